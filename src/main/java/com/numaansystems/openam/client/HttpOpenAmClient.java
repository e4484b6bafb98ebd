package com.numaansystems.openam.client;

import com.numaansystems.openam.exception.InternalOpenAmException;
import jakarta.annotation.PreDestroy;
import org.apache.hc.client5.http.async.methods.SimpleHttpRequest;
import org.apache.hc.client5.http.async.methods.SimpleHttpResponse;
import org.apache.hc.client5.http.async.methods.SimpleRequestBuilder;
import org.apache.hc.client5.http.config.ConnectionConfig;
import org.apache.hc.client5.http.config.RequestConfig;
import org.apache.hc.client5.http.impl.async.CloseableHttpAsyncClient;
import org.apache.hc.client5.http.impl.async.HttpAsyncClients;
import org.apache.hc.client5.http.impl.nio.PoolingAsyncClientConnectionManager;
import org.apache.hc.client5.http.impl.nio.PoolingAsyncClientConnectionManagerBuilder;
import org.apache.hc.core5.concurrent.FutureCallback;
import org.apache.hc.core5.http.ContentType;
import org.apache.hc.core5.io.CloseMode;
import org.apache.hc.core5.util.Timeout;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * {@link OpenAmClient} backed by the OpenAM legacy identity REST API.
 *
 * <h2>Endpoints</h2>
 * <ul>
 *   <li>{@code POST identity/isTokenValid} - answers {@code boolean=true|false}</li>
 *   <li>{@code POST identity/attributes} - answers the {@code userdetails.*} line format</li>
 *   <li>{@code UI/Login}, {@code UI/Logout} - interactive pages the browser is sent to</li>
 * </ul>
 *
 * <p>Uses a shared non-blocking Apache HttpClient whose pool wait, connect
 * and response timeouts are all bounded, so a hung or saturated OpenAM
 * server surfaces as an {@link InternalOpenAmException} instead of a
 * suspended request.</p>
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
public class HttpOpenAmClient implements OpenAmClient {

    private static final Logger logger = LoggerFactory.getLogger(HttpOpenAmClient.class);

    static final String TOKEN_ID_PREFIX = "userdetails.token.id=";
    static final String ATTRIBUTE_NAME_PREFIX = "userdetails.attribute.name=";
    static final String ATTRIBUTE_VALUE_PREFIX = "userdetails.attribute.value=";
    static final String VALID_TOKEN_BODY = "boolean=true";

    private static final String ROOT_REALM = "/";

    private final String baseUrl;
    private final String realm;
    private final CloseableHttpAsyncClient httpClient;

    /**
     * Creates the client with default pool limits and starts its I/O reactor.
     *
     * @param baseUrl OpenAM deployment URL, e.g. {@code https://sso.example.com/openam/}
     * @param realm realm tokens are validated under
     * @param connectTimeout maximum time to establish a connection
     * @param responseTimeout maximum time to wait for a response
     */
    public HttpOpenAmClient(String baseUrl, String realm, Duration connectTimeout, Duration responseTimeout) {
        this(baseUrl, realm, ConnectionSettings.builder()
                .connectTimeout(connectTimeout)
                .responseTimeout(responseTimeout)
                .build());
    }

    /**
     * Creates the client and starts its I/O reactor.
     *
     * @param baseUrl OpenAM deployment URL, e.g. {@code https://sso.example.com/openam/}
     * @param realm realm tokens are validated under
     * @param settings timeouts and connection pool limits
     */
    public HttpOpenAmClient(String baseUrl, String realm, ConnectionSettings settings) {
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl : baseUrl + "/";
        this.realm = realm;

        PoolingAsyncClientConnectionManager connectionManager = PoolingAsyncClientConnectionManagerBuilder.create()
                .setMaxConnTotal(settings.getMaxConnections())
                .setMaxConnPerRoute(settings.getMaxConnectionsPerRoute())
                .setDefaultConnectionConfig(ConnectionConfig.custom()
                        .setConnectTimeout(toTimeout(settings.getConnectTimeout()))
                        .build())
                .build();

        this.httpClient = HttpAsyncClients.custom()
                .setConnectionManager(connectionManager)
                .setDefaultRequestConfig(RequestConfig.custom()
                        .setConnectionRequestTimeout(toTimeout(settings.getConnectionRequestTimeout()))
                        .setResponseTimeout(toTimeout(settings.getResponseTimeout()))
                        .build())
                .build();
        this.httpClient.start();

        logger.info("HttpOpenAmClient initialized for {} (realm {}, {})", this.baseUrl, realm, settings);
    }

    /**
     * Shuts the I/O reactor down when the bean is destroyed.
     */
    @PreDestroy
    public void destroy() {
        httpClient.close(CloseMode.GRACEFUL);
        logger.info("OpenAM HTTP client closed");
    }

    @Override
    public CompletableFuture<Boolean> isTokenValid(String token) {
        Map<String, String> form = new LinkedHashMap<>();
        form.put("tokenid", token);
        addRealm(form);

        return post("identity/isTokenValid", form).thenApply(response -> {
            if (response.getCode() / 100 != 2) {
                logger.warn("isTokenValid answered HTTP {} for token {}", response.getCode(), abbreviate(token));
                return false;
            }
            String body = response.getBodyText() == null ? "" : response.getBodyText().trim();
            boolean valid = VALID_TOKEN_BODY.equalsIgnoreCase(body);
            logger.debug("Token {} valid: {}", abbreviate(token), valid);
            return valid;
        });
    }

    @Override
    public CompletableFuture<Map<String, String>> getAttributes(String token) {
        Map<String, String> form = new LinkedHashMap<>();
        form.put("subjectid", token);
        addRealm(form);

        return post("identity/attributes", form).thenApply(response -> {
            if (response.getCode() / 100 != 2) {
                throw new InternalOpenAmException("OpenAM attributes endpoint answered HTTP " + response.getCode());
            }
            Map<String, String> attributes = parseAttributes(response.getBodyText());
            logger.debug("Fetched {} attributes for token {}", attributes.size(), abbreviate(token));
            return attributes;
        });
    }

    @Override
    public String getLoginUiUrl(Map<String, String> params) {
        return buildUiUrl("UI/Login", params);
    }

    @Override
    public String getLogoutUiUrl(Map<String, String> params) {
        return buildUiUrl("UI/Logout", params);
    }

    /**
     * Parses the {@code userdetails} line format into a flat map.
     *
     * <p>The token id is stored under {@code tokenid}. Multi-valued
     * attributes keep their first value.</p>
     */
    static Map<String, String> parseAttributes(String body) {
        Map<String, String> attributes = new LinkedHashMap<>();
        if (body == null) {
            return attributes;
        }

        String currentName = null;
        for (String rawLine : body.split("\\r?\\n")) {
            String line = rawLine.trim();
            if (line.startsWith(TOKEN_ID_PREFIX)) {
                attributes.put("tokenid", line.substring(TOKEN_ID_PREFIX.length()));
            } else if (line.startsWith(ATTRIBUTE_NAME_PREFIX)) {
                currentName = line.substring(ATTRIBUTE_NAME_PREFIX.length());
            } else if (line.startsWith(ATTRIBUTE_VALUE_PREFIX) && currentName != null) {
                attributes.putIfAbsent(currentName, line.substring(ATTRIBUTE_VALUE_PREFIX.length()));
            }
        }
        return attributes;
    }

    private CompletableFuture<SimpleHttpResponse> post(String path, Map<String, String> form) {
        String uri = baseUrl + path;
        SimpleHttpRequest request = SimpleRequestBuilder.post(uri)
                .setBody(encode(form), ContentType.APPLICATION_FORM_URLENCODED)
                .build();

        CompletableFuture<SimpleHttpResponse> future = new CompletableFuture<>();
        httpClient.execute(request, new FutureCallback<SimpleHttpResponse>() {
            @Override
            public void completed(SimpleHttpResponse response) {
                future.complete(response);
            }

            @Override
            public void failed(Exception ex) {
                logger.error("OpenAM request to {} failed", uri, ex);
                future.completeExceptionally(new InternalOpenAmException("OpenAM request to " + path + " failed", ex));
            }

            @Override
            public void cancelled() {
                logger.warn("OpenAM request to {} was cancelled", uri);
                future.completeExceptionally(new InternalOpenAmException("OpenAM request to " + path + " was cancelled"));
            }
        });
        return future;
    }

    private String buildUiUrl(String page, Map<String, String> params) {
        Map<String, String> query = new LinkedHashMap<>();
        addRealm(query);
        if (params != null) {
            query.putAll(params);
        }

        String encoded = encode(query);
        return encoded.isEmpty() ? baseUrl + page : baseUrl + page + "?" + encoded;
    }

    private void addRealm(Map<String, String> params) {
        if (realm != null && !realm.isEmpty() && !ROOT_REALM.equals(realm)) {
            params.put("realm", realm);
        }
    }

    private static String encode(Map<String, String> params) {
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<String, String> entry : params.entrySet()) {
            if (sb.length() > 0) {
                sb.append('&');
            }
            sb.append(URLEncoder.encode(entry.getKey(), StandardCharsets.UTF_8))
              .append('=')
              .append(URLEncoder.encode(entry.getValue() == null ? "" : entry.getValue(), StandardCharsets.UTF_8));
        }
        return sb.toString();
    }

    private static Timeout toTimeout(Duration duration) {
        return Timeout.ofMilliseconds(duration.toMillis());
    }

    private static String abbreviate(String token) {
        if (token == null) {
            return "null";
        }
        return token.length() <= 8 ? "***" : token.substring(0, 8) + "...";
    }

    /**
     * Timeouts and pool limits of the OpenAM connection pool.
     *
     * <p>A provider call is bounded by the connection request timeout (waiting
     * for a pooled connection), the connect timeout and the response timeout.</p>
     */
    public static final class ConnectionSettings {

        static final Duration DEFAULT_CONNECT_TIMEOUT = Duration.ofSeconds(5);
        static final Duration DEFAULT_RESPONSE_TIMEOUT = Duration.ofSeconds(10);
        static final Duration DEFAULT_CONNECTION_REQUEST_TIMEOUT = Duration.ofSeconds(5);
        static final int DEFAULT_MAX_CONNECTIONS = 50;
        static final int DEFAULT_MAX_CONNECTIONS_PER_ROUTE = 20;

        private final Duration connectTimeout;
        private final Duration responseTimeout;
        private final Duration connectionRequestTimeout;
        private final int maxConnections;
        private final int maxConnectionsPerRoute;

        private ConnectionSettings(Builder builder) {
            this.connectTimeout = builder.connectTimeout;
            this.responseTimeout = builder.responseTimeout;
            this.connectionRequestTimeout = builder.connectionRequestTimeout;
            this.maxConnections = builder.maxConnections;
            this.maxConnectionsPerRoute = builder.maxConnectionsPerRoute;
        }

        public static Builder builder() {
            return new Builder();
        }

        public Duration getConnectTimeout() {
            return connectTimeout;
        }

        public Duration getResponseTimeout() {
            return responseTimeout;
        }

        public Duration getConnectionRequestTimeout() {
            return connectionRequestTimeout;
        }

        public int getMaxConnections() {
            return maxConnections;
        }

        public int getMaxConnectionsPerRoute() {
            return maxConnectionsPerRoute;
        }

        @Override
        public String toString() {
            return "connect timeout " + connectTimeout.toMillis() + "ms, response timeout "
                    + responseTimeout.toMillis() + "ms, pool wait " + connectionRequestTimeout.toMillis()
                    + "ms, max connections " + maxConnections + " (" + maxConnectionsPerRoute + " per route)";
        }

        public static final class Builder {

            private Duration connectTimeout = DEFAULT_CONNECT_TIMEOUT;
            private Duration responseTimeout = DEFAULT_RESPONSE_TIMEOUT;
            private Duration connectionRequestTimeout = DEFAULT_CONNECTION_REQUEST_TIMEOUT;
            private int maxConnections = DEFAULT_MAX_CONNECTIONS;
            private int maxConnectionsPerRoute = DEFAULT_MAX_CONNECTIONS_PER_ROUTE;

            private Builder() {
            }

            public Builder connectTimeout(Duration connectTimeout) {
                this.connectTimeout = connectTimeout;
                return this;
            }

            public Builder responseTimeout(Duration responseTimeout) {
                this.responseTimeout = responseTimeout;
                return this;
            }

            public Builder connectionRequestTimeout(Duration connectionRequestTimeout) {
                this.connectionRequestTimeout = connectionRequestTimeout;
                return this;
            }

            public Builder maxConnections(int maxConnections) {
                this.maxConnections = maxConnections;
                return this;
            }

            public Builder maxConnectionsPerRoute(int maxConnectionsPerRoute) {
                this.maxConnectionsPerRoute = maxConnectionsPerRoute;
                return this;
            }

            /**
             * @throws IllegalArgumentException if a timeout is missing or a pool limit is not positive
             */
            public ConnectionSettings build() {
                if (connectTimeout == null || responseTimeout == null || connectionRequestTimeout == null) {
                    throw new IllegalArgumentException("OpenAM client timeouts are required");
                }
                if (maxConnections < 1 || maxConnectionsPerRoute < 1) {
                    throw new IllegalArgumentException("OpenAM connection pool limits must be positive");
                }
                return new ConnectionSettings(this);
            }
        }
    }
}
