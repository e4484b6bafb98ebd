package com.numaansystems.openam.strategy;

import jakarta.servlet.http.HttpServletRequest;

import java.net.URI;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Request helpers used by the handshake: cookie parsing and the URL the
 * browser originally requested.
 */
public final class RequestSupport {

    private RequestSupport() {
    }

    /**
     * Parses a {@code Cookie} header into name/value pairs.
     *
     * <p>Pairs are separated by {@code ;}. Names and values are trimmed, a
     * pair without {@code =} maps to an empty value. A missing header gives
     * an empty map.</p>
     */
    public static Map<String, String> parseCookies(String header) {
        if (header == null || header.isBlank()) {
            return Collections.emptyMap();
        }

        Map<String, String> cookies = new LinkedHashMap<>();
        for (String pair : header.split(";")) {
            int eq = pair.indexOf('=');
            String name = (eq < 0 ? pair : pair.substring(0, eq)).trim();
            String value = eq < 0 ? "" : pair.substring(eq + 1).trim();
            if (!name.isEmpty()) {
                cookies.put(name, value);
            }
        }
        return cookies;
    }

    /**
     * Scheme, host and path of the request as the servlet container sees it.
     *
     * <p>Client-supplied {@code X-Forwarded-*} headers are not read here.
     * Behind a trusted proxy, enable {@code server.forward-headers-strategy}
     * so the container applies them before this point.</p>
     */
    public static String originalUrl(HttpServletRequest request) {
        return request.getRequestURL().toString();
    }

    /**
     * Returns {@code url} unchanged when absolute, otherwise resolves it
     * against the original request URL.
     */
    public static String qualify(String url, HttpServletRequest request) {
        URI uri = URI.create(url);
        if (uri.isAbsolute()) {
            return url;
        }
        return URI.create(originalUrl(request)).resolve(uri).toString();
    }
}
