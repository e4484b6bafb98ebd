package com.numaansystems.openam.profile;

import java.io.Serializable;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Normalized identity record built from OpenAM user attributes.
 *
 * <p>Instances are immutable. The complete attribute map returned by
 * OpenAM is kept in {@link #getRawAttributes()} for application-specific
 * needs (group membership, custom LDAP attributes and so on).</p>
 *
 * @author Numaan Systems
 * @version 0.1.0
 */
public final class OpenAmProfile implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String id;
    private final String username;
    private final String displayName;
    private final Name name;
    private final String email;
    private final Map<String, String> rawAttributes;

    public OpenAmProfile(String id, String username, String displayName, Name name,
                         String email, Map<String, String> rawAttributes) {
        this.id = id;
        this.username = username;
        this.displayName = displayName;
        this.name = name;
        this.email = email;
        this.rawAttributes = rawAttributes == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(rawAttributes));
    }

    /** The OpenAM session token id ({@code tokenid}). */
    public String getId() {
        return id;
    }

    /** The user id ({@code uid}). */
    public String getUsername() {
        return username;
    }

    /** The common name ({@code cn}). */
    public String getDisplayName() {
        return displayName;
    }

    public Name getName() {
        return name;
    }

    /** The mail address ({@code mail}). */
    public String getEmail() {
        return email;
    }

    public Map<String, String> getRawAttributes() {
        return rawAttributes;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof OpenAmProfile other)) {
            return false;
        }
        return Objects.equals(id, other.id)
                && Objects.equals(username, other.username)
                && Objects.equals(displayName, other.displayName)
                && Objects.equals(name, other.name)
                && Objects.equals(email, other.email)
                && rawAttributes.equals(other.rawAttributes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id, username, displayName, name, email, rawAttributes);
    }

    @Override
    public String toString() {
        return "OpenAmProfile{username='" + username + "', displayName='" + displayName
                + "', email='" + email + "'}";
    }

    /**
     * Family and given name of the user ({@code sn} and {@code givenname}).
     */
    public static final class Name implements Serializable {

        private static final long serialVersionUID = 1L;

        private final String familyName;
        private final String givenName;

        public Name(String familyName, String givenName) {
            this.familyName = familyName;
            this.givenName = givenName;
        }

        public String getFamilyName() {
            return familyName;
        }

        public String getGivenName() {
            return givenName;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) {
                return true;
            }
            if (!(o instanceof Name other)) {
                return false;
            }
            return Objects.equals(familyName, other.familyName)
                    && Objects.equals(givenName, other.givenName);
        }

        @Override
        public int hashCode() {
            return Objects.hash(familyName, givenName);
        }

        @Override
        public String toString() {
            return "Name{familyName='" + familyName + "', givenName='" + givenName + "'}";
        }
    }
}
