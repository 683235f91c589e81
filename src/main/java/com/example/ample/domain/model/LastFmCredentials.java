package com.example.ample.domain.model;

import lombok.Getter;

/**
 * Credentials every authenticated LastFM call needs. Immutable once resolved.
 */
@Getter
public class LastFmCredentials {

    private final String apiKey;

    private final String apiSecret;

    private final String username;

    private final String sessionToken;

    public LastFmCredentials(String apiKey, String apiSecret, String username, String sessionToken) {
        this.apiKey = apiKey;
        this.apiSecret = apiSecret;
        this.username = username;
        this.sessionToken = sessionToken;
    }

    @Override
    public String toString() {
        return "LastFmCredentials(username=" + username + ", apiKey=" + mask(apiKey) + ")";
    }

    private static String mask(String value) {
        if (value == null || value.length() <= 4) {
            return "****";
        }
        return value.substring(0, 4) + "****";
    }
}
