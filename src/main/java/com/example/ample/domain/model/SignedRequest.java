package com.example.ample.domain.model;

import java.util.Collections;
import java.util.Map;
import lombok.Getter;
import lombok.ToString;

/**
 * Parameters in canonical order plus the signature computed over them. The signature is null for
 * unsigned lookups.
 */
@Getter
@ToString
public class SignedRequest {

    private final Map<String, String> params;

    private final String signature;

    public SignedRequest(Map<String, String> orderedParams, String signature) {
        this.params = Collections.unmodifiableMap(orderedParams);
        this.signature = signature;
    }

    public boolean isSigned() {
        return signature != null;
    }
}
