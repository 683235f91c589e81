package com.example.ample.infrastructure.secret;

import java.util.Optional;

/**
 * Named secrets scoped to this application. Failures other than "not found" surface as
 * {@link com.example.ample.common.exception.ScrobblerException} with kind CONFIGURATION.
 */
public interface SecretStore {

    String PASSWORD_ENTRY = "amplePassword";
    String API_SECRET_ENTRY = "ampleSecret";
    String SESSION_ENTRY = "ampleSession";

    Optional<String> get(String entryName);

    void set(String entryName, String value);
}
