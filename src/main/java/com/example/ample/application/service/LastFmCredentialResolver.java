package com.example.ample.application.service;

import com.example.ample.common.exception.ErrorKind;
import com.example.ample.common.exception.ScrobblerException;
import com.example.ample.domain.model.LastFmCredentials;
import com.example.ample.infrastructure.lastfm.LastFmSessionClient;
import com.example.ample.infrastructure.secret.SecretStore;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Assembles {@link LastFmCredentials} from the environment and the secret store, obtaining and
 * caching a session key on first use.
 */
@Service
public class LastFmCredentialResolver {

    private static final Logger log = LoggerFactory.getLogger(LastFmCredentialResolver.class);

    public static final String ENV_API_KEY = "AMPLE_API_KEY";
    public static final String ENV_USERNAME = "AMPLE_USERNAME";
    public static final String ENV_PASSWORD = "AMPLE_FM_PASSWORD";
    public static final String ENV_API_SECRET = "AMPLE_FM_SECRET";

    static final String CODE_ENV_MISSING = "LASTFM_ENV_MISSING";
    static final String CODE_PASSWORD_MISSING = "LASTFM_PASSWORD_MISSING";
    static final String CODE_API_SECRET_MISSING = "LASTFM_API_SECRET_MISSING";
    static final String CODE_RETRY_EXHAUSTED = "LASTFM_RETRY_EXHAUSTED";

    private final Environment environment;
    private final SecretStore secretStore;
    private final LastFmSessionClient sessionClient;
    private final Backoff backoff;

    @Autowired
    public LastFmCredentialResolver(Environment environment,
                                    SecretStore secretStore,
                                    LastFmSessionClient sessionClient) {
        this(environment, secretStore, sessionClient, Thread::sleep);
    }

    LastFmCredentialResolver(Environment environment,
                             SecretStore secretStore,
                             LastFmSessionClient sessionClient,
                             Backoff backoff) {
        this.environment = environment;
        this.secretStore = secretStore;
        this.sessionClient = sessionClient;
        this.backoff = backoff;
    }

    /**
     * Resolves credentials, retrying retryable failures up to {@code attempts} times in total with
     * {@code backoffMs} between attempts. Non-retryable failures propagate immediately.
     */
    public LastFmCredentials resolve(int attempts, long backoffMs) {
        int maxAttempts = Math.max(1, attempts);
        ScrobblerException last = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return resolveOnce();
            } catch (ScrobblerException e) {
                if (!e.isRetryable()) {
                    throw e;
                }
                last = e;
                log.warn("LastFM bootstrap attempt failed, attempt={}/{}, code={}, msg={}",
                        attempt, maxAttempts, e.getCode(), e.getMessage());
            }
            if (attempt < maxAttempts) {
                pause(backoffMs);
            }
        }
        throw new ScrobblerException(ErrorKind.RETRYABLE, CODE_RETRY_EXHAUSTED,
                "LastFM bootstrap gave up after " + maxAttempts + " attempts", last);
    }

    LastFmCredentials resolveOnce() {
        String apiKey = environment.getProperty(ENV_API_KEY);
        String username = environment.getProperty(ENV_USERNAME);
        if (!StringUtils.hasText(apiKey) || !StringUtils.hasText(username)) {
            throw new ScrobblerException(ErrorKind.CONFIGURATION, CODE_ENV_MISSING,
                    ENV_API_KEY + " and " + ENV_USERNAME + " must both be set",
                    "Export them or add them to .env", null);
        }

        String password = lookup(SecretStore.PASSWORD_ENTRY, ENV_PASSWORD);
        if (password == null) {
            throw new ScrobblerException(ErrorKind.CONFIGURATION, CODE_PASSWORD_MISSING,
                    "No LastFM password stored",
                    "Run with --password to store it, or set " + ENV_PASSWORD, null);
        }
        String apiSecret = lookup(SecretStore.API_SECRET_ENTRY, ENV_API_SECRET);
        if (apiSecret == null) {
            throw new ScrobblerException(ErrorKind.CONFIGURATION, CODE_API_SECRET_MISSING,
                    "No LastFM API secret stored",
                    "Run with --secret to store it, or set " + ENV_API_SECRET, null);
        }

        Optional<String> cachedSession = secretStore.get(SecretStore.SESSION_ENTRY)
                .filter(StringUtils::hasText);
        if (cachedSession.isPresent()) {
            log.debug("Using cached LastFM session, username={}", username);
            return new LastFmCredentials(apiKey, apiSecret, username, cachedSession.get());
        }

        String sessionKey = sessionClient.requestMobileSession(apiKey, apiSecret, username, password);
        secretStore.set(SecretStore.SESSION_ENTRY, sessionKey);
        log.info("LastFM session obtained and cached, username={}", username);
        return new LastFmCredentials(apiKey, apiSecret, username, sessionKey);
    }

    private String lookup(String entryName, String fallbackEnv) {
        Optional<String> stored = secretStore.get(entryName).filter(StringUtils::hasText);
        if (stored.isPresent()) {
            return stored.get();
        }
        String fromEnv = environment.getProperty(fallbackEnv);
        return StringUtils.hasText(fromEnv) ? fromEnv : null;
    }

    private void pause(long backoffMs) {
        if (backoffMs <= 0) {
            return;
        }
        try {
            backoff.sleep(backoffMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ScrobblerException(ErrorKind.RETRYABLE, CODE_RETRY_EXHAUSTED,
                    "LastFM bootstrap interrupted", e);
        }
    }

    @FunctionalInterface
    interface Backoff {

        void sleep(long millis) throws InterruptedException;
    }
}
