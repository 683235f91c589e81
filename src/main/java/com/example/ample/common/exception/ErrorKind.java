package com.example.ample.common.exception;

public enum ErrorKind {

    /**
     * Missing environment variable or secret entry, or a broken secret store. Disables scrobbling.
     */
    CONFIGURATION,

    /**
     * Connection failure, timeout or HTTP 5xx. Retried only during session bootstrap.
     */
    RETRYABLE,

    /**
     * Malformed JSON, unexpected response shape or an unexpected status class.
     */
    PROTOCOL,

    /**
     * HTTP 4xx or a LastFM error body.
     */
    REJECTED
}
