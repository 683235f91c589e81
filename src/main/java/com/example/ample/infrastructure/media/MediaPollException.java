package com.example.ample.infrastructure.media;

public class MediaPollException extends Exception {

    public MediaPollException(String message) {
        super(message);
    }

    public MediaPollException(String message, Throwable cause) {
        super(message, cause);
    }
}
