package com.example.ample.domain.enumtype;

public enum MediaStatus {
    CLOSED,
    OPENED,
    CHANGING,
    STOPPED,
    PLAYING,
    PAUSED
}
