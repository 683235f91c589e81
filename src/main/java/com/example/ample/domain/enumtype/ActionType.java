package com.example.ample.domain.enumtype;

public enum ActionType {
    NOW_PLAYING,
    FETCH_ARTWORK,
    SCROBBLE
}
