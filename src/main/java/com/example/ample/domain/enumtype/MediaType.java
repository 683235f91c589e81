package com.example.ample.domain.enumtype;

public enum MediaType {
    UNKNOWN,
    MUSIC,
    VIDEO,
    IMAGE
}
