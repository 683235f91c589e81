package com.example.ample.domain.model;

import lombok.Data;

@Data
public class ArtworkUpdate {

    private final TrackIdentity track;

    private final String url;
}
