package com.example.ample.domain.model;

import java.time.Instant;
import lombok.Getter;
import lombok.ToString;

/**
 * Occupancy state of the track currently considered playing. Only the sampling loop touches it.
 */
@Getter
@ToString
public class ScrobbleState {

    private TrackIdentity current;

    private Instant startedAt;

    private boolean scrobbled;

    private String artworkUrl = "";

    public boolean isCurrent(TrackIdentity track) {
        return current != null && current.equals(track);
    }

    public void startOccupancy(TrackIdentity track, Instant now) {
        this.current = track;
        this.startedAt = now;
        this.scrobbled = false;
        this.artworkUrl = "";
    }

    public void markScrobbled() {
        if (current == null) {
            throw new IllegalStateException("No track occupancy to mark as scrobbled");
        }
        this.scrobbled = true;
    }

    public boolean hasArtwork() {
        return !artworkUrl.isEmpty();
    }

    public void setArtworkUrl(String artworkUrl) {
        this.artworkUrl = artworkUrl == null ? "" : artworkUrl;
    }
}
