package com.example.ample.domain.model;

import java.time.Instant;
import java.util.concurrent.TimeUnit;
import lombok.Data;

/**
 * What the status display shows for the playing track. Timestamps are Unix seconds.
 */
@Data
public class StatusView {

    private final String title;

    private final String subtitle;

    private final long startEpochSecond;

    private final long endEpochSecond;

    /**
     * Empty until the artwork lookup for this track has completed.
     */
    private final String artworkUrl;

    public static StatusView of(PlaybackSample sample, String artworkUrl, Instant now) {
        TrackIdentity track = sample.getIdentity();
        long nowSec = now.getEpochSecond();
        long positionSec = TimeUnit.MICROSECONDS.toSeconds(Math.max(0L, sample.getPositionUs()));
        long remainingUs = Math.max(0L, sample.getTrackLengthUs() - sample.getPositionUs());
        long start = Math.max(0L, nowSec - positionSec);
        long end = nowSec + TimeUnit.MICROSECONDS.toSeconds(remainingUs);
        return new StatusView(
                track.getSongName(),
                track.getArtistName() + " - " + track.getAlbumName(),
                start,
                end,
                artworkUrl == null ? "" : artworkUrl);
    }
}
