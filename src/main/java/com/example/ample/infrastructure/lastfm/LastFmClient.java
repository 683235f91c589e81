package com.example.ample.infrastructure.lastfm;

import com.example.ample.domain.model.TrackInfo;
import java.time.Instant;

/**
 * Blocking LastFM operations. Must not be called from the sampling loop.
 */
public interface LastFmClient {

    /**
     * Updates the remote "now playing" indicator. Advisory; callers do not retry.
     *
     * @param album may be null or blank, in which case it is omitted
     */
    void nowPlaying(String artist, String track, String album);

    /**
     * Submits a permanent play.
     *
     * @param startedAt when playback of the track began; sent as Unix seconds
     * @param album     may be null or blank, in which case it is omitted
     */
    void scrobble(String artist, String track, Instant startedAt, String album);

    /** Unsigned lookup; no session is needed. */
    TrackInfo getTrackInfo(String artist, String track);
}
