package com.example.ample.domain.model;

import com.example.ample.domain.enumtype.ActionType;
import java.time.Instant;
import lombok.Data;

@Data
public class ScrobbleAction {

    private final ActionType type;

    private final TrackIdentity track;

    /**
     * Start of the occupancy being scrobbled; null for the other action types.
     */
    private final Instant startedAt;

    public static ScrobbleAction nowPlaying(TrackIdentity track) {
        return new ScrobbleAction(ActionType.NOW_PLAYING, track, null);
    }

    public static ScrobbleAction fetchArtwork(TrackIdentity track) {
        return new ScrobbleAction(ActionType.FETCH_ARTWORK, track, null);
    }

    public static ScrobbleAction scrobble(TrackIdentity track, Instant startedAt) {
        return new ScrobbleAction(ActionType.SCROBBLE, track, startedAt);
    }
}
