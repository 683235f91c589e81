package com.example.ample.domain.model;

import com.example.ample.domain.enumtype.MediaStatus;
import com.example.ample.domain.enumtype.MediaType;
import lombok.AllArgsConstructor;
import lombok.Data;

/**
 * One poll of the media session. Lengths and positions are in microseconds.
 */
@Data
@AllArgsConstructor
public class PlaybackSample {

    private final TrackIdentity identity;

    private final MediaStatus status;

    private final MediaType mediaType;

    private final long trackLengthUs;

    private final long positionUs;

    public boolean isPlaying() {
        return status == MediaStatus.PLAYING;
    }
}
