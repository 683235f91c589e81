package com.example.ample.infrastructure.media;

import com.example.ample.domain.model.PlaybackSample;
import java.util.Optional;

public interface MediaSessionPoller {

    /**
     * Reads the current media session once.
     *
     * @return empty when no media is open
     */
    Optional<PlaybackSample> poll() throws MediaPollException;
}
