package com.example.ample.application.service;

import com.example.ample.common.config.AppScrobblerProperties;
import com.example.ample.domain.model.PlaybackSample;
import com.example.ample.domain.model.ScrobbleAction;
import com.example.ample.domain.model.ScrobbleDecision;
import com.example.ample.domain.model.ScrobbleState;
import com.example.ample.domain.model.TrackIdentity;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Decides, sample by sample, when to announce "now playing" and when to scrobble.
 * <p>
 * A track is scrobbled once per occupancy, when it is longer than 30 seconds and more than half of
 * it (whole seconds, integer division) has been played. The flag is set as soon as the action is
 * emitted and is not rolled back when delivery later fails.
 * <p>
 * No I/O happens here; the caller owns {@link ScrobbleState} and supplies the current time.
 */
@Service
public class ScrobbleDecisionEngine {

    static final long MIN_SCROBBLE_LENGTH_SECONDS = 30L;

    private final String primaryPlayer;

    @Autowired
    public ScrobbleDecisionEngine(AppScrobblerProperties properties) {
        this(properties.getPrimaryPlayer());
    }

    ScrobbleDecisionEngine(String primaryPlayer) {
        this.primaryPlayer = StringUtils.hasText(primaryPlayer) ? primaryPlayer.trim() : null;
    }

    public ScrobbleDecision onSample(ScrobbleState state, PlaybackSample sample, Instant now) {
        if (sample == null || !sample.isPlaying() || !isAcceptedPlayer(sample.getIdentity())) {
            return ScrobbleDecision.idle();
        }

        TrackIdentity track = sample.getIdentity();
        List<ScrobbleAction> actions = new ArrayList<>(2);
        if (!state.isCurrent(track)) {
            state.startOccupancy(track, now);
            actions.add(ScrobbleAction.nowPlaying(track));
            actions.add(ScrobbleAction.fetchArtwork(track));
            return ScrobbleDecision.playing(true, actions);
        }

        if (isScrobbleDue(state, sample)) {
            actions.add(ScrobbleAction.scrobble(track, state.getStartedAt()));
            state.markScrobbled();
        }
        return ScrobbleDecision.playing(false, actions);
    }

    /**
     * Records artwork fetched for {@code track}. Ignored when the occupancy has moved on or artwork
     * is already set.
     *
     * @return whether the state changed
     */
    public boolean applyArtwork(ScrobbleState state, TrackIdentity track, String artworkUrl) {
        if (!StringUtils.hasText(artworkUrl) || !state.isCurrent(track) || state.hasArtwork()) {
            return false;
        }
        state.setArtworkUrl(artworkUrl);
        return true;
    }

    boolean isAcceptedPlayer(TrackIdentity track) {
        return primaryPlayer == null || primaryPlayer.equals(track.getPlayerName());
    }

    private static boolean isScrobbleDue(ScrobbleState state, PlaybackSample sample) {
        if (state.isScrobbled()) {
            return false;
        }
        long lengthSeconds = TimeUnit.MICROSECONDS.toSeconds(Math.max(0L, sample.getTrackLengthUs()));
        long elapsedSeconds = TimeUnit.MICROSECONDS.toSeconds(Math.max(0L, sample.getPositionUs()));
        return lengthSeconds > MIN_SCROBBLE_LENGTH_SECONDS && elapsedSeconds > lengthSeconds / 2;
    }
}
