package com.example.ample.application.job;

import com.example.ample.application.service.ScrobbleDecisionEngine;
import com.example.ample.application.service.ScrobbleDispatcher;
import com.example.ample.domain.model.ArtworkUpdate;
import com.example.ample.domain.model.PlaybackSample;
import com.example.ample.domain.model.ScrobbleAction;
import com.example.ample.domain.model.ScrobbleDecision;
import com.example.ample.domain.model.ScrobbleState;
import com.example.ample.domain.model.StatusView;
import com.example.ample.domain.model.TrackIdentity;
import com.example.ample.infrastructure.media.MediaPollException;
import com.example.ample.infrastructure.media.MediaSessionPoller;
import com.example.ample.infrastructure.status.StatusSink;
import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import javax.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Profile;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

/**
 * The polling loop. Each tick applies artwork resolved since the last tick, samples the media
 * session, runs the decision engine and hands resulting actions to the dispatcher.
 * <p>
 * Ticks never overlap; {@link ScrobbleState} is touched from this job only.
 */
@Service
@Profile("!provision")
public class ScrobbleJob {

    private static final Logger log = LoggerFactory.getLogger(ScrobbleJob.class);

    private final MediaSessionPoller poller;
    private final ScrobbleDecisionEngine decisionEngine;
    private final ScrobbleDispatcher dispatcher;
    private final StatusSink statusSink;
    private final Clock clock;

    private final ScrobbleState state = new ScrobbleState();
    private PlaybackSample lastPlayingSample;

    @Autowired
    public ScrobbleJob(MediaSessionPoller poller,
                       ScrobbleDecisionEngine decisionEngine,
                       ScrobbleDispatcher dispatcher,
                       StatusSink statusSink) {
        this(poller, decisionEngine, dispatcher, statusSink, Clock.systemUTC());
    }

    ScrobbleJob(MediaSessionPoller poller,
                ScrobbleDecisionEngine decisionEngine,
                ScrobbleDispatcher dispatcher,
                StatusSink statusSink,
                Clock clock) {
        this.poller = poller;
        this.decisionEngine = decisionEngine;
        this.dispatcher = dispatcher;
        this.statusSink = statusSink;
        this.clock = clock;
    }

    @Scheduled(fixedDelayString = "${app.scrobbler.tick-ms:5000}")
    public void run() {
        try {
            tick();
        } catch (Exception e) {
            log.warn("Scrobble tick failed unexpectedly", e);
        }
    }

    void tick() {
        applyResolvedArtwork();

        Optional<PlaybackSample> polled;
        try {
            polled = poller.poll();
        } catch (MediaPollException e) {
            log.warn("Media session poll failed, msg={}", e.getMessage());
            return;
        }
        if (!polled.isPresent()) {
            log.debug("No media session");
        }

        Instant now = clock.instant();
        PlaybackSample sample = polled.orElse(null);
        ScrobbleDecision decision = decisionEngine.onSample(state, sample, now);
        if (!decision.isPlaying()) {
            lastPlayingSample = null;
            statusSink.clear();
            return;
        }

        lastPlayingSample = sample;
        if (decision.isNewTrack()) {
            TrackIdentity track = sample.getIdentity();
            log.info("Now playing, player={}, artist={}, song={}, album={}",
                    track.getPlayerName(), track.getArtistName(), track.getSongName(), track.getAlbumName());
        }
        if (dispatcher.isEnabled()) {
            for (ScrobbleAction action : decision.getActions()) {
                dispatcher.submit(action);
            }
        }
        statusSink.show(StatusView.of(sample, state.getArtworkUrl(), now));
    }

    private void applyResolvedArtwork() {
        for (ArtworkUpdate update : dispatcher.drainResolvedArtwork()) {
            boolean applied = decisionEngine.applyArtwork(state, update.getTrack(), update.getUrl());
            if (!applied) {
                log.debug("Stale artwork discarded, song={}", update.getTrack().getSongName());
                continue;
            }
            if (lastPlayingSample != null) {
                statusSink.show(StatusView.of(lastPlayingSample, state.getArtworkUrl(), clock.instant()));
            }
        }
    }

    ScrobbleState getState() {
        return state;
    }

    @PreDestroy
    public void shutdown() {
        statusSink.clear();
    }
}
