package com.example.ample.application.service;

import com.example.ample.common.exception.ScrobblerException;
import com.example.ample.domain.enumtype.ActionType;
import com.example.ample.domain.model.ArtworkUpdate;
import com.example.ample.domain.model.ScrobbleAction;
import com.example.ample.domain.model.TrackIdentity;
import com.example.ample.domain.model.TrackInfo;
import com.example.ample.infrastructure.lastfm.LastFmClient;
import io.micrometer.core.instrument.MeterRegistry;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Queue;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;

/**
 * Runs LastFM side effects off the polling thread.
 * <p>
 * Actions are executed in submission order on the supplied executor. Failures are logged and
 * dropped; nothing is retried. Resolved artwork is queued and handed back to the polling loop via
 * {@link #drainResolvedArtwork()}, so the loop stays the only writer of its state.
 * <p>
 * Without a client (LastFM not configured) every submission is discarded.
 */
public class ScrobbleDispatcher {

    private static final Logger log = LoggerFactory.getLogger(ScrobbleDispatcher.class);

    static final String METRIC_DISPATCH = "ample.lastfm.dispatch";
    static final String METRIC_LATENCY = "ample.lastfm.dispatch.latency";

    private final Executor executor;
    private final LastFmClient client;
    private final MeterRegistry meterRegistry;
    private final Queue<ArtworkUpdate> resolvedArtwork = new ConcurrentLinkedQueue<>();

    public ScrobbleDispatcher(Executor executor,
                              LastFmClient client,
                              ObjectProvider<MeterRegistry> meterRegistryProvider) {
        this.executor = executor;
        this.client = client;
        this.meterRegistry = meterRegistryProvider.getIfAvailable();
    }

    public boolean isEnabled() {
        return client != null;
    }

    /**
     * Queues {@code action} and returns immediately.
     */
    public void submit(ScrobbleAction action) {
        if (!isEnabled()) {
            log.debug("LastFM disabled, dropping action, type={}", action.getType());
            return;
        }
        try {
            executor.execute(() -> handle(action));
        } catch (RejectedExecutionException e) {
            recordCounter(action.getType(), "rejected");
            log.warn("LastFM action rejected by executor, type={}, track={}",
                    action.getType(), describe(action.getTrack()));
        }
    }

    /**
     * Returns and removes the artwork resolved since the previous call, oldest first.
     */
    public List<ArtworkUpdate> drainResolvedArtwork() {
        List<ArtworkUpdate> drained = new ArrayList<>();
        ArtworkUpdate update;
        while ((update = resolvedArtwork.poll()) != null) {
            drained.add(update);
        }
        return drained;
    }

    void handle(ScrobbleAction action) {
        TrackIdentity track = action.getTrack();
        long startedAtNanos = System.nanoTime();
        try {
            switch (action.getType()) {
                case NOW_PLAYING:
                    client.nowPlaying(track.getArtistName(), track.getSongName(), track.getAlbumName());
                    log.debug("Now playing sent, track={}", describe(track));
                    break;
                case FETCH_ARTWORK:
                    fetchArtwork(track);
                    break;
                case SCROBBLE:
                    client.scrobble(track.getArtistName(), track.getSongName(), action.getStartedAt(),
                            track.getAlbumName());
                    log.info("Scrobbled, track={}, startedAt={}", describe(track), action.getStartedAt());
                    break;
                default:
                    log.warn("Unknown LastFM action, type={}", action.getType());
                    return;
            }
            recordCounter(action.getType(), "success");
        } catch (ScrobblerException e) {
            recordCounter(action.getType(), "failed");
            log.warn("LastFM action failed, type={}, track={}, kind={}, code={}, msg={}",
                    action.getType(), describe(track), e.getKind(), e.getCode(), e.getMessage());
        } catch (RuntimeException e) {
            recordCounter(action.getType(), "failed");
            log.warn("LastFM action failed unexpectedly, type={}, track={}", action.getType(), describe(track), e);
        } finally {
            recordDuration(System.nanoTime() - startedAtNanos);
        }
    }

    private void fetchArtwork(TrackIdentity track) {
        TrackInfo info = client.getTrackInfo(track.getArtistName(), track.getSongName());
        String url = info.largeImageUrl();
        if (url.isEmpty()) {
            log.debug("No large artwork on LastFM, track={}", describe(track));
            return;
        }
        resolvedArtwork.add(new ArtworkUpdate(track, url));
        log.debug("Artwork resolved, track={}, url={}", describe(track), url);
    }

    private static String describe(TrackIdentity track) {
        return track.getArtistName() + " - " + track.getSongName();
    }

    private void recordCounter(ActionType type, String outcome) {
        if (meterRegistry == null) {
            return;
        }
        try {
            meterRegistry.counter(METRIC_DISPATCH,
                    "action", type.name().toLowerCase(Locale.ROOT), "outcome", outcome).increment();
        } catch (Exception ex) {
            log.debug("Dispatch metric counter failed, name={}", METRIC_DISPATCH, ex);
        }
    }

    private void recordDuration(long nanos) {
        if (meterRegistry == null || nanos <= 0) {
            return;
        }
        try {
            meterRegistry.timer(METRIC_LATENCY).record(nanos, TimeUnit.NANOSECONDS);
        } catch (Exception ex) {
            log.debug("Dispatch metric timer failed, name={}", METRIC_LATENCY, ex);
        }
    }
}
