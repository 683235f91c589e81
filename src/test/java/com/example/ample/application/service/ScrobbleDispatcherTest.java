package com.example.ample.application.service;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.example.ample.common.config.TaskExecutionConfig;
import com.example.ample.common.exception.ErrorKind;
import com.example.ample.common.exception.ScrobblerException;
import com.example.ample.domain.model.ArtworkUpdate;
import com.example.ample.domain.model.ScrobbleAction;
import com.example.ample.domain.model.TrackIdentity;
import com.example.ample.domain.model.TrackInfo;
import com.example.ample.infrastructure.lastfm.LastFmClient;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.support.StaticListableBeanFactory;

class ScrobbleDispatcherTest {

    private static final TrackIdentity SONG = new TrackIdentity("spotify", "Artist", "Song", "Album");
    private static final Instant STARTED = Instant.ofEpochSecond(1_700_000_000L);

    private LastFmClient client;
    private SimpleMeterRegistry meterRegistry;
    private ScrobbleDispatcher dispatcher;

    @BeforeEach
    void setUp() {
        client = mock(LastFmClient.class);
        meterRegistry = new SimpleMeterRegistry();
        dispatcher = new ScrobbleDispatcher(Runnable::run, client, beanProvider(meterRegistry));
    }

    @Test
    void submitShouldCallClientInOrder() {
        when(client.getTrackInfo("Artist", "Song")).thenReturn(trackInfo(""));

        dispatcher.submit(ScrobbleAction.nowPlaying(SONG));
        dispatcher.submit(ScrobbleAction.fetchArtwork(SONG));
        dispatcher.submit(ScrobbleAction.scrobble(SONG, STARTED));

        InOrder order = inOrder(client);
        order.verify(client).nowPlaying("Artist", "Song", "Album");
        order.verify(client).getTrackInfo("Artist", "Song");
        order.verify(client).scrobble("Artist", "Song", STARTED, "Album");
        assertEquals(1.0, meterRegistry.counter(ScrobbleDispatcher.METRIC_DISPATCH,
                "action", "scrobble", "outcome", "success").count());
    }

    @Test
    void fetchArtworkShouldQueueLargeImageForTheLoop() {
        when(client.getTrackInfo("Artist", "Song")).thenReturn(trackInfo("https://img/l.png"));

        dispatcher.submit(ScrobbleAction.fetchArtwork(SONG));

        List<ArtworkUpdate> drained = dispatcher.drainResolvedArtwork();
        assertEquals(Collections.singletonList(new ArtworkUpdate(SONG, "https://img/l.png")), drained);
        assertTrue(dispatcher.drainResolvedArtwork().isEmpty());
    }

    @Test
    void fetchArtworkWithoutLargeImageShouldQueueNothing() {
        when(client.getTrackInfo("Artist", "Song")).thenReturn(trackInfo(""));

        dispatcher.submit(ScrobbleAction.fetchArtwork(SONG));

        assertTrue(dispatcher.drainResolvedArtwork().isEmpty());
    }

    @Test
    void failuresShouldBeLoggedAndDropped() {
        doThrow(new ScrobblerException(ErrorKind.RETRYABLE, "LASTFM_TRANSPORT", "timeout"))
                .when(client).nowPlaying(anyString(), anyString(), anyString());
        doThrow(new IllegalStateException("boom"))
                .when(client).scrobble(anyString(), anyString(), any(Instant.class), anyString());

        dispatcher.submit(ScrobbleAction.nowPlaying(SONG));
        dispatcher.submit(ScrobbleAction.scrobble(SONG, STARTED));
        dispatcher.submit(ScrobbleAction.nowPlaying(SONG));

        verify(client, times(2)).nowPlaying("Artist", "Song", "Album");
        assertEquals(2.0, meterRegistry.counter(ScrobbleDispatcher.METRIC_DISPATCH,
                "action", "now_playing", "outcome", "failed").count());
        assertEquals(1.0, meterRegistry.counter(ScrobbleDispatcher.METRIC_DISPATCH,
                "action", "scrobble", "outcome", "failed").count());
    }

    @Test
    void disabledDispatcherShouldDropEverything() {
        Executor executor = mock(Executor.class);
        ScrobbleDispatcher disabled = new ScrobbleDispatcher(executor, null, beanProvider(meterRegistry));

        disabled.submit(ScrobbleAction.nowPlaying(SONG));

        assertFalse(disabled.isEnabled());
        verify(executor, never()).execute(any(Runnable.class));
    }

    @Test
    void rejectedSubmissionShouldNotPropagate() {
        Executor saturated = command -> {
            throw new RejectedExecutionException("shut down");
        };
        ScrobbleDispatcher closing = new ScrobbleDispatcher(saturated, client, beanProvider(meterRegistry));

        closing.submit(ScrobbleAction.scrobble(SONG, STARTED));

        assertEquals(1.0, meterRegistry.counter(ScrobbleDispatcher.METRIC_DISPATCH,
                "action", "scrobble", "outcome", "rejected").count());
    }

    @Test
    void missingMeterRegistryShouldBeTolerated() {
        ScrobbleDispatcher unmetered = new ScrobbleDispatcher(Runnable::run, client,
                new StaticListableBeanFactory().getBeanProvider(MeterRegistry.class));

        unmetered.submit(ScrobbleAction.nowPlaying(SONG));

        verify(client).nowPlaying("Artist", "Song", "Album");
    }

    @Test
    void submitShouldReturnBeforeWorkerFinishesAndKeepOrder() throws Exception {
        ExecutorService executor = new TaskExecutionConfig().lastFmDispatchExecutor();
        try {
            CountDownLatch release = new CountDownLatch(1);
            CountDownLatch scrobbled = new CountDownLatch(1);
            List<String> calls = new CopyOnWriteArrayList<>();
            List<String> threads = new CopyOnWriteArrayList<>();
            doAnswer(invocation -> {
                threads.add(Thread.currentThread().getName());
                release.await(5, TimeUnit.SECONDS);
                calls.add("nowPlaying");
                return null;
            }).when(client).nowPlaying("Artist", "Song", "Album");
            when(client.getTrackInfo("Artist", "Song")).thenAnswer(invocation -> {
                threads.add(Thread.currentThread().getName());
                calls.add("getTrackInfo");
                return trackInfo("");
            });
            doAnswer(invocation -> {
                threads.add(Thread.currentThread().getName());
                calls.add("scrobble");
                scrobbled.countDown();
                return null;
            }).when(client).scrobble("Artist", "Song", STARTED, "Album");
            ScrobbleDispatcher async = new ScrobbleDispatcher(executor, client, beanProvider(meterRegistry));

            async.submit(ScrobbleAction.nowPlaying(SONG));
            async.submit(ScrobbleAction.fetchArtwork(SONG));
            async.submit(ScrobbleAction.scrobble(SONG, STARTED));

            assertTrue(calls.isEmpty());
            release.countDown();
            assertTrue(scrobbled.await(5, TimeUnit.SECONDS));
            assertEquals(Arrays.asList("nowPlaying", "getTrackInfo", "scrobble"), calls);
            String caller = Thread.currentThread().getName();
            for (String thread : threads) {
                assertTrue(thread.startsWith("lastfm-dispatch-"), thread);
                assertNotEquals(caller, thread);
            }
        } finally {
            executor.shutdownNow();
        }
    }

    private static TrackInfo trackInfo(String largeUrl) {
        return new TrackInfo("Song", "Artist", "Artist", "Album", Arrays.asList(
                new TrackInfo.Image("small", "https://img/s.png"),
                new TrackInfo.Image("large", largeUrl)));
    }

    private ObjectProvider<MeterRegistry> beanProvider(MeterRegistry registry) {
        StaticListableBeanFactory beanFactory = new StaticListableBeanFactory();
        beanFactory.addBean("meterRegistry", registry);
        return beanFactory.getBeanProvider(MeterRegistry.class);
    }
}
