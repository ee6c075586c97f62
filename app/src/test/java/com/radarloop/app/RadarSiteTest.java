package com.radarloop.app;

import com.radarloop.animation.AnimationSession;
import com.radarloop.animation.QueuedUiDispatcher;
import com.radarloop.animation.RecordingRenderer;
import com.radarloop.exception.ConfigurationException;
import com.radarloop.model.PlaybackState;
import com.radarloop.services.FakeRadarDataSource;
import com.radarloop.services.FrameLoader;
import com.radarloop.services.PropertiesPreferenceStore;
import org.greenrobot.eventbus.EventBus;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.function.Executable;

import java.util.Properties;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Future;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class RadarSiteTest {

    private static final long TIMEOUT_MS = 10000;

    private QueuedUiDispatcher ui;
    private AnimationSession session;
    private RadarSite radarSite;
    private Properties properties;

    @BeforeEach
    public void setUp() {
        ui = new QueuedUiDispatcher();
        properties = new Properties();
        properties.setProperty(Settings.KEY_PREF_ANIMATION_MAX_FRAMES, "2");
        properties.setProperty(Settings.KEY_PREF_ANIMATION_FRAME_INTERVAL_MS, "20");
        properties.setProperty(Settings.KEY_PREF_ANIMATION_END_HOLD_MS, "0");
        FakeRadarDataSource source = new FakeRadarDataSource().add("KTLX_20240101_120000", "KTLX_20240101_120500");
        session = new AnimationSession("KTLX", new FrameLoader(source), new RecordingRenderer(ui), ui,
                EventBus.builder().logNoSubscriberMessages(false).sendNoSubscriberEvent(false).build(),
                new PropertiesPreferenceStore(properties));
        radarSite = new RadarSite("KTLX", session, ui);
    }

    @AfterEach
    public void tearDown() {
        session.stopAndJoin();
    }

    private void awaitPlaying() throws InterruptedException {
        assertTrue(ui.pumpUntil(new BooleanSupplier() {
            @Override
            public boolean getAsBoolean() {
                return session.getState() == PlaybackState.PLAYING;
            }
        }, TIMEOUT_MS));
    }

    private void awaitDone(final Future<?> future) throws InterruptedException {
        assertTrue(ui.pumpUntil(new BooleanSupplier() {
            @Override
            public boolean getAsBoolean() {
                return future.isDone();
            }
        }, TIMEOUT_MS));
    }

    @Test
    public void animationWaitsForLoad() throws Exception {
        radarSite.setAnimationRequested(true);
        assertEquals(PlaybackState.STOPPED, session.getState());

        radarSite.load();
        assertTrue(radarSite.isLoaded());
        assertTrue(session.getState().isActive());
        awaitPlaying();
    }

    @Test
    public void loadWithoutRequestDoesNotAnimate() {
        radarSite.load();
        assertEquals(PlaybackState.STOPPED, session.getState());
    }

    @Test
    public void unloadOfIdleSiteFinishesOnUiThread() {
        radarSite.load();
        CompletableFuture<Void> unloaded = radarSite.unload();
        assertFalse(unloaded.isDone());

        ui.runPending();

        assertTrue(unloaded.isDone());
        assertFalse(radarSite.isLoaded());
    }

    @Test
    public void unloadWaitsForWorker() throws Exception {
        radarSite.load();
        radarSite.setAnimationRequested(true);
        awaitPlaying();

        final CompletableFuture<Void> unloaded = radarSite.unload();
        awaitDone(unloaded);

        assertEquals(PlaybackState.STOPPED, session.getState());
        assertFalse(radarSite.isLoaded());
        assertTrue(radarSite.isAnimationRequested());

        radarSite.load();
        assertTrue(session.getState().isActive());
    }

    @Test
    public void stopRequestEndsAnimation() throws Exception {
        radarSite.load();
        radarSite.setAnimationRequested(true);
        awaitPlaying();

        radarSite.setAnimationRequested(false);
        awaitDone(session.getStopped());
        assertEquals(PlaybackState.STOPPED, session.getState());
        assertTrue(radarSite.isLoaded());
    }

    @Test
    public void badFrameCountWithdrawsRequest() {
        properties.setProperty(Settings.KEY_PREF_ANIMATION_MAX_FRAMES, "0");
        radarSite.load();

        assertThrows(ConfigurationException.class, new Executable() {
            @Override
            public void execute() {
                radarSite.setAnimationRequested(true);
            }
        });
        assertFalse(radarSite.isAnimationRequested());
        assertEquals(PlaybackState.STOPPED, session.getState());
    }
}
