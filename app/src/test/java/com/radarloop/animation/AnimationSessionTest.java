package com.radarloop.animation;

import com.radarloop.app.Settings;
import com.radarloop.exception.ConfigurationException;
import com.radarloop.model.AnimationStatusEvent;
import com.radarloop.model.AppMessage;
import com.radarloop.model.LoopBoundaryEvent;
import com.radarloop.model.PlaybackState;
import com.radarloop.model.RadarScan;
import com.radarloop.model.RayTime;
import com.radarloop.model.VolumeType;
import com.radarloop.services.FakeRadarDataSource;
import com.radarloop.services.FrameLoader;
import com.radarloop.services.PropertiesPreferenceStore;
import com.radarloop.util.TemporalFileMatcher;
import org.greenrobot.eventbus.EventBus;
import org.greenrobot.eventbus.Subscribe;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.function.Executable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Properties;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class AnimationSessionTest {

    private static final String SITE = "KTLX";
    private static final String[] NAMES = {"KTLX_20240101_120000", "KTLX_20240101_120500", "KTLX_20240101_121000"};
    private static final long TIMEOUT_MS = 10000;

    /** Collects what the session publishes. Runs on the UI thread, which is the test thread. */
    public static class EventCollector {
        final List<LoopBoundaryEvent> boundaries = Collections.synchronizedList(new ArrayList<LoopBoundaryEvent>());
        final List<AppMessage> messages = Collections.synchronizedList(new ArrayList<AppMessage>());
        final List<AnimationStatusEvent> statuses = Collections.synchronizedList(new ArrayList<AnimationStatusEvent>());

        @Subscribe
        public void onEvent(LoopBoundaryEvent event) {
            boundaries.add(event);
        }

        @Subscribe
        public void onEvent(AppMessage message) {
            messages.add(message);
        }

        @Subscribe
        public void onEvent(AnimationStatusEvent event) {
            statuses.add(event);
        }
    }

    private QueuedUiDispatcher ui;
    private RecordingRenderer renderer;
    private EventCollector collector;
    private EventBus eventBus;
    private Properties properties;
    private FakeRadarDataSource source;
    private AnimationSession session;

    @BeforeEach
    public void setUp() {
        ui = new QueuedUiDispatcher();
        renderer = new RecordingRenderer(ui);
        collector = new EventCollector();
        eventBus = EventBus.builder().logNoSubscriberMessages(false).sendNoSubscriberEvent(false).build();
        eventBus.register(collector);
        properties = new Properties();
        properties.setProperty(Settings.KEY_PREF_ANIMATION_MAX_FRAMES, "3");
        properties.setProperty(Settings.KEY_PREF_ANIMATION_FRAME_INTERVAL_MS, "20");
        properties.setProperty(Settings.KEY_PREF_ANIMATION_END_HOLD_MS, "1000");
        properties.setProperty(Settings.KEY_PREF_SHUTDOWN_POLL_MS, "10");
        source = new FakeRadarDataSource().add(NAMES);
    }

    @AfterEach
    public void tearDown() {
        renderer.completeHeldSweepChanges();
        if (session != null) {
            session.stopAndJoin();
        }
    }

    private AnimationSession newSession() {
        session = new AnimationSession(SITE, new FrameLoader(source), renderer, ui, eventBus,
                new PropertiesPreferenceStore(properties));
        session.setAnchorTime(TemporalFileMatcher.parseTimestamp("KTLX_20240101_121000",
                TemporalFileMatcher.LEVEL2_TIMESTAMP_OFFSET));
        return session;
    }

    private void awaitPlaying() throws InterruptedException {
        assertTrue(ui.pumpUntil(new BooleanSupplier() {
            @Override
            public boolean getAsBoolean() {
                return session.getState() == PlaybackState.PLAYING && session.getMachine().getFrameIndex() >= 0;
            }
        }, TIMEOUT_MS), "session never started playing");
    }

    private void awaitStopped() throws InterruptedException {
        assertTrue(ui.pumpUntil(new BooleanSupplier() {
            @Override
            public boolean getAsBoolean() {
                return session.getStopped().isDone();
            }
        }, TIMEOUT_MS), "session never stopped");
    }

    private void awaitCall(final String prefix, final String suffix) throws InterruptedException {
        assertTrue(ui.pumpUntil(new BooleanSupplier() {
            @Override
            public boolean getAsBoolean() {
                synchronized (renderer.getCalls()) {
                    for (String call : renderer.getCalls()) {
                        if (call.startsWith(prefix) && call.endsWith(suffix)) {
                            return true;
                        }
                    }
                }
                return false;
            }
        }, TIMEOUT_MS), "renderer never got " + prefix + "..." + suffix);
    }

    @Test
    public void oneLapGivesOneBoundaryWithLoopRange() throws Exception {
        newSession();
        assertTrue(session.start());
        assertTrue(ui.pumpUntil(new BooleanSupplier() {
            @Override
            public boolean getAsBoolean() {
                return !collector.boundaries.isEmpty();
            }
        }, TIMEOUT_MS), "no lap completed");

        session.stopAndJoin();
        ui.runPending();

        assertEquals(1, collector.boundaries.size());
        LoopBoundaryEvent boundary = collector.boundaries.get(0);
        assertEquals(SITE, boundary.getSite());
        assertEquals(1, boundary.getLap());
        assertEquals(new RayTime(2024, 1, 1, 12, 0, 0f), boundary.getLoopStart());
        assertEquals(new RayTime(2024, 1, 1, 12, 10, 3f), boundary.getLoopFinish());
    }

    @Test
    public void stopReleasesEveryFrame() throws Exception {
        newSession();
        session.start();
        awaitPlaying();

        session.stopAndJoin();
        session.stopAndJoin();
        ui.runPending();

        assertEquals(PlaybackState.STOPPED, session.getState());
        assertTrue(session.getStopped().isDone());
        assertEquals(3, renderer.getRemoved().size());
        assertTrue(renderer.getVisible().isEmpty());
        assertEquals(0, session.getMachine().getWindow().size());
        AnimationStatusEvent last = collector.statuses.get(collector.statuses.size() - 1);
        assertEquals(PlaybackState.STOPPED, last.getState());
    }

    @Test
    public void stopWithoutStartIsHarmless() {
        newSession();
        session.stopAndJoin();
        assertEquals(PlaybackState.STOPPED, session.getState());
    }

    @Test
    public void secondStartIsRefused() throws Exception {
        newSession();
        assertTrue(session.start());
        assertFalse(session.start());
        awaitPlaying();
    }

    @Test
    public void restartAfterStop() throws Exception {
        newSession();
        session.start();
        awaitPlaying();
        session.stopAndJoin();

        assertTrue(session.start());
        awaitPlaying();
        assertEquals(3, session.getMachine().getWindow().size());
    }

    @Test
    public void frameCountMustBePositive() {
        properties.setProperty(Settings.KEY_PREF_ANIMATION_MAX_FRAMES, "0");
        newSession();
        assertThrows(ConfigurationException.class, new Executable() {
            @Override
            public void execute() {
                session.start();
            }
        });
        assertEquals(PlaybackState.STOPPED, session.getState());
    }

    @Test
    public void windowWithNothingLoadedReportsError() throws Exception {
        for (String name : NAMES) {
            source.failOn(name);
        }
        newSession();
        session.start();

        awaitStopped();
        ui.runPending();

        assertEquals(PlaybackState.STOPPED, session.getState());
        assertEquals(1, collector.messages.size());
        AppMessage message = collector.messages.get(0);
        assertEquals(AppMessage.Type.ERROR, message.getType());
        assertEquals(SITE, message.getSite());
        assertTrue(message.getMessage().contains(SITE));
        assertEquals(3, renderer.getRemoved().size());
    }

    @Test
    public void missingSiteReportsStatusLink() throws Exception {
        source = new FakeRadarDataSource().add("KOUN_20240101_121000");
        newSession();
        session.start();

        awaitStopped();
        ui.runPending();

        assertEquals(1, collector.messages.size());
        assertNotNull(collector.messages.get(0).getLink());
        assertTrue(collector.messages.get(0).getLink().contains("issuedby=TLX"));
    }

    @Test
    public void stepsMoveOneFrameWhilePaused() throws Exception {
        // long interval: the worker only ticks when a command wakes it
        properties.setProperty(Settings.KEY_PREF_ANIMATION_FRAME_INTERVAL_MS, "60000");
        newSession();
        session.start();
        awaitPlaying();

        session.dispatch(PlaybackCommand.STEP_FORWARD);
        assertEquals(PlaybackState.PAUSED, session.getState());
        assertTrue(session.isPaused());
        assertSettlesAt(1);

        session.dispatch(PlaybackCommand.STEP_BACKWARD);
        assertSettlesAt(0);

        session.dispatch(PlaybackCommand.STEP_BACKWARD);
        assertSettlesAt(2);

        session.dispatch(PlaybackCommand.TOGGLE_PAUSE);
        assertEquals(PlaybackState.PLAYING, session.getState());
        assertEquals(Direction.FORWARD, session.getMachine().getDirection());
    }

    private void assertSettlesAt(final int frameIndex) throws InterruptedException {
        ui.pumpUntil(new BooleanSupplier() {
            @Override
            public boolean getAsBoolean() {
                return session.getMachine().getFrameIndex() == frameIndex;
            }
        }, TIMEOUT_MS);
        Thread.sleep(200);
        ui.runPending();
        assertEquals(frameIndex, session.getMachine().getFrameIndex());
    }

    @Test
    public void commandsIgnoredWhenStopped() {
        newSession();
        session.dispatch(PlaybackCommand.TOGGLE_PAUSE);
        session.dispatch(PlaybackCommand.STEP_FORWARD);
        assertEquals(PlaybackState.STOPPED, session.getState());
        assertFalse(session.isPaused());
    }

    @Test
    public void togglePlayStartsAndStops() throws Exception {
        newSession();
        session.dispatch(PlaybackCommand.TOGGLE_PLAY);
        awaitPlaying();

        session.dispatch(PlaybackCommand.TOGGLE_PLAY);
        awaitStopped();
        assertEquals(PlaybackState.STOPPED, session.getState());
    }

    @Test
    public void isoLevelReachesRenderer() throws Exception {
        newSession();
        session.start();
        awaitPlaying();

        session.setIsoLevel(30f);
        awaitCall("iso ", " 30.0");
    }

    @Test
    public void selectionAndElevationsFollowNewestFrame() throws Exception {
        newSession();
        session.start();
        awaitPlaying();

        assertEquals(VolumeType.REFLECTIVITY.getId(), session.getSelection().getVolumeId());
        assertEquals(0.5f, session.getSelection().getElevation(), 1e-6);
        assertEquals(Arrays.asList(0.5f, 1.5f), session.getElevations(VolumeType.VELOCITY.getId()));
        assertTrue(session.getElevations(VolumeType.SPECTRUM_WIDTH.getId()).isEmpty());

        session.selectSweep(VolumeType.VELOCITY.getId(), 1.5f);
        awaitCall("sweep ", " 1/1");
    }

    @Test
    public void stopReturnsScansToDataSource() throws Exception {
        newSession();
        session.start();
        awaitPlaying();

        session.stopAndJoin();

        assertEquals(3, source.getFreed().size());
        for (RadarScan scan : source.getFreed()) {
            assertTrue(scan.isReleased());
        }
    }

    @Test
    public void neverTwoFramesOnScreen() throws Exception {
        properties.setProperty(Settings.KEY_PREF_ANIMATION_END_HOLD_MS, "0");
        newSession();
        session.start();
        assertTrue(ui.pumpUntil(new BooleanSupplier() {
            @Override
            public boolean getAsBoolean() {
                return collector.boundaries.size() >= 2;
            }
        }, TIMEOUT_MS), "two laps never completed");
        session.selectSweep(VolumeType.VELOCITY.getId(), 1.5f);
        awaitCall("sweep ", " 1/1");
        session.dispatch(PlaybackCommand.STEP_BACKWARD);
        session.dispatch(PlaybackCommand.STEP_BACKWARD);
        Thread.sleep(100);
        ui.runPending();

        assertEquals(1, renderer.getMaxVisible());
        assertTrue(renderer.getVisible().size() <= 1);
    }

    @Test
    public void stopWaitsForPendingSweepChange() throws Exception {
        renderer.holdSweepChanges();
        newSession();
        session.start();
        awaitPlaying();
        assertTrue(ui.pumpUntil(new BooleanSupplier() {
            @Override
            public boolean getAsBoolean() {
                return renderer.getHeldCount() > 0;
            }
        }, TIMEOUT_MS), "no sweep change was requested");

        session.requestStop();
        Thread.sleep(300);
        ui.runPending();

        assertFalse(session.getStopped().isDone());
        assertTrue(renderer.getRemoved().isEmpty());
        assertTrue(source.getFreed().isEmpty());

        renderer.completeHeldSweepChanges();
        awaitStopped();

        assertEquals(3, renderer.getRemoved().size());
        List<String> calls = new ArrayList<String>(renderer.getCalls());
        int lastReady = -1;
        int firstRemove = -1;
        for (int index = 0; index < calls.size(); index++) {
            if (calls.get(index).startsWith("ready ")) {
                lastReady = index;
            } else if (firstRemove < 0 && calls.get(index).startsWith("remove ")) {
                firstRemove = index;
            }
        }
        assertTrue(lastReady >= 0 && firstRemove > lastReady, "frames removed before sweep change finished: " + calls);
    }

    @Test
    public void statusCanBeReadWhileStopping() throws Exception {
        source = new FakeRadarDataSource();
        for (int second = 0; second < 600; second += 15) {
            source.add(String.format("KTLX_20240101_12%02d%02d", second / 60, second % 60));
        }
        properties.setProperty(Settings.KEY_PREF_ANIMATION_MAX_FRAMES, "40");
        properties.setProperty(Settings.KEY_PREF_ANIMATION_END_HOLD_MS, "0");
        newSession();
        final AtomicBoolean reading = new AtomicBoolean(true);
        final AtomicReference<Throwable> failure = new AtomicReference<Throwable>();
        Thread reader = new Thread(new Runnable() {
            @Override
            public void run() {
                try {
                    while (reading.get()) {
                        AnimationStatusEvent status = session.getStatus();
                        if (status.getLoadedCount() > status.getFrameCount()) {
                            throw new IllegalStateException("loaded " + status.getLoadedCount()
                                    + " of " + status.getFrameCount());
                        }
                    }
                } catch (Throwable ex) {
                    failure.set(ex);
                }
            }
        }, "status-reader");
        reader.start();
        try {
            for (int round = 0; round < 5; round++) {
                session.start();
                awaitPlaying();
                session.stopAndJoin();
            }
        } finally {
            reading.set(false);
            reader.join();
        }
        assertNull(failure.get());
        assertEquals(0, session.getStatus().getFrameCount());
    }
}
