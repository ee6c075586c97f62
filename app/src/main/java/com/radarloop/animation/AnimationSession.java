package com.radarloop.animation;

import com.radarloop.app.Settings;
import com.radarloop.exception.ConfigurationException;
import com.radarloop.exception.NoCandidateFilesException;
import com.radarloop.exception.RadarLoopException;
import com.radarloop.model.AnimationStatusEvent;
import com.radarloop.model.AppMessage;
import com.radarloop.model.Frame;
import com.radarloop.model.FrameLoadProgressEvent;
import com.radarloop.model.FrameWindow;
import com.radarloop.model.LoopBoundaryEvent;
import com.radarloop.model.PlaybackState;
import com.radarloop.model.SubFrame;
import com.radarloop.model.SweepSelection;
import com.radarloop.model.VolumeType;
import com.radarloop.rendering.FrameRenderer;
import com.radarloop.services.FrameLoader;
import com.radarloop.services.PreferenceStore;
import com.radarloop.util.SweepTimeExtractor;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.greenrobot.eventbus.EventBus;

import java.util.Calendar;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TimeZone;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Animation of one radar site. A worker thread loads the frame window, then steps through it on
 * a timer until asked to stop. UI commands poke the worker so they take effect at once; all UI
 * notifications go out through the {@link UiDispatcher} as {@link EventBus} events.
 */
public class AnimationSession {

    public static final String TAG = "ANIMATION";

    private static final Logger LOG = LogManager.getLogger(TAG);

    protected final String site;
    protected final FrameLoader loader;
    protected final FrameRenderer renderer;
    protected final UiDispatcher ui;
    protected final EventBus eventBus;
    protected final PreferenceStore preferences;

    protected final PlaybackStateMachine machine = new PlaybackStateMachine();
    protected final WorkerSleeper sleeper = new WorkerSleeper();
    protected final LoopTimeTracker loopTimes = new LoopTimeTracker();
    protected final AtomicBoolean uiRefreshPending = new AtomicBoolean();
    protected final Object swapLock = new Object();

    protected volatile PlaybackState state = PlaybackState.STOPPED;
    protected volatile boolean stopRequested;
    protected volatile float isoLevel = Float.NaN;
    protected volatile String lastError;
    protected volatile Calendar anchorTime;
    protected volatile int loadPercent;
    /** Elevations available per volume id in the newest loaded frame, captured when playback begins. */
    protected volatile Map<Integer, List<Float>> elevations = Collections.emptyMap();

    protected Thread worker;
    protected CompletableFuture<Void> stopped = CompletableFuture.completedFuture(null);

    /** Frame the worker most recently decided to show. */
    protected volatile Frame targetFrame;
    /** Frame actually visible in the renderer. */
    protected Frame visibleFrame;

    public AnimationSession(String site, FrameLoader loader, FrameRenderer renderer, UiDispatcher ui,
                            EventBus eventBus, PreferenceStore preferences) {
        this.site = site;
        this.loader = loader;
        this.renderer = renderer;
        this.ui = ui;
        this.eventBus = eventBus;
        this.preferences = preferences;
    }

    /**
     * Spawn the worker. Refused while a session is already loading or running.
     *
     * @return false if the session was already active
     * @throws ConfigurationException if the frame count setting is not positive
     */
    public synchronized boolean start() {
        if (state.isActive() || state == PlaybackState.STOPPING) {
            LOG.debug("start ignored for " + site + ", session is " + state);
            return false;
        }
        final int maxFrames = preferences.getInt(Settings.KEY_PREF_ANIMATION_MAX_FRAMES, Settings.DEFAULT_MAX_FRAMES);
        if (maxFrames <= 0) {
            throw new ConfigurationException("the animation frame count (" + Settings.KEY_PREF_ANIMATION_MAX_FRAMES
                    + ") must be greater than zero, got " + maxFrames);
        }
        stopRequested = false;
        lastError = null;
        loadPercent = 0;
        sleeper.clear();
        loopTimes.reset();
        machine.setPaused(false);
        state = PlaybackState.LOADING;
        stopped = new CompletableFuture<Void>();
        final CompletableFuture<Void> done = stopped;
        worker = new Thread(new Runnable() {
            @Override
            public void run() {
                runWorker(maxFrames, done);
            }
        }, "animation-" + site);
        worker.setDaemon(true);
        LOG.info("starting animation for " + site + " (" + maxFrames + " frames)");
        worker.start();
        requestUiRefresh();
        return true;
    }

    /**
     * Ask the worker to stop without waiting for it.
     *
     * @return completes once the worker has released its frames and exited
     */
    public synchronized CompletableFuture<Void> requestStop() {
        if (state.isActive()) {
            state = PlaybackState.STOPPING;
        }
        stopRequested = true;
        sleeper.poke();
        return stopped;
    }

    /**
     * Stop the worker and wait for it to exit. Safe on the UI thread, which keeps processing its
     * queue meanwhile, and a no-op when nothing is running.
     */
    public void stopAndJoin() {
        Thread thread;
        CompletableFuture<Void> done;
        synchronized (this) {
            thread = worker;
            done = stopped;
            if (thread == null) {
                return;
            }
        }
        requestStop();
        try {
            ui.await(done);
            thread.join();
        } catch (InterruptedException ex) {
            LOG.warn("interrupted while stopping animation for " + site);
            Thread.currentThread().interrupt();
        }
        synchronized (this) {
            if (worker == thread) {
                worker = null;
            }
        }
    }

    public synchronized void dispatch(PlaybackCommand command) {
        LOG.debug(site + " command " + command + " in state " + state);
        if (command == PlaybackCommand.TOGGLE_PLAY) {
            if (state.isActive()) {
                requestStop();
            } else {
                start();
            }
            return;
        }
        if (state == PlaybackState.LOADING || !state.isActive()) {
            return;
        }
        switch (command) {
            case TOGGLE_PAUSE:
                if (machine.isPaused()) {
                    machine.setDirection(Direction.FORWARD);
                    machine.setPaused(false);
                    state = PlaybackState.PLAYING;
                } else {
                    machine.setPaused(true);
                    state = PlaybackState.PAUSED;
                }
                break;
            case STEP_FORWARD:
                step(Direction.FORWARD);
                break;
            case STEP_BACKWARD:
                step(Direction.BACKWARD);
                break;
            default:
                break;
        }
        sleeper.poke();
        requestUiRefresh();
    }

    private void step(Direction direction) {
        machine.setPaused(true);
        state = PlaybackState.PAUSED;
        machine.requestStep(direction);
    }

    public void toggleFrameEnabled(int frameIndex) {
        machine.toggleFrameEnabled(frameIndex);
        sleeper.poke();
        requestUiRefresh();
    }

    /**
     * Change the volume and elevation shown. Frames pick it up on the worker's next step.
     */
    public void selectSweep(int volumeId, float elevation) {
        machine.setSelection(new SweepSelection(volumeId, elevation));
        sleeper.poke();
    }

    public void setIsoLevel(float isoLevel) {
        this.isoLevel = isoLevel;
        sleeper.poke();
    }

    /**
     * Time the newest frame should be nearest to; null means now. Read when the session starts.
     */
    public void setAnchorTime(Calendar anchorTime) {
        this.anchorTime = anchorTime;
    }

    /**
     * Coalesce refresh requests: at most one status update is queued on the UI thread at a time.
     */
    public void requestUiRefresh() {
        if (uiRefreshPending.compareAndSet(false, true)) {
            ui.post(new Runnable() {
                @Override
                public void run() {
                    uiRefreshPending.set(false);
                    eventBus.post(getStatus());
                }
            });
        }
    }

    public AnimationStatusEvent getStatus() {
        FrameWindow window = machine.getWindow();
        return new AnimationStatusEvent(site, state, machine.getFrameIndex(), machine.getSubFrameIndex(),
                window.size(), window.getLoadedCount(), machine.getDisabledFrames(),
                machine.getCurrentSubFrame(), loopTimes.getLoopStart(), loopTimes.getLoopFinish(), lastError);
    }

    protected void runWorker(int maxFrames, CompletableFuture<Void> done) {
        FrameWindow window = null;
        try {
            Calendar anchor = anchorTime == null ? Calendar.getInstance(TimeZone.getTimeZone("UTC")) : anchorTime;
            window = loader.loadWindow(anchor, site, maxFrames, new FrameLoader.Listener() {
                @Override
                public void onProgress(FrameLoadProgressEvent event) {
                    loadPercent = (int) Math.round(100.0 * event.getFraction());
                    postEvent(event);
                }

                @Override
                public void onFrameReady(Frame frame) {
                    renderer.hide(frame);
                }

                @Override
                public boolean isCancelled() {
                    return stopRequested;
                }
            });
            if (!stopRequested) {
                if (window.getLoadedCount() == 0) {
                    fail(new AppMessage(site, "No radar frames available for " + site, AppMessage.Type.ERROR, null));
                } else {
                    play(window);
                }
            }
        } catch (NoCandidateFilesException ex) {
            LOG.error(ex.getMessage());
            fail(new AppMessage(site, ex.getMessage(), AppMessage.Type.ERROR, ex.getStatusUrl()));
        } catch (RadarLoopException ex) {
            LOG.error("animation for " + site + " failed", ex);
            fail(new AppMessage(site, ex.getMessage(), AppMessage.Type.ERROR, null));
        } catch (RuntimeException ex) {
            LOG.error("unexpected error animating " + site, ex);
            fail(new AppMessage(site, "Animation failed: " + ex, AppMessage.Type.ERROR, null));
        } finally {
            try {
                if (window != null) {
                    releaseFrames(window);
                }
            } finally {
                state = PlaybackState.STOPPED;
                LOG.info("animation for " + site + " stopped");
                requestUiRefresh();
                done.complete(null);
            }
        }
    }

    protected void play(FrameWindow window) {
        machine.reset(window);
        elevations = collectElevations(window);
        if (machine.getSelection() == null) {
            machine.setSelection(defaultSelection(window));
        }
        machine.setPaused(false);
        state = PlaybackState.PLAYING;
        LOG.debug("playing " + window.getLoadedCount() + "/" + window.size() + " frames for " + site);
        long frameInterval = preferences.getInt(Settings.KEY_PREF_ANIMATION_FRAME_INTERVAL_MS, Settings.DEFAULT_FRAME_INTERVAL_MS);
        long endHold = preferences.getInt(Settings.KEY_PREF_ANIMATION_END_HOLD_MS, Settings.DEFAULT_END_HOLD_MS);
        while (!stopRequested) {
            tick(endHold);
            renderer.requestRedraw();
            requestUiRefresh();
            sleeper.sleep(frameInterval);
        }
    }

    /**
     * One step of the animation: move the cursor, account for a completed lap, bring the new
     * sub-frame on screen.
     */
    protected void tick(long endHold) {
        if (machine.isPaused()) {
            Direction step = machine.takePendingStep();
            if (step != null) {
                machine.advance(step);
            } else {
                // re-resolve the current position against selection changes without moving
                machine.advance(Direction.FORWARD);
                machine.advance(Direction.BACKWARD);
            }
        } else {
            boolean boundary = machine.advance(machine.getDirection());
            if (boundary) {
                if (endHold > 0) {
                    sleeper.sleep(endHold);
                }
                if (stopRequested) {
                    return;
                }
                final int lap = loopTimes.commitLap();
                postEvent(new LoopBoundaryEvent(site, lap, loopTimes.getLoopStart(), loopTimes.getLoopFinish()));
                LOG.debug(site + " completed lap " + lap);
            }
            loopTimes.accumulate(machine.getCurrentSubFrame());
        }
        display(machine.getCurrentFrame(), machine.getCurrentSubFrame());
    }

    protected void display(final Frame frame, SubFrame subFrame) {
        if (frame == null || subFrame == null) {
            return;
        }
        targetFrame = frame;
        if (!frame.isShowing(subFrame)) {
            CompletableFuture<Void> change = renderer.setSweep(frame, subFrame.getVolumeId(), subFrame.getSweepIndex());
            frame.setPendingSweepChange(change);
            change.thenRun(new Runnable() {
                @Override
                public void run() {
                    swapTo(frame);
                }
            });
        } else {
            swapTo(frame);
        }
        float level = isoLevel;
        if (Float.compare(level, frame.getIsoLevel()) != 0) {
            renderer.setIso(frame, level, false);
        }
    }

    /**
     * Hide whatever is visible, then show {@code frame}, unless the worker has already moved past it.
     */
    protected void swapTo(Frame frame) {
        synchronized (swapLock) {
            if (targetFrame != frame) {
                return;
            }
            Frame previous = visibleFrame;
            if (previous != null && previous != frame) {
                renderer.hide(previous);
            }
            renderer.show(frame);
            visibleFrame = frame;
        }
    }

    /**
     * Wait for outstanding sweep changes, then take every frame off screen and free it.
     */
    protected void releaseFrames(FrameWindow window) {
        long pollMs = preferences.getInt(Settings.KEY_PREF_SHUTDOWN_POLL_MS, Settings.DEFAULT_SHUTDOWN_POLL_MS);
        boolean interrupted = false;
        for (Frame frame : window.getFrames()) {
            CompletableFuture<Void> pending = frame.getPendingSweepChange();
            while (pending != null && !pending.isDone()) {
                try {
                    pending.get(pollMs, TimeUnit.MILLISECONDS);
                } catch (TimeoutException ex) {
                    LOG.debug("waiting for sweep change on " + frame);
                } catch (ExecutionException ex) {
                    LOG.warn("sweep change on " + frame + " failed", ex.getCause());
                } catch (InterruptedException ex) {
                    interrupted = true;
                }
                pending = frame.getPendingSweepChange();
            }
        }
        // detach first so status readers never see a window being torn down
        machine.reset(new FrameWindow(0));
        synchronized (swapLock) {
            targetFrame = null;
            visibleFrame = null;
        }
        for (Frame frame : window.getFrames()) {
            renderer.hide(frame);
            renderer.remove(frame);
        }
        loader.release(window);
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
    }

    private Map<Integer, List<Float>> collectElevations(FrameWindow window) {
        Map<Integer, List<Float>> result = new HashMap<Integer, List<Float>>();
        for (int index = window.size() - 1; index >= 0; index--) {
            Frame frame = window.get(index);
            if (frame.isLoaded()) {
                for (VolumeType type : VolumeType.values()) {
                    result.put(type.getId(), Collections.unmodifiableList(
                            SweepTimeExtractor.elevationsOf(frame.getScan().getVolume(type.getId()))));
                }
                break;
            }
        }
        return Collections.unmodifiableMap(result);
    }

    private SweepSelection defaultSelection(FrameWindow window) {
        for (int index = window.size() - 1; index >= 0; index--) {
            Frame frame = window.get(index);
            if (!frame.isLoaded()) {
                continue;
            }
            List<Float> elevations = SweepTimeExtractor.elevationsOf(frame.getScan().getVolume(VolumeType.REFLECTIVITY.getId()));
            if (!elevations.isEmpty()) {
                return new SweepSelection(VolumeType.REFLECTIVITY.getId(), elevations.get(0));
            }
        }
        return new SweepSelection(VolumeType.REFLECTIVITY.getId(), 0.5f);
    }

    private void fail(AppMessage message) {
        lastError = message.getMessage();
        postEvent(message);
    }

    private void postEvent(final Object event) {
        ui.post(new Runnable() {
            @Override
            public void run() {
                eventBus.post(event);
            }
        });
    }

    public String getSite() {
        return site;
    }

    public PlaybackState getState() {
        return state;
    }

    public boolean isPaused() {
        return machine.isPaused();
    }

    public int getLoadPercent() {
        return loadPercent;
    }

    public float getIsoLevel() {
        return isoLevel;
    }

    /**
     * @return elevations the user can pick for {@code volumeId}, empty until playback begins
     */
    public List<Float> getElevations(int volumeId) {
        List<Float> result = elevations.get(volumeId);
        return result == null ? Collections.<Float>emptyList() : result;
    }

    public SweepSelection getSelection() {
        return machine.getSelection();
    }

    /**
     * @return completes when the current (or last) worker exits
     */
    public synchronized CompletableFuture<Void> getStopped() {
        return stopped;
    }

    PlaybackStateMachine getMachine() {
        return machine;
    }
}
