package com.radarloop.animation;

import com.radarloop.model.Frame;
import com.radarloop.model.FrameWindow;
import com.radarloop.model.SubFrame;
import com.radarloop.model.SweepSelection;
import com.radarloop.util.SweepTimeExtractor;

import java.util.BitSet;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Playback cursor over a frame window: which frame and which of its sub-frames is current, the
 * direction of travel, the pause flag and the set of frames the user switched off.
 * <p>
 * Only the animation worker moves the cursor. The pause flag, direction, pending step, disabled
 * set and sweep selection are written by the UI thread and picked up on the next {@link #advance}.
 */
public class PlaybackStateMachine {

    protected volatile FrameWindow window = new FrameWindow(0);

    protected volatile int frameIndex = -1;
    protected volatile int subFrameIndex = -1;
    protected volatile Direction direction = Direction.FORWARD;
    protected volatile boolean paused;
    protected volatile SweepSelection selection;
    protected final AtomicReference<Direction> pendingStep = new AtomicReference<Direction>();
    protected final BitSet disabledFrames = new BitSet();

    /** Sub-frames of the current frame for {@link #cachedSelection}; null when they must be rebuilt. */
    protected volatile List<SubFrame> subFrames;
    protected int cachedFrameIndex = -1;
    protected SweepSelection cachedSelection;

    /**
     * Start over on a new window: before the first frame, moving forward, nothing disabled.
     */
    public void reset(FrameWindow window) {
        this.window = window;
        frameIndex = -1;
        subFrameIndex = -1;
        direction = Direction.FORWARD;
        pendingStep.set(null);
        synchronized (disabledFrames) {
            disabledFrames.clear();
        }
        invalidate();
    }

    /**
     * Move one sub-frame in {@code direction}, crossing into the next enabled frame with sub-frames
     * when the current one is used up or the sweep selection changed.
     *
     * @return true if the move wrapped around an end of the window
     */
    public boolean advance(Direction direction) {
        int numFrames = window.size();
        if (numFrames == 0) {
            return false;
        }
        int nextSubFrame = subFrameIndex + direction.getStep();
        SweepSelection current = selection;
        List<SubFrame> cached = subFrames;
        if (cached != null && (cachedFrameIndex != frameIndex || current == null || !current.equals(cachedSelection))) {
            invalidate();
            cached = null;
        }
        if (cached != null && nextSubFrame >= 0 && nextSubFrame < cached.size()) {
            subFrameIndex = nextSubFrame;
            return false;
        }
        return moveToNextFrame(direction, current);
    }

    protected boolean moveToNextFrame(Direction direction, SweepSelection current) {
        int numFrames = window.size();
        boolean boundary = false;
        int candidate = frameIndex;
        for (int tried = 0; tried < numFrames; tried++) {
            candidate += direction.getStep();
            if (candidate >= numFrames) {
                candidate = 0;
                boundary = true;
            } else if (candidate < 0) {
                candidate = numFrames - 1;
                boundary = true;
            }
            if (isFrameDisabled(candidate)) {
                continue;
            }
            List<SubFrame> found = subFramesOf(candidate, current);
            if (found.isEmpty()) {
                continue;
            }
            land(candidate, found, current, direction);
            return boundary;
        }
        // nothing playable elsewhere: stay where we are
        if (frameIndex >= 0 && frameIndex < numFrames) {
            land(frameIndex, subFramesOf(frameIndex, current), current, direction);
        } else {
            invalidate();
            subFrameIndex = -1;
        }
        return false;
    }

    private void land(int index, List<SubFrame> found, SweepSelection current, Direction direction) {
        subFrames = found;
        cachedFrameIndex = index;
        cachedSelection = current;
        if (found.isEmpty()) {
            subFrameIndex = -1;
        } else {
            subFrameIndex = direction == Direction.FORWARD ? 0 : found.size() - 1;
        }
        frameIndex = index;
    }

    protected List<SubFrame> subFramesOf(int index, SweepSelection current) {
        Frame frame = window.get(index);
        if (current == null || !frame.isLoaded()) {
            return Collections.emptyList();
        }
        return Collections.unmodifiableList(
                SweepTimeExtractor.sweepsAt(frame.getScan(), current.getVolumeId(), current.getElevation()));
    }

    protected void invalidate() {
        subFrames = null;
        cachedFrameIndex = -1;
        cachedSelection = null;
    }

    public FrameWindow getWindow() {
        return window;
    }

    public int getFrameIndex() {
        return frameIndex;
    }

    public int getSubFrameIndex() {
        return subFrameIndex;
    }

    /**
     * @return the current frame, or null before the first advance
     */
    public Frame getCurrentFrame() {
        int index = frameIndex;
        FrameWindow current = window;
        return index >= 0 && index < current.size() ? current.get(index) : null;
    }

    /**
     * @return the current sub-frame, or null when the cursor has nothing to show
     */
    public SubFrame getCurrentSubFrame() {
        List<SubFrame> cached = subFrames;
        int index = subFrameIndex;
        if (cached == null || index < 0 || index >= cached.size()) {
            return null;
        }
        return cached.get(index);
    }

    public Direction getDirection() {
        return direction;
    }

    public void setDirection(Direction direction) {
        this.direction = direction;
    }

    public boolean isPaused() {
        return paused;
    }

    public void setPaused(boolean paused) {
        this.paused = paused;
    }

    /**
     * Queue a single step to be taken while paused. A later step replaces an unconsumed one.
     */
    public void requestStep(Direction step) {
        pendingStep.set(step);
    }

    /**
     * @return the queued step, or null; the queue is left empty
     */
    public Direction takePendingStep() {
        return pendingStep.getAndSet(null);
    }

    public SweepSelection getSelection() {
        return selection;
    }

    public void setSelection(SweepSelection selection) {
        this.selection = selection;
    }

    public boolean isFrameDisabled(int index) {
        synchronized (disabledFrames) {
            return disabledFrames.get(index);
        }
    }

    public void toggleFrameEnabled(int index) {
        synchronized (disabledFrames) {
            disabledFrames.flip(index);
        }
    }

    public BitSet getDisabledFrames() {
        synchronized (disabledFrames) {
            return (BitSet) disabledFrames.clone();
        }
    }
}
