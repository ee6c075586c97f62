package com.radarloop.model;

import java.util.BitSet;

/**
 * Snapshot of a session's position for the UI. Built on the UI thread from values the worker
 * publishes, so it never reflects a half-applied tick.
 */
public class AnimationStatusEvent {

    protected final String site;
    protected final PlaybackState state;
    protected final int frameIndex;
    protected final int subFrameIndex;
    protected final int frameCount;
    protected final int loadedCount;
    protected final BitSet disabledFrames;
    protected final SubFrame currentSubFrame;
    protected final RayTime loopStart;
    protected final RayTime loopFinish;
    protected final String errorMessage;

    public AnimationStatusEvent(String site, PlaybackState state, int frameIndex, int subFrameIndex,
                                int frameCount, int loadedCount, BitSet disabledFrames,
                                SubFrame currentSubFrame, RayTime loopStart, RayTime loopFinish,
                                String errorMessage) {
        this.site = site;
        this.state = state;
        this.frameIndex = frameIndex;
        this.subFrameIndex = subFrameIndex;
        this.frameCount = frameCount;
        this.loadedCount = loadedCount;
        this.disabledFrames = disabledFrames == null ? new BitSet() : (BitSet) disabledFrames.clone();
        this.currentSubFrame = currentSubFrame;
        this.loopStart = loopStart;
        this.loopFinish = loopFinish;
        this.errorMessage = errorMessage;
    }

    public String getSite() {
        return site;
    }

    public PlaybackState getState() {
        return state;
    }

    public boolean isPaused() {
        return state == PlaybackState.PAUSED;
    }

    public int getFrameIndex() {
        return frameIndex;
    }

    public int getSubFrameIndex() {
        return subFrameIndex;
    }

    public int getFrameCount() {
        return frameCount;
    }

    public int getLoadedCount() {
        return loadedCount;
    }

    public boolean isFrameDisabled(int index) {
        return disabledFrames.get(index);
    }

    public SubFrame getCurrentSubFrame() {
        return currentSubFrame;
    }

    public RayTime getLoopStart() {
        return loopStart;
    }

    public RayTime getLoopFinish() {
        return loopFinish;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    /**
     * Position of the current sub-frame within the last completed lap, 0 to 100. Before the first
     * lap completes there is no range to measure against and the result is 0.
     */
    public int getLoopPercent() {
        if (currentSubFrame == null || loopStart == null || loopFinish == null) {
            return 0;
        }
        long span = loopFinish.toEpochSeconds() - loopStart.toEpochSeconds();
        if (span <= 0) {
            return 0;
        }
        long offset = currentSubFrame.getStart().toEpochSeconds() - loopStart.toEpochSeconds();
        long percent = offset * 100 / span;
        return (int) Math.max(0, Math.min(100, percent));
    }

    @Override
    public String toString() {
        return "AnimationStatusEvent{" + site + " " + state + " frame=" + frameIndex + "/" + frameCount
                + " sub=" + subFrameIndex + '}';
    }
}
