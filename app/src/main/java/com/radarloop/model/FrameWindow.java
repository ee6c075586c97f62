package com.radarloop.model;

import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * The frames of one animation, oldest first. Never longer than the configured limit. Slots whose
 * file failed stay in place as empty frames; they are not disabled, they just have nothing to show.
 */
public class FrameWindow {

    protected final int maxFrames;
    /** Written only while the window is loaded or torn down, read from the UI thread for status. */
    protected final List<Frame> frames = new CopyOnWriteArrayList<Frame>();

    public FrameWindow(int maxFrames) {
        this.maxFrames = maxFrames;
    }

    /**
     * Insert a frame ahead of the ones already present. The loader walks from the newest file
     * towards older ones, so each new frame is older than everything in the window.
     */
    public void addOldest(Frame frame) {
        if (frames.size() >= maxFrames) {
            throw new IllegalStateException("frame window is full (" + maxFrames + ")");
        }
        frames.add(0, frame);
    }

    public Frame get(int index) {
        return frames.get(index);
    }

    public int size() {
        return frames.size();
    }

    public boolean isEmpty() {
        return frames.isEmpty();
    }

    public int getMaxFrames() {
        return maxFrames;
    }

    public int getLoadedCount() {
        int count = 0;
        for (Frame frame : frames) {
            if (frame.isLoaded()) {
                count++;
            }
        }
        return count;
    }

    public List<Frame> getFrames() {
        return Collections.unmodifiableList(frames);
    }

    /**
     * Empty the window. Scans still attached to the frames are left to the caller.
     */
    public void clear() {
        frames.clear();
    }
}
