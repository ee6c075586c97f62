package com.radarloop.animation;

/**
 * Playback direction through the frame window.
 */
public enum Direction {
    FORWARD(1),
    BACKWARD(-1);

    private final int step;

    Direction(int step) {
        this.step = step;
    }

    public int getStep() {
        return step;
    }
}
