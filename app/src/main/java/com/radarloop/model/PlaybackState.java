package com.radarloop.model;

/**
 * Lifecycle of an animation session.
 */
public enum PlaybackState {
    /** Building the frame window */
    LOADING,
    /** Advancing on the frame timer */
    PLAYING,
    /** Holding position; steps and selection changes still apply */
    PAUSED,
    /** Stop requested, worker releasing frames */
    STOPPING,
    /** No worker running */
    STOPPED;

    public boolean isActive() {
        return this == LOADING || this == PLAYING || this == PAUSED;
    }
}
