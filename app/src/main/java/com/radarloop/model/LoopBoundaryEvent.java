package com.radarloop.model;

/**
 * Emitted by a playing session each time it wraps around its frame window. Carries the time span
 * observed during the lap that just completed.
 */
public class LoopBoundaryEvent {

    protected final String site;
    protected final int lap;
    protected final RayTime loopStart;
    protected final RayTime loopFinish;

    public LoopBoundaryEvent(String site, int lap, RayTime loopStart, RayTime loopFinish) {
        this.site = site;
        this.lap = lap;
        this.loopStart = loopStart;
        this.loopFinish = loopFinish;
    }

    public String getSite() {
        return site;
    }

    public int getLap() {
        return lap;
    }

    public RayTime getLoopStart() {
        return loopStart;
    }

    public RayTime getLoopFinish() {
        return loopFinish;
    }
}
