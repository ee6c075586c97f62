package com.radarloop.model;

/**
 * One sweep of a frame's selected volume/elevation group, with the time span it covers.
 */
public class SubFrame {

    protected final int volumeId;
    protected final int sweepIndex;
    protected final RayTime start;
    protected final RayTime finish;

    public SubFrame(int volumeId, int sweepIndex, RayTime start, RayTime finish) {
        this.volumeId = volumeId;
        this.sweepIndex = sweepIndex;
        this.start = start;
        this.finish = finish;
    }

    public int getVolumeId() {
        return volumeId;
    }

    public int getSweepIndex() {
        return sweepIndex;
    }

    public RayTime getStart() {
        return start;
    }

    public RayTime getFinish() {
        return finish;
    }

    @Override
    public String toString() {
        return "SubFrame{volume=" + volumeId + ", sweep=" + sweepIndex + ", "
                + RayTime.formatRange(start, finish) + '}';
    }
}
