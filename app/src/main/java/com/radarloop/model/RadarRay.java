package com.radarloop.model;

/**
 * One radial of a sweep: when it was captured, where it points and the gate values along it.
 * Gate values are in the units of the owning volume; {@link Float#NaN} marks "no data".
 */
public class RadarRay {

    protected final RayTime time;
    protected final float azimuth;
    protected final float elevation;
    protected float[] bins;

    public RadarRay(RayTime time, float azimuth, float elevation, float[] bins) {
        this.time = time;
        this.azimuth = azimuth;
        this.elevation = elevation;
        this.bins = bins;
    }

    public RayTime getTime() {
        return time;
    }

    public float getAzimuth() {
        return azimuth;
    }

    public float getElevation() {
        return elevation;
    }

    public float[] getBins() {
        return bins;
    }

    public int getBinCount() {
        return bins == null ? 0 : bins.length;
    }

    void releaseBins() {
        bins = null;
    }
}
