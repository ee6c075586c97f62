package com.radarloop.model;

/**
 * What the user wants to look at: a volume (moment) and an elevation angle. Immutable, so the UI
 * thread can swap in a new selection while the animation worker reads the old one.
 */
public final class SweepSelection {

    protected final int volumeId;
    protected final float elevation;

    public SweepSelection(int volumeId, float elevation) {
        this.volumeId = volumeId;
        this.elevation = elevation;
    }

    public int getVolumeId() {
        return volumeId;
    }

    public float getElevation() {
        return elevation;
    }

    @Override
    public boolean equals(Object o) {
        if (o instanceof SweepSelection) {
            SweepSelection other = (SweepSelection) o;
            return volumeId == other.volumeId && Float.compare(elevation, other.elevation) == 0;
        }
        return false;
    }

    @Override
    public int hashCode() {
        return 31 * volumeId + Float.floatToIntBits(elevation);
    }

    @Override
    public String toString() {
        return "SweepSelection{volume=" + volumeId + ", elevation=" + elevation + '}';
    }
}
