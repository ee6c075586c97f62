package com.radarloop.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * All sweeps of one radar moment (reflectivity, velocity, ...) within one file.
 */
public class RadarVolume {

    protected final int volumeId;
    protected final List<RadarSweep> sweeps;

    public RadarVolume(int volumeId, List<RadarSweep> sweeps) {
        this.volumeId = volumeId;
        this.sweeps = sweeps == null ? new ArrayList<RadarSweep>() : sweeps;
    }

    public int getVolumeId() {
        return volumeId;
    }

    public List<RadarSweep> getSweeps() {
        return Collections.unmodifiableList(sweeps);
    }

    public int getSweepCount() {
        return sweeps.size();
    }

    public RadarSweep getSweep(int index) {
        if (index < 0 || index >= sweeps.size()) {
            return null;
        }
        return sweeps.get(index);
    }

    void releaseBins() {
        for (RadarSweep sweep : sweeps) {
            sweep.releaseBins();
        }
    }
}
