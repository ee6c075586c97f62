package com.radarloop.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A single elevation scan within a volume.
 */
public class RadarSweep {

    protected final float elevation;
    protected final float firstGateMeters;
    protected final float gateSpacingMeters;
    protected final List<RadarRay> rays;

    public RadarSweep(float elevation, float firstGateMeters, float gateSpacingMeters, List<RadarRay> rays) {
        this.elevation = elevation;
        this.firstGateMeters = firstGateMeters;
        this.gateSpacingMeters = gateSpacingMeters;
        this.rays = rays == null ? new ArrayList<RadarRay>() : rays;
    }

    public float getElevation() {
        return elevation;
    }

    public float getFirstGateMeters() {
        return firstGateMeters;
    }

    public float getGateSpacingMeters() {
        return gateSpacingMeters;
    }

    public List<RadarRay> getRays() {
        return Collections.unmodifiableList(rays);
    }

    public int getRayCount() {
        return rays.size();
    }

    void releaseBins() {
        for (RadarRay ray : rays) {
            ray.releaseBins();
        }
    }
}
