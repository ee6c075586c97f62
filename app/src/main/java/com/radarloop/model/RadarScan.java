package com.radarloop.model;

import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Decoded contents of one archive file: the radar's position plus its volumes keyed by
 * volume id.
 */
public class RadarScan {

    protected final String site;
    protected final LatLongCoordinates location;
    protected final Map<Integer, RadarVolume> volumes = new TreeMap<Integer, RadarVolume>();
    protected boolean released;

    public RadarScan(String site, LatLongCoordinates location) {
        this.site = site;
        this.location = location;
    }

    public void addVolume(RadarVolume volume) {
        volumes.put(volume.getVolumeId(), volume);
    }

    public RadarVolume getVolume(int volumeId) {
        return volumes.get(volumeId);
    }

    public Collection<RadarVolume> getVolumes() {
        return Collections.unmodifiableCollection(volumes.values());
    }

    public String getSite() {
        return site;
    }

    public LatLongCoordinates getLocation() {
        return location;
    }

    public boolean isReleased() {
        return released;
    }

    /**
     * Drop the gate arrays so a frame evicted from the window stops holding memory.
     */
    public void release() {
        for (RadarVolume volume : volumes.values()) {
            volume.releaseBins();
        }
        released = true;
    }
}
