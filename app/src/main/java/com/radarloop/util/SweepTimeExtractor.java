package com.radarloop.util;

import com.radarloop.model.RadarRay;
import com.radarloop.model.RadarScan;
import com.radarloop.model.RadarSweep;
import com.radarloop.model.RadarVolume;
import com.radarloop.model.RayTime;
import com.radarloop.model.SubFrame;

import java.util.ArrayList;
import java.util.List;

/**
 * Works out when sweeps were captured and groups the sweeps of a volume by elevation.
 */
public final class SweepTimeExtractor {

    /** Elevations closer than this many degrees belong to the same cut. */
    public static final float ELEVATION_TOLERANCE = 0.1f;

    private SweepTimeExtractor() {
    }

    /**
     * First and last ray time of a sweep.
     */
    public static class TimeRange {
        protected final RayTime start;
        protected final RayTime finish;

        public TimeRange(RayTime start, RayTime finish) {
            this.start = start;
            this.finish = finish;
        }

        public RayTime getStart() {
            return start;
        }

        public RayTime getFinish() {
            return finish;
        }
    }

    /**
     * Scan every ray for the earliest and latest stamp.
     *
     * @return the range, or null if the sweep has no rays
     */
    public static TimeRange sweepTimeRange(RadarSweep sweep) {
        RayTime start = null;
        RayTime finish = null;
        for (RadarRay ray : sweep.getRays()) {
            RayTime time = ray.getTime();
            if (start == null || time.isBefore(start)) {
                start = time;
            }
            if (finish == null || finish.isBefore(time)) {
                finish = time;
            }
        }
        if (start == null) {
            return null;
        }
        return new TimeRange(start, finish);
    }

    public static boolean sameElevation(float a, float b) {
        return Math.abs(a - b) < ELEVATION_TOLERANCE;
    }

    /**
     * Sub-frames for every sweep of {@code volumeId} at {@code elevation}, earliest first. Sweeps
     * without rays or with a zero elevation carry no data and are left out.
     *
     * @return possibly empty list, never null
     */
    public static List<SubFrame> sweepsAt(RadarScan scan, int volumeId, float elevation) {
        List<SubFrame> result = new ArrayList<SubFrame>();
        if (scan == null || scan.isReleased()) {
            return result;
        }
        RadarVolume volume = scan.getVolume(volumeId);
        if (volume == null) {
            return result;
        }
        List<RadarSweep> sweeps = volume.getSweeps();
        for (int index = 0; index < sweeps.size(); index++) {
            RadarSweep sweep = sweeps.get(index);
            if (sweep.getRayCount() == 0 || sweep.getElevation() == 0f) {
                continue;
            }
            if (!sameElevation(sweep.getElevation(), elevation)) {
                continue;
            }
            TimeRange range = sweepTimeRange(sweep);
            result.add(new SubFrame(volumeId, index, range.getStart(), range.getFinish()));
        }
        sortByStartTime(result);
        return result;
    }

    /**
     * Distinct usable elevations of a volume, in sweep order.
     */
    public static List<Float> elevationsOf(RadarVolume volume) {
        List<Float> result = new ArrayList<Float>();
        if (volume == null) {
            return result;
        }
        for (RadarSweep sweep : volume.getSweeps()) {
            if (sweep.getRayCount() == 0 || sweep.getElevation() == 0f) {
                continue;
            }
            boolean known = false;
            for (Float elevation : result) {
                if (sameElevation(elevation, sweep.getElevation())) {
                    known = true;
                    break;
                }
            }
            if (!known) {
                result.add(sweep.getElevation());
            }
        }
        return result;
    }

    /**
     * Stable insertion sort. A sub-frame moves behind another unless its start is before the
     * other's finish, so overlapping sweeps keep their relative order from the file.
     */
    static void sortByStartTime(List<SubFrame> subFrames) {
        for (int i = 1; i < subFrames.size(); i++) {
            SubFrame current = subFrames.get(i);
            int j = i - 1;
            while (j >= 0 && !subFrames.get(j).getStart().isBefore(current.getFinish())) {
                subFrames.set(j + 1, subFrames.get(j));
                j--;
            }
            subFrames.set(j + 1, current);
        }
    }
}
