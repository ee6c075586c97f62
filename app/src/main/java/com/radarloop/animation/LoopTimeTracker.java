package com.radarloop.animation;

import com.radarloop.model.RayTime;
import com.radarloop.model.SubFrame;

/**
 * Running earliest start and latest finish of the sub-frames shown in the current lap, and the
 * range committed for the last completed lap.
 */
public class LoopTimeTracker {

    private RayTime lapStart;
    private RayTime lapFinish;
    private volatile RayTime loopStart;
    private volatile RayTime loopFinish;
    private volatile int laps;

    public void accumulate(SubFrame subFrame) {
        if (subFrame == null) {
            return;
        }
        if (lapStart == null || earlier(subFrame.getStart(), lapStart)) {
            lapStart = subFrame.getStart();
        }
        if (lapFinish == null || earlier(lapFinish, subFrame.getFinish())) {
            lapFinish = subFrame.getFinish();
        }
    }

    /**
     * Publish the current lap's range and start collecting the next one.
     *
     * @return the number of laps committed so far
     */
    public int commitLap() {
        if (lapStart != null) {
            loopStart = lapStart;
            loopFinish = lapFinish;
        }
        lapStart = null;
        lapFinish = null;
        return ++laps;
    }

    public void reset() {
        lapStart = null;
        lapFinish = null;
        loopStart = null;
        loopFinish = null;
        laps = 0;
    }

    public RayTime getLoopStart() {
        return loopStart;
    }

    public RayTime getLoopFinish() {
        return loopFinish;
    }

    public int getLaps() {
        return laps;
    }

    private static boolean earlier(RayTime a, RayTime b) {
        long secondsA = a.toEpochSeconds();
        long secondsB = b.toEpochSeconds();
        if (secondsA != secondsB) {
            return secondsA < secondsB;
        }
        return a.getSecond() < b.getSecond();
    }
}
