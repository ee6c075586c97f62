package com.radarloop.services;

import com.radarloop.exception.DecodeFailureException;
import com.radarloop.exception.FetchFailureException;
import com.radarloop.model.RadarScan;
import com.radarloop.model.TestScans;
import com.radarloop.util.TemporalFileMatcher;

import java.io.File;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * In-memory archive: names are registered up front and decode to synthetic scans.
 */
public class FakeRadarDataSource implements RadarDataSource {

    protected final List<String> names = new ArrayList<String>();
    protected final Set<String> failing = new HashSet<String>();
    protected final List<String> fetched = Collections.synchronizedList(new ArrayList<String>());
    protected final List<RadarScan> freed = Collections.synchronizedList(new ArrayList<RadarScan>());
    protected float[] elevations = {0.5f, 1.5f};

    public FakeRadarDataSource add(String... fileNames) {
        Collections.addAll(names, fileNames);
        return this;
    }

    /**
     * Make {@code fileName} fail to decode.
     */
    public FakeRadarDataSource failOn(String fileName) {
        failing.add(fileName);
        return this;
    }

    public FakeRadarDataSource withElevations(float... elevations) {
        this.elevations = elevations;
        return this;
    }

    public List<String> getFetched() {
        return fetched;
    }

    public List<RadarScan> getFreed() {
        return freed;
    }

    @Override
    public List<String> listCandidates(String site, Pattern pattern) {
        List<String> result = new ArrayList<String>();
        for (String name : names) {
            if (name.startsWith(site) && pattern.matcher(name).matches()) {
                result.add(name);
            }
        }
        return result;
    }

    @Override
    public File fetch(String site, String name, FetchProgressListener listener) throws FetchFailureException {
        fetched.add(name);
        if (listener != null) {
            listener.onProgress(50, 100);
        }
        return new File(name);
    }

    @Override
    public RadarScan decode(File localFile, String site) throws DecodeFailureException {
        String name = localFile.getName();
        if (failing.contains(name)) {
            throw new DecodeFailureException("corrupt volume " + name);
        }
        return TestScans.scan(site, TemporalFileMatcher.parseTimestamp(name, TemporalFileMatcher.LEVEL2_TIMESTAMP_OFFSET),
                elevations);
    }

    @Override
    public void free(RadarScan scan) {
        freed.add(scan);
        scan.release();
    }
}
