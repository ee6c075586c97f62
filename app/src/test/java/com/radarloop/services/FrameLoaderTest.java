package com.radarloop.services;

import com.radarloop.exception.ConfigurationException;
import com.radarloop.exception.NoCandidateFilesException;
import com.radarloop.model.Frame;
import com.radarloop.model.FrameLoadProgressEvent;
import com.radarloop.model.FrameWindow;
import com.radarloop.model.RadarScan;
import com.radarloop.util.TemporalFileMatcher;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.function.Executable;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Calendar;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class FrameLoaderTest {

    private static final String[] NAMES = {
            "KTLX_20240101_120000", "KTLX_20240101_120500", "KTLX_20240101_121000",
            "KTLX_20240101_121500", "KTLX_20240101_122000_V06"};

    private static Calendar at(String name) {
        return TemporalFileMatcher.parseTimestamp(name, TemporalFileMatcher.LEVEL2_TIMESTAMP_OFFSET);
    }

    private static class RecordingListener implements FrameLoader.Listener {
        final List<FrameLoadProgressEvent> events = new ArrayList<FrameLoadProgressEvent>();
        final List<Frame> ready = new ArrayList<Frame>();
        int cancelAfter = Integer.MAX_VALUE;

        @Override
        public void onProgress(FrameLoadProgressEvent event) {
            events.add(event);
        }

        @Override
        public void onFrameReady(Frame frame) {
            ready.add(frame);
        }

        @Override
        public boolean isCancelled() {
            return ready.size() >= cancelAfter;
        }
    }

    @Test
    public void loadsNearestAndOlderFilesOldestFirst() {
        FakeRadarDataSource source = new FakeRadarDataSource().add(NAMES).add("KOUN_20240101_121000", "KTLX_notes.txt");
        RecordingListener listener = new RecordingListener();

        FrameWindow window = new FrameLoader(source).loadWindow(at("KTLX_20240101_121600"), "KTLX", 3, listener);

        assertEquals(3, window.size());
        assertEquals(3, window.getLoadedCount());
        assertEquals("KTLX_20240101_120500", window.get(0).getFileName());
        assertEquals("KTLX_20240101_121000", window.get(1).getFileName());
        assertEquals("KTLX_20240101_121500", window.get(2).getFileName());
        assertEquals(Arrays.asList("KTLX_20240101_121500", "KTLX_20240101_121000", "KTLX_20240101_120500"),
                source.getFetched());
        assertEquals(3, listener.ready.size());
        assertEquals("KTLX_20240101_121500", listener.ready.get(0).getFileName());
    }

    @Test
    public void failedFileLeavesEmptySlot() {
        FakeRadarDataSource source = new FakeRadarDataSource().add(NAMES).failOn("KTLX_20240101_120500");
        RecordingListener listener = new RecordingListener();

        FrameWindow window = new FrameLoader(source).loadWindow(at("KTLX_20240101_121500"), "KTLX", 3, listener);

        assertEquals(3, window.size());
        assertEquals(2, window.getLoadedCount());
        Frame failed = window.get(0);
        assertFalse(failed.isLoaded());
        assertNotNull(failed.getFailureReason());
        boolean sawFailure = false;
        for (FrameLoadProgressEvent event : listener.events) {
            if (event.getStatus() == FrameLoadProgressEvent.Status.FAILED) {
                assertEquals("KTLX_20240101_120500", event.getFileName());
                sawFailure = true;
            }
        }
        assertTrue(sawFailure);
    }

    @Test
    public void shortArchiveGivesSmallerWindow() {
        FakeRadarDataSource source = new FakeRadarDataSource().add(NAMES);
        FrameWindow window = new FrameLoader(source).loadWindow(at("KTLX_20240101_120500"), "KTLX", 10, null);
        assertEquals(2, window.size());
        assertEquals(10, window.getMaxFrames());
    }

    @Test
    public void progressCoversWholeWindow() {
        FakeRadarDataSource source = new FakeRadarDataSource().add(NAMES);
        RecordingListener listener = new RecordingListener();
        new FrameLoader(source).loadWindow(at("KTLX_20240101_122000"), "KTLX", 4, listener);

        double previous = 0.0;
        for (FrameLoadProgressEvent event : listener.events) {
            assertTrue(event.getFraction() >= previous, "progress went backwards at " + event);
            previous = event.getFraction();
        }
        assertEquals(1.0, previous, 1e-9);
    }

    @Test
    public void cancellationStopsLoading() {
        FakeRadarDataSource source = new FakeRadarDataSource().add(NAMES);
        RecordingListener listener = new RecordingListener();
        listener.cancelAfter = 1;

        FrameWindow window = new FrameLoader(source).loadWindow(at("KTLX_20240101_122000"), "KTLX", 4, listener);

        assertEquals(1, window.size());
        assertEquals(1, source.getFetched().size());
    }

    @Test
    public void noFilesForSite() {
        final FakeRadarDataSource source = new FakeRadarDataSource().add("KOUN_20240101_121000");
        NoCandidateFilesException ex = assertThrows(NoCandidateFilesException.class, new Executable() {
            @Override
            public void execute() {
                new FrameLoader(source).loadWindow(at("KTLX_20240101_122000"), "KTLX", 4, null);
            }
        });
        assertEquals("KTLX", ex.getSite());
        assertNotNull(ex.getStatusUrl());
    }

    @Test
    public void frameCountMustBePositive() {
        final FakeRadarDataSource source = new FakeRadarDataSource().add(NAMES);
        assertThrows(ConfigurationException.class, new Executable() {
            @Override
            public void execute() {
                new FrameLoader(source).loadWindow(at("KTLX_20240101_122000"), "KTLX", 0, null);
            }
        });
    }

    @Test
    public void repeatedStampLoadsOnce() {
        FakeRadarDataSource source = new FakeRadarDataSource().add("KTLX_20240101_120000",
                "KTLX_20240101_120000_V06", "KTLX_20240101_120500");

        FrameWindow window = new FrameLoader(source).loadWindow(at("KTLX_20240101_120500"), "KTLX", 3, null);

        assertEquals(2, window.size());
        assertEquals("KTLX_20240101_120000", window.get(0).getFileName());
        assertEquals("KTLX_20240101_120500", window.get(1).getFileName());
        assertTrue(window.get(0).getFileTime().before(window.get(1).getFileTime()));
        assertEquals(Arrays.asList("KTLX_20240101_120500", "KTLX_20240101_120000"), source.getFetched());
    }

    @Test
    public void releaseFreesLoadedScansThroughDataSource() {
        FakeRadarDataSource source = new FakeRadarDataSource().add(NAMES).failOn("KTLX_20240101_120500");
        FrameLoader loader = new FrameLoader(source);
        FrameWindow window = loader.loadWindow(at("KTLX_20240101_121500"), "KTLX", 3, null);
        Frame loaded = window.get(2);
        RadarScan scan = loaded.getScan();

        loader.release(window);

        assertEquals(2, source.getFreed().size());
        assertTrue(source.getFreed().contains(scan));
        assertTrue(scan.isReleased());
        assertFalse(loaded.isLoaded());
        assertTrue(window.isEmpty());
    }
}
