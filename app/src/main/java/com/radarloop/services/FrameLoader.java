package com.radarloop.services;

import com.radarloop.exception.ConfigurationException;
import com.radarloop.exception.NoCandidateFilesException;
import com.radarloop.exception.RadarLoopException;
import com.radarloop.model.Frame;
import com.radarloop.model.FrameLoadProgressEvent;
import com.radarloop.model.FrameWindow;
import com.radarloop.model.RadarScan;
import com.radarloop.util.RadarFileUtils;
import com.radarloop.util.TemporalFileMatcher;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.File;
import java.util.Calendar;
import java.util.List;

/**
 * Builds the frame window for a site: the file nearest the anchor time and the files just older
 * than it, each fetched and decoded in turn. A file that cannot be fetched or decoded leaves an
 * empty frame in its slot and loading carries on with the next one.
 */
public class FrameLoader {

    public static final String TAG = "FRAMELOADER";

    private static final Logger LOG = LogManager.getLogger(TAG);

    /**
     * Told about each step of a window load. Called on the loading thread.
     */
    public interface Listener {

        void onProgress(FrameLoadProgressEvent event);

        /**
         * A slot has been resolved, loaded or not. Frames arrive nearest first.
         */
        void onFrameReady(Frame frame);

        /**
         * Polled between files; returning true abandons the rest of the window.
         */
        boolean isCancelled();
    }

    protected final RadarDataSource dataSource;

    public FrameLoader(RadarDataSource dataSource) {
        this.dataSource = dataSource;
    }

    /**
     * @param anchorTime time the newest frame should be nearest to
     * @param site radar site identifier, e.g. {@code KTLX}
     * @param maxFrames window size, must be positive
     * @param listener progress receiver, may be null
     * @return the window, oldest frame first
     * @throws ConfigurationException if {@code maxFrames} is not positive
     * @throws NoCandidateFilesException if the archive has nothing for the site
     */
    public FrameWindow loadWindow(Calendar anchorTime, final String site, int maxFrames, final Listener listener) {
        if (maxFrames <= 0) {
            throw new ConfigurationException("the animation frame count must be greater than zero, got " + maxFrames);
        }
        List<String> candidates = dataSource.listCandidates(site, RadarFileUtils.LEVEL2_NAME_PATTERN);
        TemporalFileMatcher.NearestMatch match = TemporalFileMatcher.nearestSorted(anchorTime, candidates,
                TemporalFileMatcher.LEVEL2_TIMESTAMP_OFFSET);
        if (match.isEmpty()) {
            throw new NoCandidateFilesException(site);
        }
        final List<String> names = match.nearestAndOlder(maxFrames);
        LOG.debug("loading " + names.size() + " frames for " + site + " starting at " + match.getNearest());
        FrameWindow window = new FrameWindow(maxFrames);
        for (int slot = 0; slot < names.size(); slot++) {
            if (listener != null && listener.isCancelled()) {
                LOG.debug("window load for " + site + " cancelled at slot " + slot);
                break;
            }
            final String name = names.get(slot);
            final int currentSlot = slot;
            Calendar fileTime = TemporalFileMatcher.parseTimestamp(name, TemporalFileMatcher.LEVEL2_TIMESTAMP_OFFSET);
            publish(listener, new FrameLoadProgressEvent(site, slot, names.size(), name,
                    FrameLoadProgressEvent.Status.FETCHING, 0, -1));
            Frame frame;
            try {
                File localFile = dataSource.fetch(site, name, new FetchProgressListener() {
                    @Override
                    public void onProgress(long bytesRead, long bytesTotal) {
                        publish(listener, new FrameLoadProgressEvent(site, currentSlot, names.size(), name,
                                FrameLoadProgressEvent.Status.FETCHING, bytesRead, bytesTotal));
                    }
                });
                RadarScan scan = dataSource.decode(localFile, site);
                frame = new Frame(slot, site, name, fileTime, scan);
                publish(listener, new FrameLoadProgressEvent(site, slot, names.size(), name,
                        FrameLoadProgressEvent.Status.LOADED, localFile.length(), localFile.length()));
            } catch (RadarLoopException ex) {
                LOG.warn("skipping " + name + " for " + site + ": " + ex.getMessage());
                frame = Frame.failed(slot, site, name, fileTime, ex.getMessage());
                publish(listener, new FrameLoadProgressEvent(site, slot, names.size(), name,
                        FrameLoadProgressEvent.Status.FAILED, 0, -1));
            }
            window.addOldest(frame);
            if (listener != null) {
                listener.onFrameReady(frame);
            }
        }
        return window;
    }

    /**
     * Free the scan of every frame through the data source and empty the window. The frames must
     * already be off screen.
     */
    public void release(FrameWindow window) {
        int freed = 0;
        for (Frame frame : window.getFrames()) {
            RadarScan scan = frame.detachScan();
            if (scan != null) {
                dataSource.free(scan);
                freed++;
            }
        }
        window.clear();
        LOG.debug("freed " + freed + " scans");
    }

    private void publish(Listener listener, FrameLoadProgressEvent event) {
        if (listener != null) {
            listener.onProgress(event);
        }
    }
}
