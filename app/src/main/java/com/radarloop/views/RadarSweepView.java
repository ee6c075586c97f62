package com.radarloop.views;

import com.radarloop.model.Frame;
import com.radarloop.model.RadarScan;
import com.radarloop.model.RadarSweep;
import com.radarloop.model.RadarVolume;
import com.radarloop.model.RayTime;
import com.radarloop.model.VolumeType;
import com.radarloop.rendering.FrameRenderer;
import com.radarloop.rendering.SweepImageRenderer;
import com.radarloop.util.SweepTimeExtractor;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.swing.JComponent;
import javax.swing.SwingUtilities;
import java.awt.Color;
import java.awt.Dimension;
import java.awt.Graphics;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;

/**
 * Shows the one visible frame of a site's animation as a plan view of the selected sweep, with the
 * sweep's time range and the site name. Sweep images are painted on a background thread and
 * cached per frame.
 */
public class RadarSweepView extends JComponent implements FrameRenderer {

    public static final String TAG = "RadarSweepView";

    private static final Logger LOG = LogManager.getLogger(TAG);

    /** Edge of the cached sweep images, in pixels. */
    protected static final int IMAGE_SIZE = 1024;

    protected final String site;
    protected final SweepImageRenderer imageRenderer;
    protected final Map<Frame, BufferedImage> images = new ConcurrentHashMap<Frame, BufferedImage>();
    protected final Map<Frame, String> captions = new ConcurrentHashMap<Frame, String>();
    protected final ExecutorService renderExecutor;

    protected volatile Frame visibleFrame;

    public RadarSweepView(String site, SweepImageRenderer imageRenderer) {
        this.site = site;
        this.imageRenderer = imageRenderer;
        this.renderExecutor = Executors.newSingleThreadExecutor(new ThreadFactory() {
            @Override
            public Thread newThread(Runnable runnable) {
                Thread thread = new Thread(runnable, "sweep-render-" + RadarSweepView.this.site);
                thread.setDaemon(true);
                return thread;
            }
        });
        setPreferredSize(new Dimension(640, 640));
        setOpaque(true);
    }

    @Override
    public void show(Frame frame) {
        frame.setHidden(false);
        visibleFrame = frame;
        repaint();
    }

    @Override
    public void hide(Frame frame) {
        frame.setHidden(true);
        if (visibleFrame == frame) {
            visibleFrame = null;
        }
    }

    @Override
    public void requestRedraw() {
        repaint();
    }

    @Override
    public void setIso(final Frame frame, float level, boolean async) {
        frame.setIsoLevel(level);
        Runnable work = new Runnable() {
            @Override
            public void run() {
                paintFrame(frame);
            }
        };
        if (async) {
            submit(work);
        } else {
            work.run();
        }
    }

    @Override
    public CompletableFuture<Void> setSweep(final Frame frame, int volumeId, int sweepIndex) {
        frame.setSelectedSweep(volumeId, sweepIndex, elevationOf(frame.getScan(), volumeId, sweepIndex));
        final CompletableFuture<Void> ready = new CompletableFuture<Void>();
        final Runnable complete = new Runnable() {
            @Override
            public void run() {
                ready.complete(null);
            }
        };
        boolean queued = submit(new Runnable() {
            @Override
            public void run() {
                try {
                    paintFrame(frame);
                } finally {
                    SwingUtilities.invokeLater(complete);
                }
            }
        });
        if (!queued) {
            SwingUtilities.invokeLater(complete);
        }
        return ready;
    }

    @Override
    public void remove(Frame frame) {
        images.remove(frame);
        captions.remove(frame);
        if (visibleFrame == frame) {
            visibleFrame = null;
        }
        repaint();
    }

    /**
     * Stop the background painter. Pending sweep changes still complete.
     */
    public void dispose() {
        renderExecutor.shutdown();
    }

    protected void paintFrame(Frame frame) {
        int volumeId = frame.getSelectedVolumeId();
        int sweepIndex = frame.getSelectedSweepId();
        RadarScan scan = frame.getScan();
        if (volumeId == Frame.SELECTED_VOLUME_ID_NONE || scan == null) {
            return;
        }
        BufferedImage image = imageRenderer.render(scan, volumeId, sweepIndex, frame.getIsoLevel(), IMAGE_SIZE);
        if (image == null) {
            LOG.debug("nothing to paint for " + frame + " volume " + volumeId + " sweep " + sweepIndex);
            return;
        }
        images.put(frame, image);
        captions.put(frame, caption(scan, volumeId, sweepIndex));
        repaint();
    }

    private boolean submit(Runnable work) {
        try {
            renderExecutor.execute(work);
            return true;
        } catch (RejectedExecutionException ex) {
            LOG.debug("render request after dispose for " + site);
            return false;
        }
    }

    private String caption(RadarScan scan, int volumeId, int sweepIndex) {
        RadarVolume volume = scan.getVolume(volumeId);
        RadarSweep sweep = volume == null ? null : volume.getSweep(sweepIndex);
        StringBuilder text = new StringBuilder(site);
        if (scan.getLocation() != null) {
            text.append(' ').append(scan.getLocation().format());
        }
        VolumeType type = VolumeType.forId(volumeId);
        if (type != null) {
            text.append("  ").append(type.getDescription());
        }
        if (sweep != null) {
            text.append(String.format(" %.2f°", sweep.getElevation()));
            SweepTimeExtractor.TimeRange range = SweepTimeExtractor.sweepTimeRange(sweep);
            if (range != null) {
                text.append("  ").append(RayTime.formatRange(range.getStart(), range.getFinish()));
            }
        }
        return text.toString();
    }

    private static float elevationOf(RadarScan scan, int volumeId, int sweepIndex) {
        RadarVolume volume = scan == null ? null : scan.getVolume(volumeId);
        RadarSweep sweep = volume == null ? null : volume.getSweep(sweepIndex);
        return sweep == null ? Float.NaN : sweep.getElevation();
    }

    @Override
    protected void paintComponent(Graphics g) {
        Graphics2D g2 = (Graphics2D) g;
        g2.setColor(Color.BLACK);
        g2.fillRect(0, 0, getWidth(), getHeight());
        Frame frame = visibleFrame;
        if (frame == null) {
            return;
        }
        BufferedImage image = images.get(frame);
        if (image != null) {
            int edge = Math.min(getWidth(), getHeight());
            int x = (getWidth() - edge) / 2;
            int y = (getHeight() - edge) / 2;
            g2.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BILINEAR);
            g2.drawImage(image, x, y, edge, edge, null);
        }
        String caption = captions.get(frame);
        if (caption != null) {
            g2.setColor(Color.WHITE);
            g2.drawString(caption, 8, getHeight() - 8);
        }
    }
}
