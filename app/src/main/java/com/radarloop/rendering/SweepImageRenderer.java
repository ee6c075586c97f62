package com.radarloop.rendering;

import com.radarloop.model.RadarRay;
import com.radarloop.model.RadarScan;
import com.radarloop.model.RadarSweep;
import com.radarloop.model.RadarVolume;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.geom.Path2D;
import java.awt.image.BufferedImage;
import java.util.List;

/**
 * Paints one sweep into a square image centred on the radar. Each run of gates with the same
 * colour along a ray becomes one polygon between the ray's neighbouring azimuth edges.
 */
public class SweepImageRenderer {

    protected final ColormapRegistry colormaps;

    public SweepImageRenderer(ColormapRegistry colormaps) {
        this.colormaps = colormaps;
    }

    /**
     * @param isoLevel gates below this value are left transparent; NaN draws everything
     * @param size edge length of the image in pixels
     * @return the image, or null if the scan has no such sweep
     */
    public BufferedImage render(RadarScan scan, int volumeId, int sweepIndex, float isoLevel, int size) {
        if (scan == null || scan.isReleased()) {
            return null;
        }
        RadarVolume volume = scan.getVolume(volumeId);
        RadarSweep sweep = volume == null ? null : volume.getSweep(sweepIndex);
        if (sweep == null) {
            return null;
        }
        BufferedImage image = new BufferedImage(size, size, BufferedImage.TYPE_INT_ARGB);
        Graphics2D canvas = image.createGraphics();
        try {
            canvas.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_OFF);
            paintSweep(canvas, sweep, colormaps.get(volumeId), isoLevel, size);
        } finally {
            canvas.dispose();
        }
        return image;
    }

    protected void paintSweep(Graphics2D canvas, RadarSweep sweep, Colormap colormap, float isoLevel, int size) {
        List<RadarRay> rays = sweep.getRays();
        if (rays.isEmpty()) {
            return;
        }
        int maxBins = 0;
        for (RadarRay ray : rays) {
            maxBins = Math.max(maxBins, ray.getBinCount());
        }
        float maxRange = sweep.getFirstGateMeters() + sweep.getGateSpacingMeters() * maxBins;
        if (maxRange <= 0) {
            return;
        }
        double center = size / 2.0;
        double pixelsPerMeter = center / maxRange;
        double halfBeam = 180.0 / rays.size();
        Path2D.Float polygon = new Path2D.Float();
        for (RadarRay ray : rays) {
            float[] bins = ray.getBins();
            if (bins == null) {
                continue;
            }
            double startAngle = Math.toRadians(ray.getAzimuth() - halfBeam);
            double endAngle = Math.toRadians(ray.getAzimuth() + halfBeam);
            int runStart = -1;
            int runColor = 0;
            for (int gate = 0; gate <= bins.length; gate++) {
                int color = 0;
                if (gate < bins.length) {
                    float value = bins[gate];
                    if (!Float.isNaN(value) && (Float.isNaN(isoLevel) || value >= isoLevel)) {
                        color = colormap.getColor(value);
                    }
                }
                if (runStart >= 0 && color == runColor) {
                    continue;
                }
                if (runStart >= 0 && runColor != 0) {
                    double near = (sweep.getFirstGateMeters() + runStart * sweep.getGateSpacingMeters()) * pixelsPerMeter;
                    double far = (sweep.getFirstGateMeters() + gate * sweep.getGateSpacingMeters()) * pixelsPerMeter;
                    polygon.reset();
                    polygon.moveTo(center + near * Math.sin(startAngle), center - near * Math.cos(startAngle));
                    polygon.lineTo(center + far * Math.sin(startAngle), center - far * Math.cos(startAngle));
                    polygon.lineTo(center + far * Math.sin(endAngle), center - far * Math.cos(endAngle));
                    polygon.lineTo(center + near * Math.sin(endAngle), center - near * Math.cos(endAngle));
                    polygon.closePath();
                    canvas.setColor(new Color(runColor, true));
                    canvas.fill(polygon);
                }
                runStart = gate;
                runColor = color;
            }
        }
    }
}
