package com.radarloop.rendering;

import com.radarloop.exception.ConfigurationException;
import com.radarloop.model.VolumeType;
import org.apache.commons.io.IOUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Colour tables for every moment, loaded once at startup and shared read-only.
 */
public final class ColormapRegistry {

    public static final String TAG = "COLORMAPS";

    private static final Logger LOG = LogManager.getLogger(TAG);

    private final Map<VolumeType, Colormap> colormaps;

    public ColormapRegistry(Map<VolumeType, Colormap> colormaps) {
        this.colormaps = Collections.unmodifiableMap(new EnumMap<VolumeType, Colormap>(colormaps));
    }

    /**
     * Load the bundled tables from {@code /colormaps/<moment>.clr}.
     */
    public static ColormapRegistry loadDefaults() {
        Map<VolumeType, Colormap> maps = new EnumMap<VolumeType, Colormap>(VolumeType.class);
        for (VolumeType type : VolumeType.values()) {
            String resource = "/colormaps/" + type.name().toLowerCase() + ".clr";
            InputStream stream = ColormapRegistry.class.getResourceAsStream(resource);
            if (stream == null) {
                throw new ConfigurationException("missing colormap resource " + resource);
            }
            try {
                maps.put(type, Colormap.read(resource, stream));
            } catch (IOException ex) {
                throw new ConfigurationException("cannot read colormap " + resource + ": " + ex.getMessage());
            } finally {
                IOUtils.closeQuietly(stream);
            }
        }
        LOG.debug("loaded colormaps " + maps.values());
        return new ColormapRegistry(maps);
    }

    /**
     * @return the table for {@code volumeId}, falling back to reflectivity for unknown ids
     */
    public Colormap get(int volumeId) {
        VolumeType type = VolumeType.forId(volumeId);
        Colormap colormap = type == null ? null : colormaps.get(type);
        return colormap != null ? colormap : colormaps.get(VolumeType.REFLECTIVITY);
    }
}
