package com.radarloop.rendering;

import com.radarloop.exception.ConfigurationException;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Colour table for one radar moment. A value maps to entry {@code (value + shift) * scale},
 * clamped to the table.
 * <p>
 * Text format, one item per line, {@code #} starts a comment:
 * <pre>
 * name Reflectivity
 * scale 0.2
 * shift 0
 * 93 225 117 255
 * ...
 * </pre>
 */
public class Colormap {

    protected final String name;
    protected final float scale;
    protected final float shift;
    protected final int[] colors;

    public Colormap(String name, float scale, float shift, int[] colors) {
        if (colors.length == 0) {
            throw new IllegalArgumentException("colormap " + name + " has no colours");
        }
        this.name = name;
        this.scale = scale;
        this.shift = shift;
        this.colors = colors.clone();
    }

    /**
     * @return ARGB colour for {@code value}, fully transparent for NaN
     */
    public int getColor(float value) {
        if (Float.isNaN(value)) {
            return 0;
        }
        int index = (int) Math.floor((value + shift) * scale);
        if (index < 0) {
            index = 0;
        }
        if (index >= colors.length) {
            index = colors.length - 1;
        }
        return colors[index];
    }

    public String getName() {
        return name;
    }

    public int size() {
        return colors.length;
    }

    public static Colormap read(String source, InputStream stream) throws IOException {
        BufferedReader reader = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8));
        String name = source;
        float scale = 1.0f;
        float shift = 0.0f;
        List<Integer> colors = new ArrayList<Integer>();
        String line;
        int lineNumber = 0;
        while ((line = reader.readLine()) != null) {
            lineNumber++;
            int comment = line.indexOf('#');
            if (comment >= 0) {
                line = line.substring(0, comment);
            }
            line = line.trim();
            if (line.isEmpty()) {
                continue;
            }
            String[] parts = line.split("\\s+");
            try {
                if ("name".equals(parts[0])) {
                    name = line.substring(4).trim();
                } else if ("scale".equals(parts[0])) {
                    scale = Float.parseFloat(parts[1]);
                } else if ("shift".equals(parts[0])) {
                    shift = Float.parseFloat(parts[1]);
                } else if (parts.length == 4) {
                    int r = Integer.parseInt(parts[0]);
                    int g = Integer.parseInt(parts[1]);
                    int b = Integer.parseInt(parts[2]);
                    int a = Integer.parseInt(parts[3]);
                    colors.add((a & 0xFF) << 24 | (r & 0xFF) << 16 | (g & 0xFF) << 8 | (b & 0xFF));
                } else {
                    throw new ConfigurationException(source + ":" + lineNumber + ": unrecognized colormap line [" + line + "]");
                }
            } catch (NumberFormatException | ArrayIndexOutOfBoundsException ex) {
                throw new ConfigurationException(source + ":" + lineNumber + ": bad colormap line [" + line + "]");
            }
        }
        int[] table = new int[colors.size()];
        for (int index = 0; index < table.length; index++) {
            table[index] = colors.get(index);
        }
        return new Colormap(name, scale, shift, table);
    }

    @Override
    public String toString() {
        return "Colormap{" + name + ", " + colors.length + " colours}";
    }
}
