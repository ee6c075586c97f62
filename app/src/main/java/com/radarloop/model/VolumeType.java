package com.radarloop.model;

/**
 * Radar moments carried by a Level II file. The ids match the volume indexes used by the
 * renderer and the colour tables.
 */
public enum VolumeType {
    REFLECTIVITY(0, "Reflectivity", "dBZ"),
    VELOCITY(1, "Radial Velocity", "m/s"),
    SPECTRUM_WIDTH(2, "Spectrum Width", "m/s");

    protected final int id;
    protected final String description;
    protected final String units;

    VolumeType(int id, String description, String units) {
        this.id = id;
        this.description = description;
        this.units = units;
    }

    public int getId() {
        return id;
    }

    public String getDescription() {
        return description;
    }

    public String getUnits() {
        return units;
    }

    public static VolumeType forId(int id) {
        for (VolumeType type : values()) {
            if (type.id == id) {
                return type;
            }
        }
        return null;
    }
}
