package com.radarloop.model;

import java.io.Serializable;
import java.util.Locale;

/**
 * Geographic position in decimal degrees.
 */
public class LatLongCoordinates implements Serializable {
    protected double latitude;
    protected double longitude;

    public LatLongCoordinates(double latitude, double longitude) {
        this.latitude = latitude;
        this.longitude = longitude;
    }

    public double getLatitude() {
        return latitude;
    }

    public double getLongitude() {
        return longitude;
    }

    /**
     * Short display form, e.g. {@code 35.33N 97.28W}.
     */
    public String format() {
        return String.format(Locale.US, "%.2f%s %.2f%s", Math.abs(latitude), latitude < 0 ? "S" : "N",
                Math.abs(longitude), longitude < 0 ? "W" : "E");
    }

    @Override
    public String toString() {
        return "LatLongCoordinates{" +
                "latitude=" + latitude +
                ", longitude=" + longitude +
                '}';
    }
}
