package com.radarloop.services;

import com.radarloop.exception.DecodeFailureException;
import com.radarloop.model.LatLongCoordinates;
import com.radarloop.model.RadarRay;
import com.radarloop.model.RadarScan;
import com.radarloop.model.RadarSweep;
import com.radarloop.model.RadarVolume;
import com.radarloop.model.RayTime;
import com.radarloop.model.VolumeType;
import com.radarloop.util.SweepTimeExtractor;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import ucar.ma2.Array;
import ucar.ma2.DataType;
import ucar.ma2.Index;
import ucar.nc2.Attribute;
import ucar.nc2.NetcdfFile;
import ucar.nc2.Variable;
import ucar.nc2.units.DateUnit;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Calendar;
import java.util.Date;
import java.util.List;
import java.util.TimeZone;

/**
 * Reads a WSR-88D Level II archive (optionally bzip2/gzip compressed) through NetCDF-Java and
 * copies the moments into a {@link RadarScan}.
 */
public class Level2Decoder {

    public static final String TAG = "LEVEL2DECODER";

    private static final Logger LOG = LogManager.getLogger(TAG);

    /** Raw byte codes 0 (below threshold) and 1 (range folded) carry no value. */
    protected static final int MAX_FLAG_CODE = 1;

    protected static final String[][] MOMENT_VARIABLES = {
            {"Reflectivity_HI", "Reflectivity"},
            {"RadialVelocity_HI", "RadialVelocity"},
            {"SpectrumWidth_HI", "SpectrumWidth"}
    };
    /** Coordinate variable suffixes per moment. Spectrum width may share the velocity coordinates. */
    protected static final String[][] COORDINATE_SUFFIXES = {
            {"R"},
            {"V"},
            {"W", "V"}
    };

    protected final boolean mergeSplitCutsOff;

    /**
     * @param mergeSplitCutsOff keep every sweep of a split cut instead of only the first one at each elevation
     */
    public Level2Decoder(boolean mergeSplitCutsOff) {
        this.mergeSplitCutsOff = mergeSplitCutsOff;
    }

    public RadarScan decode(File file, String site) throws DecodeFailureException {
        NetcdfFile ncFile = null;
        try {
            ncFile = NetcdfFile.open(file.getAbsolutePath());
            RadarScan scan = new RadarScan(site, readLocation(ncFile));
            for (VolumeType type : VolumeType.values()) {
                RadarVolume volume = readVolume(ncFile, type);
                if (volume != null) {
                    scan.addVolume(volume);
                }
            }
            if (scan.getVolumes().isEmpty()) {
                throw new DecodeFailureException("no radar moments found in " + file.getName());
            }
            LOG.debug("decoded " + file.getName() + " with " + scan.getVolumes().size() + " volumes");
            return scan;
        } catch (IOException ex) {
            throw new DecodeFailureException("cannot read " + file.getName() + ": " + ex.getMessage(), ex);
        } catch (DecodeFailureException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            throw new DecodeFailureException("malformed Level II file " + file.getName() + ": " + ex, ex);
        } finally {
            if (ncFile != null) {
                try {
                    ncFile.close();
                } catch (IOException ex) {
                    LOG.warn("error closing " + file.getName(), ex);
                }
            }
        }
    }

    protected LatLongCoordinates readLocation(NetcdfFile ncFile) {
        Attribute latitude = ncFile.findGlobalAttribute("StationLatitude");
        Attribute longitude = ncFile.findGlobalAttribute("StationLongitude");
        if (latitude == null || longitude == null
                || latitude.getNumericValue() == null || longitude.getNumericValue() == null) {
            return null;
        }
        return new LatLongCoordinates(latitude.getNumericValue().doubleValue(),
                longitude.getNumericValue().doubleValue());
    }

    protected RadarVolume readVolume(NetcdfFile ncFile, VolumeType type) throws IOException {
        int typeIndex = type.getId();
        for (String momentName : MOMENT_VARIABLES[typeIndex]) {
            Variable moment = ncFile.findVariable(momentName);
            if (moment == null) {
                continue;
            }
            String hiSuffix = momentName.endsWith("_HI") ? "_HI" : "";
            for (String coordinates : COORDINATE_SUFFIXES[typeIndex]) {
                String suffix = coordinates + hiSuffix;
                Variable time = ncFile.findVariable("time" + suffix);
                if (time == null) {
                    continue;
                }
                List<RadarSweep> sweeps = readSweeps(ncFile, moment, suffix);
                if (!mergeSplitCutsOff) {
                    sweeps = firstSweepPerElevation(sweeps);
                }
                return new RadarVolume(typeIndex, sweeps);
            }
        }
        return null;
    }

    protected List<RadarSweep> readSweeps(NetcdfFile ncFile, Variable moment, String suffix) throws IOException {
        Variable timeVar = ncFile.findVariable("time" + suffix);
        Variable elevationVar = ncFile.findVariable("elevation" + suffix);
        Variable azimuthVar = ncFile.findVariable("azimuth" + suffix);
        Variable distanceVar = ncFile.findVariable("distance" + suffix);
        Variable numRadialsVar = ncFile.findVariable("numRadials" + suffix);
        if (elevationVar == null || azimuthVar == null || distanceVar == null) {
            throw new DecodeFailureException("incomplete coordinates for " + moment.getFullName());
        }
        DateUnit timeUnit;
        try {
            timeUnit = new DateUnit(timeVar.getUnitsString());
        } catch (Exception ex) {
            throw new DecodeFailureException("unreadable time units [" + timeVar.getUnitsString() + "]", ex);
        }
        Array data = moment.read();
        Array times = timeVar.read();
        Array elevations = elevationVar.read();
        Array azimuths = azimuthVar.read();
        Array distances = distanceVar.read();
        Array numRadials = numRadialsVar == null ? null : numRadialsVar.read();

        float scale = attributeValue(moment, "scale_factor", 1.0f);
        float offset = attributeValue(moment, "add_offset", 0.0f);
        boolean packed = moment.getDataType() == DataType.BYTE;

        int[] shape = data.getShape();
        int scanCount = shape[0];
        int radialCount = shape[1];
        int gateCount = shape[2];
        float firstGate = distances.getSize() > 0 ? distances.getFloat(0) : 0f;
        float gateSpacing = distances.getSize() > 1 ? distances.getFloat(1) - firstGate : 0f;

        Index dataIndex = data.getIndex();
        Index rayIndex = times.getIndex();
        Index angleIndex = elevations.getIndex();
        Index azimuthIndex = azimuths.getIndex();
        Calendar calendar = Calendar.getInstance(TimeZone.getTimeZone("UTC"));
        List<RadarSweep> sweeps = new ArrayList<RadarSweep>();
        for (int s = 0; s < scanCount; s++) {
            int rays = numRadials == null ? radialCount : Math.min(radialCount, numRadials.getInt(s));
            List<RadarRay> rayList = new ArrayList<RadarRay>(rays);
            double elevationSum = 0;
            for (int r = 0; r < rays; r++) {
                float elevation = elevations.getFloat(angleIndex.set(s, r));
                float azimuth = azimuths.getFloat(azimuthIndex.set(s, r));
                if (Float.isNaN(elevation) || Float.isNaN(azimuth)) {
                    continue;
                }
                Date date = timeUnit.makeDate(times.getDouble(rayIndex.set(s, r)));
                calendar.setTime(date);
                float[] bins = new float[gateCount];
                for (int g = 0; g < gateCount; g++) {
                    dataIndex.set(s, r, g);
                    if (packed) {
                        int raw = data.getByte(dataIndex) & 0xFF;
                        bins[g] = raw <= MAX_FLAG_CODE ? Float.NaN : raw * scale + offset;
                    } else {
                        bins[g] = data.getFloat(dataIndex);
                    }
                }
                rayList.add(new RadarRay(RayTime.fromCalendar(calendar), azimuth, elevation, bins));
                elevationSum += elevation;
            }
            float sweepElevation = rayList.isEmpty() ? 0f : (float) (elevationSum / rayList.size());
            // round to the hundredth shown in the sweep selectors
            sweepElevation = Math.round(sweepElevation * 100f) / 100f;
            sweeps.add(new RadarSweep(sweepElevation, firstGate, gateSpacing, rayList));
        }
        return sweeps;
    }

    /**
     * Keep the earliest sweep at each elevation, dropping the repeated cuts of split-cut patterns.
     */
    protected List<RadarSweep> firstSweepPerElevation(List<RadarSweep> sweeps) {
        List<RadarSweep> kept = new ArrayList<RadarSweep>();
        for (RadarSweep sweep : sweeps) {
            SweepTimeExtractor.TimeRange range = SweepTimeExtractor.sweepTimeRange(sweep);
            int match = -1;
            for (int i = 0; i < kept.size(); i++) {
                if (SweepTimeExtractor.sameElevation(kept.get(i).getElevation(), sweep.getElevation())) {
                    match = i;
                    break;
                }
            }
            if (match < 0) {
                kept.add(sweep);
                continue;
            }
            SweepTimeExtractor.TimeRange keptRange = SweepTimeExtractor.sweepTimeRange(kept.get(match));
            if (range != null && (keptRange == null || range.getStart().isBefore(keptRange.getStart()))) {
                kept.set(match, sweep);
            }
        }
        return kept;
    }

    private float attributeValue(Variable variable, String name, float defaultValue) {
        Attribute attribute = variable.findAttribute(name);
        if (attribute == null || attribute.getNumericValue() == null) {
            return defaultValue;
        }
        return attribute.getNumericValue().floatValue();
    }
}
