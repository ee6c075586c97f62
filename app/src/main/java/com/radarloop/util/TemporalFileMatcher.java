package com.radarloop.util;

import java.util.ArrayList;
import java.util.Calendar;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TimeZone;

/**
 * Finds the archive file closest to a point in time. File names carry a fixed-width UTC stamp
 * {@code yyyyMMdd_HHmm[ss]} at a known offset, e.g. {@code KTLX_20130520_201643_V06} at offset 5.
 */
public final class TemporalFileMatcher {

    /** Offset of the timestamp in Level II archive names ({@code SITE_yyyyMMdd_HHmmss}). */
    public static final int LEVEL2_TIMESTAMP_OFFSET = 5;

    private static final int[] FIELD_WIDTHS = {4, 2, 2, -1, 2, 2, 2};

    private TemporalFileMatcher() {
    }

    /**
     * Candidates ordered and de-duplicated by stamp, plus the position of the one nearest the target.
     */
    public static class NearestMatch {
        protected final List<String> orderedNames;
        protected final int nearestIndex;

        NearestMatch(List<String> orderedNames, int nearestIndex) {
            this.orderedNames = orderedNames;
            this.nearestIndex = nearestIndex;
        }

        /** Candidates oldest first, one name per stamp. */
        public List<String> getOrderedNames() {
            return orderedNames;
        }

        /** Position of the nearest name in {@link #getOrderedNames()}, or -1 if there were no candidates. */
        public int getNearestIndex() {
            return nearestIndex;
        }

        public boolean isEmpty() {
            return nearestIndex < 0;
        }

        public String getNearest() {
            return nearestIndex < 0 ? null : orderedNames.get(nearestIndex);
        }

        /**
         * @return the nearest name followed by successively older ones, at most {@code limit} entries
         */
        public List<String> nearestAndOlder(int limit) {
            List<String> result = new ArrayList<String>();
            for (int index = nearestIndex; index >= 0 && result.size() < limit; index--) {
                result.add(orderedNames.get(index));
            }
            return result;
        }
    }

    /**
     * Parse the stamp at {@code offset}. Parsing is best effort: a field that has no digits ends
     * the scan and the remaining fields keep their defaults, so malformed names still map to some
     * instant instead of failing.
     *
     * @param name file name
     * @param offset position of the stamp within the name
     * @return UTC calendar for the stamp
     */
    public static Calendar parseTimestamp(String name, int offset) {
        int[] fields = {1970, 1, 1, 0, 0, 0, 0};
        int position = Math.max(0, offset);
        for (int field = 0; field < FIELD_WIDTHS.length && name != null; field++) {
            int width = FIELD_WIDTHS[field];
            if (width < 0) {
                // separator between date and time
                if (position < name.length() && !Character.isDigit(name.charAt(position))) {
                    position++;
                }
                continue;
            }
            int value = 0;
            int digits = 0;
            while (digits < width && position < name.length() && Character.isDigit(name.charAt(position))) {
                value = value * 10 + (name.charAt(position) - '0');
                position++;
                digits++;
            }
            if (digits == 0) {
                break;
            }
            fields[field] = value;
        }
        Calendar calendar = Calendar.getInstance(TimeZone.getTimeZone("UTC"));
        calendar.clear();
        calendar.setLenient(true);
        calendar.set(fields[0], fields[1] - 1, fields[2], fields[4], fields[5], fields[6]);
        return calendar;
    }

    /**
     * Find the candidate closest in time to {@code target}. On a tie the candidate seen first wins.
     *
     * @return the nearest name, or null when there are no candidates
     */
    public static String nearest(Calendar target, Collection<String> candidates, int offset) {
        String nearestName = null;
        long nearestDistance = Long.MAX_VALUE;
        long targetMillis = target.getTimeInMillis();
        for (String candidate : candidates) {
            long distance = Math.abs(targetMillis - parseTimestamp(candidate, offset).getTimeInMillis());
            if (nearestName == null || distance < nearestDistance) {
                nearestName = candidate;
                nearestDistance = distance;
            }
        }
        return nearestName;
    }

    /**
     * Sort the candidates by stamp, keep one name per stamp and locate the one nearest
     * {@code target}, so callers can walk contiguously towards older files. Of several names
     * carrying the same stamp the one seen first is kept.
     */
    public static NearestMatch nearestSorted(Calendar target, Collection<String> candidates, int offset) {
        final Map<Long, String> byTime = new LinkedHashMap<Long, String>();
        for (String name : candidates) {
            long millis = parseTimestamp(name, offset).getTimeInMillis();
            if (!byTime.containsKey(millis)) {
                byTime.put(millis, name);
            }
        }
        List<Long> times = new ArrayList<Long>(byTime.keySet());
        Collections.sort(times);
        List<String> ordered = new ArrayList<String>(times.size());
        for (Long millis : times) {
            ordered.add(byTime.get(millis));
        }
        int nearestIndex = -1;
        long nearestDistance = Long.MAX_VALUE;
        long targetMillis = target.getTimeInMillis();
        for (int index = 0; index < times.size(); index++) {
            long distance = Math.abs(targetMillis - times.get(index));
            if (distance < nearestDistance) {
                nearestIndex = index;
                nearestDistance = distance;
            }
        }
        return new NearestMatch(ordered, nearestIndex);
    }
}
