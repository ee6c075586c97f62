package com.radarloop.util;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Calendar;
import java.util.Collections;
import java.util.List;
import java.util.TimeZone;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class TemporalFileMatcherTest {

    private static Calendar utc(int year, int month, int day, int hour, int minute, int second) {
        Calendar calendar = Calendar.getInstance(TimeZone.getTimeZone("UTC"));
        calendar.clear();
        calendar.set(year, month - 1, day, hour, minute, second);
        return calendar;
    }

    @Test
    public void parsesLevel2Name() {
        Calendar parsed = TemporalFileMatcher.parseTimestamp("KTLX_20130520_201643_V06", 5);
        assertEquals(utc(2013, 5, 20, 20, 16, 43).getTimeInMillis(), parsed.getTimeInMillis());
    }

    @Test
    public void missingSecondsDefaultToZero() {
        Calendar parsed = TemporalFileMatcher.parseTimestamp("KTLX_20130520_2016", 5);
        assertEquals(utc(2013, 5, 20, 20, 16, 0).getTimeInMillis(), parsed.getTimeInMillis());
    }

    @Test
    public void malformedNameStillParses() {
        Calendar parsed = TemporalFileMatcher.parseTimestamp("KTLX_2013xx", 5);
        assertEquals(utc(2013, 1, 1, 0, 0, 0).getTimeInMillis(), parsed.getTimeInMillis());
    }

    @Test
    public void nearestPicksClosestStamp() {
        List<String> names = Arrays.asList("KTLX_20240101_120000", "KTLX_20240101_121000", "KTLX_20240101_122000");
        assertEquals("KTLX_20240101_121000",
                TemporalFileMatcher.nearest(utc(2024, 1, 1, 12, 12, 0), names, 5));
        assertEquals("KTLX_20240101_122000",
                TemporalFileMatcher.nearest(utc(2024, 1, 2, 0, 0, 0), names, 5));
    }

    @Test
    public void tieGoesToFirstCandidate() {
        List<String> names = Arrays.asList("KTLX_20240101_121000", "KTLX_20240101_120000");
        assertEquals("KTLX_20240101_121000",
                TemporalFileMatcher.nearest(utc(2024, 1, 1, 12, 5, 0), names, 5));
    }

    @Test
    public void nearestOfNothingIsNull() {
        assertNull(TemporalFileMatcher.nearest(utc(2024, 1, 1, 12, 0, 0), Collections.<String>emptyList(), 5));
        assertTrue(TemporalFileMatcher.nearestSorted(utc(2024, 1, 1, 12, 0, 0),
                Collections.<String>emptyList(), 5).isEmpty());
    }

    @Test
    public void sortedMatchWalksTowardsOlderFiles() {
        List<String> names = Arrays.asList("KTLX_20240101_122000", "KTLX_20240101_120000",
                "KTLX_20240101_121000", "KTLX_20240101_120000", "KTLX_20240101_123000");
        TemporalFileMatcher.NearestMatch match =
                TemporalFileMatcher.nearestSorted(utc(2024, 1, 1, 12, 21, 0), names, 5);

        assertEquals(Arrays.asList("KTLX_20240101_120000", "KTLX_20240101_121000",
                "KTLX_20240101_122000", "KTLX_20240101_123000"), match.getOrderedNames());
        assertEquals("KTLX_20240101_122000", match.getNearest());
        assertEquals(Arrays.asList("KTLX_20240101_122000", "KTLX_20240101_121000"), match.nearestAndOlder(2));
        assertEquals(3, match.nearestAndOlder(10).size());
    }

    @Test
    public void namesSharingAStampCollapseToTheFirstSeen() {
        List<String> names = Arrays.asList("KTLX_20240101_120000", "KTLX_20240101_120000_V06",
                "KTLX_20240101_120500", "KTLX_20240101_120500_V06");
        TemporalFileMatcher.NearestMatch match =
                TemporalFileMatcher.nearestSorted(utc(2024, 1, 1, 12, 5, 0), names, 5);

        assertEquals(Arrays.asList("KTLX_20240101_120000", "KTLX_20240101_120500"), match.getOrderedNames());
        assertEquals(1, match.getNearestIndex());
        List<String> ordered = match.getOrderedNames();
        for (int index = 1; index < ordered.size(); index++) {
            long previous = TemporalFileMatcher.parseTimestamp(ordered.get(index - 1), 5).getTimeInMillis();
            long current = TemporalFileMatcher.parseTimestamp(ordered.get(index), 5).getTimeInMillis();
            assertTrue(current > previous, "not strictly ascending at " + ordered.get(index));
        }
    }
}
