package com.radarloop.model;

import java.io.Serializable;
import java.util.Calendar;
import java.util.Locale;
import java.util.TimeZone;

/**
 * Date and time stamp carried by a single radar ray. Seconds keep their fractional part.
 */
public class RayTime implements Serializable {

    protected final int year;
    protected final int month;
    protected final int day;
    protected final int hour;
    protected final int minute;
    protected final float second;

    public RayTime(int year, int month, int day, int hour, int minute, float second) {
        this.year = year;
        this.month = month;
        this.day = day;
        this.hour = hour;
        this.minute = minute;
        this.second = second;
    }

    /**
     * Build a ray time from a calendar, keeping its milliseconds as a fraction of a second.
     */
    public static RayTime fromCalendar(Calendar calendar) {
        Calendar utc = Calendar.getInstance(TimeZone.getTimeZone("UTC"));
        utc.setTimeInMillis(calendar.getTimeInMillis());
        return new RayTime(utc.get(Calendar.YEAR), utc.get(Calendar.MONTH) + 1, utc.get(Calendar.DAY_OF_MONTH),
                utc.get(Calendar.HOUR_OF_DAY), utc.get(Calendar.MINUTE),
                utc.get(Calendar.SECOND) + utc.get(Calendar.MILLISECOND) / 1000.0f);
    }

    /**
     * Field-priority comparison used to find the first and last ray of a sweep. Each clause only
     * checks equality of the field immediately above it, so the relation is not a total order on
     * arbitrary stamps; for rays of one sweep it reads as "captured earlier".
     *
     * @param other stamp to compare against
     * @return true if this stamp sorts before {@code other}
     */
    public boolean isBefore(RayTime other) {
        return year < other.year
                || (year == other.year && month < other.month)
                || (month == other.month && day < other.day)
                || (day == other.day && hour < other.hour)
                || (hour == other.hour && minute < other.minute)
                || (minute == other.minute && second < other.second);
    }

    /**
     * @return this stamp as a UTC calendar, with whole seconds
     */
    public Calendar toCalendar() {
        Calendar calendar = Calendar.getInstance(TimeZone.getTimeZone("UTC"));
        calendar.clear();
        calendar.set(year, month - 1, day, hour, minute, (int) second);
        return calendar;
    }

    public long toEpochSeconds() {
        return toCalendar().getTimeInMillis() / 1000L;
    }

    /**
     * Format a sweep's time span, e.g. {@code 2009-05-10 03:23:01 - 03:27:40}.
     */
    public static String formatRange(RayTime start, RayTime finish) {
        return String.format(Locale.US, "%04d-%02d-%02d %02d:%02d:%02.0f - %02d:%02d:%02.0f",
                start.year, start.month, start.day, start.hour, start.minute, start.second,
                finish.hour, finish.minute, finish.second);
    }

    public int getYear() {
        return year;
    }

    public int getMonth() {
        return month;
    }

    public int getDay() {
        return day;
    }

    public int getHour() {
        return hour;
    }

    public int getMinute() {
        return minute;
    }

    public float getSecond() {
        return second;
    }

    @Override
    public boolean equals(Object o) {
        if (o instanceof RayTime) {
            RayTime other = (RayTime) o;
            return year == other.year && month == other.month && day == other.day
                    && hour == other.hour && minute == other.minute
                    && Float.compare(second, other.second) == 0;
        }
        return false;
    }

    @Override
    public int hashCode() {
        int result = year;
        result = 31 * result + month;
        result = 31 * result + day;
        result = 31 * result + hour;
        result = 31 * result + minute;
        result = 31 * result + Float.floatToIntBits(second);
        return result;
    }

    @Override
    public String toString() {
        return String.format(Locale.US, "%04d-%02d-%02d %02d:%02d:%06.3f", year, month, day, hour, minute, second);
    }
}
