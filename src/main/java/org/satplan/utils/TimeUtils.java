package org.satplan.utils;

import lombok.experimental.UtilityClass;

import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;

@UtilityClass
public class TimeUtils {
    private static final double NANOS_PER_SECOND = 1_000_000_000.0;

    public static Instant parse(String isoTime) {
        return OffsetDateTime.parse(isoTime, DateTimeFormatter.ISO_OFFSET_DATE_TIME).toInstant();
    }

    public static String format(Instant instant) {
        return DateTimeFormatter.ISO_OFFSET_DATE_TIME.format(instant.atOffset(ZoneOffset.UTC));
    }

    public static Instant plusSeconds(Instant instant, double seconds) {
        return instant.plusNanos(Math.round(seconds * NANOS_PER_SECOND));
    }

    public static double secondsBetween(Instant from, Instant to) {
        return Duration.between(from, to).toNanos() / NANOS_PER_SECOND;
    }

    public static boolean overlaps(Instant start1, Instant end1, Instant start2, Instant end2) {
        return start1.isBefore(end2) && start2.isBefore(end1);
    }

    public static Instant max(Instant first, Instant second) {
        return first.isAfter(second) ? first : second;
    }

    public static Instant min(Instant first, Instant second) {
        return first.isBefore(second) ? first : second;
    }
}
