package org.satplan.data;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;
import org.satplan.utils.TimeUtils;

import java.time.Instant;

@Getter
@ToString
@EqualsAndHashCode
@RequiredArgsConstructor
@SuppressWarnings("ClassCanBeRecord")
public class TimeWindow {
    private final Instant startTime;
    private final Instant endTime;

    public static TimeWindow of(String isoStart, String isoEnd) {
        return new TimeWindow(TimeUtils.parse(isoStart), TimeUtils.parse(isoEnd));
    }

    public boolean contains(Instant instant) {
        return !instant.isBefore(startTime) && !instant.isAfter(endTime);
    }

    public boolean contains(Instant start, Instant end) {
        return !start.isBefore(startTime) && !end.isAfter(endTime);
    }

    public double getDurationSec() {
        return TimeUtils.secondsBetween(startTime, endTime);
    }
}
