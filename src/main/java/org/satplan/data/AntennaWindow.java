package org.satplan.data;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;
import org.satplan.utils.TimeUtils;

import java.time.Instant;

@Getter
@ToString
@RequiredArgsConstructor
@SuppressWarnings("ClassCanBeRecord")
public class AntennaWindow {
    private final String stationId;
    private final String antennaId;
    private final String satelliteId;
    private final Instant startTime;
    private final Instant endTime;
    private final double maxDataRateMbps;

    public double getDurationSec() {
        return TimeUtils.secondsBetween(startTime, endTime);
    }
}
