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
public class VisibilityWindow {
    private final String id;
    private final String satelliteId;
    private final String targetId;
    private final Instant startTime;
    private final Instant endTime;
    private final double maxElevationDeg;
    private final double offNadirDeg;

    public double getDurationSec() {
        return TimeUtils.secondsBetween(startTime, endTime);
    }
}
