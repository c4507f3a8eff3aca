package org.satplan.data;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

import java.time.Instant;

@Getter
@ToString
@RequiredArgsConstructor
@SuppressWarnings("ClassCanBeRecord")
public class AccessReportRecord {
    private final Kind kind;
    private final String fromName;
    private final String satelliteName;
    private final long access;
    private final Instant startTime;
    private final Instant stopTime;
    private final double durationSec;

    public enum Kind {
        TARGET,
        FACILITY
    }
}
