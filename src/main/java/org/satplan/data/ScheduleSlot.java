package org.satplan.data;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

import java.time.Instant;

@Getter
@ToString
@RequiredArgsConstructor
@SuppressWarnings("ClassCanBeRecord")
public class ScheduleSlot {
    private final String antennaId;
    private final Instant startTime;
    private final Instant endTime;
    private final String actionId;
    private final ActionType actionType;
    private final String satelliteId;
}
