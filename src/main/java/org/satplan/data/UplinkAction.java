package org.satplan.data;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

import java.time.Instant;
import java.util.List;

@Getter
@ToString
@RequiredArgsConstructor
@SuppressWarnings("ClassCanBeRecord")
public class UplinkAction {
    private final String id;
    private final String satelliteId;
    private final String stationId;
    private final String antennaId;
    private final Instant startTime;
    private final Instant endTime;
    private final double durationSec;
    private final List<String> taskIds;

    public boolean containsTask(String taskId) {
        return taskIds.contains(taskId);
    }

    public int getTaskCount() {
        return taskIds.size();
    }
}
