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
public class UplinkRequest {
    private final String satelliteId;
    private final List<String> taskIds;
    private final Instant earliestTime;
    private final Instant latestTime;
    private final int priority;

    public UplinkRequest(String satelliteId, List<String> taskIds, Instant earliestTime, Instant latestTime) {
        this(satelliteId, taskIds, earliestTime, latestTime, 1);
    }

    public int getTaskCount() {
        return taskIds.size();
    }
}
