package org.satplan.data;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

import java.util.Optional;

@Getter
@ToString
@AllArgsConstructor
@RequiredArgsConstructor
public class Task implements PlanningTask {
    private final String id;
    private final int imagingOpportunityCount;
    private final int downlinkOpportunityCount;
    private String satelliteId;

    @Override
    public Optional<String> getAssignedSatelliteId() {
        return Optional.ofNullable(satelliteId);
    }
}
