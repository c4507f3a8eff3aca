package org.satplan.data;

import java.util.Optional;

public interface PlanningTask {

    String getId();

    int getImagingOpportunityCount();

    int getDownlinkOpportunityCount();

    default Optional<String> getAssignedSatelliteId() {
        return Optional.empty();
    }

    default Optional<String> getImagingSatelliteId(int opportunityIndex) {
        return Optional.empty();
    }
}
