package org.satplan.data;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

import java.util.List;
import java.util.Optional;

@Getter
@ToString(onlyExplicitlyIncluded = true)
@RequiredArgsConstructor
public class ObservationTask implements PlanningTask {
    @ToString.Include
    private final String id;
    @ToString.Include
    private final String targetId;
    @ToString.Include
    private final double value;
    private final double requiredImagingSec;
    private final double dataVolumeGb;
    private final List<VisibilityWindow> imagingOpportunities;
    private final List<AntennaWindow> downlinkOpportunities;

    @Override
    public int getImagingOpportunityCount() {
        return imagingOpportunities.size();
    }

    @Override
    public int getDownlinkOpportunityCount() {
        return downlinkOpportunities.size();
    }

    @Override
    public Optional<String> getImagingSatelliteId(int opportunityIndex) {
        if (opportunityIndex < 1 || opportunityIndex > imagingOpportunities.size()) return Optional.empty();
        return Optional.of(imagingOpportunities.get(opportunityIndex - 1).getSatelliteId());
    }

    public VisibilityWindow getImagingOpportunity(int opportunityIndex) {
        return imagingOpportunities.get(opportunityIndex - 1);
    }

    public AntennaWindow getDownlinkOpportunity(int opportunityIndex) {
        return downlinkOpportunities.get(opportunityIndex - 1);
    }
}
