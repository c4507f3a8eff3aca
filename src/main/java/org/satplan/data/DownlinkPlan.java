package org.satplan.data;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

@Getter
@ToString
@RequiredArgsConstructor
@SuppressWarnings("ClassCanBeRecord")
public class DownlinkPlan {
    public static final double VOLUME_TOLERANCE_GB = 0.001;

    private final String planId;
    private final String satelliteId;
    private final String taskId;
    private final double totalDataGb;
    private final List<DownlinkAction> actions;
    private final boolean segmented;
    private final boolean aggregated;

    public int getActionCount() {
        return actions.size();
    }

    public double getTotalDurationSec() {
        return actions.stream().mapToDouble(DownlinkAction::getDurationSec).sum();
    }

    public double getCompletedDataGb() {
        return actions.stream().mapToDouble(DownlinkAction::getDataVolumeGb).sum();
    }

    public boolean isComplete() {
        return Math.abs(getCompletedDataGb() - totalDataGb) < VOLUME_TOLERANCE_GB;
    }

    public Optional<Instant> getEarliestStart() {
        return actions.stream().map(DownlinkAction::getStartTime).min(Comparator.naturalOrder());
    }

    public Optional<Instant> getLatestEnd() {
        return actions.stream().map(DownlinkAction::getEndTime).max(Comparator.naturalOrder());
    }
}
