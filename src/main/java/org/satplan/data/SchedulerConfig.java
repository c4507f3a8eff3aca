package org.satplan.data;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import org.satplan.exceptions.InvalidConfigurationException;

@Getter
@ToString
@Builder(toBuilder = true)
public class SchedulerConfig {
    @Builder.Default
    private final double minGapAfterUplinkSec = 60.0;
    @Builder.Default
    private final double segmentOverheadSec = 2.0;
    @Builder.Default
    private final int maxAggregatedAntennas = 4;
    @Builder.Default
    private final int maxSegments = 10;
    @Builder.Default
    private final boolean preferAggregation = true;

    @Builder.Default
    private final double imagingSwitchTimeSec = 5.0;
    @Builder.Default
    private final double imagingToDownlinkTimeSec = 10.0;
    @Builder.Default
    private final double downlinkSwitchTimeSec = 3.0;

    @Builder.Default
    private final double violationPenalty = 1.0;
    @Builder.Default
    private final double stripExtensionBonus = 0.1;

    public static SchedulerConfig defaults() {
        return builder().build();
    }

    public void validate() {
        if (minGapAfterUplinkSec < 0) {
            throw new InvalidConfigurationException("minGapAfterUplinkSec must not be negative: " + minGapAfterUplinkSec);
        }
        if (segmentOverheadSec < 0) {
            throw new InvalidConfigurationException("segmentOverheadSec must not be negative: " + segmentOverheadSec);
        }
        if (maxAggregatedAntennas <= 0) {
            throw new InvalidConfigurationException("maxAggregatedAntennas must be positive: " + maxAggregatedAntennas);
        }
        if (maxSegments <= 0) {
            throw new InvalidConfigurationException("maxSegments must be positive: " + maxSegments);
        }
    }
}
