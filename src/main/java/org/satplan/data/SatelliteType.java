package org.satplan.data;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

import java.util.Set;

@Getter
@Builder
@ToString(onlyExplicitlyIncluded = true)
public class SatelliteType {
    @ToString.Include
    private final String id;
    @ToString.Include
    private final String name;
    @ToString.Include
    private final SatelliteCategory category;

    @Builder.Default
    private final double imagingSwitchTimeSec = 5.0;
    @Builder.Default
    private final double imagingToDownlinkTimeSec = 10.0;
    @Builder.Default
    private final double downlinkSwitchTimeSec = 3.0;

    @Builder.Default
    private final Set<String> antennaTypes = Set.of("X");
    @Builder.Default
    private final double maxDownlinkRateMbps = 800.0;
    private final boolean multiAntennaCapable;
    private final boolean segmentedDownlinkCapable;
    @Builder.Default
    private final double segmentOverheadSec = 2.0;
}
