package org.satplan.data;

import lombok.experimental.UtilityClass;

import java.util.Map;
import java.util.Optional;
import java.util.Set;

@UtilityClass
public class SatelliteTypes {
    public static final SatelliteType UHR_OPTICAL = SatelliteType.builder()
            .id("UHR_OPTICAL")
            .name("Ultra-high resolution optical")
            .category(SatelliteCategory.OPTICAL)
            .imagingSwitchTimeSec(8.0)
            .imagingToDownlinkTimeSec(15.0)
            .downlinkSwitchTimeSec(5.0)
            .antennaTypes(Set.of("X", "Ka"))
            .maxDownlinkRateMbps(1200.0)
            .multiAntennaCapable(true)
            .build();

    public static final SatelliteType HR_OPTICAL = SatelliteType.builder()
            .id("HR_OPTICAL")
            .name("High resolution optical")
            .category(SatelliteCategory.OPTICAL)
            .imagingSwitchTimeSec(5.0)
            .imagingToDownlinkTimeSec(10.0)
            .downlinkSwitchTimeSec(3.0)
            .antennaTypes(Set.of("X"))
            .maxDownlinkRateMbps(800.0)
            .build();

    public static final SatelliteType UHR_SAR = SatelliteType.builder()
            .id("UHR_SAR")
            .name("Ultra-high resolution SAR")
            .category(SatelliteCategory.SAR)
            .imagingSwitchTimeSec(10.0)
            .imagingToDownlinkTimeSec(20.0)
            .downlinkSwitchTimeSec(5.0)
            .antennaTypes(Set.of("X", "Ka"))
            .maxDownlinkRateMbps(1500.0)
            .multiAntennaCapable(true)
            .segmentedDownlinkCapable(true)
            .segmentOverheadSec(3.0)
            .build();

    public static final SatelliteType HR_SAR = SatelliteType.builder()
            .id("HR_SAR")
            .name("High resolution SAR")
            .category(SatelliteCategory.SAR)
            .imagingSwitchTimeSec(8.0)
            .imagingToDownlinkTimeSec(15.0)
            .downlinkSwitchTimeSec(4.0)
            .antennaTypes(Set.of("X"))
            .maxDownlinkRateMbps(1000.0)
            .build();

    private static final Map<String, SatelliteType> REGISTRY = Map.of(
            UHR_OPTICAL.getId(), UHR_OPTICAL,
            HR_OPTICAL.getId(), HR_OPTICAL,
            UHR_SAR.getId(), UHR_SAR,
            HR_SAR.getId(), HR_SAR);

    public static Optional<SatelliteType> byId(String typeId) {
        return Optional.ofNullable(REGISTRY.get(typeId));
    }
}
