package org.satplan.constraints;

import org.satplan.data.DownlinkAction;
import org.satplan.data.ImagingAction;
import org.satplan.data.UplinkAction;
import org.satplan.utils.TimeUtils;

import java.time.Instant;
import java.util.List;

final class ConstraintFixtures {
    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

    private ConstraintFixtures() {
    }

    static Instant t(double seconds) {
        return TimeUtils.plusSeconds(T0, seconds);
    }

    static ImagingAction imaging(String taskId, String satelliteId, double start, double end) {
        return new ImagingAction(taskId, satelliteId, "TGT_" + taskId, t(start), t(end), 5.0, 0.0);
    }

    static UplinkAction uplink(String id, String satelliteId, String antennaId, double start, double end, String... taskIds) {
        return new UplinkAction(id, satelliteId, "S1", antennaId, t(start), t(end), end - start, List.of(taskIds));
    }

    static DownlinkAction downlink(String id, String satelliteId, String stationId, double start, double end, String... antennaIds) {
        return DownlinkAction.builder()
                .id(id)
                .satelliteId(satelliteId)
                .stationId(stationId)
                .antennaIds(List.of(antennaIds))
                .startTime(t(start))
                .endTime(t(end))
                .durationSec(end - start)
                .dataVolumeGb(1.0)
                .dataRateMbps(800.0)
                .aggregated(antennaIds.length > 1)
                .build();
    }
}
