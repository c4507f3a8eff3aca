package org.satplan.data;

import lombok.Builder;
import lombok.Getter;
import lombok.NonNull;
import lombok.Singular;
import lombok.ToString;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Getter
@Builder
@ToString
public class DownlinkAction {
    @NonNull
    private final String id;
    @NonNull
    private final String satelliteId;
    @NonNull
    private final String stationId;
    @Singular
    private final List<String> antennaIds;
    @NonNull
    private final Instant startTime;
    @NonNull
    private final Instant endTime;
    private final double durationSec;
    private final double dataVolumeGb;
    private final double dataRateMbps;
    private final boolean aggregated;
    private final DownlinkSegment segment;
    private final double segmentOverheadSec;

    public String getAntennaId() {
        return antennaIds.get(0);
    }

    public int getAntennaCount() {
        return antennaIds.size();
    }

    public Optional<DownlinkSegment> getDownlinkSegment() {
        return Optional.ofNullable(segment);
    }

    public boolean isSegmented() {
        return segment != null;
    }
}
