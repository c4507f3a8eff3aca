package org.satplan.data;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

@Getter
@ToString
@RequiredArgsConstructor
@SuppressWarnings("ClassCanBeRecord")
public class DownlinkSegment {
    private final String segmentId;
    private final String parentTaskId;
    private final int sequenceNumber;
    private final int totalSegments;
    private final double dataVolumeGb;
    private final double dataOffsetGb;

    public boolean isFirstSegment() {
        return sequenceNumber == 1;
    }

    public boolean isLastSegment() {
        return sequenceNumber == totalSegments;
    }
}
