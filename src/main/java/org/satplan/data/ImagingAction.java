package org.satplan.data;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

import java.time.Instant;

@Getter
@ToString
@RequiredArgsConstructor
@SuppressWarnings("ClassCanBeRecord")
public class ImagingAction {
    private final String id;
    private final String satelliteId;
    private final String targetId;
    private final Instant startTime;
    private final Instant endTime;
    private final double dataVolumeGb;
    private final double stripExtensionRate;
}
