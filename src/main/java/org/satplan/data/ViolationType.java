package org.satplan.data;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ViolationType {
    IMAGING_SWITCH("imaging_switch", ConstraintKind.TRANSITION),
    DOWNLINK_SWITCH("downlink_switch", ConstraintKind.TRANSITION),
    IMAGING_TO_DOWNLINK("imaging_to_downlink", ConstraintKind.TRANSITION),
    ANTENNA_CONFLICT("conflict", ConstraintKind.ANTENNA_RESOURCE),
    ANTENNA_SWITCH_TIME("switch_time", ConstraintKind.ANTENNA_RESOURCE),
    MISSING_UPLINK("missing_uplink", ConstraintKind.UPLINK_PRECEDENCE),
    INSUFFICIENT_GAP("insufficient_gap", ConstraintKind.UPLINK_PRECEDENCE);

    private final String tag;
    private final ConstraintKind kind;

    public enum ConstraintKind {
        TRANSITION,
        ANTENNA_RESOURCE,
        UPLINK_PRECEDENCE
    }
}
