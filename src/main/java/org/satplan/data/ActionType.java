package org.satplan.data;

public enum ActionType {
    UPLINK,
    DOWNLINK
}
