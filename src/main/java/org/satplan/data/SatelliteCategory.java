package org.satplan.data;

public enum SatelliteCategory {
    OPTICAL,
    SAR
}
