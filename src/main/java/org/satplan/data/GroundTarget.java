package org.satplan.data;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

@Getter
@ToString
@RequiredArgsConstructor
@SuppressWarnings("ClassCanBeRecord")
public class GroundTarget {
    private final String id;
    private final String name;
    private final double latitude;
    private final double longitude;
}
