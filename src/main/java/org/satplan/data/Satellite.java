package org.satplan.data;

import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

import java.util.Optional;

@Getter
@ToString
@EqualsAndHashCode(onlyExplicitlyIncluded = true)
@RequiredArgsConstructor
@SuppressWarnings("ClassCanBeRecord")
public class Satellite {
    @EqualsAndHashCode.Include
    private final String id;
    private final String name;
    private final SatelliteType type;

    public Optional<SatelliteType> getSatelliteType() {
        return Optional.ofNullable(type);
    }
}
