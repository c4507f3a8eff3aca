package org.satplan.schedulers;

import lombok.experimental.UtilityClass;
import org.satplan.data.Antenna;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.function.Supplier;

@UtilityClass
class AntennaLocks {

    static <T> T withLocks(Collection<Antenna> antennas, Supplier<T> action) {
        final var ordered = antennas.stream()
                .distinct()
                .sorted(Comparator.comparing(Antenna::getId))
                .toList();
        final var acquired = new ArrayList<Antenna>(ordered.size());
        try {
            for (final var antenna : ordered) {
                antenna.getLock().lock();
                acquired.add(antenna);
            }
            return action.get();
        } finally {
            for (var i = acquired.size() - 1; i >= 0; i--) {
                acquired.get(i).getLock().unlock();
            }
        }
    }
}
