package org.satplan.utils;

import lombok.experimental.UtilityClass;
import org.satplan.data.ScheduleSlot;

import java.time.Instant;
import java.util.Collection;
import java.util.Optional;

@UtilityClass
public class SlotConflicts {

    public static Optional<String> findConflict(Collection<ScheduleSlot> slots,
                                                Instant start,
                                                Instant end,
                                                String satelliteId,
                                                double switchTimeSec) {
        ScheduleSlot previous = null;
        ScheduleSlot next = null;
        for (final var slot : slots) {
            if (TimeUtils.overlaps(start, end, slot.getStartTime(), slot.getEndTime())) {
                return Optional.of("overlaps scheduled action " + slot.getActionId());
            }
            if (!slot.getEndTime().isAfter(start)) {
                if (previous == null || slot.getEndTime().isAfter(previous.getEndTime())) previous = slot;
            } else if (next == null || slot.getStartTime().isBefore(next.getStartTime())) {
                next = slot;
            }
        }

        if (previous != null && !previous.getSatelliteId().equals(satelliteId)) {
            final var gap = TimeUtils.secondsBetween(previous.getEndTime(), start);
            if (gap < switchTimeSec) {
                return Optional.of(String.format("satellite switch gap %.1fs after %s is below %.1fs",
                        gap, previous.getActionId(), switchTimeSec));
            }
        }
        if (next != null && !next.getSatelliteId().equals(satelliteId)) {
            final var gap = TimeUtils.secondsBetween(end, next.getStartTime());
            if (gap < switchTimeSec) {
                return Optional.of(String.format("satellite switch gap %.1fs before %s is below %.1fs",
                        gap, next.getActionId(), switchTimeSec));
            }
        }
        return Optional.empty();
    }
}
