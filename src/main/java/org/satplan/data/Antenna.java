package org.satplan.data;

import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import org.satplan.utils.SlotConflicts;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

@Getter
@Builder
public class Antenna {
    private final String id;
    private final String name;
    private final String stationId;
    @Builder.Default
    private final double maxDataRateMbps = 800.0;
    @Builder.Default
    private final Set<String> supportedFrequencies = Set.of("X");
    // null when the antenna is always available
    private final List<TimeWindow> availableWindows;
    @Builder.Default
    private final double satelliteSwitchTimeSec = 5.0;

    @Getter(AccessLevel.NONE)
    private final List<ScheduleSlot> slots = new ArrayList<>();
    private final ReentrantLock lock = new ReentrantLock();

    public boolean isAvailableAt(Instant time) {
        if (availableWindows == null) return true;
        return availableWindows.stream().anyMatch(window -> window.contains(time));
    }

    public boolean isAvailableDuring(Instant startTime, Instant endTime) {
        if (availableWindows == null) return true;
        return availableWindows.stream().anyMatch(window -> window.contains(startTime, endTime));
    }

    public boolean supportsFrequency(String frequency) {
        return supportedFrequencies.contains(frequency);
    }

    public Optional<String> findConflict(Instant startTime, Instant endTime, String satelliteId) {
        lock.lock();
        try {
            if (!isAvailableDuring(startTime, endTime)) {
                return Optional.of("antenna " + id + " is not available in this period");
            }
            return SlotConflicts.findConflict(slots, startTime, endTime, satelliteId, satelliteSwitchTimeSec);
        } finally {
            lock.unlock();
        }
    }

    public void addSlot(ScheduleSlot slot) {
        lock.lock();
        try {
            slots.add(slot);
            slots.sort(Comparator.comparing(ScheduleSlot::getStartTime));
        } finally {
            lock.unlock();
        }
    }

    public List<ScheduleSlot> getSlots() {
        lock.lock();
        try {
            return List.copyOf(slots);
        } finally {
            lock.unlock();
        }
    }

    public void clearSlots() {
        lock.lock();
        try {
            slots.clear();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public String toString() {
        return String.format("Antenna(%s, %s, station=%s, %.0fMbps)", id, name, stationId, maxDataRateMbps);
    }
}
