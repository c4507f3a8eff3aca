package org.satplan.utils;

import org.junit.jupiter.api.Test;
import org.satplan.data.ActionType;
import org.satplan.data.ScheduleSlot;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class SlotConflictsTest {
    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

    private final List<ScheduleSlot> slots = List.of(
            new ScheduleSlot("A1", t(100), t(200), "DL_0001", ActionType.DOWNLINK, "SAT-A"),
            new ScheduleSlot("A1", t(400), t(500), "DL_0002", ActionType.DOWNLINK, "SAT-B"));

    @Test
    void overlapIsAlwaysAConflict() {
        assertThat(SlotConflicts.findConflict(slots, t(150), t(160), "SAT-A", 5.0))
                .hasValueSatisfying(reason -> assertThat(reason).contains("DL_0001"));
    }

    @Test
    void touchingSlotsDoNotOverlap() {
        assertThat(SlotConflicts.findConflict(slots, t(200), t(210), "SAT-A", 5.0)).isEmpty();
    }

    @Test
    void switchTimeAppliesOnBothSides() {
        assertThat(SlotConflicts.findConflict(slots, t(203), t(300), "SAT-C", 5.0))
                .hasValueSatisfying(reason -> assertThat(reason).contains("after DL_0001"));
        assertThat(SlotConflicts.findConflict(slots, t(300), t(397), "SAT-C", 5.0))
                .hasValueSatisfying(reason -> assertThat(reason).contains("before DL_0002"));
        assertThat(SlotConflicts.findConflict(slots, t(205), t(395), "SAT-C", 5.0)).isEmpty();
    }

    @Test
    void timeHelpersWorkInSeconds() {
        assertThat(TimeUtils.secondsBetween(t(10), t(12.5))).isEqualTo(2.5);
        assertThat(TimeUtils.secondsBetween(t(12.5), t(10))).isEqualTo(-2.5);
        assertThat(TimeUtils.parse("2026-01-01T08:00:00+08:00")).isEqualTo(T0);
        assertThat(TimeUtils.format(T0)).isEqualTo("2026-01-01T00:00:00Z");
    }

    private static Instant t(double seconds) {
        return TimeUtils.plusSeconds(T0, seconds);
    }
}
