package org.satplan.constraints;

import org.junit.jupiter.api.Test;
import org.satplan.data.ConstraintViolation;
import org.satplan.data.Satellite;
import org.satplan.data.SatelliteTypes;
import org.satplan.data.SchedulerConfig;
import org.satplan.data.ViolationType;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.satplan.constraints.ConstraintFixtures.downlink;
import static org.satplan.constraints.ConstraintFixtures.imaging;

class ActionTransitionConstraintTest {
    private final ActionTransitionConstraint constraint = new ActionTransitionConstraint(SchedulerConfig.defaults());
    private final Satellite optical = new Satellite("SAT-A", "Optical", SatelliteTypes.HR_OPTICAL);

    @Test
    void imagingsCloserThanTheSwitchTimeViolate() {
        final var violations = constraint.checkImagingSequence(List.of(
                imaging("T2", "SAT-A", 113, 120),
                imaging("T1", "SAT-A", 100, 110),
                imaging("T3", "SAT-A", 125, 130)), optical);

        assertThat(violations).hasSize(1);
        final var violation = violations.get(0);
        assertThat(violation.getType()).isEqualTo(ViolationType.IMAGING_SWITCH);
        assertThat(violation.getAction1Id()).isEqualTo("T1");
        assertThat(violation.getAction2Id()).isEqualTo("T2");
        assertThat(violation.getActualGap()).contains(3.0);
        assertThat(violation.getRequiredGap()).contains(5.0);
        assertThat(violation.isError()).isTrue();
    }

    @Test
    void downlinkSwitchOnlyAppliesBetweenStations() {
        final var violations = constraint.checkDownlinkSequence(List.of(
                downlink("DL_1", "SAT-A", "S1", 0, 10, "A1"),
                downlink("DL_2", "SAT-A", "S1", 10, 20, "A1"),
                downlink("DL_3", "SAT-A", "S2", 21, 30, "B1")), optical);

        assertThat(violations).extracting(ConstraintViolation::getType).containsExactly(ViolationType.DOWNLINK_SWITCH);
        assertThat(violations.get(0).getAction1Id()).isEqualTo("DL_2");
    }

    @Test
    void downlinkTooSoonAfterImagingViolates() {
        final var imagings = List.of(imaging("T1", "SAT-A", 100, 110));

        final var tooSoon = constraint.checkImagingToDownlink(imagings,
                List.of(downlink("DL_1", "SAT-A", "S1", 115, 130, "A1")), optical);
        final var inTime = constraint.checkImagingToDownlink(imagings,
                List.of(downlink("DL_1", "SAT-A", "S1", 120, 130, "A1")), optical);

        assertThat(tooSoon).hasValueSatisfying(violation -> {
            assertThat(violation.getType()).isEqualTo(ViolationType.IMAGING_TO_DOWNLINK);
            assertThat(violation.getActualGap()).contains(5.0);
        });
        assertThat(inTime).isEmpty();
    }

    @Test
    void satelliteWithoutTypeUsesConfiguredTimes() {
        final var config = SchedulerConfig.builder().imagingSwitchTimeSec(20.0).build();
        final var untyped = new Satellite("SAT-A", "Generic", null);

        final var violations = new ActionTransitionConstraint(config).checkAll(untyped,
                List.of(imaging("T1", "SAT-A", 100, 110), imaging("T2", "SAT-A", 120, 130)), List.of());

        assertThat(violations).extracting(ConstraintViolation::getType).containsExactly(ViolationType.IMAGING_SWITCH);
    }
}
