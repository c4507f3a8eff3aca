package org.satplan.constraints;

import org.junit.jupiter.api.Test;
import org.satplan.data.ImagingAction;
import org.satplan.data.ViolationSeverity;
import org.satplan.data.ViolationType;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.satplan.constraints.ConstraintFixtures.imaging;
import static org.satplan.constraints.ConstraintFixtures.uplink;

class UplinkPrecedenceConstraintTest {
    private final UplinkPrecedenceConstraint constraint = new UplinkPrecedenceConstraint(60.0);

    @Test
    void imagingWithoutUplinkIsAnError() {
        final var violations = constraint.checkAll(List.of(imaging("T1", "SAT-A", 1000, 1010)), List.of());

        assertThat(violations).hasSize(1);
        assertThat(violations.get(0).getType()).isEqualTo(ViolationType.MISSING_UPLINK);
        assertThat(violations.get(0).getSeverity()).isEqualTo(ViolationSeverity.ERROR);
        assertThat(violations.get(0).getSubjectId()).isEqualTo("T1");
    }

    @Test
    void uplinkFinishingAfterTheStartDoesNotCount() {
        final var violation = constraint.checkTask(imaging("T1", "SAT-A", 1000, 1010),
                List.of(uplink("UL_0001", "SAT-A", "A1", 990, 1000, "T1")));

        assertThat(violation).hasValueSatisfying(found -> assertThat(found.getType()).isEqualTo(ViolationType.MISSING_UPLINK));
    }

    @Test
    void uplinkOfAnotherSatelliteDoesNotCount() {
        final var violation = constraint.checkTask(imaging("T1", "SAT-A", 1000, 1010),
                List.of(uplink("UL_0001", "SAT-B", "A1", 0, 10, "T1")));

        assertThat(violation).hasValueSatisfying(found -> assertThat(found.getType()).isEqualTo(ViolationType.MISSING_UPLINK));
    }

    @Test
    void shortGapIsOnlyAWarning() {
        final var violation = constraint.checkTask(imaging("T1", "SAT-A", 1000, 1010),
                List.of(uplink("UL_0001", "SAT-A", "A1", 960, 970, "T1", "T2")));

        assertThat(violation).isPresent();
        assertThat(violation.get().getType()).isEqualTo(ViolationType.INSUFFICIENT_GAP);
        assertThat(violation.get().getSeverity()).isEqualTo(ViolationSeverity.WARNING);
        assertThat(violation.get().getActualGap()).contains(30.0);
        assertThat(violation.get().getRequiredGap()).contains(60.0);
    }

    @Test
    void latestFinishedUplinkIsUsed() {
        final var violation = constraint.checkTask(imaging("T1", "SAT-A", 1000, 1010), List.of(
                uplink("UL_0001", "SAT-A", "A1", 100, 110, "T1"),
                uplink("UL_0002", "SAT-A", "A1", 900, 910, "T1")));

        assertThat(violation).isEmpty();
    }

    @Test
    void groupsImagingsPerSatelliteInStartOrder() {
        final var groups = UplinkPrecedenceConstraint.groupBySatellite(List.of(
                imaging("T2", "SAT-A", 500, 510),
                imaging("T3", "SAT-B", 100, 110),
                imaging("T1", "SAT-A", 200, 210)));

        assertThat(groups).containsOnlyKeys("SAT-A", "SAT-B");
        assertThat(groups.get("SAT-A")).extracting(ImagingAction::getId).containsExactly("T1", "T2");
    }
}
