package org.satplan.resolvers;

import org.junit.jupiter.api.Test;
import org.satplan.data.AntennaWindow;
import org.satplan.data.AwcsatConfig;
import org.satplan.data.ObservationTask;
import org.satplan.data.Satellite;
import org.satplan.data.SatelliteTypes;
import org.satplan.data.SchedulerConfig;
import org.satplan.data.VisibilityWindow;
import org.satplan.optimizers.AwcsatSolution;
import org.satplan.utils.TimeUtils;

import java.time.Instant;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class ScheduleValueObjectiveTest {
    private static final Instant T0 = Instant.parse("2026-01-01T00:00:00Z");

    private final List<Satellite> satellites = List.of(new Satellite("SAT-A", "A", SatelliteTypes.HR_OPTICAL));

    @Test
    void valueGrowsWithStripExtension() {
        final var objective = objective(List.of(task("T1", imaging("SAT-A", 1000, 1100), downlink("SAT-A", 1300, 1500))));

        final var plain = objective.evaluate(new AwcsatSolution(new double[][]{{1.0, 1.0, 1.0}}));
        final var extended = objective.evaluate(new AwcsatSolution(new double[][]{{1.0, 1.0, 0.0}}));

        assertThat(plain).isCloseTo(1.0, within(1e-12));
        assertThat(extended).isCloseTo(1.1, within(1e-12));
    }

    @Test
    void decodingExtendsImagingAndVolume() {
        final var objective = objective(List.of(task("T1", imaging("SAT-A", 1000, 1100), downlink("SAT-A", 1300, 1500))));

        final var decoded = objective.decode(new AwcsatSolution(new double[][]{{1.0, 1.0, 0.5}}));

        assertThat(decoded).hasSize(1);
        final var task = decoded.get(0);
        assertThat(task.getStripExtensionRate()).isEqualTo(0.5);
        assertThat(task.getImagingEnd()).isEqualTo(t(1015));
        assertThat(task.getDataVolumeGb()).isEqualTo(7.5);
        assertThat(task.getEarliestDownlink()).isEqualTo(t(1025));
        assertThat(task.toImagingAction().getSatelliteId()).isEqualTo("SAT-A");
    }

    @Test
    void unusableDownlinksDropTheTask() {
        final var objective = objective(List.of(
                task("OTHER_SATELLITE", imaging("SAT-A", 1000, 1100), downlink("SAT-B", 1300, 1500)),
                task("TOO_EARLY", imaging("SAT-A", 2000, 2100), downlink("SAT-A", 2000, 2015)),
                task("TOO_SHORT", imaging("SAT-A", 3000, 3100), downlink("SAT-A", 3300, 3310))));

        final var solution = new AwcsatSolution(new double[][]{{1.0, 1.0, 1.0}, {1.0, 1.0, 1.0}, {1.0, 1.0, 1.0}});

        assertThat(objective.decode(solution)).isEmpty();
        assertThat(objective.evaluate(solution)).isZero();
    }

    @Test
    void inactiveRowsAreSkipped() {
        final var objective = objective(List.of(task("T1", imaging("SAT-A", 1000, 1100), downlink("SAT-A", 1300, 1500))));

        assertThat(objective.evaluate(new AwcsatSolution(new double[][]{{0.0, 1.0, 1.0}}))).isZero();
        assertThat(objective.evaluate(new AwcsatSolution(new double[][]{{1.0, 0.0, 1.0}}))).isZero();
    }

    @Test
    void overlappingImagingsArePenalized() {
        final var objective = objective(List.of(
                task("T1", imaging("SAT-A", 1000, 1100), downlink("SAT-A", 1300, 1500)),
                task("T2", imaging("SAT-A", 1005, 1100), downlink("SAT-A", 1600, 1800))));
        final var solution = new AwcsatSolution(new double[][]{{1.0, 1.0, 1.0}, {1.0, 1.0, 1.0}});

        assertThat(objective.evaluate(solution)).isCloseTo(1.0, within(1e-12));
        assertThat(objective.describeViolations(solution)).hasSize(1);
        assertThat(objective.describeViolations(solution).get(0)).startsWith("imaging_switch T1 -> T2 on SAT-A");
    }

    private ScheduleValueObjective objective(List<ObservationTask> tasks) {
        return new ScheduleValueObjective(tasks, satellites, SchedulerConfig.defaults(), AwcsatConfig.defaults());
    }

    private static ObservationTask task(String id, VisibilityWindow imaging, AntennaWindow downlink) {
        return new ObservationTask(id, "TGT_" + id, 1.0, 10.0, 5.0, List.of(imaging), List.of(downlink));
    }

    private static VisibilityWindow imaging(String satelliteId, double start, double end) {
        return new VisibilityWindow("V_" + satelliteId + "_" + start, satelliteId, "TGT", t(start), t(end), 0.0, 0.0);
    }

    private static AntennaWindow downlink(String satelliteId, double start, double end) {
        return new AntennaWindow("S1", "A1", satelliteId, t(start), t(end), 800.0);
    }

    private static Instant t(double seconds) {
        return TimeUtils.plusSeconds(T0, seconds);
    }
}
