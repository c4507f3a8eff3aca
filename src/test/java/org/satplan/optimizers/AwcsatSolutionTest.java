package org.satplan.optimizers;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class AwcsatSolutionTest {

    @Test
    void decodeIsMonotonicAndReachesTheLastOpportunity() {
        for (var count = 1; count <= 7; count++) {
            var previous = 0;
            for (var step = 0; step <= 1000; step++) {
                final var decoded = AwcsatSolution.decodeOpportunity(step / 1000.0, count);
                assertThat(decoded).isGreaterThanOrEqualTo(previous).isBetween(0, count);
                previous = decoded;
            }
            assertThat(AwcsatSolution.decodeOpportunity(1.0, count)).isEqualTo(count);
        }
    }

    @Test
    void zeroCodeOrNoOpportunitiesDecodeToInactive() {
        assertThat(AwcsatSolution.decodeOpportunity(0.0, 5)).isZero();
        assertThat(AwcsatSolution.decodeOpportunity(0.7, 0)).isZero();
        assertThat(AwcsatSolution.decodeOpportunity(0.01, 5)).isEqualTo(1);
        assertThat(AwcsatSolution.decodeOpportunity(0.5, 4)).isEqualTo(2);
    }

    @Test
    void stripExtensionRateRunsFromMaxToMin() {
        final var solution = new AwcsatSolution(new double[][]{{0.5, 0.5, 0.0}, {0.5, 0.5, 1.0}, {0.5, 0.5, 0.25}});

        assertThat(solution.decodeStripExtensionRate(0, 0.8, 0.2)).isCloseTo(0.8, within(1e-12));
        assertThat(solution.decodeStripExtensionRate(1, 0.8, 0.2)).isCloseTo(0.2, within(1e-12));
        assertThat(solution.decodeStripExtensionRate(2, 0.8, 0.2)).isCloseTo(0.65, within(1e-12));
    }

    @Test
    void copyIsIndependentOfTheOriginal() {
        final var original = new AwcsatSolution(new double[][]{{0.1, 0.2, 0.3}});
        original.setObjectiveValue(4.0);

        final var copy = original.copy();
        copy.setCode(0, 1, 0.9);
        copy.setObjectiveValue(1.0);

        assertThat(original.getCode(0, 1)).isEqualTo(0.2);
        assertThat(original.getObjectiveValue()).isEqualTo(4.0);
        assertThat(copy.getCode(0, 0)).isEqualTo(0.1);
    }

    @Test
    void rejectsCodesOutsideTheUnitInterval() {
        assertThatThrownBy(() -> new AwcsatSolution(new double[][]{{0.1, 1.5, 0.3}}))
                .isInstanceOf(IllegalArgumentException.class);
        final var solution = AwcsatSolution.zeros(1);
        assertThatThrownBy(() -> solution.setCode(0, 0, -0.1)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> solution.setCode(0, 0, Double.NaN)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void fingerprintRoundsToTwoDecimals() {
        final var first = new AwcsatSolution(new double[][]{{0.121, 0.5, 0.999}});
        final var second = new AwcsatSolution(new double[][]{{0.124, 0.5, 1.0}});
        final var third = new AwcsatSolution(new double[][]{{0.13, 0.5, 1.0}});

        assertThat(first.fingerprint()).isEqualTo(second.fingerprint());
        assertThat(first.fingerprint()).hasSameHashCodeAs(second.fingerprint());
        assertThat(first.fingerprint()).isNotEqualTo(third.fingerprint());
    }

    @Test
    void violationsDecideFeasibility() {
        final var solution = AwcsatSolution.zeros(2);
        assertThat(solution.isFeasible()).isTrue();

        solution.setConstraintViolations(List.of("imaging_switch T1 -> T2"));

        assertThat(solution.isFeasible()).isFalse();
        assertThat(solution.getConstraintViolations()).containsExactly("imaging_switch T1 -> T2");
    }
}
