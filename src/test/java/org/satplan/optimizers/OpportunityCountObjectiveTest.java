package org.satplan.optimizers;

import org.junit.jupiter.api.Test;
import org.satplan.data.Task;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class OpportunityCountObjectiveTest {

    @Test
    void countsTasksWithBothOpportunitiesSelected() {
        final var objective = new OpportunityCountObjective(List.of(
                new Task("T1", 2, 2),
                new Task("T2", 0, 3),
                new Task("T3", 4, 1)));
        final var solution = new AwcsatSolution(new double[][]{
                {0.5, 0.5, 0.0},
                {0.5, 0.5, 0.0},
                {0.3, 0.0, 0.0}});

        assertThat(objective.evaluate(solution)).isEqualTo(1.0);
        assertThat(objective.describeViolations(solution)).isEmpty();
    }
}
