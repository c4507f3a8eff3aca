package org.satplan.optimizers.operators;

import org.apache.commons.math3.random.RandomGenerator;
import org.satplan.optimizers.AwcsatSolution;

public class MoveOperator implements NeighborhoodOperator {

    @Override
    public String getName() {
        return "move";
    }

    @Override
    public AwcsatSolution apply(AwcsatSolution solution, RandomGenerator random) {
        final var neighbor = solution.copy();
        if (neighbor.getTaskCount() == 0) return neighbor;
        final var task = random.nextInt(neighbor.getTaskCount());
        final var column = random.nextInt(AwcsatSolution.CODE_COUNT);
        neighbor.setCode(task, column, random.nextDouble());
        return neighbor;
    }
}
