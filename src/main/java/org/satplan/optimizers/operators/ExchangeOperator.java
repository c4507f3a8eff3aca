package org.satplan.optimizers.operators;

import org.apache.commons.math3.random.RandomGenerator;
import org.satplan.optimizers.AwcsatSolution;

abstract class ExchangeOperator implements NeighborhoodOperator {

    @Override
    public AwcsatSolution apply(AwcsatSolution solution, RandomGenerator random) {
        final var neighbor = solution.copy();
        final var taskCount = neighbor.getTaskCount();
        if (taskCount < 2) return neighbor;

        final var first = random.nextInt(taskCount);
        var second = random.nextInt(taskCount - 1);
        if (second >= first) second++;
        exchange(neighbor, first, second, random);
        return neighbor;
    }

    protected abstract void exchange(AwcsatSolution neighbor, int first, int second, RandomGenerator random);
}
