package org.satplan.optimizers.operators;

import org.apache.commons.math3.random.RandomGenerator;
import org.satplan.optimizers.AwcsatSolution;

public class SamePositionExchangeOperator extends ExchangeOperator {

    @Override
    public String getName() {
        return "same_position_exchange";
    }

    @Override
    protected void exchange(AwcsatSolution neighbor, int first, int second, RandomGenerator random) {
        final var column = random.nextInt(AwcsatSolution.CODE_COUNT);
        final var firstCode = neighbor.getCode(first, column);
        neighbor.setCode(first, column, neighbor.getCode(second, column));
        neighbor.setCode(second, column, firstCode);
    }
}
