package org.satplan.optimizers.operators;

import org.apache.commons.math3.random.RandomGenerator;
import org.satplan.optimizers.AwcsatSolution;

public class RandomExchangeOperator extends ExchangeOperator {

    @Override
    public String getName() {
        return "random_exchange";
    }

    @Override
    protected void exchange(AwcsatSolution neighbor, int first, int second, RandomGenerator random) {
        final var firstColumn = random.nextInt(AwcsatSolution.CODE_COUNT);
        final var secondColumn = random.nextInt(AwcsatSolution.CODE_COUNT);
        final var firstCode = neighbor.getCode(first, firstColumn);
        neighbor.setCode(first, firstColumn, neighbor.getCode(second, secondColumn));
        neighbor.setCode(second, secondColumn, firstCode);
    }
}
