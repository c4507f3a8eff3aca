package org.satplan.optimizers.operators;

import org.apache.commons.math3.random.RandomGenerator;
import org.satplan.optimizers.AwcsatSolution;

public class WholeRowExchangeOperator extends ExchangeOperator {

    @Override
    public String getName() {
        return "whole_row_exchange";
    }

    @Override
    protected void exchange(AwcsatSolution neighbor, int first, int second, RandomGenerator random) {
        final var firstRow = neighbor.getRow(first);
        neighbor.setRow(first, neighbor.getRow(second));
        neighbor.setRow(second, firstRow);
    }
}
