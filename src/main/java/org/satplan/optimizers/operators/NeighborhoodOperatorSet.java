package org.satplan.optimizers.operators;

import lombok.Getter;
import org.apache.commons.math3.random.RandomGenerator;
import org.satplan.optimizers.AwcsatSolution;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public class NeighborhoodOperatorSet {
    @Getter
    private final List<NeighborhoodOperator> operators;
    private final Map<String, Integer> usage = new LinkedHashMap<>();

    public NeighborhoodOperatorSet() {
        this(List.of(
                new MoveOperator(),
                new SamePositionExchangeOperator(),
                new RandomExchangeOperator(),
                new WholeRowExchangeOperator()));
    }

    public NeighborhoodOperatorSet(List<NeighborhoodOperator> operators) {
        if (operators.isEmpty()) throw new IllegalArgumentException("At least one neighborhood operator is required");
        this.operators = List.copyOf(operators);
    }

    public NeighborhoodOperator select(RandomGenerator random) {
        return operators.get(random.nextInt(operators.size()));
    }

    public AwcsatSolution generateNeighbor(AwcsatSolution solution, RandomGenerator random) {
        final var operator = select(random);
        usage.merge(operator.getName(), 1, Integer::sum);
        return operator.apply(solution, random);
    }

    public Map<String, Integer> getUsage() {
        return Map.copyOf(usage);
    }

    public void resetUsage() {
        usage.clear();
    }
}
