package org.satplan.optimizers;

import java.util.List;

/**
 * Score of an encoding, higher is better. Implementations must not modify the solution.
 */
@FunctionalInterface
public interface ObjectiveFunction {

    double evaluate(AwcsatSolution solution);

    default List<String> describeViolations(AwcsatSolution solution) {
        return List.of();
    }
}
