package org.satplan.optimizers.operators;

import org.apache.commons.math3.random.RandomGenerator;
import org.satplan.optimizers.AwcsatSolution;

/**
 * Perturbation of an encoding. Implementations return a new solution and leave the input untouched.
 */
public interface NeighborhoodOperator {

    String getName();

    AwcsatSolution apply(AwcsatSolution solution, RandomGenerator random);
}
