package org.satplan.optimizers;

import lombok.Builder;
import lombok.Getter;
import lombok.Singular;
import lombok.ToString;

import java.util.List;

@Getter
@Builder
@ToString
public class OptimizerStatistics {
    private final String algorithm;
    private final double initialTemperature;
    private final double finalTemperature;
    private final double deltaE;
    private final int outerIterations;
    private final int innerLoops;
    private final int tabuTenure;
    private final double elapsedSec;
    private final double bestObjective;
    private final boolean timeLimitReached;
    @Singular("historyEntry")
    private final List<Double> history;
}
