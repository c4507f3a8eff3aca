package org.satplan.optimizers;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.math3.random.MersenneTwister;
import org.apache.commons.math3.random.RandomGenerator;
import org.apache.commons.math3.stat.StatUtils;
import org.satplan.data.AwcsatConfig;
import org.satplan.data.PlanningTask;
import org.satplan.data.Satellite;
import org.satplan.data.Solution;
import org.satplan.optimizers.operators.NeighborhoodOperatorSet;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Optional;
import java.util.function.LongSupplier;

/**
 * Adaptive wave cooling simulated annealing with tabu memory.
 * <p>
 * The search starts from the best of a random sample, runs {@code L_k} isothermal steps per outer
 * iteration and then cools with a wave term driven by the counts of accepted and improving moves.
 * A repeated encoding is refused unless it beats the best solution found so far. The wall-clock limit
 * is checked before every outer iteration; on expiry the best solution so far is returned.
 */
@Slf4j
@Getter
public final class AwcsatOptimizer implements PlanningAlgorithm {
    private static final double NANOS_PER_SECOND = 1_000_000_000.0;
    private static final double LOW_IMPROVEMENT_RATIO = 0.1;
    private static final double HIGH_IMPROVEMENT_RATIO = 0.5;

    private final AwcsatConfig config;
    @Getter(AccessLevel.NONE)
    private final ObjectiveFunction fixedObjective;
    @Getter(AccessLevel.NONE)
    private final LongSupplier clock;
    private final NeighborhoodOperatorSet operatorSet = new NeighborhoodOperatorSet();
    @Getter(AccessLevel.PACKAGE)
    private final TabuList tabuList;

    @Getter(AccessLevel.NONE)
    private RandomGenerator random;
    @Getter(AccessLevel.NONE)
    private ObjectiveFunction objective;
    @Getter(AccessLevel.NONE)
    private AwcsatSolution currentSolution;
    @Getter(AccessLevel.NONE)
    private AwcsatSolution bestSolution;
    private double initialTemperature;
    private double currentTemperature;
    private double deltaE;
    private double averageEnergy;
    private double minEnergy;
    private int currentInnerLoops;
    private int improvedCount;
    private int acceptedCount;
    private int outerIterationsDone;
    private boolean timeLimitReached;
    private long startNanos;
    @Getter(AccessLevel.NONE)
    private final List<Double> history = new ArrayList<>();

    public AwcsatOptimizer(AwcsatConfig config) {
        this(config, null, System::nanoTime);
    }

    public AwcsatOptimizer(AwcsatConfig config, ObjectiveFunction objective) {
        this(config, objective, System::nanoTime);
    }

    AwcsatOptimizer(AwcsatConfig config, ObjectiveFunction objective, LongSupplier clock) {
        config.validate();
        this.config = config;
        this.fixedObjective = objective;
        this.clock = clock;
        this.tabuList = new TabuList(config.getTabuTenure());
    }

    @Override
    public String getName() {
        return "AWCSAT";
    }

    @Override
    public Solution solve(List<? extends PlanningTask> tasks, List<Satellite> satellites) {
        startNanos = clock.getAsLong();
        if (tasks.isEmpty()) {
            log.warn("No tasks to plan, returning an empty solution.");
            return Solution.empty();
        }

        prepare(tasks);
        log.info(String.format("AWCSAT start: %d tasks, T0=%.4f, deltaE=%.4f, best initial objective %.4f",
                tasks.size(), initialTemperature, deltaE, bestSolution.getObjectiveValue()));

        final var outerLoops = config.getOuterLoops();
        for (var k = 0; k < outerLoops; k++) {
            if (getElapsedSec() >= config.getTimeLimitSec()) {
                timeLimitReached = true;
                log.warn(String.format("AWCSAT time limit of %.1fs reached after %d outer iterations, returning best so far.",
                        config.getTimeLimitSec(), outerIterationsDone));
                break;
            }

            improvedCount = 0;
            acceptedCount = 0;
            for (var step = 0; step < currentInnerLoops; step++) {
                final var neighbor = operatorSet.generateNeighbor(currentSolution, random);
                neighbor.setObjectiveValue(objective.evaluate(neighbor));
                considerNeighbor(neighbor);
            }

            currentTemperature = nextTemperature(initialTemperature, k, outerLoops, currentInnerLoops,
                    improvedCount, acceptedCount, config.getWaveN(), config.getWaveC(), config.getMinTemperature());
            if (k + 1 < outerLoops) {
                currentInnerLoops = adaptInnerLoops(currentInnerLoops, improvedCount, config.getInitialInnerLoops());
            }
            history.add(bestSolution.getObjectiveValue());
            outerIterationsDone++;

            if (log.isDebugEnabled()) {
                log.debug(String.format("Iteration %d: T=%.6f, L=%d, improved=%d, accepted=%d, current=%.4f, best=%.4f",
                        k + 1, currentTemperature, currentInnerLoops, improvedCount, acceptedCount,
                        currentSolution.getObjectiveValue(), bestSolution.getObjectiveValue()));
            }
        }

        bestSolution.setConstraintViolations(objective.describeViolations(bestSolution));
        log.info(String.format("AWCSAT done: best objective %.4f after %d outer iterations in %.2fs",
                bestSolution.getObjectiveValue(), outerIterationsDone, getElapsedSec()));
        return toSolution(tasks, satellites);
    }

    void prepare(List<? extends PlanningTask> tasks) {
        random = config.getRandomSeed() == null ? new MersenneTwister() : new MersenneTwister(config.getRandomSeed());
        objective = fixedObjective != null ? fixedObjective : new OpportunityCountObjective(tasks);
        tabuList.clear();
        operatorSet.resetUsage();
        history.clear();
        outerIterationsDone = 0;
        timeLimitReached = false;
        improvedCount = 0;
        acceptedCount = 0;
        currentInnerLoops = config.getInitialInnerLoops();

        final var sample = AwcsatSolution.randomSample(tasks.size(), config.getInitialSampleSize(), random);
        final var energies = new double[sample.size()];
        AwcsatSolution sampleBest = null;
        for (var i = 0; i < sample.size(); i++) {
            final var solution = sample.get(i);
            solution.setObjectiveValue(objective.evaluate(solution));
            energies[i] = solution.getObjectiveValue();
            if (sampleBest == null || solution.getObjectiveValue() > sampleBest.getObjectiveValue()) {
                sampleBest = solution;
            }
        }

        minEnergy = StatUtils.min(energies);
        averageEnergy = StatUtils.mean(energies);
        deltaE = StatUtils.max(energies) - minEnergy;
        initialTemperature = initialTemperature(deltaE, config.getInitialTempCoef(), config.getDefaultTemperature());
        if (deltaE <= 0) {
            log.warn("Initial sample has no objective spread, using default temperature " + initialTemperature);
        }
        currentTemperature = initialTemperature;
        currentSolution = sampleBest;
        bestSolution = sampleBest.copy();
    }

    boolean considerNeighbor(AwcsatSolution neighbor) {
        final var fingerprint = neighbor.fingerprint();
        if (tabuList.contains(fingerprint)) {
            if (neighbor.getObjectiveValue() > bestSolution.getObjectiveValue()) {
                accept(neighbor);
                return true;
            }
            return false;
        }
        tabuList.push(fingerprint);

        final var probability = acceptanceProbability(neighbor.getObjectiveValue(), currentSolution.getObjectiveValue(),
                averageEnergy, minEnergy, initialTemperature, currentTemperature);
        if (probability >= 1.0 || (probability > 0.0 && random.nextDouble() < probability)) {
            accept(neighbor);
            return true;
        }
        return false;
    }

    private void accept(AwcsatSolution neighbor) {
        if (neighbor.getObjectiveValue() > currentSolution.getObjectiveValue()) improvedCount++;
        acceptedCount++;
        currentSolution = neighbor;
        if (neighbor.getObjectiveValue() > bestSolution.getObjectiveValue()) {
            bestSolution = neighbor.copy();
        }
    }

    public static double initialTemperature(double deltaE, double coefficient, double fallback) {
        if (deltaE <= 0 || coefficient <= 0 || coefficient >= 1) return fallback;
        return -deltaE / Math.log(coefficient);
    }

    public static double acceptanceProbability(double newEnergy, double oldEnergy, double averageEnergy,
                                               double minEnergy, double initialTemperature, double temperature) {
        if (newEnergy >= oldEnergy) return 1.0;
        final var scale = initialTemperature > 0 ? Math.exp(-(averageEnergy - minEnergy) / initialTemperature) : 1.0;
        final var scaledTemperature = scale * temperature;
        if (scaledTemperature <= 0) return 0.0;
        return Math.exp((newEnergy - oldEnergy) / scaledTemperature);
    }

    public static double nextTemperature(double initialTemperature, int k, int outerLoops, int innerLoops,
                                         int improved, int accepted, double waveN, double waveC, double floor) {
        final var decay = initialTemperature * (outerLoops - k) / outerLoops / (waveC * k + 1);
        final var waveArgument = waveN * initialTemperature;
        final var cosine = waveArgument > 0 ? Math.cos(accepted / waveArgument) : 1.0;
        final var wave = (double) innerLoops / (1 + improved) * cosine * cosine;
        final var temperature = decay + wave;
        if (!(temperature > floor)) return floor;
        return temperature;
    }

    public static int adaptInnerLoops(int innerLoops, int improved, int initialInnerLoops) {
        final var ratio = innerLoops > 0 ? (double) improved / innerLoops : 0.0;
        if (ratio < LOW_IMPROVEMENT_RATIO) {
            return Math.min((int) (innerLoops * 1.1), 2 * initialInnerLoops);
        }
        if (ratio > HIGH_IMPROVEMENT_RATIO) {
            return Math.max(Math.max((int) (innerLoops * 0.9), initialInnerLoops / 2), 1);
        }
        return innerLoops;
    }

    public double getElapsedSec() {
        return (clock.getAsLong() - startNanos) / NANOS_PER_SECOND;
    }

    public AwcsatSolution getCurrentSolution() {
        return currentSolution == null ? null : currentSolution.copy();
    }

    public AwcsatSolution getBestSolution() {
        return bestSolution == null ? null : bestSolution.copy();
    }

    public List<Double> getHistory() {
        return List.copyOf(history);
    }

    public OptimizerStatistics getStatistics() {
        return OptimizerStatistics.builder()
                .algorithm(getName())
                .initialTemperature(initialTemperature)
                .finalTemperature(currentTemperature)
                .deltaE(deltaE)
                .outerIterations(outerIterationsDone)
                .innerLoops(currentInnerLoops)
                .tabuTenure(tabuList.getTenure())
                .elapsedSec(getElapsedSec())
                .bestObjective(bestSolution == null ? 0.0 : bestSolution.getObjectiveValue())
                .timeLimitReached(timeLimitReached)
                .history(history)
                .build();
    }

    private Solution toSolution(List<? extends PlanningTask> tasks, List<Satellite> satellites) {
        final var assignments = new LinkedHashMap<String, String>();
        for (var i = 0; i < tasks.size(); i++) {
            final var task = tasks.get(i);
            final var imagingIndex = bestSolution.decodeImagingOpportunity(i, task.getImagingOpportunityCount());
            if (imagingIndex < 1) continue;
            final var imagingCode = bestSolution.getImagingCode(i);
            task.getAssignedSatelliteId()
                    .or(() -> task.getImagingSatelliteId(imagingIndex))
                    .or(() -> satelliteByCode(imagingCode, satellites))
                    .ifPresent(satelliteId -> assignments.put(task.getId(), satelliteId));
        }
        return new Solution(
                assignments,
                bestSolution.getObjectiveValue(),
                bestSolution.isFeasible(),
                List.copyOf(bestSolution.getConstraintViolations()));
    }

    private static Optional<String> satelliteByCode(double code, List<Satellite> satellites) {
        if (satellites.isEmpty() || code <= 0) return Optional.empty();
        final var index = (int) (code * satellites.size()) % satellites.size();
        return Optional.of(satellites.get(index).getId());
    }
}
