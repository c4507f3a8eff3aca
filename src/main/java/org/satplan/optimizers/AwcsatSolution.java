package org.satplan.optimizers;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.Setter;
import org.apache.commons.math3.random.RandomGenerator;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Search encoding: one row per task, three codes per row, every code in [0, 1].
 * <ul>
 *     <li>column 0 selects the imaging opportunity,</li>
 *     <li>column 1 selects the downlink opportunity,</li>
 *     <li>column 2 selects the strip extension rate.</li>
 * </ul>
 * Opportunity codes decode to {@code ceil(v * count)}, a 1-indexed opportunity; 0 means the task is left
 * inactive. The extension code decodes to {@code rMax - v * (rMax - rMin)}.
 */
@Getter
public class AwcsatSolution {
    public static final int CODE_COUNT = 3;
    public static final int IMAGING_CODE = 0;
    public static final int DOWNLINK_CODE = 1;
    public static final int STRIP_EXTENSION_CODE = 2;

    @Getter(AccessLevel.NONE)
    private final double[][] encoding;
    @Setter
    private double objectiveValue;
    @Setter
    private boolean feasible = true;
    private final List<String> constraintViolations = new ArrayList<>();

    public AwcsatSolution(double[][] encoding) {
        for (final var row : encoding) {
            if (row.length != CODE_COUNT) {
                throw new IllegalArgumentException("Every encoding row needs " + CODE_COUNT + " codes, got " + row.length);
            }
            for (final var code : row) checkCode(code);
        }
        this.encoding = encoding;
    }

    public static AwcsatSolution random(int taskCount, RandomGenerator random) {
        final var encoding = new double[taskCount][CODE_COUNT];
        for (final var row : encoding) {
            for (var column = 0; column < CODE_COUNT; column++) {
                row[column] = random.nextDouble();
            }
        }
        return new AwcsatSolution(encoding);
    }

    public static AwcsatSolution zeros(int taskCount) {
        return new AwcsatSolution(new double[taskCount][CODE_COUNT]);
    }

    public static List<AwcsatSolution> randomSample(int taskCount, int sampleSize, RandomGenerator random) {
        final var result = new ArrayList<AwcsatSolution>(sampleSize);
        for (var i = 0; i < sampleSize; i++) {
            result.add(random(taskCount, random));
        }
        return result;
    }

    public static int decodeOpportunity(double code, int opportunityCount) {
        if (opportunityCount <= 0) return 0;
        return (int) Math.ceil(code * opportunityCount);
    }

    public int getTaskCount() {
        return encoding.length;
    }

    public double getCode(int taskIndex, int column) {
        return encoding[taskIndex][column];
    }

    public void setCode(int taskIndex, int column, double code) {
        checkCode(code);
        encoding[taskIndex][column] = code;
    }

    public double[] getRow(int taskIndex) {
        return encoding[taskIndex].clone();
    }

    public void setRow(int taskIndex, double[] row) {
        if (row.length != CODE_COUNT) throw new IllegalArgumentException("Row needs " + CODE_COUNT + " codes");
        for (final var code : row) checkCode(code);
        encoding[taskIndex] = row.clone();
    }

    public double getImagingCode(int taskIndex) {
        return encoding[taskIndex][IMAGING_CODE];
    }

    public double getDownlinkCode(int taskIndex) {
        return encoding[taskIndex][DOWNLINK_CODE];
    }

    public double getStripExtensionCode(int taskIndex) {
        return encoding[taskIndex][STRIP_EXTENSION_CODE];
    }

    public int decodeImagingOpportunity(int taskIndex, int opportunityCount) {
        return decodeOpportunity(getImagingCode(taskIndex), opportunityCount);
    }

    public int decodeDownlinkOpportunity(int taskIndex, int opportunityCount) {
        return decodeOpportunity(getDownlinkCode(taskIndex), opportunityCount);
    }

    public double decodeStripExtensionRate(int taskIndex, double rMax, double rMin) {
        return rMax - getStripExtensionCode(taskIndex) * (rMax - rMin);
    }

    public void setConstraintViolations(List<String> violations) {
        constraintViolations.clear();
        constraintViolations.addAll(violations);
        feasible = violations.isEmpty();
    }

    public AwcsatSolution copy() {
        final var rows = new double[encoding.length][];
        for (var i = 0; i < encoding.length; i++) {
            rows[i] = encoding[i].clone();
        }
        final var result = new AwcsatSolution(rows);
        result.objectiveValue = objectiveValue;
        result.feasible = feasible;
        result.constraintViolations.addAll(constraintViolations);
        return result;
    }

    public SolutionFingerprint fingerprint() {
        return SolutionFingerprint.of(encoding);
    }

    @Override
    public String toString() {
        return String.format("AwcsatSolution(tasks=%d, objective=%.4f, feasible=%s, encoding=%s)",
                encoding.length, objectiveValue, feasible, Arrays.deepToString(encoding));
    }

    private static void checkCode(double code) {
        if (!(code >= 0.0 && code <= 1.0)) {
            throw new IllegalArgumentException("Encoding value out of [0, 1]: " + code);
        }
    }
}
