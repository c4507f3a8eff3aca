package org.satplan.optimizers;

import lombok.AccessLevel;
import lombok.EqualsAndHashCode;
import lombok.RequiredArgsConstructor;

/**
 * Encoding rounded to two decimals and kept as scaled integers, so equal fingerprints do not depend on
 * floating point hashing.
 */
@EqualsAndHashCode
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class SolutionFingerprint {
    private static final double SCALE = 100.0;

    private final long[] scaledCodes;

    static SolutionFingerprint of(double[][] encoding) {
        final var columns = encoding.length == 0 ? 0 : encoding[0].length;
        final var scaled = new long[encoding.length * columns];
        var position = 0;
        for (final var row : encoding) {
            for (final var code : row) {
                scaled[position++] = Math.round(code * SCALE);
            }
        }
        return new SolutionFingerprint(scaled);
    }
}
