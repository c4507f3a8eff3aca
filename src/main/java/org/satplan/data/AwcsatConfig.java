package org.satplan.data;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;
import org.satplan.exceptions.InvalidConfigurationException;

@Getter
@ToString
@Builder(toBuilder = true)
public class AwcsatConfig {
    @Builder.Default
    private final int outerLoops = 3000;
    @Builder.Default
    private final int initialInnerLoops = 200;
    @Builder.Default
    private final int tabuTenure = 5;
    @Builder.Default
    private final double initialTempCoef = 0.9;
    @Builder.Default
    private final double waveN = 1.0;
    @Builder.Default
    private final double waveC = 0.25;
    @Builder.Default
    private final int initialSampleSize = 10;
    private final Long randomSeed;
    @Builder.Default
    private final double timeLimitSec = 300.0;
    @Builder.Default
    private final double stripExtensionMax = 1.0;
    @Builder.Default
    private final double stripExtensionMin = 0.0;
    @Builder.Default
    private final double minTemperature = 1e-10;
    @Builder.Default
    private final double defaultTemperature = 100.0;

    public static AwcsatConfig defaults() {
        return builder().build();
    }

    public void validate() {
        require(outerLoops > 0, "outerLoops must be positive: " + outerLoops);
        require(initialInnerLoops > 0, "initialInnerLoops must be positive: " + initialInnerLoops);
        require(tabuTenure > 0, "tabuTenure must be positive: " + tabuTenure);
        require(initialSampleSize > 0, "initialSampleSize must be positive: " + initialSampleSize);
        require(timeLimitSec > 0, "timeLimitSec must be positive: " + timeLimitSec);
        require(stripExtensionMax >= stripExtensionMin,
                "stripExtensionMax " + stripExtensionMax + " is below stripExtensionMin " + stripExtensionMin);
        require(minTemperature > 0, "minTemperature must be positive: " + minTemperature);
        require(defaultTemperature > 0, "defaultTemperature must be positive: " + defaultTemperature);
    }

    private static void require(boolean condition, String message) {
        if (!condition) throw new InvalidConfigurationException(message);
    }
}
