package org.satplan.optimizers;

import org.junit.jupiter.api.Test;
import org.satplan.exceptions.InvalidConfigurationException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TabuListTest {

    @Test
    void evictsTheOldestFingerprintWhenFull() {
        final var tabuList = new TabuList(2);
        final var first = fingerprint(0.1);
        final var second = fingerprint(0.2);
        final var third = fingerprint(0.3);

        tabuList.push(first);
        tabuList.push(second);
        assertThat(tabuList.contains(first)).isTrue();

        tabuList.push(third);

        assertThat(tabuList.size()).isEqualTo(2);
        assertThat(tabuList.contains(first)).isFalse();
        assertThat(tabuList.contains(second)).isTrue();
        assertThat(tabuList.contains(third)).isTrue();
    }

    @Test
    void rejectsNonPositiveTenure() {
        assertThatThrownBy(() -> new TabuList(0)).isInstanceOf(InvalidConfigurationException.class);
        assertThatThrownBy(() -> new TabuList(-3)).isInstanceOf(InvalidConfigurationException.class);
    }

    private static SolutionFingerprint fingerprint(double code) {
        return new AwcsatSolution(new double[][]{{code, code, code}}).fingerprint();
    }
}
