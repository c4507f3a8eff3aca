package org.satplan.optimizers;

import org.satplan.exceptions.InvalidConfigurationException;

import java.util.ArrayDeque;
import java.util.Deque;

public class TabuList {
    private final int tenure;
    private final Deque<SolutionFingerprint> fingerprints;

    public TabuList(int tenure) {
        if (tenure <= 0) throw new InvalidConfigurationException("Tabu tenure must be positive: " + tenure);
        this.tenure = tenure;
        this.fingerprints = new ArrayDeque<>(tenure);
    }

    public boolean contains(SolutionFingerprint fingerprint) {
        return fingerprints.contains(fingerprint);
    }

    public void push(SolutionFingerprint fingerprint) {
        if (fingerprints.size() == tenure) fingerprints.removeFirst();
        fingerprints.addLast(fingerprint);
    }

    public int size() {
        return fingerprints.size();
    }

    public int getTenure() {
        return tenure;
    }

    public void clear() {
        fingerprints.clear();
    }
}
