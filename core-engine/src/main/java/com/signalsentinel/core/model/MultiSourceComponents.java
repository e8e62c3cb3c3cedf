package com.signalsentinel.core.model;

import java.io.Serializable;
import java.util.Objects;

/**
 * Layer-2 (multi-source) composite score and its six components, each in
 * [0, 1].
 *
 * @since 1.0.0
 */
public final class MultiSourceComponents implements Serializable {

    private static final long serialVersionUID = 1L;

    private final double frequency;
    private final double severity;
    private final double burst;
    private final double novelty;
    private final double consensus;
    private final double mechanism;
    private final double score;

    public MultiSourceComponents(double frequency, double severity, double burst, double novelty,
            double consensus, double mechanism, double score) {
        this.frequency = frequency;
        this.severity = severity;
        this.burst = burst;
        this.novelty = novelty;
        this.consensus = consensus;
        this.mechanism = mechanism;
        this.score = score;
    }

    public double getFrequency() {
        return frequency;
    }

    public double getSeverity() {
        return severity;
    }

    public double getBurst() {
        return burst;
    }

    public double getNovelty() {
        return novelty;
    }

    public double getConsensus() {
        return consensus;
    }

    public double getMechanism() {
        return mechanism;
    }

    public double getScore() {
        return score;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof MultiSourceComponents that))
            return false;
        return Double.compare(frequency, that.frequency) == 0
                && Double.compare(severity, that.severity) == 0
                && Double.compare(burst, that.burst) == 0
                && Double.compare(novelty, that.novelty) == 0
                && Double.compare(consensus, that.consensus) == 0
                && Double.compare(mechanism, that.mechanism) == 0
                && Double.compare(score, that.score) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(frequency, severity, burst, novelty, consensus, mechanism, score);
    }

    @Override
    public String toString() {
        return String.format(
                "MultiSourceComponents{frequency=%.3f severity=%.3f burst=%.3f novelty=%.3f "
                        + "consensus=%.3f mechanism=%.3f score=%.3f}",
                frequency, severity, burst, novelty, consensus, mechanism, score);
    }
}
