package com.signalsentinel.core.model;

import java.io.Serializable;
import java.util.Objects;

/**
 * How new a drug-event association is.
 *
 * <p>
 * The score mixes a recency term (decaying with days since first report), a
 * volume term (high when few reports have accumulated) and a growth term
 * (reports per elapsed period).
 * </p>
 *
 * @since 1.0.0
 */
public final class NoveltyResult implements Serializable {

    private static final long serialVersionUID = 1L;

    private final long daysSinceFirstReport;
    private final double recency;
    private final double volume;
    private final double growth;
    private final double score;
    private final boolean emerging;

    public NoveltyResult(long daysSinceFirstReport, double recency, double volume, double growth,
            double score, boolean emerging) {
        this.daysSinceFirstReport = daysSinceFirstReport;
        this.recency = recency;
        this.volume = volume;
        this.growth = growth;
        this.score = score;
        this.emerging = emerging;
    }

    public long getDaysSinceFirstReport() {
        return daysSinceFirstReport;
    }

    public double getRecency() {
        return recency;
    }

    public double getVolume() {
        return volume;
    }

    public double getGrowth() {
        return growth;
    }

    public double getScore() {
        return score;
    }

    public boolean isEmerging() {
        return emerging;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof NoveltyResult that))
            return false;
        return daysSinceFirstReport == that.daysSinceFirstReport
                && Double.compare(recency, that.recency) == 0
                && Double.compare(volume, that.volume) == 0
                && Double.compare(growth, that.growth) == 0
                && Double.compare(score, that.score) == 0
                && emerging == that.emerging;
    }

    @Override
    public int hashCode() {
        return Objects.hash(daysSinceFirstReport, recency, volume, growth, score, emerging);
    }

    @Override
    public String toString() {
        return String.format("NoveltyResult{days=%d score=%.3f%s}", daysSinceFirstReport, score,
                emerging ? " emerging" : "");
    }
}
