package com.signalsentinel.core.model;

import java.io.Serializable;
import java.util.Objects;

/**
 * Layer-1 (single-source) composite score with every sub-score and boost.
 *
 * <p>
 * {@link #getScore()} is deliberately unbounded: interaction and tunneling
 * boosts are added on top of a base score in [0, 1]. Consumers that need a
 * bounded value apply their own squashing transform.
 * </p>
 *
 * @since 1.0.0
 */
public final class SingleSourceComponents implements Serializable {

    private static final long serialVersionUID = 1L;

    private final double rarity;
    private final double seriousness;
    private final double recency;
    private final double count;
    private final double baseScore;
    private final double rareSeriousBoost;
    private final double rareRecentBoost;
    private final double seriousRecentBoost;
    private final double allThreeBoost;
    private final double tunnelingBoost;

    private SingleSourceComponents(Builder b) {
        this.rarity = b.rarity;
        this.seriousness = b.seriousness;
        this.recency = b.recency;
        this.count = b.count;
        this.baseScore = b.baseScore;
        this.rareSeriousBoost = b.rareSeriousBoost;
        this.rareRecentBoost = b.rareRecentBoost;
        this.seriousRecentBoost = b.seriousRecentBoost;
        this.allThreeBoost = b.allThreeBoost;
        this.tunnelingBoost = b.tunnelingBoost;
    }

    public static Builder builder() {
        return new Builder();
    }

    public double getRarity() {
        return rarity;
    }

    public double getSeriousness() {
        return seriousness;
    }

    public double getRecency() {
        return recency;
    }

    public double getCount() {
        return count;
    }

    public double getBaseScore() {
        return baseScore;
    }

    public double getRareSeriousBoost() {
        return rareSeriousBoost;
    }

    public double getRareRecentBoost() {
        return rareRecentBoost;
    }

    public double getSeriousRecentBoost() {
        return seriousRecentBoost;
    }

    public double getAllThreeBoost() {
        return allThreeBoost;
    }

    public double getInteractionBoost() {
        return rareSeriousBoost + rareRecentBoost + seriousRecentBoost + allThreeBoost;
    }

    public double getTunnelingBoost() {
        return tunnelingBoost;
    }

    /** Base score plus all boosts; may exceed 1. */
    public double getScore() {
        return baseScore + getInteractionBoost() + tunnelingBoost;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof SingleSourceComponents that))
            return false;
        return Double.compare(rarity, that.rarity) == 0
                && Double.compare(seriousness, that.seriousness) == 0
                && Double.compare(recency, that.recency) == 0
                && Double.compare(count, that.count) == 0
                && Double.compare(baseScore, that.baseScore) == 0
                && Double.compare(rareSeriousBoost, that.rareSeriousBoost) == 0
                && Double.compare(rareRecentBoost, that.rareRecentBoost) == 0
                && Double.compare(seriousRecentBoost, that.seriousRecentBoost) == 0
                && Double.compare(allThreeBoost, that.allThreeBoost) == 0
                && Double.compare(tunnelingBoost, that.tunnelingBoost) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(rarity, seriousness, recency, count, baseScore, rareSeriousBoost,
                rareRecentBoost, seriousRecentBoost, allThreeBoost, tunnelingBoost);
    }

    @Override
    public String toString() {
        return String.format(
                "SingleSourceComponents{rarity=%.3f seriousness=%.3f recency=%.3f count=%.3f "
                        + "base=%.3f interaction=%.3f tunneling=%.3f score=%.3f}",
                rarity, seriousness, recency, count, baseScore, getInteractionBoost(),
                tunnelingBoost, getScore());
    }

    /**
     * Fluent builder for {@link SingleSourceComponents}.
     */
    public static class Builder {
        private double rarity;
        private double seriousness;
        private double recency;
        private double count;
        private double baseScore;
        private double rareSeriousBoost;
        private double rareRecentBoost;
        private double seriousRecentBoost;
        private double allThreeBoost;
        private double tunnelingBoost;

        public Builder subScores(double rarity, double seriousness, double recency, double count) {
            this.rarity = rarity;
            this.seriousness = seriousness;
            this.recency = recency;
            this.count = count;
            return this;
        }

        public Builder baseScore(double v) {
            this.baseScore = v;
            return this;
        }

        public Builder interactions(double rareSerious, double rareRecent, double seriousRecent,
                double allThree) {
            this.rareSeriousBoost = rareSerious;
            this.rareRecentBoost = rareRecent;
            this.seriousRecentBoost = seriousRecent;
            this.allThreeBoost = allThree;
            return this;
        }

        public Builder tunnelingBoost(double v) {
            this.tunnelingBoost = v;
            return this;
        }

        public SingleSourceComponents build() {
            return new SingleSourceComponents(this);
        }
    }
}
