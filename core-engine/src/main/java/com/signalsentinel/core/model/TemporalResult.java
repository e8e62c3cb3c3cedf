package com.signalsentinel.core.model;

import java.io.Serializable;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Everything the temporal analyzer found in one pair's time series.
 *
 * @since 1.0.0
 */
public final class TemporalResult implements Serializable {

    private static final long serialVersionUID = 1L;

    private final List<SpikeEvent> spikes;
    private final boolean recentSpike;
    private final TrendResult trend;
    private final NoveltyResult novelty;
    private final List<ChangePoint> changePoints;
    private final double riskScore;
    private final List<String> flags;
    private final LatencyDistribution latency;

    private TemporalResult(Builder b) {
        this.spikes = List.copyOf(b.spikes);
        this.recentSpike = b.recentSpike;
        this.trend = b.trend;
        this.novelty = Objects.requireNonNull(b.novelty, "novelty must not be null");
        this.changePoints = List.copyOf(b.changePoints);
        this.riskScore = b.riskScore;
        this.flags = List.copyOf(b.flags);
        this.latency = Objects.requireNonNull(b.latency, "latency must not be null");
    }

    public static Builder builder() {
        return new Builder();
    }

    public List<SpikeEvent> getSpikes() {
        return spikes;
    }

    public boolean hasRecentSpike() {
        return recentSpike;
    }

    /**
     * @return largest fold increase over all spikes, {@code 0} when none
     */
    public double getMaxSpikeFold() {
        double max = 0;
        for (SpikeEvent spike : spikes) {
            max = Math.max(max, spike.getFoldIncrease());
        }
        return max;
    }

    /**
     * @return the trend; empty when the series was too short to fit one
     */
    public Optional<TrendResult> getTrend() {
        return Optional.ofNullable(trend);
    }

    public NoveltyResult getNovelty() {
        return novelty;
    }

    public List<ChangePoint> getChangePoints() {
        return changePoints;
    }

    public double getRiskScore() {
        return riskScore;
    }

    public List<String> getFlags() {
        return flags;
    }

    /**
     * @return time-to-onset distribution of the pair's cases; empty when no
     *         onset was reported
     */
    public LatencyDistribution getLatency() {
        return latency;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof TemporalResult that))
            return false;
        return recentSpike == that.recentSpike
                && Double.compare(riskScore, that.riskScore) == 0
                && spikes.equals(that.spikes)
                && Objects.equals(trend, that.trend)
                && novelty.equals(that.novelty)
                && changePoints.equals(that.changePoints)
                && flags.equals(that.flags)
                && latency.equals(that.latency);
    }

    @Override
    public int hashCode() {
        return Objects.hash(spikes, recentSpike, trend, novelty, changePoints, riskScore, flags, latency);
    }

    @Override
    public String toString() {
        return "TemporalResult{" +
                "spikes=" + spikes.size() +
                ", recentSpike=" + recentSpike +
                ", trend=" + trend +
                ", novelty=" + novelty +
                ", changePoints=" + changePoints.size() +
                ", riskScore=" + String.format("%.3f", riskScore) +
                '}';
    }

    /**
     * Fluent builder for {@link TemporalResult}.
     */
    public static class Builder {
        private List<SpikeEvent> spikes = List.of();
        private boolean recentSpike;
        private TrendResult trend;
        private NoveltyResult novelty;
        private List<ChangePoint> changePoints = List.of();
        private double riskScore;
        private List<String> flags = List.of();
        private LatencyDistribution latency = LatencyDistribution.empty();

        public Builder spikes(List<SpikeEvent> v, boolean recent) {
            this.spikes = v;
            this.recentSpike = recent;
            return this;
        }

        public Builder trend(TrendResult v) {
            this.trend = v;
            return this;
        }

        public Builder novelty(NoveltyResult v) {
            this.novelty = v;
            return this;
        }

        public Builder changePoints(List<ChangePoint> v) {
            this.changePoints = v;
            return this;
        }

        public Builder riskScore(double score, List<String> flags) {
            this.riskScore = score;
            this.flags = flags;
            return this;
        }

        public Builder latency(LatencyDistribution v) {
            this.latency = v;
            return this;
        }

        public TemporalResult build() {
            return new TemporalResult(this);
        }
    }
}
