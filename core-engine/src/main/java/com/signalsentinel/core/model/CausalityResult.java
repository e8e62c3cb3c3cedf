package com.signalsentinel.core.model;

import java.io.Serializable;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Side-by-side WHO-UMC and Naranjo verdicts for one pair.
 *
 * <p>
 * The two procedures answer differently shaped questions and are never
 * merged into a single category. The {@code confidence} figure is derived
 * from both, plus the strongest individual pieces of evidence, and is capped
 * below certainty.
 * </p>
 *
 * @since 1.0.0
 */
public final class CausalityResult implements Serializable {

    private static final long serialVersionUID = 1L;

    private final WhoUmcCategory whoUmcCategory;
    private final String whoUmcReasoning;
    private final int naranjoScore;
    private final NaranjoCategory naranjoCategory;
    private final Map<NaranjoQuestion, Answer> naranjoAnswers;
    private final double confidence;
    private final List<String> supportingFactors;
    private final List<String> conflictingFactors;
    private final String recommendation;

    private CausalityResult(Builder b) {
        this.whoUmcCategory = Objects.requireNonNull(b.whoUmcCategory, "whoUmcCategory must not be null");
        this.whoUmcReasoning = Objects.requireNonNull(b.whoUmcReasoning, "whoUmcReasoning must not be null");
        this.naranjoScore = b.naranjoScore;
        this.naranjoCategory = NaranjoCategory.fromScore(b.naranjoScore);
        this.naranjoAnswers = Collections.unmodifiableMap(new EnumMap<>(b.naranjoAnswers));
        this.confidence = b.confidence;
        this.supportingFactors = List.copyOf(b.supportingFactors);
        this.conflictingFactors = List.copyOf(b.conflictingFactors);
        this.recommendation = Objects.requireNonNull(b.recommendation, "recommendation must not be null");
    }

    public static Builder builder() {
        return new Builder();
    }

    public WhoUmcCategory getWhoUmcCategory() {
        return whoUmcCategory;
    }

    public String getWhoUmcReasoning() {
        return whoUmcReasoning;
    }

    public int getNaranjoScore() {
        return naranjoScore;
    }

    public NaranjoCategory getNaranjoCategory() {
        return naranjoCategory;
    }

    public Map<NaranjoQuestion, Answer> getNaranjoAnswers() {
        return naranjoAnswers;
    }

    public double getConfidence() {
        return confidence;
    }

    public List<String> getSupportingFactors() {
        return supportingFactors;
    }

    public List<String> getConflictingFactors() {
        return conflictingFactors;
    }

    public String getRecommendation() {
        return recommendation;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof CausalityResult that))
            return false;
        return whoUmcCategory == that.whoUmcCategory
                && naranjoScore == that.naranjoScore
                && Double.compare(confidence, that.confidence) == 0
                && whoUmcReasoning.equals(that.whoUmcReasoning)
                && naranjoAnswers.equals(that.naranjoAnswers)
                && supportingFactors.equals(that.supportingFactors)
                && conflictingFactors.equals(that.conflictingFactors)
                && recommendation.equals(that.recommendation);
    }

    @Override
    public int hashCode() {
        return Objects.hash(whoUmcCategory, naranjoScore, confidence, naranjoAnswers);
    }

    @Override
    public String toString() {
        return "CausalityResult{" +
                "whoUmc=" + whoUmcCategory +
                ", naranjo=" + naranjoScore + " (" + naranjoCategory + ")" +
                ", confidence=" + String.format("%.2f", confidence) +
                '}';
    }

    /**
     * Fluent builder for {@link CausalityResult}.
     */
    public static class Builder {
        private WhoUmcCategory whoUmcCategory;
        private String whoUmcReasoning;
        private int naranjoScore;
        private Map<NaranjoQuestion, Answer> naranjoAnswers = new EnumMap<>(NaranjoQuestion.class);
        private double confidence;
        private List<String> supportingFactors = List.of();
        private List<String> conflictingFactors = List.of();
        private String recommendation = "";

        public Builder whoUmc(WhoUmcCategory category, String reasoning) {
            this.whoUmcCategory = category;
            this.whoUmcReasoning = reasoning;
            return this;
        }

        public Builder naranjo(int score, Map<NaranjoQuestion, Answer> answers) {
            this.naranjoScore = score;
            this.naranjoAnswers = new EnumMap<>(NaranjoQuestion.class);
            this.naranjoAnswers.putAll(answers);
            return this;
        }

        public Builder confidence(double v) {
            this.confidence = v;
            return this;
        }

        public Builder supportingFactors(List<String> v) {
            this.supportingFactors = v;
            return this;
        }

        public Builder conflictingFactors(List<String> v) {
            this.conflictingFactors = v;
            return this;
        }

        public Builder recommendation(String v) {
            this.recommendation = v;
            return this;
        }

        public CausalityResult build() {
            return new CausalityResult(this);
        }
    }
}
