package com.signalsentinel.job;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.signalsentinel.core.model.BayesianResult;
import com.signalsentinel.core.model.CausalityResult;
import com.signalsentinel.core.model.DisproportionalityResult;
import com.signalsentinel.core.model.FusionResult;
import com.signalsentinel.core.model.LatencyCategory;
import com.signalsentinel.core.model.LatencyDistribution;
import com.signalsentinel.core.model.MultiSourceComponents;
import com.signalsentinel.core.model.SingleSourceComponents;
import com.signalsentinel.core.model.TemporalResult;

import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Flat JSON shape of one {@link FusionResult}.
 *
 * <p>
 * Components that were not computed are left out of the JSON rather than
 * written as {@code null}.
 * </p>
 *
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ResultRecord {

    private String drug;
    private String event;
    private long observed;
    private LocalDate scoredOn;

    private Integer rank;
    private Double percentile;
    private Integer classicalRank;
    private Double fusionScore;
    private String alertTier;

    private Double evidenceScore;
    private Double layer1Score;
    private Double layer1Squashed;
    private Double layer2Score;

    private Double prr;
    private Double ror;
    private Double ic;
    private Double ic025;
    private String disproportionalityStrength;

    private Double ebgm;
    private Double eb05;
    private Double eb95;
    private Double rawPValue;
    private Double adjustedPValue;
    private Boolean fdrSignificant;

    private String whoUmcCategory;
    private Integer naranjoScore;
    private String naranjoCategory;
    private Double causalityConfidence;
    private String recommendation;

    private Double temporalRiskScore;
    private List<String> temporalFlags;
    private Map<String, Integer> latencyDistribution;
    private Double medianLatencyDays;

    private List<String> notes;
    private String errorKind;
    private String errorMessage;

    public ResultRecord() {
    }

    /**
     * @param result   engine output for one pair
     * @param scoredOn reference date of the batch
     */
    public static ResultRecord from(FusionResult result, LocalDate scoredOn) {
        Objects.requireNonNull(result, "FusionResult must not be null");
        ResultRecord r = new ResultRecord();
        r.drug = result.getDrug();
        r.event = result.getEvent();
        r.observed = result.getObserved();
        r.scoredOn = scoredOn;

        if (result.getRank().isPresent()) {
            r.rank = result.getRank().getAsInt();
        }
        if (result.getPercentile().isPresent()) {
            r.percentile = result.getPercentile().getAsDouble();
        }
        if (result.getClassicalRank().isPresent()) {
            r.classicalRank = result.getClassicalRank().getAsInt();
        }
        if (result.getFusionScore().isPresent()) {
            r.fusionScore = result.getFusionScore().getAsDouble();
        }
        result.getAlertTier().ifPresent(tier -> r.alertTier = tier.name());
        if (result.getEvidenceScore().isPresent()) {
            r.evidenceScore = result.getEvidenceScore().getAsDouble();
        }
        if (result.getLayer1Squashed().isPresent()) {
            r.layer1Squashed = result.getLayer1Squashed().getAsDouble();
        }
        result.getSingleSource().map(SingleSourceComponents::getScore).ifPresent(v -> r.layer1Score = v);
        result.getMultiSource().map(MultiSourceComponents::getScore).ifPresent(v -> r.layer2Score = v);

        result.getDisproportionality().ifPresent(r::copyDisproportionality);
        result.getBayesian().ifPresent(r::copyBayesian);
        result.getCausality().ifPresent(r::copyCausality);
        result.getTemporal().ifPresent(r::copyTemporal);

        r.notes = result.getNotes().isEmpty() ? null : result.getNotes();
        result.getError().ifPresent(error -> {
            r.errorKind = error.getKind().name();
            r.errorMessage = error.getMessage();
        });
        return r;
    }

    private void copyDisproportionality(DisproportionalityResult d) {
        prr = d.getPrr().getValue();
        ror = d.getRor().getValue();
        ic = d.getIc().getValue();
        ic025 = d.getIc().getLower();
        disproportionalityStrength = d.getStrength().name();
    }

    private void copyBayesian(BayesianResult b) {
        ebgm = b.getEbgm();
        eb05 = b.getEb05();
        eb95 = b.getEb95();
        rawPValue = b.getRawPValue();
        adjustedPValue = b.getAdjustedPValue();
        fdrSignificant = b.isFdrSignificant();
    }

    private void copyCausality(CausalityResult c) {
        whoUmcCategory = c.getWhoUmcCategory().name();
        naranjoScore = c.getNaranjoScore();
        naranjoCategory = c.getNaranjoCategory().name();
        causalityConfidence = c.getConfidence();
        recommendation = c.getRecommendation();
    }

    private void copyTemporal(TemporalResult t) {
        temporalRiskScore = t.getRiskScore();
        temporalFlags = t.getFlags();
        LatencyDistribution latency = t.getLatency();
        if (!latency.isEmpty()) {
            latencyDistribution = new LinkedHashMap<>();
            for (LatencyCategory category : LatencyCategory.values()) {
                latencyDistribution.put(category.name(), latency.getCount(category));
            }
            medianLatencyDays = latency.getMedianDays().getAsDouble();
        }
    }

    // ---------------------------------------------------------------
    // Getters (read by Jackson)
    // ---------------------------------------------------------------

    public String getDrug() {
        return drug;
    }

    public String getEvent() {
        return event;
    }

    public long getObserved() {
        return observed;
    }

    public LocalDate getScoredOn() {
        return scoredOn;
    }

    public Integer getRank() {
        return rank;
    }

    public Double getPercentile() {
        return percentile;
    }

    public Double getFusionScore() {
        return fusionScore;
    }

    public String getAlertTier() {
        return alertTier;
    }

    public Double getEvidenceScore() {
        return evidenceScore;
    }

    public Double getLayer1Score() {
        return layer1Score;
    }

    public Double getLayer1Squashed() {
        return layer1Squashed;
    }

    public Double getLayer2Score() {
        return layer2Score;
    }

    public Double getPrr() {
        return prr;
    }

    public Double getRor() {
        return ror;
    }

    public Double getIc() {
        return ic;
    }

    public Double getIc025() {
        return ic025;
    }

    public String getDisproportionalityStrength() {
        return disproportionalityStrength;
    }

    public Double getEbgm() {
        return ebgm;
    }

    public Double getEb05() {
        return eb05;
    }

    public Double getEb95() {
        return eb95;
    }

    public Double getRawPValue() {
        return rawPValue;
    }

    public Double getAdjustedPValue() {
        return adjustedPValue;
    }

    public Boolean getFdrSignificant() {
        return fdrSignificant;
    }

    public String getWhoUmcCategory() {
        return whoUmcCategory;
    }

    public Integer getNaranjoScore() {
        return naranjoScore;
    }

    public String getNaranjoCategory() {
        return naranjoCategory;
    }

    public Double getCausalityConfidence() {
        return causalityConfidence;
    }

    public String getRecommendation() {
        return recommendation;
    }

    public Double getTemporalRiskScore() {
        return temporalRiskScore;
    }

    public List<String> getTemporalFlags() {
        return temporalFlags;
    }

    public Integer getClassicalRank() {
        return classicalRank;
    }

    /** Cases per latency category, keyed by category name. */
    public Map<String, Integer> getLatencyDistribution() {
        return latencyDistribution;
    }

    public Double getMedianLatencyDays() {
        return medianLatencyDays;
    }

    public List<String> getNotes() {
        return notes;
    }

    public String getErrorKind() {
        return errorKind;
    }

    public String getErrorMessage() {
        return errorMessage;
    }

    @Override
    public String toString() {
        return "ResultRecord{" +
                "drug='" + drug + '\'' +
                ", event='" + event + '\'' +
                ", rank=" + rank +
                ", fusionScore=" + fusionScore +
                ", alertTier=" + alertTier +
                ", errorKind=" + errorKind +
                '}';
    }
}
