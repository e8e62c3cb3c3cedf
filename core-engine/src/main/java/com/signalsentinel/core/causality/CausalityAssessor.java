package com.signalsentinel.core.causality;

import com.signalsentinel.core.config.CausalitySettings;
import com.signalsentinel.core.model.Answer;
import com.signalsentinel.core.model.CausalityResult;
import com.signalsentinel.core.model.ClinicalFeatures;
import com.signalsentinel.core.model.DechallengeOutcome;
import com.signalsentinel.core.model.NaranjoQuestion;
import com.signalsentinel.core.model.RechallengeOutcome;
import com.signalsentinel.core.model.WhoUmcCategory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Runs the WHO-UMC and Naranjo procedures side by side and derives a
 * causality confidence.
 *
 * <h3>Confidence</h3>
 * <p>
 * Starts from the {@linkplain WhoUmcCategory#getBaseConfidence() base
 * confidence} of the WHO-UMC category, then adds:
 * </p>
 * <ul>
 * <li>+0.10 for a definite Naranjo score (&ge; 9), +0.05 for a probable one
 * (&ge; 5)</li>
 * <li>+0.15 for a positive rechallenge, otherwise +0.08 for a positive
 * dechallenge</li>
 * <li>+0.05 when no alternative cause is known</li>
 * </ul>
 * <p>
 * The sum is capped at {@value #MAX_CONFIDENCE}.
 * </p>
 *
 * <p>
 * Stateless and thread-safe.
 * </p>
 *
 * @since 1.0.0
 */
public class CausalityAssessor {

    private static final Logger LOG = LoggerFactory.getLogger(CausalityAssessor.class);

    /** Causality is never reported as fully certain. */
    static final double MAX_CONFIDENCE = 0.98;

    private final WhoUmcAssessor whoUmc;

    public CausalityAssessor(CausalitySettings settings) {
        this.whoUmc = new WhoUmcAssessor(Objects.requireNonNull(settings, "CausalitySettings must not be null"));
    }

    public CausalityResult assess(ClinicalFeatures features) {
        Objects.requireNonNull(features, "ClinicalFeatures must not be null");

        WhoUmcAssessor.Verdict verdict = whoUmc.assess(features);
        Map<NaranjoQuestion, Answer> answers = NaranjoScorer.answers(features);
        int naranjo = NaranjoScorer.score(answers);

        double confidence = confidence(verdict.getCategory(), naranjo, features);
        List<String> supporting = new ArrayList<>();
        List<String> conflicting = new ArrayList<>();
        identifyFactors(features, supporting, conflicting);

        CausalityResult result = CausalityResult.builder()
                .whoUmc(verdict.getCategory(), verdict.getReasoning())
                .naranjo(naranjo, answers)
                .confidence(confidence)
                .supportingFactors(supporting)
                .conflictingFactors(conflicting)
                .recommendation(recommendation(verdict.getCategory()))
                .build();

        LOG.debug("Causality assessed: {}", result);
        return result;
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    static double confidence(WhoUmcCategory category, int naranjo, ClinicalFeatures features) {
        double confidence = category.getBaseConfidence();

        if (naranjo >= 9) {
            confidence += 0.10;
        } else if (naranjo >= 5) {
            confidence += 0.05;
        }

        if (features.getRechallenge() == RechallengeOutcome.RECURRED) {
            confidence += 0.15;
        } else if (features.getDechallenge() == DechallengeOutcome.IMPROVED) {
            confidence += 0.08;
        }

        if (!features.hasAlternativeCauses()) {
            confidence += 0.05;
        }

        return Math.min(MAX_CONFIDENCE, confidence);
    }

    private void identifyFactors(ClinicalFeatures features, List<String> supporting, List<String> conflicting) {
        features.getTimeToOnsetDays().ifPresent(days -> {
            if (!whoUmc.isPlausibleOnset(days)) {
                conflicting.add("Implausible onset (" + days + " days)");
            } else if (days <= 30) {
                supporting.add("Temporal relationship present (onset in " + days + " days)");
            } else {
                conflicting.add("Delayed onset (" + days + " days)");
            }
        });

        switch (features.getDechallenge()) {
            case IMPROVED -> supporting.add("Positive dechallenge (event improved when drug stopped)");
            case UNCHANGED -> conflicting.add("Negative dechallenge (event persisted after withdrawal)");
            default -> {
            }
        }

        switch (features.getRechallenge()) {
            case RECURRED -> supporting.add("Positive rechallenge (event recurred when drug restarted)");
            case DID_NOT_RECUR -> conflicting.add("Negative rechallenge (event did not recur)");
            default -> {
            }
        }

        if (features.hasAlternativeCauses()) {
            conflicting.add("Alternative causes present: " + String.join(", ", features.getAlternativeCauses()));
        } else {
            supporting.add("No alternative causes identified");
        }
        if (features.isIndicationCouldCauseEvent()) {
            conflicting.add("Underlying indication could cause the event");
        }
        if (features.getKnownReaction() == Answer.YES) {
            supporting.add("Previously reported reaction for this drug");
        }
        if (features.getDoseResponse() == Answer.YES) {
            supporting.add("Dose-response relationship observed");
        }
        if (features.getObjectiveEvidence() == Answer.YES) {
            supporting.add("Confirmed by objective evidence");
        }
    }

    private static String recommendation(WhoUmcCategory category) {
        return switch (category) {
            case CERTAIN, PROBABLE -> "Strong causal relationship established. Consider as validated signal.";
            case POSSIBLE -> "Possible causal relationship. Further evaluation recommended.";
            case UNLIKELY -> "Causal relationship unlikely. Consider alternative causes.";
            case CONDITIONAL, UNASSESSABLE -> "Insufficient data for causality assessment. Gather "
                    + "dechallenge, rechallenge and timing information.";
        };
    }
}
