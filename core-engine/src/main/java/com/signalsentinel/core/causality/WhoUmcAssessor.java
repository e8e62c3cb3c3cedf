package com.signalsentinel.core.causality;

import com.signalsentinel.core.config.CausalitySettings;
import com.signalsentinel.core.model.ClinicalFeatures;
import com.signalsentinel.core.model.DechallengeOutcome;
import com.signalsentinel.core.model.RechallengeOutcome;
import com.signalsentinel.core.model.WhoUmcCategory;

import java.util.Objects;
import java.util.OptionalInt;

/**
 * WHO-UMC causality decision table.
 *
 * <p>
 * Rules are evaluated in a fixed order and the first match decides:
 * </p>
 * <ol>
 * <li>no usable evidence at all (onset, dechallenge and rechallenge all
 * unknown): {@code UNASSESSABLE}</li>
 * <li>onset known but outside {@code [0, maxPlausibleOnsetDays]}:
 * {@code UNLIKELY}</li>
 * <li>onset unknown: {@code CONDITIONAL}</li>
 * <li>positive rechallenge, no alternative cause, dechallenge not
 * contradicting: {@code CERTAIN}</li>
 * <li>no alternative cause and positive dechallenge: {@code PROBABLE}</li>
 * <li>several alternative causes, or the indication itself explains the
 * event: {@code UNLIKELY}</li>
 * <li>negative dechallenge and negative rechallenge: {@code UNLIKELY}</li>
 * <li>otherwise: {@code POSSIBLE}</li>
 * </ol>
 *
 * @since 1.0.0
 */
public class WhoUmcAssessor {

    private final CausalitySettings settings;

    public WhoUmcAssessor(CausalitySettings settings) {
        this.settings = Objects.requireNonNull(settings, "CausalitySettings must not be null");
    }

    /**
     * Outcome of the decision table.
     */
    public static final class Verdict {
        private final WhoUmcCategory category;
        private final String reasoning;

        Verdict(WhoUmcCategory category, String reasoning) {
            this.category = category;
            this.reasoning = reasoning;
        }

        public WhoUmcCategory getCategory() {
            return category;
        }

        public String getReasoning() {
            return reasoning;
        }
    }

    public Verdict assess(ClinicalFeatures features) {
        Objects.requireNonNull(features, "ClinicalFeatures must not be null");

        OptionalInt onset = features.getTimeToOnsetDays();
        DechallengeOutcome dechallenge = features.getDechallenge();
        RechallengeOutcome rechallenge = features.getRechallenge();
        boolean alternatives = features.hasAlternativeCauses();

        if (onset.isEmpty()
                && dechallenge == DechallengeOutcome.UNKNOWN
                && rechallenge == RechallengeOutcome.NOT_ATTEMPTED) {
            return new Verdict(WhoUmcCategory.UNASSESSABLE,
                    "No onset, dechallenge or rechallenge information");
        }

        if (onset.isPresent() && !isPlausibleOnset(onset.getAsInt())) {
            return new Verdict(WhoUmcCategory.UNLIKELY,
                    "Time to onset of " + onset.getAsInt() + " days is outside the plausible window of 0-"
                            + settings.getMaxPlausibleOnsetDays() + " days");
        }

        if (onset.isEmpty()) {
            return new Verdict(WhoUmcCategory.CONDITIONAL,
                    "Time to onset unknown; more data needed for a proper assessment");
        }

        if (rechallenge == RechallengeOutcome.RECURRED
                && !alternatives
                && dechallenge != DechallengeOutcome.UNCHANGED) {
            return new Verdict(WhoUmcCategory.CERTAIN,
                    "Plausible onset, positive rechallenge, no alternative causes");
        }

        if (!alternatives && dechallenge == DechallengeOutcome.IMPROVED) {
            return new Verdict(WhoUmcCategory.PROBABLE,
                    "Plausible onset, positive dechallenge, no alternative causes");
        }

        if (features.getAlternativeCauses().size() >= settings.getAlternativeCausesForUnlikely()
                || features.isIndicationCouldCauseEvent()) {
            return new Verdict(WhoUmcCategory.UNLIKELY,
                    "Event better explained by alternative causes: " + describeAlternatives(features));
        }

        if (dechallenge == DechallengeOutcome.UNCHANGED && rechallenge == RechallengeOutcome.DID_NOT_RECUR) {
            return new Verdict(WhoUmcCategory.UNLIKELY,
                    "Negative dechallenge and negative rechallenge");
        }

        StringBuilder reasoning = new StringBuilder("Plausible onset (")
                .append(onset.getAsInt()).append(" days)");
        if (alternatives) {
            reasoning.append(", alternative causes exist: ").append(describeAlternatives(features));
        }
        if (dechallenge == DechallengeOutcome.UNKNOWN) {
            reasoning.append(", dechallenge information lacking");
        }
        return new Verdict(WhoUmcCategory.POSSIBLE, reasoning.toString());
    }

    boolean isPlausibleOnset(int days) {
        return days >= 0 && days <= settings.getMaxPlausibleOnsetDays();
    }

    private static String describeAlternatives(ClinicalFeatures features) {
        if (features.getAlternativeCauses().isEmpty()) {
            return "indication";
        }
        return String.join(", ", features.getAlternativeCauses());
    }
}
