package com.signalsentinel.core.model;

/**
 * The ten Naranjo questions with the points awarded for a "yes" and a "no"
 * answer. An unknown answer always scores zero.
 *
 * @since 1.0.0
 */
public enum NaranjoQuestion {

    PREVIOUS_REPORTS("Are there previous conclusive reports on this reaction?", 1, 0),
    AFTER_DRUG("Did the adverse event appear after the suspected drug was administered?", 2, -1),
    DECHALLENGE("Did the reaction improve when the drug was discontinued?", 1, 0),
    RECHALLENGE("Did the reaction reappear when the drug was re-administered?", 2, -1),
    ALTERNATIVE_CAUSES("Are there alternative causes that could have caused the reaction?", -1, 2),
    PLACEBO("Did the reaction reappear when a placebo was given?", -1, 1),
    TOXIC_LEVEL("Was the drug detected in blood in concentrations known to be toxic?", 1, 0),
    DOSE_RESPONSE("Was the reaction more severe when the dose was increased?", 1, 0),
    PREVIOUS_SIMILAR("Did the patient have a similar reaction to the same or similar drugs?", 1, 0),
    OBJECTIVE_EVIDENCE("Was the adverse event confirmed by any objective evidence?", 1, 0);

    private final String text;
    private final int yesPoints;
    private final int noPoints;

    NaranjoQuestion(String text, int yesPoints, int noPoints) {
        this.text = text;
        this.yesPoints = yesPoints;
        this.noPoints = noPoints;
    }

    public String getText() {
        return text;
    }

    /**
     * @param answer the answer given
     * @return points contributed to the total score
     */
    public int points(Answer answer) {
        return switch (answer) {
            case YES -> yesPoints;
            case NO -> noPoints;
            case UNKNOWN -> 0;
        };
    }
}
