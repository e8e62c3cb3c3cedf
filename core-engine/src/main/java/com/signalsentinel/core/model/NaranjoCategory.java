package com.signalsentinel.core.model;

/**
 * Naranjo adverse drug reaction probability buckets.
 *
 * @since 1.0.0
 */
public enum NaranjoCategory {

    DEFINITE,
    PROBABLE,
    POSSIBLE,
    DOUBTFUL;

    /**
     * Bucket a total Naranjo score: &ge; 9 definite, 5–8 probable, 1–4
     * possible, &le; 0 doubtful.
     *
     * @param score total questionnaire score
     * @return the matching category
     */
    public static NaranjoCategory fromScore(int score) {
        if (score >= 9) {
            return DEFINITE;
        }
        if (score >= 5) {
            return PROBABLE;
        }
        if (score >= 1) {
            return POSSIBLE;
        }
        return DOUBTFUL;
    }
}
