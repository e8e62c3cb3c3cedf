package com.signalsentinel.core.config;

import java.io.Serializable;
import java.util.List;

/**
 * WHO-UMC decision table parameters.
 *
 * @since 1.0.0
 */
public class CausalitySettings implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Onsets later than this many days after exposure are implausible. */
    private int maxPlausibleOnsetDays = 90;

    /** This many alternative causes make the drug an unlikely cause. */
    private int alternativeCausesForUnlikely = 2;

    void validate(List<String> errors) {
        if (maxPlausibleOnsetDays < 0) {
            errors.add("causality.maxPlausibleOnsetDays must be >= 0, got: " + maxPlausibleOnsetDays);
        }
        if (alternativeCausesForUnlikely < 1) {
            errors.add("causality.alternativeCausesForUnlikely must be >= 1, got: "
                    + alternativeCausesForUnlikely);
        }
    }

    public int getMaxPlausibleOnsetDays() {
        return maxPlausibleOnsetDays;
    }

    public void setMaxPlausibleOnsetDays(int maxPlausibleOnsetDays) {
        this.maxPlausibleOnsetDays = maxPlausibleOnsetDays;
    }

    public int getAlternativeCausesForUnlikely() {
        return alternativeCausesForUnlikely;
    }

    public void setAlternativeCausesForUnlikely(int alternativeCausesForUnlikely) {
        this.alternativeCausesForUnlikely = alternativeCausesForUnlikely;
    }

    @Override
    public String toString() {
        return "CausalitySettings{maxPlausibleOnsetDays=" + maxPlausibleOnsetDays + '}';
    }
}
