package com.adlanda.resumetailor.model;

import com.adlanda.resumetailor.exception.ValidationException;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Perceived strength of a bullet, 0 to 100.
 *
 * @param value the score; construction fails outside [0, 100]
 */
public record ImpactScore(@JsonValue int value) {

    public static final ImpactScore DEFAULT = new ImpactScore(50);

    public ImpactScore {
        if (value < 0 || value > 100) {
            throw ValidationException.ofField("impact_score", "impact score must be between 0 and 100");
        }
    }

    public static ImpactScore of(int value) {
        return new ImpactScore(value);
    }

    public boolean isHighImpact() {
        return value >= 70;
    }

    public boolean isLowImpact() {
        return value < 40;
    }
}
