package com.adlanda.resumetailor.model;

import com.adlanda.resumetailor.exception.ValidationException;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * How well an assembled resume fits a specific job, 0 to 100.
 */
public record MatchScore(@JsonValue int value) {

    public static final MatchScore ZERO = new MatchScore(0);

    public MatchScore {
        if (value < 0 || value > 100) {
            throw ValidationException.ofField("score", "match score must be between 0 and 100");
        }
    }

    public static MatchScore of(int value) {
        return new MatchScore(value);
    }
}
