package com.adlanda.resumetailor.model;

import com.adlanda.resumetailor.exception.ValidationException;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Skill proficiency, 0 to 100.
 */
public record ProficiencyLevel(@JsonValue int value) {

    public static final ProficiencyLevel DEFAULT = new ProficiencyLevel(50);

    public ProficiencyLevel {
        if (value < 0 || value > 100) {
            throw ValidationException.ofField("proficiency_level", "proficiency level must be between 0 and 100");
        }
    }

    public static ProficiencyLevel of(int value) {
        return new ProficiencyLevel(value);
    }
}
