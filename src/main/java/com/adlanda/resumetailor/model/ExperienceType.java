package com.adlanda.resumetailor.model;

import com.adlanda.resumetailor.exception.ValidationException;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ExperienceType {
    WORK,
    EDUCATION,
    CERTIFICATION,
    PROJECT,
    FREELANCE,
    VOLUNTEER,
    OPEN_SOURCE,
    HACKATHON,
    SIDE_PROJECT,
    EVENT_ORGANIZATION,
    PUBLICATION,
    AWARD;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static ExperienceType fromWireValue(String value) {
        for (ExperienceType type : values()) {
            if (type.wireValue().equals(value)) {
                return type;
            }
        }
        throw ValidationException.ofField("type", "invalid experience type: " + value);
    }
}
