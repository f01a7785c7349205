package com.adlanda.resumetailor.model;

import com.adlanda.resumetailor.exception.ValidationException;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum LanguageProficiency {
    NATIVE,
    FLUENT,
    ADVANCED,
    INTERMEDIATE,
    BASIC;

    @JsonValue
    public String wireValue() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static LanguageProficiency fromWireValue(String value) {
        for (LanguageProficiency proficiency : values()) {
            if (proficiency.wireValue().equals(value)) {
                return proficiency;
            }
        }
        throw ValidationException.ofField("proficiency", "invalid language proficiency level: " + value);
    }
}
