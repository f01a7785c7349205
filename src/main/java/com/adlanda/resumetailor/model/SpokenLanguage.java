package com.adlanda.resumetailor.model;

import com.adlanda.resumetailor.exception.ValidationException;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

public class SpokenLanguage {

    private final String id;
    private final String userId;
    private final String language;
    private LanguageProficiency proficiency;
    private int displayOrder;
    private final Instant createdAt = Instant.now();

    public SpokenLanguage(String userId, String language, LanguageProficiency proficiency) {
        if (language == null || language.isBlank()) {
            throw ValidationException.ofField("language", "language is required");
        }
        this.id = UUID.randomUUID().toString();
        this.userId = userId;
        this.language = language;
        this.proficiency = Objects.requireNonNull(proficiency, "proficiency");
    }

    public void setProficiency(LanguageProficiency proficiency) {
        this.proficiency = Objects.requireNonNull(proficiency, "proficiency");
    }

    public boolean isNative() {
        return proficiency == LanguageProficiency.NATIVE;
    }

    public boolean isFluent() {
        return proficiency == LanguageProficiency.NATIVE || proficiency == LanguageProficiency.FLUENT;
    }

    public void setDisplayOrder(int displayOrder) {
        this.displayOrder = displayOrder;
    }

    public String getId() {
        return id;
    }

    public String getUserId() {
        return userId;
    }

    public String getLanguage() {
        return language;
    }

    public LanguageProficiency getProficiency() {
        return proficiency;
    }

    public int getDisplayOrder() {
        return displayOrder;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }
}
