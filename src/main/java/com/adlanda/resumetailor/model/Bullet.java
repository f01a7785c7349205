package com.adlanda.resumetailor.model;

import com.adlanda.resumetailor.exception.ErrorCode;
import com.adlanda.resumetailor.exception.ValidationException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * An atomic achievement or responsibility that can be selected for a resume
 * and rewritten for a specific job.
 */
public class Bullet {

    private final String id;
    private final String experienceId;
    private String content;
    private ImpactScore impactScore;
    private final Set<String> keywords = new LinkedHashSet<>();
    private final Map<String, Object> metadata = new LinkedHashMap<>();
    private int displayOrder;
    private final Instant createdAt;
    private Instant updatedAt;

    public Bullet(String experienceId, String content) {
        this(UUID.randomUUID().toString(), experienceId, content);
    }

    public Bullet(String id, String experienceId, String content) {
        requireContent(content);
        this.id = id;
        this.experienceId = experienceId;
        this.content = content;
        this.impactScore = ImpactScore.DEFAULT;
        this.createdAt = Instant.now();
        this.updatedAt = createdAt;
    }

    public void validate() {
        ValidationException.Collector errors = new ValidationException.Collector();
        if (experienceId == null || experienceId.isBlank()) {
            errors.add("experience_id", "experience ID is required");
        }
        if (content == null || content.isBlank()) {
            errors.add("content", "content is required");
        }
        errors.throwIfAny();
    }

    public void updateContent(String content) {
        requireContent(content);
        this.content = content;
        touch();
    }

    public void setImpactScore(int score) {
        this.impactScore = ImpactScore.of(score);
        touch();
    }

    public void setKeywords(Collection<String> keywords) {
        this.keywords.clear();
        if (keywords != null) {
            this.keywords.addAll(keywords);
        }
        touch();
    }

    public void addKeyword(String keyword) {
        if (keywords.add(keyword)) {
            touch();
        }
    }

    public boolean hasKeyword(String keyword) {
        return keywords.contains(keyword);
    }

    public void putMetadata(String key, Object value) {
        metadata.put(key, value);
        touch();
    }

    public void setDisplayOrder(int displayOrder) {
        this.displayOrder = displayOrder;
        touch();
    }

    public boolean isHighImpact() {
        return impactScore.isHighImpact();
    }

    public boolean isLowImpact() {
        return impactScore.isLowImpact();
    }

    public String getId() {
        return id;
    }

    public String getExperienceId() {
        return experienceId;
    }

    public String getContent() {
        return content;
    }

    public ImpactScore getImpactScore() {
        return impactScore;
    }

    public List<String> getKeywords() {
        return List.copyOf(new ArrayList<>(keywords));
    }

    public Map<String, Object> getMetadata() {
        return Map.copyOf(metadata);
    }

    public int getDisplayOrder() {
        return displayOrder;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    private void touch() {
        this.updatedAt = Instant.now();
    }

    private static void requireContent(String content) {
        if (content == null || content.isBlank()) {
            throw ValidationException.ofField(ErrorCode.VALIDATION_ERROR, "content", "bullet content cannot be empty");
        }
    }
}
