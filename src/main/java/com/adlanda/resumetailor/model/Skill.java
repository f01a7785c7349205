package com.adlanda.resumetailor.model;

import com.adlanda.resumetailor.exception.ValidationException;

import java.time.Instant;
import java.util.UUID;

/**
 * A named skill with a bounded proficiency. Only read by the pipeline, as scoring input.
 */
public class Skill {

    private final String id;
    private final String userId;
    private final String name;
    private String category;
    private ProficiencyLevel proficiencyLevel = ProficiencyLevel.DEFAULT;
    private Double yearsOfExperience;
    private boolean highlighted;
    private int displayOrder;
    private final Instant createdAt = Instant.now();

    public Skill(String userId, String name) {
        this(UUID.randomUUID().toString(), userId, name);
    }

    public Skill(String id, String userId, String name) {
        if (name == null || name.isBlank()) {
            throw ValidationException.ofField("name", "skill name cannot be empty");
        }
        this.id = id;
        this.userId = userId;
        this.name = name;
    }

    public void setProficiency(int level) {
        this.proficiencyLevel = ProficiencyLevel.of(level);
    }

    public void setCategory(String category) {
        this.category = (category == null || category.isBlank()) ? null : category;
    }

    public void setYearsOfExperience(double years) {
        this.yearsOfExperience = years <= 0 ? null : years;
    }

    public void highlight() {
        this.highlighted = true;
    }

    public void unhighlight() {
        this.highlighted = false;
    }

    public boolean isExpert() {
        return proficiencyLevel.value() >= 80;
    }

    public boolean isBeginner() {
        return proficiencyLevel.value() < 30;
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

    public String getName() {
        return name;
    }

    public String getCategory() {
        return category;
    }

    public ProficiencyLevel getProficiencyLevel() {
        return proficiencyLevel;
    }

    public Double getYearsOfExperience() {
        return yearsOfExperience;
    }

    public boolean isHighlighted() {
        return highlighted;
    }

    public int getDisplayOrder() {
        return displayOrder;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }
}
