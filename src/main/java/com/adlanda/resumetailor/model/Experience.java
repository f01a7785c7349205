package com.adlanda.resumetailor.model;

import com.adlanda.resumetailor.exception.ErrorCode;
import com.adlanda.resumetailor.exception.ValidationException;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * A work, education or project entry that owns bullets.
 *
 * An end date never precedes the start date, and a current experience never
 * carries an end date.
 */
public class Experience {

    private final String id;
    private final String userId;
    private final ExperienceType type;
    private String title;
    private String organization;
    private String location;
    private CalendarDate startDate;
    private CalendarDate endDate = CalendarDate.ZERO;
    private boolean current;
    private String description;
    private String url;
    private int displayOrder;
    private final Instant createdAt;
    private Instant updatedAt;

    public Experience(String userId, ExperienceType type, String title, String organization, CalendarDate startDate) {
        this(UUID.randomUUID().toString(), userId, type, title, organization, startDate);
    }

    public Experience(String id, String userId, ExperienceType type, String title, String organization,
                      CalendarDate startDate) {
        this.id = id;
        this.userId = userId;
        this.type = Objects.requireNonNull(type, "type");
        this.title = title;
        this.organization = organization;
        this.startDate = startDate == null ? CalendarDate.ZERO : startDate;
        this.createdAt = Instant.now();
        this.updatedAt = createdAt;
    }

    public void validate() {
        ValidationException.Collector errors = new ValidationException.Collector();
        if (userId == null || userId.isBlank()) {
            errors.add("user_id", "user ID is required");
        }
        if (title == null || title.isBlank()) {
            errors.add("title", "title is required");
        }
        if (organization == null || organization.isBlank()) {
            errors.add("organization", "organization is required");
        }
        if (startDate.isZero()) {
            errors.add("start_date", "start date is required");
        }
        if (!endDate.isZero() && endDate.isBefore(startDate)) {
            errors.add("end_date", "end date must be after start date");
        }
        if (current && !endDate.isZero()) {
            errors.add("is_current", "current experience cannot have an end date");
        }
        errors.throwIfAny();
    }

    /**
     * Sets the end date. A real end date also clears the current flag.
     */
    public void setEndDate(CalendarDate endDate) {
        CalendarDate candidate = endDate == null ? CalendarDate.ZERO : endDate;
        if (!candidate.isZero() && candidate.isBefore(startDate)) {
            throw ValidationException.ofField(ErrorCode.INVALID_DATE_RANGE, "end_date",
                    "end date must be after start date");
        }
        this.endDate = candidate;
        if (!candidate.isZero()) {
            this.current = false;
        }
        touch();
    }

    public void setStartDate(CalendarDate startDate) {
        if (startDate == null || startDate.isZero()) {
            throw ValidationException.ofField("start_date", "start date is required");
        }
        if (!endDate.isZero() && endDate.isBefore(startDate)) {
            throw ValidationException.ofField(ErrorCode.INVALID_DATE_RANGE, "start_date",
                    "end date must be after start date");
        }
        this.startDate = startDate;
        touch();
    }

    public void markAsCurrent() {
        this.current = true;
        this.endDate = CalendarDate.ZERO;
        touch();
    }

    /**
     * Length in whole months, or -1 while the experience is ongoing.
     */
    public int durationMonths() {
        if (current || endDate.isZero()) {
            return -1;
        }
        int months = (endDate.toLocalDate().getYear() - startDate.toLocalDate().getYear()) * 12
                + endDate.toLocalDate().getMonthValue() - startDate.toLocalDate().getMonthValue();
        return Math.max(months, 0);
    }

    public void updateDetails(String title, String organization, String location, String description, String url) {
        this.title = title;
        this.organization = organization;
        this.location = location;
        this.description = description;
        this.url = url;
        touch();
    }

    public void setDisplayOrder(int displayOrder) {
        this.displayOrder = displayOrder;
        touch();
    }

    public String getId() {
        return id;
    }

    public String getUserId() {
        return userId;
    }

    public ExperienceType getType() {
        return type;
    }

    public String getTitle() {
        return title;
    }

    public String getOrganization() {
        return organization;
    }

    public String getLocation() {
        return location;
    }

    public CalendarDate getStartDate() {
        return startDate;
    }

    public CalendarDate getEndDate() {
        return endDate;
    }

    public boolean isCurrent() {
        return current;
    }

    public String getDescription() {
        return description;
    }

    public String getUrl() {
        return url;
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
}
