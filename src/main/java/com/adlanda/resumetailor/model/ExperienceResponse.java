package com.adlanda.resumetailor.model;

public record ExperienceResponse(
        String id,
        ExperienceType type,
        String title,
        String organization,
        String location,
        CalendarDate startDate,
        CalendarDate endDate,
        boolean current,
        int displayOrder
) {
    public static ExperienceResponse from(Experience experience) {
        return new ExperienceResponse(
                experience.getId(),
                experience.getType(),
                experience.getTitle(),
                experience.getOrganization(),
                experience.getLocation(),
                experience.getStartDate(),
                experience.getEndDate().isZero() ? null : experience.getEndDate(),
                experience.isCurrent(),
                experience.getDisplayOrder()
        );
    }
}
