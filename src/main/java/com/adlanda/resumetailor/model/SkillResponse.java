package com.adlanda.resumetailor.model;

public record SkillResponse(
        String id,
        String name,
        String category,
        int proficiency,
        Double yearsOfExperience,
        boolean highlighted
) {
    public static SkillResponse from(Skill skill) {
        return new SkillResponse(
                skill.getId(),
                skill.getName(),
                skill.getCategory(),
                skill.getProficiencyLevel().value(),
                skill.getYearsOfExperience(),
                skill.isHighlighted()
        );
    }
}
