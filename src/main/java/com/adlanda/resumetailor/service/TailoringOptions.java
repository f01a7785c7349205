package com.adlanda.resumetailor.service;

import com.adlanda.resumetailor.model.ExperienceType;

import java.util.List;
import java.util.Set;

/**
 * Caller knobs for one tailoring run.
 *
 * @param maxBullets              Bullets to keep in total; 0 means the configured default
 * @param maxBulletsPerExperience Cap per experience; 0 means no cap
 * @param experienceTypes         Experience types eligible for selection; empty means all
 * @param highlightSkills         Skill names surfaced first on the resume
 * @param style                   Writing style for bullet rewrites; null means the configured default
 */
public record TailoringOptions(
        int maxBullets,
        int maxBulletsPerExperience,
        Set<ExperienceType> experienceTypes,
        List<String> highlightSkills,
        String style
) {
    public static final TailoringOptions DEFAULTS = new TailoringOptions(0, 0, Set.of(), List.of(), null);

    public TailoringOptions {
        if (maxBullets < 0) {
            maxBullets = 0;
        }
        if (maxBulletsPerExperience < 0) {
            maxBulletsPerExperience = 0;
        }
        experienceTypes = experienceTypes == null ? Set.of() : Set.copyOf(experienceTypes);
        highlightSkills = highlightSkills == null ? List.of() : List.copyOf(highlightSkills);
        if (style != null && style.isBlank()) {
            style = null;
        }
    }

    public TailoringOptions withMaxBullets(int maxBullets) {
        return new TailoringOptions(maxBullets, maxBulletsPerExperience, experienceTypes, highlightSkills, style);
    }

    /**
     * Fills unset values from the given defaults.
     */
    TailoringOptions withDefaults(int defaultMaxBullets, String defaultStyle) {
        return new TailoringOptions(
                maxBullets > 0 ? maxBullets : defaultMaxBullets,
                maxBulletsPerExperience,
                experienceTypes,
                highlightSkills,
                style != null ? style : defaultStyle);
    }

    boolean includes(ExperienceType type) {
        return experienceTypes.isEmpty() || experienceTypes.contains(type);
    }
}
