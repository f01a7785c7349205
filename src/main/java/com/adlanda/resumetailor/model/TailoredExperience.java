package com.adlanda.resumetailor.model;

import java.util.List;

/**
 * An experience entry as it appears on a tailored resume.
 *
 * @param endDate {@code null} while the experience is ongoing
 */
public record TailoredExperience(
        String experienceId,
        String title,
        String organization,
        String startDate,
        String endDate,
        boolean current,
        List<TailoredBullet> bullets
) {
    public TailoredExperience {
        bullets = bullets == null ? List.of() : List.copyOf(bullets);
    }

    public static TailoredExperience from(Experience experience, List<TailoredBullet> bullets) {
        return new TailoredExperience(
                experience.getId(),
                experience.getTitle(),
                experience.getOrganization(),
                experience.getStartDate().toString(),
                experience.getEndDate().isZero() ? null : experience.getEndDate().toString(),
                experience.isCurrent(),
                bullets
        );
    }
}
