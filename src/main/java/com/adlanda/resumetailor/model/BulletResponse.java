package com.adlanda.resumetailor.model;

import java.util.List;

public record BulletResponse(
        String id,
        String experienceId,
        String content,
        int impactScore,
        List<String> keywords,
        int displayOrder
) {
    public static BulletResponse from(Bullet bullet) {
        return new BulletResponse(
                bullet.getId(),
                bullet.getExperienceId(),
                bullet.getContent(),
                bullet.getImpactScore().value(),
                bullet.getKeywords(),
                bullet.getDisplayOrder()
        );
    }
}
