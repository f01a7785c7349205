package com.adlanda.resumetailor.ai;

import com.adlanda.resumetailor.model.Bullet;

/**
 * @param style Writing style, e.g. "professional" or "technical"
 */
public record TailorBulletRequest(
        Bullet bullet,
        JobAnalysis jobAnalysis,
        String targetLanguage,
        String style
) {
}
