package com.adlanda.resumetailor.model;

import java.util.List;

/**
 * A bullet rewritten for one job, next to its original wording.
 */
public record TailoredBullet(
        String bulletId,
        String originalContent,
        String tailoredContent,
        List<String> keywords
) {
    public TailoredBullet {
        keywords = keywords == null ? List.of() : List.copyOf(keywords);
    }
}
