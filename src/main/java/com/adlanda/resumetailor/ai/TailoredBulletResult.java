package com.adlanda.resumetailor.ai;

import java.util.List;

/**
 * @param originalId      Id of the bullet that was rewritten
 * @param tailoredContent The rewritten text
 * @param keywords        Job keywords the rewrite incorporated
 */
public record TailoredBulletResult(String originalId, String tailoredContent, List<String> keywords) {

    public TailoredBulletResult {
        keywords = keywords == null ? List.of() : List.copyOf(keywords);
    }
}
