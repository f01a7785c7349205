package com.adlanda.resumetailor.ai;

import com.adlanda.resumetailor.model.Bullet;

import java.util.List;

public record SelectBulletsRequest(
        JobAnalysis jobAnalysis,
        List<Bullet> availableBullets,
        int maxBullets,
        String targetLanguage
) {
    public SelectBulletsRequest {
        availableBullets = List.copyOf(availableBullets);
    }
}
