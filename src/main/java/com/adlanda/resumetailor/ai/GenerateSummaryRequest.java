package com.adlanda.resumetailor.ai;

import com.adlanda.resumetailor.model.TailoredBullet;
import com.adlanda.resumetailor.model.UserProfile;

import java.util.List;

public record GenerateSummaryRequest(
        UserProfile user,
        JobAnalysis jobAnalysis,
        List<TailoredBullet> selectedBullets,
        String targetLanguage
) {
    public GenerateSummaryRequest {
        selectedBullets = List.copyOf(selectedBullets);
    }
}
