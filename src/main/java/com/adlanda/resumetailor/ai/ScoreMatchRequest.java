package com.adlanda.resumetailor.ai;

import com.adlanda.resumetailor.model.ResumeContent;
import com.adlanda.resumetailor.model.Skill;

import java.util.List;

public record ScoreMatchRequest(JobAnalysis jobAnalysis, ResumeContent resume, List<Skill> userSkills) {

    public ScoreMatchRequest {
        userSkills = List.copyOf(userSkills);
    }
}
