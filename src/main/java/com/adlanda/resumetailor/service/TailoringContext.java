package com.adlanda.resumetailor.service;

import com.adlanda.resumetailor.model.Experience;
import com.adlanda.resumetailor.model.Skill;
import com.adlanda.resumetailor.model.UserProfile;

import java.util.List;

/**
 * Everything about the resume owner a tailoring run reads besides the bullets.
 *
 * @param experiences Owner's experiences in display order
 */
public record TailoringContext(UserProfile user, List<Experience> experiences, List<Skill> skills) {

    public TailoringContext {
        experiences = experiences == null ? List.of() : List.copyOf(experiences);
        skills = skills == null ? List.of() : List.copyOf(skills);
    }
}
