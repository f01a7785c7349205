package com.adlanda.resumetailor.repository;

import com.adlanda.resumetailor.model.Skill;

import java.util.List;

public interface SkillRepository {

    Skill save(Skill skill);

    List<Skill> findByUserId(String userId);
}
