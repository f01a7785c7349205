package com.adlanda.resumetailor.repository;

import com.adlanda.resumetailor.model.Skill;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.List;

@Repository
public class InMemorySkillRepository extends InMemoryRepository<Skill> implements SkillRepository {

    public InMemorySkillRepository() {
        super(Skill::getId);
    }

    @Override
    public List<Skill> findByUserId(String userId) {
        return findAll(s -> s.getUserId().equals(userId),
                Comparator.comparingInt(Skill::getDisplayOrder).thenComparing(Skill::getName));
    }
}
