package com.adlanda.resumetailor.repository;

import com.adlanda.resumetailor.model.Experience;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.List;

@Repository
public class InMemoryExperienceRepository extends InMemoryRepository<Experience> implements ExperienceRepository {

    static final Comparator<Experience> DISPLAY_ORDER = Comparator
            .comparingInt(Experience::getDisplayOrder)
            .thenComparing(Experience::getStartDate, Comparator.reverseOrder());

    public InMemoryExperienceRepository() {
        super(Experience::getId);
    }

    @Override
    public List<Experience> findByUserId(String userId) {
        return findAll(e -> e.getUserId().equals(userId), DISPLAY_ORDER);
    }
}
