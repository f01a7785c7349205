package com.adlanda.resumetailor.repository;

import com.adlanda.resumetailor.model.Experience;

import java.util.List;
import java.util.Optional;

public interface ExperienceRepository {

    Experience save(Experience experience);

    Optional<Experience> findById(String id);

    /**
     * A user's experiences by display order, then most recent start date first.
     */
    List<Experience> findByUserId(String userId);

    boolean deleteById(String id);
}
