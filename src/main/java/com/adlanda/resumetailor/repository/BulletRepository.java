package com.adlanda.resumetailor.repository;

import com.adlanda.resumetailor.model.Bullet;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

public interface BulletRepository {

    Bullet save(Bullet bullet);

    Optional<Bullet> findById(String id);

    /**
     * Bullets owned by any of the given experiences, in display order.
     */
    List<Bullet> findByExperienceIds(Collection<String> experienceIds);

    boolean deleteById(String id);
}
