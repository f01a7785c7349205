package com.adlanda.resumetailor.repository;

import com.adlanda.resumetailor.model.Bullet;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.Set;

@Repository
public class InMemoryBulletRepository extends InMemoryRepository<Bullet> implements BulletRepository {

    public InMemoryBulletRepository() {
        super(Bullet::getId);
    }

    @Override
    public List<Bullet> findByExperienceIds(Collection<String> experienceIds) {
        Set<String> owners = Set.copyOf(experienceIds);
        return findAll(b -> owners.contains(b.getExperienceId()),
                Comparator.comparingInt(Bullet::getDisplayOrder).thenComparing(Bullet::getCreatedAt));
    }
}
