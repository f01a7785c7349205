package com.adlanda.resumetailor.service;

import com.adlanda.resumetailor.exception.ResourceNotFoundException;
import com.adlanda.resumetailor.model.Bullet;
import com.adlanda.resumetailor.model.BulletRequest;
import com.adlanda.resumetailor.model.Experience;
import com.adlanda.resumetailor.model.Resume;
import com.adlanda.resumetailor.repository.BulletRepository;
import com.adlanda.resumetailor.repository.ExperienceRepository;
import com.adlanda.resumetailor.repository.ResumeRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Manages a user's bullet library.
 */
@Service
public class BulletService {

    private static final Logger log = LoggerFactory.getLogger(BulletService.class);

    private final BulletRepository bulletRepository;
    private final ExperienceRepository experienceRepository;
    private final ResumeRepository resumeRepository;

    public BulletService(BulletRepository bulletRepository,
                         ExperienceRepository experienceRepository,
                         ResumeRepository resumeRepository) {
        this.bulletRepository = bulletRepository;
        this.experienceRepository = experienceRepository;
        this.resumeRepository = resumeRepository;
    }

    public Bullet createBullet(String userId, String experienceId, BulletRequest request) {
        Experience experience = ownedExperience(userId, experienceId);

        Bullet bullet = new Bullet(experience.getId(), request.content());
        apply(bullet, request);
        bullet.validate();

        bulletRepository.save(bullet);
        log.debug("Created bullet {} under experience {}", bullet.getId(), experienceId);
        return bullet;
    }

    public List<Bullet> listBullets(String userId, String experienceId) {
        Experience experience = ownedExperience(userId, experienceId);
        return bulletRepository.findByExperienceIds(List.of(experience.getId()));
    }

    /**
     * Applies the non-null fields of {@code request}.
     */
    public Bullet updateBullet(String userId, String bulletId, BulletRequest request) {
        Bullet bullet = ownedBullet(userId, bulletId);
        if (request.content() != null) {
            bullet.updateContent(request.content());
        }
        apply(bullet, request);
        bulletRepository.save(bullet);
        return bullet;
    }

    /**
     * Deletes the bullet and removes it from every resume selection of its owner.
     */
    public void deleteBullet(String userId, String bulletId) {
        Bullet bullet = ownedBullet(userId, bulletId);
        bulletRepository.deleteById(bullet.getId());

        int affected = 0;
        for (Resume resume : resumeRepository.findByUserId(userId)) {
            if (resume.removeSelectedBullet(bulletId)) {
                resumeRepository.save(resume);
                affected++;
            }
        }
        log.info("Deleted bullet {} ({} resume selections updated)", bulletId, affected);
    }

    private static void apply(Bullet bullet, BulletRequest request) {
        if (request.impactScore() != null) {
            bullet.setImpactScore(request.impactScore());
        }
        if (request.keywords() != null) {
            bullet.setKeywords(request.keywords());
        }
        if (request.displayOrder() != null) {
            bullet.setDisplayOrder(request.displayOrder());
        }
    }

    private Experience ownedExperience(String userId, String experienceId) {
        return experienceRepository.findById(experienceId)
                .filter(e -> e.getUserId().equals(userId))
                .orElseThrow(() -> new ResourceNotFoundException("experience", experienceId));
    }

    private Bullet ownedBullet(String userId, String bulletId) {
        Bullet bullet = bulletRepository.findById(bulletId)
                .orElseThrow(() -> new ResourceNotFoundException("bullet", bulletId));
        experienceRepository.findById(bullet.getExperienceId())
                .filter(e -> e.getUserId().equals(userId))
                .orElseThrow(() -> new ResourceNotFoundException("bullet", bulletId));
        return bullet;
    }
}
