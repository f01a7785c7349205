package com.adlanda.resumetailor.service;

import com.adlanda.resumetailor.exception.ResourceNotFoundException;
import com.adlanda.resumetailor.exception.ValidationException;
import com.adlanda.resumetailor.model.Bullet;
import com.adlanda.resumetailor.model.BulletRequest;
import com.adlanda.resumetailor.model.CalendarDate;
import com.adlanda.resumetailor.model.Experience;
import com.adlanda.resumetailor.model.ExperienceType;
import com.adlanda.resumetailor.model.Resume;
import com.adlanda.resumetailor.repository.InMemoryBulletRepository;
import com.adlanda.resumetailor.repository.InMemoryExperienceRepository;
import com.adlanda.resumetailor.repository.InMemoryResumeRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class BulletServiceTest {

    private final InMemoryBulletRepository bullets = new InMemoryBulletRepository();
    private final InMemoryExperienceRepository experiences = new InMemoryExperienceRepository();
    private final InMemoryResumeRepository resumes = new InMemoryResumeRepository();
    private final BulletService service = new BulletService(bullets, experiences, resumes);

    @BeforeEach
    void setUp() {
        experiences.save(new Experience("exp-1", "user-1", ExperienceType.WORK, "Backend Engineer", "Acme",
                CalendarDate.of(2019, 1, 1)));
        experiences.save(new Experience("exp-2", "user-2", ExperienceType.WORK, "Designer", "Studio",
                CalendarDate.of(2018, 1, 1)));
    }

    @Test
    void createBullet_appliesScoreKeywordsAndOrder() {
        Bullet bullet = service.createBullet("user-1", "exp-1",
                new BulletRequest("Cut p99 latency by 40%", 85, List.of("Go", "latency", "Go"), 2));

        assertThat(bullet.getImpactScore().value()).isEqualTo(85);
        assertThat(bullet.getKeywords()).containsExactly("Go", "latency");
        assertThat(bullet.getDisplayOrder()).isEqualTo(2);
        assertThat(service.listBullets("user-1", "exp-1")).containsExactly(bullet);
    }

    @Test
    void createBullet_defaultsImpactScoreTo50() {
        Bullet bullet = service.createBullet("user-1", "exp-1", new BulletRequest("Wrote docs", null, null, null));

        assertThat(bullet.getImpactScore().value()).isEqualTo(50);
    }

    @Test
    void createBullet_blankContent_isValidationError() {
        assertThatThrownBy(() -> service.createBullet("user-1", "exp-1", new BulletRequest(" ", null, null, null)))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void createBullet_onSomeoneElsesExperience_isNotFound() {
        assertThatThrownBy(() -> service.createBullet("user-1", "exp-2", new BulletRequest("x", null, null, null)))
                .isInstanceOf(ResourceNotFoundException.class);
    }

    @Test
    void updateBullet_onlyChangesGivenFields() {
        Bullet bullet = service.createBullet("user-1", "exp-1", new BulletRequest("Old text", 60, List.of("Go"), null));

        service.updateBullet("user-1", bullet.getId(), new BulletRequest("New text", null, null, null));

        Bullet stored = bullets.findById(bullet.getId()).orElseThrow();
        assertThat(stored.getContent()).isEqualTo("New text");
        assertThat(stored.getImpactScore().value()).isEqualTo(60);
        assertThat(stored.getKeywords()).containsExactly("Go");
    }

    @Test
    void updateBullet_outOfRangeScore_isRejected() {
        Bullet bullet = service.createBullet("user-1", "exp-1", new BulletRequest("Text", null, null, null));

        assertThatThrownBy(() -> service.updateBullet("user-1", bullet.getId(),
                new BulletRequest(null, 101, null, null)))
                .isInstanceOf(ValidationException.class);
    }

    @Test
    void deleteBullet_removesItFromEveryResumeSelection() {
        Bullet kept = service.createBullet("user-1", "exp-1", new BulletRequest("Kept", null, null, null));
        Bullet removed = service.createBullet("user-1", "exp-1", new BulletRequest("Removed", null, null, null));
        Resume first = new Resume("user-1", "Go engineer");
        first.selectBullets(List.of(kept.getId(), removed.getId()));
        Resume second = new Resume("user-1", "Platform engineer");
        second.selectBullets(List.of(removed.getId()));
        resumes.save(first);
        resumes.save(second);

        service.deleteBullet("user-1", removed.getId());

        assertThat(bullets.findById(removed.getId())).isEmpty();
        assertThat(resumes.findById(first.getId()).orElseThrow().getSelectedBullets()).containsExactly(kept.getId());
        assertThat(resumes.findById(second.getId()).orElseThrow().getSelectedBullets()).isEmpty();
    }

    @Test
    void deleteBullet_ofAnotherUser_isNotFound() {
        Bullet bullet = service.createBullet("user-1", "exp-1", new BulletRequest("Mine", null, null, null));

        assertThatThrownBy(() -> service.deleteBullet("user-2", bullet.getId()))
                .isInstanceOf(ResourceNotFoundException.class);
        assertThat(bullets.findById(bullet.getId())).isPresent();
    }
}
