package com.adlanda.resumetailor.repository;

import com.adlanda.resumetailor.model.Resume;
import com.adlanda.resumetailor.model.ResumeStatus;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class InMemoryResumeRepositoryTest {

    private final InMemoryResumeRepository repository = new InMemoryResumeRepository();

    @Test
    void findByUserId_onlyReturnsOwnersResumes() {
        repository.save(new Resume("r1", "user-1", "Go engineer"));
        repository.save(new Resume("r2", "user-2", "Java engineer"));

        assertThat(repository.findByUserId("user-1")).extracting(Resume::getId).containsExactly("r1");
    }

    @Test
    void findByUserId_withStatus_filters() {
        Resume generated = new Resume("r1", "user-1", "Go engineer");
        generated.transitionStatus(ResumeStatus.GENERATED);
        repository.save(generated);
        repository.save(new Resume("r2", "user-1", "Java engineer"));

        assertThat(repository.findByUserId("user-1", ResumeStatus.GENERATED, 10, 0))
                .extracting(Resume::getId)
                .containsExactly("r1");
        assertThat(repository.findByUserId("user-1", null, 10, 0)).hasSize(2);
    }

    @Test
    void findByUserId_pagesWithLimitAndOffset() {
        for (int i = 0; i < 5; i++) {
            repository.save(new Resume("r" + i, "user-1", "Job " + i));
        }

        assertThat(repository.findByUserId("user-1", null, 2, 0)).hasSize(2);
        assertThat(repository.findByUserId("user-1", null, 2, 4)).hasSize(1);
        assertThat(repository.findByUserId("user-1", null, 2, 10)).isEmpty();
    }

    @Test
    void deleteById_reportsWhetherSomethingWasRemoved() {
        repository.save(new Resume("r1", "user-1", "Go engineer"));

        assertThat(repository.deleteById("r1")).isTrue();
        assertThat(repository.deleteById("r1")).isFalse();
        assertThat(repository.findById("r1")).isEmpty();
        assertThat(repository.size()).isZero();
    }
}
