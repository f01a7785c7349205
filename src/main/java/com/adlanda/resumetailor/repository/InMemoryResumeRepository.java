package com.adlanda.resumetailor.repository;

import com.adlanda.resumetailor.model.Resume;
import com.adlanda.resumetailor.model.ResumeStatus;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.List;

@Repository
public class InMemoryResumeRepository extends InMemoryRepository<Resume> implements ResumeRepository {

    private static final Comparator<Resume> NEWEST_FIRST =
            Comparator.comparing(Resume::getCreatedAt).reversed().thenComparing(Resume::getId);

    public InMemoryResumeRepository() {
        super(Resume::getId);
    }

    @Override
    public List<Resume> findByUserId(String userId, ResumeStatus status, int limit, int offset) {
        return findAll(r -> r.getUserId().equals(userId) && (status == null || r.getStatus() == status), NEWEST_FIRST)
                .stream()
                .skip(Math.max(0, offset))
                .limit(Math.max(0, limit))
                .toList();
    }

    @Override
    public List<Resume> findByUserId(String userId) {
        return findAll(r -> r.getUserId().equals(userId), NEWEST_FIRST);
    }
}
