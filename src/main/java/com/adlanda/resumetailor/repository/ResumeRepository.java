package com.adlanda.resumetailor.repository;

import com.adlanda.resumetailor.model.Resume;
import com.adlanda.resumetailor.model.ResumeStatus;

import java.util.List;
import java.util.Optional;

public interface ResumeRepository {

    Resume save(Resume resume);

    Optional<Resume> findById(String id);

    /**
     * A user's resumes, newest first.
     *
     * @param status Only resumes in this status, or all when null
     */
    List<Resume> findByUserId(String userId, ResumeStatus status, int limit, int offset);

    List<Resume> findByUserId(String userId);

    boolean deleteById(String id);
}
