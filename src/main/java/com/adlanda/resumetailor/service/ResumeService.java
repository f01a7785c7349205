package com.adlanda.resumetailor.service;

import com.adlanda.resumetailor.config.TailoringProperties;
import com.adlanda.resumetailor.exception.ResourceNotFoundException;
import com.adlanda.resumetailor.exception.ResumeTailorException;
import com.adlanda.resumetailor.health.TailoringHealthIndicator;
import com.adlanda.resumetailor.model.Bullet;
import com.adlanda.resumetailor.model.CreateResumeRequest;
import com.adlanda.resumetailor.model.Experience;
import com.adlanda.resumetailor.model.Resume;
import com.adlanda.resumetailor.model.ResumeStatus;
import com.adlanda.resumetailor.model.UserProfile;
import com.adlanda.resumetailor.repository.BulletRepository;
import com.adlanda.resumetailor.repository.ExperienceRepository;
import com.adlanda.resumetailor.repository.ResumeRepository;
import com.adlanda.resumetailor.repository.SkillRepository;
import com.adlanda.resumetailor.repository.UserRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Resume lifecycle for one owner: create, read, tailor, move through statuses, delete.
 *
 * Every lookup is scoped to the calling user; another user's resume is reported as not found.
 */
@Service
public class ResumeService {

    private static final Logger log = LoggerFactory.getLogger(ResumeService.class);

    static final int DEFAULT_PAGE_SIZE = 20;
    static final int MAX_PAGE_SIZE = 100;

    private final ResumeRepository resumeRepository;
    private final UserRepository userRepository;
    private final ExperienceRepository experienceRepository;
    private final BulletRepository bulletRepository;
    private final SkillRepository skillRepository;
    private final ResumeOrchestrator orchestrator;
    private final TailoringHealthIndicator healthIndicator;
    private final TailoringProperties properties;

    public ResumeService(ResumeRepository resumeRepository,
                         UserRepository userRepository,
                         ExperienceRepository experienceRepository,
                         BulletRepository bulletRepository,
                         SkillRepository skillRepository,
                         ResumeOrchestrator orchestrator,
                         TailoringHealthIndicator healthIndicator,
                         TailoringProperties properties) {
        this.resumeRepository = resumeRepository;
        this.userRepository = userRepository;
        this.experienceRepository = experienceRepository;
        this.bulletRepository = bulletRepository;
        this.skillRepository = skillRepository;
        this.orchestrator = orchestrator;
        this.healthIndicator = healthIndicator;
        this.properties = properties;
    }

    public Resume createResume(String userId, CreateResumeRequest request) {
        UserProfile user = userRepository.findById(userId)
                .orElseThrow(() -> new ResourceNotFoundException("user", userId));

        Resume resume = new Resume(userId, request.jobDescription());
        resume.setJobDetails(request.jobTitle(), request.companyName(), request.jobUrl());
        resume.setTargetLanguage(resolveLanguage(request.targetLanguage(), user));
        resume.validate();

        resumeRepository.save(resume);
        log.info("Created resume {} for user {}", resume.getId(), userId);
        return resume;
    }

    public Resume getResume(String userId, String resumeId) {
        return resumeRepository.findById(resumeId)
                .filter(r -> r.getUserId().equals(userId))
                .orElseThrow(() -> new ResourceNotFoundException("resume", resumeId));
    }

    /**
     * @param status wire value to filter on, or null for every status
     * @param limit  page size; non-positive means the default, capped at {@value #MAX_PAGE_SIZE}
     */
    public List<Resume> listResumes(String userId, String status, int limit, int offset) {
        ResumeStatus filter = status == null || status.isBlank() ? null : ResumeStatus.fromWireValue(status);
        int pageSize = limit <= 0 ? DEFAULT_PAGE_SIZE : Math.min(limit, MAX_PAGE_SIZE);
        return resumeRepository.findByUserId(userId, filter, pageSize, Math.max(0, offset));
    }

    /**
     * Runs the tailoring pipeline and saves the result. A failed run saves nothing.
     */
    public Resume tailorResume(String userId, String resumeId, TailoringOptions options) {
        Resume resume = getResume(userId, resumeId);
        UserProfile user = userRepository.findById(userId)
                .orElseThrow(() -> new ResourceNotFoundException("user", userId));

        List<Experience> experiences = experienceRepository.findByUserId(userId);
        List<Bullet> bullets = bulletRepository.findByExperienceIds(
                experiences.stream().map(Experience::getId).toList());
        TailoringContext context = new TailoringContext(user, experiences, skillRepository.findByUserId(userId));

        try {
            orchestrator.tailor(resume, bullets, context, options);
        } catch (ResumeTailorException e) {
            healthIndicator.recordFailure(e.getCode());
            log.error("Tailoring resume {} failed [{}]: {}", resumeId, e.getCode(), e.getMessage());
            throw e;
        }

        resumeRepository.save(resume);
        healthIndicator.recordSuccess();
        return resume;
    }

    public Resume updateStatus(String userId, String resumeId, String status, String notes) {
        Resume resume = getResume(userId, resumeId);
        resume.transitionStatus(status);
        if (notes != null) {
            resume.updateNotes(notes);
        }
        resumeRepository.save(resume);
        log.info("Resume {} moved to {}", resumeId, resume.getStatus().wireValue());
        return resume;
    }

    public void deleteResume(String userId, String resumeId) {
        Resume resume = getResume(userId, resumeId);
        resumeRepository.deleteById(resume.getId());
        log.info("Deleted resume {}", resumeId);
    }

    private String resolveLanguage(String requested, UserProfile user) {
        if (requested != null && !requested.isBlank()) {
            return requested.trim().toLowerCase();
        }
        String preferred = user.preferredLanguage().toLowerCase();
        if (preferred.equals("en") || preferred.equals("pt-br")) {
            return preferred;
        }
        return properties.getDefaultTargetLanguage();
    }
}
