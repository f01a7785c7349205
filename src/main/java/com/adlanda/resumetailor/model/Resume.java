package com.adlanda.resumetailor.model;

import com.adlanda.resumetailor.exception.InvalidStatusTransitionException;
import com.adlanda.resumetailor.exception.ValidationException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.UUID;

/**
 * A resume tailored to one job application. Created in {@link ResumeStatus#DRAFT}
 * from a job description that never changes afterwards.
 */
public class Resume {

    static final Set<String> SUPPORTED_LANGUAGES = Set.of("en", "pt-br");

    private final String id;
    private final String userId;
    private final String jobDescription;
    private String jobTitle;
    private String companyName;
    private String jobUrl;
    private String targetLanguage = "en";
    private final List<String> selectedBullets = new ArrayList<>();
    private ResumeContent generatedContent;
    private String pdfUrl;
    private MatchScore score = MatchScore.ZERO;
    private String notes;
    private ResumeStatus status = ResumeStatus.DRAFT;
    private final Instant createdAt;
    private Instant updatedAt;

    public Resume(String userId, String jobDescription) {
        this(UUID.randomUUID().toString(), userId, jobDescription);
    }

    public Resume(String id, String userId, String jobDescription) {
        if (jobDescription == null || jobDescription.isBlank()) {
            throw ValidationException.ofField("job_description", "job description cannot be empty");
        }
        this.id = id;
        this.userId = userId;
        this.jobDescription = jobDescription;
        this.createdAt = Instant.now();
        this.updatedAt = createdAt;
    }

    public void validate() {
        ValidationException.Collector errors = new ValidationException.Collector();
        if (userId == null || userId.isBlank()) {
            errors.add("user_id", "user ID is required");
        }
        if (!SUPPORTED_LANGUAGES.contains(targetLanguage)) {
            errors.add("target_language", "must be 'en' or 'pt-br'");
        }
        errors.throwIfAny();
    }

    /**
     * Sets whichever job details are non-blank; blank values leave the current one in place.
     */
    public void setJobDetails(String title, String company, String url) {
        if (title != null && !title.isBlank()) {
            this.jobTitle = title;
        }
        if (company != null && !company.isBlank()) {
            this.companyName = company;
        }
        if (url != null && !url.isBlank()) {
            this.jobUrl = url;
        }
        touch();
    }

    public void setTargetLanguage(String targetLanguage) {
        if (!SUPPORTED_LANGUAGES.contains(targetLanguage)) {
            throw ValidationException.ofField("target_language", "must be 'en' or 'pt-br'");
        }
        this.targetLanguage = targetLanguage;
        touch();
    }

    /**
     * Stores generated content and moves the resume to {@link ResumeStatus#GENERATED}.
     * Legal only from draft or generated.
     */
    public void setGeneratedContent(ResumeContent content) {
        if (!status.allowsGeneration()) {
            throw new InvalidStatusTransitionException(status.wireValue(), ResumeStatus.GENERATED.wireValue());
        }
        this.generatedContent = content;
        this.status = ResumeStatus.GENERATED;
        touch();
    }

    public void setScore(int score) {
        setScore(MatchScore.of(score));
    }

    public void setScore(MatchScore score) {
        this.score = score;
        touch();
    }

    public void selectBullets(List<String> bulletIds) {
        selectedBullets.clear();
        selectedBullets.addAll(bulletIds);
        touch();
    }

    public void addSelectedBullet(String bulletId) {
        if (!selectedBullets.contains(bulletId)) {
            selectedBullets.add(bulletId);
            touch();
        }
    }

    public boolean removeSelectedBullet(String bulletId) {
        boolean removed = selectedBullets.remove(bulletId);
        if (removed) {
            touch();
        }
        return removed;
    }

    public void setPdfUrl(String pdfUrl) {
        this.pdfUrl = pdfUrl;
        touch();
    }

    public void updateNotes(String notes) {
        this.notes = notes;
        touch();
    }

    /**
     * Moves to {@code target} if the transition table allows it; otherwise fails
     * and leaves the resume unchanged.
     */
    public void transitionStatus(ResumeStatus target) {
        if (target == null) {
            throw InvalidStatusTransitionException.unknownStatus(null);
        }
        if (!status.canTransitionTo(target)) {
            throw new InvalidStatusTransitionException(status.wireValue(), target.wireValue());
        }
        this.status = target;
        touch();
    }

    public void transitionStatus(String target) {
        transitionStatus(ResumeStatus.fromWireValue(target));
    }

    public boolean isDraft() {
        return status == ResumeStatus.DRAFT;
    }

    public boolean isGenerated() {
        return status == ResumeStatus.GENERATED || status == ResumeStatus.REVIEWED;
    }

    public boolean isSubmitted() {
        return status == ResumeStatus.SUBMITTED
                || status == ResumeStatus.INTERVIEW
                || status == ResumeStatus.REJECTED
                || status == ResumeStatus.ACCEPTED;
    }

    public boolean canGeneratePdf() {
        return generatedContent != null
                && (status == ResumeStatus.GENERATED || status == ResumeStatus.REVIEWED);
    }

    public String jobDisplayName() {
        if (jobTitle != null && companyName != null) {
            return jobTitle + " at " + companyName;
        }
        if (jobTitle != null) {
            return jobTitle;
        }
        if (companyName != null) {
            return "Position at " + companyName;
        }
        return "Untitled Resume";
    }

    public String getId() {
        return id;
    }

    public String getUserId() {
        return userId;
    }

    public String getJobDescription() {
        return jobDescription;
    }

    public String getJobTitle() {
        return jobTitle;
    }

    public String getCompanyName() {
        return companyName;
    }

    public String getJobUrl() {
        return jobUrl;
    }

    public String getTargetLanguage() {
        return targetLanguage;
    }

    public List<String> getSelectedBullets() {
        return List.copyOf(selectedBullets);
    }

    public ResumeContent getGeneratedContent() {
        return generatedContent;
    }

    public String getPdfUrl() {
        return pdfUrl;
    }

    public MatchScore getScore() {
        return score;
    }

    public String getNotes() {
        return notes;
    }

    public ResumeStatus getStatus() {
        return status;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public Instant getUpdatedAt() {
        return updatedAt;
    }

    private void touch() {
        this.updatedAt = Instant.now();
    }
}
