package com.adlanda.resumetailor.controller;

import com.adlanda.resumetailor.model.CreateResumeRequest;
import com.adlanda.resumetailor.model.ExperienceType;
import com.adlanda.resumetailor.model.ResumeResponse;
import com.adlanda.resumetailor.model.StatusUpdateRequest;
import com.adlanda.resumetailor.model.TailorRequest;
import com.adlanda.resumetailor.service.ResumeService;
import com.adlanda.resumetailor.service.TailoringOptions;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * REST controller for resumes. The caller is identified by the X-User-Id header,
 * set by the authentication layer in front of this service.
 */
@RestController
@RequestMapping("/api/v1/resumes")
public class ResumeController {

    static final String USER_HEADER = "X-User-Id";

    private final ResumeService resumeService;

    public ResumeController(ResumeService resumeService) {
        this.resumeService = resumeService;
    }

    @PostMapping
    public ResponseEntity<ResumeResponse> create(@RequestHeader(USER_HEADER) String userId,
                                                 @Valid @RequestBody CreateResumeRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ResumeResponse.from(resumeService.createResume(userId, request)));
    }

    @GetMapping
    public ResponseEntity<List<ResumeResponse>> list(@RequestHeader(USER_HEADER) String userId,
                                                     @RequestParam(required = false) String status,
                                                     @RequestParam(defaultValue = "20") int limit,
                                                     @RequestParam(defaultValue = "0") int offset) {
        return ResponseEntity.ok(resumeService.listResumes(userId, status, limit, offset).stream()
                .map(ResumeResponse::from)
                .toList());
    }

    @GetMapping("/{id}")
    public ResponseEntity<ResumeResponse> get(@RequestHeader(USER_HEADER) String userId, @PathVariable String id) {
        return ResponseEntity.ok(ResumeResponse.from(resumeService.getResume(userId, id)));
    }

    /**
     * Runs the tailoring pipeline. Blocks until all backend calls have finished.
     */
    @PostMapping("/{id}/tailor")
    public ResponseEntity<ResumeResponse> tailor(@RequestHeader(USER_HEADER) String userId,
                                                 @PathVariable String id,
                                                 @Valid @RequestBody(required = false) TailorRequest request) {
        return ResponseEntity.ok(ResumeResponse.from(resumeService.tailorResume(userId, id, toOptions(request))));
    }

    @PatchMapping("/{id}/status")
    public ResponseEntity<ResumeResponse> updateStatus(@RequestHeader(USER_HEADER) String userId,
                                                       @PathVariable String id,
                                                       @Valid @RequestBody StatusUpdateRequest request) {
        return ResponseEntity.ok(ResumeResponse.from(
                resumeService.updateStatus(userId, id, request.status(), request.notes())));
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<Void> delete(@RequestHeader(USER_HEADER) String userId, @PathVariable String id) {
        resumeService.deleteResume(userId, id);
        return ResponseEntity.noContent().build();
    }

    static TailoringOptions toOptions(TailorRequest request) {
        if (request == null) {
            return TailoringOptions.DEFAULTS;
        }
        Set<ExperienceType> types = request.experienceTypes() == null
                ? Set.of()
                : request.experienceTypes().stream().map(ExperienceType::fromWireValue).collect(Collectors.toSet());
        return new TailoringOptions(
                request.maxBullets() == null ? 0 : request.maxBullets(),
                request.maxBulletsPerExperience() == null ? 0 : request.maxBulletsPerExperience(),
                types,
                request.highlightSkills(),
                request.style()
        );
    }
}
