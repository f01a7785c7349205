package com.adlanda.resumetailor.controller;

import com.adlanda.resumetailor.model.ExperienceRequest;
import com.adlanda.resumetailor.model.ExperienceResponse;
import com.adlanda.resumetailor.model.LanguageRequest;
import com.adlanda.resumetailor.model.LanguageResponse;
import com.adlanda.resumetailor.model.ProfileRequest;
import com.adlanda.resumetailor.model.SkillRequest;
import com.adlanda.resumetailor.model.SkillResponse;
import com.adlanda.resumetailor.model.UserProfile;
import com.adlanda.resumetailor.service.ProfileService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

import static com.adlanda.resumetailor.controller.ResumeController.USER_HEADER;

/**
 * REST controller for the caller's profile, experiences, skills and languages.
 */
@RestController
@RequestMapping("/api/v1/profile")
public class ProfileController {

    private final ProfileService profileService;

    public ProfileController(ProfileService profileService) {
        this.profileService = profileService;
    }

    @PutMapping
    public ResponseEntity<UserProfile> save(@RequestHeader(USER_HEADER) String userId,
                                            @RequestBody ProfileRequest request) {
        return ResponseEntity.ok(profileService.saveProfile(userId, request));
    }

    @GetMapping
    public ResponseEntity<UserProfile> get(@RequestHeader(USER_HEADER) String userId) {
        return ResponseEntity.ok(profileService.getProfile(userId));
    }

    @PostMapping("/experiences")
    public ResponseEntity<ExperienceResponse> addExperience(@RequestHeader(USER_HEADER) String userId,
                                                            @Valid @RequestBody ExperienceRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(ExperienceResponse.from(profileService.addExperience(userId, request)));
    }

    @GetMapping("/experiences")
    public ResponseEntity<List<ExperienceResponse>> listExperiences(@RequestHeader(USER_HEADER) String userId) {
        return ResponseEntity.ok(profileService.listExperiences(userId).stream()
                .map(ExperienceResponse::from)
                .toList());
    }

    @PostMapping("/skills")
    public ResponseEntity<SkillResponse> addSkill(@RequestHeader(USER_HEADER) String userId,
                                                  @Valid @RequestBody SkillRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(SkillResponse.from(profileService.addSkill(userId, request)));
    }

    @GetMapping("/skills")
    public ResponseEntity<List<SkillResponse>> listSkills(@RequestHeader(USER_HEADER) String userId) {
        return ResponseEntity.ok(profileService.listSkills(userId).stream().map(SkillResponse::from).toList());
    }

    @PostMapping("/languages")
    public ResponseEntity<LanguageResponse> addLanguage(@RequestHeader(USER_HEADER) String userId,
                                                        @Valid @RequestBody LanguageRequest request) {
        return ResponseEntity.status(HttpStatus.CREATED)
                .body(LanguageResponse.from(profileService.addLanguage(userId, request)));
    }

    @GetMapping("/languages")
    public ResponseEntity<List<LanguageResponse>> listLanguages(@RequestHeader(USER_HEADER) String userId) {
        return ResponseEntity.ok(profileService.listLanguages(userId).stream().map(LanguageResponse::from).toList());
    }
}
