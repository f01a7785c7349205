package com.adlanda.resumetailor.service;

import com.adlanda.resumetailor.exception.ResourceNotFoundException;
import com.adlanda.resumetailor.model.CalendarDate;
import com.adlanda.resumetailor.model.Experience;
import com.adlanda.resumetailor.model.ExperienceRequest;
import com.adlanda.resumetailor.model.ExperienceType;
import com.adlanda.resumetailor.model.LanguageProficiency;
import com.adlanda.resumetailor.model.LanguageRequest;
import com.adlanda.resumetailor.model.ProfileRequest;
import com.adlanda.resumetailor.model.Skill;
import com.adlanda.resumetailor.model.SkillRequest;
import com.adlanda.resumetailor.model.SpokenLanguage;
import com.adlanda.resumetailor.model.UserProfile;
import com.adlanda.resumetailor.repository.ExperienceRepository;
import com.adlanda.resumetailor.repository.SkillRepository;
import com.adlanda.resumetailor.repository.SpokenLanguageRepository;
import com.adlanda.resumetailor.repository.UserRepository;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * The resume owner's profile and the material tailoring reads from it:
 * experiences, skills and spoken languages.
 */
@Service
public class ProfileService {

    private final UserRepository userRepository;
    private final ExperienceRepository experienceRepository;
    private final SkillRepository skillRepository;
    private final SpokenLanguageRepository languageRepository;

    public ProfileService(UserRepository userRepository,
                          ExperienceRepository experienceRepository,
                          SkillRepository skillRepository,
                          SpokenLanguageRepository languageRepository) {
        this.userRepository = userRepository;
        this.experienceRepository = experienceRepository;
        this.skillRepository = skillRepository;
        this.languageRepository = languageRepository;
    }

    /**
     * Creates or replaces the profile of {@code userId}.
     */
    public UserProfile saveProfile(String userId, ProfileRequest request) {
        return userRepository.save(new UserProfile(
                userId,
                request.name(),
                request.email(),
                request.headline(),
                request.summary(),
                request.preferredLanguage()
        ));
    }

    public UserProfile getProfile(String userId) {
        return userRepository.findById(userId)
                .orElseThrow(() -> new ResourceNotFoundException("user", userId));
    }

    public Experience addExperience(String userId, ExperienceRequest request) {
        requireUser(userId);

        Experience experience = new Experience(
                userId,
                ExperienceType.fromWireValue(request.type()),
                request.title(),
                request.organization(),
                CalendarDate.parse(request.startDate()));
        experience.updateDetails(request.title(), request.organization(), request.location(),
                request.description(), request.url());
        if (request.current()) {
            experience.markAsCurrent();
        } else if (request.endDate() != null && !request.endDate().isBlank()) {
            experience.setEndDate(CalendarDate.parse(request.endDate()));
        }
        if (request.displayOrder() != null) {
            experience.setDisplayOrder(request.displayOrder());
        }
        experience.validate();

        return experienceRepository.save(experience);
    }

    public List<Experience> listExperiences(String userId) {
        return experienceRepository.findByUserId(userId);
    }

    public Skill addSkill(String userId, SkillRequest request) {
        requireUser(userId);

        Skill skill = new Skill(userId, request.name());
        skill.setCategory(request.category());
        if (request.proficiency() != null) {
            skill.setProficiency(request.proficiency());
        }
        if (request.yearsOfExperience() != null) {
            skill.setYearsOfExperience(request.yearsOfExperience());
        }
        if (request.highlighted()) {
            skill.highlight();
        }
        return skillRepository.save(skill);
    }

    public List<Skill> listSkills(String userId) {
        return skillRepository.findByUserId(userId);
    }

    public SpokenLanguage addLanguage(String userId, LanguageRequest request) {
        requireUser(userId);
        return languageRepository.save(new SpokenLanguage(
                userId, request.language(), LanguageProficiency.fromWireValue(request.proficiency())));
    }

    public List<SpokenLanguage> listLanguages(String userId) {
        return languageRepository.findByUserId(userId);
    }

    private void requireUser(String userId) {
        if (!userRepository.existsById(userId)) {
            throw new ResourceNotFoundException("user", userId);
        }
    }
}
