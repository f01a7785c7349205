package com.adlanda.resumetailor.model;

/**
 * The resume owner's profile as seen by the summary step.
 *
 * @param id                Internal user id
 * @param name              Display name, may be null
 * @param email             Contact email, may be null
 * @param headline          Professional headline, may be null
 * @param summary           The user's own summary, may be null
 * @param preferredLanguage Language code used when a resume does not set one
 */
public record UserProfile(
        String id,
        String name,
        String email,
        String headline,
        String summary,
        String preferredLanguage
) {
    public UserProfile {
        if (preferredLanguage == null || preferredLanguage.isBlank()) {
            preferredLanguage = "en";
        }
    }

    public String displayName() {
        if (name != null && !name.isBlank()) {
            return name;
        }
        if (email != null && !email.isBlank()) {
            return email;
        }
        return "Anonymous User";
    }
}
