package com.adlanda.resumetailor.model;

public record LanguageResponse(String id, String language, LanguageProficiency proficiency) {

    public static LanguageResponse from(SpokenLanguage language) {
        return new LanguageResponse(language.getId(), language.getLanguage(), language.getProficiency());
    }
}
