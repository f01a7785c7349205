package com.adlanda.resumetailor.model;

public record ProfileRequest(
        String name,
        String email,
        String headline,
        String summary,
        String preferredLanguage
) {}
