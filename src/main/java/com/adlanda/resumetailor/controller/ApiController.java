package com.adlanda.resumetailor.controller;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Root API controller providing endpoint discovery.
 *
 * Health checks are handled by Spring Actuator at /actuator/health.
 */
@RestController
@RequestMapping("/api/v1")
public class ApiController {

    @Value("${info.app.version:0.0.1-SNAPSHOT}")
    private String appVersion;

    @GetMapping
    public ResponseEntity<Map<String, Object>> root() {
        Map<String, String> endpoints = new LinkedHashMap<>();
        endpoints.put("createResume", "POST /api/v1/resumes - Create a draft resume from a job description");
        endpoints.put("listResumes", "GET /api/v1/resumes - List your resumes");
        endpoints.put("getResume", "GET /api/v1/resumes/{id} - Get one resume");
        endpoints.put("tailorResume", "POST /api/v1/resumes/{id}/tailor - Generate tailored content");
        endpoints.put("updateStatus", "PATCH /api/v1/resumes/{id}/status - Move a resume through its lifecycle");
        endpoints.put("deleteResume", "DELETE /api/v1/resumes/{id} - Delete a resume");
        endpoints.put("profile", "PUT /api/v1/profile - Create or replace your profile");
        endpoints.put("experiences", "POST /api/v1/profile/experiences - Add an experience");
        endpoints.put("bullets", "POST /api/v1/experiences/{id}/bullets - Add a bullet");
        endpoints.put("health", "GET /actuator/health - Health check");

        return ResponseEntity.ok(Map.of(
                "service", "Resume Tailor",
                "version", appVersion,
                "endpoints", endpoints
        ));
    }
}
