package com.adlanda.resumetailor;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Resume Tailor - Main Application
 *
 * Keeps a library of experience bullets per user and, for each job application,
 * assembles a tailored resume: analyzes the job description, selects and rewrites
 * the most relevant bullets, writes a summary and scores the match.
 *
 * This application uses:
 * - Spring Boot 3 with Java 17
 * - Spring AI's OpenAI-compatible chat client, pointed at Groq by default
 *
 * @see <a href="https://docs.spring.io/spring-ai/reference/">Spring AI Documentation</a>
 */
@SpringBootApplication
public class ResumeTailorApplication {

    public static void main(String[] args) {
        SpringApplication.run(ResumeTailorApplication.class, args);
    }
}
