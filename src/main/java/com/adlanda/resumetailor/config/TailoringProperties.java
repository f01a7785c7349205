package com.adlanda.resumetailor.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Configuration properties for resume tailoring.
 *
 * Maps to properties prefixed with 'tailor' in application.properties.
 */
@Component
@ConfigurationProperties(prefix = "tailor")
public class TailoringProperties {

    private final Ai ai = new Ai();

    /**
     * Bullets to select when a tailoring request does not say.
     */
    private int defaultMaxBullets = 15;

    /**
     * Writing style passed to bullet tailoring when a request does not say.
     */
    private String defaultStyle = "professional";

    /**
     * Language used when neither the resume nor the user has one.
     */
    private String defaultTargetLanguage = "en";

    /**
     * Whether selected bullets are tailored concurrently.
     * Output order is the same either way.
     */
    private boolean parallelTailoring = false;

    /**
     * Worker threads used when parallel tailoring is on.
     */
    private int tailoringThreads = 4;

    public Ai getAi() {
        return ai;
    }

    public int getDefaultMaxBullets() {
        return defaultMaxBullets;
    }

    public void setDefaultMaxBullets(int defaultMaxBullets) {
        this.defaultMaxBullets = defaultMaxBullets;
    }

    public String getDefaultStyle() {
        return defaultStyle;
    }

    public void setDefaultStyle(String defaultStyle) {
        this.defaultStyle = defaultStyle;
    }

    public String getDefaultTargetLanguage() {
        return defaultTargetLanguage;
    }

    public void setDefaultTargetLanguage(String defaultTargetLanguage) {
        this.defaultTargetLanguage = defaultTargetLanguage;
    }

    public boolean isParallelTailoring() {
        return parallelTailoring;
    }

    public void setParallelTailoring(boolean parallelTailoring) {
        this.parallelTailoring = parallelTailoring;
    }

    public int getTailoringThreads() {
        return tailoringThreads;
    }

    public void setTailoringThreads(int tailoringThreads) {
        this.tailoringThreads = tailoringThreads;
    }

    /**
     * Backend models and the retry budget for every backend call.
     */
    public static class Ai {

        /**
         * Model for structured, low-temperature work: job analysis, selection, scoring.
         */
        private String analysisModel = "meta-llama/llama-4-scout-17b-16e-instruct";

        /**
         * Model for writing: bullet rewrites and summaries.
         */
        private String generationModel = "llama-3.3-70b-versatile";

        private int maxTokens = 4096;

        /**
         * Retries after the first attempt.
         */
        private int maxRetries = 3;

        /**
         * Delay before the first retry; doubles on each later one.
         */
        private Duration backoffUnit = Duration.ofSeconds(1);

        public String getAnalysisModel() {
            return analysisModel;
        }

        public void setAnalysisModel(String analysisModel) {
            this.analysisModel = analysisModel;
        }

        public String getGenerationModel() {
            return generationModel;
        }

        public void setGenerationModel(String generationModel) {
            this.generationModel = generationModel;
        }

        public int getMaxTokens() {
            return maxTokens;
        }

        public void setMaxTokens(int maxTokens) {
            this.maxTokens = maxTokens;
        }

        public int getMaxRetries() {
            return maxRetries;
        }

        public void setMaxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
        }

        public Duration getBackoffUnit() {
            return backoffUnit;
        }

        public void setBackoffUnit(Duration backoffUnit) {
            this.backoffUnit = backoffUnit;
        }
    }
}
