package com.adlanda.resumetailor.ai;

public record AnalyzeJobRequest(String jobDescription, String targetLanguage) {
}
