package com.adlanda.resumetailor.ai;

import com.adlanda.resumetailor.model.MatchScore;

/**
 * The capability set the tailoring pipeline needs from a language-model backend.
 *
 * Implementations run every call through the resilient call wrapper and decode
 * backend text into validated result types. Anything they return about bullet
 * identity is still untrusted: callers filter selections against their own
 * candidate set.
 */
public interface AiProvider {

    /**
     * Extracts title, company, skills, keywords and seniority from raw job description text.
     */
    JobAnalysis analyzeJob(AnalyzeJobRequest request);

    /**
     * Picks the bullets most relevant to the job, prioritizing skill matches,
     * quantifiable achievements, industry experience and leadership signals.
     */
    BulletSelection selectBullets(SelectBulletsRequest request);

    /**
     * Rewrites one bullet towards an action + result structure, weaving in a few
     * job keywords without inventing facts.
     */
    TailoredBulletResult tailorBullet(TailorBulletRequest request);

    /**
     * Writes a 3-4 sentence professional summary grounded in the selected bullets.
     */
    SummaryResult generateSummary(GenerateSummaryRequest request);

    /**
     * Scores the assembled resume against the job. Always a valid {@link MatchScore}, or the call fails.
     */
    MatchScore scoreMatch(ScoreMatchRequest request);
}
