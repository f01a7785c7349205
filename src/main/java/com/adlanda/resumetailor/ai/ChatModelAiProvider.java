package com.adlanda.resumetailor.ai;

import com.adlanda.resumetailor.config.TailoringProperties;
import com.adlanda.resumetailor.model.Bullet;
import com.adlanda.resumetailor.model.MatchScore;
import com.adlanda.resumetailor.model.ResumeContent;
import com.adlanda.resumetailor.model.Skill;
import com.adlanda.resumetailor.model.TailoredBullet;
import com.adlanda.resumetailor.model.TailoredExperience;
import com.adlanda.resumetailor.model.UserProfile;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * {@link AiProvider} backed by a chat model.
 *
 * Analysis-type calls (job analysis, selection, scoring) use the analysis model
 * at low temperature; writing calls use the generation model. Every call goes
 * through {@link ResilientCaller} and every answer through {@link AiResponseParser}.
 */
@Service
public class ChatModelAiProvider implements AiProvider {

    private static final Logger log = LoggerFactory.getLogger(ChatModelAiProvider.class);

    private final ChatCompletionService chat;
    private final ResilientCaller caller;
    private final AiResponseParser parser;
    private final String analysisModel;
    private final String generationModel;

    public ChatModelAiProvider(ChatCompletionService chat,
                               ResilientCaller caller,
                               AiResponseParser parser,
                               TailoringProperties properties) {
        this.chat = chat;
        this.caller = caller;
        this.parser = parser;
        this.analysisModel = properties.getAi().getAnalysisModel();
        this.generationModel = properties.getAi().getGenerationModel();
    }

    @Override
    public JobAnalysis analyzeJob(AnalyzeJobRequest request) {
        String prompt = """
                Analyze the following job description and extract key information.
                Write free-text fields in %s.

                Job Description:
                %s

                Provide a JSON response with the following structure:
                {
                  "title": "extracted job title",
                  "company": "company name if found",
                  "required_skills": ["list", "of", "required", "skills"],
                  "preferred_skills": ["list", "of", "nice-to-have", "skills"],
                  "keywords": ["important", "keywords", "from", "description"],
                  "seniority_level": "junior/mid/senior/lead/executive",
                  "years_experience": null or number,
                  "summary": "brief 2-3 sentence summary of the role"
                }

                IMPORTANT: Respond ONLY with valid JSON. Do not include markdown formatting or additional text.
                """.formatted(languageName(request.targetLanguage()), request.jobDescription());

        String raw = caller.call("analyze job", () -> chat.complete(analysisModel, 0.3, prompt));
        JobAnalysis analysis = parser.parse("analyze job", raw, AiPayloads.JobAnalysisPayload.class)
                .toJobAnalysis();

        log.info("Analyzed job '{}' ({} required skills, {} keywords)",
                analysis.title(), analysis.requiredSkills().size(), analysis.keywords().size());
        return analysis;
    }

    @Override
    public BulletSelection selectBullets(SelectBulletsRequest request) {
        StringBuilder bulletsText = new StringBuilder();
        List<Bullet> bullets = request.availableBullets();
        for (int i = 0; i < bullets.size(); i++) {
            bulletsText.append(i + 1).append(". [ID: ").append(bullets.get(i).getId()).append("] ")
                    .append(bullets.get(i).getContent()).append('\n');
        }

        JobAnalysis job = request.jobAnalysis();
        String prompt = """
                You are an expert resume consultant. Select the most relevant experience bullets for this job.

                JOB REQUIREMENTS:
                - Title: %s
                - Company: %s
                - Required Skills: %s
                - Preferred Skills: %s
                - Keywords: %s
                - Summary: %s

                AVAILABLE BULLETS:
                %s
                Select up to %d bullets that best match this job. Prioritize:
                1. Direct skill matches
                2. Quantifiable achievements
                3. Relevant industry experience
                4. Leadership/impact indicators

                IMPORTANT RULES:
                1. Return ONLY the final JSON object.
                2. Do not output draft JSONs or reasoning text outside the JSON.
                3. Only use IDs from the list above.
                4. If no bullets match perfectly, select the closest ones and explain in "reasoning".

                Respond with JSON:
                {
                  "selected_bullet_ids": ["id1", "id2"],
                  "reasoning": "Brief explanation of selection strategy"
                }
                """.formatted(
                job.title(),
                job.company(),
                String.join(", ", job.requiredSkills()),
                String.join(", ", job.preferredSkills()),
                String.join(", ", job.keywords()),
                job.summary(),
                bulletsText,
                request.maxBullets());

        String raw = caller.call("select bullets", () -> chat.complete(analysisModel, 0.3, prompt));
        AiPayloads.BulletSelectionPayload payload =
                parser.parse("select bullets", raw, AiPayloads.BulletSelectionPayload.class);

        return new BulletSelection(payload.selectedBulletIds(), payload.reasoning());
    }

    @Override
    public TailoredBulletResult tailorBullet(TailorBulletRequest request) {
        JobAnalysis job = request.jobAnalysis();
        String prompt = """
                You are an expert Resume Writer and STAR Method Specialist. Your task is to optimize a specific experience bullet point.

                ORIGINAL BULLET:
                %s

                TARGET CONTEXT:
                - Job Title: %s
                - Required Skills: %s
                - Keywords: %s

                TASK INSTRUCTIONS:
                1. Analyze & Polish: fix grammar and clarity in the original bullet.
                2. STAR Method Check: does the bullet have a clear Action and a measurable Result?
                   - If YES: keep the structure close to the original.
                   - If NO: rewrite it with a specific Action and a measurable Result.
                3. Keyword Integration: naturally weave in at most 3 of the keywords, only where they fit.
                4. Never invent facts, numbers, employers or technologies that the original does not support.
                5. Style: %s. Language: write strictly in %s.

                SMART BOLDING:
                Apply **bold** markdown to 3-5 high-value terms (hard skills, metrics, strong action verbs).

                IMPORTANT: Return ONLY the final JSON. No markdown blocks, no intro text.

                Response format (JSON ONLY):
                {
                  "tailored_content": "The optimized bullet string with **markdown** formatting",
                  "keywords": ["list", "of", "keywords", "used"]
                }
                """.formatted(
                request.bullet().getContent(),
                job.title(),
                String.join(", ", job.requiredSkills()),
                String.join(", ", job.keywords()),
                request.style(),
                languageName(request.targetLanguage()));

        String raw = caller.call("tailor bullet", () -> chat.complete(generationModel, 0.7, prompt));
        AiPayloads.TailoredBulletPayload payload =
                parser.parse("tailor bullet", raw, AiPayloads.TailoredBulletPayload.class);

        return new TailoredBulletResult(request.bullet().getId(), payload.tailoredContent().strip(), payload.keywords());
    }

    @Override
    public SummaryResult generateSummary(GenerateSummaryRequest request) {
        UserProfile user = request.user();
        StringBuilder achievements = new StringBuilder();
        for (TailoredBullet bullet : request.selectedBullets()) {
            achievements.append("- ").append(bullet.tailoredContent()).append('\n');
        }

        JobAnalysis job = request.jobAnalysis();
        String prompt = """
                Generate a professional summary for a resume application.

                CANDIDATE INFO:
                - Name: %s
                - Headline: %s
                - Current Summary: %s

                KEY ACHIEVEMENTS (selected for this job):
                %s
                TARGET JOB:
                - Title: %s
                - Company: %s
                - Required Skills: %s
                - Summary: %s

                Write a compelling 3-4 sentence professional summary that:
                1. Highlights relevant experience and skills
                2. References the strongest achievements above
                3. Aligns with the target job requirements
                4. Uses confident, professional language
                5. Is written in %s

                Apply **bold** markdown to at most 4-6 terms.

                IMPORTANT: Respond ONLY with valid JSON.

                Respond with JSON:
                {
                  "summary": "the generated professional summary with **bold** highlights"
                }
                """.formatted(
                user == null ? "Professional" : user.displayName(),
                user == null ? "" : nullToEmpty(user.headline()),
                user == null ? "" : nullToEmpty(user.summary()),
                achievements,
                job.title(),
                job.company(),
                String.join(", ", job.requiredSkills()),
                job.summary(),
                languageName(request.targetLanguage()));

        String raw = caller.call("generate summary", () -> chat.complete(generationModel, 0.8, prompt));
        AiPayloads.SummaryPayload payload = parser.parse("generate summary", raw, AiPayloads.SummaryPayload.class);

        return new SummaryResult(payload.summary().strip());
    }

    @Override
    public MatchScore scoreMatch(ScoreMatchRequest request) {
        StringBuilder skillsList = new StringBuilder();
        for (Skill skill : request.userSkills()) {
            skillsList.append("- ").append(skill.getName())
                    .append(" (proficiency: ").append(skill.getProficiencyLevel().value()).append("%)\n");
        }

        StringBuilder resumeText = new StringBuilder();
        ResumeContent content = request.resume();
        if (content != null) {
            resumeText.append("Summary: ").append(content.summary()).append("\n\n");
            for (TailoredExperience experience : content.experiences()) {
                resumeText.append(experience.title()).append(" at ").append(experience.organization()).append(":\n");
                for (TailoredBullet bullet : experience.bullets()) {
                    resumeText.append("  - ").append(bullet.tailoredContent()).append('\n');
                }
            }
        }

        JobAnalysis job = request.jobAnalysis();
        String prompt = """
                Score how well this resume matches the job requirements.

                JOB REQUIREMENTS:
                - Title: %s
                - Required Skills: %s
                - Preferred Skills: %s
                - Seniority: %s
                - Years Experience: %s
                - Summary: %s

                CANDIDATE SKILLS:
                %s
                RESUME CONTENT:
                %s
                Analyze the match and provide an integer score from 0-100 based on:
                1. Skill alignment (40%%)
                2. Experience relevance (30%%)
                3. Seniority fit (15%%)
                4. Keyword coverage (15%%)

                IMPORTANT: Respond ONLY with valid JSON.

                Respond with JSON:
                {
                  "score": 85,
                  "breakdown": {
                    "skills": 90,
                    "experience": 80,
                    "seniority": 85,
                    "keywords": 75
                  },
                  "explanation": "Brief explanation of the score"
                }
                """.formatted(
                job.title(),
                String.join(", ", job.requiredSkills()),
                String.join(", ", job.preferredSkills()),
                job.seniorityLevel(),
                job.yearsExperience() == null ? "not specified" : job.yearsExperience().toString(),
                job.summary(),
                skillsList,
                resumeText);

        String raw = caller.call("score match", () -> chat.complete(analysisModel, 0.2, prompt));
        AiPayloads.ScorePayload payload = parser.parse("score match", raw, AiPayloads.ScorePayload.class);

        log.debug("Match score {}: {}", payload.score(), payload.explanation());
        return MatchScore.of(payload.score());
    }

    static String languageName(String code) {
        return "pt-br".equalsIgnoreCase(code) ? "Brazilian Portuguese" : "English";
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }
}
