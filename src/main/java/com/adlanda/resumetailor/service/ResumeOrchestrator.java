package com.adlanda.resumetailor.service;

import com.adlanda.resumetailor.ai.AiProvider;
import com.adlanda.resumetailor.ai.AnalyzeJobRequest;
import com.adlanda.resumetailor.ai.BulletSelection;
import com.adlanda.resumetailor.ai.GenerateSummaryRequest;
import com.adlanda.resumetailor.ai.JobAnalysis;
import com.adlanda.resumetailor.ai.ScoreMatchRequest;
import com.adlanda.resumetailor.ai.SelectBulletsRequest;
import com.adlanda.resumetailor.ai.SummaryResult;
import com.adlanda.resumetailor.ai.TailorBulletRequest;
import com.adlanda.resumetailor.ai.TailoredBulletResult;
import com.adlanda.resumetailor.config.TailoringProperties;
import com.adlanda.resumetailor.exception.InvalidStatusTransitionException;
import com.adlanda.resumetailor.exception.NoBulletsAvailableException;
import com.adlanda.resumetailor.exception.TailoringCancelledException;
import com.adlanda.resumetailor.model.Bullet;
import com.adlanda.resumetailor.model.Experience;
import com.adlanda.resumetailor.model.MatchScore;
import com.adlanda.resumetailor.model.Resume;
import com.adlanda.resumetailor.model.ResumeAnalysis;
import com.adlanda.resumetailor.model.ResumeContent;
import com.adlanda.resumetailor.model.ResumeStatus;
import com.adlanda.resumetailor.model.Skill;
import com.adlanda.resumetailor.model.TailoredBullet;
import com.adlanda.resumetailor.model.TailoredExperience;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.regex.Pattern;

/**
 * Runs the tailoring pipeline for one resume:
 * analyze job, select bullets, tailor each bullet, write the summary, score.
 *
 * The resume is only mutated after every backend call has succeeded, so a
 * failed run leaves it exactly as it was.
 */
@Service
public class ResumeOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(ResumeOrchestrator.class);

    private final AiProvider ai;
    private final TailoringProperties properties;
    private final ExecutorService tailoringExecutor;

    public ResumeOrchestrator(AiProvider ai,
                              TailoringProperties properties,
                              @Qualifier("tailoringExecutor") ExecutorService tailoringExecutor) {
        this.ai = ai;
        this.properties = properties;
        this.tailoringExecutor = tailoringExecutor;
    }

    /**
     * Tailors {@code resume} to its job description.
     *
     * @param candidates Bullets the owner can use; anything the backend selects outside this set is dropped
     * @return the same resume, now generated with content, selection and score
     * @throws InvalidStatusTransitionException if the resume is past the generated stage
     * @throws NoBulletsAvailableException      if no candidate survives filtering and selection
     */
    public Resume tailor(Resume resume, List<Bullet> candidates, TailoringContext context, TailoringOptions options) {
        if (!resume.getStatus().allowsGeneration()) {
            throw new InvalidStatusTransitionException(
                    resume.getStatus().wireValue(), ResumeStatus.GENERATED.wireValue());
        }

        TailoringOptions effective = options.withDefaults(properties.getDefaultMaxBullets(), properties.getDefaultStyle());
        String language = resume.getTargetLanguage();
        long startTime = System.currentTimeMillis();

        log.info("Tailoring resume {} from {} candidate bullets", resume.getId(), candidates.size());

        Map<String, Experience> experiences = new LinkedHashMap<>();
        context.experiences().forEach(e -> experiences.put(e.getId(), e));

        List<Bullet> eligible = candidates.stream()
                .filter(b -> experiences.containsKey(b.getExperienceId()))
                .filter(b -> effective.includes(experiences.get(b.getExperienceId()).getType()))
                .toList();
        if (eligible.isEmpty()) {
            throw new NoBulletsAvailableException("no candidate bullets match the tailoring options");
        }

        JobAnalysis job = ai.analyzeJob(new AnalyzeJobRequest(resume.getJobDescription(), language));

        BulletSelection selection = ai.selectBullets(
                new SelectBulletsRequest(job, eligible, effective.maxBullets(), language));
        List<Bullet> selected = applySelection(selection, eligible, effective);
        if (selected.isEmpty()) {
            throw new NoBulletsAvailableException("no relevant bullets were selected for this job");
        }
        log.info("Selected {} of {} bullets for resume {}", selected.size(), eligible.size(), resume.getId());

        List<TailoredBullet> tailored = tailorBullets(selected, job, language, effective.style());
        List<TailoredExperience> grouped = groupByExperience(tailored, selected, context.experiences());

        SummaryResult summary = ai.generateSummary(
                new GenerateSummaryRequest(context.user(), job, tailored, language));

        ResumeContent draft = new ResumeContent(
                summary.summary(), grouped, surfacedSkills(context.skills(), effective.highlightSkills()), null);
        ResumeContent content = draft.withAnalysis(analyzeCoverage(job, draft));

        MatchScore score = ai.scoreMatch(new ScoreMatchRequest(job, content, context.skills()));

        if (resume.getJobTitle() == null || resume.getJobTitle().isBlank()) {
            resume.setJobDetails(job.title(), job.company(), null);
        }
        resume.selectBullets(selected.stream().map(Bullet::getId).toList());
        resume.setGeneratedContent(content);
        resume.setScore(score);

        log.info("Tailored resume {} in {}ms: {} bullets, score {}",
                resume.getId(), System.currentTimeMillis() - startTime, selected.size(), score.value());
        return resume;
    }

    /**
     * Keeps the backend's order, dropping unknown and repeated ids, then applies both caps.
     */
    List<Bullet> applySelection(BulletSelection selection, List<Bullet> eligible, TailoringOptions options) {
        Map<String, Bullet> byId = new HashMap<>();
        eligible.forEach(b -> byId.put(b.getId(), b));

        Set<String> seen = new LinkedHashSet<>();
        Map<String, Integer> perExperience = new HashMap<>();
        List<Bullet> result = new ArrayList<>();
        int foreign = 0;

        for (String id : selection.selectedBulletIds()) {
            Bullet bullet = byId.get(id);
            if (bullet == null) {
                foreign++;
                continue;
            }
            if (!seen.add(id)) {
                continue;
            }
            int count = perExperience.getOrDefault(bullet.getExperienceId(), 0);
            if (options.maxBulletsPerExperience() > 0 && count >= options.maxBulletsPerExperience()) {
                continue;
            }
            perExperience.put(bullet.getExperienceId(), count + 1);
            result.add(bullet);
            if (result.size() >= options.maxBullets()) {
                break;
            }
        }

        if (foreign > 0) {
            log.warn("Dropped {} selected bullet ids that are not in the candidate set", foreign);
        }
        return result;
    }

    private List<TailoredBullet> tailorBullets(List<Bullet> bullets, JobAnalysis job, String language, String style) {
        if (!properties.isParallelTailoring() || bullets.size() < 2) {
            List<TailoredBullet> tailored = new ArrayList<>(bullets.size());
            for (Bullet bullet : bullets) {
                tailored.add(tailorOne(bullet, job, language, style));
            }
            return tailored;
        }

        List<Future<TailoredBullet>> futures = bullets.stream()
                .map(b -> tailoringExecutor.submit(() -> tailorOne(b, job, language, style)))
                .toList();

        List<TailoredBullet> tailored = new ArrayList<>(bullets.size());
        try {
            for (Future<TailoredBullet> future : futures) {
                tailored.add(future.get());
            }
        } catch (InterruptedException e) {
            futures.forEach(f -> f.cancel(true));
            Thread.currentThread().interrupt();
            throw new TailoringCancelledException("tailor bullets", e);
        } catch (ExecutionException e) {
            futures.forEach(f -> f.cancel(true));
            if (e.getCause() instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException("bullet tailoring failed", e.getCause());
        }
        return tailored;
    }

    private TailoredBullet tailorOne(Bullet bullet, JobAnalysis job, String language, String style) {
        TailoredBulletResult result = ai.tailorBullet(new TailorBulletRequest(bullet, job, language, style));
        return new TailoredBullet(bullet.getId(), bullet.getContent(), result.tailoredContent(), result.keywords());
    }

    /**
     * Groups tailored bullets under their experiences. Experiences follow their own
     * display order; bullets inside a group keep selection order.
     */
    private static List<TailoredExperience> groupByExperience(List<TailoredBullet> tailored,
                                                              List<Bullet> selected,
                                                              List<Experience> experiences) {
        Map<String, List<TailoredBullet>> byExperience = new HashMap<>();
        for (int i = 0; i < selected.size(); i++) {
            byExperience.computeIfAbsent(selected.get(i).getExperienceId(), k -> new ArrayList<>())
                    .add(tailored.get(i));
        }

        return experiences.stream()
                .sorted(Comparator.comparingInt(Experience::getDisplayOrder))
                .filter(e -> byExperience.containsKey(e.getId()))
                .map(e -> TailoredExperience.from(e, byExperience.get(e.getId())))
                .toList();
    }

    /**
     * Requested highlights first, then skills the user highlighted, then the rest.
     */
    static List<String> surfacedSkills(List<Skill> skills, List<String> highlightRequests) {
        Set<String> names = new LinkedHashSet<>();
        for (String request : highlightRequests) {
            skills.stream()
                    .filter(s -> s.getName().equalsIgnoreCase(request.trim()))
                    .findFirst()
                    .ifPresent(s -> names.add(s.getName()));
        }
        skills.stream().filter(Skill::isHighlighted).forEach(s -> names.add(s.getName()));
        skills.forEach(s -> names.add(s.getName()));
        return new ArrayList<>(names);
    }

    /**
     * Which job terms made it into the tailored text, by whole-word, case-insensitive match.
     */
    static ResumeAnalysis analyzeCoverage(JobAnalysis job, ResumeContent content) {
        StringBuilder text = new StringBuilder(content.summary() == null ? "" : content.summary());
        content.allBullets().forEach(b -> text.append('\n').append(b.tailoredContent()));
        content.skills().forEach(s -> text.append('\n').append(s));
        String haystack = text.toString().replace("**", "");

        List<String> matched = new ArrayList<>();
        List<String> missing = new ArrayList<>();
        for (String term : job.targetTerms()) {
            if (mentions(haystack, term)) {
                matched.add(term);
            } else {
                missing.add(term);
            }
        }

        List<String> strengths = job.requiredSkills().stream().filter(matched::contains).toList();
        List<String> gaps = job.requiredSkills().stream().filter(missing::contains).toList();
        List<String> recommendations = gaps.stream()
                .map(skill -> "Add evidence of " + skill + " if you have it")
                .toList();

        return new ResumeAnalysis(matched, missing, recommendations, strengths, gaps);
    }

    private static boolean mentions(String text, String term) {
        Pattern pattern = Pattern.compile(
                "(?<![\\p{L}\\p{N}])" + Pattern.quote(term.toLowerCase(Locale.ROOT)) + "(?![\\p{L}\\p{N}])");
        return pattern.matcher(text.toLowerCase(Locale.ROOT)).find();
    }
}
