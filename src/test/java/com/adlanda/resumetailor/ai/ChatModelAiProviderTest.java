package com.adlanda.resumetailor.ai;

import com.adlanda.resumetailor.config.TailoringProperties;
import com.adlanda.resumetailor.exception.AiServiceUnavailableException;
import com.adlanda.resumetailor.exception.MalformedAiResponseException;
import com.adlanda.resumetailor.model.Bullet;
import com.adlanda.resumetailor.model.MatchScore;
import com.adlanda.resumetailor.model.ResumeContent;
import com.adlanda.resumetailor.model.Skill;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.ai.retry.TransientAiException;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ChatModelAiProviderTest {

    private static final JobAnalysis JOB = new JobAnalysis("Senior Go Engineer", "Acme",
            List.of("Go", "Kubernetes"), List.of(), List.of("PostgreSQL"), "senior", null, "Build services");

    @Mock
    private ChatCompletionService chat;

    private ChatModelAiProvider provider;
    private TailoringProperties properties;

    @BeforeEach
    void setUp() {
        properties = new TailoringProperties();
        properties.getAi().setAnalysisModel("analysis-model");
        properties.getAi().setGenerationModel("generation-model");
        provider = new ChatModelAiProvider(chat,
                new ResilientCaller(new RetryPolicy(3, Duration.ZERO), delay -> { }),
                new AiResponseParser(new ObjectMapper()),
                properties);
    }

    @Test
    void analyzeJob_usesAnalysisModelAndTargetLanguage() {
        when(chat.complete(eq("analysis-model"), eq(0.3), anyString())).thenReturn("""
                ```json
                {"title": "Senior Go Engineer", "required_skills": ["Go"], "keywords": ["Kubernetes"]}
                ```
                """);

        JobAnalysis analysis = provider.analyzeJob(
                new AnalyzeJobRequest("Senior Go Engineer, needs Kubernetes", "pt-br"));

        ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);
        verify(chat).complete(eq("analysis-model"), eq(0.3), prompt.capture());
        assertThat(prompt.getValue())
                .contains("Senior Go Engineer, needs Kubernetes")
                .contains("Brazilian Portuguese");
        assertThat(analysis.requiredSkills()).containsExactly("Go");
    }

    @Test
    void selectBullets_listsEveryCandidateIdInPrompt() {
        Bullet go = new Bullet("b-go", "exp-1", "Built Go services on PostgreSQL");
        Bullet design = new Bullet("b-ps", "exp-1", "Designed banners in Photoshop");
        when(chat.complete(eq("analysis-model"), eq(0.3), anyString()))
                .thenReturn("{\"selected_bullet_ids\": [\"b-go\"], \"reasoning\": \"Go match\"}");

        BulletSelection selection = provider.selectBullets(
                new SelectBulletsRequest(JOB, List.of(go, design), 1, "en"));

        ArgumentCaptor<String> prompt = ArgumentCaptor.forClass(String.class);
        verify(chat).complete(anyString(), anyDouble(), prompt.capture());
        assertThat(prompt.getValue()).contains("[ID: b-go]", "[ID: b-ps]", "Select up to 1 bullets");
        assertThat(selection.selectedBulletIds()).containsExactly("b-go");
        assertThat(selection.reasoning()).isEqualTo("Go match");
    }

    @Test
    void tailorBullet_usesGenerationModelAndKeepsOriginalId() {
        Bullet bullet = new Bullet("b-go", "exp-1", "Built Go services");
        when(chat.complete(eq("generation-model"), eq(0.7), anyString()))
                .thenReturn("{\"tailored_content\": \"Built **Go** services on **Kubernetes**\", \"keywords\": [\"Go\"]}");

        TailoredBulletResult result = provider.tailorBullet(new TailorBulletRequest(bullet, JOB, "en", "technical"));

        assertThat(result.originalId()).isEqualTo("b-go");
        assertThat(result.tailoredContent()).isEqualTo("Built **Go** services on **Kubernetes**");
        assertThat(result.keywords()).containsExactly("Go");
    }

    @Test
    void scoreMatch_rateLimitedThenSucceeds_returnsScore() {
        when(chat.complete(eq("analysis-model"), eq(0.2), anyString()))
                .thenThrow(new TransientAiException("429 - rate limit"))
                .thenThrow(new TransientAiException("429 - rate limit"))
                .thenReturn("Result: {\"score\": 78, \"breakdown\": {\"skills\": 80.5}, \"explanation\": \"ok\"}");

        MatchScore score = provider.scoreMatch(new ScoreMatchRequest(JOB,
                new ResumeContent("Summary", List.of(), List.of(), null), List.of(new Skill("user-1", "Go"))));

        assertThat(score.value()).isEqualTo(78);
        verify(chat, times(3)).complete(eq("analysis-model"), eq(0.2), anyString());
    }

    @Test
    void scoreMatch_outOfRangeScore_isMalformedAndNotRetried() {
        when(chat.complete(anyString(), anyDouble(), anyString())).thenReturn("{\"score\": 130}");

        assertThatThrownBy(() -> provider.scoreMatch(new ScoreMatchRequest(JOB, null, List.of())))
                .isInstanceOf(MalformedAiResponseException.class);
        verify(chat, times(1)).complete(anyString(), anyDouble(), anyString());
    }

    @Test
    void generateSummary_backendDown_failsAfterAllAttempts() {
        when(chat.complete(anyString(), anyDouble(), anyString()))
                .thenThrow(new TransientAiException("503 - unavailable"));

        assertThatThrownBy(() -> provider.generateSummary(new GenerateSummaryRequest(null, JOB, List.of(), "en")))
                .isInstanceOf(AiServiceUnavailableException.class);
        verify(chat, times(4)).complete(eq("generation-model"), eq(0.8), anyString());
    }

    @Test
    void languageName_knownAndUnknownCodes() {
        assertThat(ChatModelAiProvider.languageName("pt-br")).isEqualTo("Brazilian Portuguese");
        assertThat(ChatModelAiProvider.languageName("EN")).isEqualTo("English");
        assertThat(ChatModelAiProvider.languageName("PT-BR")).isEqualTo("Brazilian Portuguese");
        assertThat(ChatModelAiProvider.languageName("es")).isEqualTo("English");
        assertThat(ChatModelAiProvider.languageName(null)).isEqualTo("English");
    }
}
