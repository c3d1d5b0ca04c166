package org.learningjava.biasscore.application.usecase;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.learningjava.biasscore.application.port.ScoringProviderPort;
import org.learningjava.biasscore.config.ScoringProperties;
import org.learningjava.biasscore.domain.error.ProviderErrorCategory;
import org.learningjava.biasscore.domain.error.ProviderException;
import org.learningjava.biasscore.domain.error.ScoringErrorKind;
import org.learningjava.biasscore.domain.error.ScoringException;
import org.learningjava.biasscore.domain.model.Article;
import org.learningjava.biasscore.domain.model.CompositeConfig;
import org.learningjava.biasscore.domain.model.ModelPerspective;
import org.learningjava.biasscore.domain.model.ModelScore;
import org.learningjava.biasscore.domain.model.ProviderJudgment;
import org.learningjava.biasscore.domain.service.prompting.DefaultPromptBuilder;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.concurrent.Executor;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class EnsembleCoordinatorTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-05-01T12:00:00Z"), ZoneOffset.UTC);
    private static final Article ARTICLE = new Article(5L, "Lawmakers passed the budget.");

    private ScoringProviderPort provider;
    private ScoringProperties props;

    @BeforeEach
    void setUp() {
        provider = mock(ScoringProviderPort.class);
        props = new ScoringProperties();
    }

    private EnsembleCoordinator coordinator(Executor executor, String... models) {
        List<ModelPerspective> rows = java.util.Arrays.stream(models)
                .map(m -> new ModelPerspective(m, "center"))
                .toList();
        CompositeConfig cfg = new CompositeConfig(null, null, -1, 1, 0, null, null, 0, 0, rows);
        return new EnsembleCoordinator(provider, new DefaultPromptBuilder(), cfg, props, executor, CLOCK);
    }

    @Test
    void analyze_weightsModelsByConfidence() throws Exception {
        when(provider.score(eq("a"), anyString())).thenReturn(new ProviderJudgment(0.4, 0.9, "a says", "{}"));
        when(provider.score(eq("b"), anyString())).thenReturn(new ProviderJudgment(-0.2, 0.6, "b says", "{}"));

        ModelScore s = coordinator(null, "a", "b").analyze(ARTICLE);

        assertEquals(5L, s.articleId());
        assertEquals("ensemble", s.model());
        assertEquals(0.16, s.score(), 1e-9);
        assertEquals(CLOCK.instant(), s.createdAt());

        JsonNode meta = new ObjectMapper().readTree(s.metadata());
        assertEquals(1.0, meta.get("confidence").asDouble(), 1e-9);
        assertEquals(2, meta.get("all_sub_results").size());
        assertEquals("default", meta.get("all_sub_results").get(0).get("prompt_variant").asText());
        assertEquals(1, meta.get("per_model_aggregation").get("a").get("count").asInt());
        assertFalse(meta.get("final_aggregation").get("uncertainty_flag").asBoolean());
        assertEquals("2024-05-01T12:00:00Z", meta.get("timestamp").asText());
    }

    @Test
    void analyze_directExecutorGivesSameResult() {
        when(provider.score(eq("a"), anyString())).thenReturn(new ProviderJudgment(0.4, 0.9, "a", "{}"));
        when(provider.score(eq("b"), anyString())).thenReturn(new ProviderJudgment(-0.2, 0.6, "b", "{}"));

        ModelScore s = coordinator(Runnable::run, "a", "b").analyze(ARTICLE);

        assertEquals(0.16, s.score(), 1e-9);
    }

    @Test
    void lowConfidenceModel_spendsAttemptBudgetAndIsSkipped() {
        when(provider.score(eq("a"), anyString())).thenReturn(new ProviderJudgment(0.5, 0.9, "a", "{}"));
        when(provider.score(eq("weak"), anyString())).thenReturn(new ProviderJudgment(-1.0, 0.3, "unsure", "{}"));

        ModelScore s = coordinator(null, "a", "weak").analyze(ARTICLE);

        assertEquals(0.5, s.score(), 1e-9);
        verify(provider, times(6)).score(eq("weak"), anyString());
        verify(provider, times(1)).score(eq("a"), anyString());
    }

    @Test
    void failedCall_isRetriedWithinBudget() {
        when(provider.score(eq("a"), anyString()))
                .thenThrow(new ProviderException(ProviderErrorCategory.UNKNOWN, 500, "boom", Duration.ZERO))
                .thenReturn(new ProviderJudgment(0.2, 0.8, "ok", "{}"));

        ModelScore s = coordinator(null, "a").analyze(ARTICLE);

        assertEquals(0.2, s.score(), 1e-9);
        verify(provider, times(2)).score(eq("a"), anyString());
    }

    @Test
    void noConfidentAnswers_failsAsAllPerspectivesInvalid() {
        when(provider.score(anyString(), anyString())).thenReturn(new ProviderJudgment(0.1, 0.2, "meh", "{}"));

        ScoringException e = assertThrows(ScoringException.class, () -> coordinator(null, "a", "b").analyze(ARTICLE));

        assertEquals(ScoringErrorKind.ALL_PERSPECTIVES_INVALID, e.kind());
    }

    @Test
    void bothKeysRateLimited_isRethrown() {
        when(provider.score(anyString(), anyString()))
                .thenThrow(new ScoringException(ScoringErrorKind.BOTH_LLM_KEYS_RATE_LIMITED));

        ScoringException e = assertThrows(ScoringException.class,
                () -> coordinator(Runnable::run, "a", "b").analyze(ARTICLE));

        assertEquals(ScoringErrorKind.BOTH_LLM_KEYS_RATE_LIMITED, e.kind());
    }

    @Test
    void blankModelNamesOnly_isConfigurationError() {
        ScoringException e = assertThrows(ScoringException.class, () -> coordinator(null, " ", "").analyze(ARTICLE));

        assertEquals(ScoringErrorKind.ALL_PERSPECTIVES_INVALID, e.kind());
        verifyNoInteractions(provider);
    }

    @Test
    void aggregateModel_meanVarianceAndConfidenceSum() {
        List<EnsembleCoordinator.SubResult> valid = List.of(
                new EnsembleCoordinator.SubResult("m", "default", 0.2, "", 1.0, ""),
                new EnsembleCoordinator.SubResult("m", "left_focus", 0.6, "", 0.5, ""));

        EnsembleCoordinator.ModelAggregate agg = EnsembleCoordinator.aggregateModel(valid);

        assertEquals(0.4, agg.mean(), 1e-9);
        assertEquals((0.2 * 1.0 + 0.6 * 0.5) / 1.5, agg.weightedMean(), 1e-9);
        assertEquals(0.04, agg.variance(), 1e-9);
        assertEquals(2, agg.count());
        assertEquals(1.5, agg.sumConfidence(), 1e-9);
    }
}
