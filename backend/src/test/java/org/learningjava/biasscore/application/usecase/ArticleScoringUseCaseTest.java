package org.learningjava.biasscore.application.usecase;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.learningjava.biasscore.application.cache.ResponseCache;
import org.learningjava.biasscore.application.port.CancellationSignal;
import org.learningjava.biasscore.application.port.ScoreStorePort;
import org.learningjava.biasscore.application.port.ScoringProviderPort;
import org.learningjava.biasscore.domain.error.ProviderErrorCategory;
import org.learningjava.biasscore.domain.error.ProviderException;
import org.learningjava.biasscore.domain.error.ScoringErrorKind;
import org.learningjava.biasscore.domain.error.ScoringException;
import org.learningjava.biasscore.domain.model.Article;
import org.learningjava.biasscore.domain.model.CompositeConfig;
import org.learningjava.biasscore.domain.model.ModelPerspective;
import org.learningjava.biasscore.domain.model.ModelScore;
import org.learningjava.biasscore.domain.model.ProviderJudgment;
import org.learningjava.biasscore.domain.service.PerspectiveMapper;
import org.learningjava.biasscore.domain.service.prompting.DefaultPromptBuilder;

import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class ArticleScoringUseCaseTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2024-05-01T12:00:00Z"), ZoneOffset.UTC);

    private ScoringProviderPort provider;
    private ResponseCache cache;
    private ScoreStorePort store;
    private ScoreManager scoreManager;
    private EnsembleCoordinator ensemble;
    private RecordingTransaction tx;
    private CompositeConfig cfg;
    private ArticleScoringUseCase useCase;

    @BeforeEach
    void setUp() throws SQLException {
        provider = mock(ScoringProviderPort.class);
        cache = new ResponseCache();
        store = mock(ScoreStorePort.class);
        tx = new RecordingTransaction();
        when(store.begin()).thenReturn(tx);
        scoreManager = mock(ScoreManager.class);
        ensemble = mock(EnsembleCoordinator.class);
        cfg = new CompositeConfig(null, null, -1, 1, 0, null, null, 0, 0, List.of(
                new ModelPerspective("vendor/left-model", "left"),
                new ModelPerspective("vendor/center-model", "center"),
                new ModelPerspective("vendor/right-model", "right")));
        useCase = new ArticleScoringUseCase(provider, new DefaultPromptBuilder(), cache, new PerspectiveMapper(),
                cfg, store, scoreManager, ensemble, CLOCK);
    }

    @Test
    void analyzeContent_secondCallIsServedFromCache() {
        when(provider.score(eq("vendor/left-model"), anyString()))
                .thenReturn(new ProviderJudgment(-0.4, 0.8, "leans left", "{}"));

        ModelScore first = useCase.analyzeContent(new Article(1L, "same text"), "vendor/left-model");
        ModelScore second = useCase.analyzeContent(new Article(2L, "same text"), "vendor/left-model");

        verify(provider, times(1)).score(anyString(), anyString());
        assertEquals(1L, first.articleId());
        assertEquals(2L, second.articleId());
        assertEquals(first.score(), second.score());
        assertEquals("left", first.parsedMetadata().perspective());
        assertEquals(0.8, first.parsedMetadata().confidence(), 1e-9);
        assertEquals(CLOCK.instant(), first.createdAt());
    }

    @Test
    @SuppressWarnings("unchecked")
    void rescore_skipsFailingModelAndStoresTheRest() {
        when(provider.score(eq("vendor/left-model"), anyString())).thenReturn(new ProviderJudgment(-0.4, 0.8, "l", "{}"));
        when(provider.score(eq("vendor/center-model"), anyString()))
                .thenThrow(new ProviderException(ProviderErrorCategory.UNKNOWN, 500, "boom", Duration.ZERO));
        when(provider.score(eq("vendor/right-model"), anyString())).thenReturn(new ProviderJudgment(0.2, 0.7, "r", "{}"));
        Article article = new Article(9L, "fresh text");

        useCase.rescore(article, CancellationSignal.NONE);

        assertEquals(2, tx.statements.size());
        assertTrue(tx.committed);
        ArgumentCaptor<List<ModelScore>> captor = ArgumentCaptor.forClass(List.class);
        verify(scoreManager).updateArticleScore(eq(9L), captor.capture(), eq(cfg), any());
        assertEquals(List.of("vendor/left-model", "vendor/right-model"),
                captor.getValue().stream().map(ModelScore::model).toList());
    }

    @Test
    void rescore_dropsCachedAnswersFirst() {
        when(provider.score(anyString(), anyString())).thenReturn(new ProviderJudgment(0.1, 0.9, "x", "{}"));
        Article article = new Article(3L, "cached text");
        useCase.analyzeContent(article, "vendor/left-model");

        useCase.rescore(article, CancellationSignal.NONE);

        verify(provider, times(2)).score(eq("vendor/left-model"), anyString());
    }

    @Test
    void rescore_bothKeysRateLimitedAbortsBeforeStoring() throws SQLException {
        when(provider.score(anyString(), anyString()))
                .thenThrow(new ScoringException(ScoringErrorKind.BOTH_LLM_KEYS_RATE_LIMITED));

        ScoringException e = assertThrows(ScoringException.class,
                () -> useCase.rescore(new Article(4L, "text"), CancellationSignal.NONE));

        assertEquals(ScoringErrorKind.BOTH_LLM_KEYS_RATE_LIMITED, e.kind());
        verify(store, never()).begin();
        verifyNoInteractions(scoreManager);
    }

    @Test
    void rescore_cancelledBeforeFirstCall() {
        ScoringException e = assertThrows(ScoringException.class,
                () -> useCase.rescore(new Article(4L, "text"), () -> true));

        assertEquals(ScoringErrorKind.CANCELLED, e.kind());
        verifyNoInteractions(provider);
    }

    @Test
    void analyzeEnsemble_storesEnsembleRow() {
        ModelScore row = new ModelScore(6L, "ensemble", 0.3, "{\"confidence\":0.9}", CLOCK.instant());
        when(ensemble.analyze(any(Article.class))).thenReturn(row);

        ModelScore result = useCase.analyzeEnsemble(new Article(6L, "text"));

        assertSame(row, result);
        assertEquals(1, tx.statements.size());
        assertEquals("ensemble", tx.statements.get(0).params()[1]);
        assertTrue(tx.committed);
        assertTrue(tx.closed);
    }

    @Test
    void saveFailure_isPersistenceError() {
        when(ensemble.analyze(any(Article.class)))
                .thenReturn(new ModelScore(6L, "ensemble", 0.3, "{}", CLOCK.instant()));
        tx.failOnCommit = true;

        ScoringException e = assertThrows(ScoringException.class, () -> useCase.analyzeEnsemble(new Article(6L, "t")));

        assertEquals(ScoringErrorKind.PERSISTENCE, e.kind());
        assertTrue(tx.rolledBack);
    }
}
