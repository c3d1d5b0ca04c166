package org.learningjava.biasscore.application.usecase;

import org.learningjava.biasscore.application.cache.ResponseCache;
import org.learningjava.biasscore.application.port.CancellationSignal;
import org.learningjava.biasscore.application.port.ScoreStatements;
import org.learningjava.biasscore.application.port.ScoreStorePort;
import org.learningjava.biasscore.application.port.ScoringProviderPort;
import org.learningjava.biasscore.application.port.StoreTransaction;
import org.learningjava.biasscore.domain.error.PersistenceException;
import org.learningjava.biasscore.domain.error.PersistenceStep;
import org.learningjava.biasscore.domain.error.ScoringErrorKind;
import org.learningjava.biasscore.domain.error.ScoringException;
import org.learningjava.biasscore.domain.model.AggregationResult;
import org.learningjava.biasscore.domain.model.Article;
import org.learningjava.biasscore.domain.model.CompositeConfig;
import org.learningjava.biasscore.domain.model.ModelPerspective;
import org.learningjava.biasscore.domain.model.ModelScore;
import org.learningjava.biasscore.domain.model.ProviderJudgment;
import org.learningjava.biasscore.domain.model.ScoreMetadata;
import org.learningjava.biasscore.domain.service.PerspectiveMapper;
import org.learningjava.biasscore.domain.service.prompting.PromptBuilder;
import org.learningjava.biasscore.domain.service.prompting.PromptVariant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.sql.SQLException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;

@Service
public class ArticleScoringUseCase {

    private static final Logger log = LoggerFactory.getLogger(ArticleScoringUseCase.class);

    private final ScoringProviderPort provider;
    private final PromptBuilder prompts;
    private final ResponseCache cache;
    private final PerspectiveMapper mapper;
    private final CompositeConfig config;
    private final ScoreStorePort store;
    private final ScoreManager scoreManager;
    private final EnsembleCoordinator ensemble;
    private final Clock clock;

    public ArticleScoringUseCase(ScoringProviderPort provider,
                                 PromptBuilder prompts,
                                 ResponseCache cache,
                                 PerspectiveMapper mapper,
                                 CompositeConfig config,
                                 ScoreStorePort store,
                                 ScoreManager scoreManager,
                                 EnsembleCoordinator ensemble,
                                 Clock clock) {
        this.provider = provider;
        this.prompts = prompts;
        this.cache = cache;
        this.mapper = mapper;
        this.config = config;
        this.store = store;
        this.scoreManager = scoreManager;
        this.ensemble = ensemble;
        this.clock = clock;
    }

    /** One model's judgment of the article, served from the response cache when the content was seen before. */
    public ModelScore analyzeContent(Article article, String model) {
        String hash = ResponseCache.contentHash(article.content());
        ModelScore cached = cache.get(hash, model);
        if (cached != null) {
            log.debug("Response cache hit for article {} model {}", article.id(), model);
            return cached.articleId() == article.id() ? cached
                    : new ModelScore(article.id(), cached.model(), cached.score(), cached.metadata(), cached.createdAt());
        }

        ProviderJudgment j = provider.score(model, prompts.build(PromptVariant.DEFAULT, article.content()));
        String perspective = mapper.map(model, config.models());
        ModelScore score = new ModelScore(article.id(), model, j.score(),
                new ScoreMetadata(j.confidence(), j.explanation(), perspective).toJson(), clock.instant());
        cache.set(hash, model, score);
        return score;
    }

    /**
     * Drops cached answers for the article, asks every configured model again, stores the
     * per-model rows and recomputes the composite score. A model that fails is skipped,
     * unless both API keys are rate limited.
     */
    public AggregationResult rescore(Article article, CancellationSignal cancel) {
        cache.remove(ResponseCache.contentHash(article.content()));

        List<ModelScore> scores = new ArrayList<>();
        for (ModelPerspective m : config.models()) {
            if (m.modelName().isBlank()) continue;
            if (cancel != null && cancel.isCancelled()) {
                throw new ScoringException(ScoringErrorKind.CANCELLED, "scoring of article " + article.id() + " cancelled");
            }
            try {
                scores.add(analyzeContent(article, m.modelName()));
            } catch (ScoringException e) {
                if (e.is(ScoringErrorKind.BOTH_LLM_KEYS_RATE_LIMITED) || e.is(ScoringErrorKind.CANCELLED)) throw e;
                log.warn("Model {} failed for article {}: {}", m.modelName(), article.id(), e.getMessage());
            }
        }

        if (!scores.isEmpty()) saveModelScores(scores);
        return scoreManager.updateArticleScore(article.id(), scores, config, cancel);
    }

    public ModelScore analyzeEnsemble(Article article) {
        ModelScore result = ensemble.analyze(article);
        saveModelScores(List.of(result));
        return result;
    }

    // ---- helpers ----

    private void saveModelScores(List<ModelScore> scores) {
        StoreTransaction tx;
        try {
            tx = store.begin();
        } catch (SQLException e) {
            throw new PersistenceException(PersistenceStep.BEGIN, "Failed to start DB transaction: " + e.getMessage(), e);
        }
        try {
            for (ModelScore s : scores) {
                tx.execute(ScoreStatements.UPSERT_MODEL_SCORE, s.articleId(), s.model(), s.score(),
                        s.metadata(), ScoreStatements.SCORE_VERSION, s.createdAt());
            }
            tx.commit();
        } catch (SQLException e) {
            PersistenceException pe = new PersistenceException(PersistenceStep.INSERT,
                    "Failed to store model scores: " + e.getMessage(), e);
            try {
                tx.rollback();
            } catch (SQLException rb) {
                pe.addSuppressed(rb);
            }
            throw pe;
        } finally {
            try {
                tx.close();
            } catch (SQLException e) {
                log.warn("Closing transaction failed: {}", e.getMessage());
            }
        }
    }
}
