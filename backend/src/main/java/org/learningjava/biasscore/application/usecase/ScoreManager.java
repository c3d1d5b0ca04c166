package org.learningjava.biasscore.application.usecase;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.learningjava.biasscore.application.port.ArticleViewCache;
import org.learningjava.biasscore.application.port.CancellationSignal;
import org.learningjava.biasscore.application.port.ScoreStatements;
import org.learningjava.biasscore.application.port.ScoreStorePort;
import org.learningjava.biasscore.application.port.StoreTransaction;
import org.learningjava.biasscore.application.progress.ProgressState;
import org.learningjava.biasscore.application.progress.ProgressStatus;
import org.learningjava.biasscore.application.progress.ProgressTracker;
import org.learningjava.biasscore.domain.error.PersistenceException;
import org.learningjava.biasscore.domain.error.PersistenceStep;
import org.learningjava.biasscore.domain.error.ScoringErrorKind;
import org.learningjava.biasscore.domain.error.ScoringException;
import org.learningjava.biasscore.domain.model.AggregationResult;
import org.learningjava.biasscore.domain.model.CompositeConfig;
import org.learningjava.biasscore.domain.model.ModelScore;
import org.learningjava.biasscore.domain.service.CompositeAggregator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Aggregates an article's model scores and stores the result atomically: the ensemble row
 * and the article's composite score are written in one transaction, progress is reported
 * at every step, and the article's cached views are dropped only after commit.
 */
@Service
public class ScoreManager {

    private static final Logger log = LoggerFactory.getLogger(ScoreManager.class);

    static final String STEP_START = "Start";
    static final String STEP_CALCULATING = "Calculating";
    static final String STEP_CALCULATION_FAILED = "Calculation";
    static final String STEP_STORING = "Storing";
    static final String STEP_UPDATING = "Updating";
    static final String STEP_COMPLETE = "Complete";
    static final String STEP_CANCELLED = "Cancelled";

    private final CompositeAggregator aggregator;
    private final ScoreStorePort store;
    private final ProgressTracker progress;
    private final ArticleViewCache viewCache;
    private final Clock clock;
    private final ObjectMapper om = new ObjectMapper();

    public ScoreManager(CompositeAggregator aggregator,
                        ScoreStorePort store,
                        ProgressTracker progress,
                        ArticleViewCache viewCache,
                        Clock clock) {
        this.aggregator = Objects.requireNonNull(aggregator, "aggregator");
        this.store = Objects.requireNonNull(store, "store");
        this.progress = progress;
        this.viewCache = viewCache;
        this.clock = clock == null ? Clock.systemUTC() : clock;
    }

    public AggregationResult updateArticleScore(long articleId, List<ModelScore> scores, CompositeConfig cfg) {
        return updateArticleScore(articleId, scores, cfg, CancellationSignal.NONE);
    }

    public AggregationResult updateArticleScore(long articleId, List<ModelScore> scores, CompositeConfig cfg,
                                                CancellationSignal cancel) {
        if (cfg == null) throw new IllegalArgumentException("composite score config is null");
        CancellationSignal signal = cancel == null ? CancellationSignal.NONE : cancel;

        report(articleId, STEP_START, "Starting scoring", 0, ProgressStatus.IN_PROGRESS, null);
        report(articleId, STEP_CALCULATING, "Calculating score", 20, ProgressStatus.IN_PROGRESS, null);

        AggregationResult result;
        try {
            result = aggregator.aggregate(scores, cfg);
        } catch (ScoringException e) {
            log.error("Score calculation failed for article {}: {}", articleId, e.getMessage());
            report(articleId, STEP_CALCULATION_FAILED, "Score calculation failed", 20, ProgressStatus.ERROR, e);
            throw e;
        }

        if (signal.isCancelled()) throw cancelled(articleId, null);

        report(articleId, STEP_STORING, "Storing ensemble score", 60, ProgressStatus.IN_PROGRESS, null);
        persist(articleId, result, signal);

        if (viewCache != null) {
            viewCache.invalidate("article:" + articleId);
            viewCache.invalidate("ensemble:" + articleId);
            viewCache.invalidate("bias:" + articleId);
        }

        if (progress != null) {
            progress.setProgress(articleId, new ProgressState(STEP_COMPLETE, "Scoring complete", 100,
                    ProgressStatus.SUCCESS, "", "", result.score(), 0L));
        }
        log.info("Article {} scored: composite={} confidence={}", articleId, result.score(), result.confidence());
        return result;
    }

    // ---- helpers ----

    private void persist(long articleId, AggregationResult result, CancellationSignal signal) {
        StoreTransaction tx;
        try {
            tx = store.begin();
        } catch (SQLException e) {
            throw persistenceFailure(articleId, PersistenceStep.BEGIN, "Failed to start DB transaction", e);
        }

        PersistenceStep step = PersistenceStep.INSERT;
        try {
            Instant now = clock.instant();
            tx.execute(ScoreStatements.UPSERT_MODEL_SCORE,
                    articleId, ModelScore.ENSEMBLE_MODEL, result.score(),
                    ensembleMetadata(now, result.confidence()), ScoreStatements.SCORE_VERSION, now);
            if (signal.isCancelled()) throw cancelled(articleId, tx);

            report(articleId, STEP_UPDATING, "Updating article score", 80, ProgressStatus.IN_PROGRESS, null);
            step = PersistenceStep.UPDATE;
            int rows = tx.execute(ScoreStatements.UPDATE_ARTICLE_SCORE, result.score(), result.confidence(), articleId);
            if (rows == 0) log.warn("Article {} not found while updating its score", articleId);
            if (signal.isCancelled()) throw cancelled(articleId, tx);

            step = PersistenceStep.COMMIT;
            tx.commit();
        } catch (SQLException e) {
            rollback(tx, e);
            throw persistenceFailure(articleId, step, failureMessage(step), e);
        } finally {
            try {
                tx.close();
            } catch (SQLException e) {
                log.warn("Closing transaction for article {} failed: {}", articleId, e.getMessage());
            }
        }
    }

    private ScoringException cancelled(long articleId, StoreTransaction tx) {
        ScoringException e = new ScoringException(ScoringErrorKind.CANCELLED,
                "scoring of article " + articleId + " cancelled");
        if (tx != null) rollback(tx, e);
        log.info("Scoring of article {} cancelled", articleId);
        report(articleId, STEP_CANCELLED, "Scoring cancelled", 0, ProgressStatus.ERROR, e);
        return e;
    }

    private PersistenceException persistenceFailure(long articleId, PersistenceStep step, String message,
                                                    SQLException cause) {
        log.error("{} for article {}: {}", message, articleId, cause.getMessage());
        PersistenceException e = new PersistenceException(step, message + ": " + cause.getMessage(), cause);
        report(articleId, step.label(), message, step.percent(), ProgressStatus.ERROR, e);
        return e;
    }

    private static String failureMessage(PersistenceStep step) {
        return switch (step) {
            case BEGIN -> "Failed to start DB transaction";
            case INSERT -> "Failed to insert ensemble score";
            case UPDATE -> "Failed to update article";
            case COMMIT -> "Failed to commit transaction";
        };
    }

    private void rollback(StoreTransaction tx, Exception primary) {
        try {
            tx.rollback();
        } catch (SQLException rb) {
            log.error("Rollback failed: {}", rb.getMessage());
            primary.addSuppressed(rb);
        }
    }

    private void report(long articleId, String step, String message, int percent, ProgressStatus status,
                        Throwable error) {
        if (progress == null) return;
        // error and its details land in a single write
        progress.setProgress(articleId, new ProgressState(step, message, percent, status,
                error == null ? "" : String.valueOf(error.getMessage()),
                error == null ? "" : progress.errorDetails(error),
                null, 0L));
    }

    private String ensembleMetadata(Instant now, double confidence) {
        ObjectNode n = om.createObjectNode();
        n.put("timestamp", now.toString());
        n.put("aggregation", "ensemble");
        n.put("confidence", confidence);
        return n.toString();
    }
}
