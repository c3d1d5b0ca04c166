package org.learningjava.biasscore.infrastructure.adapter.in.runner;

import org.learningjava.biasscore.application.port.ArticleSourcePort;
import org.learningjava.biasscore.application.port.CancellationSignal;
import org.learningjava.biasscore.application.usecase.ArticleScoringUseCase;
import org.learningjava.biasscore.config.ScoringProperties;
import org.learningjava.biasscore.domain.error.ScoringErrorKind;
import org.learningjava.biasscore.domain.error.ScoringException;
import org.learningjava.biasscore.domain.model.AggregationResult;
import org.learningjava.biasscore.domain.model.Article;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Scores a batch of articles that have no LLM score yet when the application starts.
 * Off unless {@code scoring.runner.enabled=true}.
 */
@Component
public class ScoreArticlesRunner implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(ScoreArticlesRunner.class);

    private final ArticleSourcePort articles;
    private final ArticleScoringUseCase scoring;
    private final ScoringProperties props;

    public ScoreArticlesRunner(ArticleSourcePort articles, ArticleScoringUseCase scoring, ScoringProperties props) {
        this.articles = articles;
        this.scoring = scoring;
        this.props = props;
    }

    @Override
    public void run(ApplicationArguments args) {
        if (!props.getRunner().isEnabled()) {
            log.info("Score runner disabled (scoring.runner.enabled=false)");
            return;
        }
        runBatch();
    }

    /** @return number of articles scored successfully */
    public int runBatch() {
        List<Article> batch = articles.findUnscored(props.getRunner().getBatchSize());
        log.info("=== Scoring {} unscored articles ===", batch.size());
        int ok = 0;
        for (Article a : batch) {
            try {
                AggregationResult r = scoring.rescore(a, CancellationSignal.NONE);
                log.info("Article {} -> score={} confidence={}", a.id(), r.score(), r.confidence());
                ok++;
            } catch (ScoringException e) {
                if (e.is(ScoringErrorKind.BOTH_LLM_KEYS_RATE_LIMITED)) {
                    log.error("Both LLM keys rate limited; stopping batch after {} articles", ok);
                    break;
                }
                log.error("Scoring article {} failed: {}", a.id(), e.getMessage());
            }
        }
        log.info("=== Scoring done: {}/{} succeeded ===", ok, batch.size());
        return ok;
    }
}
