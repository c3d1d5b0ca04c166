package org.learningjava.biasscore.application.usecase;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.learningjava.biasscore.application.port.ScoringProviderPort;
import org.learningjava.biasscore.config.ScoringProperties;
import org.learningjava.biasscore.domain.error.ScoringErrorKind;
import org.learningjava.biasscore.domain.error.ScoringException;
import org.learningjava.biasscore.domain.model.Article;
import org.learningjava.biasscore.domain.model.CompositeConfig;
import org.learningjava.biasscore.domain.model.ModelPerspective;
import org.learningjava.biasscore.domain.model.ModelScore;
import org.learningjava.biasscore.domain.model.ProviderJudgment;
import org.learningjava.biasscore.domain.service.prompting.PromptBuilder;
import org.learningjava.biasscore.domain.service.prompting.PromptVariant;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;

/**
 * Asks every configured model for a judgment, cycling through prompt variants until the
 * model has produced enough confident answers or its attempt budget is spent, then
 * folds the per-model results into one {@code ensemble} score.
 * <p>
 * Models may be queried concurrently on the scoring executor. Results are merged in
 * configuration order, so the outcome does not depend on completion order.
 */
@Service
public class EnsembleCoordinator {

    private static final Logger log = LoggerFactory.getLogger(EnsembleCoordinator.class);

    static final int RETRIES_PER_VARIANT = 2;
    static final double UNCERTAINTY_VARIANCE = 0.1;

    private final ScoringProviderPort provider;
    private final PromptBuilder prompts;
    private final CompositeConfig config;
    private final ScoringProperties.Ensemble settings;
    private final Executor executor;
    private final Clock clock;
    private final ObjectMapper om = new ObjectMapper();

    public EnsembleCoordinator(ScoringProviderPort provider,
                               PromptBuilder prompts,
                               CompositeConfig config,
                               ScoringProperties props,
                               @Qualifier("scoringExecutor") Executor executor,
                               Clock clock) {
        this.provider = provider;
        this.prompts = prompts;
        this.config = config;
        this.settings = props.getEnsemble();
        this.executor = executor;
        this.clock = clock;
    }

    public record SubResult(
            @JsonProperty("model") String model,
            @JsonProperty("prompt_variant") String promptVariant,
            @JsonProperty("score") double score,
            @JsonProperty("explanation") String explanation,
            @JsonProperty("confidence") double confidence,
            @JsonProperty("raw_response") String rawResponse
    ) {}

    public record ModelAggregate(
            @JsonProperty("mean") double mean,
            @JsonProperty("weighted_mean") double weightedMean,
            @JsonProperty("variance") double variance,
            @JsonProperty("count") int count,
            @JsonProperty("sum_confidence") double sumConfidence
    ) {}

    /** Everything one model produced: all answers, and the confident ones that count. */
    record ModelRun(String model, List<SubResult> all, List<SubResult> valid) {}

    public ModelScore analyze(Article article) {
        List<String> models = new ArrayList<>();
        for (ModelPerspective m : config.models()) {
            if (m.modelName().isBlank()) {
                log.warn("[Ensemble] Skipping model config with empty name (perspective {})", m.perspective());
                continue;
            }
            models.add(m.modelName());
        }
        if (models.isEmpty()) {
            throw new ScoringException(ScoringErrorKind.ALL_PERSPECTIVES_INVALID, "no valid models in configuration");
        }
        log.info("[Ensemble] Article {} | using {} models: {}", article.id(), models.size(), models);

        List<ModelRun> runs = runAll(article, models);

        List<SubResult> allSubResults = new ArrayList<>();
        Map<String, List<SubResult>> perModelResults = new LinkedHashMap<>();
        Map<String, ModelAggregate> perModelAgg = new LinkedHashMap<>();
        for (ModelRun run : runs) {
            allSubResults.addAll(run.all());
            if (run.valid().isEmpty()) {
                log.warn("[Ensemble] Model {}: no confident responses, skipping", run.model());
                continue;
            }
            ModelAggregate agg = aggregateModel(run.valid());
            perModelResults.put(run.model(), run.valid());
            perModelAgg.put(run.model(), agg);
            log.debug("[Ensemble] Model {}: {} valid responses, weighted mean={}, variance={}, sum_confidence={}",
                    run.model(), agg.count(), agg.weightedMean(), agg.variance(), agg.sumConfidence());
        }

        if (perModelAgg.isEmpty()) {
            log.error("[Ensemble] Article {} | no confident responses from any model", article.id());
            throw new ScoringException(ScoringErrorKind.ALL_PERSPECTIVES_INVALID,
                    "no valid high-confidence LLM responses from any model");
        }

        double weighted = 0.0;
        double totalWeight = 0.0;
        double varianceSum = 0.0;
        for (ModelAggregate agg : perModelAgg.values()) {
            weighted += agg.weightedMean() * agg.sumConfidence();
            varianceSum += agg.variance() * agg.sumConfidence();
            totalWeight += agg.sumConfidence();
        }
        double finalScore = weighted / Math.max(totalWeight, 1e-9);
        double variance = varianceSum / Math.max(totalWeight, 1e-9);
        double confidence = Math.max(0.0, 1.0 - variance);
        boolean uncertain = variance > UNCERTAINTY_VARIANCE;

        log.info("[Ensemble] Article {} | score={} confidence={} variance={} subResults={}",
                article.id(), finalScore, confidence, variance, allSubResults.size());

        Map<String, Object> finalAgg = new LinkedHashMap<>();
        finalAgg.put("weighted_mean", finalScore);
        finalAgg.put("variance", variance);
        finalAgg.put("uncertainty_flag", uncertain);
        finalAgg.put("total_weight", totalWeight);

        Map<String, Object> meta = new LinkedHashMap<>();
        meta.put("confidence", confidence);
        meta.put("all_sub_results", allSubResults);
        meta.put("per_model_results", perModelResults);
        meta.put("per_model_aggregation", perModelAgg);
        meta.put("final_aggregation", finalAgg);
        meta.put("timestamp", clock.instant().toString());

        return new ModelScore(article.id(), ModelScore.ENSEMBLE_MODEL, finalScore, toJson(meta), clock.instant());
    }

    // ---- helpers ----

    private List<ModelRun> runAll(Article article, List<String> models) {
        if (executor == null || models.size() == 1) {
            List<ModelRun> out = new ArrayList<>();
            for (String m : models) out.add(runModel(article, m));
            return out;
        }
        List<CompletableFuture<ModelRun>> futures = new ArrayList<>();
        for (String m : models) {
            futures.add(CompletableFuture.supplyAsync(() -> runModel(article, m), executor));
        }
        List<ModelRun> out = new ArrayList<>();
        for (CompletableFuture<ModelRun> f : futures) {
            try {
                out.add(f.join());
            } catch (CompletionException e) {
                futures.forEach(other -> other.cancel(true));
                if (e.getCause() instanceof RuntimeException re) throw re;
                throw e;
            }
        }
        return out;
    }

    ModelRun runModel(Article article, String model) {
        List<SubResult> all = new ArrayList<>();
        List<SubResult> valid = new ArrayList<>();
        int attempts = 0;

        outer:
        while (attempts < settings.getMaxAttempts() && valid.size() < settings.getMinValid()) {
            for (PromptVariant pv : PromptVariant.values()) {
                for (int retry = 0; retry < RETRIES_PER_VARIANT
                        && attempts < settings.getMaxAttempts()
                        && valid.size() < settings.getMinValid(); retry++) {
                    attempts++;
                    ProviderJudgment j;
                    try {
                        j = provider.score(model, prompts.build(pv, article.content()));
                    } catch (ScoringException e) {
                        if (e.is(ScoringErrorKind.BOTH_LLM_KEYS_RATE_LIMITED) || e.is(ScoringErrorKind.CANCELLED)) {
                            throw e;
                        }
                        log.warn("[Ensemble] Article {} | Model {} | Prompt {} | call failed: {}",
                                article.id(), model, pv.id(), e.getMessage());
                        continue;
                    }
                    SubResult sub = new SubResult(model, pv.id(), j.score(), j.explanation(),
                            j.confidence(), j.rawResponse());
                    all.add(sub);
                    if (j.confidence() >= settings.getConfidenceThreshold()) valid.add(sub);
                }
                if (attempts >= settings.getMaxAttempts() || valid.size() >= settings.getMinValid()) break outer;
            }
        }
        log.debug("[Ensemble] Model {} finished after {} attempts", model, attempts);
        return new ModelRun(model, all, valid);
    }

    static ModelAggregate aggregateModel(List<SubResult> valid) {
        double sum = 0.0;
        double weightedSum = 0.0;
        double sumConfidence = 0.0;
        for (SubResult r : valid) {
            sum += r.score();
            weightedSum += r.score() * r.confidence();
            sumConfidence += r.confidence();
        }
        double mean = sum / valid.size();
        double weightedMean = weightedSum / Math.max(sumConfidence, 1e-6);
        double varianceSum = 0.0;
        for (SubResult r : valid) {
            double d = r.score() - mean;
            varianceSum += d * d;
        }
        return new ModelAggregate(mean, weightedMean, varianceSum / valid.size(), valid.size(), sumConfidence);
    }

    private String toJson(Map<String, Object> meta) {
        try {
            return om.writeValueAsString(meta);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize ensemble metadata", e);
        }
    }
}
