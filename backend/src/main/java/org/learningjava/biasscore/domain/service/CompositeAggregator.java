package org.learningjava.biasscore.domain.service;

import org.learningjava.biasscore.domain.error.ScoringErrorKind;
import org.learningjava.biasscore.domain.error.ScoringException;
import org.learningjava.biasscore.domain.model.AggregationResult;
import org.learningjava.biasscore.domain.model.CompositeConfig;
import org.learningjava.biasscore.domain.model.ModelScore;
import org.learningjava.biasscore.domain.model.Perspective;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Turns the raw per-model judgments of one article into a single composite score and a
 * confidence value.
 * <p>
 * Order of evaluation:
 * <ol>
 *   <li>zero-confidence pre-check over every non-ensemble score;</li>
 *   <li>grouping by perspective, best candidate per perspective;</li>
 *   <li>guards: nothing present, everything exactly 0, a single perspective;</li>
 *   <li>formula and confidence.</li>
 * </ol>
 */
@Component
public class CompositeAggregator {

    private static final Logger log = LoggerFactory.getLogger(CompositeAggregator.class);

    private final PerspectiveMapper mapper;

    public CompositeAggregator(PerspectiveMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    public AggregationResult aggregate(List<ModelScore> scores, CompositeConfig cfg) {
        if (cfg == null) throw new IllegalArgumentException("composite score config is null");
        if (scores == null || scores.isEmpty()) {
            throw new ScoringException(ScoringErrorKind.ALL_PERSPECTIVES_INVALID, "no scores provided");
        }

        checkForAllZeroConfidence(scores);

        Map<Perspective, List<ModelScore>> candidates = groupByPerspective(scores, cfg);
        Map<Perspective, Double> present = selectPerPerspective(candidates, cfg);

        if (present.isEmpty()) {
            log.warn("No valid model scores after selection ({} inputs)", scores.size());
            throw new ScoringException(ScoringErrorKind.ALL_PERSPECTIVES_INVALID);
        }
        if (present.values().stream().allMatch(v -> v == 0.0)) {
            log.warn("Every selected perspective score is exactly 0: {}", present);
            throw new ScoringException(ScoringErrorKind.ALL_PERSPECTIVES_INVALID,
                    "all selected perspective scores are zero");
        }

        double score = present.size() == 1
                ? cfg.clampScore(present.values().iterator().next())
                : cfg.clampScore(composite(present, cfg));
        double confidence = confidence(present, cfg);

        log.debug("Composite: present={} formula={} -> score={} confidence={}",
                present, cfg.formula(), score, confidence);
        return new AggregationResult(score, confidence);
    }

    /**
     * Fails with {@link ScoringErrorKind#ALL_SCORES_ZERO_CONFIDENCE} when there is at least one
     * non-ensemble score and none of them carries a positive confidence.
     */
    public void checkForAllZeroConfidence(List<ModelScore> scores) {
        if (scores == null) return;
        int nonEnsemble = 0;
        for (ModelScore s : scores) {
            if (s.isEnsemble()) continue;
            nonEnsemble++;
            if (s.parsedMetadata().confidence() > 0.0) return;
        }
        if (nonEnsemble > 0) {
            log.error("All {} non-ensemble model scores returned zero confidence", nonEnsemble);
            throw new ScoringException(ScoringErrorKind.ALL_SCORES_ZERO_CONFIDENCE);
        }
    }

    // ---- helpers ----

    private Map<Perspective, List<ModelScore>> groupByPerspective(List<ModelScore> scores, CompositeConfig cfg) {
        Map<Perspective, List<ModelScore>> out = new EnumMap<>(Perspective.class);
        for (ModelScore s : scores) {
            Perspective p;
            if (s.isEnsemble()) {
                p = Perspective.CENTER;
            } else {
                p = Perspective.fromLabel(mapper.map(s.model(), cfg.models())).orElse(null);
                if (p == null) {
                    log.warn("Skipping score from unknown model '{}' (article {})", s.model(), s.articleId());
                    continue;
                }
            }
            out.computeIfAbsent(p, k -> new ArrayList<>()).add(s);
        }
        return out;
    }

    private Map<Perspective, Double> selectPerPerspective(Map<Perspective, List<ModelScore>> candidates,
                                                          CompositeConfig cfg) {
        Map<Perspective, Double> present = new EnumMap<>(Perspective.class);
        Comparator<ModelScore> order = Comparator
                .comparingDouble((ModelScore s) -> s.parsedMetadata().confidence()).reversed()
                .thenComparing(ModelScore::createdAt, Comparator.nullsLast(Comparator.<Instant>reverseOrder()));

        for (var e : candidates.entrySet()) {
            List<ModelScore> sorted = new ArrayList<>(e.getValue());
            sorted.sort(order);
            log.debug("Candidates for {}: {}", e.getKey().label(), sorted);

            for (ModelScore s : sorted) {
                if (isValid(s.score(), cfg)) {
                    present.put(e.getKey(), s.score());
                    break;
                }
                if (cfg.handleInvalid() == CompositeConfig.InvalidHandling.DEFAULT) {
                    log.debug("Invalid score {} from '{}' replaced by default {}", s.score(), s.model(), cfg.defaultMissing());
                    present.put(e.getKey(), cfg.defaultMissing());
                    break;
                }
            }
        }
        return present;
    }

    private static boolean isValid(double v, CompositeConfig cfg) {
        return Double.isFinite(v) && v >= cfg.minScore() && v <= cfg.maxScore();
    }

    private static double composite(Map<Perspective, Double> present, CompositeConfig cfg) {
        return switch (cfg.formula()) {
            case AVERAGE -> average(present, cfg);
            case WEIGHTED -> {
                double sum = 0.0;
                double total = 0.0;
                // missing perspectives take no part, unlike average
                for (var e : present.entrySet()) {
                    double w = cfg.weightOf(e.getKey());
                    sum += e.getValue() * w;
                    total += w;
                }
                yield total > 0 ? sum / total : average(present, cfg);
            }
            case MIN -> present.values().stream().mapToDouble(Double::doubleValue).min().orElse(cfg.defaultMissing());
            case MAX -> present.values().stream().mapToDouble(Double::doubleValue).max().orElse(cfg.defaultMissing());
        };
    }

    private static double average(Map<Perspective, Double> present, CompositeConfig cfg) {
        double sum = 0.0;
        for (Perspective p : Perspective.values()) sum += valueOrDefault(present, p, cfg);
        return sum / Perspective.values().length;
    }

    private static double valueOrDefault(Map<Perspective, Double> present, Perspective p, CompositeConfig cfg) {
        Double v = present.get(p);
        return v == null ? cfg.defaultMissing() : v;
    }

    private static double confidence(Map<Perspective, Double> present, CompositeConfig cfg) {
        int count = present.size();
        double confidence = switch (cfg.confidenceMethod()) {
            case COUNT_VALID -> count / 3.0;
            case SPREAD -> {
                double min = present.values().stream().mapToDouble(Double::doubleValue).min().orElse(0.0);
                double max = present.values().stream().mapToDouble(Double::doubleValue).max().orElse(0.0);
                double range = cfg.maxScore() - cfg.minScore();
                double spread = range > 0 ? (max - min) / range : (max - min);
                yield 1.0 - spread;
            }
        };
        if (count < 3 && cfg.hasConfidenceBounds()) {
            confidence = Math.max(cfg.minConfidence(), Math.min(cfg.maxConfidence(), confidence));
        }
        return confidence;
    }
}
