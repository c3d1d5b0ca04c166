package org.learningjava.biasscore.domain.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Composite score configuration, loaded once at start-up and passed to every component
 * that needs it.
 * <p>
 * Confidence bounds only apply when {@code maxConfidence > minConfidence}; leaving both
 * at zero means "unbounded". Score bounds are always applied.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CompositeConfig(
        @JsonProperty("formula") Formula formula,
        @JsonProperty("weights") Map<String, Double> weights,
        @JsonProperty("min_score") double minScore,
        @JsonProperty("max_score") double maxScore,
        @JsonProperty("default_missing") double defaultMissing,
        @JsonProperty("handle_invalid") InvalidHandling handleInvalid,
        @JsonProperty("confidence_method") ConfidenceMethod confidenceMethod,
        @JsonProperty("min_confidence") double minConfidence,
        @JsonProperty("max_confidence") double maxConfidence,
        @JsonProperty("models") List<ModelPerspective> models
) {

    public enum Formula {
        @JsonProperty("average") AVERAGE,
        @JsonProperty("weighted") WEIGHTED,
        @JsonProperty("min") MIN,
        @JsonProperty("max") MAX
    }

    public enum InvalidHandling {
        @JsonProperty("ignore") IGNORE,
        @JsonProperty("default") DEFAULT
    }

    public enum ConfidenceMethod {
        @JsonProperty("count_valid") COUNT_VALID,
        @JsonProperty("spread") SPREAD
    }

    public CompositeConfig {
        formula = formula == null ? Formula.AVERAGE : formula;
        weights = weights == null ? Map.of() : Map.copyOf(weights);
        handleInvalid = handleInvalid == null ? InvalidHandling.DEFAULT : handleInvalid;
        confidenceMethod = confidenceMethod == null ? ConfidenceMethod.COUNT_VALID : confidenceMethod;
        models = models == null ? List.of() : List.copyOf(models);
    }

    /**
     * @throws IllegalStateException when bounds are inconsistent or no model is configured
     */
    public CompositeConfig validate() {
        if (Double.isNaN(minScore) || Double.isNaN(maxScore) || minScore > maxScore) {
            throw new IllegalStateException("Invalid score bounds: min_score=" + minScore + " max_score=" + maxScore);
        }
        if (Double.isNaN(minConfidence) || Double.isNaN(maxConfidence) || minConfidence > maxConfidence) {
            throw new IllegalStateException("Invalid confidence bounds: min_confidence=" + minConfidence
                    + " max_confidence=" + maxConfidence);
        }
        if (models.isEmpty()) {
            throw new IllegalStateException("Composite score config has no models");
        }
        return this;
    }

    public boolean hasConfidenceBounds() {
        return maxConfidence > minConfidence;
    }

    public double weightOf(Perspective p) {
        Double w = weights.get(p.label());
        return w == null ? 1.0 : w;
    }

    public double clampScore(double v) {
        return Math.max(minScore, Math.min(maxScore, v));
    }

    public CompositeConfig withFormula(Formula f) {
        return new CompositeConfig(f, weights, minScore, maxScore, defaultMissing, handleInvalid,
                confidenceMethod, minConfidence, maxConfidence, models);
    }

    public CompositeConfig withHandleInvalid(InvalidHandling h) {
        return new CompositeConfig(formula, weights, minScore, maxScore, defaultMissing, h,
                confidenceMethod, minConfidence, maxConfidence, models);
    }

    public CompositeConfig withConfidenceMethod(ConfidenceMethod m) {
        return new CompositeConfig(formula, weights, minScore, maxScore, defaultMissing, handleInvalid,
                m, minConfidence, maxConfidence, models);
    }

    public CompositeConfig withWeights(Map<String, Double> w) {
        return new CompositeConfig(formula, w, minScore, maxScore, defaultMissing, handleInvalid,
                confidenceMethod, minConfidence, maxConfidence, models);
    }
}
