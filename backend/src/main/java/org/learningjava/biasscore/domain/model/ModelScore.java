package org.learningjava.biasscore.domain.model;

import java.time.Instant;

/**
 * One judgment stored for an article: either a single provider model's score or the
 * synthetic {@code ensemble} row.
 *
 * @param articleId subject id
 * @param model     provider model name, or {@link #ENSEMBLE_MODEL}
 * @param score     raw score, nominally -1..+1 (may be NaN or out of range when a provider misbehaves)
 * @param metadata  JSON blob with at least a {@code confidence} field
 * @param createdAt when the judgment was produced
 */
public record ModelScore(
        long articleId,
        String model,
        double score,
        String metadata,
        Instant createdAt
) {
    public static final String ENSEMBLE_MODEL = "ensemble";

    public boolean isEnsemble() {
        return model != null && ENSEMBLE_MODEL.equalsIgnoreCase(model.trim());
    }

    public ScoreMetadata parsedMetadata() {
        return ScoreMetadata.parse(metadata);
    }
}
