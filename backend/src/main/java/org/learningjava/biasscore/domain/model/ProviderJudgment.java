package org.learningjava.biasscore.domain.model;

/**
 * Parsed answer of one provider call.
 *
 * @param rawResponse response body, already sanitized of credentials
 */
public record ProviderJudgment(
        double score,
        double confidence,
        String explanation,
        String rawResponse
) { }
