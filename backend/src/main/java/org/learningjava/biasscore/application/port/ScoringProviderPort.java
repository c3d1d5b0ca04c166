package org.learningjava.biasscore.application.port;

import org.learningjava.biasscore.domain.model.ProviderJudgment;

public interface ScoringProviderPort {
    String provider();

    /**
     * Sends one prompt to one model and parses the judgment.
     *
     * @throws org.learningjava.biasscore.domain.error.ScoringException with kind
     *         {@code BOTH_LLM_KEYS_RATE_LIMITED} or {@code PROVIDER} once retries are spent
     */
    ProviderJudgment score(String model, String prompt);
}
