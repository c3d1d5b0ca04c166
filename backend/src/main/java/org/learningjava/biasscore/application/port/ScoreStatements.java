package org.learningjava.biasscore.application.port;

/** SQL understood by every {@link ScoreStorePort}. Parameters are positional. */
public final class ScoreStatements {

    private ScoreStatements() { }

    /** (article_id, model, score, metadata, version, created_at) */
    public static final String UPSERT_MODEL_SCORE = """
            INSERT INTO llm_scores (article_id, model, score, metadata, version, created_at)
            VALUES (?, ?, ?, ?, ?, ?)
            ON CONFLICT (article_id, model) DO UPDATE
               SET score = EXCLUDED.score,
                   metadata = EXCLUDED.metadata,
                   version = EXCLUDED.version,
                   created_at = EXCLUDED.created_at
            """;

    /** (composite_score, confidence, id) */
    public static final String UPDATE_ARTICLE_SCORE = """
            UPDATE articles
               SET composite_score = ?, confidence = ?, score_source = 'llm'
             WHERE id = ?
            """;

    public static final int SCORE_VERSION = 1;
}
