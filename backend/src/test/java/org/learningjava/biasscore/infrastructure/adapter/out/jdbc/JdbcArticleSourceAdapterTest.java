package org.learningjava.biasscore.infrastructure.adapter.out.jdbc;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.learningjava.biasscore.application.port.ArticleSourcePort;
import org.learningjava.biasscore.application.port.ScoreStatements;
import org.learningjava.biasscore.application.port.StoreTransaction;
import org.learningjava.biasscore.domain.model.Article;

import java.sql.SQLException;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JdbcArticleSourceAdapterTest extends PostgresTestBase {
    private JdbcScoreStoreAdapter store;
    private ArticleSourcePort source;

    @BeforeEach
    void init() throws SQLException {
        store = new JdbcScoreStoreAdapter(dataSource());
        store.ensureSchema();
        truncate();
        source = new JdbcArticleSourceAdapter(dataSource());
    }

    @Test
    void findUnscored_skipsScoredArticlesOldestFirst() throws SQLException {
        long first = insertArticle("first");
        long scored = insertArticle("scored");
        long third = insertArticle("third");
        try (StoreTransaction tx = store.begin()) {
            tx.execute(ScoreStatements.UPSERT_MODEL_SCORE, scored, "vendor/m", 0.1, "{}",
                    ScoreStatements.SCORE_VERSION, Instant.now());
            tx.commit();
        }

        List<Article> out = source.findUnscored(10);

        assertEquals(List.of(new Article(first, "first"), new Article(third, "third")), out);
    }

    @Test
    void findUnscored_honoursLimit() throws SQLException {
        insertArticle("a");
        insertArticle("b");
        insertArticle("c");

        assertEquals(2, source.findUnscored(2).size());
        assertTrue(source.findUnscored(0).isEmpty());
    }
}
