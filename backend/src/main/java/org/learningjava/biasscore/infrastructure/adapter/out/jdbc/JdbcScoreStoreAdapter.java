package org.learningjava.biasscore.infrastructure.adapter.out.jdbc;

import org.learningjava.biasscore.application.port.ScoreStorePort;
import org.learningjava.biasscore.application.port.StoreTransaction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.time.Instant;

public class JdbcScoreStoreAdapter implements ScoreStorePort {

    private static final Logger log = LoggerFactory.getLogger(JdbcScoreStoreAdapter.class);

    private final DataSource dataSource;

    public JdbcScoreStoreAdapter(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public void ensureSchema() {
        String articles = """
            CREATE TABLE IF NOT EXISTS articles (
                id              BIGSERIAL PRIMARY KEY,
                source          TEXT,
                url             TEXT,
                title           TEXT,
                content         TEXT NOT NULL,
                pub_date        TIMESTAMPTZ,
                created_at      TIMESTAMPTZ NOT NULL DEFAULT now(),
                composite_score DOUBLE PRECISION,
                confidence      DOUBLE PRECISION,
                score_source    TEXT
            )
            """;
        String scores = """
            CREATE TABLE IF NOT EXISTS llm_scores (
                id          BIGSERIAL PRIMARY KEY,
                article_id  BIGINT NOT NULL REFERENCES articles(id) ON DELETE CASCADE,
                model       TEXT NOT NULL,
                score       DOUBLE PRECISION NOT NULL,
                metadata    TEXT,
                version     INTEGER NOT NULL DEFAULT 1,
                created_at  TIMESTAMPTZ NOT NULL DEFAULT now(),
                CONSTRAINT uq_llm_scores_article_model UNIQUE (article_id, model)
            )
            """;
        String index = "CREATE INDEX IF NOT EXISTS idx_llm_scores_article ON llm_scores(article_id)";

        try (Connection c = dataSource.getConnection();
             Statement st = c.createStatement()) {
            st.execute(articles);
            st.execute(scores);
            st.execute(index);
            log.info("Score schema ensured");
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to ensure score schema", e);
        }
    }

    @Override
    public StoreTransaction begin() throws SQLException {
        Connection c = dataSource.getConnection();
        try {
            c.setAutoCommit(false);
        } catch (SQLException e) {
            c.close();
            throw e;
        }
        return new JdbcTransaction(c);
    }

    static final class JdbcTransaction implements StoreTransaction {
        private final Connection conn;
        private boolean finished;

        JdbcTransaction(Connection conn) {
            this.conn = conn;
        }

        @Override
        public int execute(String sql, Object... params) throws SQLException {
            try (PreparedStatement ps = conn.prepareStatement(sql)) {
                for (int i = 0; i < params.length; i++) {
                    Object p = params[i];
                    if (p instanceof Instant instant) {
                        ps.setTimestamp(i + 1, Timestamp.from(instant));
                    } else {
                        ps.setObject(i + 1, p);
                    }
                }
                return ps.executeUpdate();
            }
        }

        @Override
        public void commit() throws SQLException {
            conn.commit();
            finished = true;
        }

        @Override
        public void rollback() throws SQLException {
            finished = true;
            conn.rollback();
        }

        @Override
        public void close() throws SQLException {
            try {
                if (!finished) conn.rollback();
                conn.setAutoCommit(true);
            } finally {
                conn.close();
            }
        }
    }
}
