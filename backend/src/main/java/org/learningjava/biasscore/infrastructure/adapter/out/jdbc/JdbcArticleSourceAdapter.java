package org.learningjava.biasscore.infrastructure.adapter.out.jdbc;

import org.learningjava.biasscore.application.port.ArticleSourcePort;
import org.learningjava.biasscore.domain.model.Article;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

public class JdbcArticleSourceAdapter implements ArticleSourcePort {

    private final DataSource dataSource;

    public JdbcArticleSourceAdapter(DataSource dataSource) {
        this.dataSource = dataSource;
    }

    @Override
    public List<Article> findUnscored(int limit) {
        String sql = """
            SELECT a.id, a.content
              FROM articles a
             WHERE NOT EXISTS (SELECT 1 FROM llm_scores s WHERE s.article_id = a.id)
             ORDER BY a.created_at, a.id
             LIMIT ?
            """;
        List<Article> out = new ArrayList<>();
        try (Connection c = dataSource.getConnection();
             PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setInt(1, Math.max(0, limit));
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new Article(rs.getLong("id"), rs.getString("content")));
                }
            }
            return out;
        } catch (SQLException e) {
            throw new IllegalStateException("Failed to query unscored articles", e);
        }
    }
}
