package org.learningjava.biasscore.application.port;

import org.learningjava.biasscore.domain.model.Article;

import java.util.List;

public interface ArticleSourcePort {
    // Articles that have no LLM score yet, oldest first
    List<Article> findUnscored(int limit);
}
