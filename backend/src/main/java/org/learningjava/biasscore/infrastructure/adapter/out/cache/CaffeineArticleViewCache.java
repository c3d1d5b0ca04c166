package org.learningjava.biasscore.infrastructure.adapter.out.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.learningjava.biasscore.application.port.ArticleViewCache;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;

public class CaffeineArticleViewCache implements ArticleViewCache {

    private static final Logger log = LoggerFactory.getLogger(CaffeineArticleViewCache.class);

    private final Cache<String, Object> cache;

    public CaffeineArticleViewCache(Duration ttl, long maximumSize) {
        this(Caffeine.newBuilder()
                .maximumSize(Math.max(1, maximumSize))
                .expireAfterWrite(ttl == null || ttl.isNegative() || ttl.isZero() ? Duration.ofMinutes(10) : ttl)
                .build());
    }

    CaffeineArticleViewCache(Cache<String, Object> cache) {
        this.cache = cache;
    }

    @Override
    public void invalidate(String key) {
        log.debug("View cache invalidate {}", key);
        cache.invalidate(key);
    }
}
