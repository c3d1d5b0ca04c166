package org.learningjava.biasscore.application.port;

/**
 * Cache of rendered article views, keyed like {@code article:42}. The views themselves are
 * produced and read by the API side; scoring only drops the keys whose score changed.
 */
@FunctionalInterface
public interface ArticleViewCache {
    void invalidate(String key);
}
