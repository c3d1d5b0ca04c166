package org.learningjava.biasscore.application.cache;

import org.learningjava.biasscore.domain.model.ModelScore;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HashMap;
import java.util.HexFormat;
import java.util.Map;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Process-lifetime memo of provider output, keyed by (content hash, model).
 * Entries never expire; {@link #remove(String)} drops everything cached for one content.
 */
public class ResponseCache {

    private final Map<String, Map<String, ModelScore>> byHash = new HashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    public ModelScore get(String contentHash, String model) {
        lock.readLock().lock();
        try {
            Map<String, ModelScore> models = byHash.get(contentHash);
            return models == null ? null : models.get(model);
        } finally {
            lock.readLock().unlock();
        }
    }

    public void set(String contentHash, String model, ModelScore score) {
        lock.writeLock().lock();
        try {
            byHash.computeIfAbsent(contentHash, k -> new HashMap<>()).put(model, score);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void delete(String contentHash, String model) {
        lock.writeLock().lock();
        try {
            Map<String, ModelScore> models = byHash.get(contentHash);
            if (models == null) return;
            models.remove(model);
            if (models.isEmpty()) byHash.remove(contentHash);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public void remove(String contentHash) {
        lock.writeLock().lock();
        try {
            byHash.remove(contentHash);
        } finally {
            lock.writeLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return byHash.values().stream().mapToInt(Map::size).sum();
        } finally {
            lock.readLock().unlock();
        }
    }

    /** SHA-256 of the UTF-8 content, lower-case hex. */
    public static String contentHash(String content) {
        try {
            MessageDigest md = MessageDigest.getInstance("SHA-256");
            byte[] digest = md.digest((content == null ? "" : content).getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(digest);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
