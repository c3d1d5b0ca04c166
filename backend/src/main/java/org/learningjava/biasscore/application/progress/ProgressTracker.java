package org.learningjava.biasscore.application.progress;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.learningjava.biasscore.domain.error.ProviderException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Per-article progress of scoring runs, readable while a run is writing it.
 * <p>
 * Stale entries are removed by {@link #sweep()}: terminal entries after 5 minutes,
 * in-progress entries after 30 minutes. The periodic sweep only runs between
 * {@link #start()} and {@link #stop()}.
 */
public class ProgressTracker {

    private static final Logger log = LoggerFactory.getLogger(ProgressTracker.class);

    static final long TERMINAL_TTL_SECONDS = 300;
    static final long IN_PROGRESS_TTL_SECONDS = 1800;

    private final Map<Long, ProgressState> entries = new HashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();
    private final ObjectMapper om = new ObjectMapper();

    private final Clock clock;
    private final Duration cleanupInterval;
    private final boolean cleanupEnabled;

    private ThreadPoolTaskScheduler scheduler;
    private ScheduledFuture<?> sweepTask;

    public ProgressTracker(Clock clock, Duration cleanupInterval, boolean cleanupEnabled) {
        this.clock = clock == null ? Clock.systemUTC() : clock;
        this.cleanupInterval = cleanupInterval == null ? Duration.ofMinutes(1) : cleanupInterval;
        this.cleanupEnabled = cleanupEnabled;
    }

    public ProgressTracker(Clock clock) {
        this(clock, Duration.ofMinutes(1), false);
    }

    public synchronized void start() {
        if (!cleanupEnabled) {
            log.info("Progress cleanup disabled (scoring.progress.cleanup-enabled=false)");
            return;
        }
        if (sweepTask != null) return;
        scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("progress-sweep-");
        scheduler.initialize();
        sweepTask = scheduler.scheduleAtFixedRate(this::sweep, cleanupInterval);
        log.info("Progress cleanup started, interval={}", cleanupInterval);
    }

    public synchronized void stop() {
        if (sweepTask != null) {
            sweepTask.cancel(false);
            sweepTask = null;
        }
        if (scheduler != null) {
            scheduler.shutdown();
            scheduler = null;
            log.info("Progress cleanup stopped");
        }
    }

    public synchronized boolean isRunning() {
        return sweepTask != null;
    }

    public void setProgress(long articleId, ProgressState state) {
        lock.writeLock().lock();
        try {
            entries.put(articleId, state.touchedAt(now()));
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Moves an article to a new step. A non-null {@code error} is recorded with its message;
     * provider errors also get JSON details ({@code type}, {@code status_code}, {@code message},
     * and {@code retry_after} when positive). A null error clears both fields.
     */
    public void updateProgress(long articleId, String step, int percent, ProgressStatus status, Throwable error) {
        String errorText = error == null ? "" : String.valueOf(error.getMessage());
        String details = error == null ? "" : errorDetails(error);
        long ts = now();

        lock.writeLock().lock();
        try {
            entries.compute(articleId, (k, cur) -> new ProgressState(
                    step,
                    cur != null ? cur.message() : "",
                    percent,
                    status,
                    errorText,
                    details,
                    cur != null ? cur.finalScore() : null,
                    ts));
        } finally {
            lock.writeLock().unlock();
        }
    }

    public ProgressState getProgress(long articleId) {
        lock.readLock().lock();
        try {
            return entries.get(articleId);
        } finally {
            lock.readLock().unlock();
        }
    }

    /** @return number of entries removed */
    public int sweep() {
        long now = now();
        int removed = 0;
        lock.writeLock().lock();
        try {
            var it = entries.entrySet().iterator();
            while (it.hasNext()) {
                ProgressState s = it.next().getValue();
                long age = now - s.lastUpdated();
                boolean stale = s.status().isTerminal()
                        ? age > TERMINAL_TTL_SECONDS
                        : age > IN_PROGRESS_TTL_SECONDS;
                if (stale) {
                    it.remove();
                    removed++;
                }
            }
        } finally {
            lock.writeLock().unlock();
        }
        if (removed > 0) log.debug("Progress sweep removed {} stale entries", removed);
        return removed;
    }

    public int size() {
        lock.readLock().lock();
        try {
            return entries.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * JSON details for the first {@link ProviderException} in the cause chain of
     * {@code error}, or {@code ""} when there is none.
     */
    public String errorDetails(Throwable error) {
        Throwable cur = error;
        while (cur != null && !(cur instanceof ProviderException)) {
            if (cur.getCause() == cur) break;
            cur = cur.getCause();
        }
        if (!(cur instanceof ProviderException pe)) return "";

        ObjectNode n = om.createObjectNode();
        n.put("type", pe.category().code());
        n.put("status_code", pe.statusCode());
        n.put("message", pe.getMessage());
        if (pe.retryAfter().getSeconds() > 0) n.put("retry_after", pe.retryAfter().getSeconds());
        try {
            return om.writeValueAsString(n);
        } catch (JsonProcessingException e) {
            log.warn("Could not serialize provider error details: {}", e.getMessage());
            return "";
        }
    }

    // ---- helpers ----

    private long now() {
        return clock.instant().getEpochSecond();
    }
}
