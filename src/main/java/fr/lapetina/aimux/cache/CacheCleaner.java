package fr.lapetina.aimux.cache;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Background task that periodically reclaims expired cache entries.
 */
public final class CacheCleaner implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(CacheCleaner.class);

    private final ResponseCache cache;
    private final Duration interval;
    private final ScheduledExecutorService scheduler;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public CacheCleaner(ResponseCache cache, Duration interval) {
        this.cache = cache;
        this.interval = interval;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "cache-cleaner");
            t.setDaemon(true);
            return t;
        });
    }

    public void start() {
        if (running.compareAndSet(false, true)) {
            scheduler.scheduleWithFixedDelay(
                    this::runCleanup,
                    interval.toMillis(),
                    interval.toMillis(),
                    TimeUnit.MILLISECONDS
            );
            log.info("Cache cleaner started with interval: {}", interval);
        }
    }

    /**
     * Runs one cleanup pass. Failures are logged and never propagate to the scheduler.
     */
    int runCleanup() {
        try {
            int removed = cache.cleanup();
            if (removed > 0) {
                log.info("Cache cleanup removed entries: removed={}, remaining={}", removed, cache.size());
            }
            return removed;
        } catch (Exception e) {
            log.error("Cache cleanup failed", e);
            return 0;
        }
    }

    @Override
    public void close() {
        if (running.compareAndSet(true, false)) {
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    scheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                scheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
            log.info("Cache cleaner stopped");
        } else {
            scheduler.shutdownNow();
        }
    }
}
