package fr.lapetina.aimux.infrastructure.health;

import fr.lapetina.aimux.domain.provider.Provider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Background health checker for providers.
 *
 * Periodically probes each enabled provider and feeds the result into the
 * {@link FailoverManager}:
 * - an unhealthy provider that is currently selectable is marked failed with a backoff cooldown
 * - a healthy provider whose cooldown has elapsed is marked healthy
 * - a provider still cooling down is left alone
 *
 * Probe failures are logged and never affect request dispatch.
 */
public final class ProviderHealthChecker implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(ProviderHealthChecker.class);

    private final ProviderRegistry registry;
    private final FailoverManager failoverManager;
    private final BackoffPolicy backoffPolicy;
    private final Duration checkInterval;
    private final Duration checkTimeout;
    private final ScheduledExecutorService scheduler;
    private final AtomicBoolean running = new AtomicBoolean(false);

    public ProviderHealthChecker(
            ProviderRegistry registry,
            FailoverManager failoverManager,
            BackoffPolicy backoffPolicy,
            Duration checkInterval,
            Duration checkTimeout
    ) {
        this.registry = registry;
        this.failoverManager = failoverManager;
        this.backoffPolicy = backoffPolicy;
        this.checkInterval = checkInterval;
        this.checkTimeout = checkTimeout;
        this.scheduler = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "health-checker");
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Starts the periodic health checking.
     */
    public void start() {
        if (running.compareAndSet(false, true)) {
            scheduler.scheduleWithFixedDelay(
                    this::checkAllProviders,
                    checkInterval.toMillis(),
                    checkInterval.toMillis(),
                    TimeUnit.MILLISECONDS
            );
            log.info("Health checker started with interval: {}", checkInterval);
        }
    }

    /**
     * Probes every enabled provider once.
     */
    public void checkAllProviders() {
        List<Provider> providers = registry.getEnabledProviders();
        log.debug("Starting health check cycle: providerCount={}", providers.size());

        for (Provider provider : providers) {
            checkProvider(provider);
        }
    }

    /**
     * Probes one provider and applies the result.
     *
     * @return completes with the probe result once failover state has been updated
     */
    public CompletableFuture<Boolean> checkProvider(Provider provider) {
        String name = provider.getName();
        try {
            return provider.healthCheck()
                    .orTimeout(checkTimeout.toMillis(), TimeUnit.MILLISECONDS)
                    .handle((healthy, ex) -> {
                        if (ex != null) {
                            log.warn("Health check error: provider={}, error={}", name, ex.getMessage());
                            applyResult(name, false);
                            return false;
                        }
                        applyResult(name, Boolean.TRUE.equals(healthy));
                        return Boolean.TRUE.equals(healthy);
                    });
        } catch (Exception e) {
            log.warn("Health check could not start: provider={}, error={}", name, e.getMessage());
            applyResult(name, false);
            return CompletableFuture.completedFuture(false);
        }
    }

    private void applyResult(String provider, boolean healthy) {
        boolean available = failoverManager.isAvailable(provider);
        if (healthy) {
            if (failoverManager.isFailed(provider) && available) {
                log.info("Health check passed after cooldown: provider={}", provider);
                failoverManager.markHealthy(provider);
            } else {
                log.debug("Health check passed: provider={}", provider);
            }
        } else if (available) {
            Duration cooldown = backoffPolicy.cooldownFor(failoverManager.getConsecutiveFailures(provider) + 1);
            log.warn("Health check failed: provider={}, cooldownMs={}", provider, cooldown.toMillis());
            failoverManager.markFailed(provider, cooldown);
        } else {
            log.debug("Health check failed during cooldown: provider={}", provider);
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
            log.info("Health checker stopped");
        } else {
            scheduler.shutdownNow();
        }
    }
}
