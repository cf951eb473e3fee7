package fr.lapetina.aimux.domain.strategy;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Strategy-driven provider selection backed by live per-provider metrics.
 *
 * <p>One lock covers the metrics map, the strategy reference and the strategy's own
 * state, so concurrent selections never skip or repeat a round-robin turn and never
 * observe a half-applied metric update.
 */
public final class LoadBalancer {

    private static final Logger log = LoggerFactory.getLogger(LoadBalancer.class);

    public static final double DEFAULT_EWMA_ALPHA = 0.3;

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, ProviderMetrics> metrics = new LinkedHashMap<>();
    private final double alpha;

    private LoadBalancingStrategy strategy;
    private long totalSelections;

    public LoadBalancer(LoadBalancingStrategy strategy, double alpha) {
        if (alpha <= 0.0 || alpha > 1.0) {
            throw new IllegalArgumentException("EWMA alpha must be in (0, 1]: " + alpha);
        }
        this.strategy = Objects.requireNonNull(strategy, "Strategy is required");
        this.alpha = alpha;
    }

    public LoadBalancer(LoadBalancingStrategy strategy) {
        this(strategy, DEFAULT_EWMA_ALPHA);
    }

    /**
     * Picks one provider among the candidates.
     *
     * @return the chosen provider, empty only when {@code candidates} is empty
     */
    public Optional<String> selectProvider(List<String> candidates) {
        if (candidates == null || candidates.isEmpty()) {
            return Optional.empty();
        }

        lock.lock();
        try {
            for (String candidate : candidates) {
                metrics.putIfAbsent(candidate, ProviderMetrics.EMPTY);
            }
            Optional<String> selected = strategy.select(candidates, Collections.unmodifiableMap(metrics));
            if (selected.isPresent()) {
                totalSelections++;
                log.debug("Provider selected: provider={}, strategy={}, candidates={}",
                        selected.get(), strategy.getName(), candidates);
            }
            return selected;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Records a response-time sample for a provider.
     */
    public void updateResponseTime(String provider, long responseTimeMs) {
        lock.lock();
        try {
            ProviderMetrics updated = metrics
                    .getOrDefault(provider, ProviderMetrics.EMPTY)
                    .withSample(responseTimeMs, alpha);
            metrics.put(provider, updated);
            log.debug("Response time recorded: provider={}, sampleMs={}, averageMs={}",
                    provider, responseTimeMs, String.format("%.1f", updated.averageResponseTimeMs()));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Overwrites the open-connection gauge for a provider.
     */
    public void updateConnections(String provider, int connections) {
        lock.lock();
        try {
            metrics.put(provider, metrics
                    .getOrDefault(provider, ProviderMetrics.EMPTY)
                    .withConnections(Math.max(0, connections)));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Applies a delta to the open-connection gauge and returns the new value.
     * Read and write happen under the balancer lock, so concurrent callers never
     * publish counts out of order.
     */
    public int adjustConnections(String provider, int delta) {
        lock.lock();
        try {
            ProviderMetrics current = metrics.getOrDefault(provider, ProviderMetrics.EMPTY);
            int connections = Math.max(0, current.activeConnections() + delta);
            metrics.put(provider, current.withConnections(connections));
            return connections;
        } finally {
            lock.unlock();
        }
    }

    public void setStrategy(LoadBalancingStrategy newStrategy) {
        Objects.requireNonNull(newStrategy, "Strategy is required");
        lock.lock();
        try {
            String previous = strategy.getName();
            strategy = newStrategy;
            log.info("Load balancing strategy changed: previous={}, current={}", previous, newStrategy.getName());
        } finally {
            lock.unlock();
        }
    }

    public LoadBalancingStrategy getStrategy() {
        lock.lock();
        try {
            return strategy;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Metrics for one provider, or {@link ProviderMetrics#EMPTY} when nothing was recorded yet.
     */
    public ProviderMetrics getMetrics(String provider) {
        lock.lock();
        try {
            return metrics.getOrDefault(provider, ProviderMetrics.EMPTY);
        } finally {
            lock.unlock();
        }
    }

    public LoadBalancerStats getStatistics() {
        lock.lock();
        try {
            long rotationIndex = strategy instanceof RoundRobinStrategy
                    ? ((RoundRobinStrategy) strategy).currentIndex()
                    : 0;
            return new LoadBalancerStats(
                    strategy.getName(),
                    totalSelections,
                    rotationIndex,
                    Collections.unmodifiableMap(new LinkedHashMap<>(metrics))
            );
        } finally {
            lock.unlock();
        }
    }

    /**
     * Zeroes every provider's metrics and the strategy's internal state.
     * Provider entries are kept.
     */
    public void resetStatistics() {
        lock.lock();
        try {
            metrics.replaceAll((name, m) -> ProviderMetrics.EMPTY);
            totalSelections = 0;
            strategy.reset();
            log.info("Load balancer statistics reset");
        } finally {
            lock.unlock();
        }
    }

    /**
     * Point-in-time load balancer statistics.
     */
    public record LoadBalancerStats(
            String strategy,
            long totalSelections,
            long roundRobinIndex,
            Map<String, ProviderMetrics> providers
    ) {
    }
}
