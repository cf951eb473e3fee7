package fr.lapetina.aimux.domain.strategy;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Scores each candidate on speed and spare capacity and picks the best.
 *
 * <pre>
 * score = 0.7 * (100 / avgMs, or 100 without samples)
 *       + 0.3 * max(0, 10 - activeConnections)
 * </pre>
 *
 * Equal scores go to the provider with fewer recorded requests, then to list order.
 */
public final class AdaptiveStrategy implements LoadBalancingStrategy {

    private static final double SPEED_WEIGHT = 0.7;
    private static final double CAPACITY_WEIGHT = 0.3;
    private static final int CONNECTION_HEADROOM = 10;

    @Override
    public String getName() {
        return "adaptive";
    }

    @Override
    public Optional<String> select(List<String> candidates, Map<String, ProviderMetrics> metrics) {
        if (candidates == null || candidates.isEmpty()) {
            return Optional.empty();
        }

        String selected = null;
        double bestScore = Double.NEGATIVE_INFINITY;
        long bestRequests = Long.MAX_VALUE;

        for (String candidate : candidates) {
            ProviderMetrics m = metrics.getOrDefault(candidate, ProviderMetrics.EMPTY);
            double score = score(m);
            if (score > bestScore || (score == bestScore && m.totalRequests() < bestRequests)) {
                bestScore = score;
                bestRequests = m.totalRequests();
                selected = candidate;
            }
        }

        return Optional.ofNullable(selected);
    }

    static double score(ProviderMetrics metrics) {
        double speed = metrics.hasSamples()
                ? 100.0 / Math.max(1.0, metrics.averageResponseTimeMs())
                : 100.0;
        double capacity = Math.max(0, CONNECTION_HEADROOM - metrics.activeConnections());
        return SPEED_WEIGHT * speed + CAPACITY_WEIGHT * capacity;
    }
}
