package fr.lapetina.aimux.domain.strategy;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Selects the provider with the fewest open connections.
 * Ties go to the earliest candidate in list order.
 */
public final class LeastConnectionsStrategy implements LoadBalancingStrategy {

    @Override
    public String getName() {
        return "least_connections";
    }

    @Override
    public Optional<String> select(List<String> candidates, Map<String, ProviderMetrics> metrics) {
        if (candidates == null || candidates.isEmpty()) {
            return Optional.empty();
        }

        String selected = null;
        int minConnections = Integer.MAX_VALUE;

        for (String candidate : candidates) {
            int connections = metrics.getOrDefault(candidate, ProviderMetrics.EMPTY).activeConnections();
            if (connections < minConnections) {
                minConnections = connections;
                selected = candidate;
            }
        }

        return Optional.ofNullable(selected);
    }
}
