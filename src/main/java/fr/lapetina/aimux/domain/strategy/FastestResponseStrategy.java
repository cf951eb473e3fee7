package fr.lapetina.aimux.domain.strategy;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Selects the provider with the lowest moving-average response time.
 *
 * A provider without samples counts as the fastest possible, so new providers
 * get sampled before the balancer settles on a favourite.
 */
public final class FastestResponseStrategy implements LoadBalancingStrategy {

    @Override
    public String getName() {
        return "fastest_response";
    }

    @Override
    public Optional<String> select(List<String> candidates, Map<String, ProviderMetrics> metrics) {
        if (candidates == null || candidates.isEmpty()) {
            return Optional.empty();
        }

        String selected = null;
        double bestTime = Double.MAX_VALUE;

        for (String candidate : candidates) {
            ProviderMetrics m = metrics.getOrDefault(candidate, ProviderMetrics.EMPTY);
            double time = m.hasSamples() ? m.averageResponseTimeMs() : 0.0;
            if (time < bestTime) {
                bestTime = time;
                selected = candidate;
            }
        }

        return Optional.ofNullable(selected);
    }
}
