package fr.lapetina.aimux.domain.strategy;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Uniform random choice among candidates.
 *
 * Thread-safe via ThreadLocalRandom.
 */
public final class RandomStrategy implements LoadBalancingStrategy {

    @Override
    public String getName() {
        return "random";
    }

    @Override
    public Optional<String> select(List<String> candidates, Map<String, ProviderMetrics> metrics) {
        if (candidates == null || candidates.isEmpty()) {
            return Optional.empty();
        }

        int index = ThreadLocalRandom.current().nextInt(candidates.size());
        return Optional.of(candidates.get(index));
    }
}
