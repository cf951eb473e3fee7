package fr.lapetina.aimux.domain.strategy;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Cycles through the candidate list with an index that persists across calls.
 * Repeated calls with the same candidates visit each provider once per rotation.
 */
public final class RoundRobinStrategy implements LoadBalancingStrategy {

    private final AtomicLong counter = new AtomicLong(0);

    @Override
    public String getName() {
        return "round_robin";
    }

    @Override
    public Optional<String> select(List<String> candidates, Map<String, ProviderMetrics> metrics) {
        if (candidates == null || candidates.isEmpty()) {
            return Optional.empty();
        }

        int index = (int) Math.floorMod(counter.getAndIncrement(), (long) candidates.size());
        return Optional.of(candidates.get(index));
    }

    /**
     * Current rotation index, reported in load-balancer statistics.
     */
    public long currentIndex() {
        return counter.get();
    }

    @Override
    public void reset() {
        counter.set(0);
    }
}
