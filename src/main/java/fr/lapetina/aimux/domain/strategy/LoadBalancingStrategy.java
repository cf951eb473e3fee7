package fr.lapetina.aimux.domain.strategy;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Strategy for choosing one provider among the current candidates.
 *
 * <p>The {@link LoadBalancer} calls {@link #select} while holding its lock, so
 * implementations see a consistent metrics view. Implementations used outside the
 * balancer must still be thread-safe.
 */
public interface LoadBalancingStrategy {

    /**
     * Returns the name of this strategy for configuration and metrics.
     */
    String getName();

    /**
     * Selects a provider from the candidates.
     *
     * @param candidates ordered list of eligible provider names
     * @param metrics    live metrics keyed by provider name; absent means no data yet
     * @return selected provider, or empty only when {@code candidates} is empty
     */
    Optional<String> select(List<String> candidates, Map<String, ProviderMetrics> metrics);

    /**
     * Resets any internal state such as rotation counters.
     */
    default void reset() {
        // Default no-op
    }
}
