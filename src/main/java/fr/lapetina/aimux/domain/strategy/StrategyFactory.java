package fr.lapetina.aimux.domain.strategy;

import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

/**
 * Registry of load balancing strategies by configuration name.
 *
 * Names are case-insensitive and accept either underscores or dashes.
 */
public final class StrategyFactory {

    private static final Map<String, Supplier<LoadBalancingStrategy>> REGISTRY = new ConcurrentHashMap<>();

    static {
        register("round_robin", RoundRobinStrategy::new);
        register("least_connections", LeastConnectionsStrategy::new);
        register("fastest_response", FastestResponseStrategy::new);
        register("random", RandomStrategy::new);
        register("weighted_response", WeightedResponseStrategy::new);
        register("adaptive", AdaptiveStrategy::new);
    }

    private StrategyFactory() {
        // Utility class
    }

    /**
     * Registers a custom strategy.
     *
     * @param name Strategy name (used in configuration)
     * @param supplier Factory for creating strategy instances
     */
    public static void register(String name, Supplier<LoadBalancingStrategy> supplier) {
        REGISTRY.put(normalize(name), supplier);
    }

    /**
     * Creates a strategy by name.
     *
     * @param name Strategy name from configuration
     * @return Strategy instance, or empty if not found
     */
    public static Optional<LoadBalancingStrategy> create(String name) {
        if (name == null) {
            return Optional.empty();
        }
        Supplier<LoadBalancingStrategy> supplier = REGISTRY.get(normalize(name));
        if (supplier == null) {
            return Optional.empty();
        }
        return Optional.of(supplier.get());
    }

    /**
     * Creates a strategy by name, with default fallback.
     */
    public static LoadBalancingStrategy createOrDefault(String name, LoadBalancingStrategy defaultStrategy) {
        return create(name).orElse(defaultStrategy);
    }

    public static boolean isRegistered(String name) {
        return name != null && REGISTRY.containsKey(normalize(name));
    }

    /**
     * Returns all registered strategy names, sorted.
     */
    public static Set<String> getRegisteredNames() {
        return new TreeSet<>(REGISTRY.keySet());
    }

    private static String normalize(String name) {
        return name.trim().toLowerCase(Locale.ROOT).replace('-', '_');
    }
}
