package fr.lapetina.aimux.domain.strategy;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Random choice weighted by inverse response time.
 *
 * A provider averaging 100 ms gets weight 10, one averaging 500 ms gets weight 2.
 * Providers without samples get {@link #UNSAMPLED_WEIGHT}.
 */
public final class WeightedResponseStrategy implements LoadBalancingStrategy {

    static final double UNSAMPLED_WEIGHT = 100.0;
    private static final double WEIGHT_SCALE = 1000.0;

    @Override
    public String getName() {
        return "weighted_response";
    }

    @Override
    public Optional<String> select(List<String> candidates, Map<String, ProviderMetrics> metrics) {
        if (candidates == null || candidates.isEmpty()) {
            return Optional.empty();
        }

        double[] weights = new double[candidates.size()];
        double total = 0.0;
        for (int i = 0; i < candidates.size(); i++) {
            weights[i] = weightOf(metrics.getOrDefault(candidates.get(i), ProviderMetrics.EMPTY));
            total += weights[i];
        }

        double point = ThreadLocalRandom.current().nextDouble(total);
        for (int i = 0; i < weights.length; i++) {
            point -= weights[i];
            if (point < 0) {
                return Optional.of(candidates.get(i));
            }
        }
        return Optional.of(candidates.get(candidates.size() - 1));
    }

    static double weightOf(ProviderMetrics metrics) {
        if (!metrics.hasSamples()) {
            return UNSAMPLED_WEIGHT;
        }
        return WEIGHT_SCALE / Math.max(1.0, metrics.averageResponseTimeMs());
    }
}
