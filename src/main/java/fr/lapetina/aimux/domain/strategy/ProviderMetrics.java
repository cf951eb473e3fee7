package fr.lapetina.aimux.domain.strategy;

/**
 * Live metrics for one provider as seen by the load balancer.
 * Immutable; the balancer swaps in a new instance on every update.
 *
 * @param averageResponseTimeMs exponentially weighted average response time
 * @param activeConnections     caller-reported open connection count
 * @param totalRequests         number of response-time samples recorded
 * @param totalResponseTimeMs   sum of all samples
 */
public record ProviderMetrics(
        double averageResponseTimeMs,
        int activeConnections,
        long totalRequests,
        double totalResponseTimeMs
) {
    public static final ProviderMetrics EMPTY = new ProviderMetrics(0.0, 0, 0, 0.0);

    public boolean hasSamples() {
        return totalRequests > 0;
    }

    /**
     * Arithmetic mean of all samples, or 0 with no samples.
     */
    public double meanResponseTimeMs() {
        return totalRequests == 0 ? 0.0 : totalResponseTimeMs / totalRequests;
    }

    /**
     * Folds one response-time sample into the moving average.
     * The first sample sets the average directly.
     */
    public ProviderMetrics withSample(double sampleMs, double alpha) {
        double average = hasSamples()
                ? averageResponseTimeMs + alpha * (sampleMs - averageResponseTimeMs)
                : sampleMs;
        return new ProviderMetrics(average, activeConnections, totalRequests + 1, totalResponseTimeMs + sampleMs);
    }

    public ProviderMetrics withConnections(int connections) {
        return new ProviderMetrics(averageResponseTimeMs, connections, totalRequests, totalResponseTimeMs);
    }
}
