package fr.lapetina.aimux.infrastructure.metrics;

import fr.lapetina.aimux.cache.CacheStats;
import fr.lapetina.aimux.domain.model.ErrorType;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.binder.jvm.JvmGcMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmMemoryMetrics;
import io.micrometer.core.instrument.binder.jvm.JvmThreadMetrics;
import io.micrometer.core.instrument.binder.system.ProcessorMetrics;
import io.micrometer.prometheus.PrometheusConfig;
import io.micrometer.prometheus.PrometheusMeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Micrometer registry with Prometheus exposition.
 *
 * Provides:
 * - request counters per model, provider and outcome
 * - request latency timers per model and provider
 * - error counters by type, and provider attempt failures
 * - cache and provider availability gauges
 * - JVM and system metrics
 */
public final class MetricsRegistry implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MetricsRegistry.class);

    private final PrometheusMeterRegistry registry;
    private final String prefix;

    private final ConcurrentHashMap<String, Timer> latencyTimers = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> requestCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> errorCounters = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, Counter> attemptFailureCounters = new ConcurrentHashMap<>();
    private final Counter retryCounter;
    private final Counter droppedEventsCounter;

    private final AtomicLong ringBufferRemaining = new AtomicLong(0);

    public MetricsRegistry(String prefix) {
        this.prefix = prefix;
        this.registry = new PrometheusMeterRegistry(PrometheusConfig.DEFAULT);

        new JvmMemoryMetrics().bindTo(registry);
        new JvmGcMetrics().bindTo(registry);
        new JvmThreadMetrics().bindTo(registry);
        new ProcessorMetrics().bindTo(registry);

        this.retryCounter = Counter.builder(prefix + "_retries_total")
                .description("Provider attempts beyond the first one")
                .register(registry);

        this.droppedEventsCounter = Counter.builder(prefix + "_metrics_events_dropped_total")
                .description("Metrics events dropped because the ring buffer was full")
                .register(registry);

        Gauge.builder(prefix + "_ringbuffer_remaining", ringBufferRemaining, AtomicLong::get)
                .description("Remaining capacity in the metrics ring buffer")
                .register(registry);

        log.info("MetricsRegistry initialized with prefix: {}", prefix);
    }

    public MetricsRegistry() {
        this("aimux");
    }

    /**
     * Counts one finished request. Outcome is {@code success}, {@code cache_hit} or {@code error}.
     */
    public void incrementRequestCount(String model, String provider, String outcome) {
        String key = model + ":" + provider + ":" + outcome;
        requestCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_requests_total")
                        .description("Total number of requests")
                        .tag("model", model)
                        .tag("provider", provider)
                        .tag("outcome", outcome)
                        .register(registry)
        ).increment();
    }

    public void recordLatency(String model, String provider, Duration latency) {
        String key = model + ":" + provider;
        latencyTimers.computeIfAbsent(key, k ->
                Timer.builder(prefix + "_request_latency")
                        .description("Request latency")
                        .tag("model", model)
                        .tag("provider", provider)
                        .publishPercentileHistogram()
                        .publishPercentiles(0.5, 0.9, 0.95, 0.99)
                        .register(registry)
        ).record(latency);
    }

    public void incrementErrorCount(String model, String provider, ErrorType errorType) {
        String key = model + ":" + provider + ":" + errorType.name();
        errorCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_errors_total")
                        .description("Total number of errors")
                        .tag("model", model)
                        .tag("provider", provider)
                        .tag("type", errorType.name())
                        .register(registry)
        ).increment();
    }

    /**
     * Counts a failed provider attempt that triggered failover.
     */
    public void incrementAttemptFailure(String provider, ErrorType errorType) {
        String key = provider + ":" + errorType.name();
        attemptFailureCounters.computeIfAbsent(key, k ->
                Counter.builder(prefix + "_provider_failures_total")
                        .description("Failed provider attempts")
                        .tag("provider", provider)
                        .tag("type", errorType.name())
                        .register(registry)
        ).increment();
    }

    public void incrementRetries(int retries) {
        if (retries > 0) {
            retryCounter.increment(retries);
        }
    }

    public void incrementDroppedEvents() {
        droppedEventsCounter.increment();
    }

    public double getDroppedEvents() {
        return droppedEventsCounter.count();
    }

    public void setRingBufferRemaining(long value) {
        ringBufferRemaining.set(value);
    }

    /**
     * Registers gauges reading the response cache statistics on every scrape.
     */
    public void registerCacheGauges(Supplier<CacheStats> stats) {
        Gauge.builder(prefix + "_cache_entries", stats, s -> s.get().entries())
                .description("Entries held by the response cache")
                .register(registry);
        Gauge.builder(prefix + "_cache_memory_bytes", stats, s -> s.get().memoryUsageBytes())
                .description("Estimated memory used by the response cache")
                .register(registry);
        Gauge.builder(prefix + "_cache_hits", stats, s -> s.get().hits())
                .description("Cache hits since the last statistics reset")
                .register(registry);
        Gauge.builder(prefix + "_cache_misses", stats, s -> s.get().misses())
                .description("Cache misses since the last statistics reset")
                .register(registry);
        Gauge.builder(prefix + "_cache_hit_rate", stats, s -> s.get().hitRate())
                .description("Cache hit rate")
                .register(registry);
    }

    /**
     * Registers a gauge for provider availability (0=in cooldown, 1=available).
     */
    public void registerProviderAvailability(String provider, Supplier<Number> available) {
        Gauge.builder(prefix + "_provider_available", available, s -> s.get().doubleValue())
                .description("Provider availability (0=cooling down, 1=available)")
                .tag("provider", provider)
                .register(registry);
    }

    public void registerProviderInFlight(String provider, Supplier<Number> inFlight) {
        Gauge.builder(prefix + "_provider_inflight", inFlight, s -> s.get().doubleValue())
                .description("In-flight requests per provider")
                .tag("provider", provider)
                .register(registry);
    }

    public String scrape() {
        return registry.scrape();
    }

    public MeterRegistry getRegistry() {
        return registry;
    }

    @Override
    public void close() {
        registry.close();
    }
}
