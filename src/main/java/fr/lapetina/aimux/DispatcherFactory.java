package fr.lapetina.aimux;

import fr.lapetina.aimux.cache.CacheCleaner;
import fr.lapetina.aimux.cache.CacheWarmer;
import fr.lapetina.aimux.cache.ResponseCache;
import fr.lapetina.aimux.dispatch.Dispatcher;
import fr.lapetina.aimux.dispatch.RequestValidator;
import fr.lapetina.aimux.disruptor.MetricsEventPipeline;
import fr.lapetina.aimux.domain.model.ProviderDescriptor;
import fr.lapetina.aimux.domain.model.RequestType;
import fr.lapetina.aimux.domain.provider.PayloadAdapter;
import fr.lapetina.aimux.domain.provider.Provider;
import fr.lapetina.aimux.domain.strategy.LoadBalancer;
import fr.lapetina.aimux.domain.strategy.LoadBalancingStrategy;
import fr.lapetina.aimux.domain.strategy.RoundRobinStrategy;
import fr.lapetina.aimux.domain.strategy.StrategyFactory;
import fr.lapetina.aimux.infrastructure.config.AimuxConfig;
import fr.lapetina.aimux.infrastructure.config.ConfigLoader;
import fr.lapetina.aimux.infrastructure.health.BackoffPolicy;
import fr.lapetina.aimux.infrastructure.health.FailoverManager;
import fr.lapetina.aimux.infrastructure.health.ProviderHealthChecker;
import fr.lapetina.aimux.infrastructure.health.ProviderRegistry;
import fr.lapetina.aimux.infrastructure.http.HttpProvider;
import fr.lapetina.aimux.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.http.HttpClient;
import java.time.Duration;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.function.Function;

/**
 * Builds a fully wired dispatcher from configuration.
 *
 * <p>Usage:
 * <pre>{@code
 * try (DispatcherFactory factory = DispatcherFactory.create("config.yaml").start()) {
 *     CompletionResponse response = factory.getDispatcher().dispatch(request);
 * }
 * }</pre>
 */
public class DispatcherFactory implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(DispatcherFactory.class);

    private final AimuxConfig config;
    private final ProviderRegistry providerRegistry;
    private final FailoverManager failoverManager;
    private final BackoffPolicy backoffPolicy;
    private final LoadBalancer loadBalancer;
    private final ResponseCache cache;
    private final MetricsRegistry metricsRegistry;
    private final MetricsEventPipeline metricsPipeline;
    private final Dispatcher dispatcher;
    private final CacheWarmer cacheWarmer;
    private final CacheCleaner cacheCleaner;
    private final ProviderHealthChecker healthChecker;

    /**
     * @param providerFactoryOverride builds providers from their descriptors; null creates
     *                                HTTP providers
     */
    protected DispatcherFactory(String configPath, Function<ProviderDescriptor, Provider> providerFactoryOverride) {
        log.info("Initializing DispatcherFactory from config: {}", configPath);

        this.config = new ConfigLoader(configPath).load();

        this.metricsRegistry = new MetricsRegistry(config.getMetrics().getPrefix());

        Function<ProviderDescriptor, Provider> providerFactory = providerFactoryOverride != null
                ? providerFactoryOverride
                : httpProviderFactory();
        this.providerRegistry = new ProviderRegistry();
        for (AimuxConfig.ProviderConfig providerConfig : config.getProviders()) {
            providerRegistry.register(providerFactory.apply(toDescriptor(providerConfig)));
        }

        this.failoverManager = new FailoverManager(providerRegistry.getEnabledNames());
        this.backoffPolicy = BackoffPolicy.fromConfig(config.getFailover());

        LoadBalancingStrategy strategy = StrategyFactory.createOrDefault(
                config.getStrategy().getType(),
                new RoundRobinStrategy()
        );
        this.loadBalancer = new LoadBalancer(strategy, config.getStrategy().getEwmaAlpha());
        log.info("Using load balancing strategy: {}", strategy.getName());

        this.cache = ResponseCache.builder().fromConfig(config.getCache()).build();

        this.metricsPipeline = MetricsEventPipeline.builder()
                .fromConfig(config.getMetrics())
                .metricsRegistry(metricsRegistry)
                .build();

        this.dispatcher = Dispatcher.builder()
                .registry(providerRegistry)
                .failoverManager(failoverManager)
                .loadBalancer(loadBalancer)
                .cache(cache)
                .cacheEnabled(config.getCache().isEnabled())
                .backoffPolicy(backoffPolicy)
                .validator(RequestValidator.fromConfig(config.getValidation()))
                .metricsPipeline(metricsPipeline)
                .requestTimeout(Duration.ofMillis(config.getTimeouts().getRequestTimeoutMs()))
                .build();

        List<ProviderDescriptor> descriptors = providerRegistry.getAllProviders().stream()
                .map(Provider::descriptor)
                .toList();
        this.cacheWarmer = new CacheWarmer(cache, dispatcher::dispatch, descriptors, config.getWarmup());
        this.cacheCleaner = new CacheCleaner(cache, Duration.ofMillis(config.getCache().getCleanupIntervalMs()));
        this.healthChecker = new ProviderHealthChecker(
                providerRegistry,
                failoverManager,
                backoffPolicy,
                Duration.ofMillis(config.getHealthCheck().getIntervalMs()),
                Duration.ofMillis(config.getTimeouts().getHealthCheckTimeoutMs())
        );

        registerMetrics();

        log.info("DispatcherFactory initialized with {} providers", providerRegistry.size());
    }

    /**
     * Creates a factory from the specified configuration file.
     */
    public static DispatcherFactory create(String configPath) {
        return new DispatcherFactory(configPath, null);
    }

    /**
     * Creates a factory from the default configuration (config.yaml).
     */
    public static DispatcherFactory create() {
        return create("config.yaml");
    }

    /**
     * Starts the metrics pipeline and the background tasks enabled in configuration, then
     * warms the cache if requested.
     */
    public DispatcherFactory start() {
        metricsPipeline.start();
        if (config.getCache().isEnabled()) {
            cacheCleaner.start();
        }
        if (config.getHealthCheck().isEnabled()) {
            healthChecker.start();
        }
        if (config.getCache().isEnabled() && config.getWarmup().isOnStartup()) {
            cacheWarmer.warm();
        }
        log.info("Dispatcher started");
        return this;
    }

    public AimuxConfig getConfig() {
        return config;
    }

    public Dispatcher getDispatcher() {
        return dispatcher;
    }

    public ProviderRegistry getProviderRegistry() {
        return providerRegistry;
    }

    public FailoverManager getFailoverManager() {
        return failoverManager;
    }

    public BackoffPolicy getBackoffPolicy() {
        return backoffPolicy;
    }

    public LoadBalancer getLoadBalancer() {
        return loadBalancer;
    }

    public ResponseCache getCache() {
        return cache;
    }

    public CacheWarmer getCacheWarmer() {
        return cacheWarmer;
    }

    public MetricsRegistry getMetricsRegistry() {
        return metricsRegistry;
    }

    public MetricsEventPipeline getMetricsPipeline() {
        return metricsPipeline;
    }

    private Function<ProviderDescriptor, Provider> httpProviderFactory() {
        HttpClient httpClient = HttpProvider.newHttpClient(
                Duration.ofMillis(config.getTimeouts().getConnectTimeoutMs()));
        Duration healthTimeout = Duration.ofMillis(config.getTimeouts().getHealthCheckTimeoutMs());
        return descriptor -> new HttpProvider(descriptor, httpClient, PayloadAdapter.identity(), healthTimeout);
    }

    static ProviderDescriptor toDescriptor(AimuxConfig.ProviderConfig providerConfig) {
        Set<RequestType> capabilities = EnumSet.noneOf(RequestType.class);
        if (providerConfig.getCapabilities() != null) {
            for (String capability : providerConfig.getCapabilities()) {
                capabilities.add(RequestType.valueOf(capability.trim().toUpperCase(Locale.ROOT)));
            }
        }
        return ProviderDescriptor.builder()
                .name(providerConfig.getName())
                .endpoint(providerConfig.getEndpoint())
                .completionPath(providerConfig.getCompletionPath())
                .healthPath(providerConfig.getHealthPath())
                .apiKey(providerConfig.getApiKey())
                .models(providerConfig.getModels())
                .capabilities(capabilities)
                .headers(providerConfig.getHeaders())
                .timeout(providerConfig.getTimeoutMs() > 0 ? Duration.ofMillis(providerConfig.getTimeoutMs()) : null)
                .enabled(providerConfig.isEnabled())
                .build();
    }

    private void registerMetrics() {
        metricsRegistry.registerCacheGauges(cache::getStats);
        for (String name : failoverManager.getProviders()) {
            metricsRegistry.registerProviderAvailability(name, () -> failoverManager.isAvailable(name) ? 1 : 0);
            metricsRegistry.registerProviderInFlight(name, () -> dispatcher.getInFlight(name));
        }
    }

    @Override
    public void close() {
        log.info("Shutting down DispatcherFactory...");

        try {
            healthChecker.close();
        } catch (Exception e) {
            log.warn("Error closing health checker", e);
        }

        try {
            cacheCleaner.close();
        } catch (Exception e) {
            log.warn("Error closing cache cleaner", e);
        }

        try {
            metricsPipeline.close();
        } catch (Exception e) {
            log.warn("Error closing metrics pipeline", e);
        }

        try {
            metricsRegistry.close();
        } catch (Exception e) {
            log.warn("Error closing metrics registry", e);
        }

        log.info("DispatcherFactory shut down");
    }
}
