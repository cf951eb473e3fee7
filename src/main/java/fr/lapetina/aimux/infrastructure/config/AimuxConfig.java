package fr.lapetina.aimux.infrastructure.config;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Root configuration object for the dispatcher.
 * Designed to be populated from YAML.
 */
public class AimuxConfig {

    private ServerConfig server = new ServerConfig();
    private List<ProviderConfig> providers = new ArrayList<>();
    private StrategyConfig strategy = new StrategyConfig();
    private CacheConfig cache = new CacheConfig();
    private FailoverConfig failover = new FailoverConfig();
    private TimeoutsConfig timeouts = new TimeoutsConfig();
    private HealthCheckConfig healthCheck = new HealthCheckConfig();
    private ValidationConfig validation = new ValidationConfig();
    private MetricsConfig metrics = new MetricsConfig();
    private WarmupConfig warmup = new WarmupConfig();

    // Getters and Setters
    public ServerConfig getServer() { return server; }
    public void setServer(ServerConfig server) { this.server = server; }

    public List<ProviderConfig> getProviders() { return providers; }
    public void setProviders(List<ProviderConfig> providers) { this.providers = providers; }

    public StrategyConfig getStrategy() { return strategy; }
    public void setStrategy(StrategyConfig strategy) { this.strategy = strategy; }

    public CacheConfig getCache() { return cache; }
    public void setCache(CacheConfig cache) { this.cache = cache; }

    public FailoverConfig getFailover() { return failover; }
    public void setFailover(FailoverConfig failover) { this.failover = failover; }

    public TimeoutsConfig getTimeouts() { return timeouts; }
    public void setTimeouts(TimeoutsConfig timeouts) { this.timeouts = timeouts; }

    public HealthCheckConfig getHealthCheck() { return healthCheck; }
    public void setHealthCheck(HealthCheckConfig healthCheck) { this.healthCheck = healthCheck; }

    public ValidationConfig getValidation() { return validation; }
    public void setValidation(ValidationConfig validation) { this.validation = validation; }

    public MetricsConfig getMetrics() { return metrics; }
    public void setMetrics(MetricsConfig metrics) { this.metrics = metrics; }

    public WarmupConfig getWarmup() { return warmup; }
    public void setWarmup(WarmupConfig warmup) { this.warmup = warmup; }

    /**
     * HTTP server configuration.
     */
    public static class ServerConfig {
        private int port = 8080;
        private String host = "0.0.0.0";
        private int backlog = 100;
        private int workerThreads = 32;
        private long maxRequestBytes = 10L * 1024 * 1024;
        private String corsAllowedOrigin = "*";

        public int getPort() { return port; }
        public void setPort(int port) { this.port = port; }

        public String getHost() { return host; }
        public void setHost(String host) { this.host = host; }

        public int getBacklog() { return backlog; }
        public void setBacklog(int backlog) { this.backlog = backlog; }

        public int getWorkerThreads() { return workerThreads; }
        public void setWorkerThreads(int workerThreads) { this.workerThreads = workerThreads; }

        public long getMaxRequestBytes() { return maxRequestBytes; }
        public void setMaxRequestBytes(long maxRequestBytes) { this.maxRequestBytes = maxRequestBytes; }

        public String getCorsAllowedOrigin() { return corsAllowedOrigin; }
        public void setCorsAllowedOrigin(String corsAllowedOrigin) { this.corsAllowedOrigin = corsAllowedOrigin; }
    }

    /**
     * Individual upstream provider configuration.
     */
    public static class ProviderConfig {
        private String name;
        private String endpoint;
        private String completionPath = "/v1/chat/completions";
        private String healthPath = "/v1/models";
        private String apiKey;
        private Set<String> models = new HashSet<>();
        private List<String> capabilities = new ArrayList<>();
        private Map<String, String> headers = new LinkedHashMap<>();
        private long timeoutMs = 0;
        private boolean enabled = true;

        public String getName() { return name; }
        public void setName(String name) { this.name = name; }

        public String getEndpoint() { return endpoint; }
        public void setEndpoint(String endpoint) { this.endpoint = endpoint; }

        public String getCompletionPath() { return completionPath; }
        public void setCompletionPath(String completionPath) { this.completionPath = completionPath; }

        public String getHealthPath() { return healthPath; }
        public void setHealthPath(String healthPath) { this.healthPath = healthPath; }

        public String getApiKey() { return apiKey; }
        public void setApiKey(String apiKey) { this.apiKey = apiKey; }

        public Set<String> getModels() { return models; }
        public void setModels(Set<String> models) { this.models = models; }

        public List<String> getCapabilities() { return capabilities; }
        public void setCapabilities(List<String> capabilities) { this.capabilities = capabilities; }

        public Map<String, String> getHeaders() { return headers; }
        public void setHeaders(Map<String, String> headers) { this.headers = headers; }

        /** Per-provider request timeout; 0 falls back to {@code timeouts.requestTimeoutMs}. */
        public long getTimeoutMs() { return timeoutMs; }
        public void setTimeoutMs(long timeoutMs) { this.timeoutMs = timeoutMs; }

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }
    }

    /**
     * Load balancing strategy configuration.
     */
    public static class StrategyConfig {
        private String type = "round_robin";
        private double ewmaAlpha = 0.3;

        public String getType() { return type; }
        public void setType(String type) { this.type = type; }

        public double getEwmaAlpha() { return ewmaAlpha; }
        public void setEwmaAlpha(double ewmaAlpha) { this.ewmaAlpha = ewmaAlpha; }
    }

    /**
     * Response cache configuration.
     */
    public static class CacheConfig {
        private boolean enabled = true;
        private String keyStrategy = "hashing";
        private int maxEntries = 1000;
        private long maxMemoryMb = 100;
        private long defaultTtlMs = 300_000;
        private long maxTtlMs = 3_600_000;
        private double ttlMultiplier = 1.0;
        private boolean adaptiveTtl = true;
        private long largeResponseBytes = 64 * 1024;
        private double hitRateThreshold = 0.0;
        private long cleanupIntervalMs = 60_000;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getKeyStrategy() { return keyStrategy; }
        public void setKeyStrategy(String keyStrategy) { this.keyStrategy = keyStrategy; }

        public int getMaxEntries() { return maxEntries; }
        public void setMaxEntries(int maxEntries) { this.maxEntries = maxEntries; }

        public long getMaxMemoryMb() { return maxMemoryMb; }
        public void setMaxMemoryMb(long maxMemoryMb) { this.maxMemoryMb = maxMemoryMb; }

        public long getDefaultTtlMs() { return defaultTtlMs; }
        public void setDefaultTtlMs(long defaultTtlMs) { this.defaultTtlMs = defaultTtlMs; }

        public long getMaxTtlMs() { return maxTtlMs; }
        public void setMaxTtlMs(long maxTtlMs) { this.maxTtlMs = maxTtlMs; }

        public double getTtlMultiplier() { return ttlMultiplier; }
        public void setTtlMultiplier(double ttlMultiplier) { this.ttlMultiplier = ttlMultiplier; }

        public boolean isAdaptiveTtl() { return adaptiveTtl; }
        public void setAdaptiveTtl(boolean adaptiveTtl) { this.adaptiveTtl = adaptiveTtl; }

        public long getLargeResponseBytes() { return largeResponseBytes; }
        public void setLargeResponseBytes(long largeResponseBytes) { this.largeResponseBytes = largeResponseBytes; }

        /** Minimum hits per minute an entry must sustain to survive cleanup; 0 disables the sweep. */
        public double getHitRateThreshold() { return hitRateThreshold; }
        public void setHitRateThreshold(double hitRateThreshold) { this.hitRateThreshold = hitRateThreshold; }

        public long getCleanupIntervalMs() { return cleanupIntervalMs; }
        public void setCleanupIntervalMs(long cleanupIntervalMs) { this.cleanupIntervalMs = cleanupIntervalMs; }
    }

    /**
     * Failover cooldown configuration.
     */
    public static class FailoverConfig {
        private long cooldownMs = 300_000;
        private double backoffMultiplier = 2.0;
        private long maxCooldownMs = 3_600_000;

        public long getCooldownMs() { return cooldownMs; }
        public void setCooldownMs(long cooldownMs) { this.cooldownMs = cooldownMs; }

        public double getBackoffMultiplier() { return backoffMultiplier; }
        public void setBackoffMultiplier(double backoffMultiplier) { this.backoffMultiplier = backoffMultiplier; }

        public long getMaxCooldownMs() { return maxCooldownMs; }
        public void setMaxCooldownMs(long maxCooldownMs) { this.maxCooldownMs = maxCooldownMs; }
    }

    /**
     * Timeout configuration.
     */
    public static class TimeoutsConfig {
        private long requestTimeoutMs = 30_000;
        private long connectTimeoutMs = 10_000;
        private long healthCheckTimeoutMs = 5_000;

        public long getRequestTimeoutMs() { return requestTimeoutMs; }
        public void setRequestTimeoutMs(long requestTimeoutMs) { this.requestTimeoutMs = requestTimeoutMs; }

        public long getConnectTimeoutMs() { return connectTimeoutMs; }
        public void setConnectTimeoutMs(long connectTimeoutMs) { this.connectTimeoutMs = connectTimeoutMs; }

        public long getHealthCheckTimeoutMs() { return healthCheckTimeoutMs; }
        public void setHealthCheckTimeoutMs(long healthCheckTimeoutMs) { this.healthCheckTimeoutMs = healthCheckTimeoutMs; }
    }

    /**
     * Background health check configuration.
     */
    public static class HealthCheckConfig {
        private boolean enabled = true;
        private long intervalMs = 60_000;

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public long getIntervalMs() { return intervalMs; }
        public void setIntervalMs(long intervalMs) { this.intervalMs = intervalMs; }
    }

    /**
     * Request validation configuration.
     */
    public static class ValidationConfig {
        private int maxPromptLength = 100_000;
        private Set<String> allowedModels = new HashSet<>();

        public int getMaxPromptLength() { return maxPromptLength; }
        public void setMaxPromptLength(int maxPromptLength) { this.maxPromptLength = maxPromptLength; }

        public Set<String> getAllowedModels() { return allowedModels; }
        public void setAllowedModels(Set<String> allowedModels) { this.allowedModels = allowedModels; }
    }

    /**
     * Metrics configuration.
     */
    public static class MetricsConfig {
        private boolean enabled = true;
        private String prefix = "aimux";
        private int ringBufferSize = 1024;
        private String waitStrategy = "blocking";

        public boolean isEnabled() { return enabled; }
        public void setEnabled(boolean enabled) { this.enabled = enabled; }

        public String getPrefix() { return prefix; }
        public void setPrefix(String prefix) { this.prefix = prefix; }

        public int getRingBufferSize() { return ringBufferSize; }
        public void setRingBufferSize(int ringBufferSize) { this.ringBufferSize = ringBufferSize; }

        public String getWaitStrategy() { return waitStrategy; }
        public void setWaitStrategy(String waitStrategy) { this.waitStrategy = waitStrategy; }
    }

    /**
     * Cache warm-up configuration.
     */
    public static class WarmupConfig {
        private boolean onStartup = false;
        private boolean builtInQueries = true;
        private String defaultModel;
        private List<WarmupQuery> queries = new ArrayList<>();

        public boolean isOnStartup() { return onStartup; }
        public void setOnStartup(boolean onStartup) { this.onStartup = onStartup; }

        public boolean isBuiltInQueries() { return builtInQueries; }
        public void setBuiltInQueries(boolean builtInQueries) { this.builtInQueries = builtInQueries; }

        /** Model used for built-in queries against providers that declare no models. */
        public String getDefaultModel() { return defaultModel; }
        public void setDefaultModel(String defaultModel) { this.defaultModel = defaultModel; }

        public List<WarmupQuery> getQueries() { return queries; }
        public void setQueries(List<WarmupQuery> queries) { this.queries = queries; }
    }

    /**
     * One operator-supplied warm-up query.
     */
    public static class WarmupQuery {
        private String model;
        private String prompt;
        private int maxTokens = 100;
        private double temperature = 0.7;

        public String getModel() { return model; }
        public void setModel(String model) { this.model = model; }

        public String getPrompt() { return prompt; }
        public void setPrompt(String prompt) { this.prompt = prompt; }

        public int getMaxTokens() { return maxTokens; }
        public void setMaxTokens(int maxTokens) { this.maxTokens = maxTokens; }

        public double getTemperature() { return temperature; }
        public void setTemperature(double temperature) { this.temperature = temperature; }
    }
}
