package fr.lapetina.aimux.infrastructure.config;

import fr.lapetina.aimux.cache.KeyGenerator;
import fr.lapetina.aimux.domain.model.RequestType;
import fr.lapetina.aimux.domain.strategy.StrategyFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.Constructor;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashSet;
import java.util.Locale;
import java.util.Set;

/**
 * Loads and validates the dispatcher configuration.
 *
 * Supports:
 * - Loading from the file system, falling back to the classpath
 * - Validation of every section before the configuration is handed out
 *
 * Any problem surfaces as a {@link ConfigurationException}, which is fatal at startup.
 */
public final class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private final Path configPath;
    private final Yaml yaml;

    public ConfigLoader(String configPath) {
        this.configPath = Paths.get(configPath);
        LoaderOptions loaderOptions = new LoaderOptions();
        this.yaml = new Yaml(new Constructor(AimuxConfig.class, loaderOptions));
    }

    /**
     * Loads configuration from file or classpath and validates it.
     *
     * @return The loaded configuration
     * @throws ConfigurationException if loading or validation fails
     */
    public AimuxConfig load() {
        AimuxConfig config = loadFromPath();
        validate(config);
        log.info("Configuration loaded: providers={}, strategy={}, keyStrategy={}",
                config.getProviders().size(),
                config.getStrategy().getType(),
                config.getCache().getKeyStrategy());
        return config;
    }

    /**
     * Loads and validates configuration from an input stream.
     */
    public AimuxConfig loadFromStream(InputStream inputStream) {
        AimuxConfig config = parse(inputStream, "stream");
        validate(config);
        return config;
    }

    private AimuxConfig loadFromPath() {
        if (Files.exists(configPath)) {
            log.info("Loading configuration from file: {}", configPath);
            try (InputStream is = Files.newInputStream(configPath)) {
                return parse(is, configPath.toString());
            } catch (IOException e) {
                throw new ConfigurationException("Failed to load configuration from: " + configPath, e);
            }
        }

        String classpathResource = configPath.toString();
        if (classpathResource.startsWith("/")) {
            classpathResource = classpathResource.substring(1);
        }

        try (InputStream is = getClass().getClassLoader().getResourceAsStream(classpathResource)) {
            if (is != null) {
                log.info("Loading configuration from classpath: {}", classpathResource);
                return parse(is, classpathResource);
            }
        } catch (IOException e) {
            throw new ConfigurationException("Failed to load from classpath: " + classpathResource, e);
        }

        throw new ConfigurationException("Configuration file not found: " + configPath);
    }

    private AimuxConfig parse(InputStream is, String source) {
        try {
            AimuxConfig config = yaml.load(is);
            if (config == null) {
                throw new ConfigurationException("Configuration is empty: " + source);
            }
            return config;
        } catch (YAMLException e) {
            throw new ConfigurationException("Invalid configuration in " + source + ": " + e.getMessage(), e);
        }
    }

    /**
     * Checks the configuration for errors that would make the dispatcher unusable.
     *
     * @throws ConfigurationException on the first problem found
     */
    public static void validate(AimuxConfig config) {
        if (config.getProviders() == null || config.getProviders().isEmpty()) {
            throw new ConfigurationException("No providers configured");
        }

        Set<String> names = new HashSet<>();
        int enabled = 0;
        for (AimuxConfig.ProviderConfig provider : config.getProviders()) {
            validateProvider(provider);
            if (!names.add(provider.getName())) {
                throw new ConfigurationException("Duplicate provider name: " + provider.getName());
            }
            if (provider.isEnabled()) {
                enabled++;
            }
        }
        if (enabled == 0) {
            throw new ConfigurationException("All configured providers are disabled");
        }

        AimuxConfig.CacheConfig cache = config.getCache();
        if (cache.getMaxEntries() <= 0) {
            throw new ConfigurationException("cache.maxEntries must be positive: " + cache.getMaxEntries());
        }
        if (cache.getMaxMemoryMb() <= 0) {
            throw new ConfigurationException("cache.maxMemoryMb must be positive: " + cache.getMaxMemoryMb());
        }
        if (cache.getDefaultTtlMs() < 0 || cache.getMaxTtlMs() < 0) {
            throw new ConfigurationException("cache TTLs must not be negative");
        }
        if (cache.getDefaultTtlMs() > cache.getMaxTtlMs()) {
            throw new ConfigurationException("cache.defaultTtlMs exceeds cache.maxTtlMs");
        }
        if (cache.getTtlMultiplier() < 0) {
            throw new ConfigurationException("cache.ttlMultiplier must not be negative");
        }
        try {
            KeyGenerator.KeyStrategy.fromName(cache.getKeyStrategy());
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(e.getMessage(), e);
        }

        if (!StrategyFactory.isRegistered(config.getStrategy().getType())) {
            throw new ConfigurationException("Unknown load balancing strategy: " + config.getStrategy().getType()
                    + ". Available: " + StrategyFactory.getRegisteredNames());
        }
        double alpha = config.getStrategy().getEwmaAlpha();
        if (alpha <= 0.0 || alpha > 1.0) {
            throw new ConfigurationException("strategy.ewmaAlpha must be in (0, 1]: " + alpha);
        }

        AimuxConfig.FailoverConfig failover = config.getFailover();
        if (failover.getCooldownMs() < 0 || failover.getMaxCooldownMs() < failover.getCooldownMs()) {
            throw new ConfigurationException("failover cooldowns must satisfy 0 <= cooldownMs <= maxCooldownMs");
        }
        if (failover.getBackoffMultiplier() < 1.0) {
            throw new ConfigurationException("failover.backoffMultiplier must be at least 1.0");
        }

        if (config.getTimeouts().getRequestTimeoutMs() <= 0) {
            throw new ConfigurationException("timeouts.requestTimeoutMs must be positive");
        }
        if (config.getServer().getMaxRequestBytes() <= 0) {
            throw new ConfigurationException("server.maxRequestBytes must be positive");
        }
        int ringBufferSize = config.getMetrics().getRingBufferSize();
        if (ringBufferSize <= 0 || Integer.bitCount(ringBufferSize) != 1) {
            throw new ConfigurationException("metrics.ringBufferSize must be a power of 2: " + ringBufferSize);
        }
    }

    private static void validateProvider(AimuxConfig.ProviderConfig provider) {
        if (provider.getName() == null || provider.getName().isBlank()) {
            throw new ConfigurationException("Provider name is required");
        }
        if (provider.getEndpoint() == null || provider.getEndpoint().isBlank()) {
            throw new ConfigurationException("Provider endpoint is required: " + provider.getName());
        }
        try {
            URI uri = URI.create(provider.getEndpoint());
            if (uri.getScheme() == null || uri.getHost() == null) {
                throw new ConfigurationException("Provider endpoint must be an absolute URL: " + provider.getEndpoint());
            }
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Invalid provider endpoint: " + provider.getEndpoint(), e);
        }
        for (String capability : provider.getCapabilities()) {
            try {
                RequestType.valueOf(capability.toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException("Unknown capability '" + capability + "' for provider " + provider.getName());
            }
        }
    }

    /**
     * Exception for configuration errors.
     */
    public static class ConfigurationException extends RuntimeException {
        public ConfigurationException(String message) {
            super(message);
        }

        public ConfigurationException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
