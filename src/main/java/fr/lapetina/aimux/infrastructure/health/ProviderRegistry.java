package fr.lapetina.aimux.infrastructure.health;

import fr.lapetina.aimux.domain.provider.Provider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Registry of configured providers, in configuration order.
 *
 * This is the only place concrete {@link Provider} implementations are enumerated;
 * everything downstream works with provider names.
 */
public final class ProviderRegistry {

    private static final Logger log = LoggerFactory.getLogger(ProviderRegistry.class);

    private final Map<String, Provider> providers = new ConcurrentHashMap<>();
    private final List<String> order = new CopyOnWriteArrayList<>();

    /**
     * Registers a provider. Names must be unique.
     *
     * @throws IllegalArgumentException if a provider with the same name exists
     */
    public void register(Provider provider) {
        String name = provider.getName();
        if (providers.putIfAbsent(name, provider) != null) {
            throw new IllegalArgumentException("Provider already registered: " + name);
        }
        order.add(name);
        log.info("Provider registered: {}", provider.descriptor());
    }

    public Optional<Provider> getProvider(String name) {
        return Optional.ofNullable(providers.get(name));
    }

    /**
     * All providers, in registration order.
     */
    public List<Provider> getAllProviders() {
        return order.stream().map(providers::get).toList();
    }

    /**
     * Enabled providers, in registration order.
     */
    public List<Provider> getEnabledProviders() {
        return order.stream()
                .map(providers::get)
                .filter(provider -> provider.descriptor().enabled())
                .toList();
    }

    /**
     * Names of enabled providers, in registration order.
     */
    public List<String> getEnabledNames() {
        return getEnabledProviders().stream().map(Provider::getName).toList();
    }

    public int size() {
        return providers.size();
    }
}
