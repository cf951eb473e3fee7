package fr.lapetina.aimux.domain.model;

import java.net.URI;
import java.time.Duration;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Static description of an upstream provider: where it lives, how to authenticate,
 * and which models and request types it serves.
 *
 * <p>Empty {@code models} or {@code capabilities} mean "serves everything".
 */
public record ProviderDescriptor(
        String name,
        URI endpoint,
        String completionPath,
        String healthPath,
        String apiKey,
        Set<String> models,
        Set<RequestType> capabilities,
        Map<String, String> headers,
        Duration timeout,
        boolean enabled
) {
    public ProviderDescriptor {
        Objects.requireNonNull(name, "Provider name is required");
        Objects.requireNonNull(endpoint, "Provider endpoint is required");
        if (completionPath == null || completionPath.isBlank()) {
            completionPath = "/v1/chat/completions";
        }
        if (healthPath == null || healthPath.isBlank()) {
            healthPath = "/v1/models";
        }
        models = models != null ? Set.copyOf(models) : Set.of();
        capabilities = capabilities != null ? Set.copyOf(capabilities) : Set.of();
        headers = headers != null ? Map.copyOf(headers) : Map.of();
    }

    public boolean supportsModel(String model) {
        return models.isEmpty() || models.contains(model);
    }

    public boolean supportsType(RequestType type) {
        return type == null || type == RequestType.REGULAR
                || capabilities.isEmpty() || capabilities.contains(type);
    }

    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isBlank();
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "Provider[%s, %s, models=%s, enabled=%s]",
                name, endpoint, models, enabled);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String name;
        private URI endpoint;
        private String completionPath;
        private String healthPath;
        private String apiKey;
        private Set<String> models;
        private Set<RequestType> capabilities;
        private Map<String, String> headers;
        private Duration timeout;
        private boolean enabled = true;

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder endpoint(URI endpoint) {
            this.endpoint = endpoint;
            return this;
        }

        public Builder endpoint(String endpoint) {
            this.endpoint = URI.create(endpoint);
            return this;
        }

        public Builder completionPath(String completionPath) {
            this.completionPath = completionPath;
            return this;
        }

        public Builder healthPath(String healthPath) {
            this.healthPath = healthPath;
            return this;
        }

        public Builder apiKey(String apiKey) {
            this.apiKey = apiKey;
            return this;
        }

        public Builder models(Set<String> models) {
            this.models = models;
            return this;
        }

        public Builder capabilities(Set<RequestType> capabilities) {
            this.capabilities = capabilities;
            return this;
        }

        public Builder headers(Map<String, String> headers) {
            this.headers = headers;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public ProviderDescriptor build() {
            return new ProviderDescriptor(
                    name, endpoint, completionPath, healthPath, apiKey,
                    models, capabilities, headers, timeout, enabled
            );
        }
    }
}
