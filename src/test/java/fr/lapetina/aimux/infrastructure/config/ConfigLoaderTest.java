package fr.lapetina.aimux.infrastructure.config;

import fr.lapetina.aimux.infrastructure.config.ConfigLoader.ConfigurationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ConfigLoaderTest {

    private static final String MINIMAL = "providers:\n"
            + "  - name: primary\n"
            + "    endpoint: http://localhost:9000\n";

    private static AimuxConfig load(String yaml) {
        return new ConfigLoader("unused.yaml")
                .loadFromStream(new ByteArrayInputStream(yaml.getBytes(StandardCharsets.UTF_8)));
    }

    @Nested
    @DisplayName("Loading")
    class Loading {

        @Test
        @DisplayName("should apply defaults to a minimal configuration")
        void shouldApplyDefaults() {
            AimuxConfig config = load(MINIMAL);

            assertThat(config.getServer().getPort()).isEqualTo(8080);
            assertThat(config.getStrategy().getType()).isEqualTo("round_robin");
            assertThat(config.getCache().getKeyStrategy()).isEqualTo("hashing");
            assertThat(config.getCache().getDefaultTtlMs()).isEqualTo(300_000);
            assertThat(config.getFailover().getCooldownMs()).isEqualTo(300_000);
            assertThat(config.getTimeouts().getRequestTimeoutMs()).isEqualTo(30_000);
            assertThat(config.getMetrics().getPrefix()).isEqualTo("aimux");

            AimuxConfig.ProviderConfig provider = config.getProviders().get(0);
            assertThat(provider.getCompletionPath()).isEqualTo("/v1/chat/completions");
            assertThat(provider.isEnabled()).isTrue();
            assertThat(provider.getModels()).isEmpty();
        }

        @Test
        @DisplayName("should read provider details and nested sections")
        void shouldReadFullProvider() {
            AimuxConfig config = load("strategy:\n"
                    + "  type: least-connections\n"
                    + "  ewmaAlpha: 0.5\n"
                    + "cache:\n"
                    + "  keyStrategy: semantic\n"
                    + "  hitRateThreshold: 0.1\n"
                    + "providers:\n"
                    + "  - name: hosted\n"
                    + "    endpoint: https://api.example.com\n"
                    + "    apiKey: secret\n"
                    + "    models: [gpt-x, gpt-y]\n"
                    + "    capabilities: [vision, tools]\n"
                    + "    headers:\n"
                    + "      X-Org: acme\n"
                    + "    timeoutMs: 2500\n");

            assertThat(config.getStrategy().getType()).isEqualTo("least-connections");
            assertThat(config.getStrategy().getEwmaAlpha()).isEqualTo(0.5);
            assertThat(config.getCache().getHitRateThreshold()).isEqualTo(0.1);

            AimuxConfig.ProviderConfig provider = config.getProviders().get(0);
            assertThat(provider.getApiKey()).isEqualTo("secret");
            assertThat(provider.getModels()).containsExactlyInAnyOrder("gpt-x", "gpt-y");
            assertThat(provider.getCapabilities()).containsExactly("vision", "tools");
            assertThat(provider.getHeaders()).containsEntry("X-Org", "acme");
            assertThat(provider.getTimeoutMs()).isEqualTo(2500);
        }

        @Test
        @DisplayName("should load from a file path before the classpath")
        void shouldLoadFromFile(@TempDir Path dir) throws Exception {
            Path file = dir.resolve("aimux.yaml");
            Files.writeString(file, MINIMAL + "server:\n  port: 9999\n");

            AimuxConfig config = new ConfigLoader(file.toString()).load();

            assertThat(config.getServer().getPort()).isEqualTo(9999);
        }

        @Test
        @DisplayName("should fall back to the classpath")
        void shouldLoadFromClasspath() {
            AimuxConfig config = new ConfigLoader("test-config.yaml").load();

            assertThat(config.getProviders()).extracting(AimuxConfig.ProviderConfig::getName)
                    .contains("provider-a", "provider-b");
        }

        @Test
        @DisplayName("should fail when the file does not exist anywhere")
        void shouldFailWhenMissing() {
            assertThatThrownBy(() -> new ConfigLoader("does-not-exist.yaml").load())
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("not found");
        }

        @Test
        @DisplayName("should reject empty or malformed documents")
        void shouldRejectBadDocuments() {
            assertThatThrownBy(() -> load(""))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("empty");
            assertThatThrownBy(() -> load("providers: [unclosed"))
                    .isInstanceOf(ConfigurationException.class);
        }
    }

    @Nested
    @DisplayName("Validation")
    class Validation {

        @Test
        @DisplayName("should require at least one provider")
        void shouldRequireProviders() {
            assertThatThrownBy(() -> load("providers: []"))
                    .isInstanceOf(ConfigurationException.class)
                    .hasMessageContaining("No providers");
        }

        @Test
        @DisplayName("should reject duplicate provider names")
        void shouldRejectDuplicates() {
            assertThatThrownBy(() -> load(MINIMAL + "  - name: primary\n"
                    + "    endpoint: http://localhost:9001\n"))
                    .hasMessageContaining("Duplicate provider name");
        }

        @Test
        @DisplayName("should reject a configuration with every provider disabled")
        void shouldRejectAllDisabled() {
            assertThatThrownBy(() -> load(MINIMAL + "    enabled: false\n"))
                    .hasMessageContaining("disabled");
        }

        @Test
        @DisplayName("should reject relative endpoints and unknown capabilities")
        void shouldRejectBadProviderFields() {
            assertThatThrownBy(() -> load("providers:\n"
                    + "  - name: p\n"
                    + "    endpoint: localhost\n"))
                    .hasMessageContaining("absolute URL");
            assertThatThrownBy(() -> load(MINIMAL + "    capabilities: [telepathy]\n"))
                    .hasMessageContaining("Unknown capability");
        }

        @Test
        @DisplayName("should reject unknown strategies and key strategies")
        void shouldRejectUnknownStrategies() {
            assertThatThrownBy(() -> load(MINIMAL + "strategy:\n  type: fancy\n"))
                    .hasMessageContaining("Unknown load balancing strategy");
            assertThatThrownBy(() -> load(MINIMAL + "cache:\n  keyStrategy: fuzzy\n"))
                    .isInstanceOf(ConfigurationException.class);
        }

        @Test
        @DisplayName("should reject inconsistent numeric settings")
        void shouldRejectBadNumbers() {
            assertThatThrownBy(() -> load(MINIMAL + "cache:\n  defaultTtlMs: 10\n  maxTtlMs: 5\n"))
                    .hasMessageContaining("defaultTtlMs");
            assertThatThrownBy(() -> load(MINIMAL + "failover:\n  backoffMultiplier: 0.5\n"))
                    .hasMessageContaining("backoffMultiplier");
            assertThatThrownBy(() -> load(MINIMAL + "metrics:\n  ringBufferSize: 1000\n"))
                    .hasMessageContaining("power of 2");
            assertThatThrownBy(() -> load(MINIMAL + "strategy:\n  ewmaAlpha: 0\n"))
                    .hasMessageContaining("ewmaAlpha");
        }
    }
}
