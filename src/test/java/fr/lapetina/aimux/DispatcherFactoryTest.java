package fr.lapetina.aimux;

import fr.lapetina.aimux.domain.model.CompletionRequest;
import fr.lapetina.aimux.domain.model.ProviderDescriptor;
import fr.lapetina.aimux.domain.model.RequestType;
import fr.lapetina.aimux.infrastructure.config.AimuxConfig;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class DispatcherFactoryTest {

    private static DispatcherFactory stubFactory(String configPath) {
        return new DispatcherFactory(configPath, StubProvider::new) {
        };
    }

    @Test
    @DisplayName("should translate provider configuration into a descriptor")
    void shouldBuildDescriptor() {
        AimuxConfig.ProviderConfig config = new AimuxConfig.ProviderConfig();
        config.setName("hosted");
        config.setEndpoint("https://api.example.com");
        config.setCapabilities(List.of(" vision", "TOOLS"));
        config.setTimeoutMs(1500);

        ProviderDescriptor descriptor = DispatcherFactory.toDescriptor(config);

        assertThat(descriptor.endpoint()).isEqualTo(URI.create("https://api.example.com"));
        assertThat(descriptor.capabilities()).containsExactlyInAnyOrder(RequestType.VISION, RequestType.TOOLS);
        assertThat(descriptor.timeout()).isEqualTo(Duration.ofMillis(1500));
        assertThat(descriptor.completionPath()).isEqualTo("/v1/chat/completions");

        config.setTimeoutMs(0);
        config.setCapabilities(null);
        assertThat(DispatcherFactory.toDescriptor(config).timeout()).isNull();
        assertThat(DispatcherFactory.toDescriptor(config).capabilities()).isEmpty();
    }

    @Test
    @DisplayName("should leave disabled providers out of failover and warm the cache on start")
    void shouldWarmOnStartup() {
        try (DispatcherFactory factory = stubFactory("warmup-config.yaml").start()) {
            assertThat(factory.getProviderRegistry().size()).isEqualTo(2);
            assertThat(factory.getFailoverManager().getProviders()).containsExactly("primary");
            assertThat(factory.getLoadBalancer().getStrategy().getName()).isEqualTo("fastest_response");

            // five built-in prompts for model-a plus one configured query
            assertThat(factory.getCache().size()).isEqualTo(6);

            StubProvider primary = (StubProvider) factory.getProviderRegistry().getProvider("primary").orElseThrow();
            assertThat(primary.getCallCount()).isEqualTo(6);
            assertThat(primary.descriptor().headers()).containsEntry("X-Team", "platform");

            assertThat(factory.getDispatcher().dispatch(CompletionRequest.builder()
                    .payload(primary.getReceived().get(5).payload())
                    .build()).cacheHit()).isTrue();
        }
    }

    @Test
    @DisplayName("should serve HTTP traffic until closed")
    void applicationShouldServeUntilClosed() throws Exception {
        AimuxApplication app = new AimuxApplication(stubFactory("test-config.yaml"));
        try {
            app.start();
            HttpClient client = HttpClient.newHttpClient();

            HttpResponse<String> response = client.send(
                    HttpRequest.newBuilder(URI.create("http://127.0.0.1:" + app.getPort() + "/health")).GET().build(),
                    HttpResponse.BodyHandlers.ofString());

            assertThat(response.statusCode()).isEqualTo(200);
            assertThat(app.getFactory().getMetricsPipeline().isRunning()).isTrue();
        } finally {
            app.close();
        }
        assertThat(app.getFactory().getMetricsPipeline().isRunning()).isFalse();
    }
}
