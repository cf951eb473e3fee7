package fr.lapetina.aimux.integration;

import fr.lapetina.aimux.StubProvider;
import fr.lapetina.aimux.cache.CacheWarmer;
import fr.lapetina.aimux.domain.model.CompletionRequest;
import fr.lapetina.aimux.domain.model.CompletionResponse;
import fr.lapetina.aimux.domain.model.ErrorType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;

class DispatcherIntegrationTest {

    private TestDispatcherFactory factory;

    @BeforeEach
    void setUp() {
        factory = TestDispatcherFactory.create();
    }

    @AfterEach
    void tearDown() {
        factory.close();
    }

    @Test
    @DisplayName("should wire configured providers, strategy and failover settings")
    void shouldWireFromConfig() {
        assertThat(factory.getProviderRegistry().size()).isEqualTo(3);
        assertThat(factory.getFailoverManager().getProviders())
                .containsExactly("provider-a", "provider-b", "vision-only");
        assertThat(factory.getLoadBalancer().getStrategy().getName()).isEqualTo("round_robin");
        assertThat(factory.getBackoffPolicy().cooldownFor(2)).isEqualTo(Duration.ofMinutes(2));
        assertThat(factory.getMetricsPipeline().isRunning()).isTrue();
    }

    @Test
    @DisplayName("should keep the model-restricted provider out of general traffic")
    void shouldRespectModelLists() {
        for (int i = 0; i < 6; i++) {
            factory.getDispatcher().dispatch(CompletionRequest.ofChat("general", "question " + i));
        }

        assertThat(factory.stub("vision-only").getCallCount()).isZero();
        assertThat(factory.stub("provider-a").getCallCount()).isEqualTo(3);
        assertThat(factory.stub("provider-b").getCallCount()).isEqualTo(3);
    }

    @Test
    @DisplayName("should fail over and then keep the failed provider out during its cooldown")
    void shouldFailOverAndCoolDown() {
        factory.stub("provider-a").respondWith(500, StubProvider.chatBody("down"));

        CompletionResponse first = factory.getDispatcher().dispatch(CompletionRequest.ofChat("general", "one"));
        CompletionResponse second = factory.getDispatcher().dispatch(CompletionRequest.ofChat("general", "two"));

        assertThat(first.provider()).isEqualTo("provider-b");
        assertThat(first.retryCount()).isEqualTo(1);
        assertThat(second.provider()).isEqualTo("provider-b");
        assertThat(factory.stub("provider-a").getCallCount()).isEqualTo(1);
        assertThat(factory.getFailoverManager().getStatus("provider-a").orElseThrow().cooldown())
                .isEqualTo(Duration.ofMinutes(1));
    }

    @Test
    @DisplayName("should time out a hanging provider within the configured request timeout")
    void shouldTimeOutHangingProvider() {
        factory.stub("provider-a").hang();
        factory.stub("provider-b").hang();

        CompletionResponse response = factory.getDispatcher().dispatch(CompletionRequest.ofChat("general", "slow"));

        assertThat(response.errorType()).isEqualTo(ErrorType.ALL_PROVIDERS_FAILED);
        assertThat(response.elapsedMs()).isBetween(900L, 3000L);
        assertThat(factory.getDispatcher().getInFlight("provider-a")).isZero();
    }

    @Test
    @DisplayName("should find nothing to warm without queries and still cache live traffic")
    void shouldWarmNothingWithoutQueries() {
        CacheWarmer.WarmupReport report = factory.getCacheWarmer().warm();

        assertThat(report.attempted()).isZero();

        factory.getCache().clear();
        CompletionResponse miss = factory.getDispatcher().dispatch(CompletionRequest.ofChat("general", "warm"));
        CompletionResponse hit = factory.getDispatcher().dispatch(CompletionRequest.ofChat("general", "warm"));
        assertThat(miss.cacheHit()).isFalse();
        assertThat(hit.cacheHit()).isTrue();
    }

    @Test
    @DisplayName("should serve concurrent identical requests consistently")
    void shouldHandleConcurrentRequests() throws Exception {
        ExecutorService executor = Executors.newFixedThreadPool(8);
        List<Future<CompletionResponse>> futures = new ArrayList<>();
        for (int i = 0; i < 40; i++) {
            int n = i % 4;
            futures.add(executor.submit(() ->
                    factory.getDispatcher().dispatch(CompletionRequest.ofChat("general", "concurrent " + n))));
        }

        for (Future<CompletionResponse> future : futures) {
            assertThat(future.get().isSuccess()).isTrue();
        }
        executor.shutdown();

        assertThat(factory.getCache().size()).isEqualTo(4);
        int calls = factory.stub("provider-a").getCallCount() + factory.stub("provider-b").getCallCount();
        assertThat(calls).isBetween(4, 40);
    }
}
