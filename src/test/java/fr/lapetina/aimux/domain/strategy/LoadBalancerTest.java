package fr.lapetina.aimux.domain.strategy;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class LoadBalancerTest {

    private static final List<String> CANDIDATES = List.of("a", "b", "c");

    private LoadBalancer loadBalancer;

    @BeforeEach
    void setUp() {
        loadBalancer = new LoadBalancer(new RoundRobinStrategy(), 0.5);
    }

    @Test
    @DisplayName("should seed the moving average with the first sample")
    void shouldSeedAverageWithFirstSample() {
        loadBalancer.updateResponseTime("a", 200);

        assertThat(loadBalancer.getMetrics("a").averageResponseTimeMs()).isEqualTo(200.0);
    }

    @Test
    @DisplayName("should fold later samples into an exponential moving average")
    void shouldApplyEwma() {
        loadBalancer.updateResponseTime("a", 200);
        loadBalancer.updateResponseTime("a", 100);
        loadBalancer.updateResponseTime("a", 100);

        ProviderMetrics metrics = loadBalancer.getMetrics("a");
        assertThat(metrics.averageResponseTimeMs()).isCloseTo(125.0, within(1e-9));
        assertThat(metrics.totalRequests()).isEqualTo(3);
        assertThat(metrics.meanResponseTimeMs()).isCloseTo(133.333, within(1e-3));
    }

    @Test
    @DisplayName("should clamp negative connection counts to zero")
    void shouldClampConnections() {
        loadBalancer.updateConnections("a", -3);

        assertThat(loadBalancer.getMetrics("a").activeConnections()).isZero();
    }

    @Test
    @DisplayName("should route with live metrics after a strategy switch")
    void shouldSwitchStrategy() {
        loadBalancer.updateResponseTime("a", 500);
        loadBalancer.updateResponseTime("b", 50);
        loadBalancer.updateResponseTime("c", 300);

        loadBalancer.setStrategy(new FastestResponseStrategy());

        assertThat(loadBalancer.getStrategy().getName()).isEqualTo("fastest_response");
        assertThat(loadBalancer.selectProvider(CANDIDATES)).contains("b");
    }

    @Test
    @DisplayName("should return empty without candidates")
    void shouldReturnEmptyWithoutCandidates() {
        assertThat(loadBalancer.selectProvider(List.of())).isEmpty();
        assertThat(loadBalancer.selectProvider(null)).isEmpty();
    }

    @Test
    @DisplayName("should report and reset statistics")
    void shouldReportAndResetStatistics() {
        loadBalancer.selectProvider(CANDIDATES);
        loadBalancer.selectProvider(CANDIDATES);
        loadBalancer.updateResponseTime("a", 100);

        LoadBalancer.LoadBalancerStats stats = loadBalancer.getStatistics();
        assertThat(stats.strategy()).isEqualTo("round_robin");
        assertThat(stats.totalSelections()).isEqualTo(2);
        assertThat(stats.roundRobinIndex()).isEqualTo(2);
        assertThat(stats.providers()).containsOnlyKeys("a", "b", "c");

        loadBalancer.resetStatistics();

        LoadBalancer.LoadBalancerStats reset = loadBalancer.getStatistics();
        assertThat(reset.totalSelections()).isZero();
        assertThat(reset.roundRobinIndex()).isZero();
        assertThat(reset.providers().get("a")).isEqualTo(ProviderMetrics.EMPTY);
        assertThat(loadBalancer.selectProvider(CANDIDATES)).contains("a");
    }

    @Test
    @DisplayName("should reject alpha outside (0, 1]")
    void shouldRejectInvalidAlpha() {
        assertThatThrownBy(() -> new LoadBalancer(new RoundRobinStrategy(), 0.0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new LoadBalancer(new RoundRobinStrategy(), 1.5))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("should distribute round-robin turns evenly under concurrency")
    void shouldDistributeEvenlyUnderConcurrency() throws Exception {
        int threads = 6;
        int perThread = 300;
        Map<String, AtomicInteger> counts = new ConcurrentHashMap<>();
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(threads);

        for (int t = 0; t < threads; t++) {
            executor.execute(() -> {
                try {
                    start.await();
                    for (int i = 0; i < perThread; i++) {
                        loadBalancer.selectProvider(CANDIDATES).ifPresent(p ->
                                counts.computeIfAbsent(p, k -> new AtomicInteger()).incrementAndGet());
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    done.countDown();
                }
            });
        }

        start.countDown();
        assertThat(done.await(10, TimeUnit.SECONDS)).isTrue();
        executor.shutdown();

        int expected = threads * perThread / CANDIDATES.size();
        assertThat(counts.values()).extracting(AtomicInteger::get).containsOnly(expected);
    }

    @Test
    @DisplayName("should apply connection deltas and never drop below zero")
    void shouldAdjustConnections() {
        assertThat(loadBalancer.adjustConnections("a", 1)).isEqualTo(1);
        assertThat(loadBalancer.adjustConnections("a", 1)).isEqualTo(2);
        assertThat(loadBalancer.adjustConnections("a", -1)).isEqualTo(1);
        assertThat(loadBalancer.adjustConnections("a", -5)).isZero();

        assertThat(loadBalancer.getMetrics("a").activeConnections()).isZero();
    }

    @Test
    @DisplayName("should settle the connection gauge at zero after balanced concurrent deltas")
    void shouldKeepConnectionGaugeConsistentUnderConcurrency() throws Exception {
        int threads = 8;
        int perThread = 2000;
        AtomicInteger peak = new AtomicInteger();
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        CountDownLatch done = new CountDownLatch(threads);

        for (int t = 0; t < threads; t++) {
            executor.execute(() -> {
                try {
                    start.await();
                    for (int i = 0; i < perThread; i++) {
                        int open = loadBalancer.adjustConnections("a", 1);
                        peak.accumulateAndGet(open, Math::max);
                        loadBalancer.adjustConnections("a", -1);
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    done.countDown();
                }
            });
        }

        start.countDown();
        assertThat(done.await(10, TimeUnit.SECONDS)).isTrue();
        executor.shutdown();

        assertThat(loadBalancer.getMetrics("a").activeConnections()).isZero();
        assertThat(peak.get()).isBetween(1, threads);
    }
}
