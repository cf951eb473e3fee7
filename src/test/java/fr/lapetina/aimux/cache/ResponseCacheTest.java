package fr.lapetina.aimux.cache;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import fr.lapetina.aimux.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ResponseCacheTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private MutableClock clock;
    private ResponseCache cache;

    @BeforeEach
    void setUp() {
        clock = new MutableClock();
        cache = ResponseCache.builder()
                .clock(clock)
                .maxEntries(3)
                .build();
    }

    private static ObjectNode response(String content) {
        ObjectNode node = MAPPER.createObjectNode();
        node.put("id", "chatcmpl-1");
        node.putArray("choices").addObject().putObject("message").put("content", content);
        return node;
    }

    private static JsonNode json(String text) throws Exception {
        return MAPPER.readTree(text);
    }

    @Nested
    @DisplayName("Lookups")
    class Lookups {

        @Test
        @DisplayName("should return a stored response and count a hit")
        void shouldReturnStoredResponse() {
            cache.put("k", response("hello"), Duration.ofMinutes(1));

            assertThat(cache.get("k")).contains(response("hello"));
            assertThat(cache.getStats().hits()).isEqualTo(1);
            assertThat(cache.getStats().misses()).isZero();
        }

        @Test
        @DisplayName("should count a miss for unknown keys")
        void shouldCountMiss() {
            assertThat(cache.get("missing")).isEmpty();
            assertThat(cache.getStats().misses()).isEqualTo(1);
        }

        @Test
        @DisplayName("should hand out copies that callers cannot corrupt")
        void shouldReturnCopies() {
            cache.put("k", response("hello"), Duration.ofMinutes(1));

            ObjectNode first = (ObjectNode) cache.get("k").orElseThrow();
            first.put("id", "tampered");

            assertThat(cache.get("k").orElseThrow().get("id").asText()).isEqualTo("chatcmpl-1");
        }

        @Test
        @DisplayName("contains should not change statistics")
        void containsShouldNotTouchStats() {
            cache.put("k", response("hello"), Duration.ofMinutes(1));

            assertThat(cache.contains("k")).isTrue();
            assertThat(cache.contains("other")).isFalse();
            assertThat(cache.getStats().lookups()).isZero();
        }
    }

    @Nested
    @DisplayName("Expiry")
    class Expiry {

        @Test
        @DisplayName("should still serve an entry exactly at its TTL and expire it just after")
        void shouldExpireStrictlyAfterTtl() {
            cache.put("k", response("hello"), Duration.ofMillis(100));

            clock.advance(Duration.ofMillis(100));
            assertThat(cache.get("k")).isPresent();

            clock.advance(Duration.ofMillis(1));
            assertThat(cache.get("k")).isEmpty();

            CacheStats stats = cache.getStats();
            assertThat(stats.expirations()).isEqualTo(1);
            assertThat(stats.misses()).isEqualTo(1);
            assertThat(stats.entries()).isZero();
            assertThat(stats.memoryUsageBytes()).isZero();
        }

        @Test
        @DisplayName("should treat a negative TTL as already expiring")
        void shouldClampNegativeTtl() {
            cache.put("k", response("hello"), Duration.ofSeconds(-5));

            clock.advance(Duration.ofMillis(1));

            assertThat(cache.get("k")).isEmpty();
        }

        @Test
        @DisplayName("cleanup should remove expired entries only")
        void cleanupShouldRemoveExpired() {
            cache.put("short", response("a"), Duration.ofSeconds(1));
            cache.put("long", response("b"), Duration.ofMinutes(10));

            clock.advance(Duration.ofSeconds(2));

            assertThat(cache.cleanup()).isEqualTo(1);
            assertThat(cache.contains("long")).isTrue();
            assertThat(cache.size()).isEqualTo(1);
            assertThat(cache.getStats().expirations()).isEqualTo(1);
        }

        @Test
        @DisplayName("cleanup should drop rarely used entries when a hit-rate threshold is set")
        void cleanupShouldDropLowUtilityEntries() {
            ResponseCache sweeping = ResponseCache.builder()
                    .clock(clock)
                    .hitRateThreshold(1.0)
                    .build();
            sweeping.put("cold", response("a"), Duration.ofHours(1));
            sweeping.put("hot", response("b"), Duration.ofHours(1));
            for (int i = 0; i < 5; i++) {
                sweeping.get("hot");
            }

            clock.advance(Duration.ofMinutes(2));

            assertThat(sweeping.cleanup()).isEqualTo(1);
            assertThat(sweeping.contains("hot")).isTrue();
            assertThat(sweeping.contains("cold")).isFalse();
            assertThat(sweeping.getStats().evictions()).isEqualTo(1);
        }
    }

    @Nested
    @DisplayName("Eviction")
    class Eviction {

        @Test
        @DisplayName("should evict the least recently used entry when full")
        void shouldEvictLeastRecentlyUsed() {
            cache.put("a", response("a"), Duration.ofMinutes(1));
            cache.put("b", response("b"), Duration.ofMinutes(1));
            cache.put("c", response("c"), Duration.ofMinutes(1));

            cache.get("a");
            cache.put("d", response("d"), Duration.ofMinutes(1));

            assertThat(cache.contains("a")).isTrue();
            assertThat(cache.contains("b")).isFalse();
            assertThat(cache.contains("c")).isTrue();
            assertThat(cache.contains("d")).isTrue();
            assertThat(cache.getStats().evictions()).isEqualTo(1);
        }

        @Test
        @DisplayName("should replace an existing key without evicting")
        void shouldReplaceExistingKey() {
            cache.put("a", response("a"), Duration.ofMinutes(1));
            cache.put("b", response("b"), Duration.ofMinutes(1));
            cache.put("c", response("c"), Duration.ofMinutes(1));

            cache.put("a", response("a2"), Duration.ofMinutes(1));

            assertThat(cache.size()).isEqualTo(3);
            assertThat(cache.getStats().evictions()).isZero();
            assertThat(cache.get("a").orElseThrow().at("/choices/0/message/content").asText()).isEqualTo("a2");
        }

        @Test
        @DisplayName("should evict by memory and refuse entries larger than the limit")
        void shouldEnforceMemoryLimit() {
            long entrySize = ResponseCache.estimateSize(response("x"));
            ResponseCache small = ResponseCache.builder()
                    .clock(clock)
                    .maxMemoryBytes(entrySize * 2)
                    .build();

            small.put("a", response("x"), Duration.ofMinutes(1));
            small.put("b", response("y"), Duration.ofMinutes(1));
            small.put("c", response("z"), Duration.ofMinutes(1));

            assertThat(small.size()).isEqualTo(2);
            assertThat(small.contains("a")).isFalse();
            assertThat(small.getStats().memoryUsageBytes()).isLessThanOrEqualTo(entrySize * 2);

            boolean stored = small.put("huge", response("x".repeat(1000)), Duration.ofMinutes(1));
            assertThat(stored).isFalse();
            assertThat(small.size()).isEqualTo(2);
        }
    }

    @Nested
    @DisplayName("TTL calculation")
    class TtlCalculation {

        @Test
        @DisplayName("should use the default TTL for ordinary requests")
        void shouldUseDefaultTtl() throws Exception {
            JsonNode request = json("{\"messages\":[{\"role\":\"user\",\"content\":\"explain recursion\"}],\"temperature\":0.7}");

            assertThat(cache.calculateTtl(request, response("ok"))).isEqualTo(Duration.ofMinutes(5));
        }

        @Test
        @DisplayName("should double the TTL for deterministic requests")
        void shouldDoubleForZeroTemperature() throws Exception {
            JsonNode request = json("{\"messages\":[{\"role\":\"user\",\"content\":\"explain recursion\"}],\"temperature\":0}");

            assertThat(cache.calculateTtl(request, response("ok"))).isEqualTo(Duration.ofMinutes(10));
        }

        @Test
        @DisplayName("should shorten the TTL for time-sensitive requests")
        void shouldShortenForTimeSensitive() throws Exception {
            JsonNode request = json("{\"messages\":[{\"role\":\"user\",\"content\":\"What is the weather today?\"}]}");

            assertThat(cache.calculateTtl(request, response("ok"))).isEqualTo(Duration.ofSeconds(75));
        }

        @Test
        @DisplayName("should halve the TTL for large responses")
        void shouldHalveForLargeResponses() {
            ResponseCache smallThreshold = ResponseCache.builder().largeResponseBytes(10).build();

            assertThat(smallThreshold.calculateTtl(null, response("ok"))).isEqualTo(Duration.ofSeconds(150));
        }

        @Test
        @DisplayName("should clamp to the maximum TTL and ignore adjustments when adaptive TTL is off")
        void shouldClampAndHonorAdaptiveFlag() throws Exception {
            JsonNode deterministic = json("{\"prompt\":\"hello\",\"temperature\":0}");
            ResponseCache clamped = ResponseCache.builder()
                    .defaultTtl(Duration.ofMinutes(40))
                    .maxTtl(Duration.ofHours(1))
                    .build();

            assertThat(clamped.calculateTtl(deterministic, response("ok"))).isEqualTo(Duration.ofHours(1));

            clamped.setAdaptiveTtl(false);
            assertThat(clamped.calculateTtl(deterministic, response("ok"))).isEqualTo(Duration.ofMinutes(40));
        }

        @Test
        @DisplayName("should apply the TTL multiplier and reject negative multipliers")
        void shouldApplyMultiplier() {
            cache.setTtlMultiplier(0.5);

            assertThat(cache.calculateTtl(null, response("ok"))).isEqualTo(Duration.ofSeconds(150));
            assertThatThrownBy(() -> cache.setTtlMultiplier(-1))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }

    @Nested
    @DisplayName("Statistics")
    class Statistics {

        @Test
        @DisplayName("should compute hit rate and keep stats across clear")
        void shouldComputeHitRate() {
            cache.put("k", response("hello"), Duration.ofMinutes(1));
            cache.get("k");
            cache.get("k");
            cache.get("k");
            cache.get("missing");

            assertThat(cache.getStats().hitRate()).isEqualTo(0.75);

            cache.clear();
            assertThat(cache.size()).isZero();
            assertThat(cache.getStats().hits()).isEqualTo(3);

            cache.resetStats();
            assertThat(cache.getStats().lookups()).isZero();
            assertThat(cache.getStats().hitRate()).isZero();
        }
    }

    @Test
    @DisplayName("should stay consistent under concurrent access")
    void shouldStayConsistentUnderConcurrency() throws Exception {
        ResponseCache shared = ResponseCache.builder().clock(clock).maxEntries(50).build();
        int threads = 8;
        int operations = 500;
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        CountDownLatch start = new CountDownLatch(1);
        List<Future<?>> futures = new ArrayList<>();

        for (int t = 0; t < threads; t++) {
            int offset = t;
            futures.add(executor.submit(() -> {
                start.await();
                for (int i = 0; i < operations; i++) {
                    String key = "k" + ((i + offset) % 100);
                    if (i % 3 == 0) {
                        shared.put(key, response(key), Duration.ofMinutes(1));
                    } else {
                        shared.get(key);
                    }
                }
                return null;
            }));
        }
        start.countDown();
        for (Future<?> future : futures) {
            future.get(10, TimeUnit.SECONDS);
        }
        executor.shutdown();

        CacheStats stats = shared.getStats();
        assertThat(stats.entries()).isLessThanOrEqualTo(50);
        assertThat(stats.lookups()).isEqualTo((long) threads * operations - (long) threads * ((operations + 2) / 3));
        assertThat(stats.memoryUsageBytes()).isPositive();
    }
}
