package fr.lapetina.aimux.cache;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import fr.lapetina.aimux.MutableClock;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class CacheCleanerTest {

    @Test
    @DisplayName("should remove expired entries on each pass")
    void shouldRemoveExpiredEntries() {
        MutableClock clock = new MutableClock();
        ResponseCache cache = ResponseCache.builder().clock(clock).build();
        cache.put("k", JsonNodeFactory.instance.objectNode(), Duration.ofSeconds(1));
        clock.advance(Duration.ofSeconds(5));

        try (CacheCleaner cleaner = new CacheCleaner(cache, Duration.ofMinutes(1))) {
            assertThat(cleaner.runCleanup()).isEqualTo(1);
            assertThat(cache.size()).isZero();
        }
    }

    @Test
    @DisplayName("should run periodically once started")
    void shouldRunPeriodically() throws Exception {
        MutableClock clock = new MutableClock();
        ResponseCache cache = ResponseCache.builder().clock(clock).build();
        cache.put("k", JsonNodeFactory.instance.objectNode(), Duration.ofSeconds(1));
        clock.advance(Duration.ofSeconds(5));

        try (CacheCleaner cleaner = new CacheCleaner(cache, Duration.ofMillis(20))) {
            cleaner.start();
            long deadline = System.currentTimeMillis() + 2000;
            while (cache.size() > 0 && System.currentTimeMillis() < deadline) {
                Thread.sleep(10);
            }
        }

        assertThat(cache.size()).isZero();
    }
}
