package fr.lapetina.aimux.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import fr.lapetina.aimux.infrastructure.config.AimuxConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.LongAdder;
import java.util.concurrent.locks.ReentrantLock;
import java.util.regex.Pattern;

/**
 * Bounded response cache with TTL expiry and LRU eviction.
 *
 * <p>Entries live in a {@link LinkedHashMap} kept in recency order: the first entry is
 * the least recently used. One lock covers the map, its ordering and the running memory
 * total. Hit, miss, eviction and expiration counters are {@link LongAdder}s updated
 * outside that lock.
 *
 * <p>Expired entries are removed lazily on {@link #get} and in bulk by {@link #cleanup()},
 * which a background task calls periodically.
 */
public final class ResponseCache {

    private static final Logger log = LoggerFactory.getLogger(ResponseCache.class);

    /** Fixed per-entry overhead added to the serialized size. */
    static final long ENTRY_OVERHEAD_BYTES = 256;

    private static final Pattern TIME_SENSITIVE = Pattern.compile(
            "\\b(today|now|current|latest|news|weather|price|stock)\\b");

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private final ReentrantLock lock = new ReentrantLock();
    private final LinkedHashMap<String, CacheEntry> entries = new LinkedHashMap<>();
    private long memoryUsageBytes;

    private final LongAdder hits = new LongAdder();
    private final LongAdder misses = new LongAdder();
    private final LongAdder evictions = new LongAdder();
    private final LongAdder expirations = new LongAdder();

    private final KeyGenerator keyGenerator;
    private final Clock clock;
    private final int maxEntries;
    private final long maxMemoryBytes;
    private final Duration defaultTtl;
    private final Duration maxTtl;
    private final long largeResponseBytes;
    private final double hitRateThreshold;

    private volatile double ttlMultiplier;
    private volatile boolean adaptiveTtl;

    private ResponseCache(Builder builder) {
        this.keyGenerator = new KeyGenerator(builder.keyStrategy);
        this.clock = builder.clock;
        this.maxEntries = builder.maxEntries;
        this.maxMemoryBytes = builder.maxMemoryBytes;
        this.defaultTtl = builder.defaultTtl;
        this.maxTtl = builder.maxTtl;
        this.largeResponseBytes = builder.largeResponseBytes;
        this.hitRateThreshold = builder.hitRateThreshold;
        this.ttlMultiplier = builder.ttlMultiplier;
        this.adaptiveTtl = builder.adaptiveTtl;

        log.info("ResponseCache created: keyStrategy={}, maxEntries={}, maxMemoryBytes={}, defaultTtlMs={}, maxTtlMs={}",
                builder.keyStrategy, maxEntries, maxMemoryBytes, defaultTtl.toMillis(), maxTtl.toMillis());
    }

    /**
     * Derives the cache key for a request with the configured key strategy.
     */
    public String generateKey(String model, JsonNode request) {
        return keyGenerator.generate(model, request);
    }

    /**
     * Looks up a response. A hit refreshes the entry's recency; an expired entry is
     * removed and counted as a miss.
     *
     * @return a copy of the cached response, or empty
     */
    public Optional<JsonNode> get(String key) {
        Instant now = clock.instant();
        lock.lock();
        try {
            CacheEntry entry = entries.get(key);
            if (entry == null) {
                misses.increment();
                return Optional.empty();
            }
            if (entry.isExpired(now)) {
                removeEntry(key);
                expirations.increment();
                misses.increment();
                log.debug("Cache entry expired on read: key={}", key);
                return Optional.empty();
            }
            entries.remove(key);
            entries.put(key, entry);
            entry.recordHit(now);
            hits.increment();
            return Optional.of(entry.response().deepCopy());
        } finally {
            lock.unlock();
        }
    }

    /**
     * True if a live entry exists. Does not touch recency or statistics.
     */
    public boolean contains(String key) {
        Instant now = clock.instant();
        lock.lock();
        try {
            CacheEntry entry = entries.get(key);
            return entry != null && !entry.isExpired(now);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Stores a response with a TTL computed from the response alone.
     */
    public boolean put(String key, JsonNode response) {
        return put(key, null, response);
    }

    /**
     * Stores a response with a TTL computed from the request and the response.
     */
    public boolean put(String key, JsonNode request, JsonNode response) {
        long size = estimateSize(response);
        return store(key, response, calculateTtl(request, response, size), size);
    }

    /**
     * Stores a response with an explicit TTL. Negative TTLs are treated as zero.
     *
     * @return false when the entry alone exceeds the memory limit and was not stored
     */
    public boolean put(String key, JsonNode response, Duration ttl) {
        Duration effective = ttl == null || ttl.isNegative() ? Duration.ZERO : ttl;
        return store(key, response, effective, estimateSize(response));
    }

    private boolean store(String key, JsonNode response, Duration ttl, long size) {
        if (size > maxMemoryBytes) {
            log.debug("Response too large to cache: key={}, sizeBytes={}, maxMemoryBytes={}",
                    key, size, maxMemoryBytes);
            return false;
        }

        CacheEntry entry = new CacheEntry(response.deepCopy(), clock.instant(), ttl, size);
        lock.lock();
        try {
            CacheEntry previous = entries.remove(key);
            if (previous != null) {
                memoryUsageBytes -= previous.sizeBytes();
            }
            entries.put(key, entry);
            memoryUsageBytes += size;
            evictIfNeeded();
        } finally {
            lock.unlock();
        }

        log.debug("Response cached: key={}, ttlMs={}, sizeBytes={}", key, ttl.toMillis(), size);
        return true;
    }

    private void evictIfNeeded() {
        Iterator<Map.Entry<String, CacheEntry>> it = entries.entrySet().iterator();
        while ((entries.size() > maxEntries || memoryUsageBytes > maxMemoryBytes) && it.hasNext()) {
            Map.Entry<String, CacheEntry> eldest = it.next();
            it.remove();
            memoryUsageBytes -= eldest.getValue().sizeBytes();
            evictions.increment();
            log.debug("Cache entry evicted: key={}, entries={}, memoryBytes={}",
                    eldest.getKey(), entries.size(), memoryUsageBytes);
        }
    }

    /**
     * Computes the TTL for a new entry.
     *
     * <p>Base TTL times the multiplier. With adaptive TTL enabled: doubled for deterministic
     * requests (temperature 0), halved for large responses, quartered for time-sensitive
     * requests. The result is clamped to {@code [0, maxTtl]}.
     */
    public Duration calculateTtl(JsonNode request, JsonNode response) {
        return calculateTtl(request, response, estimateSize(response));
    }

    private Duration calculateTtl(JsonNode request, JsonNode response, long sizeBytes) {
        double ttlMs = defaultTtl.toMillis() * ttlMultiplier;

        if (adaptiveTtl) {
            if (request != null) {
                JsonNode temperature = request.get("temperature");
                if (temperature != null && temperature.isNumber() && temperature.asDouble() == 0.0) {
                    ttlMs *= 2.0;
                }
                if (isTimeSensitive(request)) {
                    ttlMs *= 0.25;
                }
            }
            if (sizeBytes > largeResponseBytes) {
                ttlMs *= 0.5;
            }
        }

        long clamped = (long) Math.max(0.0, Math.min(ttlMs, (double) maxTtl.toMillis()));
        return Duration.ofMillis(clamped);
    }

    static boolean isTimeSensitive(JsonNode request) {
        JsonNode core = KeyGenerator.extractCoreContent(request);
        if (core == null) {
            return false;
        }
        StringBuilder text = new StringBuilder();
        for (JsonNode message : core.path("messages")) {
            text.append(message.path("content").asText()).append(' ');
        }
        text.append(core.path("prompt").asText(""));
        return TIME_SENSITIVE.matcher(text).find();
    }

    /**
     * Serialized UTF-8 size plus a fixed per-entry overhead.
     */
    static long estimateSize(JsonNode response) {
        try {
            return MAPPER.writeValueAsBytes(response).length + ENTRY_OVERHEAD_BYTES;
        } catch (JsonProcessingException e) {
            return response.toString().length() + ENTRY_OVERHEAD_BYTES;
        }
    }

    public boolean remove(String key) {
        lock.lock();
        try {
            return removeEntry(key);
        } finally {
            lock.unlock();
        }
    }

    private boolean removeEntry(String key) {
        CacheEntry removed = entries.remove(key);
        if (removed != null) {
            memoryUsageBytes -= removed.sizeBytes();
            return true;
        }
        return false;
    }

    /**
     * Drops every entry. Statistics are kept.
     */
    public void clear() {
        int cleared;
        lock.lock();
        try {
            cleared = entries.size();
            entries.clear();
            memoryUsageBytes = 0;
        } finally {
            lock.unlock();
        }
        log.info("Cache cleared: entriesRemoved={}", cleared);
    }

    /**
     * Removes expired entries and, when a hit-rate threshold is configured, entries
     * older than a minute whose hits per minute fall below it.
     *
     * @return number of entries removed
     */
    public int cleanup() {
        Instant now = clock.instant();
        int expired = 0;
        int lowUtility = 0;

        lock.lock();
        try {
            Iterator<Map.Entry<String, CacheEntry>> it = entries.entrySet().iterator();
            while (it.hasNext()) {
                CacheEntry entry = it.next().getValue();
                if (entry.isExpired(now)) {
                    it.remove();
                    memoryUsageBytes -= entry.sizeBytes();
                    expired++;
                } else if (hitRateThreshold > 0 && entry.hitsPerMinute(now) < hitRateThreshold) {
                    it.remove();
                    memoryUsageBytes -= entry.sizeBytes();
                    lowUtility++;
                }
            }
        } finally {
            lock.unlock();
        }

        expirations.add(expired);
        evictions.add(lowUtility);
        if (expired + lowUtility > 0) {
            log.debug("Cache cleanup finished: expired={}, lowUtility={}", expired, lowUtility);
        }
        return expired + lowUtility;
    }

    public CacheStats getStats() {
        int size;
        long memory;
        lock.lock();
        try {
            size = entries.size();
            memory = memoryUsageBytes;
        } finally {
            lock.unlock();
        }
        return new CacheStats(hits.sum(), misses.sum(), evictions.sum(), expirations.sum(), size, memory);
    }

    public void resetStats() {
        hits.reset();
        misses.reset();
        evictions.reset();
        expirations.reset();
        log.info("Cache statistics reset");
    }

    public int size() {
        lock.lock();
        try {
            return entries.size();
        } finally {
            lock.unlock();
        }
    }

    public void setTtlMultiplier(double ttlMultiplier) {
        if (ttlMultiplier < 0) {
            throw new IllegalArgumentException("TTL multiplier must not be negative: " + ttlMultiplier);
        }
        this.ttlMultiplier = ttlMultiplier;
    }

    public double getTtlMultiplier() {
        return ttlMultiplier;
    }

    public void setAdaptiveTtl(boolean adaptiveTtl) {
        this.adaptiveTtl = adaptiveTtl;
    }

    public boolean isAdaptiveTtl() {
        return adaptiveTtl;
    }

    public KeyGenerator.KeyStrategy getKeyStrategy() {
        return keyGenerator.getStrategy();
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * Builder for ResponseCache.
     */
    public static final class Builder {
        private KeyGenerator.KeyStrategy keyStrategy = KeyGenerator.KeyStrategy.HASHING;
        private Clock clock = Clock.systemUTC();
        private int maxEntries = 1000;
        private long maxMemoryBytes = 100L * 1024 * 1024;
        private Duration defaultTtl = Duration.ofMinutes(5);
        private Duration maxTtl = Duration.ofHours(1);
        private double ttlMultiplier = 1.0;
        private boolean adaptiveTtl = true;
        private long largeResponseBytes = 64 * 1024;
        private double hitRateThreshold = 0.0;

        public Builder keyStrategy(KeyGenerator.KeyStrategy keyStrategy) {
            this.keyStrategy = keyStrategy;
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = clock;
            return this;
        }

        public Builder maxEntries(int maxEntries) {
            if (maxEntries <= 0) {
                throw new IllegalArgumentException("maxEntries must be positive");
            }
            this.maxEntries = maxEntries;
            return this;
        }

        public Builder maxMemoryBytes(long maxMemoryBytes) {
            if (maxMemoryBytes <= 0) {
                throw new IllegalArgumentException("maxMemoryBytes must be positive");
            }
            this.maxMemoryBytes = maxMemoryBytes;
            return this;
        }

        public Builder defaultTtl(Duration defaultTtl) {
            this.defaultTtl = defaultTtl;
            return this;
        }

        public Builder maxTtl(Duration maxTtl) {
            this.maxTtl = maxTtl;
            return this;
        }

        public Builder ttlMultiplier(double ttlMultiplier) {
            this.ttlMultiplier = ttlMultiplier;
            return this;
        }

        public Builder adaptiveTtl(boolean adaptiveTtl) {
            this.adaptiveTtl = adaptiveTtl;
            return this;
        }

        public Builder largeResponseBytes(long largeResponseBytes) {
            this.largeResponseBytes = largeResponseBytes;
            return this;
        }

        public Builder hitRateThreshold(double hitRateThreshold) {
            this.hitRateThreshold = hitRateThreshold;
            return this;
        }

        public Builder fromConfig(AimuxConfig.CacheConfig config) {
            this.keyStrategy = KeyGenerator.KeyStrategy.fromName(config.getKeyStrategy());
            this.maxEntries = config.getMaxEntries();
            this.maxMemoryBytes = config.getMaxMemoryMb() * 1024 * 1024;
            this.defaultTtl = Duration.ofMillis(config.getDefaultTtlMs());
            this.maxTtl = Duration.ofMillis(config.getMaxTtlMs());
            this.ttlMultiplier = config.getTtlMultiplier();
            this.adaptiveTtl = config.isAdaptiveTtl();
            this.largeResponseBytes = config.getLargeResponseBytes();
            this.hitRateThreshold = config.getHitRateThreshold();
            return this;
        }

        public ResponseCache build() {
            return new ResponseCache(this);
        }
    }
}
