package fr.lapetina.aimux.cache;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Duration;
import java.time.Instant;

/**
 * A cached response with its expiry and usage bookkeeping.
 *
 * Mutable fields are only touched while the owning {@link ResponseCache} holds its lock.
 */
final class CacheEntry {

    private final JsonNode response;
    private final Instant createdAt;
    private final Duration ttl;
    private final long sizeBytes;
    private long hitCount;
    private Instant lastAccessedAt;

    CacheEntry(JsonNode response, Instant createdAt, Duration ttl, long sizeBytes) {
        this.response = response;
        this.createdAt = createdAt;
        this.ttl = ttl;
        this.sizeBytes = sizeBytes;
        this.lastAccessedAt = createdAt;
    }

    /**
     * Expired once strictly past {@code createdAt + ttl}.
     */
    boolean isExpired(Instant now) {
        return now.isAfter(createdAt.plus(ttl));
    }

    void recordHit(Instant now) {
        hitCount++;
        lastAccessedAt = now;
    }

    /**
     * Hits per minute since creation. Entries younger than a minute report {@code Double.MAX_VALUE}.
     */
    double hitsPerMinute(Instant now) {
        double ageMinutes = Duration.between(createdAt, now).toMillis() / 60_000.0;
        if (ageMinutes < 1.0) {
            return Double.MAX_VALUE;
        }
        return hitCount / ageMinutes;
    }

    JsonNode response() {
        return response;
    }

    Instant createdAt() {
        return createdAt;
    }

    Duration ttl() {
        return ttl;
    }

    long sizeBytes() {
        return sizeBytes;
    }

    long hitCount() {
        return hitCount;
    }

    Instant lastAccessedAt() {
        return lastAccessedAt;
    }
}
