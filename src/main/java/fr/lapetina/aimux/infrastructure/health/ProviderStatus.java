package fr.lapetina.aimux.infrastructure.health;

import java.time.Duration;
import java.time.Instant;

/**
 * Snapshot of one provider's failover state.
 *
 * @param failed              logically FAILED; stays true after the cooldown until marked healthy
 * @param available           eligible for selection right now
 * @param failedAt            time of the most recent failure, or null
 * @param cooldownRemaining   time until the provider becomes eligible again, zero when available
 * @param failureCount        cumulative failures since start or last reset
 * @param consecutiveFailures failures since the last success
 */
public record ProviderStatus(
        String name,
        boolean failed,
        boolean available,
        Instant failedAt,
        Duration cooldown,
        Duration cooldownRemaining,
        long failureCount,
        int consecutiveFailures
) {
    static ProviderStatus healthy(String name) {
        return new ProviderStatus(name, false, true, null, Duration.ZERO, Duration.ZERO, 0, 0);
    }
}
