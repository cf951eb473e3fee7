package fr.lapetina.aimux.infrastructure.health;

import fr.lapetina.aimux.infrastructure.config.AimuxConfig;

import java.time.Duration;

/**
 * Exponential cooldown growth for providers that keep failing.
 *
 * <pre>
 * cooldown(n) = min(base * multiplier^(n-1), max)    n = consecutive failures, starting at 1
 * </pre>
 *
 * With the defaults (5 min, x2, 60 min cap): 5, 10, 20, 40, 60, 60... minutes.
 */
public final class BackoffPolicy {

    private final long baseCooldownMs;
    private final double multiplier;
    private final long maxCooldownMs;

    public BackoffPolicy(Duration baseCooldown, double multiplier, Duration maxCooldown) {
        if (baseCooldown.isNegative()) {
            throw new IllegalArgumentException("baseCooldown must not be negative: " + baseCooldown);
        }
        if (multiplier < 1.0) {
            throw new IllegalArgumentException("multiplier must be >= 1.0: " + multiplier);
        }
        if (maxCooldown.compareTo(baseCooldown) < 0) {
            throw new IllegalArgumentException(
                    "maxCooldown must be >= baseCooldown (base: " + baseCooldown + ", max: " + maxCooldown + ")");
        }
        this.baseCooldownMs = baseCooldown.toMillis();
        this.multiplier = multiplier;
        this.maxCooldownMs = maxCooldown.toMillis();
    }

    public BackoffPolicy() {
        this(FailoverManager.DEFAULT_COOLDOWN, 2.0, Duration.ofHours(1));
    }

    public static BackoffPolicy fromConfig(AimuxConfig.FailoverConfig config) {
        return new BackoffPolicy(
                Duration.ofMillis(config.getCooldownMs()),
                config.getBackoffMultiplier(),
                Duration.ofMillis(config.getMaxCooldownMs())
        );
    }

    /**
     * Cooldown to apply for the given consecutive failure count.
     * Counts below 1 are treated as the first failure.
     */
    public Duration cooldownFor(int consecutiveFailures) {
        int exponent = Math.max(0, consecutiveFailures - 1);
        double cooldown = baseCooldownMs * Math.pow(multiplier, exponent);
        return Duration.ofMillis((long) Math.min(cooldown, (double) maxCooldownMs));
    }

    public Duration getBaseCooldown() {
        return Duration.ofMillis(baseCooldownMs);
    }

    public Duration getMaxCooldown() {
        return Duration.ofMillis(maxCooldownMs);
    }
}
