package fr.lapetina.aimux.infrastructure.health;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Per-provider health state machine with cooldowns.
 *
 * <p>Every configured provider starts AVAILABLE. {@link #markFailed} moves it to FAILED
 * for a caller-supplied cooldown; {@link #markHealthy} moves it back immediately. Once the
 * cooldown has elapsed the provider is selectable again but stays logically FAILED, with its
 * failure history, until a success marks it healthy.
 *
 * <p>There is no timer: cooldown expiry is evaluated against the clock on every query.
 * All reads and writes happen under one lock.
 */
public final class FailoverManager {

    private static final Logger log = LoggerFactory.getLogger(FailoverManager.class);

    public static final Duration DEFAULT_COOLDOWN = Duration.ofMinutes(5);

    private final ReentrantLock lock = new ReentrantLock();
    private final List<String> providers;
    private final Map<String, FailureState> states = new HashMap<>();
    private final Clock clock;

    public FailoverManager(List<String> providers, Clock clock) {
        this.providers = List.copyOf(providers);
        this.clock = clock;
    }

    public FailoverManager(List<String> providers) {
        this(providers, Clock.systemUTC());
    }

    /**
     * Marks a provider failed with the default cooldown.
     */
    public void markFailed(String provider) {
        markFailed(provider, DEFAULT_COOLDOWN);
    }

    /**
     * Marks a provider failed. A failure during or after an earlier cooldown restarts the
     * clock from now with the new cooldown.
     */
    public void markFailed(String provider, Duration cooldown) {
        if (!providers.contains(provider)) {
            log.warn("Ignoring failure for unknown provider: provider={}", provider);
            return;
        }
        Duration effective = cooldown == null || cooldown.isNegative() ? Duration.ZERO : cooldown;

        long failureCount;
        int consecutive;
        lock.lock();
        try {
            FailureState state = states.computeIfAbsent(provider, p -> new FailureState());
            state.failed = true;
            state.failedAt = clock.instant();
            state.cooldown = effective;
            failureCount = ++state.failureCount;
            consecutive = ++state.consecutiveFailures;
        } finally {
            lock.unlock();
        }

        log.warn("Provider marked failed: provider={}, cooldownMs={}, failureCount={}, consecutiveFailures={}",
                provider, effective.toMillis(), failureCount, consecutive);
    }

    /**
     * Marks a provider available, regardless of any remaining cooldown.
     * The cumulative failure count is kept.
     */
    public void markHealthy(String provider) {
        boolean recovered = false;
        lock.lock();
        try {
            FailureState state = states.get(provider);
            if (state != null) {
                recovered = state.failed;
                state.failed = false;
                state.consecutiveFailures = 0;
            }
        } finally {
            lock.unlock();
        }

        if (recovered) {
            log.info("Provider marked healthy: provider={}", provider);
        }
    }

    /**
     * AVAILABLE, or FAILED with {@code now >= failedAt + cooldown}. Unknown providers are unavailable.
     */
    public boolean isAvailable(String provider) {
        if (!providers.contains(provider)) {
            return false;
        }
        Instant now = clock.instant();
        lock.lock();
        try {
            return isAvailable(states.get(provider), now);
        } finally {
            lock.unlock();
        }
    }

    private static boolean isAvailable(FailureState state, Instant now) {
        return state == null || !state.failed || !now.isBefore(state.failedAt.plus(state.cooldown));
    }

    /**
     * First other provider that is currently available, in configured order.
     */
    public Optional<String> getNextProvider(String failedProvider) {
        Instant now = clock.instant();
        lock.lock();
        try {
            for (String provider : providers) {
                if (!provider.equals(failedProvider) && isAvailable(states.get(provider), now)) {
                    return Optional.of(provider);
                }
            }
            return Optional.empty();
        } finally {
            lock.unlock();
        }
    }

    /**
     * All currently available providers, in configured order.
     */
    public List<String> getAvailableProviders() {
        Instant now = clock.instant();
        lock.lock();
        try {
            List<String> available = new ArrayList<>(providers.size());
            for (String provider : providers) {
                if (isAvailable(states.get(provider), now)) {
                    available.add(provider);
                }
            }
            return available;
        } finally {
            lock.unlock();
        }
    }

    public List<String> getProviders() {
        return providers;
    }

    public int getConsecutiveFailures(String provider) {
        lock.lock();
        try {
            FailureState state = states.get(provider);
            return state == null ? 0 : state.consecutiveFailures;
        } finally {
            lock.unlock();
        }
    }

    /**
     * True if the provider is logically FAILED, whether or not its cooldown has elapsed.
     */
    public boolean isFailed(String provider) {
        lock.lock();
        try {
            FailureState state = states.get(provider);
            return state != null && state.failed;
        } finally {
            lock.unlock();
        }
    }

    public Optional<ProviderStatus> getStatus(String provider) {
        if (!providers.contains(provider)) {
            return Optional.empty();
        }
        Instant now = clock.instant();
        lock.lock();
        try {
            return Optional.of(snapshot(provider, states.get(provider), now));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Status of every configured provider, in configured order.
     */
    public List<ProviderStatus> getStatistics() {
        Instant now = clock.instant();
        lock.lock();
        try {
            List<ProviderStatus> result = new ArrayList<>(providers.size());
            for (String provider : providers) {
                result.add(snapshot(provider, states.get(provider), now));
            }
            return result;
        } finally {
            lock.unlock();
        }
    }

    private static ProviderStatus snapshot(String provider, FailureState state, Instant now) {
        if (state == null) {
            return ProviderStatus.healthy(provider);
        }
        Duration remaining = Duration.ZERO;
        if (state.failed) {
            Duration left = Duration.between(now, state.failedAt.plus(state.cooldown));
            remaining = left.isNegative() ? Duration.ZERO : left;
        }
        return new ProviderStatus(
                provider,
                state.failed,
                isAvailable(state, now),
                state.failedAt,
                state.cooldown,
                remaining,
                state.failureCount,
                state.consecutiveFailures
        );
    }

    /**
     * Clears all failure state.
     */
    public void reset() {
        lock.lock();
        try {
            states.clear();
        } finally {
            lock.unlock();
        }
        log.info("Failover state reset: providers={}", providers.size());
    }

    private static final class FailureState {
        private boolean failed;
        private Instant failedAt;
        private Duration cooldown = Duration.ZERO;
        private long failureCount;
        private int consecutiveFailures;
    }
}
