package fr.lapetina.aimux.dispatch;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import fr.lapetina.aimux.cache.ResponseCache;
import fr.lapetina.aimux.disruptor.MetricsEventPipeline;
import fr.lapetina.aimux.domain.model.CompletionRequest;
import fr.lapetina.aimux.domain.model.CompletionResponse;
import fr.lapetina.aimux.domain.model.ErrorType;
import fr.lapetina.aimux.domain.model.ProviderDescriptor;
import fr.lapetina.aimux.domain.provider.Provider;
import fr.lapetina.aimux.domain.provider.ProviderException;
import fr.lapetina.aimux.domain.provider.ProviderReply;
import fr.lapetina.aimux.domain.strategy.LoadBalancer;
import fr.lapetina.aimux.infrastructure.health.BackoffPolicy;
import fr.lapetina.aimux.infrastructure.health.FailoverManager;
import fr.lapetina.aimux.infrastructure.health.ProviderRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.http.HttpTimeoutException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Routes one completion request: validation, cache lookup, provider selection and
 * failover, cache write-back and response annotation.
 *
 * <p>Each candidate provider is tried at most once per request. A provider that times out,
 * fails at transport level or answers 5xx, 408 or 429 is put into cooldown and the next
 * candidate is selected. Any other 4xx is returned to the caller unchanged, and a
 * non-retryable {@link ProviderException} fails the request as a client error; neither
 * touches the provider's failover state.
 *
 * <p>The dispatcher holds no lock of its own; cache, failover manager and load balancer
 * each guard their own state.
 */
public final class Dispatcher {

    private static final Logger log = LoggerFactory.getLogger(Dispatcher.class);

    private final ProviderRegistry registry;
    private final FailoverManager failoverManager;
    private final LoadBalancer loadBalancer;
    private final ResponseCache cache;
    private final boolean cacheEnabled;
    private final BackoffPolicy backoffPolicy;
    private final RequestValidator validator;
    private final MetricsEventPipeline metricsPipeline;
    private final Duration requestTimeout;

    private final ConcurrentHashMap<String, AtomicInteger> inFlight = new ConcurrentHashMap<>();

    private Dispatcher(Builder builder) {
        this.registry = builder.registry;
        this.failoverManager = builder.failoverManager;
        this.loadBalancer = builder.loadBalancer;
        this.cache = builder.cache;
        this.cacheEnabled = builder.cacheEnabled;
        this.backoffPolicy = builder.backoffPolicy;
        this.validator = builder.validator;
        this.metricsPipeline = builder.metricsPipeline;
        this.requestTimeout = builder.requestTimeout;
    }

    /**
     * Dispatches a request and always returns a response; failures are described by the
     * response's error type.
     */
    public CompletionResponse dispatch(CompletionRequest request) {
        long startNanos = System.nanoTime();
        CompletionResponse response;
        try {
            response = route(request, startNanos);
        } catch (Exception e) {
            log.error("Unexpected dispatch failure: requestId={}, model={}, correlationId={}",
                    request.requestId(), request.model(), request.correlationId(), e);
            response = CompletionResponse.error(request.requestId(), request.model(),
                            ErrorType.INTERNAL_ERROR, "Internal error")
                    .withAttempts(null, elapsedSince(startNanos), 0);
        }
        metricsPipeline.publishCompleted(request, response);
        return response;
    }

    private CompletionResponse route(CompletionRequest request, long startNanos) {
        try {
            validator.validate(request);
        } catch (RequestValidator.ValidationException e) {
            log.warn("Validation failed: requestId={}, model={}, reason={}",
                    request.requestId(), request.model(), e.getMessage());
            return CompletionResponse.error(request.requestId(), request.model(),
                    ErrorType.CLIENT_ERROR, e.getMessage());
        }

        ObjectNode payload = request.payload();
        boolean cacheable = cacheEnabled && !request.stream();
        String cacheKey = null;
        if (cacheable) {
            cacheKey = cache.generateKey(request.model(), payload);
            Optional<JsonNode> cached = cache.get(cacheKey);
            if (cached.isPresent()) {
                JsonNode body = ResponseEnvelope.withCacheFlag(cached.get(), true);
                String provider = ResponseEnvelope.routedProvider(body)
                        .filter(name -> registry.getProvider(name).isPresent())
                        .orElse(null);
                log.info("Cache hit: requestId={}, model={}, provider={}", request.requestId(), request.model(), provider);
                return CompletionResponse.success(request.requestId(), request.model(), body,
                        provider, elapsedSince(startNanos), 0, true);
            }
        }

        List<String> candidates = candidatesFor(request);
        if (candidates.isEmpty()) {
            log.warn("No available provider: requestId={}, model={}, type={}",
                    request.requestId(), request.model(), request.type().label());
            return CompletionResponse.error(request.requestId(), request.model(),
                            ErrorType.NO_AVAILABLE_PROVIDER, "No available provider for model " + request.model())
                    .withAttempts(null, elapsedSince(startNanos), 0);
        }

        int maxAttempts = candidates.size();
        int failures = 0;
        String lastProvider = null;
        String lastError = null;

        for (int attempt = 0; attempt < maxAttempts && !candidates.isEmpty(); attempt++) {
            Optional<String> selected = loadBalancer.selectProvider(candidates);
            if (selected.isEmpty()) {
                break;
            }
            String name = selected.get();
            Provider provider = registry.getProvider(name).orElseThrow(
                    () -> new IllegalStateException("Provider not registered: " + name));
            lastProvider = name;

            log.debug("Provider selected: requestId={}, provider={}, attempt={}, candidates={}",
                    request.requestId(), name, attempt + 1, candidates);

            Attempt result = forward(provider, request);

            if (result.reply() != null && result.reply().isSuccess()) {
                failoverManager.markHealthy(name);
                loadBalancer.updateResponseTime(name, result.elapsedMs());

                ObjectNode annotated = ResponseEnvelope.annotate(
                        result.reply().body(), name, result.elapsedMs(), failures);
                if (cacheable) {
                    cache.put(cacheKey, payload, annotated);
                }
                log.info("Request dispatched: requestId={}, model={}, provider={}, latencyMs={}, retries={}",
                        request.requestId(), request.model(), name, result.elapsedMs(), failures);
                return CompletionResponse.success(request.requestId(), request.model(),
                        ResponseEnvelope.withCacheFlag(annotated, false), name,
                        elapsedSince(startNanos), failures, false);
            }

            if (result.reply() != null && !result.reply().isRetryable()) {
                ProviderReply reply = result.reply();
                log.info("Upstream rejected request: requestId={}, provider={}, status={}",
                        request.requestId(), name, reply.statusCode());
                return new CompletionResponse(request.requestId(), request.model(), reply.statusCode(),
                        reply.body(), name, elapsedSince(startNanos), failures, false,
                        ErrorType.UPSTREAM_CLIENT_ERROR, "Provider " + name + " rejected the request");
            }

            if (!result.retryable()) {
                log.warn("Request not accepted by provider: requestId={}, provider={}, reason={}",
                        request.requestId(), name, result.message());
                return CompletionResponse.error(request.requestId(), request.model(), result.errorType(),
                                "Request could not be sent to provider " + name + ": " + result.message())
                        .withAttempts(name, elapsedSince(startNanos), failures);
            }

            Duration cooldown = backoffPolicy.cooldownFor(failoverManager.getConsecutiveFailures(name) + 1);
            failoverManager.markFailed(name, cooldown);
            metricsPipeline.publishAttemptFailed(request, name, result.errorType(), result.elapsedMs());
            candidates.remove(name);
            failures++;
            lastError = result.message();

            log.warn("Provider attempt failed: requestId={}, provider={}, errorType={}, reason={}, remaining={}",
                    request.requestId(), name, result.errorType(), result.message(), candidates.size());
        }

        log.error("All providers failed: requestId={}, model={}, attempts={}, lastProvider={}, lastError={}",
                request.requestId(), request.model(), failures, lastProvider, lastError);
        return CompletionResponse.error(request.requestId(), request.model(), ErrorType.ALL_PROVIDERS_FAILED,
                        "All providers failed after " + failures + " attempt(s)")
                .withAttempts(lastProvider, elapsedSince(startNanos), Math.max(0, failures - 1));
    }

    private List<String> candidatesFor(CompletionRequest request) {
        List<String> candidates = new ArrayList<>();
        for (String name : failoverManager.getAvailableProviders()) {
            registry.getProvider(name)
                    .map(Provider::descriptor)
                    .filter(ProviderDescriptor::enabled)
                    .filter(d -> d.supportsModel(request.model()))
                    .filter(d -> d.supportsType(request.type()))
                    .ifPresent(d -> candidates.add(name));
        }
        return candidates;
    }

    private Attempt forward(Provider provider, CompletionRequest request) {
        String name = provider.getName();
        Duration timeout = provider.descriptor().timeout() != null
                ? provider.descriptor().timeout()
                : requestTimeout;

        AtomicInteger counter = inFlight.computeIfAbsent(name, k -> new AtomicInteger());
        counter.incrementAndGet();
        loadBalancer.adjustConnections(name, 1);
        long startNanos = System.nanoTime();
        CompletableFuture<ProviderReply> future = null;
        try {
            future = provider.forward(request);
            ProviderReply reply = future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            long elapsed = elapsedSince(startNanos);
            if (reply.isRetryable()) {
                return Attempt.failed(ErrorType.PROVIDER_ERROR, "HTTP " + reply.statusCode(), elapsed, reply);
            }
            return new Attempt(reply, null, null, elapsed, true);
        } catch (TimeoutException e) {
            future.cancel(true);
            return Attempt.failed(ErrorType.TIMEOUT, "Timed out after " + timeout.toMillis() + "ms",
                    elapsedSince(startNanos), null);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof ProviderException) {
                return fromProviderException((ProviderException) cause, elapsedSince(startNanos));
            }
            return Attempt.failed(classify(cause), describe(cause), elapsedSince(startNanos), null);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            if (future != null) {
                future.cancel(true);
            }
            return Attempt.failed(ErrorType.PROVIDER_ERROR, "Interrupted", elapsedSince(startNanos), null);
        } catch (ProviderException e) {
            return fromProviderException(e, elapsedSince(startNanos));
        } finally {
            counter.decrementAndGet();
            loadBalancer.adjustConnections(name, -1);
        }
    }

    /**
     * A non-retryable provider exception describes a request the provider could not accept,
     * such as a payload the adapter cannot translate. It fails the request as a client error.
     */
    private static Attempt fromProviderException(ProviderException e, long elapsedMs) {
        if (!e.isRetryable()) {
            return new Attempt(null, ErrorType.CLIENT_ERROR, describe(e), elapsedMs, false);
        }
        return Attempt.failed(ErrorType.PROVIDER_ERROR, describe(e), elapsedMs, null);
    }

    private static ErrorType classify(Throwable cause) {
        if (cause instanceof HttpTimeoutException || cause instanceof TimeoutException) {
            return ErrorType.TIMEOUT;
        }
        return ErrorType.PROVIDER_ERROR;
    }

    private static String describe(Throwable cause) {
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }

    private static long elapsedSince(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }

    /**
     * Requests currently forwarded to a provider.
     */
    public int getInFlight(String provider) {
        AtomicInteger counter = inFlight.get(provider);
        return counter == null ? 0 : counter.get();
    }

    public boolean isCacheEnabled() {
        return cacheEnabled;
    }

    /**
     * Outcome of one forward. {@code retryable} is false only for failures that must not
     * penalise the provider or move on to the next candidate.
     */
    private record Attempt(ProviderReply reply, ErrorType errorType, String message, long elapsedMs,
                           boolean retryable) {

        static Attempt failed(ErrorType errorType, String message, long elapsedMs, ProviderReply reply) {
            return new Attempt(reply, errorType, message, elapsedMs, true);
        }
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private ProviderRegistry registry;
        private FailoverManager failoverManager;
        private LoadBalancer loadBalancer;
        private ResponseCache cache;
        private boolean cacheEnabled = true;
        private BackoffPolicy backoffPolicy = new BackoffPolicy();
        private RequestValidator validator = RequestValidator.withDefaults();
        private MetricsEventPipeline metricsPipeline;
        private Duration requestTimeout = Duration.ofSeconds(30);

        public Builder registry(ProviderRegistry registry) {
            this.registry = registry;
            return this;
        }

        public Builder failoverManager(FailoverManager failoverManager) {
            this.failoverManager = failoverManager;
            return this;
        }

        public Builder loadBalancer(LoadBalancer loadBalancer) {
            this.loadBalancer = loadBalancer;
            return this;
        }

        public Builder cache(ResponseCache cache) {
            this.cache = cache;
            return this;
        }

        public Builder cacheEnabled(boolean cacheEnabled) {
            this.cacheEnabled = cacheEnabled;
            return this;
        }

        public Builder backoffPolicy(BackoffPolicy backoffPolicy) {
            this.backoffPolicy = backoffPolicy;
            return this;
        }

        public Builder validator(RequestValidator validator) {
            this.validator = validator;
            return this;
        }

        public Builder metricsPipeline(MetricsEventPipeline metricsPipeline) {
            this.metricsPipeline = metricsPipeline;
            return this;
        }

        public Builder requestTimeout(Duration requestTimeout) {
            this.requestTimeout = requestTimeout;
            return this;
        }

        public Dispatcher build() {
            if (registry == null) {
                throw new IllegalStateException("ProviderRegistry is required");
            }
            if (failoverManager == null) {
                throw new IllegalStateException("FailoverManager is required");
            }
            if (loadBalancer == null) {
                throw new IllegalStateException("LoadBalancer is required");
            }
            if (cache == null) {
                throw new IllegalStateException("ResponseCache is required");
            }
            if (metricsPipeline == null) {
                throw new IllegalStateException("MetricsEventPipeline is required");
            }
            if (requestTimeout == null || requestTimeout.isZero() || requestTimeout.isNegative()) {
                throw new IllegalStateException("Request timeout must be positive");
            }
            return new Dispatcher(this);
        }
    }
}
