package fr.lapetina.aimux.api;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.sun.net.httpserver.Headers;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import fr.lapetina.aimux.cache.CacheStats;
import fr.lapetina.aimux.cache.CacheWarmer;
import fr.lapetina.aimux.cache.ResponseCache;
import fr.lapetina.aimux.dispatch.Dispatcher;
import fr.lapetina.aimux.dispatch.ResponseEnvelope;
import fr.lapetina.aimux.domain.model.CompletionRequest;
import fr.lapetina.aimux.domain.model.CompletionResponse;
import fr.lapetina.aimux.domain.model.ErrorType;
import fr.lapetina.aimux.domain.strategy.LoadBalancer;
import fr.lapetina.aimux.domain.strategy.LoadBalancingStrategy;
import fr.lapetina.aimux.domain.strategy.StrategyFactory;
import fr.lapetina.aimux.infrastructure.config.AimuxConfig;
import fr.lapetina.aimux.infrastructure.health.BackoffPolicy;
import fr.lapetina.aimux.infrastructure.health.FailoverManager;
import fr.lapetina.aimux.infrastructure.health.ProviderRegistry;
import fr.lapetina.aimux.infrastructure.health.ProviderStatus;
import fr.lapetina.aimux.infrastructure.metrics.MetricsRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Lightweight HTTP server using the JDK's built-in HttpServer.
 *
 * Endpoints:
 * - POST /v1/chat/completions - Dispatch a completion request
 * - POST /v1/completions - Alias of the above
 * - GET /health - UP, DEGRADED or DOWN from provider availability
 * - GET /status - Provider, cache and load balancer statistics
 * - GET /metrics - Prometheus metrics endpoint
 * - GET|POST /admin/strategy - Read or change the load balancing strategy
 * - POST /admin/failover/reset - Clear all provider failure state
 * - POST /admin/providers/{name}/healthy|failed - Force a provider's state
 * - POST /admin/cache/clear - Drop all cached responses
 * - POST /admin/cache/warm - Run the cache warm-up queries
 * - POST /admin/stats/reset - Reset cache and load balancer statistics
 */
public final class HttpServer implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(HttpServer.class);

    private final com.sun.net.httpserver.HttpServer server;
    private final ExecutorService executor;
    private final ObjectMapper objectMapper;
    private final AimuxConfig.ServerConfig serverConfig;
    private final Dispatcher dispatcher;
    private final ProviderRegistry providerRegistry;
    private final FailoverManager failoverManager;
    private final LoadBalancer loadBalancer;
    private final ResponseCache cache;
    private final CacheWarmer cacheWarmer;
    private final BackoffPolicy backoffPolicy;
    private final MetricsRegistry metricsRegistry;

    public HttpServer(
            AimuxConfig.ServerConfig serverConfig,
            Dispatcher dispatcher,
            ProviderRegistry providerRegistry,
            FailoverManager failoverManager,
            LoadBalancer loadBalancer,
            ResponseCache cache,
            CacheWarmer cacheWarmer,
            BackoffPolicy backoffPolicy,
            MetricsRegistry metricsRegistry
    ) throws IOException {
        this.serverConfig = serverConfig;
        this.dispatcher = dispatcher;
        this.providerRegistry = providerRegistry;
        this.failoverManager = failoverManager;
        this.loadBalancer = loadBalancer;
        this.cache = cache;
        this.cacheWarmer = cacheWarmer;
        this.backoffPolicy = backoffPolicy;
        this.metricsRegistry = metricsRegistry;

        this.objectMapper = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);

        this.server = com.sun.net.httpserver.HttpServer.create(
                new InetSocketAddress(serverConfig.getHost(), serverConfig.getPort()),
                serverConfig.getBacklog()
        );

        this.executor = Executors.newFixedThreadPool(
                serverConfig.getWorkerThreads(), new WorkerThreadFactory("http-worker"));
        server.setExecutor(executor);

        server.createContext("/v1/chat/completions", new CompletionHandler());
        server.createContext("/v1/completions", new CompletionHandler());
        server.createContext("/health", new HealthHandler());
        server.createContext("/status", new StatusHandler());
        server.createContext("/metrics", new MetricsHandler());
        server.createContext("/admin", new AdminHandler());

        log.info("HTTP server configured on {}:{}", serverConfig.getHost(), getPort());
    }

    public void start() {
        server.start();
        log.info("HTTP server started on port {}", getPort());
    }

    /**
     * Port actually bound, useful when configured with port 0.
     */
    public int getPort() {
        return server.getAddress().getPort();
    }

    @Override
    public void close() {
        server.stop(1);
        executor.shutdown();
        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }
        log.info("HTTP server stopped");
    }

    // ==================== COMPLETION HANDLER ====================

    private class CompletionHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            Headers headers = exchange.getRequestHeaders();
            String requestId = Optional.ofNullable(headers.getFirst("X-Request-ID"))
                    .filter(id -> !id.isBlank())
                    .orElseGet(() -> UUID.randomUUID().toString());
            String correlationId = Optional.ofNullable(headers.getFirst("X-Correlation-ID"))
                    .filter(id -> !id.isBlank())
                    .orElse(requestId);
            MDC.put("requestId", requestId);
            MDC.put("correlationId", correlationId);

            try {
                addCorsHeaders(exchange);
                exchange.getResponseHeaders().set("X-Request-ID", requestId);

                String method = exchange.getRequestMethod();
                if ("OPTIONS".equalsIgnoreCase(method)) {
                    exchange.sendResponseHeaders(204, -1);
                    exchange.close();
                    return;
                }
                if (!"POST".equalsIgnoreCase(method)) {
                    sendError(exchange, ErrorType.METHOD_NOT_ALLOWED, "Method Not Allowed", requestId);
                    return;
                }

                byte[] body = readBody(exchange);
                if (body == null) {
                    log.warn("Request body too large: limit={}", serverConfig.getMaxRequestBytes());
                    sendError(exchange, ErrorType.PAYLOAD_TOO_LARGE,
                            "Request body exceeds " + serverConfig.getMaxRequestBytes() + " bytes", requestId);
                    return;
                }

                JsonNode json;
                try {
                    json = objectMapper.readTree(body);
                } catch (JsonProcessingException e) {
                    sendError(exchange, ErrorType.CLIENT_ERROR, "Malformed JSON body", requestId);
                    return;
                }
                if (json == null || !json.isObject()) {
                    sendError(exchange, ErrorType.CLIENT_ERROR, "Request body must be a JSON object", requestId);
                    return;
                }

                CompletionRequest request = CompletionRequest.builder()
                        .requestId(requestId)
                        .correlationId(correlationId)
                        .payload((ObjectNode) json)
                        .authorization(headers.getFirst("Authorization"))
                        .apiKey(headers.getFirst("x-api-key"))
                        .build();

                CompletionResponse response = dispatcher.dispatch(request);
                sendCompletion(exchange, response);

            } catch (Exception e) {
                log.error("Error handling completion request", e);
                sendError(exchange, ErrorType.INTERNAL_ERROR, "Internal server error", requestId);
            } finally {
                MDC.clear();
            }
        }

        /**
         * Reads the body, or returns null when it exceeds the configured limit.
         */
        private byte[] readBody(HttpExchange exchange) throws IOException {
            long limit = serverConfig.getMaxRequestBytes();
            String contentLength = exchange.getRequestHeaders().getFirst("Content-Length");
            if (contentLength != null) {
                try {
                    if (Long.parseLong(contentLength.trim()) > limit) {
                        return null;
                    }
                } catch (NumberFormatException e) {
                    log.debug("Ignoring unparseable Content-Length: {}", contentLength);
                }
            }
            try (InputStream is = exchange.getRequestBody()) {
                byte[] bytes = is.readNBytes((int) Math.min(Integer.MAX_VALUE - 8, limit + 1));
                return bytes.length > limit ? null : bytes;
            }
        }

        private void sendCompletion(HttpExchange exchange, CompletionResponse response) throws IOException {
            if (response.isSuccess()) {
                sendJson(exchange, 200, response.body());
            } else if (response.errorType() == ErrorType.UPSTREAM_CLIENT_ERROR && response.body() != null) {
                sendJson(exchange, response.statusCode(), response.body());
            } else {
                sendJson(exchange, response.statusCode(),
                        ResponseEnvelope.error(response.errorType(), response.errorMessage(), response.requestId()));
            }
        }
    }

    // ==================== HEALTH HANDLER ====================

    private class HealthHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                sendError(exchange, ErrorType.METHOD_NOT_ALLOWED, "Method Not Allowed", null);
                return;
            }

            List<String> providers = providerRegistry.getEnabledNames();
            long available = providers.stream().filter(failoverManager::isAvailable).count();

            String status;
            if (available == 0) {
                status = "DOWN";
            } else if (available < providers.size()) {
                status = "DEGRADED";
            } else {
                status = "UP";
            }

            Map<String, Object> health = new LinkedHashMap<>();
            health.put("status", status);
            health.put("timestamp", System.currentTimeMillis());
            health.put("providers", providers.size());
            health.put("availableProviders", available);

            sendJson(exchange, "DOWN".equals(status) ? 503 : 200, health);
        }
    }

    // ==================== STATUS HANDLER ====================

    private class StatusHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                sendError(exchange, ErrorType.METHOD_NOT_ALLOWED, "Method Not Allowed", null);
                return;
            }

            List<Map<String, Object>> providers = new ArrayList<>();
            for (ProviderStatus status : failoverManager.getStatistics()) {
                Map<String, Object> info = new LinkedHashMap<>();
                info.put("name", status.name());
                info.put("available", status.available());
                info.put("failed", status.failed());
                info.put("failedAt", status.failedAt());
                info.put("cooldownMs", status.cooldown().toMillis());
                info.put("cooldownRemainingMs", status.cooldownRemaining().toMillis());
                info.put("failureCount", status.failureCount());
                info.put("consecutiveFailures", status.consecutiveFailures());
                info.put("inFlight", dispatcher.getInFlight(status.name()));
                providers.add(info);
            }

            Map<String, Object> body = new LinkedHashMap<>();
            body.put("providers", providers);
            body.put("cache", cacheStats());
            body.put("loadBalancer", loadBalancer.getStatistics());
            sendJson(exchange, 200, body);
        }

        private Map<String, Object> cacheStats() {
            CacheStats stats = cache.getStats();
            Map<String, Object> info = new LinkedHashMap<>();
            info.put("enabled", dispatcher.isCacheEnabled());
            info.put("keyStrategy", cache.getKeyStrategy().name().toLowerCase(Locale.ROOT));
            info.put("entries", stats.entries());
            info.put("memoryUsageBytes", stats.memoryUsageBytes());
            info.put("hits", stats.hits());
            info.put("misses", stats.misses());
            info.put("hitRate", stats.hitRate());
            info.put("evictions", stats.evictions());
            info.put("expirations", stats.expirations());
            return info;
        }
    }

    // ==================== METRICS HANDLER ====================

    private class MetricsHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"GET".equalsIgnoreCase(exchange.getRequestMethod())) {
                sendError(exchange, ErrorType.METHOD_NOT_ALLOWED, "Method Not Allowed", null);
                return;
            }

            String metrics = metricsRegistry.scrape();
            exchange.getResponseHeaders().set("Content-Type", "text/plain; version=0.0.4");
            byte[] bytes = metrics.getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(200, bytes.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(bytes);
            }
        }
    }

    // ==================== ADMIN HANDLER ====================

    private class AdminHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            String path = exchange.getRequestURI().getPath();
            String method = exchange.getRequestMethod();

            try {
                if (path.equals("/admin/strategy") && "GET".equals(method)) {
                    handleGetStrategy(exchange);
                } else if (path.equals("/admin/strategy") && "POST".equals(method)) {
                    handleChangeStrategy(exchange);
                } else if (path.equals("/admin/failover/reset") && "POST".equals(method)) {
                    failoverManager.reset();
                    sendJson(exchange, 200, Map.of("message", "Failover state reset"));
                } else if (path.matches("/admin/providers/[^/]+/healthy") && "POST".equals(method)) {
                    handleProviderAction(exchange, path, true);
                } else if (path.matches("/admin/providers/[^/]+/failed") && "POST".equals(method)) {
                    handleProviderAction(exchange, path, false);
                } else if (path.equals("/admin/cache/clear") && "POST".equals(method)) {
                    int entries = cache.size();
                    cache.clear();
                    sendJson(exchange, 200, Map.of("message", "Cache cleared", "entries", entries));
                } else if (path.equals("/admin/cache/warm") && "POST".equals(method)) {
                    sendJson(exchange, 200, cacheWarmer.warm());
                } else if (path.equals("/admin/stats/reset") && "POST".equals(method)) {
                    cache.resetStats();
                    loadBalancer.resetStatistics();
                    sendJson(exchange, 200, Map.of("message", "Statistics reset"));
                } else {
                    sendError(exchange, 404, "NOT_FOUND", "Not Found", null);
                }
            } catch (Exception e) {
                log.error("Error in admin handler: path={}, method={}", path, method, e);
                sendError(exchange, ErrorType.INTERNAL_ERROR, "Internal server error", null);
            }
        }

        private void handleGetStrategy(HttpExchange exchange) throws IOException {
            sendJson(exchange, 200, Map.of(
                    "current", loadBalancer.getStrategy().getName(),
                    "available", StrategyFactory.getRegisteredNames()
            ));
        }

        private void handleChangeStrategy(HttpExchange exchange) throws IOException {
            JsonNode request;
            try (InputStream is = exchange.getRequestBody()) {
                request = objectMapper.readTree(is);
            } catch (JsonProcessingException e) {
                sendError(exchange, ErrorType.CLIENT_ERROR, "Malformed JSON body", null);
                return;
            }

            String strategyName = request == null ? null : request.path("strategy").asText(null);
            if (strategyName == null || strategyName.isBlank()) {
                sendError(exchange, ErrorType.CLIENT_ERROR, "Missing 'strategy' field", null);
                return;
            }

            Optional<LoadBalancingStrategy> strategy = StrategyFactory.create(strategyName);
            if (strategy.isEmpty()) {
                sendError(exchange, ErrorType.CLIENT_ERROR, "Unknown strategy: " + strategyName +
                        ". Available: " + StrategyFactory.getRegisteredNames(), null);
                return;
            }

            loadBalancer.setStrategy(strategy.get());
            sendJson(exchange, 200, Map.of(
                    "strategy", strategy.get().getName(),
                    "message", "Strategy changed successfully"
            ));
        }

        private void handleProviderAction(HttpExchange exchange, String path, boolean healthy) throws IOException {
            String name = path.split("/")[3];
            if (!failoverManager.getProviders().contains(name)) {
                sendError(exchange, 404, "NOT_FOUND", "Provider not found: " + name, null);
                return;
            }

            if (healthy) {
                failoverManager.markHealthy(name);
            } else {
                failoverManager.markFailed(name, backoffPolicy.cooldownFor(failoverManager.getConsecutiveFailures(name) + 1));
            }
            log.info("Provider state forced by admin: provider={}, action={}", name, healthy ? "healthy" : "failed");

            sendJson(exchange, 200, Map.of(
                    "provider", name,
                    "action", healthy ? "healthy" : "failed",
                    "available", failoverManager.isAvailable(name)
            ));
        }
    }

    // ==================== HELPER METHODS ====================

    private void addCorsHeaders(HttpExchange exchange) {
        Headers headers = exchange.getResponseHeaders();
        headers.set("Access-Control-Allow-Origin", serverConfig.getCorsAllowedOrigin());
        headers.set("Access-Control-Allow-Methods", "POST, OPTIONS");
        headers.set("Access-Control-Allow-Headers",
                "Content-Type, Authorization, x-api-key, X-Request-ID, X-Correlation-ID");
    }

    private void sendJson(HttpExchange exchange, int statusCode, Object body) throws IOException {
        byte[] bytes = objectMapper.writeValueAsBytes(body);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        exchange.sendResponseHeaders(statusCode, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    private void sendError(HttpExchange exchange, ErrorType errorType, String message, String requestId)
            throws IOException {
        sendJson(exchange, CompletionResponse.statusFor(errorType),
                ResponseEnvelope.error(errorType, message, requestId));
    }

    private void sendError(HttpExchange exchange, int statusCode, String type, String message, String requestId)
            throws IOException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", Map.of("type", type, "message", message));
        if (requestId != null) {
            body.put("request_id", requestId);
        }
        sendJson(exchange, statusCode, body);
    }

    private static class WorkerThreadFactory implements ThreadFactory {
        private final String namePrefix;
        private final AtomicInteger counter = new AtomicInteger(0);

        WorkerThreadFactory(String namePrefix) {
            this.namePrefix = namePrefix;
        }

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, namePrefix + "-" + counter.getAndIncrement());
            t.setDaemon(true);
            return t;
        }
    }
}
