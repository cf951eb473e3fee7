package fr.lapetina.aimux.infrastructure.http;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import fr.lapetina.aimux.domain.model.CompletionRequest;
import fr.lapetina.aimux.domain.model.ProviderDescriptor;
import fr.lapetina.aimux.domain.provider.PayloadAdapter;
import fr.lapetina.aimux.domain.provider.Provider;
import fr.lapetina.aimux.domain.provider.ProviderException;
import fr.lapetina.aimux.domain.provider.ProviderReply;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;

/**
 * {@link Provider} that talks JSON over HTTP(S) using {@code java.net.http.HttpClient}.
 *
 * <p>Requests go to {@code endpoint + completionPath}. Credentials configured on the provider
 * take precedence over the ones the caller sent. Any HTTP answer completes the future
 * normally; transport failures and unreadable success bodies complete it exceptionally.
 */
public class HttpProvider implements Provider {

    private static final Logger log = LoggerFactory.getLogger(HttpProvider.class);

    static final String USER_AGENT = "aimux-dispatcher/1.0";

    private static final Set<String> RESTRICTED_HEADERS =
            Set.of("connection", "content-length", "expect", "host", "upgrade");

    private final ProviderDescriptor descriptor;
    private final HttpClient httpClient;
    private final PayloadAdapter adapter;
    private final ObjectMapper objectMapper;
    private final Duration healthCheckTimeout;

    public HttpProvider(
            ProviderDescriptor descriptor,
            HttpClient httpClient,
            PayloadAdapter adapter,
            Duration healthCheckTimeout
    ) {
        this.descriptor = descriptor;
        this.httpClient = httpClient;
        this.adapter = adapter;
        this.healthCheckTimeout = healthCheckTimeout;
        this.objectMapper = new ObjectMapper()
                .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
    }

    public HttpProvider(ProviderDescriptor descriptor, HttpClient httpClient) {
        this(descriptor, httpClient, PayloadAdapter.identity(), Duration.ofSeconds(5));
    }

    /**
     * Creates the HTTP client shared by all providers.
     */
    public static HttpClient newHttpClient(Duration connectTimeout) {
        return HttpClient.newBuilder()
                .connectTimeout(connectTimeout)
                .version(HttpClient.Version.HTTP_1_1)
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
    }

    @Override
    public ProviderDescriptor descriptor() {
        return descriptor;
    }

    @Override
    public CompletableFuture<ProviderReply> forward(CompletionRequest request) {
        HttpRequest httpRequest;
        try {
            httpRequest = buildHttpRequest(request);
        } catch (Exception e) {
            log.error("Failed to build request: provider={}, requestId={}", descriptor.name(), request.requestId(), e);
            return CompletableFuture.failedFuture(new ProviderException(
                    descriptor.name(), 0, false, "Failed to build request: " + e.getMessage()));
        }

        Instant startTime = Instant.now();
        log.info("Forwarding request: provider={}, requestId={}, model={}, endpoint={}",
                descriptor.name(), request.requestId(), request.model(), httpRequest.uri());

        return httpClient.sendAsync(httpRequest, HttpResponse.BodyHandlers.ofString())
                .thenApply(response -> handleResponse(request, response, startTime));
    }

    private HttpRequest buildHttpRequest(CompletionRequest request) throws JsonProcessingException {
        ObjectNode payload = adapter.toProvider(request.payload());
        String body = objectMapper.writeValueAsString(payload);

        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(resolve(descriptor.completionPath()))
                .header("Content-Type", "application/json")
                .header("Accept", "application/json")
                .header("User-Agent", USER_AGENT)
                .header("X-Request-ID", request.requestId())
                .header("X-Correlation-ID", request.correlationId())
                .POST(HttpRequest.BodyPublishers.ofString(body));

        if (descriptor.timeout() != null) {
            builder.timeout(descriptor.timeout());
        }

        applyCredentials(builder, request.authorization(), request.apiKey());
        for (Map.Entry<String, String> header : descriptor.headers().entrySet()) {
            if (!RESTRICTED_HEADERS.contains(header.getKey().toLowerCase(Locale.ROOT))) {
                builder.setHeader(header.getKey(), header.getValue());
            }
        }
        return builder.build();
    }

    private void applyCredentials(HttpRequest.Builder builder, String inboundAuthorization, String inboundApiKey) {
        if (descriptor.hasApiKey()) {
            builder.header("Authorization", "Bearer " + descriptor.apiKey());
            builder.header("x-api-key", descriptor.apiKey());
            return;
        }
        if (inboundAuthorization != null && !inboundAuthorization.isBlank()) {
            builder.header("Authorization", inboundAuthorization);
        }
        if (inboundApiKey != null && !inboundApiKey.isBlank()) {
            builder.header("x-api-key", inboundApiKey);
        }
    }

    private URI resolve(String path) {
        String base = descriptor.endpoint().toString();
        if (base.endsWith("/")) {
            base = base.substring(0, base.length() - 1);
        }
        return URI.create(base + (path.startsWith("/") ? path : "/" + path));
    }

    private ProviderReply handleResponse(
            CompletionRequest request,
            HttpResponse<String> response,
            Instant startTime
    ) {
        long latencyMs = Duration.between(startTime, Instant.now()).toMillis();
        int statusCode = response.statusCode();
        JsonNode body = parseBody(response.body());

        if (statusCode >= 200 && statusCode < 300) {
            if (body == null) {
                log.warn("Provider returned unreadable body: provider={}, requestId={}, status={}, latencyMs={}",
                        descriptor.name(), request.requestId(), statusCode, latencyMs);
                throw new ProviderException(descriptor.name(), statusCode, true,
                        "Provider returned a non-JSON body");
            }
            log.info("Request successful: provider={}, requestId={}, model={}, status={}, latencyMs={}",
                    descriptor.name(), request.requestId(), request.model(), statusCode, latencyMs);
            return new ProviderReply(statusCode, adapter.fromProvider(body));
        }

        log.warn("Request failed with HTTP error: provider={}, requestId={}, model={}, status={}, latencyMs={}",
                descriptor.name(), request.requestId(), request.model(), statusCode, latencyMs);
        if (body == null) {
            ObjectNode error = objectMapper.createObjectNode();
            error.putObject("error").put("message", "HTTP " + statusCode);
            body = error;
        }
        return new ProviderReply(statusCode, body);
    }

    private JsonNode parseBody(String body) {
        if (body == null || body.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            return null;
        }
    }

    /**
     * GETs the provider's health path. Any answer below 500 counts as healthy: the
     * provider is reachable even when it rejects an unauthenticated probe.
     */
    @Override
    public CompletableFuture<Boolean> healthCheck() {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(resolve(descriptor.healthPath()))
                .timeout(healthCheckTimeout)
                .header("User-Agent", USER_AGENT)
                .GET();
        if (descriptor.hasApiKey()) {
            builder.header("Authorization", "Bearer " + descriptor.apiKey());
        }
        HttpRequest request = builder.build();

        log.debug("Health check started: provider={}, uri={}", descriptor.name(), request.uri());

        return httpClient.sendAsync(request, HttpResponse.BodyHandlers.discarding())
                .thenApply(response -> {
                    boolean healthy = response.statusCode() < 500;
                    if (healthy) {
                        log.debug("Health check passed: provider={}, status={}", descriptor.name(), response.statusCode());
                    } else {
                        log.warn("Health check failed: provider={}, status={}", descriptor.name(), response.statusCode());
                    }
                    return healthy;
                })
                .exceptionally(ex -> {
                    log.warn("Health check error: provider={}, error={}", descriptor.name(), ex.getMessage());
                    return false;
                });
    }
}
