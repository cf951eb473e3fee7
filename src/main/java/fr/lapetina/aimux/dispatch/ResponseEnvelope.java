package fr.lapetina.aimux.dispatch;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import fr.lapetina.aimux.domain.model.ErrorType;

import java.util.Optional;

/**
 * Builds the JSON bodies returned to callers.
 *
 * <p>Dispatch annotations are only added when the provider body does not already carry a
 * field of the same name.
 */
public final class ResponseEnvelope {

    public static final String PROVIDER = "provider";
    public static final String RESPONSE_TIME = "response_time";
    public static final String CACHE = "cache";
    public static final String METADATA = "metadata";
    public static final String ROUTING_DECISION = "routing_decision";

    private static final String PROVIDER_PREFIX = "provider:";

    private ResponseEnvelope() {
    }

    /**
     * Adds provider, timing and routing metadata to a provider body. The result carries no
     * cache flag and is the form stored in the cache.
     */
    public static ObjectNode annotate(JsonNode providerBody, String provider, long responseTimeMs, int retryCount) {
        ObjectNode envelope;
        if (providerBody != null && providerBody.isObject()) {
            envelope = ((ObjectNode) providerBody).deepCopy();
        } else {
            envelope = JsonNodeFactory.instance.objectNode();
            envelope.set("data", providerBody == null ? JsonNodeFactory.instance.nullNode() : providerBody.deepCopy());
        }

        if (!envelope.has(PROVIDER)) {
            envelope.put(PROVIDER, provider);
        }
        if (!envelope.has(RESPONSE_TIME)) {
            envelope.put(RESPONSE_TIME, responseTimeMs);
        }

        JsonNode existing = envelope.get(METADATA);
        if (existing == null || existing.isNull()) {
            existing = envelope.putObject(METADATA);
        }
        if (existing.isObject()) {
            ObjectNode metadata = (ObjectNode) existing;
            if (!metadata.has(ROUTING_DECISION)) {
                metadata.put(ROUTING_DECISION, PROVIDER_PREFIX + provider + ";retries:" + retryCount);
            }
            if (!metadata.has("retry_count")) {
                metadata.put("retry_count", retryCount);
            }
            if (!metadata.has("fallback_used")) {
                metadata.put("fallback_used", retryCount > 0);
            }
        }
        return envelope;
    }

    /**
     * Provider name recorded in {@code metadata.routing_decision}, if the body carries one.
     * The top-level {@code provider} field may be the upstream's own and is not consulted.
     */
    public static Optional<String> routedProvider(JsonNode annotated) {
        String decision = annotated.path(METADATA).path(ROUTING_DECISION).asText("");
        if (!decision.startsWith(PROVIDER_PREFIX)) {
            return Optional.empty();
        }
        int end = decision.indexOf(';');
        String name = decision.substring(PROVIDER_PREFIX.length(), end < 0 ? decision.length() : end);
        return name.isEmpty() || "null".equals(name) ? Optional.empty() : Optional.of(name);
    }

    /**
     * Returns a copy of an annotated body carrying the cache flag.
     */
    public static ObjectNode withCacheFlag(JsonNode annotated, boolean cached) {
        ObjectNode copy = annotated.isObject()
                ? ((ObjectNode) annotated).deepCopy()
                : annotate(annotated, null, 0, 0);
        if (!copy.has(CACHE)) {
            copy.put(CACHE, cached);
        }
        return copy;
    }

    /**
     * {@code {"error": {"type": ..., "message": ...}, "request_id": ...}}
     */
    public static ObjectNode error(ErrorType errorType, String message, String requestId) {
        ObjectNode body = JsonNodeFactory.instance.objectNode();
        ObjectNode error = body.putObject("error");
        error.put("type", errorType.name());
        error.put("message", message);
        if (requestId != null) {
            body.put("request_id", requestId);
        }
        return body;
    }
}
