package fr.lapetina.aimux.domain.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Instant;
import java.util.Objects;
import java.util.UUID;

/**
 * A completion request accepted from a caller and routed to one provider.
 * The JSON payload is copied on construction and on access, so instances are immutable.
 */
public record CompletionRequest(
        String requestId,
        String correlationId,
        String model,
        ObjectNode payload,
        boolean stream,
        String authorization,
        String apiKey,
        RequestType type,
        Instant createdAt
) {
    public CompletionRequest {
        Objects.requireNonNull(payload, "Payload is required");
        payload = payload.deepCopy();
        if (requestId == null) {
            requestId = UUID.randomUUID().toString();
        }
        if (correlationId == null) {
            correlationId = requestId;
        }
        if (model == null) {
            JsonNode modelNode = payload.get("model");
            model = modelNode != null && modelNode.isTextual() ? modelNode.asText() : null;
        }
        if (type == null) {
            type = RequestType.classify(model, payload);
        }
        if (createdAt == null) {
            createdAt = Instant.now();
        }
    }

    @Override
    public ObjectNode payload() {
        return payload.deepCopy();
    }

    /**
     * Creates a request from a raw JSON body, deriving model, stream flag and request type.
     */
    public static CompletionRequest fromPayload(ObjectNode payload) {
        return builder().payload(payload).build();
    }

    /**
     * Creates a single-turn chat request.
     */
    public static CompletionRequest ofChat(String model, String userMessage) {
        ObjectNode payload = JsonNodeFactory.instance.objectNode();
        payload.put("model", model);
        ArrayNode messages = payload.putArray("messages");
        messages.addObject().put("role", "user").put("content", userMessage);
        return fromPayload(payload);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String requestId;
        private String correlationId;
        private String model;
        private ObjectNode payload;
        private Boolean stream;
        private String authorization;
        private String apiKey;
        private RequestType type;
        private Instant createdAt;

        public Builder requestId(String requestId) {
            this.requestId = requestId;
            return this;
        }

        public Builder correlationId(String correlationId) {
            this.correlationId = correlationId;
            return this;
        }

        public Builder model(String model) {
            this.model = model;
            return this;
        }

        public Builder payload(ObjectNode payload) {
            this.payload = payload;
            return this;
        }

        public Builder stream(boolean stream) {
            this.stream = stream;
            return this;
        }

        public Builder authorization(String authorization) {
            this.authorization = authorization;
            return this;
        }

        public Builder apiKey(String apiKey) {
            this.apiKey = apiKey;
            return this;
        }

        public Builder type(RequestType type) {
            this.type = type;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public CompletionRequest build() {
            boolean streaming = stream != null
                    ? stream
                    : payload != null && payload.path("stream").asBoolean(false);
            return new CompletionRequest(
                    requestId, correlationId, model, payload, streaming,
                    authorization, apiKey, type, createdAt
            );
        }
    }
}
