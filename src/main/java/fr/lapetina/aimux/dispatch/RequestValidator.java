package fr.lapetina.aimux.dispatch;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import fr.lapetina.aimux.domain.model.CompletionRequest;
import fr.lapetina.aimux.infrastructure.config.AimuxConfig;

import java.util.Set;

/**
 * Checks the shape of a completion request before any provider is contacted.
 *
 * Validates:
 * - model is present and, when an allow-list is configured, allowed
 * - a {@code messages} array or a {@code prompt} string is present
 * - every message is an object with a role
 * - prompt and message text stay within the configured length
 */
public final class RequestValidator {

    private final Set<String> allowedModels;
    private final int maxPromptLength;

    public RequestValidator(Set<String> allowedModels, int maxPromptLength) {
        this.allowedModels = allowedModels == null ? Set.of() : Set.copyOf(allowedModels);
        this.maxPromptLength = maxPromptLength;
    }

    /**
     * Creates a validator with no model restrictions and default prompt length.
     */
    public static RequestValidator withDefaults() {
        return new RequestValidator(Set.of(), 100_000);
    }

    public static RequestValidator fromConfig(AimuxConfig.ValidationConfig config) {
        return new RequestValidator(config.getAllowedModels(), config.getMaxPromptLength());
    }

    public void validate(CompletionRequest request) throws ValidationException {
        if (request == null) {
            throw new ValidationException("Request is null");
        }

        String model = request.model();
        if (model == null || model.isBlank()) {
            throw new ValidationException("Model name is required");
        }
        if (!allowedModels.isEmpty() && !allowedModels.contains(model)) {
            throw new ValidationException("Model not allowed: " + model);
        }

        ObjectNode payload = request.payload();
        JsonNode messages = payload.get("messages");
        JsonNode prompt = payload.get("prompt");

        boolean hasMessages = messages != null && messages.isArray() && !messages.isEmpty();
        boolean hasPrompt = prompt != null && prompt.isTextual() && !prompt.asText().isBlank();
        if (!hasMessages && !hasPrompt) {
            throw new ValidationException("Either prompt or messages must be provided");
        }
        if (messages != null && !messages.isNull() && !messages.isArray()) {
            throw new ValidationException("Messages must be an array");
        }

        if (hasPrompt && prompt.asText().length() > maxPromptLength) {
            throw new ValidationException("Prompt exceeds maximum length of " + maxPromptLength);
        }

        if (hasMessages) {
            for (JsonNode message : messages) {
                validateMessage(message);
            }
        }
    }

    private void validateMessage(JsonNode message) throws ValidationException {
        if (!message.isObject()) {
            throw new ValidationException("Each message must be an object");
        }
        JsonNode role = message.get("role");
        if (role == null || !role.isTextual() || role.asText().isBlank()) {
            throw new ValidationException("Message role is required");
        }
        if (contentLength(message.get("content")) > maxPromptLength) {
            throw new ValidationException("Message content exceeds maximum length");
        }
    }

    private static int contentLength(JsonNode content) {
        if (content == null || content.isNull()) {
            return 0;
        }
        if (content.isTextual()) {
            return content.asText().length();
        }
        int length = 0;
        if (content.isArray()) {
            for (JsonNode part : content) {
                JsonNode text = part.get("text");
                if (text != null && text.isTextual()) {
                    length += text.asText().length();
                }
            }
        }
        return length;
    }

    /**
     * Raised when a request is rejected; the message is safe to return to the caller.
     */
    public static class ValidationException extends Exception {
        public ValidationException(String message) {
            super(message);
        }
    }
}
