package fr.lapetina.aimux.domain.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Locale;

/**
 * Coarse classification of a completion request, used for capability-based routing.
 */
public enum RequestType {
    REGULAR,
    THINKING,
    VISION,
    TOOLS;

    /**
     * Classifies a raw request body. Tools take precedence over vision, vision over thinking.
     */
    public static RequestType classify(String model, JsonNode body) {
        if (body != null) {
            JsonNode tools = body.get("tools");
            if (tools != null && tools.isArray() && !tools.isEmpty()) {
                return TOOLS;
            }
            if (hasImageContent(body.get("messages"))) {
                return VISION;
            }
        }
        if (model != null && model.toLowerCase(Locale.ROOT).contains("thinking")) {
            return THINKING;
        }
        return REGULAR;
    }

    private static boolean hasImageContent(JsonNode messages) {
        if (messages == null || !messages.isArray()) {
            return false;
        }
        for (JsonNode message : messages) {
            JsonNode content = message.get("content");
            if (content == null || !content.isArray()) {
                continue;
            }
            for (JsonNode part : content) {
                if ("image_url".equals(part.path("type").asText())) {
                    return true;
                }
            }
        }
        return false;
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
