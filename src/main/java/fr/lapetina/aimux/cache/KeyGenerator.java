package fr.lapetina.aimux.cache;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Derives cache keys from a model name and a request payload.
 *
 * <ul>
 *   <li>{@code HASHING}: 64-bit FNV-1a over the model and the canonical (key-sorted) JSON payload.</li>
 *   <li>{@code SEMANTIC}: hashes only normalized core content, so volatile metadata such as
 *       request ids, users or timestamps does not split the cache.</li>
 *   <li>{@code PARAMETER}: readable key listing model, sampling parameters and messages; no hashing.</li>
 * </ul>
 *
 * Instances hold no mutable state and are safe to share.
 */
public final class KeyGenerator {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private static final long FNV_OFFSET_BASIS = 0xcbf29ce484222325L;
    private static final long FNV_PRIME = 0x100000001b3L;

    private static final List<String> SEMANTIC_PARAMETERS =
            List.of("max_tokens", "temperature", "top_p", "stop");

    private final KeyStrategy strategy;

    public KeyGenerator(KeyStrategy strategy) {
        this.strategy = Objects.requireNonNull(strategy, "Key strategy is required");
    }

    public KeyStrategy getStrategy() {
        return strategy;
    }

    /**
     * Returns the cache key for a request. Never throws for malformed payloads.
     */
    public String generate(String model, JsonNode request) {
        String safeModel = model != null ? model : "";
        return switch (strategy) {
            case HASHING -> hashKey(safeModel, request);
            case SEMANTIC -> semanticKey(safeModel, request);
            case PARAMETER -> parameterKey(safeModel, request);
        };
    }

    private String hashKey(String model, JsonNode request) {
        return fnv1aHex(model + "|" + canonicalJson(request));
    }

    private String semanticKey(String model, JsonNode request) {
        ObjectNode core = extractCoreContent(request);
        if (core == null) {
            return hashKey(model, request);
        }
        return fnv1aHex(model + "|" + canonicalJson(core));
    }

    private String parameterKey(String model, JsonNode request) {
        JsonNode body = request != null ? request : JsonNodeFactory.instance.nullNode();
        StringBuilder key = new StringBuilder(model)
                .append("|max_tokens=").append(body.path("max_tokens").asText(""))
                .append("|temperature=").append(body.path("temperature").asText(""))
                .append("|messages=").append(canonicalJson(body.get("messages")));
        JsonNode prompt = body.get("prompt");
        if (prompt != null) {
            key.append("|prompt=").append(canonicalJson(prompt));
        }
        return key.toString();
    }

    /**
     * Pulls the fields that determine a completion's content, with text normalized.
     * Returns {@code null} when neither messages nor a prompt can be found.
     */
    static ObjectNode extractCoreContent(JsonNode request) {
        if (request == null || !request.isObject()) {
            return null;
        }
        JsonNode messages = request.get("messages");
        JsonNode prompt = request.get("prompt");
        boolean hasMessages = messages != null && messages.isArray();
        boolean hasPrompt = prompt != null && prompt.isTextual();
        if (!hasMessages && !hasPrompt) {
            return null;
        }

        ObjectNode core = JsonNodeFactory.instance.objectNode();
        if (hasMessages) {
            ArrayNode normalized = core.putArray("messages");
            for (JsonNode message : messages) {
                ObjectNode entry = normalized.addObject();
                entry.put("role", normalize(message.path("role").asText("")));
                entry.put("content", normalize(textOf(message.get("content"))));
            }
        }
        if (hasPrompt) {
            core.put("prompt", normalize(prompt.asText()));
        }
        JsonNode system = request.get("system");
        if (system != null && !system.isNull()) {
            core.put("system", normalize(textOf(system)));
        }
        JsonNode tools = request.get("tools");
        if (tools != null && !tools.isNull()) {
            core.set("tools", tools);
        }
        for (String parameter : SEMANTIC_PARAMETERS) {
            JsonNode value = request.get(parameter);
            if (value != null && !value.isNull()) {
                core.set(parameter, value);
            }
        }
        return core;
    }

    private static String textOf(JsonNode content) {
        if (content == null || content.isNull()) {
            return "";
        }
        if (content.isTextual()) {
            return content.asText();
        }
        if (content.isArray()) {
            List<String> parts = new ArrayList<>();
            for (JsonNode part : content) {
                if (part.isTextual()) {
                    parts.add(part.asText());
                } else if (part.has("text")) {
                    parts.add(part.get("text").asText());
                } else {
                    parts.add(canonicalJson(part));
                }
            }
            return String.join(" ", parts);
        }
        return canonicalJson(content);
    }

    private static String normalize(String text) {
        return text.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }

    /**
     * Serializes a JSON tree with object keys sorted at every level.
     */
    static String canonicalJson(JsonNode node) {
        if (node == null) {
            return "null";
        }
        try {
            return MAPPER.writeValueAsString(sorted(node));
        } catch (JsonProcessingException e) {
            // Trees built by Jackson always serialize; fall back to the default rendering
            return node.toString();
        }
    }

    private static JsonNode sorted(JsonNode node) {
        if (node.isObject()) {
            List<String> names = new ArrayList<>();
            Iterator<String> it = node.fieldNames();
            it.forEachRemaining(names::add);
            Collections.sort(names);
            ObjectNode result = JsonNodeFactory.instance.objectNode();
            for (String name : names) {
                result.set(name, sorted(node.get(name)));
            }
            return result;
        }
        if (node.isArray()) {
            ArrayNode result = JsonNodeFactory.instance.arrayNode();
            for (JsonNode element : node) {
                result.add(sorted(element));
            }
            return result;
        }
        return node;
    }

    static String fnv1aHex(String input) {
        long hash = FNV_OFFSET_BASIS;
        for (byte b : input.getBytes(StandardCharsets.UTF_8)) {
            hash ^= (b & 0xff);
            hash *= FNV_PRIME;
        }
        return String.format("%016x", hash);
    }

    /**
     * Key derivation strategy, selected per deployment.
     */
    public enum KeyStrategy {
        HASHING,
        SEMANTIC,
        PARAMETER;

        public static KeyStrategy fromName(String name) {
            if (name == null || name.isBlank()) {
                return HASHING;
            }
            try {
                return valueOf(name.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new IllegalArgumentException("Unknown cache key strategy: " + name
                        + ". Available: hashing, semantic, parameter", e);
            }
        }
    }
}
