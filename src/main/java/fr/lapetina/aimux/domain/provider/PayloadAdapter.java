package fr.lapetina.aimux.domain.provider;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Field-level translation between the generic request shape and a vendor schema.
 * Vendor adapters are supplied from outside; the default passes payloads through.
 */
public interface PayloadAdapter {

    ObjectNode toProvider(ObjectNode request);

    JsonNode fromProvider(JsonNode response);

    static PayloadAdapter identity() {
        return new PayloadAdapter() {
            @Override
            public ObjectNode toProvider(ObjectNode request) {
                return request;
            }

            @Override
            public JsonNode fromProvider(JsonNode response) {
                return response;
            }
        };
    }
}
