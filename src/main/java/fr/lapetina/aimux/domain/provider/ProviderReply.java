package fr.lapetina.aimux.domain.provider;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Raw answer from a provider: HTTP status plus parsed body.
 */
public record ProviderReply(int statusCode, JsonNode body) {

    public boolean isSuccess() {
        return statusCode >= 200 && statusCode < 300;
    }

    /**
     * True for statuses that say the provider, not the request, is at fault.
     */
    public boolean isRetryable() {
        return statusCode >= 500 || statusCode == 408 || statusCode == 429;
    }
}
