package fr.lapetina.aimux.domain.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Objects;

/**
 * Outcome of dispatching one completion request.
 *
 * <p>On success {@code body} holds the annotated provider response. On failure
 * {@code errorType} and {@code errorMessage} are set and {@code body} may carry
 * the upstream error payload for pass-through 4xx responses.
 */
public record CompletionResponse(
        String requestId,
        String model,
        int statusCode,
        JsonNode body,
        String provider,
        long elapsedMs,
        int retryCount,
        boolean cacheHit,
        ErrorType errorType,
        String errorMessage
) {
    public CompletionResponse {
        Objects.requireNonNull(requestId, "Request ID is required");
        if (body != null) {
            body = body.deepCopy();
        }
    }

    public boolean isSuccess() {
        return errorType == null;
    }

    public boolean isError() {
        return errorType != null;
    }

    /**
     * Creates a successful response.
     */
    public static CompletionResponse success(
            String requestId,
            String model,
            JsonNode body,
            String provider,
            long elapsedMs,
            int retryCount,
            boolean cacheHit
    ) {
        return new CompletionResponse(
                requestId, model, 200, body, provider, elapsedMs, retryCount, cacheHit, null, null
        );
    }

    /**
     * Creates an error response with the status implied by the error type.
     */
    public static CompletionResponse error(
            String requestId,
            String model,
            ErrorType errorType,
            String errorMessage
    ) {
        return new CompletionResponse(
                requestId, model, statusFor(errorType), null, null, 0, 0, false, errorType, errorMessage
        );
    }

    /**
     * Returns a copy carrying elapsed time and retry count of the dispatch attempt.
     */
    public CompletionResponse withAttempts(String provider, long elapsedMs, int retryCount) {
        return new CompletionResponse(
                requestId, model, statusCode, body, provider, elapsedMs, retryCount, cacheHit,
                errorType, errorMessage
        );
    }

    /**
     * Maps an error type to the HTTP status surfaced to callers.
     */
    public static int statusFor(ErrorType errorType) {
        if (errorType == null) {
            return 200;
        }
        return switch (errorType) {
            case CLIENT_ERROR, VALIDATION_ERROR -> 400;
            case METHOD_NOT_ALLOWED -> 405;
            case PAYLOAD_TOO_LARGE -> 413;
            case UPSTREAM_CLIENT_ERROR -> 400;
            case PROVIDER_ERROR -> 502;
            case TIMEOUT -> 504;
            case NO_AVAILABLE_PROVIDER, ALL_PROVIDERS_FAILED -> 503;
            case INTERNAL_ERROR -> 500;
        };
    }
}
