package fr.lapetina.aimux.domain.model;

/**
 * Error taxonomy for completion requests.
 * Drives both the HTTP status returned to callers and the error metrics.
 */
public enum ErrorType {
    /** Malformed request body or unsupported content */
    CLIENT_ERROR,

    /** Request parsed but failed shape validation */
    VALIDATION_ERROR,

    /** Request body exceeds the configured maximum size */
    PAYLOAD_TOO_LARGE,

    /** Endpoint called with an unsupported HTTP method */
    METHOD_NOT_ALLOWED,

    /** Provider rejected the request with a non-retryable 4xx status */
    UPSTREAM_CLIENT_ERROR,

    /** Provider returned a 5xx status or an unreadable body */
    PROVIDER_ERROR,

    /** Provider did not answer within the per-attempt timeout */
    TIMEOUT,

    /** No configured provider is currently eligible for the request */
    NO_AVAILABLE_PROVIDER,

    /** Every candidate provider was tried and failed */
    ALL_PROVIDERS_FAILED,

    /** Unexpected failure inside the dispatcher */
    INTERNAL_ERROR
}
