package fr.lapetina.aimux.domain.event;

import fr.lapetina.aimux.domain.model.ErrorType;

/**
 * Ring buffer slot describing something the dispatcher did.
 *
 * <p>Instances are pre-allocated by the Disruptor and reused, so they are mutable and must
 * not escape the metrics handlers.
 */
public final class DispatchEvent {

    /**
     * What the event reports.
     */
    public enum Kind {
        /** A request reached a terminal outcome. */
        REQUEST_COMPLETED,
        /** One provider attempt failed and the request moved on. */
        ATTEMPT_FAILED
    }

    private Kind kind;
    private String requestId;
    private String correlationId;
    private String model;
    private String provider;
    private String requestType;
    private ErrorType errorType;
    private int statusCode;
    private long latencyMs;
    private int retryCount;
    private boolean cacheHit;

    public void clear() {
        this.kind = null;
        this.requestId = null;
        this.correlationId = null;
        this.model = null;
        this.provider = null;
        this.requestType = null;
        this.errorType = null;
        this.statusCode = 0;
        this.latencyMs = 0;
        this.retryCount = 0;
        this.cacheHit = false;
    }

    public void initializeCompleted(
            String requestId,
            String correlationId,
            String model,
            String provider,
            String requestType,
            int statusCode,
            ErrorType errorType,
            long latencyMs,
            int retryCount,
            boolean cacheHit
    ) {
        clear();
        this.kind = Kind.REQUEST_COMPLETED;
        this.requestId = requestId;
        this.correlationId = correlationId;
        this.model = model;
        this.provider = provider;
        this.requestType = requestType;
        this.statusCode = statusCode;
        this.errorType = errorType;
        this.latencyMs = latencyMs;
        this.retryCount = retryCount;
        this.cacheHit = cacheHit;
    }

    public void initializeAttemptFailed(
            String requestId,
            String correlationId,
            String model,
            String provider,
            ErrorType errorType,
            long latencyMs
    ) {
        clear();
        this.kind = Kind.ATTEMPT_FAILED;
        this.requestId = requestId;
        this.correlationId = correlationId;
        this.model = model;
        this.provider = provider;
        this.errorType = errorType;
        this.latencyMs = latencyMs;
    }

    public Kind getKind() {
        return kind;
    }

    public String getRequestId() {
        return requestId;
    }

    public String getCorrelationId() {
        return correlationId;
    }

    public String getModel() {
        return model;
    }

    public String getProvider() {
        return provider;
    }

    public String getRequestType() {
        return requestType;
    }

    public ErrorType getErrorType() {
        return errorType;
    }

    public int getStatusCode() {
        return statusCode;
    }

    public long getLatencyMs() {
        return latencyMs;
    }

    public int getRetryCount() {
        return retryCount;
    }

    public boolean isCacheHit() {
        return cacheHit;
    }

    public boolean isSuccess() {
        return errorType == null;
    }

    @Override
    public String toString() {
        return "DispatchEvent{" +
                "kind=" + kind +
                ", requestId='" + requestId + '\'' +
                ", model='" + model + '\'' +
                ", provider='" + provider + '\'' +
                ", errorType=" + errorType +
                ", latencyMs=" + latencyMs +
                '}';
    }
}
