package fr.lapetina.aimux.domain.provider;

/**
 * Raised when a provider cannot produce a usable answer.
 */
public class ProviderException extends RuntimeException {

    private final String provider;
    private final int statusCode;
    private final boolean retryable;

    public ProviderException(String provider, int statusCode, boolean retryable, String message) {
        super(message);
        this.provider = provider;
        this.statusCode = statusCode;
        this.retryable = retryable;
    }

    public String getProvider() {
        return provider;
    }

    /**
     * Upstream status code, or 0 when no HTTP answer was received.
     */
    public int getStatusCode() {
        return statusCode;
    }

    public boolean isRetryable() {
        return retryable;
    }
}
