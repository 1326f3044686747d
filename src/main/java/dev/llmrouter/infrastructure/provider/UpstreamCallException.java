package dev.llmrouter.infrastructure.provider;

/**
 * Failure talking to an upstream backend.
 *
 * <p>{@code status} is the HTTP status, or 0 when no response arrived (connect error,
 * timeout) or the call was never sent. Transient failures are the ones worth retrying.
 */
public class UpstreamCallException extends RuntimeException {

    private final int status;
    private final boolean transientFailure;

    public UpstreamCallException(String message, int status, boolean transientFailure, Throwable cause) {
        super(message, cause);
        this.status = status;
        this.transientFailure = transientFailure;
    }

    public static UpstreamCallException terminal(String message) {
        return new UpstreamCallException(message, 0, false, null);
    }

    public static boolean isRetryableStatus(int status) {
        return status >= 500 || status == 429;
    }

    public int getStatus() {
        return status;
    }

    public boolean isTransient() {
        return transientFailure;
    }
}
