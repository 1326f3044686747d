package dev.llmrouter.exception;

public class RouterInternalException extends RuntimeException {
    private final String requestId;

    public RouterInternalException(String requestId, Throwable cause) {
        super("Request " + requestId + " failed", cause);
        this.requestId = requestId;
    }

    public String getRequestId() {
        return requestId;
    }
}
