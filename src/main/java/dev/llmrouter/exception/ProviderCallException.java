package dev.llmrouter.exception;

/**
 * Upstream call failed after whatever retries the provider allows. The message may carry
 * upstream detail and is never returned to the client.
 */
public class ProviderCallException extends RuntimeException {
    private final String provider;

    public ProviderCallException(String provider, String message, Throwable cause) {
        super(message, cause);
        this.provider = provider;
    }

    public String getProvider() {
        return provider;
    }
}
