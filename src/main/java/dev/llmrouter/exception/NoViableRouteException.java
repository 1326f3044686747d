package dev.llmrouter.exception;

/**
 * No configured candidate can serve the request: empty chain, or every provider disabled,
 * unknown, excluded or missing a model for its tier.
 */
public class NoViableRouteException extends RuntimeException {
    public NoViableRouteException(String message) {
        super(message);
    }
}
