package dev.llmrouter.exception;

import java.util.List;

/**
 * Admission refused for the primary route and for the single alternate (if any).
 */
public class BudgetExceededException extends RuntimeException {
    private final List<String> rejectedProviders;

    public BudgetExceededException(List<String> rejectedProviders) {
        super("Budget exhausted for " + String.join(", ", rejectedProviders));
        this.rejectedProviders = List.copyOf(rejectedProviders);
    }

    public List<String> getRejectedProviders() {
        return rejectedProviders;
    }
}
