package dev.llmrouter.domain.enums;

import java.util.Locale;
import java.util.Optional;

/**
 * Request priority. Selects the token budget pair applied by the context builder.
 */
public enum Priority {
    LOW, NORMAL, HIGH;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<Priority> fromWire(String value) {
        if (value == null) return Optional.empty();
        for (Priority priority : values()) {
            if (priority.wireName().equals(value)) return Optional.of(priority);
        }
        return Optional.empty();
    }
}
