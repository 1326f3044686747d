package dev.llmrouter.domain.enums;

import java.util.Locale;
import java.util.Optional;

/**
 * Coarse purpose of a request. Each intent selects its own fallback chain.
 */
public enum Intent {
    CHAT, CODE, REASONING, VISION, VERIFY;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static Optional<Intent> fromWire(String value) {
        if (value == null) return Optional.empty();
        for (Intent intent : values()) {
            if (intent.wireName().equals(value)) return Optional.of(intent);
        }
        return Optional.empty();
    }
}
