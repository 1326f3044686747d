package dev.llmrouter.domain.valueobject;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * One conversation turn. System-role messages (including the synthetic pinned-context
 * message) are protected from trimming.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record ChatMessage(String role, String content) {

    public static final String SYSTEM = "system";
    public static final String USER = "user";

    public ChatMessage {
        if (content == null) content = "";
    }

    public static ChatMessage system(String content) {
        return new ChatMessage(SYSTEM, content);
    }

    @JsonIgnore
    public boolean isProtected() {
        return SYSTEM.equals(role);
    }

    @JsonIgnore
    public boolean isFromUser() {
        return USER.equals(role);
    }
}
