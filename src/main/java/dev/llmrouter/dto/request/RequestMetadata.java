package dev.llmrouter.dto.request;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Optional routing hints. Absent or unrecognised values fall back to inference and defaults.
 *
 * @param intent   chat | code | reasoning | vision | verify
 * @param priority low | normal | high
 * @param route    provider name to force
 * @param model    model id to force
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RequestMetadata(String intent, String priority, String route, String model) {

    public static RequestMetadata empty() {
        return new RequestMetadata(null, null, null, null);
    }

    public boolean hasRoute() {
        return route != null && !route.isBlank();
    }

    public boolean hasModel() {
        return model != null && !model.isBlank();
    }
}
