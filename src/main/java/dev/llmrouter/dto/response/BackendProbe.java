package dev.llmrouter.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Live status of a local inference backend: up (with its models), error (HTTP status) or down.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record BackendProbe(String status, List<String> models, Integer httpStatus, String error) {

    public static BackendProbe up(List<String> models) {
        return new BackendProbe("up", List.copyOf(models), null, null);
    }

    public static BackendProbe error(int httpStatus) {
        return new BackendProbe("error", null, httpStatus, null);
    }

    public static BackendProbe down(String error) {
        String message = error == null ? "unreachable" : error;
        return new BackendProbe("down", null, null, message.length() > 120 ? message.substring(0, 120) : message);
    }
}
