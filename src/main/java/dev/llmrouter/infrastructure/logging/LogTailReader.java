package dev.llmrouter.infrastructure.logging;

import dev.llmrouter.config.RouterProperties;
import dev.llmrouter.dto.response.LogTailResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Returns the last lines of one of the router's append-only logs.
 * A missing or unreadable file yields an empty tail.
 */
@Component
public class LogTailReader {

    public static final int MAX_LIMIT = 200;

    private static final Logger log = LoggerFactory.getLogger(LogTailReader.class);

    private final Map<String, Path> files;

    public LogTailReader(RouterProperties properties) {
        RouterProperties.Logging logging = properties.logging();
        this.files = Map.of(
                "requests", Path.of(logging.requestLog()),
                "errors", Path.of(logging.errorLog()),
                "context", Path.of(logging.contextLog()));
    }

    public LogTailResponse tail(String type, int limit) {
        String key = type == null ? "" : type.toLowerCase(Locale.ROOT);
        Path file = files.get(key);
        if (file == null) {
            throw new IllegalArgumentException("Unknown log type '" + type + "', expected requests, errors or context");
        }
        if (limit < 1 || limit > MAX_LIMIT) {
            throw new IllegalArgumentException("limit must be between 1 and " + MAX_LIMIT);
        }
        return new LogTailResponse(key, readTail(file, limit));
    }

    private List<String> readTail(Path file, int limit) {
        if (!Files.isRegularFile(file)) return List.of();
        Deque<String> tail = new ArrayDeque<>(limit);
        try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            String line;
            while ((line = reader.readLine()) != null) {
                if (tail.size() == limit) tail.removeFirst();
                tail.addLast(line);
            }
        } catch (IOException e) {
            log.warn("Could not read {}: {}", file, e.getMessage());
            return List.of();
        }
        return new ArrayList<>(tail);
    }
}
