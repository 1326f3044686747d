package dev.llmrouter.controller;

import dev.llmrouter.dto.response.LogTailResponse;
import dev.llmrouter.infrastructure.logging.LogTailReader;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/** Tail of the request, error or context log for the dashboard. */
@RestController
public class LogController {
    private final LogTailReader logTailReader;
    public LogController(LogTailReader logTailReader) { this.logTailReader = logTailReader; }

    @GetMapping({"/logs", "/ui/logs"})
    public ResponseEntity<LogTailResponse> tail(@RequestParam(defaultValue = "requests") String type,
                                                @RequestParam(defaultValue = "50") int limit) {
        return ResponseEntity.ok(logTailReader.tail(type, limit));
    }
}
