package dev.llmrouter.controller;

import dev.llmrouter.dto.response.HealthResponse;
import dev.llmrouter.service.HealthService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
public class HealthController {
    private final HealthService healthService;
    public HealthController(HealthService healthService) { this.healthService = healthService; }

    @GetMapping({"/health", "/ui/health"})
    public ResponseEntity<HealthResponse> health() {
        return ResponseEntity.ok(healthService.health());
    }
}
