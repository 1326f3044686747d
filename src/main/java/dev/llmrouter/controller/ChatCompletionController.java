package dev.llmrouter.controller;

import dev.llmrouter.dto.request.ChatCompletionRequest;
import dev.llmrouter.dto.response.ChatCompletionResponse;
import dev.llmrouter.service.ChatOrchestrator;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

/**
 * OpenAI-compatible entry point. Clients send {@code model: "auto"} and let the router decide.
 */
@RestController
@RequestMapping("/v1/chat")
public class ChatCompletionController {
    private final ChatOrchestrator orchestrator;
    public ChatCompletionController(ChatOrchestrator orchestrator) { this.orchestrator = orchestrator; }

    @PostMapping("/completions")
    public ResponseEntity<ChatCompletionResponse> complete(@RequestBody ChatCompletionRequest request) {
        return ResponseEntity.ok(orchestrator.complete(request));
    }
}
