package dev.llmrouter.dto.response;

import java.util.List;

public record LogTailResponse(String type, List<String> lines) {}
