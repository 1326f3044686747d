package dev.llmrouter.domain.valueobject;

import java.time.Instant;

/**
 * Last dispatched call: which backend ran it and how (local, remote, stub).
 */
public record ExecutionRecord(String target, String host, String mode, String model, Instant at) {}
