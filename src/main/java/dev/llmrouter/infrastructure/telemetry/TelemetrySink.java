package dev.llmrouter.infrastructure.telemetry;

import dev.llmrouter.domain.valueobject.CallRecord;

/**
 * Destination for completed-call records. Implementations may throw; the tiered sink absorbs it.
 */
public interface TelemetrySink {
    void record(CallRecord call);
}
