package dev.llmrouter.infrastructure.telemetry;

import dev.llmrouter.config.RouterProperties;
import dev.llmrouter.domain.valueobject.CallRecord;
import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Component;

/**
 * Hands call records to the telemetry sink on {@code telemetryExecutor}.
 */
@Component
public class TelemetryPublisher {

    private final TelemetrySink sink;
    private final boolean enabled;

    public TelemetryPublisher(TelemetrySink sink, RouterProperties properties) {
        this.sink = sink;
        this.enabled = properties.telemetry().enabled();
    }

    @Async("telemetryExecutor")
    public void publish(CallRecord call) {
        if (!enabled) return;
        sink.record(call);
    }
}
