package dev.llmrouter.infrastructure.telemetry;

import dev.llmrouter.domain.valueobject.CallRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.context.annotation.Primary;
import org.springframework.stereotype.Component;

/**
 * HTTP endpoint first, local store when it is unreachable. Never throws: telemetry
 * must not affect the request it describes.
 */
@Primary
@Component
public class TieredTelemetrySink implements TelemetrySink {

    private static final Logger log = LoggerFactory.getLogger(TieredTelemetrySink.class);

    private final TelemetrySink primary;
    private final TelemetrySink fallback;

    @Autowired
    public TieredTelemetrySink(HttpTelemetrySink primary, JpaTelemetrySink fallback) {
        this((TelemetrySink) primary, fallback);
    }

    TieredTelemetrySink(TelemetrySink primary, TelemetrySink fallback) {
        this.primary = primary;
        this.fallback = fallback;
    }

    @Override
    public void record(CallRecord call) {
        try {
            primary.record(call);
            return;
        } catch (RuntimeException e) {
            log.debug("Telemetry endpoint unavailable, writing locally: {}", e.getMessage());
        }
        try {
            fallback.record(call);
        } catch (RuntimeException e) {
            log.warn("Telemetry dropped for {}/{}: {}", call.provider(), call.modelName(), e.getMessage());
        }
    }
}
