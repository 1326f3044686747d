package dev.llmrouter.service;

import dev.llmrouter.domain.valueobject.ExecutionRecord;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/** Most recent dispatched call, for the health endpoint. */
@Component
public class ExecutionTracker {

    private final AtomicReference<ExecutionRecord> last = new AtomicReference<>();

    public void record(ExecutionRecord execution) {
        last.set(execution);
    }

    public Optional<ExecutionRecord> last() {
        return Optional.ofNullable(last.get());
    }
}
