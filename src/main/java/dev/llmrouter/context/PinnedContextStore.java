package dev.llmrouter.context;

import java.util.List;

/**
 * Source of long-lived facts that go into every prompt.
 */
public interface PinnedContextStore {
    List<String> loadPins();
}
