package dev.llmrouter.infrastructure.provider;

import dev.llmrouter.domain.enums.ProviderKind;
import dev.llmrouter.domain.valueobject.UpstreamResponse;

/**
 * One configured upstream backend.
 */
public interface ProviderClient {

    String name();

    ProviderKind kind();

    /** Base URL reported as the execution host; empty for synthetic providers. */
    String host();

    /**
     * @throws UpstreamCallException when the backend cannot produce a reply
     */
    UpstreamResponse complete(ProviderCall call);
}
