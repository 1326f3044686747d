package dev.llmrouter.infrastructure.provider;

import dev.llmrouter.domain.enums.ProviderKind;
import dev.llmrouter.domain.valueobject.UpstreamResponse;

import java.time.Clock;

/**
 * Answers locally without any upstream call, for providers that are configured but not wired yet.
 */
public class PlaceholderProviderClient implements ProviderClient {

    static final String CONTENT = "This is a placeholder response from the LLM router (no upstream call was made).";

    private final String name;
    private final Clock clock;

    public PlaceholderProviderClient(String name, Clock clock) {
        this.name = name;
        this.clock = clock;
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public ProviderKind kind() {
        return ProviderKind.PLACEHOLDER;
    }

    @Override
    public String host() {
        return "";
    }

    @Override
    public UpstreamResponse complete(ProviderCall call) {
        long now = clock.instant().getEpochSecond();
        return new UpstreamResponse("chatcmpl-local-" + now, call.decision().model(), CONTENT, "stop",
                call.estimatedPromptTokens(), 0, null);
    }
}
