package dev.llmrouter.routing;

import dev.llmrouter.config.RouterProperties;
import dev.llmrouter.domain.enums.Intent;
import dev.llmrouter.dto.request.ChatCompletionRequest;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Keyword-based intent inference over the most recent user message.
 * Keyword lists are scanned in configuration order; the first hit wins.
 */
@Component
public class IntentClassifier {

    private final RouterProperties.Routing routing;

    public IntentClassifier(RouterProperties properties) {
        this.routing = properties.routing();
    }

    public Intent classify(ChatCompletionRequest request) {
        Intent declared = Intent.fromWire(request.metadataOrEmpty().intent()).orElse(null);
        if (declared != null) return declared;

        String text = request.lastUserMessage()
                .map(m -> m.content().toLowerCase(Locale.ROOT))
                .orElse(null);
        if (text == null) return Intent.CHAT;

        for (Map.Entry<Intent, List<String>> entry : routing.intentKeywords().entrySet()) {
            if (containsAny(text, entry.getValue())) return entry.getKey();
        }
        if (containsAny(text, routing.visionHints())) return Intent.VISION;
        return Intent.CHAT;
    }

    private static boolean containsAny(String text, List<String> keywords) {
        for (String keyword : keywords) {
            if (keyword != null && !keyword.isBlank() && text.contains(keyword.toLowerCase(Locale.ROOT))) {
                return true;
            }
        }
        return false;
    }
}
