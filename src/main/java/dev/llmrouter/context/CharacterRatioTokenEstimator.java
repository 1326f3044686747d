package dev.llmrouter.context;

import dev.llmrouter.domain.valueobject.ChatMessage;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.stream.Collectors;

/** Four characters per token over the newline-joined contents, never less than one. */
@Component
public class CharacterRatioTokenEstimator implements TokenEstimator {

    static final int CHARS_PER_TOKEN = 4;

    @Override
    public int estimate(List<ChatMessage> messages) {
        String text = messages.stream().map(ChatMessage::content).collect(Collectors.joining("\n"));
        return Math.max(1, text.length() / CHARS_PER_TOKEN);
    }
}
