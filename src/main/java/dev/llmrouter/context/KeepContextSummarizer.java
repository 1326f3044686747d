package dev.llmrouter.context;

import dev.llmrouter.config.RouterProperties;
import dev.llmrouter.config.RouterProperties.TokenBudget;
import dev.llmrouter.domain.valueobject.ChatMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Leaves the history as is. Prepares {@code router.memory.summaries-dir} so a summarizing
 * implementation has somewhere to persist its output.
 */
@Component
public class KeepContextSummarizer implements ContextSummarizer {

    static final String METHOD = "keep";

    private static final Logger log = LoggerFactory.getLogger(KeepContextSummarizer.class);

    private final Path summariesDir;

    public KeepContextSummarizer(RouterProperties properties) {
        this.summariesDir = Path.of(properties.memory().summariesDir());
    }

    @Override
    public Summary summarize(List<ChatMessage> messages, TokenBudget budget) {
        try {
            Files.createDirectories(summariesDir);
        } catch (IOException e) {
            log.warn("Could not create summaries directory {}: {}", summariesDir, e.getMessage());
        }
        return new Summary(messages, METHOD);
    }
}
