package dev.llmrouter.context;

import dev.llmrouter.config.RouterProperties;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Reads pins from {@code router.memory.pins-file}: one fact per non-blank line.
 * The file is re-read on every call so edits apply without a restart.
 */
@Component
public class FilePinnedContextStore implements PinnedContextStore {

    private final Path pinsFile;

    public FilePinnedContextStore(RouterProperties properties) {
        this.pinsFile = Path.of(properties.memory().pinsFile());
    }

    @Override
    public List<String> loadPins() {
        if (!Files.isRegularFile(pinsFile)) return List.of();
        try {
            return Files.readAllLines(pinsFile, StandardCharsets.UTF_8).stream()
                    .map(String::trim)
                    .filter(line -> !line.isEmpty())
                    .collect(Collectors.toList());
        } catch (IOException e) {
            throw new UncheckedIOException("Could not read pins file " + pinsFile, e);
        }
    }
}
