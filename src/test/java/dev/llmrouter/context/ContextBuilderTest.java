package dev.llmrouter.context;

import dev.llmrouter.config.RouterProperties;
import dev.llmrouter.domain.enums.Priority;
import dev.llmrouter.domain.valueobject.BuiltContext;
import dev.llmrouter.domain.valueobject.ChatMessage;
import dev.llmrouter.domain.valueobject.ContextInfo;
import dev.llmrouter.dto.request.ChatCompletionRequest;
import dev.llmrouter.infrastructure.logging.RouterEventLog;
import dev.llmrouter.support.RouterFixtures;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static dev.llmrouter.support.RouterFixtures.metadata;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;

class ContextBuilderTest {

    @TempDir
    Path tempDir;

    private RouterProperties properties;
    private RouterEventLog eventLog;
    private List<String> pins;

    @BeforeEach
    void setUp() {
        RouterProperties base = RouterFixtures.properties();
        RouterProperties.Tokens tokens = new RouterProperties.Tokens(
                new RouterProperties.TokenBudget(6000, 10000),
                Map.of(Priority.LOW, new RouterProperties.TokenBudget(100, 200)));
        RouterProperties.Memory memory = new RouterProperties.Memory(
                tempDir.resolve("pins.md").toString(), tempDir.resolve("summaries").toString());
        properties = new RouterProperties(base.routing(), base.providers(), base.budget(), tokens, memory, null, null);
        eventLog = mock(RouterEventLog.class);
        pins = new ArrayList<>();
    }

    private ContextBuilder builder() {
        return new ContextBuilder(properties, new CharacterRatioTokenEstimator(), () -> pins,
                new KeepContextSummarizer(properties), eventLog);
    }

    private static ChatMessage turn(int index, int chars) {
        String role = index % 2 == 0 ? "user" : "assistant";
        return new ChatMessage(role, String.valueOf((char) ('a' + index % 26)).repeat(chars));
    }

    @Nested
    @DisplayName("trimming")
    class Trimming {

        @Test
        @DisplayName("drops oldest turns until a 12k-token history fits the 10k hard max")
        void trimsToHardMax() {
            List<ChatMessage> messages = new ArrayList<>();
            messages.add(ChatMessage.system("You are helpful."));
            for (int i = 0; i < 12; i++) messages.add(turn(i, 4000));
            ChatCompletionRequest request = RouterFixtures.request(metadata(null, "normal", null, null),
                    messages.toArray(new ChatMessage[0]));

            BuiltContext built = builder().build(request);

            ContextInfo info = built.info();
            assertThat(info.tokensBefore()).isEqualTo(12_007);
            assertThat(info.tokensAfter()).isLessThanOrEqualTo(10_000);
            assertThat(info.droppedMessages()).isEqualTo(3);
            assertThat(built.messages()).hasSize(10);
            assertThat(built.messages().get(0)).isEqualTo(ChatMessage.system("You are helpful."));
            assertThat(built.messages().subList(1, 10)).isEqualTo(messages.subList(4, 13));
        }

        @Test
        @DisplayName("small histories pass through untouched without summarization")
        void smallHistoryUntouched() {
            ChatCompletionRequest request = RouterFixtures.request("hello");

            BuiltContext built = builder().build(request);

            assertThat(built.messages()).isEqualTo(request.messages());
            assertThat(built.info().summarizationInvoked()).isFalse();
            assertThat(built.info().summarizationMethod()).isEqualTo("none");
            assertThat(built.info().tokensAfter()).isEqualTo(1);
        }

        @Test
        @DisplayName("stops when only protected messages remain, even above the hard max")
        void protectedMessagesSurvive() {
            ChatCompletionRequest request = RouterFixtures.request(metadata(null, "low", null, null),
                    ChatMessage.system("s".repeat(2000)), turn(0, 400), turn(1, 400));

            BuiltContext built = builder().build(request);

            assertThat(built.messages()).containsExactly(ChatMessage.system("s".repeat(2000)));
            assertThat(built.info().tokensAfter()).isGreaterThan(200);
            assertThat(built.info().droppedMessages()).isEqualTo(2);
        }

        @Test
        @DisplayName("an explicit priority selects its own budget pair")
        void priorityBudget() {
            ChatCompletionRequest request = RouterFixtures.request(null, turn(0, 400), turn(1, 400), turn(2, 400));

            BuiltContext built = builder().build(request, Priority.LOW);

            assertThat(built.info().hardMaxInputTokens()).isEqualTo(200);
            assertThat(built.info().targetInputTokens()).isEqualTo(100);
            assertThat(built.messages()).containsExactly(turn(1, 400), turn(2, 400));
        }

        @Test
        @DisplayName("rebuilding its own output removes nothing further")
        void idempotent() {
            pins.add("Owner prefers metric units");
            List<ChatMessage> messages = new ArrayList<>();
            for (int i = 0; i < 8; i++) messages.add(turn(i, 300));
            ChatCompletionRequest request = RouterFixtures.request(metadata(null, "low", null, null),
                    messages.toArray(new ChatMessage[0]));

            BuiltContext first = builder().build(request);
            BuiltContext second = builder().build(RouterFixtures.request(metadata(null, "low", null, null),
                    first.messages().toArray(new ChatMessage[0])));

            assertThat(second.messages()).isEqualTo(first.messages());
            assertThat(second.info().droppedMessages()).isZero();
            assertThat(second.info().tokensAfter()).isLessThanOrEqualTo(200);
        }
    }

    @Nested
    @DisplayName("pinned context and summarization")
    class PinsAndSummaries {

        @Test
        @DisplayName("pins are prepended as a single system message")
        void pinsPrepended() {
            pins.addAll(List.of("Owner prefers metric units", "Timezone is UTC"));

            BuiltContext built = builder().build(RouterFixtures.request("hi"));

            assertThat(built.messages()).hasSize(2);
            assertThat(built.messages().get(0).role()).isEqualTo("system");
            assertThat(built.messages().get(0).content())
                    .isEqualTo("Pinned context:\nOwner prefers metric units\nTimezone is UTC");
            assertThat(built.info().pinnedIncluded()).isTrue();
        }

        @Test
        @DisplayName("the summarizer runs above target and prepares the summaries directory")
        void summarizerAboveTarget() {
            List<ChatMessage> messages = new ArrayList<>();
            for (int i = 0; i < 8; i++) messages.add(turn(i, 4000));

            BuiltContext built = builder().build(RouterFixtures.request(null, messages.toArray(new ChatMessage[0])));

            assertThat(built.info().summarizationInvoked()).isTrue();
            assertThat(built.info().summarizationMethod()).isEqualTo("keep");
            assertThat(built.messages()).hasSize(8);
            assertThat(Files.isDirectory(tempDir.resolve("summaries"))).isTrue();
        }

        @Test
        @DisplayName("an uncreatable summaries directory does not undo trimming")
        void unwritableSummariesDir() throws Exception {
            Path blocker = Files.writeString(tempDir.resolve("blocker"), "not a directory");
            RouterProperties.Memory memory = new RouterProperties.Memory(
                    tempDir.resolve("pins.md").toString(), blocker.resolve("sub").toString());
            properties = new RouterProperties(properties.routing(), properties.providers(), properties.budget(),
                    properties.tokens(), memory, null, null);
            List<ChatMessage> messages = new ArrayList<>();
            for (int i = 0; i < 12; i++) messages.add(new ChatMessage("user", "u".repeat(4000)));

            BuiltContext built = builder().build(RouterFixtures.request(metadata(null, "normal", null, null),
                    messages.toArray(new ChatMessage[0])));

            assertThat(built.info().tokensBefore()).isEqualTo(12_002);
            assertThat(built.info().tokensAfter()).isLessThanOrEqualTo(10_000);
            assertThat(built.messages()).hasSize(9);
            assertThat(built.info().summarizationMethod()).isEqualTo("keep");
        }

        @Test
        @DisplayName("a failing summarizer keeps the trimmed history")
        void failingSummarizer() {
            ContextBuilder builder = new ContextBuilder(properties, new CharacterRatioTokenEstimator(), () -> pins,
                    (messages, budget) -> { throw new IllegalStateException("summary store offline"); }, eventLog);
            List<ChatMessage> messages = new ArrayList<>();
            for (int i = 0; i < 12; i++) messages.add(turn(i, 4000));

            BuiltContext built = builder.build(RouterFixtures.request(null, messages.toArray(new ChatMessage[0])));

            assertThat(built.info().tokensAfter()).isLessThanOrEqualTo(10_000);
            assertThat(built.info().droppedMessages()).isEqualTo(3);
            assertThat(built.info().summarizationInvoked()).isFalse();
            assertThat(built.messages()).isEqualTo(messages.subList(3, 12));
        }

        @Test
        @DisplayName("reads pins from the configured file, skipping blank lines")
        void filePins() throws Exception {
            Files.writeString(tempDir.resolve("pins.md"), "  first fact  \n\n second fact\n   \n");

            assertThat(new FilePinnedContextStore(properties).loadPins()).containsExactly("first fact", "second fact");
        }

        @Test
        @DisplayName("a missing pins file means no pins")
        void missingPinsFile() {
            assertThat(new FilePinnedContextStore(properties).loadPins()).isEmpty();
        }
    }

    @Test
    @DisplayName("passes the original messages through when building fails")
    void failsOpen() {
        ContextBuilder broken = new ContextBuilder(properties, new CharacterRatioTokenEstimator(),
                () -> { throw new IllegalStateException("disk gone"); },
                new KeepContextSummarizer(properties), eventLog);
        ChatCompletionRequest request = RouterFixtures.request("hello world");

        BuiltContext built = broken.build(request);

        assertThat(built.messages()).isEqualTo(request.messages());
        assertThat(built.info().droppedMessages()).isZero();
        verify(eventLog).logContext(any());
    }
}
