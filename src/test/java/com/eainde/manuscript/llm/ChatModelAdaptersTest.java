package com.eainde.manuscript.llm;

import com.eainde.manuscript.governance.DeterministicScope;
import com.eainde.manuscript.model.ExtractedTriple;
import com.eainde.manuscript.model.ExtractionResult;
import com.eainde.manuscript.prompts.PromptRegistry;
import com.eainde.manuscript.prompts.PromptTemplate;
import com.eainde.manuscript.state.ProjectContext;
import com.eainde.manuscript.state.RigorLevel;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.github.benmanes.caffeine.cache.Caffeine;
import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.data.message.ChatMessage;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import dev.langchain4j.model.chat.response.ChatResponse;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ChatModelAdaptersTest {

    @Mock
    private ChatModel chatModel;

    @Captor
    private ArgumentCaptor<List<ChatMessage>> messages;

    private PromptRegistry prompts;

    @BeforeEach
    void setUp() {
        prompts = new PromptRegistry(role -> new PromptTemplate(role, "1", "system prompt for " + role),
                Caffeine.newBuilder().build());
    }

    private void answer(String text) {
        when(chatModel.chat(anyList())).thenReturn(ChatResponse.builder().aiMessage(AiMessage.from(text)).build());
    }

    @Nested
    @DisplayName("Extractor")
    class Extractor {

        private ChatModelExtractor extractor;

        @BeforeEach
        void setUp() {
            extractor = new ChatModelExtractor(chatModel, prompts, new ObjectMapper());
        }

        @Test
        @DisplayName("should parse fenced JSON into triples")
        void fencedJson() {
            answer("""
                    ```json
                    {"triples": [{"subject": "X", "predicate": "IMPACTS", "object": "Y", "confidence": 0.8,
                                  "source_pointer": {"page": 2, "snippet": "X impacts Y"}}],
                     "entities": ["X", "Y"]}
                    ```
                    """);

            ExtractionResult result = extractor.extract("X impacts Y.", new ProjectContext("X matters", List.of("rq1")));

            assertThat(result.triples()).singleElement()
                    .extracting(ExtractedTriple::subject, ExtractedTriple::object, ExtractedTriple::page)
                    .containsExactly("X", "Y", 2);
            assertThat(result.entities()).containsExactly("X", "Y");
        }

        @Test
        @DisplayName("should send the registry prompt and the project context")
        void promptContent() {
            answer("{\"triples\": []}");

            extractor.extract("Body text", new ProjectContext("X matters", List.of("rq1", "rq2")));

            verify(chatModel).chat(messages.capture());
            assertThat(messages.getValue()).hasSize(2);
            assertThat(((SystemMessage) messages.getValue().get(0)).text()).isEqualTo("system prompt for extractor");
            assertThat(((UserMessage) messages.getValue().get(1)).singleText())
                    .contains("Thesis: X matters")
                    .contains("Research questions: rq1; rq2")
                    .endsWith("Body text");
        }

        @Test
        @DisplayName("should surface malformed JSON as a model response failure")
        void malformed() {
            answer("I could not find any triples.");

            assertThatThrownBy(() -> extractor.extract("text", ProjectContext.empty()))
                    .isInstanceOf(ModelResponseException.class)
                    .hasMessage("Extractor returned malformed JSON");
        }

        @Test
        @DisplayName("should report its prompt role")
        void role() {
            assertThat(extractor.promptRole()).isEqualTo(PromptRegistry.EXTRACTOR);
        }
    }

    @Nested
    @DisplayName("Drafter")
    class Drafter {

        @Test
        @DisplayName("should ask the model to cite each triple by claim id")
        void citations() {
            answer("  X impacts Y [[c1]].  ");
            ChatModelDrafter drafter = new ChatModelDrafter(chatModel, prompts);

            String draft = drafter.draft(List.of(new ExtractedTriple("X", "IMPACTS", "Y", null, null, null, null)),
                    List.of("c1"), RigorLevel.CONSERVATIVE);

            assertThat(draft).isEqualTo("X impacts Y [[c1]].");
            verify(chatModel).chat(messages.capture());
            assertThat(((UserMessage) messages.getValue().get(1)).singleText())
                    .contains("Rigor: conservative")
                    .contains("- (X, IMPACTS, Y) cite as [[c1]]");
        }
    }

    @Nested
    @DisplayName("Tone rewriter")
    class Rewriter {

        @Test
        @DisplayName("should strip quotes the model wraps its answer in")
        void stripsQuotes() {
            answer("\"A significant result\"");
            ChatModelTextRewriter rewriter = new ChatModelTextRewriter(chatModel, prompts);

            assertThat(rewriter.rewrite("A revolutionary result", "significant")).isEqualTo("A significant result");
        }

        @Test
        @DisplayName("should refuse to call the model from a deterministic section")
        void deterministicGuard() {
            ChatModelTextRewriter rewriter = new ChatModelTextRewriter(chatModel, prompts);

            assertThatThrownBy(() -> DeterministicScope.call("tone-lint", () -> rewriter.rewrite("text", "balanced")))
                    .isInstanceOf(IllegalStateException.class)
                    .hasMessageContaining("tone-lint");
            verifyNoInteractions(chatModel);
        }

        @Test
        @DisplayName("should treat an empty answer as a model failure")
        void emptyAnswer() {
            when(chatModel.chat(anyList())).thenReturn(ChatResponse.builder().aiMessage(AiMessage.from(" ")).build());
            ChatModelTextRewriter rewriter = new ChatModelTextRewriter(chatModel, prompts);

            assertThatThrownBy(() -> rewriter.rewrite("text", "balanced"))
                    .isInstanceOf(ModelResponseException.class);
        }
    }
}
