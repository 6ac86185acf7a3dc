package com.eainde.manuscript.llm;

import com.eainde.manuscript.collaborator.Extractor;
import com.eainde.manuscript.collaborator.PromptAware;
import com.eainde.manuscript.governance.DeterministicScope;
import com.eainde.manuscript.model.ExtractionResult;
import com.eainde.manuscript.prompts.PromptRegistry;
import com.eainde.manuscript.state.ProjectContext;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;
import lombok.extern.slf4j.Slf4j;

import java.util.List;

/**
 * Extractor backed by a chat model. Malformed JSON surfaces as {@link ModelResponseException};
 * the cartographer treats that like any other extraction failure.
 */
@Slf4j
public class ChatModelExtractor implements Extractor, PromptAware {

    private final ChatModel chatModel;
    private final PromptRegistry prompts;
    private final ObjectMapper objectMapper;

    public ChatModelExtractor(ChatModel chatModel, PromptRegistry prompts, ObjectMapper objectMapper) {
        this.chatModel = chatModel;
        this.prompts = prompts;
        this.objectMapper = objectMapper;
    }

    @Override
    public ExtractionResult extract(String text, ProjectContext context) {
        DeterministicScope.assertModelCallAllowed("extractor");
        StringBuilder user = new StringBuilder();
        if (!context.thesis().isBlank()) {
            user.append("Thesis: ").append(context.thesis()).append('\n');
        }
        if (!context.researchQuestions().isEmpty()) {
            user.append("Research questions: ").append(String.join("; ", context.researchQuestions())).append('\n');
        }
        user.append("Text:\n").append(text);

        String raw = ModelResponses.text(chatModel.chat(List.of(
                SystemMessage.from(prompts.get(PromptRegistry.EXTRACTOR).text()),
                UserMessage.from(user.toString()))));
        try {
            ExtractionResult result = objectMapper.readValue(ModelResponses.cleanJson(raw), ExtractionResult.class);
            log.debug("Extractor returned {} triples", result.triples().size());
            return result;
        } catch (JsonProcessingException e) {
            throw new ModelResponseException("Extractor returned malformed JSON", e);
        }
    }

    @Override
    public String promptRole() {
        return PromptRegistry.EXTRACTOR;
    }
}
