package com.eainde.manuscript.llm;

import com.eainde.manuscript.collaborator.TextRewriter;
import com.eainde.manuscript.collaborator.PromptAware;
import com.eainde.manuscript.governance.DeterministicScope;
import com.eainde.manuscript.prompts.PromptRegistry;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;

import java.util.List;

/**
 * Sentence rewriter backed by a chat model. Surrounding quotes the model adds are removed.
 */
public class ChatModelTextRewriter implements TextRewriter, PromptAware {

    private final ChatModel chatModel;
    private final PromptRegistry prompts;

    public ChatModelTextRewriter(ChatModel chatModel, PromptRegistry prompts) {
        this.chatModel = chatModel;
        this.prompts = prompts;
    }

    @Override
    public String rewrite(String sentence, String suggestion) {
        DeterministicScope.assertModelCallAllowed("tone-rewriter");
        String answer = ModelResponses.text(chatModel.chat(List.of(
                SystemMessage.from(prompts.get(PromptRegistry.TONE_REWRITER).text()),
                UserMessage.from("Fragment: " + sentence + "\nReplacement guidance: " + suggestion)))).strip();
        if (answer.length() > 1 && answer.startsWith("\"") && answer.endsWith("\"")) {
            answer = answer.substring(1, answer.length() - 1).strip();
        }
        return answer;
    }

    @Override
    public String promptRole() {
        return PromptRegistry.TONE_REWRITER;
    }
}
