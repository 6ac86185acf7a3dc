package com.eainde.manuscript.llm;

import com.eainde.manuscript.collaborator.Drafter;
import com.eainde.manuscript.collaborator.PromptAware;
import com.eainde.manuscript.governance.DeterministicScope;
import com.eainde.manuscript.model.ExtractedTriple;
import com.eainde.manuscript.prompts.PromptRegistry;
import com.eainde.manuscript.state.RigorLevel;
import dev.langchain4j.data.message.SystemMessage;
import dev.langchain4j.data.message.UserMessage;
import dev.langchain4j.model.chat.ChatModel;

import java.util.List;

public class ChatModelDrafter implements Drafter, PromptAware {

    private final ChatModel chatModel;
    private final PromptRegistry prompts;

    public ChatModelDrafter(ChatModel chatModel, PromptRegistry prompts) {
        this.chatModel = chatModel;
        this.prompts = prompts;
    }

    @Override
    public String draft(List<ExtractedTriple> triples, List<String> citations, RigorLevel rigor) {
        DeterministicScope.assertModelCallAllowed("drafter");
        StringBuilder user = new StringBuilder("Rigor: ").append(rigor.wireName()).append("\nTriples:\n");
        for (int i = 0; i < triples.size(); i++) {
            ExtractedTriple t = triples.get(i);
            user.append("- (").append(t.subject()).append(", ").append(t.predicate()).append(", ")
                    .append(t.object()).append(")");
            if (i < citations.size()) {
                user.append(" cite as [[").append(citations.get(i)).append("]]");
            }
            user.append('\n');
        }
        return ModelResponses.text(chatModel.chat(List.of(
                SystemMessage.from(prompts.get(PromptRegistry.DRAFTER).text()),
                UserMessage.from(user.toString())))).strip();
    }

    @Override
    public String promptRole() {
        return PromptRegistry.DRAFTER;
    }
}
