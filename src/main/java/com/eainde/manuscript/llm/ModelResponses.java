package com.eainde.manuscript.llm;

import dev.langchain4j.data.message.AiMessage;
import dev.langchain4j.model.chat.response.ChatResponse;

final class ModelResponses {

    private ModelResponses() {
    }

    static String text(ChatResponse response) {
        AiMessage message = response == null ? null : response.aiMessage();
        String text = message == null ? null : message.text();
        if (text == null || text.isBlank()) {
            throw new ModelResponseException("Model returned an empty response");
        }
        return text;
    }

    /** Strips markdown code fences models like to wrap JSON in. */
    static String cleanJson(String raw) {
        return raw.replace("```json", "")
                .replace("```", "")
                .trim();
    }
}
