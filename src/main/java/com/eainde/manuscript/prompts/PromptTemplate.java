package com.eainde.manuscript.prompts;

import com.eainde.manuscript.model.Hashing;
import com.eainde.manuscript.state.PromptUse;

/**
 * A role prompt at a specific version.
 */
public record PromptTemplate(String role, String version, String text) {

    public PromptTemplate {
        if (role == null || role.isBlank()) {
            throw new IllegalArgumentException("Prompt role is required");
        }
        text = text == null ? "" : text;
        version = version == null || version.isBlank() ? "1" : version;
    }

    public PromptUse toUse() {
        return new PromptUse(role, version, Hashing.sha256Hex(text));
    }
}
