package com.eainde.manuscript.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One policy entry: a word or phrase, how badly it is banned, and what to say instead.
 */
public record ToneTerm(
        @JsonProperty("word") String word,
        @JsonProperty("severity") ToneSeverity severity,
        @JsonProperty("replacement") String replacement,
        @JsonProperty("category") String category
) {

    public ToneTerm {
        if (word == null || word.isBlank()) {
            throw new IllegalArgumentException("Tone term requires a word");
        }
        word = word.trim();
        severity = severity == null ? ToneSeverity.WARN : severity;
    }
}
