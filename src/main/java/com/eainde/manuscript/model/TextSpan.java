package com.eainde.manuscript.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Character span inside the extracted page text.
 */
public record TextSpan(
        @JsonProperty("start") int start,
        @JsonProperty("end") int end
) {

    public TextSpan {
        if (start < 0) {
            throw new IllegalArgumentException("Span start must be >= 0, was " + start);
        }
        if (end < start) {
            throw new IllegalArgumentException("Span end " + end + " precedes start " + start);
        }
    }
}
