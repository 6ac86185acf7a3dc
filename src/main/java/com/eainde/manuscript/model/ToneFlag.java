package com.eainde.manuscript.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * A single lint match.
 *
 * @param word       matched text as it appears in the input
 * @param severity   policy severity of the matched term
 * @param locations  character offsets {@code [start, end)} of the match
 * @param suggestion replacement from the policy, may be {@code null}
 * @param category   policy category, may be {@code null}
 */
public record ToneFlag(
        @JsonProperty("word") String word,
        @JsonProperty("severity") ToneSeverity severity,
        @JsonProperty("locations") List<Integer> locations,
        @JsonProperty("suggestion") String suggestion,
        @JsonProperty("category") String category
) {

    public ToneFlag {
        locations = locations == null ? List.of() : List.copyOf(locations);
    }

    public int start() {
        return locations.isEmpty() ? -1 : locations.get(0);
    }

    public int end() {
        return locations.size() < 2 ? start() + (word == null ? 0 : word.length()) : locations.get(1);
    }

    public boolean failing() {
        return severity == ToneSeverity.FAIL;
    }

    @Override
    public String toString() {
        return severity.wireName() + ":" + word + "@" + start();
    }
}
