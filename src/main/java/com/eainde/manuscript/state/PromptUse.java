package com.eainde.manuscript.state;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Entry of a run's prompt manifest: which prompt (or governance pass) ran, at which version.
 */
public record PromptUse(
        @JsonProperty("name") String name,
        @JsonProperty("version") String version,
        @JsonProperty("sha256") String sha256
) {
}
