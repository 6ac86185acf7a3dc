package com.eainde.manuscript.state;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

public record SaveReceipt(
        @JsonProperty("collection") String collection,
        @JsonProperty("key") String key,
        @JsonProperty("saved_at") Instant savedAt,
        @JsonProperty("status") String status
) {

    public static final String SAVED = "SAVED";
}
