package com.eainde.manuscript.model;

import com.fasterxml.jackson.annotation.JsonProperty;

public record PrecisionFlag(
        @JsonProperty("table_id") String tableId,
        @JsonProperty("column") String column,
        @JsonProperty("issue") PrecisionIssue issue,
        @JsonProperty("details") String details
) {

    @Override
    public String toString() {
        return issue + "(" + tableId + "." + column + "): " + details;
    }
}
