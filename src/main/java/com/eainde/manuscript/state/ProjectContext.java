package com.eainde.manuscript.state;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record ProjectContext(
        @JsonProperty("thesis") String thesis,
        @JsonProperty("research_questions") List<String> researchQuestions
) {

    public ProjectContext {
        thesis = thesis == null ? "" : thesis;
        researchQuestions = researchQuestions == null ? List.of() : List.copyOf(researchQuestions);
    }

    public static ProjectContext empty() {
        return new ProjectContext("", List.of());
    }
}
