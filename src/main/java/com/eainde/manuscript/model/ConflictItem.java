package com.eainde.manuscript.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * One detected conflict between claims.
 *
 * @param conflictId       stable id of the conflict
 * @param conflictType     template family used for the explanation
 * @param severity         how strongly the conflict blocks the run
 * @param summary          one-line summary
 * @param details          templated explanation naming each source's page
 * @param evidenceAnchors  at least one anchor per conflict
 * @param contradicts      ids of the claims involved
 * @param assumptions      assumptions the claims rely on
 * @param suggestedActions remediation hints
 * @param confidence       detection confidence in [0, 1]
 */
public record ConflictItem(
        @JsonProperty("conflict_id") String conflictId,
        @JsonProperty("conflict_type") ConflictType conflictType,
        @JsonProperty("severity") ConflictSeverity severity,
        @JsonProperty("summary") String summary,
        @JsonProperty("details") String details,
        @JsonProperty("evidence_anchors") List<SourceAnchor> evidenceAnchors,
        @JsonProperty("contradicts") List<String> contradicts,
        @JsonProperty("assumptions") List<String> assumptions,
        @JsonProperty("suggested_actions") List<SuggestedAction> suggestedActions,
        @JsonProperty("confidence") double confidence
) {

    public ConflictItem {
        if (conflictType == null || severity == null) {
            throw new IllegalArgumentException("ConflictItem requires a type and a severity");
        }
        if (evidenceAnchors == null || evidenceAnchors.isEmpty()) {
            throw new IllegalArgumentException("ConflictItem requires at least one evidence anchor");
        }
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("ConflictItem confidence must be within [0, 1], was " + confidence);
        }
        evidenceAnchors = List.copyOf(evidenceAnchors);
        contradicts = contradicts == null ? List.of() : List.copyOf(contradicts);
        assumptions = assumptions == null ? List.of() : List.copyOf(assumptions);
        suggestedActions = suggestedActions == null ? List.of() : List.copyOf(suggestedActions);
    }

    public ConflictItem withSeverity(ConflictSeverity newSeverity, List<SuggestedAction> actions) {
        return new ConflictItem(conflictId, conflictType, newSeverity, summary, details,
                evidenceAnchors, contradicts, assumptions, actions, confidence);
    }
}
