package com.eainde.manuscript.governance.conflict;

import com.eainde.manuscript.collaborator.ClaimStore;
import com.eainde.manuscript.governance.DeterministicScope;
import com.eainde.manuscript.model.Claim;
import com.eainde.manuscript.model.ConflictItem;
import com.eainde.manuscript.model.ConflictReport;
import com.eainde.manuscript.model.ConflictSeverity;
import com.eainde.manuscript.model.ConflictType;
import com.eainde.manuscript.model.RecommendedNextStep;
import com.eainde.manuscript.model.SourceAnchor;
import com.eainde.manuscript.model.SuggestedAction;
import com.eainde.manuscript.state.CriticStatus;
import com.eainde.manuscript.state.PipelineRun;
import com.eainde.manuscript.state.RigorLevel;
import lombok.extern.log4j.Log4j2;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;

/**
 * Finds contradictions between claims and turns a critic pass into a {@link ConflictReport}.
 *
 * <h3>Contradiction rule</h3>
 * Two claims contradict when their trimmed, lower-cased {@code (subject, predicate)} match and their
 * objects differ. Nothing else is detected automatically; there is no semantic judgment.
 *
 * <h3>Determinism</h3>
 * Claims are grouped in sorted maps and each group is ordered by claim id, so the detected items do not
 * depend on the order the store returned the claims in. Explanations are rendered inside a
 * {@link DeterministicScope}.
 */
@Log4j2
public class ConflictDetector {

    static final double CONTRADICTION_CONFIDENCE = 0.9;
    private static final String UNKNOWN_DOC = "unknown";

    private final ClaimStore claimStore;
    private final ConflictSettings settings;
    private final ConflictExplainer explainer;

    public ConflictDetector(ClaimStore claimStore, ConflictSettings settings) {
        this(claimStore, settings, new ConflictExplainer(settings.excerptLength()));
    }

    ConflictDetector(ClaimStore claimStore, ConflictSettings settings, ConflictExplainer explainer) {
        this.claimStore = claimStore;
        this.settings = settings;
        this.explainer = explainer;
    }

    /**
     * Loads the project's claims for the run, merges the run's own claims, and detects contradictions.
     * A failing claim store degrades to the run's claims only.
     */
    public ConflictDetection detect(PipelineRun run) {
        List<Claim> stored = List.of();
        String storeFailure = null;
        try {
            stored = claimStore.load(run.getProjectId(), run.getIngestionId(), run.getJobId());
        } catch (RuntimeException e) {
            storeFailure = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
            log.warn("CONFLICT: claim store unavailable for project {}, using {} run claims: {}",
                    run.getProjectId(), run.getClaims().size(), storeFailure);
        }
        Map<String, Claim> merged = new LinkedHashMap<>();
        stored.forEach(c -> merged.putIfAbsent(c.claimId(), c));
        run.getClaims().forEach(c -> merged.putIfAbsent(c.claimId(), c));

        List<Claim> claims = new ArrayList<>(merged.values());
        List<ConflictItem> items = findContradictions(claims);
        log.debug("CONFLICT: {} claims examined, {} contradictions", claims.size(), items.size());
        return new ConflictDetection(claims, items, storeFailure);
    }

    public List<ConflictItem> findContradictions(List<Claim> claims) {
        return DeterministicScope.call("conflict-explanation", () -> contradictions(claims));
    }

    private List<ConflictItem> contradictions(List<Claim> claims) {
        Map<String, Map<String, List<Claim>>> index = new TreeMap<>();
        for (Claim claim : claims) {
            String key = norm(claim.subject()) + "|" + norm(claim.predicate());
            index.computeIfAbsent(key, k -> new TreeMap<>())
                    .computeIfAbsent(norm(claim.object()), k -> new ArrayList<>())
                    .add(claim);
        }

        List<ConflictItem> items = new ArrayList<>();
        for (Map.Entry<String, Map<String, List<Claim>>> entry : index.entrySet()) {
            Map<String, List<Claim>> byObject = entry.getValue();
            if (byObject.size() < 2) {
                continue;
            }
            List<Claim> representatives = new ArrayList<>();
            List<String> contradicts = new ArrayList<>();
            for (List<Claim> group : byObject.values()) {
                group.sort(Comparator.comparing(Claim::claimId));
                representatives.add(group.get(0));
                group.forEach(c -> contradicts.add(c.claimId()));
            }
            items.add(contradiction(entry.getKey(), representatives, contradicts));
        }
        return items;
    }

    private ConflictItem contradiction(String key, List<Claim> representatives, List<String> contradicts) {
        Claim a = representatives.get(0);
        Claim b = representatives.get(1);
        String details = explainer.explain(ConflictType.CONTRADICTION,
                a.displayText(), a.pageNumber(), b.displayText(), b.pageNumber());
        if (representatives.size() > 2) {
            details += " " + (representatives.size() - 2) + " further source(s) assert other objects.";
        }
        List<SourceAnchor> anchors = representatives.stream().map(ConflictDetector::evidenceAnchor).toList();
        return new ConflictItem(
                "conflict_" + UUID.nameUUIDFromBytes(key.getBytes(StandardCharsets.UTF_8)),
                ConflictType.CONTRADICTION,
                ConflictSeverity.HIGH,
                "Contradiction detected: " + a.subject() + " " + a.predicate(),
                details,
                anchors,
                contradicts.stream().sorted().toList(),
                List.of(),
                List.of(SuggestedAction.RETRY_EXTRACTION, SuggestedAction.HUMAN_SIGNOFF_REQUIRED),
                CONTRADICTION_CONFIDENCE);
    }

    /**
     * Builds the report for one critic pass. The deadlock flag is derived, never counted:
     * the critic failed and {@code revisionCount} already reached the retry budget.
     */
    public ConflictReport buildReport(List<ConflictItem> items, CriticStatus status, int revisionCount,
                                      boolean needsHumanReview) {
        boolean failing = status == CriticStatus.FAIL;
        boolean deadlock = failing && revisionCount >= settings.maxRevisions();

        ConflictSeverity severity;
        if (items.isEmpty()) {
            severity = failing ? ConflictSeverity.MEDIUM : ConflictSeverity.LOW;
        } else if (revisionCount >= settings.maxRevisions() - 1) {
            severity = ConflictSeverity.BLOCKER;
        } else {
            severity = ConflictSeverity.HIGH;
        }

        RecommendedNextStep next;
        if (deadlock) {
            next = RecommendedNextStep.TRIGGER_REFRAMING;
        } else if (needsHumanReview) {
            next = RecommendedNextStep.PAUSE_FOR_HUMAN;
        } else if (failing) {
            next = RecommendedNextStep.REVISE_AND_RETRY;
        } else {
            next = RecommendedNextStep.PROCEED;
        }
        return new ConflictReport(items, ConflictHasher.hash(items), severity, deadlock, next, revisionCount);
    }

    public boolean requiresHumanReview(RigorLevel rigor, int conflictCount) {
        return rigor == RigorLevel.CONSERVATIVE && conflictCount > settings.humanReviewThreshold();
    }

    private static SourceAnchor evidenceAnchor(Claim claim) {
        if (claim.sourceAnchor() != null) {
            return claim.sourceAnchor();
        }
        // unanchored claims still need one anchor; the explanation keeps reporting their page as unknown
        String docId = claim.fileHash() == null || claim.fileHash().isBlank() ? UNKNOWN_DOC : claim.fileHash();
        return SourceAnchor.ofSnippet(docId, 1, claim.displayText());
    }

    private static String norm(String value) {
        return value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
    }
}
