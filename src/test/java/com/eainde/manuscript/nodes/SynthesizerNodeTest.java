package com.eainde.manuscript.nodes;

import com.eainde.manuscript.collaborator.ClaimListDrafter;
import com.eainde.manuscript.collaborator.Drafter;
import com.eainde.manuscript.governance.GovernanceViolationException;
import com.eainde.manuscript.model.Claim;
import com.eainde.manuscript.model.ExtractedTriple;
import com.eainde.manuscript.model.ExtractionResult;
import com.eainde.manuscript.model.ManuscriptBlock;
import com.eainde.manuscript.state.PipelineRun;
import com.eainde.manuscript.state.RigorLevel;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SynthesizerNodeTest {

    private final ExtractedTriple triple = NodeFixtures.triple("X", "INCREASES", "Y", 1);

    private PipelineRun mapped(RigorLevel rigor) {
        PipelineRun run = NodeFixtures.run(rigor);
        run.setExtraction(new ExtractionResult(List.of(triple), List.of()));
        run.setClaims(new ArrayList<>(List.of(Claim.fromTriple(triple, NodeFixtures.DOC, null))));
        return run;
    }

    private SynthesizerNode node(Drafter drafter) {
        return new SynthesizerNode(drafter, NodeFixtures.prompts(), new ObjectMapper());
    }

    private String claimId() {
        return Claim.fromTriple(triple, NodeFixtures.DOC, null).claimId();
    }

    @Test
    @DisplayName("should bind inline citations of a prose draft into a single block")
    void proseDraft() {
        PipelineRun run = mapped(RigorLevel.CONSERVATIVE);

        node(new ClaimListDrafter()).execute(run);

        assertThat(run.getSynthesis()).isEqualTo("X increases Y [[" + claimId() + "]].");
        assertThat(run.getManuscriptBlocks()).singleElement()
                .satisfies(block -> {
                    assertThat(block.blockId()).isEqualTo("block_job-1_0");
                    assertThat(block.claimIds()).containsExactly(claimId());
                });
    }

    @Test
    @DisplayName("should read a JSON block array and merge declared and inline claim ids")
    void blockArray() {
        String id = claimId();
        PipelineRun run = mapped(RigorLevel.CONSERVATIVE);
        Drafter drafter = (triples, citations, rigor) ->
                "[{\"block_id\": \"intro\", \"section_id\": \"s1\", \"text\": \"X increases Y [[" + id + "]].\"},"
                        + " {\"block_id\": \"body\", \"text\": \"More detail.\", \"claim_ids\": [\"" + id + "\"]}]";

        node(drafter).execute(run);

        assertThat(run.getManuscriptBlocks()).extracting(ManuscriptBlock::blockId).containsExactly("intro", "body");
        assertThat(run.getManuscriptBlocks()).allSatisfy(b -> assertThat(b.claimIds()).containsExactly(id));
    }

    @Test
    @DisplayName("should fall back to a summary sentence for an empty draft")
    void emptyDraft() {
        PipelineRun run = mapped(RigorLevel.EXPLORATORY);

        node((triples, citations, rigor) -> "  ").execute(run);

        assertThat(run.getSynthesis()).isEqualTo("Synthesized summary: processed 1 triples.");
    }

    @Test
    @DisplayName("should force a failure when the drafter throws")
    void drafterFailure() {
        PipelineRun run = mapped(RigorLevel.CONSERVATIVE);

        node((triples, citations, rigor) -> {
            throw new IllegalStateException("model down");
        }).execute(run);

        assertThat(run.isForceFailure()).isTrue();
        assertThat(run.getFailureReason()).isEqualTo("Drafter failed: model down");
        assertThat(run.getManuscriptBlocks()).isEmpty();
    }

    @Nested
    @DisplayName("Citation integrity")
    class Integrity {

        private final Drafter unknownCitation = (triples, citations, rigor) -> "X increases Y [[nope]].";

        @Test
        @DisplayName("should refuse unknown citations in conservative mode")
        void conservative() {
            PipelineRun run = mapped(RigorLevel.CONSERVATIVE);

            assertThatThrownBy(() -> node(unknownCitation).execute(run))
                    .isInstanceOf(GovernanceViolationException.class)
                    .satisfies(e -> assertThat(((GovernanceViolationException) e).getFlags())
                            .containsExactly("citation:block_job-1_0:unknown_claim:nope"));
        }

        @Test
        @DisplayName("should downgrade citation problems to warnings in exploratory mode")
        void exploratory() {
            PipelineRun run = mapped(RigorLevel.EXPLORATORY);

            node(unknownCitation).execute(run);

            assertThat(run.getWarnings()).containsExactly("citation:block_job-1_0:unknown_claim:nope");
        }
    }
}
