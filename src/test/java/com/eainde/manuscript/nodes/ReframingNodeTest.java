package com.eainde.manuscript.nodes;

import com.eainde.manuscript.collaborator.HumanDecisionChannel;
import com.eainde.manuscript.model.ConflictReport;
import com.eainde.manuscript.model.ConflictSeverity;
import com.eainde.manuscript.model.RecommendedNextStep;
import com.eainde.manuscript.model.ReframingProposal;
import com.eainde.manuscript.state.PipelineRun;
import com.eainde.manuscript.state.RigorLevel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class ReframingNodeTest {

    private static final String HASH = "f".repeat(64);

    @Mock
    private HumanDecisionChannel channel;

    private static PipelineRun deadlocked() {
        PipelineRun run = NodeFixtures.run(RigorLevel.CONSERVATIVE);
        run.setConflictReport(new ConflictReport(List.of(), HASH, ConflictSeverity.BLOCKER, true,
                RecommendedNextStep.TRIGGER_REFRAMING, 3));
        return run;
    }

    @Test
    @DisplayName("should suspend the run on a deterministic proposal and publish it")
    void suspends() {
        PipelineRun run = deadlocked();

        new ReframingNode(channel).execute(run);

        ArgumentCaptor<ReframingProposal> published = ArgumentCaptor.forClass(ReframingProposal.class);
        verify(channel).publish(published.capture());
        ReframingProposal proposal = published.getValue();
        assertThat(proposal.proposalId()).isEqualTo(ReframingNode.proposalId("job-1", HASH)).startsWith("reframe_");
        assertThat(proposal.pivotType()).isEqualTo("SCOPE");
        assertThat(proposal.proposal()).isEqualTo("Refine scope to reduce contradiction.");
        assertThat(proposal.requiresHumanSignoff()).isTrue();
        assertThat(run.getPendingDecision()).isEqualTo(proposal.proposalId());
        assertThat(run.isNeedsSignoff()).isTrue();
        assertThat(run.isNeedsHumanReview()).isTrue();
    }

    @Test
    @DisplayName("should stay suspended when publishing fails")
    void publishFailure() {
        doThrow(new IllegalStateException("smtp down")).when(channel).publish(any());
        PipelineRun run = deadlocked();

        new ReframingNode(channel).execute(run);

        assertThat(run.awaitingDecision()).isTrue();
        assertThat(run.isNeedsSignoff()).isTrue();
        assertThat(run.getWarnings()).containsExactly(ReframingNode.PUBLISH_FAILED);
    }

    @Test
    @DisplayName("should need no sign-off without a report that recommends reframing")
    void nothingToSignOff() {
        PipelineRun run = NodeFixtures.run(RigorLevel.CONSERVATIVE);
        run.setNeedsSignoff(true);

        new ReframingNode(channel).execute(run);

        assertThat(run.isNeedsSignoff()).isFalse();
        assertThat(run.awaitingDecision()).isFalse();
        verifyNoInteractions(channel);
    }
}
