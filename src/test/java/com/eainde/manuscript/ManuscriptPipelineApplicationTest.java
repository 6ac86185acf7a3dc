package com.eainde.manuscript;

import com.eainde.manuscript.checkpoint.CheckpointStore;
import com.eainde.manuscript.checkpoint.InMemoryCheckpointStore;
import com.eainde.manuscript.collaborator.ClaimListDrafter;
import com.eainde.manuscript.collaborator.DelimitedTripleExtractor;
import com.eainde.manuscript.collaborator.Drafter;
import com.eainde.manuscript.collaborator.Extractor;
import com.eainde.manuscript.governance.tone.TonePolicy;
import com.eainde.manuscript.state.PipelineRequest;
import com.eainde.manuscript.state.PipelineRun;
import com.eainde.manuscript.state.RigorLevel;
import com.eainde.manuscript.state.RunStatus;
import com.eainde.manuscript.workflow.WorkflowEngine;
import dev.langchain4j.model.chat.ChatModel;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
class ManuscriptPipelineApplicationTest {

    @Autowired
    private ApplicationContext context;

    @Autowired
    private WorkflowEngine engine;

    @Test
    @DisplayName("should wire the local collaborators when no model endpoint is configured")
    void localCollaborators() {
        assertThat(context.getBeanNamesForType(ChatModel.class)).isEmpty();
        assertThat(context.getBean(Extractor.class)).isInstanceOf(DelimitedTripleExtractor.class);
        assertThat(context.getBean(Drafter.class)).isInstanceOf(ClaimListDrafter.class);
        assertThat(context.getBean(CheckpointStore.class)).isInstanceOf(InMemoryCheckpointStore.class);
        assertThat(context.getBean(TonePolicy.class).find("revolutionary")).isPresent();
    }

    @Test
    @DisplayName("should run a document end to end through the wired engine")
    void endToEnd() {
        PipelineRun run = engine.start(PipelineRequest.of("proj-ctx",
                "Soil moisture | INCREASES | crop yield | 1", RigorLevel.CONSERVATIVE));

        assertThat(run.getStatus()).isEqualTo(RunStatus.COMPLETED);
        assertThat(engine.getRun(run.getThreadId())).isPresent();
    }
}
