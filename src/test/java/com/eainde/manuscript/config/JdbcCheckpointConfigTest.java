package com.eainde.manuscript.config;

import com.eainde.manuscript.checkpoint.CheckpointStore;
import com.eainde.manuscript.checkpoint.JdbcCheckpointStore;
import com.eainde.manuscript.state.PipelineRequest;
import com.eainde.manuscript.state.PipelineRun;
import com.eainde.manuscript.state.RigorLevel;
import com.eainde.manuscript.state.RunStatus;
import com.eainde.manuscript.workflow.WorkflowEngine;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(properties = {
        "manuscript.checkpoint.store=jdbc",
        "spring.datasource.url=jdbc:h2:mem:manuscript-jdbc-test;DB_CLOSE_DELAY=-1"
})
class JdbcCheckpointConfigTest {

    @Autowired
    private CheckpointStore checkpointStore;

    @Autowired
    private WorkflowEngine engine;

    @Autowired
    private JdbcTemplate jdbcTemplate;

    @Test
    @DisplayName("should checkpoint runs in the database when the jdbc store is selected")
    void jdbcStore() {
        assertThat(checkpointStore).isInstanceOf(JdbcCheckpointStore.class);

        PipelineRun run = engine.start(PipelineRequest.of("proj-jdbc",
                "X | IMPACTS | Y | 1\nX | IMPACTS | Z | 2", RigorLevel.CONSERVATIVE));

        assertThat(run.getStatus()).isEqualTo(RunStatus.AWAITING_SIGNOFF);
        assertThat(jdbcTemplate.queryForObject(
                "SELECT status FROM pipeline_checkpoint WHERE thread_id = ?", String.class, run.getThreadId()))
                .isEqualTo("AWAITING_SIGNOFF");
        assertThat(engine.history(run.getThreadId())).hasSizeGreaterThan(10);
    }
}
