package com.eainde.manuscript.checkpoint;

import com.eainde.manuscript.state.PipelineRun;
import org.springframework.dao.EmptyResultDataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Checkpoints in a relational table.
 * <p>
 * {@code pipeline_checkpoint} holds the latest snapshot per thread; {@code pipeline_checkpoint_history}
 * keeps every snapshot. See {@code schema.sql}. Both rows of a save commit together.
 * </p>
 */
public class JdbcCheckpointStore implements CheckpointStore {

    private final JdbcTemplate jdbcTemplate;
    private final TransactionTemplate transactionTemplate;
    private final CheckpointCodec codec;

    public JdbcCheckpointStore(JdbcTemplate jdbcTemplate, TransactionTemplate transactionTemplate,
                               CheckpointCodec codec) {
        this.jdbcTemplate = jdbcTemplate;
        this.transactionTemplate = transactionTemplate;
        this.codec = codec;
    }

    @Override
    public void save(String threadId, PipelineRun run) {
        String json = codec.encode(run);
        String stage = run.getCurrentStage() == null ? null : run.getCurrentStage().name();
        transactionTemplate.executeWithoutResult(status -> {
            jdbcTemplate.update("""
                    MERGE INTO pipeline_checkpoint (thread_id, job_id, phase, stage, status, run_data, updated_at)
                    KEY (thread_id)
                    VALUES (?, ?, ?, ?, ?, ?, CURRENT_TIMESTAMP)
                    """, threadId, run.getJobId(), run.getPhase().name(), stage, run.getStatus().name(), json);
            // PostgreSQL: INSERT ... ON CONFLICT (thread_id) DO UPDATE SET ...
            jdbcTemplate.update("""
                    INSERT INTO pipeline_checkpoint_history (thread_id, stage, run_data, created_at)
                    VALUES (?, ?, ?, CURRENT_TIMESTAMP)
                    """, threadId, stage, json);
        });
    }

    @Override
    public Optional<PipelineRun> load(String threadId) {
        try {
            String json = jdbcTemplate.queryForObject(
                    "SELECT run_data FROM pipeline_checkpoint WHERE thread_id = ?",
                    String.class,
                    threadId);
            return Optional.of(codec.decode(json));
        } catch (EmptyResultDataAccessException e) {
            return Optional.empty();
        }
    }

    @Override
    public List<PipelineRun> history(String threadId) {
        return jdbcTemplate.query(
                "SELECT run_data FROM pipeline_checkpoint_history WHERE thread_id = ? ORDER BY id",
                (rs, rowNum) -> codec.decode(rs.getString("run_data")),
                threadId);
    }

    @Override
    public boolean delete(String threadId) {
        Integer rows = transactionTemplate.execute(status -> {
            jdbcTemplate.update("DELETE FROM pipeline_checkpoint_history WHERE thread_id = ?", threadId);
            return jdbcTemplate.update("DELETE FROM pipeline_checkpoint WHERE thread_id = ?", threadId);
        });
        return rows != null && rows > 0;
    }

    @Override
    public Set<String> threadIds() {
        return new HashSet<>(jdbcTemplate.queryForList("SELECT thread_id FROM pipeline_checkpoint", String.class));
    }
}
