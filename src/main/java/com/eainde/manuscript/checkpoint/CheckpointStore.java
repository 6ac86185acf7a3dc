package com.eainde.manuscript.checkpoint;

import com.eainde.manuscript.state.PipelineRun;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Snapshots of pipeline runs keyed by thread id. Implementations must store copies: mutating a run
 * after {@link #save} must not change what {@link #load} returns.
 */
public interface CheckpointStore {

    void save(String threadId, PipelineRun run);

    Optional<PipelineRun> load(String threadId);

    /** All snapshots written for the thread, oldest first. */
    List<PipelineRun> history(String threadId);

    boolean delete(String threadId);

    Set<String> threadIds();
}
