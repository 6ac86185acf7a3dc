package com.eainde.manuscript.checkpoint;

import com.eainde.manuscript.state.PipelineRun;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Keeps every snapshot of every thread as JSON, in memory.
 */
public class InMemoryCheckpointStore implements CheckpointStore {

    private final Map<String, List<String>> storage = new ConcurrentHashMap<>();
    private final CheckpointCodec codec;

    public InMemoryCheckpointStore(CheckpointCodec codec) {
        this.codec = codec;
    }

    @Override
    public void save(String threadId, PipelineRun run) {
        if (threadId == null) {
            throw new IllegalArgumentException("Thread ID is required");
        }
        String json = codec.encode(run);
        storage.compute(threadId, (k, snapshots) -> {
            List<String> list = snapshots == null ? new ArrayList<>() : snapshots;
            synchronized (list) {
                list.add(json);
            }
            return list;
        });
    }

    @Override
    public Optional<PipelineRun> load(String threadId) {
        List<String> snapshots = storage.get(threadId);
        if (snapshots == null) {
            return Optional.empty();
        }
        String latest;
        synchronized (snapshots) {
            if (snapshots.isEmpty()) {
                return Optional.empty();
            }
            latest = snapshots.get(snapshots.size() - 1);
        }
        return Optional.of(codec.decode(latest));
    }

    @Override
    public List<PipelineRun> history(String threadId) {
        List<String> snapshots = storage.get(threadId);
        if (snapshots == null) {
            return List.of();
        }
        List<String> copy;
        synchronized (snapshots) {
            copy = new ArrayList<>(snapshots);
        }
        return copy.stream().map(codec::decode).toList();
    }

    @Override
    public boolean delete(String threadId) {
        return storage.remove(threadId) != null;
    }

    @Override
    public Set<String> threadIds() {
        return Set.copyOf(storage.keySet());
    }
}
