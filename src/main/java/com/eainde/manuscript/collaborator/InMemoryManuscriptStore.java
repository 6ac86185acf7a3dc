package com.eainde.manuscript.collaborator;

import com.eainde.manuscript.state.PipelineRun;
import com.eainde.manuscript.state.SaveReceipt;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Component
public class InMemoryManuscriptStore implements ManuscriptStore {

    static final String COLLECTION = "manuscripts";

    private final Map<String, PipelineRun> saved = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemoryManuscriptStore(Clock clock) {
        this.clock = clock;
    }

    @Override
    public SaveReceipt save(PipelineRun run) {
        saved.put(run.getJobId(), run);
        return new SaveReceipt(COLLECTION, run.getJobId(), clock.instant(), SaveReceipt.SAVED);
    }

    public Optional<PipelineRun> find(String jobId) {
        return Optional.ofNullable(saved.get(jobId));
    }
}
