package com.eainde.manuscript.collaborator;

import com.eainde.manuscript.state.PipelineRun;
import com.eainde.manuscript.state.SaveReceipt;

/**
 * Final persistence of a finished run.
 */
public interface ManuscriptStore {

    SaveReceipt save(PipelineRun run);
}
