package com.eainde.manuscript.nodes;

import com.eainde.manuscript.state.PipelineRun;
import com.eainde.manuscript.workflow.Stage;

/**
 * One pipeline stage. Implementations mutate the working copy of the run they are given; the engine
 * decides whether that copy becomes the next checkpoint.
 */
public interface PipelineNode {

    Stage stage();

    void execute(PipelineRun run);
}
