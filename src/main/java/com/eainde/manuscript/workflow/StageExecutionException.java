package com.eainde.manuscript.workflow;

/**
 * A stage threw something other than a governance violation. The invocation was aborted and the stage's
 * result was not checkpointed.
 */
public class StageExecutionException extends RuntimeException {

    private final Stage stage;
    private final String threadId;

    public StageExecutionException(Stage stage, String threadId, Throwable cause) {
        super("Stage " + stage.wireName() + " failed for thread " + threadId + ": " + cause.getMessage(), cause);
        this.stage = stage;
        this.threadId = threadId;
    }

    public Stage getStage() {
        return stage;
    }

    public String getThreadId() {
        return threadId;
    }
}
