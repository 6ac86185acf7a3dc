package com.eainde.manuscript.workflow;

public class RunNotFoundException extends RuntimeException {

    public RunNotFoundException(String threadId) {
        super("No checkpoint for thread " + threadId);
    }
}
