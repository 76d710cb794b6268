package io.jobkeeper.core;

public enum ExecutionOutcome {
    RUNNING,
    SUCCEEDED,
    FAILED,
    SKIPPED_DUPLICATE;

    public boolean isFinal() {
        return this != RUNNING;
    }
}
