package com.enterprise.statements.model;

/**
 * Lifecycle of a statement job: QUEUED -> EXECUTING -> COMPLETED | FAILED.
 */
public enum JobStatus {
    QUEUED,
    EXECUTING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
