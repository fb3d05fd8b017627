package dev.devanks.mediagen.orchestrator.model;

/**
 * Lifecycle of a remote generation task as seen by this service.
 * SUBMITTED and RUNNING are the only non-terminal values.
 */
public enum TaskStatus {
    SUBMITTED,
    RUNNING,
    SUCCEEDED,
    FAILED,
    CANCELLED,
    TIMED_OUT;

    public boolean isTerminal() {
        return this != SUBMITTED && this != RUNNING;
    }
}
