package tribe.scheduler.model;

/**
 * Lifecycle status of a task execution.
 */
public enum ExecutionStatus {
    /** Scheduled, waiting for dependencies or a free worker */
    PENDING,
    /** Attempt in progress inside the executor */
    RUNNING,
    /** Finished successfully */
    COMPLETED,
    /** Failed permanently (retries exhausted or disabled) */
    FAILED,
    /** Cancelled by the caller */
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED || this == CANCELLED;
    }
}
