package tribe.scheduler.model;

/**
 * Execution mode hint carried on a task execution.
 * Used by callers composing workflows; the scheduler dispatches every mode
 * the same way.
 */
public enum ExecutionMode {
    SYNC,
    ASYNC,
    PARALLEL,
    CONCURRENT
}
