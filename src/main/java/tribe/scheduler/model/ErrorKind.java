package tribe.scheduler.model;

/**
 * Internal error taxonomy. None of these are thrown to callers; they show up
 * in logs and in the final status/error of an execution.
 */
public enum ErrorKind {
    /** Dependencies not yet met - requeued */
    DEPENDENCY_UNRESOLVED,
    /** Attempt exceeded its timeout - counts against retries */
    EXECUTION_TIMEOUT,
    /** Executor threw - counts against retries */
    EXECUTOR_FAILURE,
    /** Last attempt failed with no retries left */
    RETRIES_EXHAUSTED,
    /** Caller cancelled the execution */
    CANCELLATION_REQUESTED
}
