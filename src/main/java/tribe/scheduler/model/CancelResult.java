package tribe.scheduler.model;

/**
 * Result of a cancellation request.
 */
public enum CancelResult {
    /** Flag set on a pending or running execution */
    REQUESTED,

    /** Cancellation was already requested earlier - idempotent no-op */
    ALREADY_REQUESTED,

    /** Execution already reached a terminal state */
    ALREADY_TERMINAL,

    /** Execution not found */
    NOT_FOUND
}
