package tribe.scheduler.executor;

import tribe.scheduler.model.TaskDescriptor;

/**
 * Capability that performs the actual work of a task.
 *
 * Calls may block or throw. The scheduler runs them on a separate thread and
 * stops waiting once the attempt timeout expires, cancelling the call with an
 * interrupt on a best-effort basis, so implementations must tolerate being
 * abandoned mid-call.
 */
@FunctionalInterface
public interface TaskExecutor {

    /**
     * Run one attempt of a task.
     *
     * @param task    descriptor resolved from the task registry
     * @param context per-attempt context
     * @return the task result
     * @throws Exception any failure; counted against the retry budget
     */
    String run(TaskDescriptor task, ExecutionContext context) throws Exception;
}
