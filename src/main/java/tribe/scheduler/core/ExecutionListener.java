package tribe.scheduler.core;

import tribe.scheduler.model.TaskExecution;

/**
 * Callback for execution status transitions.
 */
@FunctionalInterface
public interface ExecutionListener {

    /**
     * Called after a transition is stored, on the thread that made it.
     * Implementations must be quick and must not block.
     *
     * @param execution snapshot after the transition
     */
    void onTransition(TaskExecution execution);
}
