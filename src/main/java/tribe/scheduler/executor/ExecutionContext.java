package tribe.scheduler.executor;

import tribe.scheduler.model.ExecutionMode;

import java.util.Map;
import java.util.function.BooleanSupplier;

/**
 * Per-attempt context handed to a {@link TaskExecutor}.
 *
 * @param executionId       id of the execution being run
 * @param taskId            registry id of the task
 * @param attempt           1-based attempt number
 * @param executionMode     mode hint of the execution
 * @param dependencyOutputs results of dependencies that produced one, by execution id
 * @param cancellationProbe reports whether the caller asked to cancel
 */
public record ExecutionContext(
        String executionId,
        String taskId,
        int attempt,
        ExecutionMode executionMode,
        Map<String, String> dependencyOutputs,
        BooleanSupplier cancellationProbe) {

    public ExecutionContext {
        dependencyOutputs = dependencyOutputs == null ? Map.of() : Map.copyOf(dependencyOutputs);
        cancellationProbe = cancellationProbe == null ? () -> false : cancellationProbe;
    }

    /**
     * Long-running executors may poll this and stop early.
     * The scheduler never interrupts a call because of a cancellation.
     */
    public boolean isCancellationRequested() {
        return cancellationProbe.getAsBoolean();
    }
}
