package tribe.scheduler.repository;

import tribe.scheduler.model.CancelResult;
import tribe.scheduler.model.ExecutionStatus;
import tribe.scheduler.model.TaskExecution;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Status store for task executions.
 *
 * Records live in one of three partitions: pending, running or completed
 * (the completed partition holds every terminal record, successful or not).
 * Results of successful executions are kept separately by execution id.
 * Every method is atomic; transitions only succeed from the expected
 * partition, and terminal records are never modified.
 */
public interface ExecutionRepository {

    /**
     * Insert a new PENDING execution.
     *
     * @param execution the execution to insert
     * @throws IllegalArgumentException if it is not PENDING or the id is taken
     */
    void insertPending(TaskExecution execution);

    /**
     * Find an execution by ID in any partition.
     *
     * @param executionId the execution ID
     * @return the current snapshot if found
     */
    Optional<TaskExecution> findById(String executionId);

    /**
     * Find an execution in the pending partition only.
     */
    Optional<TaskExecution> findPending(String executionId);

    /**
     * Check if an execution is in the running partition.
     */
    boolean isRunning(String executionId);

    /**
     * Find an execution in the completed (terminal) partition.
     */
    Optional<TaskExecution> findCompleted(String executionId);

    /**
     * Find the stored result of a successful execution.
     */
    Optional<String> findResult(String executionId);

    /**
     * Collect stored results for the given ids, skipping ids without one.
     */
    Map<String, String> findResults(Collection<String> executionIds);

    /**
     * Set the cancellation flag of a PENDING or RUNNING execution.
     *
     * @param executionId the execution ID
     * @return detailed result of the request
     */
    CancelResult requestCancellation(String executionId);

    /**
     * Move a PENDING execution whose cancellation was requested to the
     * completed partition with status CANCELLED.
     *
     * @param executionId the execution ID
     * @param now         completion timestamp
     * @return the cancelled snapshot, empty if not pending or not flagged
     */
    Optional<TaskExecution> cancelPending(String executionId, Instant now);

    /**
     * Move a PENDING execution to RUNNING.
     * Fails if the execution is not pending or cancellation was requested.
     *
     * @param executionId the execution ID
     * @param now         start timestamp
     * @return the running snapshot, empty if the transition did not happen
     */
    Optional<TaskExecution> markRunning(String executionId, Instant now);

    /**
     * Finish a RUNNING attempt successfully.
     * If cancellation was requested meanwhile the execution becomes CANCELLED
     * and the result is discarded; otherwise COMPLETED and the result is stored.
     *
     * @return the resulting snapshot, empty if the execution was not running
     */
    Optional<TaskExecution> recordSuccess(String executionId, String result, Instant now);

    /**
     * Finish a RUNNING attempt with a failure.
     * If cancellation was requested meanwhile the execution becomes CANCELLED.
     * Otherwise, when {@code retryAllowed} and retries remain, the retry
     * counter is incremented and the execution goes back to PENDING;
     * else it becomes FAILED with the given error.
     *
     * @return the resulting snapshot, empty if the execution was not running
     */
    Optional<TaskExecution> recordFailure(String executionId, String error, boolean retryAllowed, Instant now);

    /**
     * Find executions by status.
     *
     * @param status the status to filter by
     * @return snapshots ordered by creation time
     */
    List<TaskExecution> findByStatus(ExecutionStatus status);

    /**
     * Count executions per status. Every status is present in the map.
     */
    Map<ExecutionStatus, Integer> countByStatus();

    /**
     * Evict terminal executions (and their results) completed before the cutoff.
     *
     * @param completedBefore cutoff timestamp
     * @return evicted executions
     */
    List<TaskExecution> evictCompletedBefore(Instant completedBefore);
}
