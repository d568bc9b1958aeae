package tribe.scheduler.service;

import tribe.scheduler.api.dto.ScheduleRequest;
import tribe.scheduler.config.SchedulerConfig;
import tribe.scheduler.core.ExecutionEvents;
import tribe.scheduler.core.TransitionSignal;
import tribe.scheduler.model.BatchEntryResult;
import tribe.scheduler.model.CancelResult;
import tribe.scheduler.model.ExecutionMode;
import tribe.scheduler.model.ExecutionStatus;
import tribe.scheduler.model.SchedulerStats;
import tribe.scheduler.model.TaskDependency;
import tribe.scheduler.model.TaskExecution;
import tribe.scheduler.repository.ExecutionRepository;
import tribe.scheduler.worker.ConcurrencyLimiter;
import tribe.scheduler.worker.ExecutionQueue;
import tribe.scheduler.worker.WorkerPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

/**
 * Public entry point of the scheduler.
 *
 * Callers submit executions and poll their status; nothing here ever throws
 * for well-formed input. Snapshots returned by {@link #getStatus(String)} are
 * immutable.
 */
public class TaskSchedulerService implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(TaskSchedulerService.class);

    private final ExecutionRepository store;
    private final ExecutionQueue queue;
    private final ConcurrencyLimiter limiter;
    private final WorkerPool workerPool;
    private final ExecutionEvents events;
    private final TransitionSignal signal;
    private final SchedulerConfig config;

    private volatile boolean closed = false;

    public TaskSchedulerService(ExecutionRepository store,
            ExecutionQueue queue,
            ConcurrencyLimiter limiter,
            WorkerPool workerPool,
            ExecutionEvents events,
            TransitionSignal signal,
            SchedulerConfig config) {
        this.store = store;
        this.queue = queue;
        this.limiter = limiter;
        this.workerPool = workerPool;
        this.events = events;
        this.signal = signal;
        this.config = config;
    }

    /**
     * Start dispatching queued executions.
     * Executions may be scheduled before this is called; they wait in the queue.
     */
    public void start() {
        if (closed) {
            throw new IllegalStateException("Scheduler is closed");
        }
        workerPool.start();
    }

    /**
     * Schedule one execution of a task.
     *
     * @param taskId        task registry id
     * @param executorId    executor to run the task with
     * @param executionMode mode hint, SYNC if null
     * @param dependencies  dependencies, none if null
     * @param priority      advisory priority, higher first
     * @param timeout       per-attempt timeout, configured default if null
     * @param maxRetries    retry budget, configured default if null
     * @return the new execution id
     * @throws IllegalArgumentException for malformed input
     */
    public String schedule(String taskId,
            String executorId,
            ExecutionMode executionMode,
            List<TaskDependency> dependencies,
            int priority,
            Duration timeout,
            Integer maxRetries) {
        if (closed) {
            throw new IllegalStateException("Scheduler is closed");
        }
        String rejection = validate(taskId, executorId, dependencies, timeout, maxRetries);
        if (rejection != null) {
            throw new IllegalArgumentException(rejection);
        }

        TaskExecution execution = TaskExecution.builder()
                .id(generateExecutionId())
                .taskId(taskId)
                .executorId(executorId)
                .executionMode(executionMode != null ? executionMode : ExecutionMode.SYNC)
                .dependencies(dependencies != null ? dependencies : List.of())
                .priority(priority)
                .timeout(timeout != null ? timeout : config.defaultTimeout())
                .maxRetries(maxRetries != null ? maxRetries : config.defaultMaxRetries())
                .status(ExecutionStatus.PENDING)
                .createdAt(Instant.now())
                .build();

        store.insertPending(execution);
        queue.offer(execution.id(), execution.priority());
        events.fire(execution);

        log.debug("Scheduled execution {} of task {} on executor {} ({} dependencies)",
                execution.id(), taskId, executorId, execution.dependencies().size());
        return execution.id();
    }

    /**
     * Schedule one execution from a request, applying configured defaults.
     */
    public String schedule(ScheduleRequest request) {
        String rejection = validate(request);
        if (rejection != null) {
            throw new IllegalArgumentException(rejection);
        }
        return schedule(
                request.taskId(),
                request.executorId(),
                request.executionMode(),
                request.toDependencies(),
                request.priority() != null ? request.priority() : 0,
                request.timeoutMs() != null ? Duration.ofMillis(request.timeoutMs()) : null,
                request.maxRetries());
    }

    /**
     * Schedule every well-formed entry; malformed entries are skipped and logged.
     *
     * @return ids of the scheduled executions, in submission order
     */
    public List<String> scheduleBatch(List<ScheduleRequest> requests) {
        List<String> ids = new ArrayList<>();
        for (BatchEntryResult entry : scheduleBatchDetailed(requests)) {
            if (entry.isAccepted()) {
                ids.add(entry.executionId());
            }
        }
        return ids;
    }

    /**
     * Schedule every well-formed entry and report the outcome of each one.
     */
    public List<BatchEntryResult> scheduleBatchDetailed(List<ScheduleRequest> requests) {
        List<BatchEntryResult> results = new ArrayList<>(requests.size());
        for (int i = 0; i < requests.size(); i++) {
            ScheduleRequest request = requests.get(i);
            String rejection = validate(request);
            if (rejection != null) {
                log.warn("Skipping batch entry {}: {}", i, rejection);
                results.add(BatchEntryResult.rejected(i, rejection));
                continue;
            }
            results.add(BatchEntryResult.accepted(i, schedule(request)));
        }

        long accepted = results.stream().filter(BatchEntryResult::isAccepted).count();
        log.info("Scheduled batch: {} of {} entries accepted", accepted, requests.size());
        return results;
    }

    /**
     * Request cooperative cancellation.
     *
     * @return true if the request took effect now, false if the execution is
     *         unknown, already terminal, or cancellation was already requested
     */
    public boolean cancel(String executionId) {
        CancelResult result = cancelDetailed(executionId);
        return result == CancelResult.REQUESTED;
    }

    /**
     * Request cooperative cancellation with a detailed result.
     */
    public CancelResult cancelDetailed(String executionId) {
        if (executionId == null) {
            return CancelResult.NOT_FOUND;
        }
        CancelResult result = store.requestCancellation(executionId);
        if (result == CancelResult.REQUESTED) {
            log.info("Cancellation requested for execution {}", executionId);
            store.findById(executionId).ifPresent(events::fire);
        } else {
            log.debug("Cancel of execution {} ignored: {}", executionId, result);
        }
        return result;
    }

    /**
     * Current snapshot of an execution.
     */
    public Optional<TaskExecution> getStatus(String executionId) {
        if (executionId == null) {
            return Optional.empty();
        }
        return store.findById(executionId);
    }

    /**
     * Wait until the execution reaches a terminal state or the wait expires.
     *
     * @return the latest snapshot, terminal or not; empty for unknown ids
     */
    public Optional<TaskExecution> awaitTerminal(String executionId, Duration maxWait) throws InterruptedException {
        long deadline = System.nanoTime() + maxWait.toNanos();
        while (true) {
            long generation = signal.generation();
            Optional<TaskExecution> current = getStatus(executionId);
            if (current.isEmpty() || current.get().isTerminal()) {
                return current;
            }
            long remaining = deadline - System.nanoTime();
            if (remaining <= 0) {
                return current;
            }
            signal.awaitChange(generation, Duration.ofNanos(remaining));
        }
    }

    /**
     * Find executions by status, oldest first.
     */
    public List<TaskExecution> findByStatus(ExecutionStatus status) {
        return store.findByStatus(status);
    }

    public SchedulerStats stats() {
        Map<ExecutionStatus, Integer> counts = store.countByStatus();
        return new SchedulerStats(
                counts.get(ExecutionStatus.PENDING),
                counts.get(ExecutionStatus.RUNNING),
                counts.get(ExecutionStatus.COMPLETED),
                counts.get(ExecutionStatus.FAILED),
                counts.get(ExecutionStatus.CANCELLED),
                limiter.availablePermits(),
                queue.size());
    }

    public ExecutionEvents events() {
        return events;
    }

    public boolean isRunning() {
        return workerPool.isRunning();
    }

    /**
     * Generate a new execution ID.
     */
    public String generateExecutionId() {
        return "exec-" + UUID.randomUUID();
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        workerPool.stop();
        log.info("Scheduler closed: {}", stats());
    }

    private static String validate(ScheduleRequest request) {
        if (request == null) {
            return "request is required";
        }
        if (request.timeoutMs() != null && request.timeoutMs() <= 0) {
            return "timeoutMs must be positive";
        }
        String dependencyProblem = request.dependencyProblem();
        if (dependencyProblem != null) {
            return dependencyProblem;
        }
        return validate(request.taskId(), request.executorId(), null, null, request.maxRetries());
    }

    private static String validate(String taskId, String executorId, List<TaskDependency> dependencies,
            Duration timeout, Integer maxRetries) {
        if (taskId == null || taskId.isBlank()) {
            return "taskId is required";
        }
        if (executorId == null || executorId.isBlank()) {
            return "executorId is required";
        }
        if (timeout != null && (timeout.isZero() || timeout.isNegative())) {
            return "timeout must be positive";
        }
        if (maxRetries != null && maxRetries < 0) {
            return "maxRetries must not be negative";
        }
        if (dependencies != null) {
            for (TaskDependency dependency : dependencies) {
                if (dependency == null) {
                    return "dependencies must not contain null";
                }
            }
        }
        return null;
    }
}
