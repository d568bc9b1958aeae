package tribe.scheduler.store;

import tribe.scheduler.model.CancelResult;
import tribe.scheduler.model.ExecutionStatus;
import tribe.scheduler.model.TaskExecution;
import tribe.scheduler.repository.ExecutionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * In-memory implementation of ExecutionRepository.
 * A single lock guards all four maps, so moving a record between partitions
 * is one atomic step and two workers can never finalize the same id twice.
 */
public class InMemoryExecutionStore implements ExecutionRepository {

    private static final Logger log = LoggerFactory.getLogger(InMemoryExecutionStore.class);

    private static final Comparator<TaskExecution> BY_CREATION = Comparator
            .comparing(TaskExecution::createdAt, Comparator.nullsLast(Comparator.naturalOrder()))
            .thenComparing(TaskExecution::id);

    private final ReentrantLock lock = new ReentrantLock();
    private final Map<String, TaskExecution> pending = new LinkedHashMap<>();
    private final Map<String, TaskExecution> running = new LinkedHashMap<>();
    private final Map<String, TaskExecution> completed = new LinkedHashMap<>();
    private final Map<String, String> results = new LinkedHashMap<>();

    @Override
    public void insertPending(TaskExecution execution) {
        if (execution.status() != ExecutionStatus.PENDING) {
            throw new IllegalArgumentException("Only PENDING executions can be inserted: " + execution);
        }
        locked(() -> {
            String id = execution.id();
            if (pending.containsKey(id) || running.containsKey(id) || completed.containsKey(id)) {
                throw new IllegalArgumentException("Duplicate execution id: " + id);
            }
            pending.put(id, execution);
            return null;
        });
    }

    @Override
    public Optional<TaskExecution> findById(String executionId) {
        return locked(() -> Optional.ofNullable(lookup(executionId)));
    }

    @Override
    public Optional<TaskExecution> findPending(String executionId) {
        return locked(() -> Optional.ofNullable(pending.get(executionId)));
    }

    @Override
    public boolean isRunning(String executionId) {
        return locked(() -> running.containsKey(executionId));
    }

    @Override
    public Optional<TaskExecution> findCompleted(String executionId) {
        return locked(() -> Optional.ofNullable(completed.get(executionId)));
    }

    @Override
    public Optional<String> findResult(String executionId) {
        return locked(() -> Optional.ofNullable(results.get(executionId)));
    }

    @Override
    public Map<String, String> findResults(Collection<String> executionIds) {
        return locked(() -> {
            Map<String, String> found = new LinkedHashMap<>();
            for (String id : executionIds) {
                String result = results.get(id);
                if (result != null) {
                    found.put(id, result);
                }
            }
            return found;
        });
    }

    @Override
    public CancelResult requestCancellation(String executionId) {
        return locked(() -> {
            if (completed.containsKey(executionId)) {
                return CancelResult.ALREADY_TERMINAL;
            }

            Map<String, TaskExecution> partition = pending.containsKey(executionId) ? pending
                    : running.containsKey(executionId) ? running
                    : null;
            if (partition == null) {
                return CancelResult.NOT_FOUND;
            }

            TaskExecution current = partition.get(executionId);
            if (current.cancellationRequested()) {
                return CancelResult.ALREADY_REQUESTED;
            }
            partition.put(executionId, current.toBuilder().cancellationRequested(true).build());
            return CancelResult.REQUESTED;
        });
    }

    @Override
    public Optional<TaskExecution> cancelPending(String executionId, Instant now) {
        return locked(() -> {
            TaskExecution current = pending.get(executionId);
            if (current == null || !current.cancellationRequested()) {
                return Optional.empty();
            }
            pending.remove(executionId);
            TaskExecution cancelled = cancelled(current, now);
            completed.put(executionId, cancelled);
            return Optional.of(cancelled);
        });
    }

    @Override
    public Optional<TaskExecution> markRunning(String executionId, Instant now) {
        return locked(() -> {
            TaskExecution current = pending.get(executionId);
            if (current == null || current.cancellationRequested()) {
                return Optional.empty();
            }
            pending.remove(executionId);
            TaskExecution started = current.toBuilder()
                    .status(ExecutionStatus.RUNNING)
                    .startedAt(now)
                    .build();
            running.put(executionId, started);
            return Optional.of(started);
        });
    }

    @Override
    public Optional<TaskExecution> recordSuccess(String executionId, String result, Instant now) {
        return locked(() -> {
            TaskExecution current = running.remove(executionId);
            if (current == null) {
                return Optional.empty();
            }

            TaskExecution finished;
            if (current.cancellationRequested()) {
                finished = cancelled(current, now);
            } else {
                finished = current.toBuilder()
                        .status(ExecutionStatus.COMPLETED)
                        .result(result)
                        .error(null)
                        .completedAt(now)
                        .build();
                // a null result counts as "no output"
                if (result != null) {
                    results.put(executionId, result);
                }
            }
            completed.put(executionId, finished);
            return Optional.of(finished);
        });
    }

    @Override
    public Optional<TaskExecution> recordFailure(String executionId, String error, boolean retryAllowed,
            Instant now) {
        return locked(() -> {
            TaskExecution current = running.remove(executionId);
            if (current == null) {
                return Optional.empty();
            }

            if (current.cancellationRequested()) {
                TaskExecution cancelled = cancelled(current, now);
                completed.put(executionId, cancelled);
                return Optional.of(cancelled);
            }

            if (retryAllowed && current.canRetry()) {
                // a retry waits as a fresh PENDING record; error is only kept on terminal ones
                TaskExecution retry = current.toBuilder()
                        .status(ExecutionStatus.PENDING)
                        .retryCount(current.retryCount() + 1)
                        .startedAt(null)
                        .error(null)
                        .build();
                pending.put(executionId, retry);
                return Optional.of(retry);
            }

            TaskExecution failed = current.toBuilder()
                    .status(ExecutionStatus.FAILED)
                    .error(error)
                    .completedAt(now)
                    .build();
            completed.put(executionId, failed);
            return Optional.of(failed);
        });
    }

    @Override
    public List<TaskExecution> findByStatus(ExecutionStatus status) {
        return locked(() -> {
            Collection<TaskExecution> source = switch (status) {
                case PENDING -> pending.values();
                case RUNNING -> running.values();
                case COMPLETED, FAILED, CANCELLED -> completed.values();
            };
            List<TaskExecution> matching = new ArrayList<>();
            for (TaskExecution execution : source) {
                if (execution.status() == status) {
                    matching.add(execution);
                }
            }
            matching.sort(BY_CREATION);
            return matching;
        });
    }

    @Override
    public Map<ExecutionStatus, Integer> countByStatus() {
        return locked(() -> {
            Map<ExecutionStatus, Integer> counts = new EnumMap<>(ExecutionStatus.class);
            for (ExecutionStatus status : ExecutionStatus.values()) {
                counts.put(status, 0);
            }
            counts.put(ExecutionStatus.PENDING, pending.size());
            counts.put(ExecutionStatus.RUNNING, running.size());
            for (TaskExecution execution : completed.values()) {
                counts.merge(execution.status(), 1, Integer::sum);
            }
            return counts;
        });
    }

    @Override
    public List<TaskExecution> evictCompletedBefore(Instant completedBefore) {
        return locked(() -> {
            List<TaskExecution> evicted = new ArrayList<>();
            for (Iterator<TaskExecution> it = completed.values().iterator(); it.hasNext();) {
                TaskExecution execution = it.next();
                Instant completedAt = execution.completedAt();
                if (completedAt != null && completedAt.isBefore(completedBefore)) {
                    it.remove();
                    results.remove(execution.id());
                    evicted.add(execution);
                }
            }
            if (!evicted.isEmpty()) {
                log.debug("Evicted {} terminal executions completed before {}", evicted.size(), completedBefore);
            }
            return evicted;
        });
    }

    private TaskExecution lookup(String executionId) {
        TaskExecution execution = pending.get(executionId);
        if (execution == null) {
            execution = running.get(executionId);
        }
        if (execution == null) {
            execution = completed.get(executionId);
        }
        return execution;
    }

    private static TaskExecution cancelled(TaskExecution current, Instant now) {
        return current.toBuilder()
                .status(ExecutionStatus.CANCELLED)
                .result(null)
                .error(null)
                .completedAt(now)
                .build();
    }

    private <T> T locked(Supplier<T> action) {
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }
}
