package tribe.scheduler.worker;

import tribe.scheduler.core.ExecutionEvents;
import tribe.scheduler.core.TransitionSignal;
import tribe.scheduler.model.TaskExecution;
import tribe.scheduler.repository.ExecutionRepository;
import tribe.scheduler.service.DependencyResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import java.util.function.BooleanSupplier;

/**
 * One worker slot.
 * Loops: dequeue -> cancellation check -> dependency check -> acquire permit
 * -> run attempt -> record outcome -> release permit.
 * Stops when the pool stops or on Thread.interrupt().
 */
public final class Worker implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(Worker.class);

    private final String name;
    private final ExecutionRepository store;
    private final ExecutionQueue queue;
    private final ConcurrencyLimiter limiter;
    private final DependencyResolver resolver;
    private final AttemptRunner attemptRunner;
    private final ExecutionEvents events;
    private final TransitionSignal signal;
    private final RetryDispatcher retryDispatcher;
    private final BooleanSupplier active;
    private final Duration pollInterval;
    private final Duration dependencyRetryDelay;
    private final boolean retryFailedTasks;

    Worker(String name,
            ExecutionRepository store,
            ExecutionQueue queue,
            ConcurrencyLimiter limiter,
            DependencyResolver resolver,
            AttemptRunner attemptRunner,
            ExecutionEvents events,
            TransitionSignal signal,
            RetryDispatcher retryDispatcher,
            BooleanSupplier active,
            Duration pollInterval,
            Duration dependencyRetryDelay,
            boolean retryFailedTasks) {
        this.name = name;
        this.store = store;
        this.queue = queue;
        this.limiter = limiter;
        this.resolver = resolver;
        this.attemptRunner = attemptRunner;
        this.events = events;
        this.signal = signal;
        this.retryDispatcher = retryDispatcher;
        this.active = active;
        this.pollInterval = pollInterval;
        this.dependencyRetryDelay = dependencyRetryDelay;
        this.retryFailedTasks = retryFailedTasks;
    }

    @Override
    public void run() {
        Thread.currentThread().setName(name);
        log.debug("Worker {} started", name);

        while (active.getAsBoolean() && !Thread.currentThread().isInterrupted()) {
            try {
                String executionId = queue.poll(pollInterval);
                if (executionId != null) {
                    process(executionId);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (RuntimeException e) {
                log.error("Worker {} error", name, e);
            }
        }

        log.debug("Worker {} stopped", name);
    }

    /**
     * Handle one dequeued id.
     */
    void process(String executionId) throws InterruptedException {
        // 1. Lookup
        Optional<TaskExecution> found = store.findPending(executionId);
        if (found.isEmpty()) {
            log.debug("Execution {} no longer pending, dropping", executionId);
            return;
        }
        TaskExecution execution = found.get();

        // 2. Cancellation
        if (execution.cancellationRequested()) {
            cancelPending(executionId);
            return;
        }

        // 3. Dependencies
        long generation = signal.generation();
        if (!resolver.isSatisfied(execution)) {
            queue.requeue(executionId);
            signal.awaitChange(generation, dependencyRetryDelay);
            return;
        }

        // 4. Admission
        limiter.acquire();
        try {
            Optional<TaskExecution> started = store.markRunning(executionId, Instant.now());
            if (started.isEmpty()) {
                // cancelled between the checks above and admission
                cancelPending(executionId);
                return;
            }
            events.fire(started.get());
            log.debug("Execution {} started attempt {}", executionId, started.get().attempt());

            // 5. Execute
            AttemptResult attempt;
            try {
                attempt = attemptRunner.run(started.get());
            } catch (InterruptedException e) {
                store.recordFailure(executionId, "scheduler stopped before the attempt finished", false,
                        Instant.now()).ifPresent(events::fire);
                throw e;
            }

            // 6. Outcome
            Optional<TaskExecution> finished = attempt.success()
                    ? store.recordSuccess(executionId, attempt.result(), Instant.now())
                    : store.recordFailure(executionId, attempt.error(), retryFailedTasks, Instant.now());
            if (finished.isPresent()) {
                afterAttempt(finished.get(), attempt);
            }
        } finally {
            // 7. Release
            limiter.release();
        }
    }

    private void afterAttempt(TaskExecution execution, AttemptResult attempt) {
        events.fire(execution);

        switch (execution.status()) {
            case COMPLETED -> log.info("Execution {} completed (attempt {})", execution.id(), execution.attempt());
            case PENDING -> {
                log.warn("Execution {} failed, retry {} of {}: {}",
                        execution.id(), execution.retryCount(), execution.maxRetries(), attempt.error());
                retryDispatcher.dispatch(execution);
            }
            case FAILED -> log.warn("Execution {} permanently failed after {} attempt(s): {}",
                    execution.id(), execution.attempt(), execution.error());
            case CANCELLED -> log.info("Execution {} cancelled after attempt {}", execution.id(), execution.attempt());
            case RUNNING -> log.error("Execution {} still RUNNING after its attempt", execution.id());
        }
    }

    private void cancelPending(String executionId) {
        store.cancelPending(executionId, Instant.now()).ifPresent(cancelled -> {
            log.info("Execution {} cancelled before running", executionId);
            events.fire(cancelled);
        });
    }

    String name() {
        return name;
    }
}
