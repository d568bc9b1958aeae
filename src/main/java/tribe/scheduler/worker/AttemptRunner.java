package tribe.scheduler.worker;

import tribe.scheduler.executor.ExecutionContext;
import tribe.scheduler.executor.ExecutorRegistry;
import tribe.scheduler.executor.TaskExecutor;
import tribe.scheduler.model.TaskDependency;
import tribe.scheduler.model.TaskDescriptor;
import tribe.scheduler.model.TaskExecution;
import tribe.scheduler.repository.ExecutionRepository;
import tribe.scheduler.repository.TaskRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs one attempt of an execution: resolves the task descriptor and the
 * executor, then calls the executor on a separate thread bounded by the
 * execution timeout.
 *
 * On timeout the call is abandoned and cancelled with an interrupt. Whatever
 * the executor does after that is ignored.
 */
public class AttemptRunner implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(AttemptRunner.class);

    private final ExecutorRegistry executors;
    private final TaskRegistry tasks;
    private final ExecutionRepository store;
    private final ExecutorService callPool;

    public AttemptRunner(ExecutorRegistry executors, TaskRegistry tasks, ExecutionRepository store) {
        this.executors = executors;
        this.tasks = tasks;
        this.store = store;
        AtomicInteger counter = new AtomicInteger();
        this.callPool = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "tribe-call-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Run one attempt.
     *
     * @throws InterruptedException if the calling worker is interrupted while
     *                              waiting; the call is cancelled first
     */
    public AttemptResult run(TaskExecution execution) throws InterruptedException {
        Optional<TaskDescriptor> descriptor = tasks.findById(execution.taskId());
        if (descriptor.isEmpty()) {
            return AttemptResult.failed("task not found: " + execution.taskId());
        }

        Optional<TaskExecutor> executor = executors.find(execution.executorId());
        if (executor.isEmpty()) {
            return AttemptResult.failed("no executor registered: " + execution.executorId());
        }

        ExecutionContext context = contextFor(execution);
        TaskExecutor taskExecutor = executor.get();
        TaskDescriptor task = descriptor.get();

        Future<String> call = callPool.submit(() -> taskExecutor.run(task, context));
        try {
            String result = call.get(execution.timeout().toNanos(), TimeUnit.NANOSECONDS);
            return AttemptResult.success(result);
        } catch (TimeoutException e) {
            call.cancel(true);
            log.warn("Execution {} attempt {} timed out after {}", execution.id(), execution.attempt(),
                    execution.timeout());
            return AttemptResult.timedOut();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("Execution {} attempt {} failed: {}", execution.id(), execution.attempt(), messageOf(cause));
            log.debug("Executor failure for {}", execution.id(), cause);
            return AttemptResult.failed(messageOf(cause));
        } catch (InterruptedException e) {
            call.cancel(true);
            throw e;
        }
    }

    private ExecutionContext contextFor(TaskExecution execution) {
        List<String> dependencyIds = new ArrayList<>();
        for (TaskDependency dependency : execution.dependencies()) {
            dependencyIds.add(dependency.dependencyId());
        }
        Map<String, String> outputs = store.findResults(dependencyIds);
        String id = execution.id();
        return new ExecutionContext(
                id,
                execution.taskId(),
                execution.attempt(),
                execution.executionMode(),
                outputs,
                () -> store.findById(id).map(TaskExecution::cancellationRequested).orElse(false));
    }

    static String messageOf(Throwable t) {
        String message = t.getMessage();
        return message != null && !message.isBlank() ? message : t.getClass().getName();
    }

    @Override
    public void close() {
        callPool.shutdownNow();
    }
}
