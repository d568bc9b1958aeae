package tribe.scheduler.worker;

import tribe.scheduler.model.TaskExecution;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Puts executions that are due for another attempt back on the queue,
 * optionally after a fixed backoff.
 */
public final class RetryDispatcher implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(RetryDispatcher.class);

    private final ExecutionQueue queue;
    private final Duration backoff;
    private final ScheduledExecutorService timer;

    public RetryDispatcher(ExecutionQueue queue, Duration backoff) {
        this.queue = queue;
        this.backoff = backoff;
        this.timer = backoff.isZero() ? null : Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "tribe-retry-timer");
            t.setDaemon(true);
            return t;
        });
    }

    public void dispatch(TaskExecution execution) {
        if (timer == null) {
            queue.offer(execution.id(), execution.priority());
            return;
        }
        try {
            timer.schedule(() -> queue.offer(execution.id(), execution.priority()),
                    backoff.toMillis(), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException e) {
            // timer already closed: keep the execution reachable anyway
            log.debug("Retry timer closed, requeueing {} immediately", execution.id());
            queue.offer(execution.id(), execution.priority());
        }
    }

    @Override
    public void close() {
        if (timer != null) {
            timer.shutdownNow();
        }
    }
}
