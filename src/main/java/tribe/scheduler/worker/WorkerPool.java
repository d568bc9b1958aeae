package tribe.scheduler.worker;

import tribe.scheduler.config.SchedulerConfig;
import tribe.scheduler.core.ExecutionEvents;
import tribe.scheduler.core.TransitionSignal;
import tribe.scheduler.repository.ExecutionRepository;
import tribe.scheduler.service.DependencyResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Fixed pool of worker threads pulling from the execution queue.
 *
 * Stopping first lets in-flight attempts finish for up to the configured
 * shutdown timeout, then interrupts whatever is left.
 */
public class WorkerPool implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(WorkerPool.class);

    private final ExecutionRepository store;
    private final ExecutionQueue queue;
    private final ConcurrencyLimiter limiter;
    private final DependencyResolver resolver;
    private final AttemptRunner attemptRunner;
    private final ExecutionEvents events;
    private final TransitionSignal signal;
    private final RetryDispatcher retryDispatcher;
    private final SchedulerConfig config;

    private ExecutorService threads;
    private volatile boolean running = false;
    private boolean stopped = false;

    public WorkerPool(ExecutionRepository store,
            ExecutionQueue queue,
            ConcurrencyLimiter limiter,
            DependencyResolver resolver,
            AttemptRunner attemptRunner,
            ExecutionEvents events,
            TransitionSignal signal,
            SchedulerConfig config) {
        this.store = store;
        this.queue = queue;
        this.limiter = limiter;
        this.resolver = resolver;
        this.attemptRunner = attemptRunner;
        this.events = events;
        this.signal = signal;
        this.retryDispatcher = new RetryDispatcher(queue, config.retryBackoff());
        this.config = config;
    }

    /**
     * Start the worker threads.
     */
    public synchronized void start() {
        if (running) {
            log.warn("Worker pool already running");
            return;
        }
        if (stopped) {
            throw new IllegalStateException("Worker pool cannot be restarted once stopped");
        }

        running = true;
        int workerCount = config.workerCount();
        threads = Executors.newFixedThreadPool(workerCount, r -> {
            Thread t = new Thread(r);
            t.setDaemon(true);
            return t;
        });

        for (int i = 1; i <= workerCount; i++) {
            threads.submit(newWorker("tribe-worker-" + i));
        }

        log.info("Worker pool started: {} workers, {} concurrent attempts", workerCount, limiter.capacity());
    }

    Worker newWorker(String name) {
        return new Worker(name, store, queue, limiter, resolver, attemptRunner, events, signal,
                retryDispatcher, () -> running, config.pollInterval(), config.dependencyRetryDelay(),
                config.retryFailedTasks());
    }

    /**
     * Stop the worker pool gracefully.
     */
    public synchronized void stop() {
        stopped = true;
        if (!running) {
            retryDispatcher.close();
            attemptRunner.close();
            return;
        }

        running = false;
        threads.shutdown();
        // wake workers parked on a dependency wait
        signal.signalAll();

        try {
            if (!threads.awaitTermination(config.shutdownTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                threads.shutdownNow();
                // let interrupted workers record their attempts before the call pool goes away
                if (!threads.awaitTermination(config.shutdownTimeout().toMillis(), TimeUnit.MILLISECONDS)) {
                    log.warn("Worker threads did not exit after interrupt");
                }
                log.warn("Worker pool forcefully stopped");
            } else {
                log.info("Worker pool stopped gracefully");
            }
        } catch (InterruptedException e) {
            threads.shutdownNow();
            Thread.currentThread().interrupt();
        } finally {
            retryDispatcher.close();
            attemptRunner.close();
        }
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isRunning() {
        return running;
    }
}
