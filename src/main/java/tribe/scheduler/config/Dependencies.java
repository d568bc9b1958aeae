package tribe.scheduler.config;

import tribe.scheduler.core.ExecutionEvents;
import tribe.scheduler.core.TransitionSignal;
import tribe.scheduler.executor.ExecutorRegistry;
import tribe.scheduler.executor.ResourceAvailability;
import tribe.scheduler.maintenance.MaintenanceScheduler;
import tribe.scheduler.repository.ExecutionRepository;
import tribe.scheduler.repository.TaskRegistry;
import tribe.scheduler.service.DependencyResolver;
import tribe.scheduler.service.TaskSchedulerService;
import tribe.scheduler.store.InMemoryExecutionStore;
import tribe.scheduler.worker.AttemptRunner;
import tribe.scheduler.worker.ConcurrencyLimiter;
import tribe.scheduler.worker.ExecutionQueue;
import tribe.scheduler.worker.WorkerPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Manual dependency injection container.
 * Creates and wires all scheduler components.
 *
 * Usage:
 *
 * <pre>
 * Dependencies deps = Dependencies.create(SchedulerConfig.fromEnv(), executors, tasks);
 * deps.start(); // start workers and maintenance jobs
 * TaskSchedulerService scheduler = deps.scheduler();
 * // ... schedule, poll status ...
 * deps.close(); // cleanup
 * </pre>
 */
public final class Dependencies implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Dependencies.class);

    private final SchedulerConfig config;
    private final ExecutionRepository store;
    private final ExecutionEvents events;
    private final TransitionSignal signal;
    private final ExecutionQueue queue;
    private final ConcurrencyLimiter limiter;
    private final DependencyResolver dependencyResolver;
    private final WorkerPool workerPool;
    private final TaskSchedulerService scheduler;
    private final MaintenanceScheduler maintenance;

    private Dependencies(SchedulerConfig config,
            ExecutorRegistry executors,
            TaskRegistry tasks,
            ResourceAvailability resources) {
        this.config = config;

        log.info("Initializing dependencies with config: {}", config);

        // State
        this.store = new InMemoryExecutionStore();
        this.events = new ExecutionEvents();
        this.signal = new TransitionSignal();
        this.events.onTransition(signal);

        // Dispatch
        this.queue = config.priorityOrdering() ? ExecutionQueue.priorityOrdered() : ExecutionQueue.fifo();
        this.limiter = new ConcurrencyLimiter(config.maxConcurrentTasks());
        this.dependencyResolver = new DependencyResolver(store, resources);
        this.workerPool = new WorkerPool(store, queue, limiter, dependencyResolver,
                new AttemptRunner(executors, tasks, store), events, signal, config);

        // Services
        this.scheduler = new TaskSchedulerService(store, queue, limiter, workerPool, events, signal, config);
        this.maintenance = new MaintenanceScheduler(store, config);

        log.info("Dependencies initialized successfully");
    }

    /**
     * Create dependencies with the given config and collaborators.
     */
    public static Dependencies create(SchedulerConfig config, ExecutorRegistry executors, TaskRegistry tasks) {
        return create(config, executors, tasks, ResourceAvailability.ALWAYS_AVAILABLE);
    }

    /**
     * Create dependencies with a resource availability predicate for RESOURCE dependencies.
     */
    public static Dependencies create(SchedulerConfig config,
            ExecutorRegistry executors,
            TaskRegistry tasks,
            ResourceAvailability resources) {
        return new Dependencies(config, executors, tasks, resources);
    }

    // Getters
    public SchedulerConfig config() {
        return config;
    }

    public ExecutionRepository store() {
        return store;
    }

    public ExecutionEvents events() {
        return events;
    }

    public ExecutionQueue queue() {
        return queue;
    }

    public ConcurrencyLimiter limiter() {
        return limiter;
    }

    public DependencyResolver dependencyResolver() {
        return dependencyResolver;
    }

    public TaskSchedulerService scheduler() {
        return scheduler;
    }

    public MaintenanceScheduler maintenance() {
        return maintenance;
    }

    /**
     * Start the worker pool and background maintenance.
     */
    public void start() {
        scheduler.start();
        maintenance.start();
    }

    @Override
    public void close() {
        log.info("Closing dependencies...");

        // Stop maintenance first
        try {
            maintenance.stop();
        } catch (RuntimeException e) {
            log.warn("Error stopping maintenance: {}", e.getMessage());
        }

        try {
            scheduler.close();
        } catch (RuntimeException e) {
            log.warn("Error closing scheduler: {}", e.getMessage());
        }

        log.info("Dependencies closed");
    }
}
