package tribe.scheduler.executor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registered executors by executor id.
 */
public class ExecutorRegistry {

    private static final Logger log = LoggerFactory.getLogger(ExecutorRegistry.class);

    private final ConcurrentHashMap<String, TaskExecutor> executors = new ConcurrentHashMap<>();

    public ExecutorRegistry register(String executorId, TaskExecutor executor) {
        if (executorId == null || executorId.isBlank()) {
            throw new IllegalArgumentException("executorId is required");
        }
        Objects.requireNonNull(executor, "executor is required");

        TaskExecutor previous = executors.put(executorId, executor);
        if (previous != null) {
            log.info("Executor {} replaced", executorId);
        } else {
            log.debug("Executor {} registered", executorId);
        }
        return this;
    }

    public Optional<TaskExecutor> find(String executorId) {
        return Optional.ofNullable(executors.get(executorId));
    }

    public boolean unregister(String executorId) {
        return executors.remove(executorId) != null;
    }

    public Set<String> executorIds() {
        return Set.copyOf(executors.keySet());
    }

    public static ExecutorRegistry of(Map<String, TaskExecutor> executors) {
        ExecutorRegistry registry = new ExecutorRegistry();
        executors.forEach(registry::register);
        return registry;
    }
}
