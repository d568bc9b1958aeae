package tribe.scheduler.core;

import tribe.scheduler.model.TaskExecution;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Listener bus for execution status transitions.
 * A failing listener is logged and skipped; it never breaks the caller.
 */
public final class ExecutionEvents {

    private static final Logger log = LoggerFactory.getLogger(ExecutionEvents.class);

    private final CopyOnWriteArrayList<ExecutionListener> listeners = new CopyOnWriteArrayList<>();

    public void onTransition(ExecutionListener listener) {
        listeners.add(listener);
    }

    public boolean remove(ExecutionListener listener) {
        return listeners.remove(listener);
    }

    public void fire(TaskExecution execution) {
        log.debug("Execution {} -> {}", execution.id(), execution.status());
        for (ExecutionListener listener : listeners) {
            try {
                listener.onTransition(execution);
            } catch (RuntimeException e) {
                log.warn("Listener failed on {} -> {}: {}", execution.id(), execution.status(), e.getMessage(), e);
            }
        }
    }
}
