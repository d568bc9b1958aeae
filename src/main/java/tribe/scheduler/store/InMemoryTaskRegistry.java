package tribe.scheduler.store;

import tribe.scheduler.model.TaskDescriptor;
import tribe.scheduler.repository.TaskRegistry;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Map-backed task registry.
 */
public class InMemoryTaskRegistry implements TaskRegistry {

    private final ConcurrentHashMap<String, TaskDescriptor> tasks = new ConcurrentHashMap<>();

    public InMemoryTaskRegistry register(TaskDescriptor task) {
        tasks.put(task.taskId(), task);
        return this;
    }

    public InMemoryTaskRegistry registerAll(List<TaskDescriptor> descriptors) {
        descriptors.forEach(this::register);
        return this;
    }

    @Override
    public Optional<TaskDescriptor> findById(String taskId) {
        if (taskId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(tasks.get(taskId));
    }

    public boolean remove(String taskId) {
        return tasks.remove(taskId) != null;
    }

    public int size() {
        return tasks.size();
    }
}
