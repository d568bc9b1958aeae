package tribe.scheduler.repository;

import tribe.scheduler.model.TaskDescriptor;

import java.util.Optional;

/**
 * Source of task descriptors.
 * The scheduler never modifies descriptors, it only resolves them by id.
 */
public interface TaskRegistry {

    /**
     * Find a task descriptor by ID.
     *
     * @param taskId the task ID
     * @return the descriptor if found
     */
    Optional<TaskDescriptor> findById(String taskId);
}
