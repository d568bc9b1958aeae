package tribe.scheduler.model;

import java.util.Objects;

/**
 * Description of a task as supplied by the task registry.
 * The scheduler only keeps the task id and resolves the descriptor when an
 * attempt starts.
 *
 * @param taskId           registry id
 * @param description      what the task is about
 * @param expectedOutput   what a successful run should produce
 * @param executorAffinity preferred executor id, may be null
 */
public record TaskDescriptor(
        String taskId,
        String description,
        String expectedOutput,
        String executorAffinity) {

    public TaskDescriptor {
        Objects.requireNonNull(taskId, "taskId is required");
    }

    public static TaskDescriptor of(String taskId, String description) {
        return new TaskDescriptor(taskId, description, null, null);
    }
}
