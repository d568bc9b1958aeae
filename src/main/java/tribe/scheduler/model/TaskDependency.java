package tribe.scheduler.model;

import java.util.Objects;

/**
 * A single dependency declared by a task execution.
 *
 * @param dependencyId  execution id this dependency refers to
 * @param type          condition to check
 * @param expectedValue for OUTPUT: required exact result, or null for "any result"
 * @param resource      for RESOURCE: resource key, falls back to dependencyId
 */
public record TaskDependency(
        String dependencyId,
        DependencyType type,
        String expectedValue,
        String resource) {

    public TaskDependency {
        Objects.requireNonNull(dependencyId, "dependencyId is required");
        Objects.requireNonNull(type, "type is required");
    }

    public static TaskDependency completion(String executionId) {
        return new TaskDependency(executionId, DependencyType.COMPLETION, null, null);
    }

    public static TaskDependency start(String executionId) {
        return new TaskDependency(executionId, DependencyType.START, null, null);
    }

    public static TaskDependency output(String executionId) {
        return new TaskDependency(executionId, DependencyType.OUTPUT, null, null);
    }

    public static TaskDependency output(String executionId, String expectedValue) {
        return new TaskDependency(executionId, DependencyType.OUTPUT, expectedValue, null);
    }

    public static TaskDependency resource(String resource) {
        return new TaskDependency(resource, DependencyType.RESOURCE, null, resource);
    }

    /** Key used to look up resource availability */
    public String resourceKey() {
        return resource != null ? resource : dependencyId;
    }
}
