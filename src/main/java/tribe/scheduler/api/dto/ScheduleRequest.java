package tribe.scheduler.api.dto;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import tribe.scheduler.model.DependencyType;
import tribe.scheduler.model.ExecutionMode;
import tribe.scheduler.model.TaskDependency;

import java.util.ArrayList;
import java.util.List;

/**
 * One execution to schedule, as submitted in a batch.
 * Optional fields left null take the configured defaults.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ScheduleRequest(
        @JsonProperty("taskId") String taskId,
        @JsonProperty("executorId") String executorId,
        @JsonProperty("executionMode") ExecutionMode executionMode,
        @JsonProperty("dependencies") List<DependencySpec> dependencies,
        @JsonProperty("priority") Integer priority,
        @JsonProperty("timeoutMs") Long timeoutMs,
        @JsonProperty("maxRetries") Integer maxRetries) {

    /**
     * Dependency as written in a request.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record DependencySpec(
            @JsonProperty("dependencyId") String dependencyId,
            @JsonProperty("type") DependencyType type,
            @JsonProperty("expectedValue") String expectedValue,
            @JsonProperty("resource") String resource) {

        /** Check the entry can be turned into a dependency */
        @JsonIgnore
        public boolean isValid() {
            if (type == null) {
                return false;
            }
            if (type == DependencyType.RESOURCE) {
                return notBlank(dependencyId) || notBlank(resource);
            }
            return notBlank(dependencyId);
        }

        public TaskDependency toDependency() {
            String id = notBlank(dependencyId) ? dependencyId : resource;
            return new TaskDependency(id, type, expectedValue, resource);
        }

        public static DependencySpec from(TaskDependency dependency) {
            return new DependencySpec(dependency.dependencyId(), dependency.type(),
                    dependency.expectedValue(), dependency.resource());
        }
    }

    /** Minimal request with defaults for everything optional */
    public static ScheduleRequest of(String taskId, String executorId) {
        return new ScheduleRequest(taskId, executorId, null, null, null, null, null);
    }

    /** Request with dependencies and defaults for everything else */
    public static ScheduleRequest of(String taskId, String executorId, List<TaskDependency> dependencies) {
        List<DependencySpec> specs = new ArrayList<>();
        for (TaskDependency dependency : dependencies) {
            specs.add(DependencySpec.from(dependency));
        }
        return new ScheduleRequest(taskId, executorId, null, specs, null, null, null);
    }

    /**
     * Describe the first problem with the dependency list, or null if there is none.
     */
    public String dependencyProblem() {
        if (dependencies == null) {
            return null;
        }
        for (int i = 0; i < dependencies.size(); i++) {
            DependencySpec spec = dependencies.get(i);
            if (spec == null || !spec.isValid()) {
                return "dependency " + i + " needs a dependencyId and a type";
            }
        }
        return null;
    }

    /**
     * Convert the dependency specs; call {@link #dependencyProblem()} first.
     */
    public List<TaskDependency> toDependencies() {
        if (dependencies == null) {
            return List.of();
        }
        List<TaskDependency> converted = new ArrayList<>(dependencies.size());
        for (DependencySpec spec : dependencies) {
            converted.add(spec.toDependency());
        }
        return converted;
    }

    private static boolean notBlank(String value) {
        return value != null && !value.isBlank();
    }
}
