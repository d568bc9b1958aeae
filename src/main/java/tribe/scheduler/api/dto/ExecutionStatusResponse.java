package tribe.scheduler.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import tribe.scheduler.model.TaskExecution;

import java.time.Instant;
import java.util.List;

/**
 * Status view of an execution for a consuming layer.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ExecutionStatusResponse(
        @JsonProperty("executionId") String executionId,
        @JsonProperty("taskId") String taskId,
        @JsonProperty("executorId") String executorId,
        @JsonProperty("status") String status,
        @JsonProperty("executionMode") String executionMode,
        @JsonProperty("priority") int priority,
        @JsonProperty("retryCount") int retryCount,
        @JsonProperty("maxRetries") int maxRetries,
        @JsonProperty("timeoutMs") long timeoutMs,
        @JsonProperty("cancellationRequested") boolean cancellationRequested,
        @JsonProperty("dependencies") List<ScheduleRequest.DependencySpec> dependencies,
        @JsonProperty("createdAt") Instant createdAt,
        @JsonProperty("startedAt") Instant startedAt,
        @JsonProperty("completedAt") Instant completedAt,
        @JsonProperty("result") String result,
        @JsonProperty("error") String error) {

    public static ExecutionStatusResponse from(TaskExecution execution) {
        return new ExecutionStatusResponse(
                execution.id(),
                execution.taskId(),
                execution.executorId(),
                execution.status().name(),
                execution.executionMode().name(),
                execution.priority(),
                execution.retryCount(),
                execution.maxRetries(),
                execution.timeout().toMillis(),
                execution.cancellationRequested(),
                execution.dependencies().isEmpty() ? null
                        : execution.dependencies().stream().map(ScheduleRequest.DependencySpec::from).toList(),
                execution.createdAt(),
                execution.startedAt(),
                execution.completedAt(),
                execution.result(),
                execution.error());
    }
}
