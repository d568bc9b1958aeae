package tribe.scheduler.model;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Immutable snapshot of one scheduled run of a task.
 * Every state transition produces a new instance via {@link #toBuilder()},
 * so snapshots handed out to callers can never be changed afterwards.
 */
public final class TaskExecution {
    private final String id;
    private final String taskId;
    private final String executorId;
    private final ExecutionMode executionMode;
    private final List<TaskDependency> dependencies;
    private final int maxRetries;
    private final int retryCount;
    private final Duration timeout;
    private final int priority;
    private final Instant createdAt;
    private final Instant startedAt;
    private final Instant completedAt;
    private final ExecutionStatus status;
    private final String result;
    private final String error;
    private final boolean cancellationRequested;

    private TaskExecution(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "id is required");
        this.taskId = Objects.requireNonNull(builder.taskId, "taskId is required");
        this.executorId = Objects.requireNonNull(builder.executorId, "executorId is required");
        this.executionMode = Objects.requireNonNull(builder.executionMode, "executionMode is required");
        this.dependencies = builder.dependencies == null ? List.of() : List.copyOf(builder.dependencies);
        this.maxRetries = builder.maxRetries;
        this.retryCount = builder.retryCount;
        this.timeout = Objects.requireNonNull(builder.timeout, "timeout is required");
        this.priority = builder.priority;
        this.createdAt = builder.createdAt;
        this.startedAt = builder.startedAt;
        this.completedAt = builder.completedAt;
        this.status = Objects.requireNonNull(builder.status, "status is required");
        this.result = builder.result;
        this.error = builder.error;
        this.cancellationRequested = builder.cancellationRequested;

        if (maxRetries < 0) {
            throw new IllegalArgumentException("maxRetries must not be negative");
        }
        if (retryCount < 0 || retryCount > maxRetries) {
            throw new IllegalArgumentException(
                    "retryCount " + retryCount + " outside of [0, " + maxRetries + "]");
        }
    }

    public String id() {
        return id;
    }

    public String taskId() {
        return taskId;
    }

    public String executorId() {
        return executorId;
    }

    public ExecutionMode executionMode() {
        return executionMode;
    }

    public List<TaskDependency> dependencies() {
        return dependencies;
    }

    public int maxRetries() {
        return maxRetries;
    }

    public int retryCount() {
        return retryCount;
    }

    public Duration timeout() {
        return timeout;
    }

    public int priority() {
        return priority;
    }

    public Instant createdAt() {
        return createdAt;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public Instant completedAt() {
        return completedAt;
    }

    public ExecutionStatus status() {
        return status;
    }

    public String result() {
        return result;
    }

    public String error() {
        return error;
    }

    public boolean cancellationRequested() {
        return cancellationRequested;
    }

    /** Check if another attempt is allowed after a failure */
    public boolean canRetry() {
        return retryCount < maxRetries;
    }

    /** Check if execution is in terminal state */
    public boolean isTerminal() {
        return status.isTerminal();
    }

    /** 1-based number of the current (or last) attempt */
    public int attempt() {
        return retryCount + 1;
    }

    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .taskId(taskId)
                .executorId(executorId)
                .executionMode(executionMode)
                .dependencies(dependencies)
                .maxRetries(maxRetries)
                .retryCount(retryCount)
                .timeout(timeout)
                .priority(priority)
                .createdAt(createdAt)
                .startedAt(startedAt)
                .completedAt(completedAt)
                .status(status)
                .result(result)
                .error(error)
                .cancellationRequested(cancellationRequested);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String taskId;
        private String executorId;
        private ExecutionMode executionMode = ExecutionMode.SYNC;
        private List<TaskDependency> dependencies = List.of();
        private int maxRetries = 3;
        private int retryCount = 0;
        private Duration timeout = Duration.ofMinutes(5);
        private int priority = 0;
        private Instant createdAt;
        private Instant startedAt;
        private Instant completedAt;
        private ExecutionStatus status = ExecutionStatus.PENDING;
        private String result;
        private String error;
        private boolean cancellationRequested;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder taskId(String taskId) {
            this.taskId = taskId;
            return this;
        }

        public Builder executorId(String executorId) {
            this.executorId = executorId;
            return this;
        }

        public Builder executionMode(ExecutionMode executionMode) {
            this.executionMode = executionMode;
            return this;
        }

        public Builder dependencies(List<TaskDependency> dependencies) {
            this.dependencies = dependencies;
            return this;
        }

        public Builder maxRetries(int maxRetries) {
            this.maxRetries = maxRetries;
            return this;
        }

        public Builder retryCount(int retryCount) {
            this.retryCount = retryCount;
            return this;
        }

        public Builder timeout(Duration timeout) {
            this.timeout = timeout;
            return this;
        }

        public Builder priority(int priority) {
            this.priority = priority;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Builder startedAt(Instant startedAt) {
            this.startedAt = startedAt;
            return this;
        }

        public Builder completedAt(Instant completedAt) {
            this.completedAt = completedAt;
            return this;
        }

        public Builder status(ExecutionStatus status) {
            this.status = status;
            return this;
        }

        public Builder result(String result) {
            this.result = result;
            return this;
        }

        public Builder error(String error) {
            this.error = error;
            return this;
        }

        public Builder cancellationRequested(boolean cancellationRequested) {
            this.cancellationRequested = cancellationRequested;
            return this;
        }

        public TaskExecution build() {
            return new TaskExecution(this);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof TaskExecution that))
            return false;
        return Objects.equals(id, that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "TaskExecution{id='" + id + "', taskId='" + taskId + "', status=" + status
                + ", retryCount=" + retryCount + "/" + maxRetries + "}";
    }
}
