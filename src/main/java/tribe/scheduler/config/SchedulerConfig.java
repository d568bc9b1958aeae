package tribe.scheduler.config;

import java.time.Duration;
import java.util.Map;

/**
 * Configuration holder for scheduler settings.
 * All settings have sensible defaults.
 */
public final class SchedulerConfig {

    // Pool settings
    private int workerCount = 4;
    private int maxConcurrentTasks = 10;
    private Duration pollInterval = Duration.ofMillis(250);
    private Duration shutdownTimeout = Duration.ofSeconds(5);

    // Execution defaults
    private int defaultMaxRetries = 3;
    private Duration defaultTimeout = Duration.ofMinutes(5);
    private boolean retryFailedTasks = true;
    private Duration retryBackoff = Duration.ZERO;

    // Queue settings
    private Duration dependencyRetryDelay = Duration.ofMillis(100);
    private boolean priorityOrdering = false;

    // Retention settings
    private Duration completedRetention = null; // keep terminal records forever
    private Duration retentionSweepInterval = Duration.ofSeconds(30);

    private SchedulerConfig() {
    }

    public static SchedulerConfig defaults() {
        return new SchedulerConfig();
    }

    public static SchedulerConfig fromEnv() {
        return fromEnv(System.getenv());
    }

    /**
     * Build config overriding defaults with the given environment.
     * Unset or blank variables keep the default.
     */
    static SchedulerConfig fromEnv(Map<String, String> env) {
        SchedulerConfig config = new SchedulerConfig();

        Integer workers = intVar(env, "TRIBE_WORKERS");
        if (workers != null) {
            config.withWorkerCount(workers);
        }

        Integer maxConcurrent = intVar(env, "TRIBE_MAX_CONCURRENT_TASKS");
        if (maxConcurrent != null) {
            config.withMaxConcurrentTasks(maxConcurrent);
        }

        Integer maxRetries = intVar(env, "TRIBE_MAX_RETRIES");
        if (maxRetries != null) {
            config.withDefaultMaxRetries(maxRetries);
        }

        Long timeoutMs = longVar(env, "TRIBE_TASK_TIMEOUT_MS");
        if (timeoutMs != null) {
            config.withDefaultTimeout(Duration.ofMillis(timeoutMs));
        }

        String retryFailed = env.get("TRIBE_RETRY_FAILED_TASKS");
        if (retryFailed != null && !retryFailed.isBlank()) {
            config.retryFailedTasks = Boolean.parseBoolean(retryFailed.trim());
        }

        Long backoffMs = longVar(env, "TRIBE_RETRY_BACKOFF_MS");
        if (backoffMs != null) {
            config.withRetryBackoff(Duration.ofMillis(backoffMs));
        }

        String priority = env.get("TRIBE_PRIORITY_ORDERING");
        if (priority != null && !priority.isBlank()) {
            config.priorityOrdering = Boolean.parseBoolean(priority.trim());
        }

        Long retentionMs = longVar(env, "TRIBE_COMPLETED_RETENTION_MS");
        if (retentionMs != null) {
            config.withCompletedRetention(Duration.ofMillis(retentionMs));
        }

        return config;
    }

    private static Integer intVar(Map<String, String> env, String name) {
        Long value = longVar(env, name);
        if (value == null) {
            return null;
        }
        if (value > Integer.MAX_VALUE || value < Integer.MIN_VALUE) {
            throw new IllegalArgumentException(name + " is out of range: " + value);
        }
        return value.intValue();
    }

    private static Long longVar(Map<String, String> env, String name) {
        String raw = env.get(name);
        if (raw == null || raw.isBlank()) {
            return null;
        }
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(name + " is not a number: " + raw, e);
        }
    }

    // Getters
    public int workerCount() {
        return workerCount;
    }

    public int maxConcurrentTasks() {
        return maxConcurrentTasks;
    }

    public Duration pollInterval() {
        return pollInterval;
    }

    public Duration shutdownTimeout() {
        return shutdownTimeout;
    }

    public int defaultMaxRetries() {
        return defaultMaxRetries;
    }

    public Duration defaultTimeout() {
        return defaultTimeout;
    }

    public boolean retryFailedTasks() {
        return retryFailedTasks;
    }

    public Duration retryBackoff() {
        return retryBackoff;
    }

    public Duration dependencyRetryDelay() {
        return dependencyRetryDelay;
    }

    public boolean priorityOrdering() {
        return priorityOrdering;
    }

    public Duration completedRetention() {
        return completedRetention;
    }

    public boolean hasCompletedRetention() {
        return completedRetention != null;
    }

    public Duration retentionSweepInterval() {
        return retentionSweepInterval;
    }

    // Fluent setters for testing/customization
    public SchedulerConfig withWorkerCount(int workerCount) {
        if (workerCount <= 0) {
            throw new IllegalArgumentException("workerCount must be positive");
        }
        this.workerCount = workerCount;
        return this;
    }

    public SchedulerConfig withMaxConcurrentTasks(int maxConcurrentTasks) {
        if (maxConcurrentTasks <= 0) {
            throw new IllegalArgumentException("maxConcurrentTasks must be positive");
        }
        this.maxConcurrentTasks = maxConcurrentTasks;
        return this;
    }

    public SchedulerConfig withPollInterval(Duration pollInterval) {
        this.pollInterval = positive(pollInterval, "pollInterval");
        return this;
    }

    public SchedulerConfig withShutdownTimeout(Duration shutdownTimeout) {
        this.shutdownTimeout = positive(shutdownTimeout, "shutdownTimeout");
        return this;
    }

    public SchedulerConfig withDefaultMaxRetries(int maxRetries) {
        if (maxRetries < 0) {
            throw new IllegalArgumentException("defaultMaxRetries must not be negative");
        }
        this.defaultMaxRetries = maxRetries;
        return this;
    }

    public SchedulerConfig withDefaultTimeout(Duration timeout) {
        this.defaultTimeout = positive(timeout, "defaultTimeout");
        return this;
    }

    public SchedulerConfig withRetryFailedTasks(boolean retryFailedTasks) {
        this.retryFailedTasks = retryFailedTasks;
        return this;
    }

    public SchedulerConfig withRetryBackoff(Duration backoff) {
        if (backoff == null || backoff.isNegative()) {
            throw new IllegalArgumentException("retryBackoff must not be negative");
        }
        this.retryBackoff = backoff;
        return this;
    }

    public SchedulerConfig withDependencyRetryDelay(Duration delay) {
        this.dependencyRetryDelay = positive(delay, "dependencyRetryDelay");
        return this;
    }

    public SchedulerConfig withPriorityOrdering(boolean priorityOrdering) {
        this.priorityOrdering = priorityOrdering;
        return this;
    }

    /** Retention window for terminal records; null keeps them forever. */
    public SchedulerConfig withCompletedRetention(Duration retention) {
        this.completedRetention = retention == null ? null : positive(retention, "completedRetention");
        return this;
    }

    public SchedulerConfig withRetentionSweepInterval(Duration interval) {
        this.retentionSweepInterval = positive(interval, "retentionSweepInterval");
        return this;
    }

    private static Duration positive(Duration value, String name) {
        if (value == null || value.isZero() || value.isNegative()) {
            throw new IllegalArgumentException(name + " must be positive");
        }
        return value;
    }

    @Override
    public String toString() {
        return "SchedulerConfig{" +
                "workers=" + workerCount +
                ", maxConcurrentTasks=" + maxConcurrentTasks +
                ", maxRetries=" + defaultMaxRetries +
                ", timeout=" + defaultTimeout +
                ", retryFailedTasks=" + retryFailedTasks +
                ", priorityOrdering=" + priorityOrdering +
                ", completedRetention=" + completedRetention +
                '}';
    }
}
