package tribe.scheduler.config;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SchedulerConfigTest {

    @Test
    void defaults() {
        SchedulerConfig config = SchedulerConfig.defaults();

        assertEquals(4, config.workerCount());
        assertEquals(10, config.maxConcurrentTasks());
        assertEquals(3, config.defaultMaxRetries());
        assertEquals(Duration.ofMinutes(5), config.defaultTimeout());
        assertTrue(config.retryFailedTasks());
        assertEquals(Duration.ZERO, config.retryBackoff());
        assertEquals(Duration.ofMillis(100), config.dependencyRetryDelay());
        assertFalse(config.priorityOrdering());
        assertFalse(config.hasCompletedRetention());
        assertNull(config.completedRetention());
    }

    @Test
    void fromEnvOverridesDefaults() {
        SchedulerConfig config = SchedulerConfig.fromEnv(Map.of(
                "TRIBE_WORKERS", "8",
                "TRIBE_MAX_CONCURRENT_TASKS", "2",
                "TRIBE_MAX_RETRIES", "0",
                "TRIBE_TASK_TIMEOUT_MS", "1500",
                "TRIBE_RETRY_FAILED_TASKS", "false",
                "TRIBE_RETRY_BACKOFF_MS", "250",
                "TRIBE_PRIORITY_ORDERING", "true",
                "TRIBE_COMPLETED_RETENTION_MS", "60000"));

        assertEquals(8, config.workerCount());
        assertEquals(2, config.maxConcurrentTasks());
        assertEquals(0, config.defaultMaxRetries());
        assertEquals(Duration.ofMillis(1500), config.defaultTimeout());
        assertFalse(config.retryFailedTasks());
        assertEquals(Duration.ofMillis(250), config.retryBackoff());
        assertTrue(config.priorityOrdering());
        assertEquals(Duration.ofMinutes(1), config.completedRetention());
    }

    @Test
    void blankEnvKeepsDefaults() {
        SchedulerConfig config = SchedulerConfig.fromEnv(Map.of("TRIBE_WORKERS", "  "));
        assertEquals(4, config.workerCount());
    }

    @Test
    void invalidEnvFailsFast() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
                () -> SchedulerConfig.fromEnv(Map.of("TRIBE_WORKERS", "many")));
        assertTrue(e.getMessage().contains("TRIBE_WORKERS"));

        assertThrows(IllegalArgumentException.class,
                () -> SchedulerConfig.fromEnv(Map.of("TRIBE_MAX_CONCURRENT_TASKS", "0")));
    }

    @Test
    void fluentSettersValidate() {
        SchedulerConfig config = SchedulerConfig.defaults();

        assertThrows(IllegalArgumentException.class, () -> config.withWorkerCount(0));
        assertThrows(IllegalArgumentException.class, () -> config.withMaxConcurrentTasks(-1));
        assertThrows(IllegalArgumentException.class, () -> config.withDefaultMaxRetries(-1));
        assertThrows(IllegalArgumentException.class, () -> config.withDefaultTimeout(Duration.ZERO));
        assertThrows(IllegalArgumentException.class, () -> config.withRetryBackoff(Duration.ofMillis(-1)));

        config.withCompletedRetention(Duration.ofSeconds(10));
        assertTrue(config.hasCompletedRetention());
        config.withCompletedRetention(null);
        assertFalse(config.hasCompletedRetention());
    }
}
