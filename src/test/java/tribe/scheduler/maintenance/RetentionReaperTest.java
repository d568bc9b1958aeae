package tribe.scheduler.maintenance;

import tribe.scheduler.config.SchedulerConfig;
import tribe.scheduler.model.TaskExecution;
import tribe.scheduler.store.InMemoryExecutionStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.*;

class RetentionReaperTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    private InMemoryExecutionStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryExecutionStore();
    }

    private void finish(String id, Instant at) {
        store.insertPending(TaskExecution.builder()
                .id(id).taskId("t").executorId("e").createdAt(at).build());
        store.markRunning(id, at);
        store.recordSuccess(id, "r-" + id, at);
    }

    @Test
    void evictsOnlyExpiredTerminalExecutions() {
        finish("old", NOW.minus(Duration.ofHours(2)));
        finish("fresh", NOW.minus(Duration.ofMinutes(5)));
        store.insertPending(TaskExecution.builder()
                .id("waiting").taskId("t").executorId("e").createdAt(NOW.minus(Duration.ofDays(1))).build());

        RetentionReaper reaper = new RetentionReaper(store, Duration.ofHours(1), Clock.fixed(NOW, ZoneOffset.UTC));

        assertEquals(1, reaper.reapExpired());
        assertTrue(store.findById("old").isEmpty());
        assertTrue(store.findResult("old").isEmpty());
        assertTrue(store.findById("fresh").isPresent());
        assertTrue(store.findById("waiting").isPresent());

        assertEquals(0, reaper.reapExpired());
    }

    @Test
    void maintenanceSchedulerOnlyBuildsReaperWhenRetentionConfigured() {
        try (MaintenanceScheduler disabled = new MaintenanceScheduler(store, SchedulerConfig.defaults())) {
            assertNull(disabled.retentionReaper());
            disabled.start();
            assertTrue(disabled.isRunning());
        }

        SchedulerConfig config = SchedulerConfig.defaults().withCompletedRetention(Duration.ofMinutes(10));
        try (MaintenanceScheduler enabled = new MaintenanceScheduler(store, config)) {
            assertNotNull(enabled.retentionReaper());
        }
    }

    @Test
    void scheduledSweepEvictsInBackground() throws InterruptedException {
        finish("old", Instant.now().minus(Duration.ofHours(1)));

        SchedulerConfig config = SchedulerConfig.defaults()
                .withCompletedRetention(Duration.ofMinutes(1))
                .withRetentionSweepInterval(Duration.ofMillis(20));
        try (MaintenanceScheduler maintenance = new MaintenanceScheduler(store, config)) {
            maintenance.start();

            long deadline = System.currentTimeMillis() + 5000;
            while (store.findById("old").isPresent() && System.currentTimeMillis() < deadline) {
                Thread.sleep(10);
            }
        }

        assertTrue(store.findById("old").isEmpty());
    }
}
