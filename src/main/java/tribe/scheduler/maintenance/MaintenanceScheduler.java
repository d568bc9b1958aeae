package tribe.scheduler.maintenance;

import tribe.scheduler.config.SchedulerConfig;
import tribe.scheduler.repository.ExecutionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * Coordinates background maintenance jobs:
 * - RetentionReaper: evicts terminal executions past the retention window
 *
 * Uses a single-threaded executor; jobs never run concurrently with each other.
 */
public class MaintenanceScheduler implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(MaintenanceScheduler.class);

    private final ScheduledExecutorService executor;
    private final RetentionReaper retentionReaper;
    private final SchedulerConfig config;

    private volatile boolean running = false;

    public MaintenanceScheduler(ExecutionRepository store, SchedulerConfig config) {
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "tribe-maintenance");
            t.setDaemon(true);
            return t;
        });
        this.retentionReaper = config.hasCompletedRetention()
                ? new RetentionReaper(store, config.completedRetention())
                : null;
        this.config = config;
    }

    /**
     * Start the maintenance jobs.
     */
    public void start() {
        if (running) {
            log.warn("Maintenance scheduler already running");
            return;
        }

        running = true;

        if (retentionReaper != null) {
            long intervalMs = config.retentionSweepInterval().toMillis();
            executor.scheduleAtFixedRate(retentionReaper, intervalMs, intervalMs, TimeUnit.MILLISECONDS);
            log.info("Retention reaper scheduled every {}ms (retention {})", intervalMs, config.completedRetention());
        } else {
            log.info("Retention disabled, terminal executions are kept");
        }
    }

    /**
     * Stop the maintenance jobs gracefully.
     */
    public void stop() {
        if (!running) {
            executor.shutdownNow();
            return;
        }

        running = false;
        executor.shutdown();

        try {
            if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
                executor.shutdownNow();
                log.warn("Maintenance scheduler forcefully stopped");
            } else {
                log.debug("Maintenance scheduler stopped gracefully");
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public void close() {
        stop();
    }

    public boolean isRunning() {
        return running;
    }

    /**
     * Get the retention reaper for a manual sweep, null when retention is disabled.
     */
    public RetentionReaper retentionReaper() {
        return retentionReaper;
    }
}
