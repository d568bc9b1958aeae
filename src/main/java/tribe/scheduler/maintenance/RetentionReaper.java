package tribe.scheduler.maintenance;

import tribe.scheduler.model.TaskExecution;
import tribe.scheduler.repository.ExecutionRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Background job that evicts old terminal executions.
 *
 * Terminal records (and stored results) whose completion is older than the
 * retention window are removed from the store. An evicted execution is
 * unknown afterwards: status lookups return nothing and dependencies on it
 * no longer resolve.
 */
public class RetentionReaper implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(RetentionReaper.class);

    private final ExecutionRepository store;
    private final Duration retention;
    private final Clock clock;

    public RetentionReaper(ExecutionRepository store, Duration retention) {
        this(store, retention, Clock.systemUTC());
    }

    RetentionReaper(ExecutionRepository store, Duration retention, Clock clock) {
        this.store = store;
        this.retention = retention;
        this.clock = clock;
    }

    @Override
    public void run() {
        try {
            reapExpired();
        } catch (RuntimeException e) {
            log.error("Retention reaper error", e);
        }
    }

    /**
     * Evict terminal executions older than the retention window.
     *
     * @return number of evicted executions
     */
    public int reapExpired() {
        Instant cutoff = Instant.now(clock).minus(retention);
        List<TaskExecution> evicted = store.evictCompletedBefore(cutoff);

        if (evicted.isEmpty()) {
            log.debug("No expired executions found");
            return 0;
        }

        log.info("Retention reaper: evicted {} executions completed before {}", evicted.size(), cutoff);
        return evicted.size();
    }
}
