package tribe.scheduler.model;

/**
 * Point-in-time counters of the scheduler.
 */
public record SchedulerStats(
        int pending,
        int running,
        int completed,
        int failed,
        int cancelled,
        int availablePermits,
        int queued) {

    public int total() {
        return pending + running + completed + failed + cancelled;
    }
}
