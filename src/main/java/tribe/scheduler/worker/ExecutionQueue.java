package tribe.scheduler.worker;

import java.time.Duration;
import java.util.Comparator;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.PriorityBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Channel of execution ids waiting for a worker.
 *
 * FIFO by default. In priority mode entries are ordered by priority
 * descending, then by submission order. Ids sent back with
 * {@link #requeue(String)} because they are still blocked sort behind all
 * other entries, in the order they were sent back, so a blocked high priority
 * execution never hides the work it waits on.
 */
public final class ExecutionQueue {

    private static final Comparator<Entry> PRIORITY_ORDER = (a, b) -> {
        if (a.deferred() != b.deferred()) {
            return a.deferred() ? 1 : -1;
        }
        if (!a.deferred() && a.priority() != b.priority()) {
            return Integer.compare(b.priority(), a.priority());
        }
        return Long.compare(a.sequence(), b.sequence());
    };

    private record Entry(String executionId, int priority, long sequence, boolean deferred) {
    }

    private final BlockingQueue<Entry> entries;
    private final AtomicLong sequence = new AtomicLong();
    private final boolean priorityOrdered;

    private ExecutionQueue(BlockingQueue<Entry> entries, boolean priorityOrdered) {
        this.entries = entries;
        this.priorityOrdered = priorityOrdered;
    }

    public static ExecutionQueue fifo() {
        return new ExecutionQueue(new LinkedBlockingQueue<>(), false);
    }

    public static ExecutionQueue priorityOrdered() {
        return new ExecutionQueue(new PriorityBlockingQueue<>(64, PRIORITY_ORDER), true);
    }

    public void offer(String executionId, int priority) {
        entries.add(new Entry(executionId, priority, sequence.getAndIncrement(), false));
    }

    /**
     * Put back an id whose dependencies are not met yet.
     */
    public void requeue(String executionId) {
        entries.add(new Entry(executionId, 0, sequence.getAndIncrement(), true));
    }

    /**
     * Take the next id, waiting up to {@code timeout} for one to arrive.
     *
     * @return the id, or null if none arrived in time
     */
    public String poll(Duration timeout) throws InterruptedException {
        Entry entry = entries.poll(timeout.toNanos(), TimeUnit.NANOSECONDS);
        return entry != null ? entry.executionId() : null;
    }

    public int size() {
        return entries.size();
    }

    public boolean isEmpty() {
        return entries.isEmpty();
    }

    public boolean isPriorityOrdered() {
        return priorityOrdered;
    }

    public void clear() {
        entries.clear();
    }
}
