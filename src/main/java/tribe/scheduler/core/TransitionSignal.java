package tribe.scheduler.core;

import tribe.scheduler.model.TaskExecution;

import java.time.Duration;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Generation counter bumped on every status transition.
 *
 * Waiters read {@link #generation()} before checking a condition and then
 * call {@link #awaitChange(long, Duration)} with that value, so a transition
 * between the check and the wait is never lost.
 */
public final class TransitionSignal implements ExecutionListener {

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();
    private long generation;

    public long generation() {
        lock.lock();
        try {
            return generation;
        } finally {
            lock.unlock();
        }
    }

    public void signalAll() {
        lock.lock();
        try {
            generation++;
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void onTransition(TaskExecution execution) {
        signalAll();
    }

    /**
     * Wait until the generation moves past {@code seen} or the wait expires.
     *
     * @return true if a transition happened
     */
    public boolean awaitChange(long seen, Duration maxWait) throws InterruptedException {
        long remaining = maxWait.toNanos();
        lock.lock();
        try {
            while (generation == seen) {
                if (remaining <= 0) {
                    return false;
                }
                remaining = changed.awaitNanos(remaining);
            }
            return true;
        } finally {
            lock.unlock();
        }
    }
}
