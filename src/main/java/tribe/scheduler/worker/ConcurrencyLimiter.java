package tribe.scheduler.worker;

import java.util.concurrent.Semaphore;

/**
 * Counting admission gate bounding how many attempts run at once,
 * independent of the number of workers.
 */
public final class ConcurrencyLimiter {

    private final int capacity;
    private final Semaphore permits;

    public ConcurrencyLimiter(int capacity) {
        if (capacity <= 0) {
            throw new IllegalArgumentException("capacity must be positive");
        }
        this.capacity = capacity;
        this.permits = new Semaphore(capacity, true);
    }

    /** Block until a permit is free. */
    public void acquire() throws InterruptedException {
        permits.acquire();
    }

    public boolean tryAcquire() {
        return permits.tryAcquire();
    }

    public void release() {
        permits.release();
    }

    public int capacity() {
        return capacity;
    }

    public int availablePermits() {
        return permits.availablePermits();
    }

    public int inUse() {
        return capacity - permits.availablePermits();
    }
}
