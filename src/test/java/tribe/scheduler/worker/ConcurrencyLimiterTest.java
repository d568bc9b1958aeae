package tribe.scheduler.worker;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ConcurrencyLimiterTest {

    @Test
    void permitsAreBounded() throws InterruptedException {
        ConcurrencyLimiter limiter = new ConcurrencyLimiter(2);

        limiter.acquire();
        assertTrue(limiter.tryAcquire());
        assertFalse(limiter.tryAcquire());
        assertEquals(2, limiter.inUse());
        assertEquals(0, limiter.availablePermits());

        limiter.release();
        assertEquals(1, limiter.availablePermits());
        assertEquals(2, limiter.capacity());
    }

    @Test
    void capacityMustBePositive() {
        assertThrows(IllegalArgumentException.class, () -> new ConcurrencyLimiter(0));
    }

    @Test
    void blockedAcquireProceedsAfterRelease() throws Exception {
        ConcurrencyLimiter limiter = new ConcurrencyLimiter(1);
        limiter.acquire();

        Thread waiter = new Thread(() -> {
            try {
                limiter.acquire();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        waiter.start();
        waiter.join(100);
        assertTrue(waiter.isAlive(), "should block while the permit is held");

        limiter.release();
        waiter.join(5000);
        assertFalse(waiter.isAlive());
        assertEquals(1, limiter.inUse());
    }
}
