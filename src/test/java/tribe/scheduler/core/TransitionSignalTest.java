package tribe.scheduler.core;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

import static org.junit.jupiter.api.Assertions.*;

class TransitionSignalTest {

    @Test
    void awaitTimesOutWithoutTransition() throws InterruptedException {
        TransitionSignal signal = new TransitionSignal();
        long seen = signal.generation();

        assertFalse(signal.awaitChange(seen, Duration.ofMillis(20)));
    }

    @Test
    void transitionBeforeWaitIsNotLost() throws InterruptedException {
        TransitionSignal signal = new TransitionSignal();
        long seen = signal.generation();
        signal.signalAll();

        assertTrue(signal.awaitChange(seen, Duration.ZERO));
        assertEquals(seen + 1, signal.generation());
    }

    @Test
    void waiterWakesOnTransition() throws Exception {
        TransitionSignal signal = new TransitionSignal();
        long seen = signal.generation();
        CountDownLatch waiting = new CountDownLatch(1);
        AtomicBoolean woke = new AtomicBoolean();

        Thread waiter = new Thread(() -> {
            waiting.countDown();
            try {
                woke.set(signal.awaitChange(seen, Duration.ofSeconds(10)));
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        });
        waiter.start();
        assertTrue(waiting.await(5, TimeUnit.SECONDS));

        signal.onTransition(null);
        waiter.join(5000);

        assertFalse(waiter.isAlive());
        assertTrue(woke.get());
    }
}
