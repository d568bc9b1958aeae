package tribe.scheduler.store;

import tribe.scheduler.model.CancelResult;
import tribe.scheduler.model.ExecutionStatus;
import tribe.scheduler.model.TaskExecution;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class InMemoryExecutionStoreTest {

    private InMemoryExecutionStore store;

    @BeforeEach
    void setUp() {
        store = new InMemoryExecutionStore();
    }

    private static TaskExecution pending(String id, int maxRetries) {
        return TaskExecution.builder()
                .id(id)
                .taskId("task-" + id)
                .executorId("exec")
                .maxRetries(maxRetries)
                .createdAt(Instant.now())
                .build();
    }

    @Test
    void insertAndFind() {
        store.insertPending(pending("a", 3));

        assertEquals(ExecutionStatus.PENDING, store.findById("a").orElseThrow().status());
        assertTrue(store.findPending("a").isPresent());
        assertFalse(store.isRunning("a"));
        assertTrue(store.findCompleted("a").isEmpty());
        assertTrue(store.findById("unknown").isEmpty());
    }

    @Test
    void rejectsDuplicatesAndNonPending() {
        store.insertPending(pending("a", 3));

        assertThrows(IllegalArgumentException.class, () -> store.insertPending(pending("a", 3)));
        assertThrows(IllegalArgumentException.class, () -> store.insertPending(
                pending("b", 3).toBuilder().status(ExecutionStatus.RUNNING).build()));
    }

    @Test
    void successfulLifecycle() {
        store.insertPending(pending("a", 3));

        TaskExecution running = store.markRunning("a", Instant.now()).orElseThrow();
        assertEquals(ExecutionStatus.RUNNING, running.status());
        assertNotNull(running.startedAt());
        assertTrue(store.isRunning("a"));
        assertTrue(store.findPending("a").isEmpty());

        TaskExecution done = store.recordSuccess("a", "42", Instant.now()).orElseThrow();
        assertEquals(ExecutionStatus.COMPLETED, done.status());
        assertEquals("42", done.result());
        assertNotNull(done.completedAt());
        assertFalse(store.isRunning("a"));
        assertEquals("42", store.findResult("a").orElseThrow());
        assertEquals(ExecutionStatus.COMPLETED, store.findCompleted("a").orElseThrow().status());
    }

    @Test
    void failureWithRetriesGoesBackToPending() {
        store.insertPending(pending("a", 1));
        store.markRunning("a", Instant.now());

        TaskExecution retry = store.recordFailure("a", "boom", true, Instant.now()).orElseThrow();
        assertEquals(ExecutionStatus.PENDING, retry.status());
        assertEquals(1, retry.retryCount());
        assertNull(retry.error());
        assertNull(retry.startedAt());
        assertNull(retry.completedAt());
        assertTrue(store.findPending("a").isPresent());

        // Second failure exhausts the budget
        store.markRunning("a", Instant.now());
        TaskExecution failed = store.recordFailure("a", "boom again", true, Instant.now()).orElseThrow();
        assertEquals(ExecutionStatus.FAILED, failed.status());
        assertEquals(1, failed.retryCount());
        assertEquals("boom again", failed.error());
        assertNotNull(failed.completedAt());
        assertTrue(store.findResult("a").isEmpty());
    }

    @Test
    void failureWithoutRetryAllowedIsTerminal() {
        store.insertPending(pending("a", 3));
        store.markRunning("a", Instant.now());

        TaskExecution failed = store.recordFailure("a", "boom", false, Instant.now()).orElseThrow();
        assertEquals(ExecutionStatus.FAILED, failed.status());
        assertEquals(0, failed.retryCount());
    }

    @Test
    void cancellationResults() {
        store.insertPending(pending("a", 3));

        assertEquals(CancelResult.REQUESTED, store.requestCancellation("a"));
        assertEquals(CancelResult.ALREADY_REQUESTED, store.requestCancellation("a"));
        assertEquals(CancelResult.NOT_FOUND, store.requestCancellation("missing"));

        // A flagged pending execution cannot start
        assertTrue(store.markRunning("a", Instant.now()).isEmpty());

        TaskExecution cancelled = store.cancelPending("a", Instant.now()).orElseThrow();
        assertEquals(ExecutionStatus.CANCELLED, cancelled.status());
        assertNotNull(cancelled.completedAt());

        assertEquals(CancelResult.ALREADY_TERMINAL, store.requestCancellation("a"));
    }

    @Test
    void cancelPendingRequiresFlag() {
        store.insertPending(pending("a", 3));
        assertTrue(store.cancelPending("a", Instant.now()).isEmpty());
        assertEquals(ExecutionStatus.PENDING, store.findById("a").orElseThrow().status());
    }

    @Test
    void cancellationDuringRunDiscardsOutcome() {
        store.insertPending(pending("ok", 3));
        store.insertPending(pending("bad", 3));
        store.markRunning("ok", Instant.now());
        store.markRunning("bad", Instant.now());

        assertEquals(CancelResult.REQUESTED, store.requestCancellation("ok"));
        assertEquals(CancelResult.REQUESTED, store.requestCancellation("bad"));

        TaskExecution ok = store.recordSuccess("ok", "value", Instant.now()).orElseThrow();
        assertEquals(ExecutionStatus.CANCELLED, ok.status());
        assertNull(ok.result());
        assertTrue(store.findResult("ok").isEmpty());

        TaskExecution bad = store.recordFailure("bad", "boom", true, Instant.now()).orElseThrow();
        assertEquals(ExecutionStatus.CANCELLED, bad.status());
        assertNull(bad.error());
        assertEquals(0, bad.retryCount());
    }

    @Test
    void terminalRecordsAreNeverModified() {
        store.insertPending(pending("a", 3));
        store.markRunning("a", Instant.now());
        TaskExecution done = store.recordSuccess("a", "r", Instant.now()).orElseThrow();

        assertTrue(store.markRunning("a", Instant.now()).isEmpty());
        assertTrue(store.recordSuccess("a", "other", Instant.now()).isEmpty());
        assertTrue(store.recordFailure("a", "late", true, Instant.now()).isEmpty());
        assertTrue(store.cancelPending("a", Instant.now()).isEmpty());
        assertEquals(CancelResult.ALREADY_TERMINAL, store.requestCancellation("a"));

        TaskExecution after = store.findById("a").orElseThrow();
        assertSame(done, after);
        assertEquals("r", store.findResult("a").orElseThrow());
    }

    @Test
    void nullResultIsNotAnOutput() {
        store.insertPending(pending("a", 0));
        store.markRunning("a", Instant.now());
        TaskExecution done = store.recordSuccess("a", null, Instant.now()).orElseThrow();

        assertEquals(ExecutionStatus.COMPLETED, done.status());
        assertTrue(store.findResult("a").isEmpty());
    }

    @Test
    void findResultsSkipsMissing() {
        store.insertPending(pending("a", 0));
        store.markRunning("a", Instant.now());
        store.recordSuccess("a", "A", Instant.now());

        Map<String, String> results = store.findResults(List.of("a", "b"));
        assertEquals(Map.of("a", "A"), results);
    }

    @Test
    void findByStatusAndCounts() {
        store.insertPending(pending("p", 0));
        store.insertPending(pending("r", 0));
        store.insertPending(pending("c", 0));
        store.insertPending(pending("f", 0));
        store.insertPending(pending("x", 0));

        store.markRunning("r", Instant.now());
        store.markRunning("c", Instant.now());
        store.recordSuccess("c", "ok", Instant.now());
        store.markRunning("f", Instant.now());
        store.recordFailure("f", "no", true, Instant.now());
        store.requestCancellation("x");
        store.cancelPending("x", Instant.now());

        assertEquals(List.of("p"), ids(store.findByStatus(ExecutionStatus.PENDING)));
        assertEquals(List.of("r"), ids(store.findByStatus(ExecutionStatus.RUNNING)));
        assertEquals(List.of("c"), ids(store.findByStatus(ExecutionStatus.COMPLETED)));
        assertEquals(List.of("f"), ids(store.findByStatus(ExecutionStatus.FAILED)));
        assertEquals(List.of("x"), ids(store.findByStatus(ExecutionStatus.CANCELLED)));

        Map<ExecutionStatus, Integer> counts = store.countByStatus();
        for (ExecutionStatus status : ExecutionStatus.values()) {
            assertEquals(1, counts.get(status), status.name());
        }
    }

    @Test
    void evictCompletedBefore() {
        Instant old = Instant.parse("2026-01-01T00:00:00Z");
        Instant recent = Instant.parse("2026-01-01T01:00:00Z");

        store.insertPending(pending("old", 0));
        store.insertPending(pending("recent", 0));
        store.insertPending(pending("waiting", 0));
        store.markRunning("old", old);
        store.recordSuccess("old", "o", old);
        store.markRunning("recent", recent);
        store.recordSuccess("recent", "r", recent);

        List<TaskExecution> evicted = store.evictCompletedBefore(Instant.parse("2026-01-01T00:30:00Z"));

        assertEquals(List.of("old"), ids(evicted));
        assertTrue(store.findById("old").isEmpty());
        assertTrue(store.findResult("old").isEmpty());
        assertTrue(store.findById("recent").isPresent());
        assertTrue(store.findById("waiting").isPresent());
    }

    @Test
    void concurrentFinalizationHappensOnce() throws Exception {
        store.insertPending(pending("a", 0));
        store.markRunning("a", Instant.now());

        int threads = 8;
        ExecutorService pool = Executors.newFixedThreadPool(threads);
        CountDownLatch go = new CountDownLatch(1);
        AtomicInteger winners = new AtomicInteger();
        Set<String> outcomes = ConcurrentHashMap.newKeySet();
        List<Future<?>> futures = new ArrayList<>();

        try {
            for (int i = 0; i < threads; i++) {
                int n = i;
                futures.add(pool.submit(() -> {
                    go.await();
                    var result = n % 2 == 0
                            ? store.recordSuccess("a", "r" + n, Instant.now())
                            : store.recordFailure("a", "e" + n, false, Instant.now());
                    result.ifPresent(r -> {
                        winners.incrementAndGet();
                        outcomes.add(r.status().name());
                    });
                    return null;
                }));
            }
            go.countDown();
            for (Future<?> f : futures) {
                f.get(5, TimeUnit.SECONDS);
            }
        } finally {
            pool.shutdownNow();
        }

        assertEquals(1, winners.get());
        assertEquals(1, outcomes.size());
        assertTrue(store.findById("a").orElseThrow().isTerminal());
    }

    private static List<String> ids(List<TaskExecution> executions) {
        return executions.stream().map(TaskExecution::id).toList();
    }
}
