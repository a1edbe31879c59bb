package admission.java.engine;

import admission.core.clock.ManualClock;
import admission.core.clock.SystemClock;
import admission.core.model.AdmissionLimits;
import admission.core.model.AdmissionResult;
import admission.core.model.LedgerRecord;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Concurrency tests for AdmissionController.
 *
 * Focus:
 * - Parallel calls on one session never over-admit
 * - Sessions do not interfere under load
 * - Ledger stays consistent with what was admitted
 * - No deadlocks across sessions
 */
class AdmissionControllerConcurrencyTest {

    @Test
    void testConcurrent_sameSessionRequestLimitExact() throws InterruptedException {
        ManualClock clock = new ManualClock(0L);
        AdmissionController controller = new AdmissionController(clock, AdmissionLimits.defaults(), 1000);

        int numThreads = 100;
        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch doneLatch = new CountDownLatch(numThreads);

        AtomicInteger admitCount = new AtomicInteger(0);
        AtomicInteger rejectCount = new AtomicInteger(0);

        ExecutorService executor = Executors.newFixedThreadPool(numThreads);

        for (int i = 0; i < numThreads; i++) {
            executor.submit(() -> {
                try {
                    startLatch.await(); // Wait for signal to start
                    AdmissionResult result = controller.check("session:hot", 10);
                    if (result.admitted()) {
                        admitCount.incrementAndGet();
                    } else {
                        rejectCount.incrementAndGet();
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    doneLatch.countDown();
                }
            });
        }

        startLatch.countDown(); // Signal all threads to start
        assertTrue(doneLatch.await(5, TimeUnit.SECONDS), "Test timed out");

        executor.shutdown();
        assertTrue(executor.awaitTermination(5, TimeUnit.SECONDS), "Executor did not terminate");

        // Time stands still, so exactly the request limit gets through
        assertEquals(60, admitCount.get());
        assertEquals(40, rejectCount.get());
        assertEquals(60, controller.snapshot("session:hot").size());
    }

    @Test
    void testConcurrent_sameSessionTokenLimitExact() throws InterruptedException {
        ManualClock clock = new ManualClock(0L);
        AdmissionController controller = new AdmissionController(clock, AdmissionLimits.defaults(), 1000);

        int numThreads = 50;
        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch doneLatch = new CountDownLatch(numThreads);
        AtomicInteger admitCount = new AtomicInteger(0);

        ExecutorService executor = Executors.newFixedThreadPool(numThreads);

        for (int i = 0; i < numThreads; i++) {
            executor.submit(() -> {
                try {
                    startLatch.await();
                    if (controller.check("session:hot", 300).admitted()) {
                        admitCount.incrementAndGet();
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    doneLatch.countDown();
                }
            });
        }

        startLatch.countDown();
        assertTrue(doneLatch.await(5, TimeUnit.SECONDS));

        executor.shutdown();
        assertTrue(executor.awaitTermination(5, TimeUnit.SECONDS));

        // 10,000 / 300 = 33 calls fit
        assertEquals(33, admitCount.get());
        long charged = controller.snapshot("session:hot").stream().mapToLong(LedgerRecord::tokens).sum();
        assertEquals(9_900L, charged);
    }

    @Test
    void testConcurrent_sessionsShouldNotInterfere() throws InterruptedException {
        ManualClock clock = new ManualClock(0L);
        AdmissionController controller = new AdmissionController(clock, AdmissionLimits.defaults(), 1000);

        int numSessions = 10;
        int threadsPerSession = 10;
        int callsPerThread = 10;
        int numThreads = numSessions * threadsPerSession;
        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch doneLatch = new CountDownLatch(numThreads);

        ConcurrentHashMap<String, AtomicInteger> admittedPerSession = new ConcurrentHashMap<>();

        ExecutorService executor = Executors.newFixedThreadPool(numThreads);

        for (int i = 0; i < numThreads; i++) {
            final String sessionId = "session-" + (i % numSessions);
            executor.submit(() -> {
                try {
                    startLatch.await();
                    for (int j = 0; j < callsPerThread; j++) {
                        if (controller.check(sessionId, 1).admitted()) {
                            admittedPerSession.computeIfAbsent(sessionId, k -> new AtomicInteger(0))
                                .incrementAndGet();
                        }
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    doneLatch.countDown();
                }
            });
        }

        startLatch.countDown();
        assertTrue(doneLatch.await(10, TimeUnit.SECONDS));

        executor.shutdown();
        assertTrue(executor.awaitTermination(5, TimeUnit.SECONDS));

        // each session saw 100 calls and admitted exactly its own 60
        assertEquals(numSessions, admittedPerSession.size());
        admittedPerSession.forEach((sessionId, count) ->
            assertEquals(60, count.get(), "Session " + sessionId));
        assertEquals(numSessions, controller.size());
    }

    @Test
    void testConcurrent_sequentialCallsSeeEachOther() throws Exception {
        ManualClock clock = new ManualClock(0L);
        AdmissionController controller = new AdmissionController(clock, AdmissionLimits.defaults(), 1000);

        // successive calls on one session, each on a different pool thread
        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            for (int i = 0; i < 60; i++) {
                Future<AdmissionResult> result = executor.submit(() -> controller.check("session:seq", 100));
                assertTrue(result.get(5, TimeUnit.SECONDS).admitted());
            }
            Future<AdmissionResult> last = executor.submit(() -> controller.check("session:seq", 100));
            assertFalse(last.get(5, TimeUnit.SECONDS).admitted());
        } finally {
            executor.shutdown();
        }

        List<LedgerRecord> records = controller.snapshot("session:seq");
        assertEquals(60, records.size());
    }

    @Test
    void testConcurrent_LRUBoundUnderLoad() throws InterruptedException {
        AdmissionController controller =
            new AdmissionController(SystemClock.instance(), AdmissionLimits.defaults(), 10);

        int numThreads = 20;
        int sessionsPerThread = 5;
        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch doneLatch = new CountDownLatch(numThreads);

        ExecutorService executor = Executors.newFixedThreadPool(numThreads);

        for (int i = 0; i < numThreads; i++) {
            final int threadId = i;
            executor.submit(() -> {
                try {
                    startLatch.await();
                    for (int k = 0; k < sessionsPerThread; k++) {
                        controller.check("thread-" + threadId + "-session-" + k, 1);
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    doneLatch.countDown();
                }
            });
        }

        startLatch.countDown();
        assertTrue(doneLatch.await(5, TimeUnit.SECONDS));

        executor.shutdown();
        assertTrue(executor.awaitTermination(5, TimeUnit.SECONDS));

        // 100 sessions seen, only 10 kept
        assertEquals(10, controller.size());
    }

    @Test
    void testConcurrent_noDeadlockWithMultipleSessions() throws InterruptedException {
        AdmissionController controller =
            new AdmissionController(SystemClock.instance(), AdmissionLimits.defaults(), 1000);

        int numThreads = 20;
        CountDownLatch startLatch = new CountDownLatch(1);
        CountDownLatch doneLatch = new CountDownLatch(numThreads);

        ExecutorService executor = Executors.newFixedThreadPool(numThreads);

        // Each thread alternates between two sessions and inspects both
        for (int i = 0; i < numThreads; i++) {
            final int threadId = i;
            executor.submit(() -> {
                try {
                    startLatch.await();
                    for (int j = 0; j < 100; j++) {
                        String sessionId = ((threadId + j) % 2 == 0) ? "s1" : "s2";
                        controller.check(sessionId, 1);
                        controller.snapshot(sessionId);
                    }
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                } finally {
                    doneLatch.countDown();
                }
            });
        }

        startLatch.countDown();

        // If there's a deadlock, this will timeout
        assertTrue(doneLatch.await(10, TimeUnit.SECONDS), "Deadlock detected - test timed out");

        executor.shutdown();
        assertTrue(executor.awaitTermination(5, TimeUnit.SECONDS));

        assertTrue(controller.snapshot("s1").size() <= 60);
        assertTrue(controller.snapshot("s2").size() <= 60);
    }
}
