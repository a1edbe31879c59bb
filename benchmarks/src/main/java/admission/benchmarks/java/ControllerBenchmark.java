package admission.benchmarks.java;

import admission.core.clock.SystemClock;
import admission.core.model.AdmissionLimits;
import admission.core.model.AdmissionResult;
import admission.java.engine.AdmissionController;
import org.openjdk.jmh.annotations.*;

import java.time.Duration;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.TimeUnit;

/**
 * JMH Benchmarks for AdmissionController (thread-safe, per-session locks).
 *
 * Measures throughput (ops/sec) across 3 scenarios:
 * - singleSession: all calls on one session
 * - multiSession: rotating through 1000 sessions (low contention)
 * - parallel: 8 threads on one session (high contention)
 *
 * Run:
 *   java -cp ... org.openjdk.jmh.Main Controller
 *   java -cp ... org.openjdk.jmh.Main Controller -rf json -rff results.json
 */
@BenchmarkMode(Mode.Throughput)
@OutputTimeUnit(TimeUnit.SECONDS)
@Warmup(iterations = 3, time = 1)
@Measurement(iterations = 5, time = 1)
@Fork(1)
@State(Scope.Benchmark)
public class ControllerBenchmark {

    private AdmissionController controller;

    @Setup
    public void setup() {
        // short window keeps ledgers small while every call is admitted
        AdmissionLimits limits = AdmissionLimits.of(1_000_000, 1_000_000_000L, Duration.ofMillis(1));
        controller = new AdmissionController(SystemClock.instance(), limits, 10_000);
    }

    @Benchmark
    public AdmissionResult singleSession() {
        return controller.check("session:1", 1);
    }

    @Benchmark
    public AdmissionResult multiSession() {
        String sessionId = "session:" + ThreadLocalRandom.current().nextInt(1000);
        return controller.check(sessionId, 1);
    }

    @Benchmark
    @Threads(8)
    public AdmissionResult parallel() {
        return controller.check("session:1", 1);
    }
}
