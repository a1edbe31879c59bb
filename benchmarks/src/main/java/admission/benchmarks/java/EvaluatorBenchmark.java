package admission.benchmarks.java;

import admission.core.algorithms.sliding_window.SessionLedger;
import admission.core.algorithms.sliding_window.SlidingWindowEvaluator;
import admission.core.clock.SystemClock;
import admission.core.model.AdmissionLimits;
import admission.core.model.AdmissionResult;
import org.openjdk.jmh.annotations.*;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * JMH Benchmarks for the bare sliding-window evaluator (single thread, no locking).
 *
 * Scenarios:
 * - admit: short window, ledger stays small, every call admitted (hot path)
 * - reject: request limit exhausted for an hour, every call rejected
 * - rejectTokens: token limit exhausted behind a long ledger, retry hint walks it
 *
 * Run:
 *   mvn -pl benchmarks -am package
 *   java -cp benchmarks/target/classes:... org.openjdk.jmh.Main Evaluator
 */
@BenchmarkMode(Mode.Throughput)
@OutputTimeUnit(TimeUnit.SECONDS)
@Warmup(iterations = 3, time = 1)
@Measurement(iterations = 5, time = 1)
@Fork(1)
@State(Scope.Thread)
public class EvaluatorBenchmark {

    private SystemClock clock;

    private SlidingWindowEvaluator admitEvaluator;
    private SessionLedger admitLedger;

    private SlidingWindowEvaluator rejectEvaluator;
    private SessionLedger rejectLedger;

    private SlidingWindowEvaluator tokenEvaluator;
    private SessionLedger tokenLedger;

    @Setup
    public void setup() {
        clock = SystemClock.instance();

        admitEvaluator = new SlidingWindowEvaluator(
            AdmissionLimits.of(1_000_000, 1_000_000_000L, Duration.ofMillis(1)));
        admitLedger = new SessionLedger();

        rejectEvaluator = new SlidingWindowEvaluator(
            AdmissionLimits.of(1, 1_000_000L, Duration.ofHours(1)));
        rejectLedger = new SessionLedger();
        rejectEvaluator.check(rejectLedger, 1, clock.nowNanos());

        tokenEvaluator = new SlidingWindowEvaluator(
            AdmissionLimits.of(10_000, 1_000L, Duration.ofHours(1)));
        tokenLedger = new SessionLedger();
        long now = clock.nowNanos();
        for (int i = 0; i < 1_000; i++) {
            tokenEvaluator.check(tokenLedger, 1, now);
        }
    }

    @Benchmark
    public AdmissionResult admit() {
        return admitEvaluator.check(admitLedger, 1, clock.nowNanos());
    }

    @Benchmark
    public AdmissionResult reject() {
        return rejectEvaluator.check(rejectLedger, 1, clock.nowNanos());
    }

    @Benchmark
    public AdmissionResult rejectTokens() {
        return tokenEvaluator.check(tokenLedger, 1_000, clock.nowNanos());
    }
}
