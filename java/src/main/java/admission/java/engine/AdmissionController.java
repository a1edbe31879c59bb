package admission.java.engine;

import admission.core.algorithms.sliding_window.SessionLedger;
import admission.core.algorithms.sliding_window.SlidingWindowEvaluator;
import admission.core.clock.Clock;
import admission.core.model.AdmissionGate;
import admission.core.model.AdmissionLimits;
import admission.core.model.AdmissionResult;
import admission.core.model.LedgerRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Thread-safe admission controller: one sliding-window ledger per session,
 * two limits (requests and tokens per window) enforced per session.
 *
 * Architecture:
 * - SessionStore maps session id to SessionEntry (ledger + ReentrantLock)
 * - Per-session locks: a check on one session never waits for another session
 * - The whole evict/check/append step runs under the session lock
 * - Clock injection enables deterministic testing
 *
 * Limits are process-wide and identical for every session; nothing is
 * aggregated across sessions.
 *
 * Usage example:
 * <pre>
 * AdmissionController controller =
 *     new AdmissionController(SystemClock.instance(), AdmissionLimits.defaults(), 10_000);
 *
 * AdmissionResult result = controller.check("session:abc", 250);
 * if (result.admitted()) {
 *     // call the model with exactly 250 tokens
 * } else {
 *     // surface a rate-limit failure; result.retryAfterNanos() is a hint
 * }
 * </pre>
 */
public final class AdmissionController implements AdmissionGate {

    private static final Logger logger = LoggerFactory.getLogger(AdmissionController.class);

    private final Clock clock;
    private final SlidingWindowEvaluator evaluator;
    private final SessionStore sessions;

    /**
     * Creates a new controller.
     *
     * @param clock Clock instance for time control (injected for testability)
     * @param limits Limits applied to every session
     * @param maxSessions Maximum number of sessions to track (LRU beyond this)
     * @throws IllegalArgumentException if any parameter is invalid
     */
    public AdmissionController(Clock clock, AdmissionLimits limits, int maxSessions) {
        this(clock, limits, new SessionStore(maxSessions));
    }

    /**
     * Creates a controller over an existing store.
     */
    public AdmissionController(Clock clock, AdmissionLimits limits, SessionStore sessions) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (limits == null) {
            throw new IllegalArgumentException("limits cannot be null");
        }
        if (sessions == null) {
            throw new IllegalArgumentException("sessions cannot be null");
        }

        this.clock = clock;
        this.evaluator = new SlidingWindowEvaluator(limits);
        this.sessions = sessions;
    }

    /**
     * Decides whether a session may make one more call costing
     * {@code tokensRequested} tokens, recording it if admitted.
     *
     * <p>Sequential calls on a session always see each other's effects.
     * Parallel calls on a session are serialized by its lock, so the limits
     * hold exactly.
     *
     * @param sessionId The session to charge (non-empty)
     * @param tokensRequested Token cost of the call (>= 0, 0 is allowed)
     * @return ADMIT, or REJECT with the failing limit and a retry hint
     * @throws IllegalArgumentException if sessionId is null/empty or tokensRequested < 0
     */
    @Override
    public AdmissionResult check(String sessionId, long tokensRequested) {
        requireSessionId(sessionId);
        if (tokensRequested < 0) {
            throw new IllegalArgumentException("tokensRequested must be >= 0, got: " + tokensRequested);
        }

        // An entry dropped between lookup and lock is detached: resolve again.
        SessionEntry entry;
        ReentrantLock lock;
        while (true) {
            entry = sessions.getOrCreate(sessionId);
            lock = entry.lock();
            lock.lock();
            if (sessions.isBound(sessionId, entry)) {
                break;
            }
            lock.unlock();
        }
        try {
            AdmissionResult result = evaluator.check(entry.ledger(), tokensRequested, clock.nowNanos());
            if (!result.admitted()) {
                logger.debug("Rejected session={} tokens={} reason={} retryAfterNanos={}",
                    sessionId, tokensRequested, result.reason(), result.retryAfterNanos());
            }
            return result;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Returns a consistent copy of a session's records, oldest first.
     * Records are not evicted by this call, so some may already be outside
     * the window until the next check.
     *
     * @return the records, or an empty list if the session is not tracked
     */
    public List<LedgerRecord> snapshot(String sessionId) {
        requireSessionId(sessionId);

        SessionEntry entry = sessions.get(sessionId);
        if (entry == null) {
            return List.of();
        }

        ReentrantLock lock = entry.lock();
        lock.lock();
        try {
            return entry.ledger().records();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Replaces a session's ledger, e.g. to restore state handed over from elsewhere.
     */
    public void restore(String sessionId, List<LedgerRecord> records) {
        requireSessionId(sessionId);
        sessions.put(sessionId, new SessionLedger(records));
    }

    /**
     * Forgets a session. Its next call starts from an empty ledger.
     *
     * @return true if the session was tracked
     */
    public boolean release(String sessionId) {
        requireSessionId(sessionId);
        return sessions.remove(sessionId);
    }

    /**
     * @return number of tracked sessions
     */
    public int size() {
        return sessions.size();
    }

    /**
     * @return maximum number of tracked sessions
     */
    public int maxSessions() {
        return sessions.maxSessions();
    }

    /**
     * Clears all sessions. Primarily useful for testing.
     */
    public void clear() {
        sessions.clear();
    }

    public AdmissionLimits limits() {
        return evaluator.limits();
    }

    private static void requireSessionId(String sessionId) {
        if (sessionId == null || sessionId.isEmpty()) {
            throw new IllegalArgumentException("sessionId cannot be null or empty");
        }
    }
}
