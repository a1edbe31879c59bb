package admission.core.algorithms.sliding_window;

import admission.core.model.AdmissionLimits;
import admission.core.model.AdmissionResult;
import admission.core.model.LedgerRecord;
import admission.core.model.RejectReason;

/**
 * Exact sliding window (log) with two limits checked together:
 * calls per window and tokens per window.
 *
 * Per check:
 * 1. evict records older than the window (always, even if the call is rejected)
 * 2. reject if one more call would exceed the request limit
 * 3. reject if the requested tokens would exceed the token limit
 * 4. otherwise append (now, tokens) and admit
 *
 * A rejected call never appends, so the ledger only loses records that had
 * already expired.
 *
 * Stateless: "now" is passed in and the ledger belongs to the caller, who
 * must hold its lock for the whole call.
 */
public final class SlidingWindowEvaluator {
    private final AdmissionLimits limits;

    public SlidingWindowEvaluator(AdmissionLimits limits) {
        if (limits == null) throw new IllegalArgumentException("limits cannot be null");
        this.limits = limits;
    }

    public AdmissionResult check(SessionLedger ledger, long tokensRequested, long nowNanos) {
        if (ledger == null) throw new IllegalArgumentException("ledger cannot be null");
        if (tokensRequested < 0) throw new IllegalArgumentException("tokensRequested < 0: " + tokensRequested);

        long window = limits.windowNanos();
        ledger.evictExpired(nowNanos, window);

        if (ledger.size() + 1 > limits.rpmLimit()) {
            return AdmissionResult.reject(RejectReason.REQUEST_LIMIT, expiryOf(ledger.oldest(), nowNanos));
        }

        if (tokensRequested > limits.tpmLimit()) {
            return AdmissionResult.reject(RejectReason.REQUEST_TOO_LARGE, 0L);
        }
        // headroom form: tokenSum + tokensRequested may not fit in a long
        if (tokensRequested > limits.tpmLimit() - ledger.tokenSum()) {
            return AdmissionResult.reject(RejectReason.TOKEN_LIMIT, tokenRetryAfter(ledger, tokensRequested, nowNanos));
        }

        ledger.append(new LedgerRecord(nowNanos, tokensRequested));
        return AdmissionResult.admit();
    }

    public AdmissionLimits limits() {
        return limits;
    }

    // first instant at which the record no longer counts
    private long expiryOf(LedgerRecord record, long nowNanos) {
        return record.timestampNanos() + limits.windowNanos() + 1 - nowNanos;
    }

    private long tokenRetryAfter(SessionLedger ledger, long tokensRequested, long nowNanos) {
        long remaining = ledger.tokenSum();
        for (LedgerRecord r : ledger.oldestFirst()) {
            remaining -= r.tokens();
            if (tokensRequested <= limits.tpmLimit() - remaining) {
                return expiryOf(r, nowNanos);
            }
        }
        // unreachable while tokensRequested <= tpmLimit
        return limits.windowNanos();
    }
}
