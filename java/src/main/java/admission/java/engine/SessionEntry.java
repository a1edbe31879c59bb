package admission.java.engine;

import admission.core.algorithms.sliding_window.SessionLedger;

import java.util.concurrent.locks.ReentrantLock;

/**
 * A session's ledger together with the lock that guards it.
 *
 * The lock must be held for every read or write of the ledger, including
 * replacing it, so one evict/check/append step is never interleaved with
 * another on the same session.
 */
final class SessionEntry {

    private final ReentrantLock lock = new ReentrantLock(); // non-fair
    private SessionLedger ledger;

    SessionEntry(SessionLedger ledger) {
        if (ledger == null) {
            throw new IllegalArgumentException("ledger cannot be null");
        }
        this.ledger = ledger;
    }

    /**
     * MUST be called while holding the lock.
     */
    SessionLedger ledger() {
        return ledger;
    }

    /**
     * MUST be called while holding the lock.
     */
    void replaceLedger(SessionLedger replacement) {
        if (replacement == null) {
            throw new IllegalArgumentException("ledger cannot be null");
        }
        this.ledger = replacement;
    }

    ReentrantLock lock() {
        return lock;
    }
}
