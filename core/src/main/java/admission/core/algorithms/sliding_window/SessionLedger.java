package admission.core.algorithms.sliding_window;

import admission.core.model.LedgerRecord;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Admitted calls of one session, oldest first.
 *
 * Keeps a running token sum so the volume check is O(1); eviction is O(expired).
 *
 * Thread-safety: none. The owner must hold the session lock for every call.
 */
public final class SessionLedger {
    private final ArrayDeque<LedgerRecord> records = new ArrayDeque<>();
    private long tokenSum;

    public SessionLedger() {
    }

    /**
     * Copies the given records, reordered oldest first so eviction from the
     * front reaches every expired record.
     *
     * @throws IllegalArgumentException if the list or any record is null, or
     *         the tokens add up to more than a long can hold
     */
    public SessionLedger(List<LedgerRecord> initial) {
        if (initial == null) throw new IllegalArgumentException("initial cannot be null");
        List<LedgerRecord> sorted = new ArrayList<>(initial.size());
        for (LedgerRecord r : initial) {
            if (r == null) throw new IllegalArgumentException("records cannot contain null");
            sorted.add(r);
        }
        sorted.sort(Comparator.comparingLong(LedgerRecord::timestampNanos));
        try {
            for (LedgerRecord r : sorted) append(r);
        } catch (ArithmeticException e) {
            throw new IllegalArgumentException("token sum overflows", e);
        }
    }

    void append(LedgerRecord record) {
        tokenSum = Math.addExact(tokenSum, record.tokens());
        records.addLast(record);
    }

    /**
     * Drops every record older than the window. A record aged exactly
     * {@code windowNanos} is still inside the window.
     *
     * @return number of records dropped
     */
    int evictExpired(long nowNanos, long windowNanos) {
        int evicted = 0;
        while (!records.isEmpty() && records.peekFirst().ageNanos(nowNanos) > windowNanos) {
            tokenSum -= records.removeFirst().tokens();
            evicted++;
        }
        return evicted;
    }

    Iterable<LedgerRecord> oldestFirst() {
        return records;
    }

    public int size() {
        return records.size();
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }

    public long tokenSum() {
        return tokenSum;
    }

    /**
     * @return the oldest retained record, or null if empty
     */
    public LedgerRecord oldest() {
        return records.peekFirst();
    }

    /**
     * Immutable copy of the records, oldest first.
     */
    public List<LedgerRecord> records() {
        return List.copyOf(records);
    }

    @Override
    public String toString() {
        return "SessionLedger{size=" + records.size() + ", tokenSum=" + tokenSum + "}";
    }
}
