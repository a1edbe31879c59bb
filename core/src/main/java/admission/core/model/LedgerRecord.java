package admission.core.model;

/**
 * One admitted call: when it was admitted and how many tokens it was charged.
 */
public record LedgerRecord(long timestampNanos, long tokens) {
    public LedgerRecord {
        if (tokens < 0) throw new IllegalArgumentException("tokens < 0");
    }

    public long ageNanos(long nowNanos) {
        return nowNanos - timestampNanos;
    }
}
