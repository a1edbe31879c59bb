package admission.core.model;

/**
 * Outcome of one admission check.
 *
 * @param decision ADMIT or REJECT
 * @param reason why the call was rejected, null when admitted
 * @param retryAfterNanos advisory wait before the same call could pass, 0 when admitted
 */
public record AdmissionResult(
    Decision decision,
    RejectReason reason,
    long retryAfterNanos
) {
    private static final AdmissionResult ADMITTED = new AdmissionResult(Decision.ADMIT, null, 0L);

    public static AdmissionResult admit() {
        return ADMITTED;
    }

    public static AdmissionResult reject(RejectReason reason, long retryAfterNanos) {
        if (reason == null) throw new IllegalArgumentException("reason cannot be null");
        return new AdmissionResult(Decision.REJECT, reason, Math.max(0L, retryAfterNanos));
    }

    public boolean admitted() {
        return decision == Decision.ADMIT;
    }
}
