package admission.core.model;

/**
 * Pure core contract: decide whether a session may make one more call
 * costing {@code tokensRequested} tokens, and record it if so.
 */
public interface AdmissionGate {
    AdmissionResult check(String sessionId, long tokensRequested);
}
