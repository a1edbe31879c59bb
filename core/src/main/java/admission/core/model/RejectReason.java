package admission.core.model;

/**
 * Which limit turned a call away.
 */
public enum RejectReason {
    /** Admitting the call would exceed the request count for the window. */
    REQUEST_LIMIT,

    /** Admitting the call would exceed the token volume for the window. */
    TOKEN_LIMIT,

    /**
     * The call alone asks for more tokens than the window allows.
     * Waiting does not help; the hint is always 0.
     */
    REQUEST_TOO_LARGE
}
