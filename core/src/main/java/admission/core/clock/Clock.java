package admission.core.clock;

/**
 * Monotonic time source, in nanoseconds.
 * Injected everywhere "now" is needed so tests can drive time by hand.
 */
public interface Clock {
    long nowNanos();
}
