package admission.core.model;

import java.time.Duration;

/**
 * Process-wide limits, fixed for the lifetime of the process.
 *
 * @param rpmLimit max admitted calls in any window
 * @param tpmLimit max sum of admitted tokens in any window
 * @param windowNanos trailing window length in nanoseconds
 */
public record AdmissionLimits(
    int rpmLimit,
    long tpmLimit,
    long windowNanos
) {
    public static final int DEFAULT_RPM_LIMIT = 60;
    public static final long DEFAULT_TPM_LIMIT = 10_000L;
    public static final long DEFAULT_WINDOW_SECONDS = 60L;

    public AdmissionLimits {
        if (rpmLimit <= 0) throw new IllegalArgumentException("rpmLimit must be > 0");
        if (tpmLimit <= 0) throw new IllegalArgumentException("tpmLimit must be > 0");
        if (windowNanos <= 0) throw new IllegalArgumentException("window must be > 0");
    }

    /**
     * 60 requests and 10,000 tokens per trailing 60 seconds.
     */
    public static AdmissionLimits defaults() {
        return perMinute(DEFAULT_RPM_LIMIT, DEFAULT_TPM_LIMIT);
    }

    public static AdmissionLimits perMinute(int rpmLimit, long tpmLimit) {
        return of(rpmLimit, tpmLimit, Duration.ofSeconds(DEFAULT_WINDOW_SECONDS));
    }

    public static AdmissionLimits of(int rpmLimit, long tpmLimit, Duration window) {
        if (window == null) throw new IllegalArgumentException("window cannot be null");
        return new AdmissionLimits(rpmLimit, tpmLimit, window.toNanos());
    }

    public Duration window() {
        return Duration.ofNanos(windowNanos);
    }
}
