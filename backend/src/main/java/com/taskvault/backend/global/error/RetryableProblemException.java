package com.taskvault.backend.global.error;

/**
 * Backing-store outage: the request may succeed if repeated after {@code Retry-After} seconds.
 * Nothing in the core retries on its own.
 */
public class RetryableProblemException extends ProblemException {

    public static final int DEFAULT_RETRY_AFTER_SECONDS = 5;

    private final int retryAfterSeconds;

    public RetryableProblemException(String code, String detail, int retryAfterSeconds, Throwable cause) {
        super(ErrorKind.SERVICE_UNAVAILABLE, code, detail, cause);
        if (retryAfterSeconds < 0) {
            throw new IllegalArgumentException("retryAfterSeconds must be >= 0");
        }
        this.retryAfterSeconds = retryAfterSeconds;
    }

    public static RetryableProblemException storeUnavailable(String store, Throwable cause) {
        return new RetryableProblemException(
                ErrorKind.SERVICE_UNAVAILABLE.defaultCode(),
                store + " is temporarily unavailable",
                DEFAULT_RETRY_AFTER_SECONDS,
                cause
        );
    }

    public int getRetryAfterSeconds() {
        return retryAfterSeconds;
    }
}
