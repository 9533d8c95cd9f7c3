package com.calai.credreset.passwordreset.guard;

public class RateLimitedException extends RuntimeException {

    private final ResetOperation operation;
    private final int retryAfterSec;

    public RateLimitedException(ResetOperation operation, int retryAfterSec) {
        super("RATE_LIMITED");
        this.operation = operation;
        this.retryAfterSec = retryAfterSec;
    }

    public ResetOperation operation() { return operation; }
    public int retryAfterSec() { return retryAfterSec; }
}
