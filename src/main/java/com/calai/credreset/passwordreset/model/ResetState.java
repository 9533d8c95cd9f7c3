package com.calai.credreset.passwordreset.model;

import org.springframework.http.HttpStatus;

/**
 * Every outcome a reset-flow operation can end in, with the public code,
 * the user-facing message and the HTTP status derived from it.
 * <p>
 * The first six are the verification states, in precedence order.
 * INVALID_FORMAT, NOT_FOUND and EXPIRED share one public code so callers
 * cannot probe which tokens exist.
 */
public enum ResetState {

    MISSING_FIELDS("MISSING_FIELDS", HttpStatus.BAD_REQUEST,
            "Required fields are missing.",
            "token argument absent or empty"),

    INVALID_FORMAT("TOKEN_INVALID_OR_EXPIRED", HttpStatus.BAD_REQUEST,
            "Invalid or expired reset token. Please request a new password reset link.",
            "token failed format check (expected 64 hex characters)"),

    NOT_FOUND("TOKEN_INVALID_OR_EXPIRED", HttpStatus.BAD_REQUEST,
            "Invalid or expired reset token. Please request a new password reset link.",
            "no token record matches"),

    USED("TOKEN_USED", HttpStatus.BAD_REQUEST,
            "This reset link has already been used. Please request a new one.",
            "token already consumed"),

    EXPIRED("TOKEN_INVALID_OR_EXPIRED", HttpStatus.BAD_REQUEST,
            "Invalid or expired reset token. Please request a new password reset link.",
            "token expired or superseded by a newer request"),

    OK(null, HttpStatus.OK, null, "token valid"),

    WEAK_PASSWORD("WEAK_PASSWORD", HttpStatus.BAD_REQUEST,
            "Password does not meet the requirements.",
            "new password rejected by policy"),

    UPDATE_FAILED("INTERNAL_ERROR", HttpStatus.INTERNAL_SERVER_ERROR,
            "Unable to reset password. Please request a new reset link and try again.",
            "password update failed after token consumption"),

    RATE_LIMITED("RATE_LIMITED", HttpStatus.TOO_MANY_REQUESTS,
            "Too many requests. Please try again later.",
            "rate limit exceeded"),

    INTERNAL_ERROR("INTERNAL_ERROR", HttpStatus.INTERNAL_SERVER_ERROR,
            "An unexpected error occurred.",
            "unexpected failure");

    private final String publicCode;
    private final HttpStatus httpStatus;
    private final String message;
    private final String reason;

    ResetState(String publicCode, HttpStatus httpStatus, String message, String reason) {
        this.publicCode = publicCode;
        this.httpStatus = httpStatus;
        this.message = message;
        this.reason = reason;
    }

    /** null for OK */
    public String publicCode() { return publicCode; }
    public HttpStatus httpStatus() { return httpStatus; }
    public String message() { return message; }
    public String reason() { return reason; }

    public boolean isOk() { return this == OK; }
}
