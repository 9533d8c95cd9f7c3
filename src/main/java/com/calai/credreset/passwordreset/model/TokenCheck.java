package com.calai.credreset.passwordreset.model;

import com.calai.credreset.passwordreset.entity.PasswordResetToken;

/**
 * Result of the verification state machine. {@code record} and
 * {@code tokenHash} are only set when a row was found and are never serialized.
 */
public record TokenCheck(
        ResetState state,
        ResetDiagnostics diagnostics,
        PasswordResetToken record,
        String tokenHash
) {
    public boolean isOk() {
        return state == ResetState.OK;
    }
}
