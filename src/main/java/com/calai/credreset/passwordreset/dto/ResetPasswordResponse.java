package com.calai.credreset.passwordreset.dto;

import com.calai.credreset.passwordreset.model.ResetDiagnostics;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * success: {message, requestId}
 * failure: {code, error, requestId}（+ diagnostics）
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ResetPasswordResponse(
        String message,
        String code,
        String error,
        String requestId,
        ResetDiagnostics diagnostics
) {
    public static ResetPasswordResponse failure(String code, String error, String requestId) {
        return new ResetPasswordResponse(null, code, error, requestId, null);
    }
}
