package com.calai.credreset.passwordreset.dto;

import com.calai.credreset.passwordreset.model.ResetDiagnostics;
import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * success: {valid:true, requestId}
 * failure: {valid:false, code, error, requestId}
 * diagnostics 只在非 prod 或帶 operator header 時出現。不含任何帳號資訊。
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record VerifyTokenResponse(
        boolean valid,
        String code,
        String error,
        String requestId,
        ResetDiagnostics diagnostics
) {}
