package com.calai.credreset.passwordreset.web;

import com.calai.credreset.common.crypto.HmacSha256;
import com.calai.credreset.passwordreset.config.PasswordResetProperties;
import com.calai.credreset.passwordreset.dto.ResetPasswordResponse;
import com.calai.credreset.passwordreset.dto.VerifyTokenResponse;
import com.calai.credreset.passwordreset.guard.DiagnosticsConsistencyGuard;
import com.calai.credreset.passwordreset.model.ResetOutcome;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;

/**
 * verify / reset 的回應只從這裡組，組完交給 consistency guard 比對後才回傳。
 */
@Component
@RequiredArgsConstructor
public class ResetResponses {

    public static final String DIAGNOSTICS_HEADER = "X-Reset-Diagnostics-Key";
    public static final String RESET_SUCCESS_MESSAGE =
            "Password has been successfully reset. You can now log in with your new password.";

    private final PasswordResetProperties props;
    private final DiagnosticsConsistencyGuard guard;

    public ResponseEntity<VerifyTokenResponse> verify(ResetOutcome o, String requestId, boolean exposeDiagnostics) {
        var diag = exposeDiagnostics ? o.diagnostics() : null;
        VerifyTokenResponse body = o.isOk()
                ? new VerifyTokenResponse(true, null, null, requestId, diag)
                : new VerifyTokenResponse(false, o.state().publicCode(), o.message(), requestId, diag);

        guard.check(o, body.code(), body.diagnostics(), requestId);
        return ResponseEntity.status(o.state().httpStatus()).body(body);
    }

    public ResponseEntity<ResetPasswordResponse> reset(ResetOutcome o, String requestId, boolean exposeDiagnostics) {
        var diag = exposeDiagnostics ? o.diagnostics() : null;
        ResetPasswordResponse body = o.isOk()
                ? new ResetPasswordResponse(RESET_SUCCESS_MESSAGE, null, null, requestId, diag)
                : new ResetPasswordResponse(null, o.state().publicCode(), o.message(), requestId, diag);

        guard.check(o, body.code(), body.diagnostics(), requestId);
        return ResponseEntity.status(o.state().httpStatus()).body(body);
    }

    /** 非 prod 設定打開，或帶了正確的 operator header */
    public boolean exposeDiagnostics(HttpServletRequest req) {
        if (props.getDiagnostics().isExpose()) return true;
        String key = props.getDiagnostics().getOperatorKey();
        if (key == null || key.isBlank()) return false;
        return HmacSha256.constantTimeEquals(key, req.getHeader(DIAGNOSTICS_HEADER));
    }
}
