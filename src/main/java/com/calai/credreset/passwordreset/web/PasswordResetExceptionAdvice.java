package com.calai.credreset.passwordreset.web;

import com.calai.credreset.common.web.RequestIdFilter;
import com.calai.credreset.passwordreset.controller.PasswordResetController;
import com.calai.credreset.passwordreset.dto.ResetPasswordResponse;
import com.calai.credreset.passwordreset.dto.VerifyTokenResponse;
import com.calai.credreset.passwordreset.guard.DiagnosticsMismatchException;
import com.calai.credreset.passwordreset.guard.RateLimitedException;
import com.calai.credreset.passwordreset.guard.ResetOperation;
import com.calai.credreset.passwordreset.model.ResetState;
import jakarta.servlet.http.HttpServletRequest;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

@Slf4j
@RestControllerAdvice(assignableTypes = PasswordResetController.class)
@Order(Ordered.HIGHEST_PRECEDENCE)
public class PasswordResetExceptionAdvice {

    /**
     * 429 + Retry-After，不說明原因。verify 的回應多帶 valid=false，維持同一種 shape。
     */
    @ExceptionHandler(RateLimitedException.class)
    public ResponseEntity<?> handleRateLimited(RateLimitedException e, HttpServletRequest req) {
        String rid = RequestIdFilter.getOrCreate(req);
        log.info("[PASSWORD_RESET] rate limited. op={} retryAfter={}s", e.operation(), e.retryAfterSec());

        ResetState s = ResetState.RATE_LIMITED;
        Object body = (e.operation() == ResetOperation.VERIFY)
                ? new VerifyTokenResponse(false, s.publicCode(), s.message(), rid, null)
                : ResetPasswordResponse.failure(s.publicCode(), s.message(), rid);

        return ResponseEntity.status(HttpStatus.TOO_MANY_REQUESTS)
                .header(HttpHeaders.RETRY_AFTER, String.valueOf(Math.max(0, e.retryAfterSec())))
                .body(body);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ResetPasswordResponse> handleUnreadable(HttpMessageNotReadableException e, HttpServletRequest req) {
        ResetState s = ResetState.MISSING_FIELDS;
        return ResponseEntity.status(s.httpStatus())
                .body(ResetPasswordResponse.failure(s.publicCode(), s.message(), RequestIdFilter.getOrCreate(req)));
    }

    /**
     * 只有 fail-on-mismatch=true（非 prod）才會走到這裡：大聲失敗
     */
    @ExceptionHandler(DiagnosticsMismatchException.class)
    public ResponseEntity<ResetPasswordResponse> handleMismatch(DiagnosticsMismatchException e, HttpServletRequest req) {
        String rid = RequestIdFilter.getOrCreate(req);
        log.error("[PASSWORD_RESET] {}", e.getMessage(), e);
        ResetState s = ResetState.INTERNAL_ERROR;
        return ResponseEntity.status(s.httpStatus())
                .body(ResetPasswordResponse.failure(s.publicCode(), s.message(), rid));
    }
}
