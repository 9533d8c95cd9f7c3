package com.calai.credreset.passwordreset.controller;

import com.calai.credreset.common.web.RequestIdFilter;
import com.calai.credreset.passwordreset.dto.ForgotPasswordRequest;
import com.calai.credreset.passwordreset.dto.MessageResponse;
import com.calai.credreset.passwordreset.dto.ResetPasswordRequest;
import com.calai.credreset.passwordreset.dto.ResetPasswordResponse;
import com.calai.credreset.passwordreset.dto.VerifyTokenResponse;
import com.calai.credreset.passwordreset.guard.ResetOperation;
import com.calai.credreset.passwordreset.guard.ResetRateLimiter;
import com.calai.credreset.passwordreset.model.ResetState;
import com.calai.credreset.passwordreset.service.PasswordResetService;
import com.calai.credreset.passwordreset.web.ResetResponses;
import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Clock;
import java.time.Instant;

@RestController
@RequestMapping("/api/auth")
@RequiredArgsConstructor
public class PasswordResetController {

    public static final String ISSUE_MESSAGE =
            "If an account with that email exists, a password reset link has been sent.";

    private final PasswordResetService service;
    private final ResetRateLimiter limiter;
    private final ResetResponses responses;
    private final Clock clock;

    @PostMapping("/forgot-password")
    public ResponseEntity<?> forgotPassword(@RequestBody(required = false) ForgotPasswordRequest req,
                                            HttpServletRequest http) {
        String rid = RequestIdFilter.getOrCreate(http);
        String ip = clientIp(http);
        Instant now = Instant.now(clock);
        limiter.checkOrThrow(ResetOperation.ISSUE, ip, now);

        if (req == null || req.email() == null || req.email().isBlank()) {
            ResetState s = ResetState.MISSING_FIELDS;
            return ResponseEntity.status(s.httpStatus())
                    .body(ResetPasswordResponse.failure(s.publicCode(), "Email is required.", rid));
        }
        // 同一個信箱不論從幾個 IP 打，也只能收到固定次數的信
        limiter.checkOrThrow(ResetOperation.ISSUE,
                "email:" + PasswordResetService.normalizeEmail(req.email()), now);

        // 有沒有這個帳號，回應都一樣
        service.issue(req.email(), ip);
        return ResponseEntity.ok(new MessageResponse(ISSUE_MESSAGE, rid));
    }

    @GetMapping("/reset-password/verify")
    public ResponseEntity<VerifyTokenResponse> verifyByQuery(@RequestParam(value = "token", required = false) String token,
                                                             HttpServletRequest http) {
        return verify(token, http);
    }

    @GetMapping("/reset-password/verify/{token}")
    public ResponseEntity<VerifyTokenResponse> verifyByPath(@PathVariable("token") String token,
                                                            HttpServletRequest http) {
        return verify(token, http);
    }

    @PostMapping("/reset-password")
    public ResponseEntity<ResetPasswordResponse> resetPassword(@RequestBody(required = false) ResetPasswordRequest req,
                                                               HttpServletRequest http) {
        String rid = RequestIdFilter.getOrCreate(http);
        limiter.checkOrThrow(ResetOperation.RESET, clientIp(http), Instant.now(clock));

        String token = (req == null) ? null : req.token();
        String newPassword = (req == null) ? null : req.newPassword();
        return responses.reset(service.reset(token, newPassword), rid, responses.exposeDiagnostics(http));
    }

    private ResponseEntity<VerifyTokenResponse> verify(String token, HttpServletRequest http) {
        String rid = RequestIdFilter.getOrCreate(http);
        limiter.checkOrThrow(ResetOperation.VERIFY, clientIp(http), Instant.now(clock));
        return responses.verify(service.verify(token), rid, responses.exposeDiagnostics(http));
    }

    /**
     * 只認連線的對端位址。X-Forwarded-For 由 server.forward-headers-strategy=native
     * （Tomcat RemoteIpValve，只信任內網 proxy）在進來之前就換成 remoteAddr，這裡不自己解析。
     */
    private static String clientIp(HttpServletRequest request) {
        return request.getRemoteAddr();
    }
}
