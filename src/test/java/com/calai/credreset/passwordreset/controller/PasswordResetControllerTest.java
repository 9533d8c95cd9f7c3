package com.calai.credreset.passwordreset.controller;

import com.calai.credreset.common.web.ApiExceptionHandler;
import com.calai.credreset.common.web.RequestIdFilter;
import com.calai.credreset.passwordreset.config.PasswordResetConfig;
import com.calai.credreset.passwordreset.guard.DiagnosticsConsistencyGuard;
import com.calai.credreset.passwordreset.guard.RateLimitedException;
import com.calai.credreset.passwordreset.guard.ResetOperation;
import com.calai.credreset.passwordreset.guard.ResetRateLimiter;
import com.calai.credreset.passwordreset.model.ResetDiagnostics;
import com.calai.credreset.passwordreset.model.ResetOutcome;
import com.calai.credreset.passwordreset.model.ResetState;
import com.calai.credreset.passwordreset.service.PasswordResetService;
import com.calai.credreset.passwordreset.web.PasswordResetExceptionAdvice;
import com.calai.credreset.passwordreset.web.ResetResponses;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.autoconfigure.security.servlet.SecurityAutoConfiguration;
import org.springframework.boot.autoconfigure.security.servlet.SecurityFilterAutoConfiguration;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.not;
import static org.mockito.ArgumentMatchers.*;
import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@ActiveProfiles("test")
@WebMvcTest(
        controllers = PasswordResetController.class,
        excludeAutoConfiguration = {
                SecurityAutoConfiguration.class,
                SecurityFilterAutoConfiguration.class
        }
)
@Import({
        PasswordResetConfig.class,
        ResetResponses.class,
        DiagnosticsConsistencyGuard.class,
        PasswordResetExceptionAdvice.class,
        ApiExceptionHandler.class,
        RequestIdFilter.class
})
// prod 的預設：diagnostics 只給帶 operator key 的請求
@TestPropertySource(properties = "app.password-reset.diagnostics.expose=false")
class PasswordResetControllerTest {

    private static final String TOKEN = "0f".repeat(32);

    @Autowired MockMvc mvc;

    @MockitoBean PasswordResetService service;
    @MockitoBean ResetRateLimiter limiter;

    private static ResetOutcome outcome(ResetState state) {
        return ResetOutcome.of(ResetDiagnostics.of(state, 64, "9a8b7c6d",
                state != ResetState.NOT_FOUND, state == ResetState.EXPIRED, state == ResetState.USED));
    }

    @Test
    void issue_returns_the_same_body_whatever_the_email() throws Exception {
        for (String email : new String[]{"known@example.com", "unknown@example.com"}) {
            mvc.perform(post("/api/auth/forgot-password")
                            .contentType(MediaType.APPLICATION_JSON)
                            .content("{\"email\":\"" + email + "\"}")
                            .header("X-Request-Id", "RID-ISSUE")
                            .header("X-Forwarded-For", "198.51.100.99")
                            .with(r -> {
                                r.setRemoteAddr("203.0.113.5");
                                return r;
                            }))
                    .andExpect(status().isOk())
                    .andExpect(header().string("X-Request-Id", "RID-ISSUE"))
                    .andExpect(jsonPath("$.message").value(PasswordResetController.ISSUE_MESSAGE))
                    .andExpect(jsonPath("$.requestId").value("RID-ISSUE"))
                    .andExpect(jsonPath("$.code").doesNotExist());

            verify(service).issue(email, "203.0.113.5");
            verify(limiter).checkOrThrow(eq(ResetOperation.ISSUE), eq("203.0.113.5"), any());
            verify(limiter).checkOrThrow(eq(ResetOperation.ISSUE), eq("email:" + email), any());
        }
    }

    @Test
    void issue_without_email_is_400_MISSING_FIELDS() throws Exception {
        mvc.perform(post("/api/auth/forgot-password")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"email\":\"  \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("MISSING_FIELDS"))
                .andExpect(jsonPath("$.requestId").isNotEmpty());

        verifyNoInteractions(service);
    }

    @Test
    void issue_ignores_forwarded_for_from_the_client() throws Exception {
        mvc.perform(post("/api/auth/forgot-password")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"email\":\" Mixed.Case@Example.com \"}")
                        .header("X-Forwarded-For", "10.9.8.7")
                        .with(r -> {
                            r.setRemoteAddr("203.0.113.8");
                            return r;
                        }))
                .andExpect(status().isOk());

        verify(limiter).checkOrThrow(eq(ResetOperation.ISSUE), eq("203.0.113.8"), any());
        verify(limiter).checkOrThrow(eq(ResetOperation.ISSUE), eq("email:mixed.case@example.com"), any());
        verify(limiter, never()).checkOrThrow(any(), eq("10.9.8.7"), any());
    }

    @Test
    void verify_ok_hides_diagnostics_by_default() throws Exception {
        when(service.verify(TOKEN)).thenReturn(outcome(ResetState.OK));

        mvc.perform(get("/api/auth/reset-password/verify").param("token", TOKEN)
                        .header("X-Request-Id", "RID-1"))
                .andExpect(status().isOk())
                .andExpect(header().string("X-Request-Id", "RID-1"))
                .andExpect(jsonPath("$.valid").value(true))
                .andExpect(jsonPath("$.requestId").value("RID-1"))
                .andExpect(jsonPath("$.code").doesNotExist())
                .andExpect(jsonPath("$.diagnostics").doesNotExist());
    }

    @Test
    void operator_key_header_exposes_diagnostics() throws Exception {
        when(service.verify(TOKEN)).thenReturn(outcome(ResetState.EXPIRED));

        mvc.perform(get("/api/auth/reset-password/verify/{token}", TOKEN)
                        .header(ResetResponses.DIAGNOSTICS_HEADER, "test-operator-key"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.valid").value(false))
                .andExpect(jsonPath("$.code").value("TOKEN_INVALID_OR_EXPIRED"))
                .andExpect(jsonPath("$.diagnostics.state").value("EXPIRED"))
                .andExpect(jsonPath("$.diagnostics.expired").value(true))
                .andExpect(jsonPath("$.diagnostics.hashFragment").value("9a8b7c6d"));
    }

    @Test
    void wrong_operator_key_does_not_expose_diagnostics() throws Exception {
        when(service.verify(TOKEN)).thenReturn(outcome(ResetState.USED));

        mvc.perform(get("/api/auth/reset-password/verify/{token}", TOKEN)
                        .header(ResetResponses.DIAGNOSTICS_HEADER, "guess"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("TOKEN_USED"))
                .andExpect(jsonPath("$.diagnostics").doesNotExist());
    }

    @Test
    void verify_without_token_is_MISSING_FIELDS() throws Exception {
        when(service.verify(isNull())).thenReturn(outcome(ResetState.MISSING_FIELDS));

        mvc.perform(get("/api/auth/reset-password/verify"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.valid").value(false))
                .andExpect(jsonPath("$.code").value("MISSING_FIELDS"));
    }

    @Test
    void reset_success_returns_message() throws Exception {
        when(service.reset(TOKEN, "N3w-Passw0rd!!")).thenReturn(outcome(ResetState.OK));

        mvc.perform(post("/api/auth/reset-password")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"token\":\"" + TOKEN + "\",\"newPassword\":\"N3w-Passw0rd!!\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value(ResetResponses.RESET_SUCCESS_MESSAGE))
                .andExpect(jsonPath("$.code").doesNotExist())
                .andExpect(jsonPath("$.requestId").isNotEmpty());
    }

    @Test
    void reset_used_token_is_400_TOKEN_USED() throws Exception {
        when(service.reset(anyString(), anyString())).thenReturn(outcome(ResetState.USED));

        mvc.perform(post("/api/auth/reset-password")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"token\":\"" + TOKEN + "\",\"newPassword\":\"N3w-Passw0rd!!\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("TOKEN_USED"))
                .andExpect(jsonPath("$.error").value(ResetState.USED.message()))
                .andExpect(jsonPath("$.message").doesNotExist());
    }

    @Test
    void reset_update_failure_is_500_INTERNAL_ERROR() throws Exception {
        when(service.reset(anyString(), anyString())).thenReturn(outcome(ResetState.UPDATE_FAILED));

        mvc.perform(post("/api/auth/reset-password")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"token\":\"" + TOKEN + "\",\"newPassword\":\"N3w-Passw0rd!!\"}"))
                .andExpect(status().isInternalServerError())
                .andExpect(jsonPath("$.code").value("INTERNAL_ERROR"));
    }

    @Test
    void malformed_reset_body_is_400_MISSING_FIELDS() throws Exception {
        mvc.perform(post("/api/auth/reset-password")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{not json"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("MISSING_FIELDS"));

        verifyNoInteractions(service);
    }

    @Test
    void rate_limited_issue_is_429_with_retry_after() throws Exception {
        doThrow(new RateLimitedException(ResetOperation.ISSUE, 120))
                .when(limiter).checkOrThrow(eq(ResetOperation.ISSUE), anyString(), any());

        mvc.perform(post("/api/auth/forgot-password")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"email\":\"a@example.com\"}")
                        .header("X-Request-Id", "RID-429"))
                .andExpect(status().isTooManyRequests())
                .andExpect(header().string("Retry-After", "120"))
                .andExpect(jsonPath("$.code").value("RATE_LIMITED"))
                .andExpect(jsonPath("$.requestId").value("RID-429"));

        verifyNoInteractions(service);
    }

    @Test
    void rate_limited_verify_keeps_the_verify_shape() throws Exception {
        doThrow(new RateLimitedException(ResetOperation.VERIFY, 30))
                .when(limiter).checkOrThrow(eq(ResetOperation.VERIFY), anyString(), any());

        mvc.perform(get("/api/auth/reset-password/verify").param("token", TOKEN))
                .andExpect(status().isTooManyRequests())
                .andExpect(header().string("Retry-After", "30"))
                .andExpect(jsonPath("$.valid").value(false))
                .andExpect(jsonPath("$.code").value("RATE_LIMITED"));
    }

    @Test
    void unsafe_request_id_is_replaced() throws Exception {
        when(service.verify(TOKEN)).thenReturn(outcome(ResetState.OK));

        mvc.perform(get("/api/auth/reset-password/verify").param("token", TOKEN)
                        .header("X-Request-Id", "bad id\r\ninjected"))
                .andExpect(status().isOk())
                .andExpect(header().string("X-Request-Id", not("bad id\r\ninjected")))
                .andExpect(jsonPath("$.requestId").isNotEmpty());
    }
}
