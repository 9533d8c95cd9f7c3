package com.calai.credreset.passwordreset.guard;

import com.calai.credreset.passwordreset.config.PasswordResetProperties;
import com.calai.credreset.passwordreset.model.ResetDiagnostics;
import com.calai.credreset.passwordreset.model.ResetOutcome;
import com.calai.credreset.passwordreset.model.ResetState;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class DiagnosticsConsistencyGuardTest {

    private static final ResetDiagnostics EXPIRED =
            ResetDiagnostics.of(ResetState.EXPIRED, 64, "a1b2c3d4", true, true, false);

    private static DiagnosticsConsistencyGuard guard(boolean failOnMismatch) {
        PasswordResetProperties props = new PasswordResetProperties();
        props.getDiagnostics().setFailOnMismatch(failOnMismatch);
        return new DiagnosticsConsistencyGuard(props);
    }

    @Test
    void consistent_payload_passes() {
        ResetOutcome computed = ResetOutcome.of(EXPIRED);

        assertThat(guard(true).check(computed, "TOKEN_INVALID_OR_EXPIRED", EXPIRED, "rid-1")).isEmpty();
        assertThat(guard(true).check(computed, "TOKEN_INVALID_OR_EXPIRED", null, "rid-1")).isEmpty();
    }

    @Test
    void mismatched_payload_is_fatal_in_non_production() {
        ResetOutcome computed = ResetOutcome.of(EXPIRED);
        // 回應寫成 USED，但判定時其實是 EXPIRED
        ResetDiagnostics returned = ResetDiagnostics.of(ResetState.USED, 64, "a1b2c3d4", true, false, true);

        DiagnosticsMismatchException ex = catchThrowableOfType(
                () -> guard(true).check(computed, "TOKEN_USED", returned, "rid-2"),
                DiagnosticsMismatchException.class);

        assertThat(ex).isNotNull();
        assertThat(ex.fields()).containsExactly("code", "state", "reason", "expired", "used");
        assertThat(ex.getMessage()).contains("rid-2");
    }

    @Test
    void mismatched_payload_is_only_reported_in_production() {
        ResetOutcome computed = ResetOutcome.of(EXPIRED);
        ResetDiagnostics returned = ResetDiagnostics.of(ResetState.EXPIRED, 64, 63, "a1b2c3d4", true, true, false);

        List<String> bad = guard(false).check(computed, "TOKEN_INVALID_OR_EXPIRED", returned, "rid-3");

        assertThat(bad).containsExactly("tokenLength");
    }

    @Test
    void code_alone_is_compared_when_diagnostics_are_hidden() {
        ResetOutcome ok = ResetOutcome.of(ResetDiagnostics.of(ResetState.OK, 64, "a1b2c3d4", true, false, false));

        assertThatThrownBy(() -> guard(true).check(ok, "TOKEN_USED", null, "rid-4"))
                .isInstanceOf(DiagnosticsMismatchException.class);
    }

    @Test
    void later_steps_are_compared_against_the_token_verdict() {
        ResetDiagnostics verdict = ResetDiagnostics.of(ResetState.OK, 64, "a1b2c3d4", true, false, false);
        ResetOutcome weak = ResetOutcome.derived(verdict, verdict.withState(ResetState.WEAK_PASSWORD, null));

        assertThat(guard(true).check(weak, weak.state().publicCode(), weak.diagnostics(), "rid-5")).isEmpty();

        // policy 步驟不該改動 token 的判定事實
        ResetOutcome drifted = ResetOutcome.derived(verdict,
                ResetDiagnostics.of(ResetState.WEAK_PASSWORD, 64, "ffffffff", true, false, false));
        List<String> bad = guard(false).check(drifted, drifted.state().publicCode(), drifted.diagnostics(), "rid-6");

        assertThat(bad).containsExactly("hashFragment");
    }
}
