package com.calai.credreset.passwordreset.guard;

import com.calai.credreset.passwordreset.config.PasswordResetProperties;
import com.calai.credreset.passwordreset.model.ResetDiagnostics;
import com.calai.credreset.passwordreset.model.ResetOutcome;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * 回應送出前，逐欄比對「要回給 client 的」與「判定當下算出來的」。
 * - dev/test（fail-on-mismatch=true）：直接丟 DiagnosticsMismatchException
 * - prod：記一行 ERROR（RESET_DIAGNOSTICS_MISMATCH，可掛告警），回應照送
 */
@Slf4j
@Component
public class DiagnosticsConsistencyGuard {

    public static final String ALERT_MARKER = "RESET_DIAGNOSTICS_MISMATCH";

    private final boolean failOnMismatch;

    public DiagnosticsConsistencyGuard(PasswordResetProperties props) {
        this.failOnMismatch = props.getDiagnostics().isFailOnMismatch();
    }

    /**
     * @param returnedCode        the {@code code} field of the outgoing body (null on success)
     * @param returnedDiagnostics the {@code diagnostics} object of the outgoing body, or null
     *                            when diagnostics are not exposed
     * @return the names of mismatching fields (empty when consistent)
     */
    public List<String> check(ResetOutcome computed, String returnedCode,
                              ResetDiagnostics returnedDiagnostics, String requestId) {
        List<String> bad = diff(computed, returnedCode, returnedDiagnostics);
        if (bad.isEmpty()) return bad;

        if (failOnMismatch) {
            throw new DiagnosticsMismatchException(requestId, bad);
        }
        log.error("{} rid={} state={} fields={}", ALERT_MARKER, requestId, computed.state(), bad);
        return bad;
    }

    /**
     * state / reason / used 對最終結果比；token 本身的事實（長度、hash 尾碼、有沒有列、過期）
     * 對狀態機當下的判定比，後面的步驟不可以改到它們。
     */
    static List<String> diff(ResetOutcome computed, String returnedCode, ResetDiagnostics r) {
        List<String> bad = new ArrayList<>();
        if (!Objects.equals(computed.state().publicCode(), returnedCode)) bad.add("code");
        if (r == null) return bad;

        ResetDiagnostics c = computed.diagnostics();
        ResetDiagnostics v = computed.verdict() == null ? c : computed.verdict();
        if (c.state() != r.state()) bad.add("state");
        if (!Objects.equals(c.reason(), r.reason())) bad.add("reason");
        if (v.presentedLength() != r.presentedLength()) bad.add("presentedLength");
        if (v.tokenLength() != r.tokenLength()) bad.add("tokenLength");
        if (!Objects.equals(v.hashFragment(), r.hashFragment())) bad.add("hashFragment");
        if (v.rowFound() != r.rowFound()) bad.add("rowFound");
        if (v.expired() != r.expired()) bad.add("expired");
        if (c.used() != r.used()) bad.add("used");
        return bad;
    }
}
