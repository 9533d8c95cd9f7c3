package com.calai.credreset.passwordreset.service;

import com.calai.credreset.account.service.AccountDirectory;
import com.calai.credreset.account.service.AccountDirectory.AccountRef;
import com.calai.credreset.passwordreset.config.PasswordResetProperties;
import com.calai.credreset.passwordreset.entity.PasswordResetToken;
import com.calai.credreset.passwordreset.mail.ResetMailer;
import com.calai.credreset.passwordreset.model.ResetDiagnostics;
import com.calai.credreset.passwordreset.model.ResetOutcome;
import com.calai.credreset.passwordreset.model.ResetState;
import com.calai.credreset.passwordreset.model.TokenCheck;
import com.calai.credreset.passwordreset.store.ResetTokenStore;
import com.calai.credreset.passwordreset.token.ResetTokenCodec;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Locale;
import java.util.Optional;

/**
 * issue / verify / reset 三個操作。
 * <p>
 * reset 刻意不包一個大 transaction：consume 先 commit，之後改密碼失敗 token 也不會復活（fail-closed）。
 * log 只印 state、token 長度、hash 尾碼，不印 raw token 與密碼。
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class PasswordResetService {

    private final ResetTokenCodec codec;
    private final ResetTokenStore store;
    private final TokenVerifier verifier;
    private final AccountDirectory accounts;
    private final PasswordPolicy policy;
    private final PasswordEncoder passwordEncoder;
    private final ResetMailer mailer;
    private final PasswordResetProperties props;
    private final Clock clock;

    /**
     * 不論帳號存不存在、不論中途有沒有失敗，呼叫端看到的都一樣，所以這裡沒有回傳值。
     */
    public void issue(String email, String requestIp) {
        final String normalizedEmail = normalizeEmail(email);
        if (normalizedEmail.isEmpty()) return;

        try {
            Optional<AccountRef> account = accounts.findByEmail(normalizedEmail);
            if (account.isEmpty()) {
                log.info("[PASSWORD_RESET] issue: no account, nothing sent");
                return;
            }
            AccountRef acct = account.get();

            final Instant now = Instant.now(clock);
            final String rawToken = codec.generate();
            final String hash = codec.hash(rawToken);

            var row = new PasswordResetToken();
            row.setTokenHash(hash);
            row.setUserId(acct.id());
            row.setEmail(acct.email());
            row.setIssuedAt(now);
            row.setExpiresAt(now.plus(props.getTokenTtl()));
            row.setRequestIp(requestIp);

            // 同帳號舊 token 全部邏輯過期 + 寫入新的一筆
            store.replaceActive(row, now);

            log.info("[PASSWORD_RESET] issue: token stored. userId={} hash=..{} expiresAt={}",
                    acct.id(), ResetTokenCodec.fragment(hash), row.getExpiresAt());

            mailer.sendResetLink(acct.email(), acct.displayName(), rawToken);
        } catch (RuntimeException e) {
            // 吞掉：回應不能透露帳號是否存在，也不能因為 store / mail 掛了而不同
            log.error("[PASSWORD_RESET] issue failed, generic response still returned", e);
        }
    }

    /** 不會改任何狀態，可重複呼叫 */
    public ResetOutcome verify(String rawToken) {
        TokenCheck check = verifier.check(rawToken, Instant.now(clock));
        logCheck("verify", check.diagnostics());
        return ResetOutcome.of(check.diagnostics());
    }

    public ResetOutcome reset(String rawToken, String newPassword) {
        final Instant now = Instant.now(clock);

        // 1) token 判定（與 verify 同一份）
        TokenCheck check = (newPassword == null || newPassword.isEmpty())
                ? verifier.missingFields()
                : verifier.check(rawToken, now);
        if (!check.isOk()) {
            logCheck("reset", check.diagnostics());
            return ResetOutcome.of(check.diagnostics());
        }

        // 2) 密碼規則：不合格就不消耗 token
        Optional<String> weak = policy.violation(newPassword);
        if (weak.isPresent()) {
            ResetDiagnostics d = check.diagnostics().withState(ResetState.WEAK_PASSWORD, null);
            logCheck("reset", d);
            return ResetOutcome.derived(check.diagnostics(), d, weak.get());
        }

        // 3) CAS consume：輸給並發的另一個 reset 就是 USED
        if (!store.markConsumed(check.tokenHash(), now)) {
            ResetDiagnostics d = check.diagnostics().markUsed();
            log.info("[PASSWORD_RESET] reset: lost consume race. hash=..{}", d.hashFragment());
            return ResetOutcome.derived(check.diagnostics(), d);
        }

        // 4) 改密碼；失敗時 token 維持 consumed
        Long userId = check.record().getUserId();
        boolean updated;
        try {
            updated = accounts.updatePasswordHash(userId, passwordEncoder.encode(newPassword));
        } catch (RuntimeException e) {
            log.error("[PASSWORD_RESET] reset: password update threw. userId={} hash=..{}",
                    userId, check.diagnostics().hashFragment(), e);
            updated = false;
        }
        if (!updated) {
            ResetDiagnostics d = check.diagnostics().withState(ResetState.UPDATE_FAILED, null);
            log.error("[PASSWORD_RESET] reset: UPDATE_FAILED, token stays consumed. userId={} hash=..{}",
                    userId, d.hashFragment());
            return ResetOutcome.derived(check.diagnostics(), d);
        }

        log.info("[PASSWORD_RESET] reset: success. userId={} hash=..{}", userId, check.diagnostics().hashFragment());
        return ResetOutcome.of(check.diagnostics());
    }

    public static String normalizeEmail(String email) {
        return email == null ? "" : email.trim().toLowerCase(Locale.ROOT);
    }

    private static void logCheck(String op, ResetDiagnostics d) {
        log.info("[PASSWORD_RESET] {}: state={} presented={} len={} hash=..{} found={} expired={} used={}",
                op, d.state(), d.presentedLength(), d.tokenLength(), d.hashFragment(), d.rowFound(), d.expired(), d.used());
    }
}
