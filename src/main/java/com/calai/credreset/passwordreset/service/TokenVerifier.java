package com.calai.credreset.passwordreset.service;

import com.calai.credreset.passwordreset.entity.PasswordResetToken;
import com.calai.credreset.passwordreset.model.ResetDiagnostics;
import com.calai.credreset.passwordreset.model.ResetState;
import com.calai.credreset.passwordreset.model.TokenCheck;
import com.calai.credreset.passwordreset.store.ResetTokenStore;
import com.calai.credreset.passwordreset.token.ResetTokenCodec;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Optional;

/**
 * 唯一的 token 判定流程，verify 與 reset 都呼叫這裡，不可以各自重寫。
 * <pre>
 * MISSING_FIELDS  空字串 / null
 * INVALID_FORMAT  normalize 後不是 64 碼 hex（不查 store）
 * NOT_FOUND       hash 查不到
 * USED            consumedAt 有值
 * EXPIRED         expiresAt <= now
 * OK
 * </pre>
 * 由上往下，第一個符合的就是結果。
 */
@Component
@RequiredArgsConstructor
public class TokenVerifier {

    private final ResetTokenCodec codec;
    private final ResetTokenStore store;

    public TokenCheck check(String rawToken, Instant now) {
        if (rawToken == null) {
            return missingFields();
        }
        int presented = rawToken.length();

        String token = ResetTokenCodec.normalize(rawToken);
        if (token.isEmpty()) {
            return missing(presented);
        }
        if (!ResetTokenCodec.validateFormat(token)) {
            return new TokenCheck(ResetState.INVALID_FORMAT,
                    ResetDiagnostics.of(ResetState.INVALID_FORMAT, presented, token.length(), null, false, false, false),
                    null, null);
        }

        String hash = codec.hash(token);
        String fragment = ResetTokenCodec.fragment(hash);

        Optional<PasswordResetToken> found = store.findByHash(hash);
        if (found.isEmpty()) {
            return new TokenCheck(ResetState.NOT_FOUND,
                    ResetDiagnostics.of(ResetState.NOT_FOUND, presented, token.length(), fragment, false, false, false),
                    null, hash);
        }

        PasswordResetToken row = found.get();
        boolean used = row.isConsumed();
        boolean expired = row.isExpiredAt(now);

        ResetState state;
        if (used) state = ResetState.USED;
        else if (expired) state = ResetState.EXPIRED;
        else state = ResetState.OK;

        return new TokenCheck(state,
                ResetDiagnostics.of(state, presented, token.length(), fragment, true, expired, used),
                row, hash);
    }

    public TokenCheck missingFields() {
        return missing(0);
    }

    private static TokenCheck missing(int presented) {
        return new TokenCheck(ResetState.MISSING_FIELDS,
                ResetDiagnostics.of(ResetState.MISSING_FIELDS, presented, 0, null, false, false, false),
                null, null);
    }
}
