package com.calai.credreset.passwordreset.model;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * 非敏感的判定資訊：給 log 關聯與非 prod 回應用。
 * 絕不放 raw token 或完整 hash（hashFragment 只有最後 8 碼）。
 *
 * @param presentedLength 呼叫端送來的原始字串長度（可能是整段 deep link）
 * @param tokenLength     normalize 之後實際拿去檢查的長度
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ResetDiagnostics(
        ResetState state,
        String reason,
        int presentedLength,
        int tokenLength,
        String hashFragment,
        boolean rowFound,
        boolean expired,
        boolean used
) {

    public static ResetDiagnostics of(ResetState state, int presentedLength, int tokenLength, String hashFragment,
                                      boolean rowFound, boolean expired, boolean used) {
        return new ResetDiagnostics(state, state.reason(), presentedLength, tokenLength, hashFragment,
                rowFound, expired, used);
    }

    /** 送來的就是裸 token 時兩個長度相同 */
    public static ResetDiagnostics of(ResetState state, int tokenLength, String hashFragment,
                                      boolean rowFound, boolean expired, boolean used) {
        return of(state, tokenLength, tokenLength, hashFragment, rowFound, expired, used);
    }

    /** token 判定之後的步驟（policy / consume / update）改寫最終狀態，其餘欄位沿用 */
    public ResetDiagnostics withState(ResetState next, String nextReason) {
        return new ResetDiagnostics(next, nextReason == null ? next.reason() : nextReason,
                presentedLength, tokenLength, hashFragment, rowFound, expired, used);
    }

    public ResetDiagnostics markUsed() {
        return new ResetDiagnostics(ResetState.USED, ResetState.USED.reason(),
                presentedLength, tokenLength, hashFragment, rowFound, expired, true);
    }
}
