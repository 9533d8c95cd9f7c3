package com.calai.credreset.account.service;

import java.util.Optional;

/**
 * 帳號儲存的最小介面：reset 流程只需要「用 email 找人」與「換密碼雜湊」。
 */
public interface AccountDirectory {

    /** @param normalizedEmail 已 trim + lower-case */
    Optional<AccountRef> findByEmail(String normalizedEmail);

    /** @return true 表示有一筆帳號被更新 */
    boolean updatePasswordHash(Long accountId, String passwordHash);

    record AccountRef(Long id, String email, String displayName) {}
}
