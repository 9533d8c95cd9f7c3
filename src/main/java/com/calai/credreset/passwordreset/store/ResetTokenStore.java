package com.calai.credreset.passwordreset.store;

import com.calai.credreset.passwordreset.entity.PasswordResetToken;

import java.time.Instant;
import java.util.Optional;

/**
 * Hashed token store. Rows are keyed by the peppered token hash only; nothing
 * here ever sees a raw token.
 */
public interface ResetTokenStore {

    void insert(PasswordResetToken record);

    Optional<PasswordResetToken> findByHash(String tokenHash);

    /** Logically expires every unconsumed, unexpired token of the account. */
    int invalidateAllForAccount(Long accountId, Instant now);

    /**
     * Atomic "set consumedAt where consumedAt is null".
     *
     * @return false if another consumer got there first
     */
    boolean markConsumed(String tokenHash, Instant now);

    /** Deletes rows whose expiry is before the cutoff. */
    int purgeExpiredBefore(Instant cutoff);

    /**
     * Invalidate-then-insert as one unit. Implementations backed by a database
     * should run both steps in a single transaction.
     */
    default void replaceActive(PasswordResetToken record, Instant now) {
        invalidateAllForAccount(record.getUserId(), now);
        insert(record);
    }
}
