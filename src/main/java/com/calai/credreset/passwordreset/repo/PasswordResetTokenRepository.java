package com.calai.credreset.passwordreset.repo;

import com.calai.credreset.passwordreset.entity.PasswordResetToken;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Optional;

public interface PasswordResetTokenRepository extends JpaRepository<PasswordResetToken, Long> {

    Optional<PasswordResetToken> findByTokenHash(String tokenHash);

    /**
     * 發新 token 前，把同帳號所有還有效的舊 token 邏輯過期（expiresAt = now），
     * 確保同一時間每個帳號最多一筆可用 token
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
           update PasswordResetToken t
              set t.expiresAt = :now
            where t.userId = :userId
              and t.consumedAt is null
              and t.expiresAt > :now
           """)
    int expireAllActive(@Param("userId") Long userId,
                        @Param("now") Instant now);

    /**
     * 條件式更新（compare-and-set）：只有 consumedAt 還是 null 才寫入。
     * 兩個並發 reset 只會有一個拿到 1，另一個拿到 0。
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
           update PasswordResetToken t
              set t.consumedAt = :now
            where t.tokenHash = :hash
              and t.consumedAt is null
           """)
    int markConsumed(@Param("hash") String tokenHash,
                     @Param("now") Instant now);

    @Modifying
    @Query("""
           delete from PasswordResetToken t
            where t.expiresAt < :cutoff
           """)
    int deleteExpiredBefore(@Param("cutoff") Instant cutoff);
}
