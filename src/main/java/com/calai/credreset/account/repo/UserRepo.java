package com.calai.credreset.account.repo;

import com.calai.credreset.account.entity.User;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;

import java.time.Instant;
import java.util.Optional;

public interface UserRepo extends JpaRepository<User, Long> {

    // User#setEmail 已經 lower-case，IgnoreCase 兩邊保險
    Optional<User> findByEmailIgnoreCase(String email);

    /**
     * 只更新密碼雜湊；回傳受影響筆數（0 = 帳號不存在或已停用）
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
           update User u
              set u.passwordHash = :hash,
                  u.passwordChangedAt = :now,
                  u.updatedAt = :now
            where u.id = :id
              and u.status = 'ACTIVE'
           """)
    int updatePasswordHash(@Param("id") Long id,
                           @Param("hash") String hash,
                           @Param("now") Instant now);
}
