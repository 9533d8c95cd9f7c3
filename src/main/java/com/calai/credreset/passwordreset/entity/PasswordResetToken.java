package com.calai.credreset.passwordreset.entity;

import jakarta.persistence.*;
import lombok.Data;

import java.time.Instant;

/**
 * 一次 issue 一筆。只存 token 的 HMAC，不存 raw token。
 * consumedAt 一旦有值就是終態，任何流程都不能清回 null。
 */
@Data
@Entity
@Table(
        name = "password_reset_tokens",
        uniqueConstraints = {
                @UniqueConstraint(name = "ux_prt_token_hash", columnNames = {"token_hash"})
        },
        indexes = {
                @Index(name = "ix_prt_user_id", columnList = "user_id"),
                @Index(name = "ix_prt_expires_at", columnList = "expires_at")
        }
)
public class PasswordResetToken {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "token_hash", length = 64, nullable = false)
    private String tokenHash;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    // 只給 log / 稽核看，授權判斷一律用 userId
    @Column(name = "email", length = 320, nullable = false)
    private String email;

    @Column(name = "issued_at", nullable = false)
    private Instant issuedAt;

    @Column(name = "expires_at", nullable = false)
    private Instant expiresAt;

    @Column(name = "consumed_at")
    private Instant consumedAt;

    @Column(name = "request_ip", length = 64)
    private String requestIp;

    public boolean isConsumed() {
        return consumedAt != null;
    }

    /** expiresAt <= now 就算過期；reissue 會把舊 token 的 expiresAt 設成 now */
    public boolean isExpiredAt(Instant now) {
        return !expiresAt.isAfter(now);
    }
}
