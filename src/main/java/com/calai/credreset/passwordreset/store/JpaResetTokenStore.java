package com.calai.credreset.passwordreset.store;

import com.calai.credreset.passwordreset.entity.PasswordResetToken;
import com.calai.credreset.passwordreset.repo.PasswordResetTokenRepository;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Optional;

@Component
@RequiredArgsConstructor
public class JpaResetTokenStore implements ResetTokenStore {

    private final PasswordResetTokenRepository repo;

    @Override
    @Transactional
    public void insert(PasswordResetToken record) {
        repo.save(record);
    }

    @Override
    @Transactional(readOnly = true)
    public Optional<PasswordResetToken> findByHash(String tokenHash) {
        return repo.findByTokenHash(tokenHash);
    }

    @Override
    @Transactional
    public int invalidateAllForAccount(Long accountId, Instant now) {
        return repo.expireAllActive(accountId, now);
    }

    // 自己一個 transaction：之後改密碼失敗也不會把 consumedAt rollback 掉
    @Override
    @Transactional
    public boolean markConsumed(String tokenHash, Instant now) {
        return repo.markConsumed(tokenHash, now) == 1;
    }

    @Override
    @Transactional
    public int purgeExpiredBefore(Instant cutoff) {
        return repo.deleteExpiredBefore(cutoff);
    }

    @Override
    @Transactional
    public void replaceActive(PasswordResetToken record, Instant now) {
        repo.expireAllActive(record.getUserId(), now);
        repo.save(record);
    }
}
