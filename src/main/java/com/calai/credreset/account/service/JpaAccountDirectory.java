package com.calai.credreset.account.service;

import com.calai.credreset.account.repo.UserRepo;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;

@Service
@RequiredArgsConstructor
public class JpaAccountDirectory implements AccountDirectory {

    private final UserRepo users;
    private final Clock clock;

    @Override
    @Transactional(readOnly = true)
    public Optional<AccountRef> findByEmail(String normalizedEmail) {
        return users.findByEmailIgnoreCase(normalizedEmail)
                .filter(u -> "ACTIVE".equalsIgnoreCase(u.getStatus()))
                .map(u -> new AccountRef(u.getId(), u.getEmail(), u.getDisplayName()));
    }

    @Override
    @Transactional
    public boolean updatePasswordHash(Long accountId, String passwordHash) {
        return users.updatePasswordHash(accountId, passwordHash, Instant.now(clock)) == 1;
    }
}
