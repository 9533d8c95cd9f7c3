package com.calai.credreset.passwordreset.retention;

import com.calai.credreset.passwordreset.config.PasswordResetProperties;
import com.calai.credreset.passwordreset.store.ResetTokenStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;

/**
 * 過期超過 retention 的 token 列直接刪掉。正確性不依賴它，只是控制表大小。
 */
@Slf4j
@RequiredArgsConstructor
@Component
@ConditionalOnProperty(prefix = "app.password-reset.retention-worker", name = "enabled", havingValue = "true", matchIfMissing = true)
public class ResetTokenRetentionWorker {

    private final PasswordResetProperties props;
    private final ResetTokenStore store;
    private final Clock clock;

    // 每小時第 15 分跑
    @Scheduled(cron = "${app.password-reset.retention-worker.cron:0 15 * * * *}")
    public int runOnce() {
        Instant cutoff = Instant.now(clock).minus(props.getRetention());
        try {
            int n = store.purgeExpiredBefore(cutoff);
            if (n > 0) {
                log.info("[PASSWORD_RESET] retention purged {} token rows. cutoff={}", n, cutoff);
            }
            return n;
        } catch (RuntimeException e) {
            log.warn("[PASSWORD_RESET] retention purge failed. cutoff={}", cutoff, e);
            return 0;
        }
    }
}
