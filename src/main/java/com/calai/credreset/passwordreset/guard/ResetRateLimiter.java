package com.calai.credreset.passwordreset.guard;

import com.calai.credreset.passwordreset.config.PasswordResetProperties;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * 固定視窗速率限制（預設 15 分鐘）
 * - key = operation + caller（IP，issue 另外再以 email 計一次）
 * - issue 3 次、verify 10 次、reset 5 次
 * 超過就丟 RateLimitedException，不做任何其他事。
 * 計數放在有上限的 Caffeine cache：閒置超過一個視窗就過期，key 數量超過上限就淘汰。
 * 多機要全域：把這個換成 Redis 計數即可（介面不變）。
 */
@Service
public class ResetRateLimiter {

    static final long DEFAULT_MAX_TRACKED_CALLERS = 100_000;

    private static final class Window {
        volatile long windowStartEpochSec;
        final AtomicInteger count = new AtomicInteger(0);

        Window(long start) {
            this.windowStartEpochSec = start;
        }
    }

    private final Cache<String, Window> windows;
    private final long windowSec;
    private final int issueLimit;
    private final int verifyLimit;
    private final int resetLimit;

    @Autowired
    public ResetRateLimiter(PasswordResetProperties props) {
        this(props.getRateLimit().getWindow().getSeconds(),
                props.getRateLimit().getIssue(),
                props.getRateLimit().getVerify(),
                props.getRateLimit().getReset(),
                props.getRateLimit().getMaxTrackedCallers());
    }

    public ResetRateLimiter(long windowSec, int issueLimit, int verifyLimit, int resetLimit) {
        this(windowSec, issueLimit, verifyLimit, resetLimit, DEFAULT_MAX_TRACKED_CALLERS);
    }

    public ResetRateLimiter(long windowSec, int issueLimit, int verifyLimit, int resetLimit, long maxTrackedCallers) {
        this.windowSec = Math.max(1, windowSec);
        this.issueLimit = Math.max(1, issueLimit);
        this.verifyLimit = Math.max(1, verifyLimit);
        this.resetLimit = Math.max(1, resetLimit);
        // expireAfterAccess：最後一次存取後至少還活一整個視窗，進行中的視窗計數不會中途消失
        this.windows = Caffeine.newBuilder()
                .expireAfterAccess(Duration.ofSeconds(this.windowSec))
                .maximumSize(Math.max(1, maxTrackedCallers))
                .build();
    }

    public void checkOrThrow(ResetOperation op, String caller, Instant nowUtc) {
        String key = op.name() + ":" + (caller == null || caller.isBlank() ? "unknown" : caller);
        long nowSec = nowUtc.getEpochSecond();
        long start = (nowSec / windowSec) * windowSec;

        Window w = windows.get(key, k -> new Window(start));

        // 進入新視窗：重置
        if (w.windowStartEpochSec != start) {
            synchronized (w) {
                if (w.windowStartEpochSec != start) {
                    w.windowStartEpochSec = start;
                    w.count.set(0);
                }
            }
        }

        int n = w.count.incrementAndGet();
        if (n > limitOf(op)) {
            int retryAfter = (int) Math.max(0, (start + windowSec) - nowSec);
            throw new RateLimitedException(op, retryAfter);
        }
    }

    int limitOf(ResetOperation op) {
        return switch (op) {
            case ISSUE -> issueLimit;
            case VERIFY -> verifyLimit;
            case RESET -> resetLimit;
        };
    }

    /** 目前追蹤中的 key 數（先跑完待處理的淘汰） */
    long trackedCallers() {
        windows.cleanUp();
        return windows.estimatedSize();
    }
}
