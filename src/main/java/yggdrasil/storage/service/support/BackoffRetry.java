package yggdrasil.storage.service.support;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import yggdrasil.storage.common.convention.errorcode.StorageErrorCode;
import yggdrasil.storage.common.convention.exception.TransientStoreException;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * 指数退避重试
 * 只重试 TransientStoreException，其他异常立即抛出
 */
public final class BackoffRetry {

    private static final Logger log = LoggerFactory.getLogger(BackoffRetry.class);

    private BackoffRetry() {
    }

    public static <T> T call(String operation,
                             int maxAttempts,
                             Duration initialBackoff,
                             Duration maxBackoff,
                             Supplier<T> action) {
        int attempts = Math.max(1, maxAttempts);
        TransientStoreException last = null;
        for (int attempt = 1; attempt <= attempts; attempt++) {
            try {
                return action.get();
            } catch (TransientStoreException e) {
                last = e;
                if (attempt == attempts) {
                    break;
                }
                Duration wait = delayFor(attempt, initialBackoff, maxBackoff);
                log.warn("{} 第 {}/{} 次失败，{} ms 后重试: {}",
                    operation, attempt, attempts, wait.toMillis(), e.getErrorMessage());
                sleep(wait);
            }
        }
        throw last;
    }

    /**
     * 第 attempt 次失败后的等待时间：initial * 2^(attempt-1)，不超过 max
     */
    public static Duration delayFor(int attempt, Duration initialBackoff, Duration maxBackoff) {
        long initialMillis = Math.max(0L, initialBackoff.toMillis());
        int exponent = Math.min(Math.max(0, attempt - 1), 30);
        long millis = initialMillis * (1L << exponent);
        if (millis < 0 || millis > maxBackoff.toMillis()) {
            millis = maxBackoff.toMillis();
        }
        return Duration.ofMillis(millis);
    }

    private static void sleep(Duration wait) {
        try {
            Thread.sleep(wait.toMillis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransientStoreException("重试等待被中断", e, StorageErrorCode.STORAGE_WRITE_FAILED);
        }
    }
}
