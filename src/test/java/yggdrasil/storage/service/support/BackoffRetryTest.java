package yggdrasil.storage.service.support;

import org.junit.jupiter.api.Test;
import yggdrasil.storage.common.convention.errorcode.StorageErrorCode;
import yggdrasil.storage.common.convention.exception.ServiceException;
import yggdrasil.storage.common.convention.exception.TransientStoreException;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class BackoffRetryTest {

    @Test
    public void delayDoublesUpToTheCap() {
        Duration initial = Duration.ofMillis(100);
        Duration max = Duration.ofMillis(500);

        assertThat(BackoffRetry.delayFor(1, initial, max)).isEqualTo(Duration.ofMillis(100));
        assertThat(BackoffRetry.delayFor(2, initial, max)).isEqualTo(Duration.ofMillis(200));
        assertThat(BackoffRetry.delayFor(3, initial, max)).isEqualTo(Duration.ofMillis(400));
        assertThat(BackoffRetry.delayFor(4, initial, max)).isEqualTo(Duration.ofMillis(500));
        assertThat(BackoffRetry.delayFor(60, initial, max)).isEqualTo(Duration.ofMillis(500));
    }

    @Test
    public void retriesTransientFailuresUntilSuccess() {
        AtomicInteger calls = new AtomicInteger();

        String result = BackoffRetry.call("写入", 3, Duration.ofMillis(1), Duration.ofMillis(2), () -> {
            if (calls.incrementAndGet() < 3) {
                throw new TransientStoreException("timeout", StorageErrorCode.STORAGE_WRITE_FAILED);
            }
            return "ok";
        });

        assertThat(result).isEqualTo("ok");
        assertThat(calls.get()).isEqualTo(3);
    }

    @Test
    public void permanentFailuresAreNotRetried() {
        AtomicInteger calls = new AtomicInteger();

        assertThatThrownBy(() -> BackoffRetry.call("写入", 5, Duration.ofMillis(1), Duration.ofMillis(2), () -> {
            calls.incrementAndGet();
            throw new ServiceException("bad schema", StorageErrorCode.DATABASE_ERROR);
        })).isInstanceOf(ServiceException.class);

        assertThat(calls.get()).isEqualTo(1);
    }

    @Test
    public void exhaustedRetriesRethrowLastTransientFailure() {
        assertThatThrownBy(() -> BackoffRetry.call("写入", 2, Duration.ofMillis(1), Duration.ofMillis(2), () -> {
            throw new TransientStoreException("still down", StorageErrorCode.STORAGE_WRITE_FAILED);
        })).isInstanceOf(TransientStoreException.class);
    }
}
