package yggdrasil.storage.dto;

import lombok.Getter;
import yggdrasil.storage.model.StorageStrategy;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 后台迁移句柄
 */
@Getter
public class MigrationHandle {

    private final Long recordId;
    private final StorageStrategy target;
    private final CompletableFuture<MigrationResult> result = new CompletableFuture<>();
    private final AtomicBoolean cancelRequested = new AtomicBoolean(false);

    public MigrationHandle(Long recordId, StorageStrategy target) {
        this.recordId = recordId;
        this.target = target;
    }

    /**
     * 请求取消；切换指针之前的任何时刻生效，已切换的迁移不受影响
     */
    public void cancel() {
        cancelRequested.set(true);
    }

    public boolean isCancelled() {
        return cancelRequested.get();
    }
}
