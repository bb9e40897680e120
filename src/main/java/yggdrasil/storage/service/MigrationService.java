package yggdrasil.storage.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import yggdrasil.storage.common.convention.errorcode.StorageErrorCode;
import yggdrasil.storage.common.convention.exception.AbstractException;
import yggdrasil.storage.common.convention.exception.ClientException;
import yggdrasil.storage.common.convention.exception.ServiceException;
import yggdrasil.storage.config.StorageProperties;
import yggdrasil.storage.dto.MigrationHandle;
import yggdrasil.storage.dto.MigrationResult;
import yggdrasil.storage.model.StorageStrategy;
import yggdrasil.storage.service.support.WritePacer;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * 迁移调度
 * 迁移在有界线程池中后台执行，启动间隔受节流器限制，可随时取消
 */
@Service
public class MigrationService {

    private static final Logger log = LoggerFactory.getLogger(MigrationService.class);

    private final ConsistencyMapper consistencyMapper;
    private final Executor migrationExecutor;
    private final WritePacer pacer;
    private final ConcurrentMap<Long, MigrationHandle> active = new ConcurrentHashMap<>();

    public MigrationService(ConsistencyMapper consistencyMapper,
                            @Qualifier("migrationExecutor") Executor migrationExecutor,
                            StorageProperties properties) {
        this.consistencyMapper = consistencyMapper;
        this.migrationExecutor = migrationExecutor;
        this.pacer = new WritePacer(properties.getMigration().getMinInterval());
    }

    /**
     * 提交迁移
     *
     * @throws ClientException 该记录已有迁移在进行
     */
    public MigrationHandle submit(Long recordId, StorageStrategy target, double confidence) {
        MigrationHandle handle = new MigrationHandle(recordId, target);
        if (active.putIfAbsent(recordId, handle) != null) {
            throw new ClientException(StorageErrorCode.MIGRATION_IN_PROGRESS);
        }
        try {
            migrationExecutor.execute(() -> {
                MigrationResult result;
                try {
                    result = run(handle, confidence);
                } finally {
                    active.remove(recordId, handle);
                }
                handle.getResult().complete(result);
            });
        } catch (RejectedExecutionException e) {
            active.remove(recordId, handle);
            throw new ServiceException("迁移队列已满", e, StorageErrorCode.MIGRATION_FAILED);
        }
        log.info("已提交迁移: 记录 {} -> {}", recordId, target.value());
        return handle;
    }

    /**
     * 取消进行中的迁移
     *
     * @return 是否找到进行中的迁移
     */
    public boolean cancel(Long recordId) {
        MigrationHandle handle = active.get(recordId);
        if (handle == null) {
            return false;
        }
        handle.cancel();
        log.info("已请求取消迁移: 记录 {}", recordId);
        return true;
    }

    public Optional<MigrationHandle> find(Long recordId) {
        return Optional.ofNullable(active.get(recordId));
    }

    private MigrationResult run(MigrationHandle handle, double confidence) {
        Long recordId = handle.getRecordId();
        try {
            pacer.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return new MigrationResult(recordId, null, handle.getTarget(), MigrationResult.Outcome.CANCELLED, "迁移线程被中断");
        }
        if (handle.isCancelled()) {
            return new MigrationResult(recordId, null, handle.getTarget(), MigrationResult.Outcome.CANCELLED, "迁移已取消");
        }
        try {
            return consistencyMapper.migrate(recordId, handle.getTarget(), confidence, handle::isCancelled);
        } catch (AbstractException e) {
            return new MigrationResult(recordId, null, handle.getTarget(), MigrationResult.Outcome.FAILED, e.getErrorMessage());
        } catch (RuntimeException e) {
            log.error("记录 {} 迁移失败", recordId, e);
            return new MigrationResult(recordId, null, handle.getTarget(), MigrationResult.Outcome.FAILED, e.getMessage());
        }
    }
}
