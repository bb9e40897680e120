package yggdrasil.storage.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import yggdrasil.storage.config.StorageProperties;
import yggdrasil.storage.model.ContentRecord;
import yggdrasil.storage.model.GarbageCollectionTask;
import yggdrasil.storage.repository.ContentRecordRepository;
import yggdrasil.storage.repository.GarbageCollectionTaskRepository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 旧位置回收
 * 宽限期过后删除迁移替换下来的位置；仍被任何记录指针引用的部分跳过
 */
@Service
public class LocationGarbageCollector {

    private static final Logger log = LoggerFactory.getLogger(LocationGarbageCollector.class);
    private static final int COLLECT_BATCH = 100;

    private final GarbageCollectionTaskRepository taskRepository;
    private final ContentRecordRepository recordRepository;
    private final FullContentStore fullContentStore;
    private final VectorStoreGateway vectorGateway;
    private final VectorBatchLedger batchLedger;
    private final SpecializedTableWriter specializedWriter;
    private final StorageProperties.Migration settings;

    private final AtomicBoolean running = new AtomicBoolean(false);

    public LocationGarbageCollector(GarbageCollectionTaskRepository taskRepository,
                                    ContentRecordRepository recordRepository,
                                    FullContentStore fullContentStore,
                                    VectorStoreGateway vectorGateway,
                                    VectorBatchLedger batchLedger,
                                    SpecializedTableWriter specializedWriter,
                                    StorageProperties properties) {
        this.taskRepository = taskRepository;
        this.recordRepository = recordRepository;
        this.fullContentStore = fullContentStore;
        this.vectorGateway = vectorGateway;
        this.batchLedger = batchLedger;
        this.specializedWriter = specializedWriter;
        this.settings = properties.getMigration();
    }

    @Scheduled(
        initialDelayString = "${storage.migration.gc-initial-delay-ms:60000}",
        fixedDelayString = "${storage.migration.gc-interval-ms:300000}"
    )
    public void collect() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        try {
            int collected = collectDue(LocalDateTime.now());
            if (collected > 0) {
                log.info("本轮回收旧位置: {}", collected);
            }
        } finally {
            running.set(false);
        }
    }

    /**
     * 处理 now 之前到期的回收任务
     *
     * @return 完成的任务数
     */
    public int collectDue(LocalDateTime now) {
        List<GarbageCollectionTask> due = taskRepository.findByStatusAndDueAtLessThanEqualOrderByDueAtAsc(
            GarbageCollectionTask.Status.PENDING, now, PageRequest.of(0, COLLECT_BATCH));
        int done = 0;
        for (GarbageCollectionTask task : due) {
            try {
                if (collectOne(task, now)) {
                    task.setStatus(GarbageCollectionTask.Status.DONE);
                    done++;
                } else {
                    task.setDueAt(now.plus(settings.getGcGrace()));
                }
            } catch (RuntimeException e) {
                task.setAttempts(task.getAttempts() + 1);
                if (task.getAttempts() >= settings.getGcMaxAttempts()) {
                    task.setStatus(GarbageCollectionTask.Status.FAILED);
                    log.error("旧位置回收失败次数过多，放弃: {} {}", task.getKind(), task.getReference(), e);
                } else {
                    log.warn("旧位置回收失败，下轮重试: {} {}: {}", task.getKind(), task.getReference(), e.getMessage());
                }
            }
            taskRepository.save(task);
        }
        return done;
    }

    /**
     * @return false 表示 blob 仍在被写入方使用，任务顺延到下一个宽限期
     */
    private boolean collectOne(GarbageCollectionTask task, LocalDateTime now) {
        switch (task.getKind()) {
            case FULL_BLOB: {
                Long blobId = Long.valueOf(task.getReference());
                if (recordRepository.isBlobReferenced(blobId)) {
                    log.debug("blob {} 仍被引用，跳过回收", blobId);
                    return true;
                }
                // 同一哈希的摄取可能刚认领这个 blob 而尚未提交指针
                if (!fullContentStore.deleteIfUnclaimed(blobId, now.minus(settings.getGcGrace()))) {
                    log.info("blob {} 近期被认领，顺延回收", blobId);
                    return false;
                }
                return true;
            }
            case VECTOR_GENERATION: {
                String generation = task.getReference();
                if (recordRepository.isGenerationReferenced(generation)) {
                    log.debug("generation {} 仍被引用，跳过回收", generation);
                    return true;
                }
                vectorGateway.deleteGeneration(generation);
                batchLedger.markSwept(generation);
                return true;
            }
            case SPECIALIZED_ROW: {
                Optional<ContentRecord> owner = recordRepository.findById(task.getRecordId());
                if (owner.isPresent() && task.getReference().equals(owner.get().getLocation().getSpecializedTable())) {
                    log.debug("专用表 {} 中记录 {} 仍被引用，跳过回收", task.getReference(), task.getRecordId());
                    return true;
                }
                specializedWriter.delete(task.getReference(), task.getRecordId());
                return true;
            }
            default:
                return true;
        }
    }
}
