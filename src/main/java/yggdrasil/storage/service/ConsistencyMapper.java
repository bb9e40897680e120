package yggdrasil.storage.service;

import org.apache.commons.codec.digest.DigestUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import yggdrasil.storage.common.convention.errorcode.StorageErrorCode;
import yggdrasil.storage.common.convention.exception.ClientException;
import yggdrasil.storage.common.convention.exception.ConsistencyViolationException;
import yggdrasil.storage.config.StorageProperties;
import yggdrasil.storage.dto.LegResult;
import yggdrasil.storage.dto.MigrationResult;
import yggdrasil.storage.dto.WriteOutcome;
import yggdrasil.storage.model.ContentRecord;
import yggdrasil.storage.model.FullContentBlob;
import yggdrasil.storage.model.GarbageCollectionTask;
import yggdrasil.storage.model.RecordStatus;
import yggdrasil.storage.model.StorageLeg;
import yggdrasil.storage.model.StorageLocation;
import yggdrasil.storage.model.StorageStrategy;
import yggdrasil.storage.model.VectorChunkDocument;
import yggdrasil.storage.model.VectorWriteBatch;
import yggdrasil.storage.repository.ContentRecordRepository;
import yggdrasil.storage.repository.GarbageCollectionTaskRepository;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.function.BooleanSupplier;
import java.util.stream.Collectors;

/**
 * 一致性映射
 *
 * <p>唯一负责更新记录位置指针的组件。READY 记录的指针始终指向完整写入且可读的数据：</p>
 * <ul>
 *     <li>摄取时只为完成标记已写入的分支设置指针</li>
 *     <li>迁移时按 写入新位置 → 回读校验 → 原子切换 → 延迟回收旧位置 的顺序执行，校验失败不动原指针</li>
 * </ul>
 */
@Service
public class ConsistencyMapper {

    private static final Logger log = LoggerFactory.getLogger(ConsistencyMapper.class);

    private final ContentRecordRepository recordRepository;
    private final GarbageCollectionTaskRepository gcTaskRepository;
    private final StorageCoordinator coordinator;
    private final FullContentStore fullContentStore;
    private final VectorStoreGateway vectorGateway;
    private final VectorBatchLedger batchLedger;
    private final SpecializedTableWriter specializedWriter;
    private final PlacementPolicy placementPolicy;
    private final StorageProperties properties;

    public ConsistencyMapper(ContentRecordRepository recordRepository,
                             GarbageCollectionTaskRepository gcTaskRepository,
                             StorageCoordinator coordinator,
                             FullContentStore fullContentStore,
                             VectorStoreGateway vectorGateway,
                             VectorBatchLedger batchLedger,
                             SpecializedTableWriter specializedWriter,
                             PlacementPolicy placementPolicy,
                             StorageProperties properties) {
        this.recordRepository = recordRepository;
        this.gcTaskRepository = gcTaskRepository;
        this.coordinator = coordinator;
        this.fullContentStore = fullContentStore;
        this.vectorGateway = vectorGateway;
        this.batchLedger = batchLedger;
        this.specializedWriter = specializedWriter;
        this.placementPolicy = placementPolicy;
        this.properties = properties;
    }

    /**
     * 摄取完成：只为成功且回读通过的分支设置指针，全部分支就位才置为 READY
     */
    @Transactional
    public ContentRecord commitIngestion(Long recordId, WriteOutcome outcome) {
        ContentRecord record = loadRecord(recordId);
        for (LegResult leg : outcome.succeeded()) {
            applyIfReadable(record, leg);
        }
        record.setStatus(record.getLocation().covers(record.getStrategy()) ? RecordStatus.READY : RecordStatus.DEGRADED);
        ContentRecord saved = recordRepository.save(record);
        log.info("记录 {} 摄取完成, 策略: {}, 状态: {}", recordId, saved.getStrategy().value(), saved.getStatus());
        return saved;
    }

    /**
     * 补写成功后补上对应分支的指针
     * 只有整个位置回读校验通过才恢复为 READY，否则保持 DEGRADED
     */
    @Transactional
    public ContentRecord completeLeg(Long recordId, LegResult leg) {
        ContentRecord record = loadRecord(recordId);
        if (!applyIfReadable(record, leg)) {
            return record;
        }
        if (record.getStatus() == RecordStatus.DEGRADED) {
            if (isReadable(record)) {
                record.setStatus(RecordStatus.READY);
                log.info("记录 {} 补写完成，恢复为 READY", recordId);
            } else {
                log.warn("记录 {} 补写后位置仍不完整，保持 DEGRADED", recordId);
            }
        }
        return recordRepository.save(record);
    }

    /**
     * 分支单独回读通过才写入指针
     */
    private boolean applyIfReadable(ContentRecord record, LegResult leg) {
        if (!leg.isSuccess()) {
            return false;
        }
        StorageLocation written = new StorageLocation();
        applyLeg(written, leg);
        if (!isLegReadable(record.getId(), written, leg.getLeg(), record.getContentHash())) {
            log.warn("记录 {} 分支 {} 写入后回读失败，不设置指针", record.getId(), leg.getLeg());
            return false;
        }
        applyLeg(record.getLocation(), leg);
        return true;
    }

    /**
     * 查询可见的记录：PENDING 记录不可见
     */
    public List<ContentRecord> resolveQueryable(Collection<Long> ids) {
        if (ids == null || ids.isEmpty()) {
            return List.of();
        }
        return recordRepository.findByIdIn(ids).stream()
            .filter(ContentRecord::isQueryable)
            .collect(Collectors.toList());
    }

    /**
     * 向量命中是否来自记录当前指向的 generation，迁移后的旧分块在回收前仍可能被检索到
     */
    public boolean isCurrentGeneration(ContentRecord record, String generation) {
        return generation != null && generation.equals(record.getLocation().getVectorGeneration());
    }

    /**
     * 回读校验记录当前指针
     */
    public boolean isReadable(ContentRecord record) {
        return verifyLocation(record.getId(), record.getLocation(), record.getStrategy(), record.getContentHash());
    }

    /**
     * 回读校验：位置覆盖策略要求的每个分支，且每个分支都能完整读回
     */
    public boolean verifyLocation(Long recordId, StorageLocation location, StorageStrategy strategy, String contentHash) {
        if (!location.covers(strategy)) {
            return false;
        }
        for (StorageLeg leg : strategy.requiredLegs()) {
            if (!isLegReadable(recordId, location, leg, contentHash)) {
                log.warn("记录 {} 分支 {} 回读校验失败", recordId, leg);
                return false;
            }
        }
        return true;
    }

    /**
     * 读取记录正文：全文优先，其次专用表，最后按序号拼接向量分块
     */
    public Optional<String> loadContent(ContentRecord record) {
        StorageLocation location = record.getLocation();
        if (location.getFullBlobId() != null) {
            Optional<String> full = fullContentStore.find(location.getFullBlobId()).map(FullContentBlob::getFullContent);
            if (full.isPresent()) {
                return full;
            }
        }
        if (location.getSpecializedTable() != null) {
            Optional<String> row = specializedWriter.readContent(location.getSpecializedTable(), record.getId());
            if (row.isPresent()) {
                return row;
            }
        }
        if (location.getVectorGeneration() != null && batchLedger.isCommitted(location.getVectorGeneration())) {
            List<VectorChunkDocument> chunks = vectorGateway.loadGeneration(location.getVectorGeneration());
            if (isComplete(chunks, location.getVectorChunkCount())) {
                return Optional.of(chunks.stream()
                    .map(VectorChunkDocument::getText)
                    .collect(Collectors.joining("\n\n")));
            }
            log.warn("记录 {} 向量分块不完整, generation: {}, 读取 {} / 期望 {}", record.getId(),
                location.getVectorGeneration(), chunks.size(), location.getVectorChunkCount());
        }
        return Optional.empty();
    }

    /**
     * 分块数等于指针登记的数量，序号从 0 连续递增且正文非空
     */
    static boolean isComplete(List<VectorChunkDocument> chunks, Integer expectedCount) {
        if (expectedCount == null || expectedCount <= 0 || chunks.size() != expectedCount) {
            return false;
        }
        for (int i = 0; i < chunks.size(); i++) {
            VectorChunkDocument chunk = chunks.get(i);
            if (chunk.getChunkSequence() == null || chunk.getChunkSequence() != i || chunk.getText() == null) {
                return false;
            }
        }
        return true;
    }

    /**
     * 迁移记录到新策略
     *
     * @param recordId 记录 ID
     * @param target 目标策略
     * @param confidence 新决策的置信度
     * @param cancelled 取消信号，在每个分支写入前与切换前检查
     * @throws ConsistencyViolationException 新位置回读校验失败，原指针保持不变
     */
    public MigrationResult migrate(Long recordId, StorageStrategy target, double confidence, BooleanSupplier cancelled) {
        ContentRecord record = loadRecord(recordId);
        StorageStrategy source = record.getStrategy();
        if (record.getStatus() != RecordStatus.READY) {
            return new MigrationResult(recordId, source, target, MigrationResult.Outcome.FAILED,
                "记录状态为 " + record.getStatus() + "，只有 READY 记录可以迁移");
        }
        if (source == target) {
            return new MigrationResult(recordId, source, target, MigrationResult.Outcome.UNCHANGED, "策略未变化");
        }

        String content = null;
        if (!target.requiredLegs().isEmpty()) {
            Optional<String> loaded = loadContent(record);
            if (loaded.isEmpty()) {
                return new MigrationResult(recordId, source, target, MigrationResult.Outcome.FAILED,
                    "记录未保留正文，无法迁移到 " + target.value());
            }
            content = loaded.get();
        }
        String contentHash = content == null ? record.getContentHash() : DigestUtils.sha256Hex(content);

        if (recordRepository.transitionStatus(recordId, RecordStatus.READY, RecordStatus.MIGRATING) == 0) {
            return new MigrationResult(recordId, source, target, MigrationResult.Outcome.FAILED, "记录状态已被并发修改");
        }
        ContentRecord migrating = loadRecord(recordId);
        StorageLocation current = new StorageLocation(migrating.getLocation());
        StorageLocation candidate = new StorageLocation();
        try {
            return writeVerifyAndSwap(migrating, current, candidate, target, content, contentHash, confidence, cancelled);
        } catch (ConsistencyViolationException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("记录 {} 迁移过程异常", recordId, e);
            return abort(migrating, current, candidate, target, MigrationResult.Outcome.FAILED,
                "迁移异常: " + e.getMessage());
        }
    }

    private MigrationResult writeVerifyAndSwap(ContentRecord migrating, StorageLocation current,
                                               StorageLocation candidate, StorageStrategy target,
                                               String content, String contentHash, double confidence,
                                               BooleanSupplier cancelled) {
        Long recordId = migrating.getId();
        StorageStrategy source = migrating.getStrategy();

        // 阶段一：完整写入新位置
        for (StorageLeg leg : target.requiredLegs()) {
            if (cancelled.getAsBoolean()) {
                return abort(migrating, current, candidate, target, MigrationResult.Outcome.CANCELLED, "迁移已取消");
            }
            if (canReuse(current, leg, contentHash, migrating)) {
                copyLeg(current, candidate, leg);
                continue;
            }
            LegResult result = coordinator.writeLeg(migrating, leg, content, contentHash,
                properties.getCoordinator().getMaxAttempts());
            if (!result.isSuccess()) {
                return abort(migrating, current, candidate, target, MigrationResult.Outcome.FAILED,
                    "新位置写入失败: " + leg + " " + result.getError());
            }
            applyLeg(candidate, result);
        }

        // 阶段二：回读校验
        if (!verifyLocation(recordId, candidate, target, contentHash)) {
            log.error("[FATAL] 记录 {} 迁移到 {} 回读校验失败，保留原指针", recordId, target.value());
            abort(migrating, current, candidate, target, MigrationResult.Outcome.FAILED, "回读校验失败");
            throw new ConsistencyViolationException("记录 " + recordId + " 迁移到 " + target.value() + " 回读校验失败");
        }
        if (cancelled.getAsBoolean()) {
            return abort(migrating, current, candidate, target, MigrationResult.Outcome.CANCELLED, "迁移已取消");
        }

        // 阶段三：原子切换指针
        int swapped = recordRepository.swapLocation(recordId, migrating.getVersion(),
            candidate.getFullBlobId(), candidate.getVectorCollection(), candidate.getVectorGeneration(),
            candidate.getVectorChunkCount(), candidate.getSpecializedTable(), contentHash,
            target, placementPolicy.currentVersion(), confidence, RecordStatus.READY);
        if (swapped == 0) {
            return abort(migrating, current, candidate, target, MigrationResult.Outcome.FAILED,
                "记录版本已变化，放弃切换");
        }

        // 阶段四：旧位置延迟回收
        LocalDateTime dueAt = LocalDateTime.now().plus(properties.getMigration().getGcGrace());
        retireParts(recordId, current, candidate, dueAt);
        log.info("记录 {} 迁移完成: {} -> {}", recordId, source.value(), target.value());
        return new MigrationResult(recordId, source, target, MigrationResult.Outcome.SWAPPED, "迁移完成");
    }

    /**
     * 放弃迁移：候选位置中新写入的部分同样等宽限期后回收（全文 blob 可能已被其他记录按哈希复用），恢复 READY
     */
    private MigrationResult abort(ContentRecord record, StorageLocation current, StorageLocation candidate,
                                  StorageStrategy target, MigrationResult.Outcome outcome, String message) {
        retireParts(record.getId(), candidate, current,
            LocalDateTime.now().plus(properties.getMigration().getGcGrace()));
        recordRepository.transitionStatus(record.getId(), RecordStatus.MIGRATING, RecordStatus.READY);
        log.warn("记录 {} 迁移到 {} 未完成: {}", record.getId(), target.value(), message);
        return new MigrationResult(record.getId(), record.getStrategy(), target, outcome, message);
    }

    /**
     * 为 retired 中不再被 kept 引用的部分登记回收任务
     */
    private void retireParts(Long recordId, StorageLocation retired, StorageLocation kept, LocalDateTime dueAt) {
        if (retired.getFullBlobId() != null && !retired.getFullBlobId().equals(kept.getFullBlobId())) {
            scheduleCollection(recordId, GarbageCollectionTask.Kind.FULL_BLOB, String.valueOf(retired.getFullBlobId()), dueAt);
        }
        if (retired.getVectorGeneration() != null && !retired.getVectorGeneration().equals(kept.getVectorGeneration())) {
            scheduleCollection(recordId, GarbageCollectionTask.Kind.VECTOR_GENERATION, retired.getVectorGeneration(), dueAt);
        }
        if (retired.getSpecializedTable() != null && !retired.getSpecializedTable().equals(kept.getSpecializedTable())) {
            scheduleCollection(recordId, GarbageCollectionTask.Kind.SPECIALIZED_ROW, retired.getSpecializedTable(), dueAt);
        }
    }

    private void scheduleCollection(Long recordId, GarbageCollectionTask.Kind kind, String reference, LocalDateTime dueAt) {
        GarbageCollectionTask task = new GarbageCollectionTask();
        task.setRecordId(recordId);
        task.setKind(kind);
        task.setReference(reference);
        task.setDueAt(dueAt);
        task.setAttempts(0);
        task.setStatus(GarbageCollectionTask.Status.PENDING);
        gcTaskRepository.save(task);
        log.debug("登记旧位置回收: 记录 {}, {} {}, 到期 {}", recordId, kind, reference, dueAt);
    }

    private boolean canReuse(StorageLocation current, StorageLeg leg, String contentHash, ContentRecord record) {
        return current.hasLeg(leg) && isLegReadable(record.getId(), current, leg, contentHash);
    }

    private boolean isLegReadable(Long recordId, StorageLocation location, StorageLeg leg, String contentHash) {
        switch (leg) {
            case FULL:
                return fullContentStore.isReadable(location.getFullBlobId(), contentHash);
            case VECTOR: {
                Optional<VectorWriteBatch> batch = batchLedger.find(location.getVectorGeneration());
                if (batch.isEmpty() || !batch.get().isCommitted()) {
                    return false;
                }
                long expected = location.getVectorChunkCount() == null ? 0 : location.getVectorChunkCount();
                return expected > 0 && vectorGateway.countGeneration(location.getVectorGeneration()) == expected;
            }
            case SPECIALIZED:
                return specializedWriter.isReadable(location.getSpecializedTable(), recordId, contentHash);
            default:
                return false;
        }
    }

    private void copyLeg(StorageLocation from, StorageLocation to, StorageLeg leg) {
        switch (leg) {
            case FULL:
                to.setFullBlobId(from.getFullBlobId());
                break;
            case VECTOR:
                to.setVectorCollection(from.getVectorCollection());
                to.setVectorGeneration(from.getVectorGeneration());
                to.setVectorChunkCount(from.getVectorChunkCount());
                break;
            case SPECIALIZED:
                to.setSpecializedTable(from.getSpecializedTable());
                break;
            default:
                break;
        }
    }

    private void applyLeg(StorageLocation location, LegResult leg) {
        if (!leg.isSuccess()) {
            return;
        }
        switch (leg.getLeg()) {
            case FULL:
                location.setFullBlobId(leg.getFullBlobId());
                break;
            case VECTOR:
                location.setVectorCollection(leg.getVectorCollection());
                location.setVectorGeneration(leg.getVectorGeneration());
                location.setVectorChunkCount(leg.getVectorChunkCount());
                break;
            case SPECIALIZED:
                location.setSpecializedTable(leg.getSpecializedTable());
                break;
            default:
                break;
        }
    }

    private ContentRecord loadRecord(Long recordId) {
        return recordRepository.findById(recordId)
            .orElseThrow(() -> new ClientException("记录不存在: " + recordId, StorageErrorCode.RECORD_NOT_FOUND));
    }
}
