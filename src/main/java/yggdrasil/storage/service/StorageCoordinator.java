package yggdrasil.storage.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import yggdrasil.storage.client.VectorEncodingService;
import yggdrasil.storage.common.convention.errorcode.StorageErrorCode;
import yggdrasil.storage.common.convention.exception.AbstractException;
import yggdrasil.storage.common.convention.exception.ServiceException;
import yggdrasil.storage.common.convention.exception.TransientStoreException;
import yggdrasil.storage.config.StorageProperties;
import yggdrasil.storage.dto.LegResult;
import yggdrasil.storage.dto.WriteOutcome;
import yggdrasil.storage.model.ContentRecord;
import yggdrasil.storage.model.StorageLeg;
import yggdrasil.storage.model.StorageStrategy;
import yggdrasil.storage.model.VectorChunkDocument;
import yggdrasil.storage.model.VectorMapping;
import yggdrasil.storage.service.support.BackoffRetry;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.Semaphore;
import java.util.concurrent.atomic.AtomicReference;

/**
 * 存储协调器
 *
 * <p>不使用分布式事务，每个分支单独写入：</p>
 * <ul>
 *     <li>全文：按内容哈希幂等写入</li>
 *     <li>向量：先登记暂存批次，分块并行写入并全部确认后，再写入唯一的完成标记</li>
 *     <li>专用表：先应用声明式表结构，再按记录 ID 幂等写入一行</li>
 * </ul>
 * <p>瞬时错误按指数退避重试，重试耗尽的分支返回失败结果，由调用方记录降级并安排补写。</p>
 */
@Service
public class StorageCoordinator {

    private static final Logger log = LoggerFactory.getLogger(StorageCoordinator.class);
    private static final int ENCODE_WINDOW = 256;
    static final int BULK_BATCH_SIZE = 64;

    private final FullContentStore fullContentStore;
    private final VectorStoreGateway vectorGateway;
    private final VectorBatchLedger batchLedger;
    private final VectorEncodingService encodingService;
    private final SpecializedTableWriter specializedWriter;
    private final ContentChunker chunker;
    private final Executor vectorWriteExecutor;
    private final StorageProperties.Coordinator settings;

    public StorageCoordinator(FullContentStore fullContentStore,
                              VectorStoreGateway vectorGateway,
                              VectorBatchLedger batchLedger,
                              VectorEncodingService encodingService,
                              SpecializedTableWriter specializedWriter,
                              ContentChunker chunker,
                              @Qualifier("vectorWriteExecutor") Executor vectorWriteExecutor,
                              StorageProperties properties) {
        this.fullContentStore = fullContentStore;
        this.vectorGateway = vectorGateway;
        this.batchLedger = batchLedger;
        this.encodingService = encodingService;
        this.specializedWriter = specializedWriter;
        this.chunker = chunker;
        this.vectorWriteExecutor = vectorWriteExecutor;
        this.settings = properties.getCoordinator();
    }

    /**
     * 写入策略要求的全部分支
     */
    public WriteOutcome execute(ContentRecord record, String content, String contentHash, StorageStrategy strategy) {
        WriteOutcome outcome = new WriteOutcome();
        for (StorageLeg leg : strategy.requiredLegs()) {
            outcome.add(writeLeg(record, leg, content, contentHash, settings.getMaxAttempts()));
        }
        if (!outcome.allSucceeded()) {
            log.warn("记录 {} 部分分支写入失败: {}", record.getId(), outcome.failedLegs());
        }
        return outcome;
    }

    /**
     * 写入单个分支，失败不抛异常
     *
     * @param maxAttempts 包含首次在内的最大尝试次数
     */
    public LegResult writeLeg(ContentRecord record, StorageLeg leg, String content, String contentHash, int maxAttempts) {
        String operation = "记录 " + record.getId() + " 写入 " + leg;
        try {
            return BackoffRetry.call(operation, maxAttempts, settings.getInitialBackoff(), settings.getMaxBackoff(),
                () -> writeOnce(record, leg, content, contentHash));
        } catch (AbstractException e) {
            log.error("{} 失败: {}", operation, e.getErrorMessage(), e);
            return LegResult.failed(leg, e.getErrorMessage());
        } catch (RuntimeException e) {
            log.error("{} 失败", operation, e);
            return LegResult.failed(leg, e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage());
        }
    }

    private LegResult writeOnce(ContentRecord record, StorageLeg leg, String content, String contentHash) {
        switch (leg) {
            case FULL:
                return LegResult.full(writeFull(record, content, contentHash));
            case VECTOR:
                return writeVectors(record, content);
            case SPECIALIZED:
                return LegResult.specialized(specializedWriter.write(record, content, contentHash));
            default:
                throw new ServiceException("未知存储分支: " + leg, StorageErrorCode.SERVICE_ERROR);
        }
    }

    private Long writeFull(ContentRecord record, String content, String contentHash) {
        List<String> chunks = "book".equals(record.getContentType()) ? chunker.chunk(content) : null;
        return fullContentStore.writeIdempotent(contentHash, content, chunks, record.getId());
    }

    /**
     * 向量分支：暂存 → 并行写入分块 → 全部确认 → 刷新 → 完成标记
     * 任何一步失败都不写完成标记，暂存分块由清理任务回收
     */
    private LegResult writeVectors(ContentRecord record, String content) {
        List<String> chunks = chunker.chunk(content);
        if (chunks.isEmpty()) {
            throw new ServiceException("正文为空，无法生成向量分块", StorageErrorCode.CONTENT_EMPTY);
        }

        String collection = vectorGateway.collection();
        String generation = UUID.randomUUID().toString();
        batchLedger.stage(record.getId(), collection, generation, chunks.size());
        vectorGateway.ensureIndex(encodingService.getDimension());

        Long createdAt = VectorStoreGateway.toEpochMillis(record.getCreatedAt());
        String domain = record.getDomain() == null ? null : record.getDomain().toLowerCase(Locale.ROOT);
        List<VectorMapping> mappings = new ArrayList<>(chunks.size());

        for (int windowStart = 0; windowStart < chunks.size(); windowStart += ENCODE_WINDOW) {
            List<String> window = chunks.subList(windowStart, Math.min(windowStart + ENCODE_WINDOW, chunks.size()));
            List<float[]> vectors = encodingService.encode(window);

            List<VectorChunkDocument> documents = new ArrayList<>(window.size());
            for (int i = 0; i < window.size(); i++) {
                int sequence = windowStart + i;
                String text = window.get(i);
                int words = countWords(text);
                documents.add(VectorChunkDocument.builder()
                    .pointId(VectorChunkDocument.pointId(generation, sequence))
                    .contentRecordId(record.getId())
                    .chunkSequence(sequence)
                    .wordCount(words)
                    .domain(domain)
                    .contentType(record.getContentType())
                    .generation(generation)
                    .createdAt(createdAt)
                    .text(text)
                    .embedding(vectors.get(i))
                    .build());
                mappings.add(buildMapping(record.getId(), collection, generation, sequence, words, vectors.get(i).length));
            }
            indexInParallel(documents);
        }

        vectorGateway.refresh();
        batchLedger.commit(generation, mappings);
        log.info("记录 {} 向量写入完成, generation: {}, 分块数: {}", record.getId(), generation, chunks.size());
        return LegResult.vector(collection, generation, chunks.size());
    }

    /**
     * 按批次批量写入，最多 vectorWorkers 个批次同时在途；全部确认后才返回
     */
    private void indexInParallel(List<VectorChunkDocument> documents) {
        Semaphore inFlight = new Semaphore(Math.max(1, settings.getVectorWorkers()));
        AtomicReference<RuntimeException> firstFailure = new AtomicReference<>();
        List<CompletableFuture<Void>> futures = new ArrayList<>(documents.size());

        for (int start = 0; start < documents.size(); start += BULK_BATCH_SIZE) {
            List<VectorChunkDocument> batch = documents.subList(start, Math.min(start + BULK_BATCH_SIZE, documents.size()));
            if (firstFailure.get() != null) {
                break;
            }
            try {
                inFlight.acquire();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new TransientStoreException("向量写入被中断", e, StorageErrorCode.STORAGE_WRITE_FAILED);
            }
            CompletableFuture<Void> future;
            try {
                future = CompletableFuture.runAsync(() -> {
                    try {
                        vectorGateway.indexChunks(batch);
                    } catch (RuntimeException e) {
                        firstFailure.compareAndSet(null, e);
                        throw e;
                    } finally {
                        inFlight.release();
                    }
                }, vectorWriteExecutor);
            } catch (RuntimeException e) {
                inFlight.release();
                throw new TransientStoreException("向量写入任务提交失败", e, StorageErrorCode.STORAGE_WRITE_FAILED);
            }
            futures.add(future);
        }

        try {
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        } catch (CompletionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new ServiceException("向量写入失败", cause, StorageErrorCode.STORAGE_WRITE_FAILED);
        }
        if (firstFailure.get() != null) {
            throw firstFailure.get();
        }
    }

    private VectorMapping buildMapping(Long recordId, String collection, String generation,
                                       int sequence, int wordCount, int dimensions) {
        VectorMapping mapping = new VectorMapping();
        mapping.setRecordId(recordId);
        mapping.setCollectionName(collection);
        mapping.setPointId(VectorChunkDocument.pointId(generation, sequence));
        mapping.setGeneration(generation);
        mapping.setVectorDimensions(dimensions);
        mapping.setEmbeddingModel(encodingService.getModelName());
        mapping.setChunkSequence(sequence);
        mapping.setWordCount(wordCount);
        return mapping;
    }

    private int countWords(String text) {
        String trimmed = text.trim();
        return trimmed.isEmpty() ? 0 : trimmed.split("\\s+").length;
    }
}
