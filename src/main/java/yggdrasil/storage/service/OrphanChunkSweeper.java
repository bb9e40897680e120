package yggdrasil.storage.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import yggdrasil.storage.common.convention.exception.AbstractException;
import yggdrasil.storage.config.StorageProperties;
import yggdrasil.storage.model.VectorWriteBatch;
import yggdrasil.storage.repository.VectorWriteBatchRepository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 孤儿分块清理
 * 超过宽限期仍没有完成标记的暂存批次，其分块从向量库删除
 */
@Service
public class OrphanChunkSweeper {

    private static final Logger log = LoggerFactory.getLogger(OrphanChunkSweeper.class);
    private static final int SWEEP_BATCH = 100;

    private final VectorWriteBatchRepository batchRepository;
    private final VectorBatchLedger batchLedger;
    private final VectorStoreGateway vectorGateway;
    private final StorageProperties.Coordinator settings;

    private final AtomicBoolean running = new AtomicBoolean(false);

    public OrphanChunkSweeper(VectorWriteBatchRepository batchRepository,
                              VectorBatchLedger batchLedger,
                              VectorStoreGateway vectorGateway,
                              StorageProperties properties) {
        this.batchRepository = batchRepository;
        this.batchLedger = batchLedger;
        this.vectorGateway = vectorGateway;
        this.settings = properties.getCoordinator();
    }

    @Scheduled(
        initialDelayString = "${storage.coordinator.sweep-initial-delay-ms:60000}",
        fixedDelayString = "${storage.coordinator.sweep-interval-ms:300000}"
    )
    public void sweep() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        try {
            int swept = sweepOlderThan(LocalDateTime.now().minus(settings.getOrphanGrace()));
            if (swept > 0) {
                log.info("本轮清理孤儿向量批次: {}", swept);
            }
        } finally {
            running.set(false);
        }
    }

    /**
     * 清理 cutoff 之前创建且仍为 STAGING 的批次
     *
     * @return 清理成功的批次数
     */
    public int sweepOlderThan(LocalDateTime cutoff) {
        List<VectorWriteBatch> stale = batchRepository.findByStatusAndCreatedAtBeforeOrderByCreatedAtAsc(
            VectorWriteBatch.Status.STAGING, cutoff, PageRequest.of(0, SWEEP_BATCH));
        int swept = 0;
        for (VectorWriteBatch batch : stale) {
            try {
                vectorGateway.deleteGeneration(batch.getGeneration());
                batchLedger.markSwept(batch.getGeneration());
                swept++;
            } catch (AbstractException e) {
                log.warn("孤儿批次 {} 清理失败，下轮重试: {}", batch.getGeneration(), e.getErrorMessage());
            }
        }
        return swept;
    }
}
