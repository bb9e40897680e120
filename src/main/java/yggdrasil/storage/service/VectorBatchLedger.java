package yggdrasil.storage.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import yggdrasil.storage.common.convention.errorcode.StorageErrorCode;
import yggdrasil.storage.common.convention.exception.ServiceException;
import yggdrasil.storage.model.VectorMapping;
import yggdrasil.storage.model.VectorWriteBatch;
import yggdrasil.storage.repository.VectorMappingRepository;
import yggdrasil.storage.repository.VectorWriteBatchRepository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * 向量暂存批次台账
 * 分块全部确认后，批次提交与映射写入在同一事务完成，这一步即完成标记
 */
@Service
public class VectorBatchLedger {

    private static final Logger log = LoggerFactory.getLogger(VectorBatchLedger.class);

    private final VectorWriteBatchRepository batchRepository;
    private final VectorMappingRepository mappingRepository;

    public VectorBatchLedger(VectorWriteBatchRepository batchRepository,
                             VectorMappingRepository mappingRepository) {
        this.batchRepository = batchRepository;
        this.mappingRepository = mappingRepository;
    }

    /**
     * 登记暂存批次，须在写入任何分块之前调用，清理任务据此识别孤儿分块
     */
    public VectorWriteBatch stage(Long recordId, String collection, String generation, int expectedChunks) {
        VectorWriteBatch batch = new VectorWriteBatch();
        batch.setRecordId(recordId);
        batch.setCollectionName(collection);
        batch.setGeneration(generation);
        batch.setExpectedChunks(expectedChunks);
        batch.setStatus(VectorWriteBatch.Status.STAGING);
        return batchRepository.saveAndFlush(batch);
    }

    @Transactional
    public VectorWriteBatch commit(String generation, List<VectorMapping> mappings) {
        VectorWriteBatch batch = batchRepository.findByGeneration(generation)
            .orElseThrow(() -> new ServiceException("暂存批次不存在: " + generation,
                StorageErrorCode.STORAGE_WRITE_FAILED));
        if (batch.getStatus() != VectorWriteBatch.Status.STAGING) {
            throw new ServiceException("暂存批次状态异常: " + generation + " " + batch.getStatus(),
                StorageErrorCode.STORAGE_WRITE_FAILED);
        }
        mappingRepository.saveAll(mappings);
        batch.setStatus(VectorWriteBatch.Status.COMMITTED);
        batch.setCommittedAt(LocalDateTime.now());
        VectorWriteBatch committed = batchRepository.save(batch);
        log.info("向量批次已提交, generation: {}, 分块数: {}", generation, mappings.size());
        return committed;
    }

    public Optional<VectorWriteBatch> find(String generation) {
        if (generation == null) {
            return Optional.empty();
        }
        return batchRepository.findByGeneration(generation);
    }

    public boolean isCommitted(String generation) {
        return find(generation).map(VectorWriteBatch::isCommitted).orElse(false);
    }

    /**
     * 分块已从向量库删除后，清理映射并把批次标记为已清理
     */
    @Transactional
    public void markSwept(String generation) {
        mappingRepository.deleteByGeneration(generation);
        batchRepository.findByGeneration(generation).ifPresent(batch -> {
            batch.setStatus(VectorWriteBatch.Status.SWEPT);
            batchRepository.save(batch);
        });
    }
}
