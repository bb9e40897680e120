package yggdrasil.storage.service;

import org.springframework.stereotype.Service;
import yggdrasil.storage.common.convention.errorcode.StorageErrorCode;
import yggdrasil.storage.common.convention.exception.ClientException;
import yggdrasil.storage.dto.HealthReport;
import yggdrasil.storage.dto.RecordStatusReport;
import yggdrasil.storage.dto.StatusCountView;
import yggdrasil.storage.model.ContentRecord;
import yggdrasil.storage.model.OptimizationRecommendation;
import yggdrasil.storage.model.RecordStatus;
import yggdrasil.storage.model.ReconciliationTask;
import yggdrasil.storage.model.StorageLocation;
import yggdrasil.storage.model.VectorWriteBatch;
import yggdrasil.storage.repository.ContentRecordRepository;
import yggdrasil.storage.repository.OptimizationRecommendationRepository;
import yggdrasil.storage.repository.ReconciliationTaskRepository;
import yggdrasil.storage.repository.VectorWriteBatchRepository;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * 运维视图：整体健康与单条记录状态
 */
@Service
public class StorageHealthService {

    private final ContentRecordRepository recordRepository;
    private final ReconciliationTaskRepository taskRepository;
    private final VectorWriteBatchRepository batchRepository;
    private final OptimizationRecommendationRepository recommendationRepository;

    public StorageHealthService(ContentRecordRepository recordRepository,
                                ReconciliationTaskRepository taskRepository,
                                VectorWriteBatchRepository batchRepository,
                                OptimizationRecommendationRepository recommendationRepository) {
        this.recordRepository = recordRepository;
        this.taskRepository = taskRepository;
        this.batchRepository = batchRepository;
        this.recommendationRepository = recommendationRepository;
    }

    public HealthReport report() {
        Map<RecordStatus, Long> byStatus = new EnumMap<>(RecordStatus.class);
        for (RecordStatus status : RecordStatus.values()) {
            byStatus.put(status, 0L);
        }
        for (StatusCountView view : recordRepository.countGroupedByStatus()) {
            byStatus.put(view.getStatus(), view.getTotal());
        }
        return new HealthReport(
            byStatus,
            recordRepository.countByManualReviewTrue(),
            taskRepository.countByStatus(ReconciliationTask.Status.PENDING),
            taskRepository.countByStatus(ReconciliationTask.Status.MANUAL_REVIEW),
            batchRepository.countByStatus(VectorWriteBatch.Status.STAGING),
            recommendationRepository.countByStatus(OptimizationRecommendation.Status.PENDING),
            recordRepository.strategyOverview());
    }

    public RecordStatusReport recordStatus(Long recordId) {
        ContentRecord record = recordRepository.findById(recordId)
            .orElseThrow(() -> new ClientException(StorageErrorCode.RECORD_NOT_FOUND));
        List<String> repairs = taskRepository.findByRecordIdOrderByIdAsc(recordId).stream()
            .filter(task -> task.getStatus() != ReconciliationTask.Status.SUCCEEDED)
            .map(task -> task.getLeg() + " x" + task.getAttempts() + " (" + task.getStatus() + ")")
            .collect(Collectors.toList());
        return new RecordStatusReport(
            record.getId(),
            record.getSourceLocator(),
            record.getStrategy(),
            record.getPolicyVersion(),
            record.getConfidenceScore(),
            record.getStatus(),
            record.isManualReview(),
            new StorageLocation(record.getLocation()),
            repairs);
    }
}
