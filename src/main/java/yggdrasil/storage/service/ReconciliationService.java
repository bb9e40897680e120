package yggdrasil.storage.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import yggdrasil.storage.config.StorageProperties;
import yggdrasil.storage.dto.LegResult;
import yggdrasil.storage.model.ContentRecord;
import yggdrasil.storage.model.ReconciliationTask;
import yggdrasil.storage.model.StorageLeg;
import yggdrasil.storage.model.StorageLocation;
import yggdrasil.storage.repository.ContentRecordRepository;
import yggdrasil.storage.repository.ReconciliationTaskRepository;
import yggdrasil.storage.service.support.BackoffRetry;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 补写服务
 * 降级记录的失败分支按指数退避重试，超过上限转人工复核
 */
@Service
public class ReconciliationService {

    private static final Logger log = LoggerFactory.getLogger(ReconciliationService.class);
    private static final int MAX_ERROR_LENGTH = 1000;

    private final ReconciliationTaskRepository taskRepository;
    private final ContentRecordRepository recordRepository;
    private final StorageCoordinator coordinator;
    private final ConsistencyMapper consistencyMapper;
    private final StorageProperties.Reconciliation settings;

    private final AtomicBoolean running = new AtomicBoolean(false);

    public ReconciliationService(ReconciliationTaskRepository taskRepository,
                                 ContentRecordRepository recordRepository,
                                 StorageCoordinator coordinator,
                                 ConsistencyMapper consistencyMapper,
                                 StorageProperties properties) {
        this.taskRepository = taskRepository;
        this.recordRepository = recordRepository;
        this.coordinator = coordinator;
        this.consistencyMapper = consistencyMapper;
        this.settings = properties.getReconciliation();
    }

    /**
     * 登记补写任务，同一记录同一分支只保留一个待处理任务
     *
     * @param content 正文；只有记录没有其他分支保存正文时才会留存
     */
    public ReconciliationTask scheduleRepair(ContentRecord record, StorageLeg leg, String content, String error) {
        Optional<ReconciliationTask> existing = taskRepository.findFirstByRecordIdAndLegAndStatus(
            record.getId(), leg, ReconciliationTask.Status.PENDING);
        if (existing.isPresent()) {
            return existing.get();
        }
        ReconciliationTask task = new ReconciliationTask();
        task.setRecordId(record.getId());
        task.setLeg(leg);
        task.setAttempts(0);
        task.setStatus(ReconciliationTask.Status.PENDING);
        task.setLastError(abbreviate(error));
        task.setNextAttemptAt(LocalDateTime.now().plus(delayAfter(1)));
        if (!retainsContent(record.getLocation())) {
            task.setPendingContent(content);
        }
        ReconciliationTask saved = taskRepository.save(task);
        log.warn("记录 {} 分支 {} 已登记补写，原因: {}", record.getId(), leg, error);
        return saved;
    }

    @Scheduled(
        initialDelayString = "${storage.reconciliation.initial-delay-ms:30000}",
        fixedDelayString = "${storage.reconciliation.poll-interval-ms:30000}"
    )
    public void runDue() {
        if (!running.compareAndSet(false, true)) {
            return;
        }
        try {
            List<ReconciliationTask> due = taskRepository
                .findByStatusAndNextAttemptAtLessThanEqualOrderByNextAttemptAtAsc(
                    ReconciliationTask.Status.PENDING, LocalDateTime.now(), PageRequest.of(0, settings.getBatchSize()));
            for (ReconciliationTask task : due) {
                attempt(task);
            }
            if (!due.isEmpty()) {
                log.info("本轮补写处理任务数: {}", due.size());
            }
        } finally {
            running.set(false);
        }
    }

    /**
     * 执行一次补写尝试
     *
     * @return 补写后的任务状态
     */
    public ReconciliationTask.Status attempt(ReconciliationTask task) {
        Optional<ContentRecord> found = recordRepository.findById(task.getRecordId());
        if (found.isEmpty()) {
            return escalate(task, "记录不存在");
        }
        ContentRecord record = found.get();
        if (record.getLocation().hasLeg(task.getLeg())) {
            return resolve(task);
        }

        String content = task.getPendingContent();
        if (content == null) {
            content = consistencyMapper.loadContent(record).orElse(null);
        }
        if (content == null) {
            return recordFailure(task, "无可用正文，无法补写");
        }

        LegResult result = coordinator.writeLeg(record, task.getLeg(), content, record.getContentHash(), 1);
        if (!result.isSuccess()) {
            return recordFailure(task, result.getError());
        }
        ContentRecord repaired = consistencyMapper.completeLeg(record.getId(), result);
        if (!repaired.getLocation().hasLeg(task.getLeg())) {
            return recordFailure(task, "补写后回读校验失败");
        }
        return resolve(task);
    }

    private ReconciliationTask.Status resolve(ReconciliationTask task) {
        task.setStatus(ReconciliationTask.Status.SUCCEEDED);
        task.setPendingContent(null);
        task.setResolvedAt(LocalDateTime.now());
        taskRepository.save(task);
        log.info("记录 {} 分支 {} 补写成功", task.getRecordId(), task.getLeg());
        return task.getStatus();
    }

    private ReconciliationTask.Status recordFailure(ReconciliationTask task, String error) {
        task.setAttempts(task.getAttempts() + 1);
        task.setLastError(abbreviate(error));
        if (task.getAttempts() >= settings.getMaxAttempts()) {
            return escalate(task, error);
        }
        task.setNextAttemptAt(LocalDateTime.now().plus(delayAfter(task.getAttempts() + 1)));
        taskRepository.save(task);
        log.warn("记录 {} 分支 {} 第 {} 次补写失败: {}", task.getRecordId(), task.getLeg(), task.getAttempts(), error);
        return task.getStatus();
    }

    private ReconciliationTask.Status escalate(ReconciliationTask task, String error) {
        task.setStatus(ReconciliationTask.Status.MANUAL_REVIEW);
        task.setLastError(abbreviate(error));
        task.setResolvedAt(LocalDateTime.now());
        taskRepository.save(task);
        recordRepository.flagManualReview(task.getRecordId());
        log.error("[FATAL] 记录 {} 分支 {} 补写 {} 次仍失败，转人工复核: {}",
            task.getRecordId(), task.getLeg(), task.getAttempts(), error);
        return task.getStatus();
    }

    private Duration delayAfter(int attempt) {
        return BackoffRetry.delayFor(attempt, settings.getInitialBackoff(), settings.getMaxBackoff());
    }

    private boolean retainsContent(StorageLocation location) {
        return location.getFullBlobId() != null || location.getSpecializedTable() != null;
    }

    private String abbreviate(String message) {
        if (message == null || message.length() <= MAX_ERROR_LENGTH) {
            return message;
        }
        return message.substring(0, MAX_ERROR_LENGTH);
    }
}
