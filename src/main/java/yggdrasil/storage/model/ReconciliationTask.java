package yggdrasil.storage.model;

import jakarta.persistence.*;
import lombok.Data;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;

/**
 * 降级记录的补写任务
 */
@Data
@Entity
@Table(name = "reconciliation_tasks",
    indexes = {
        @Index(name = "idx_reconciliation_due", columnList = "status, next_attempt_at"),
        @Index(name = "idx_reconciliation_record", columnList = "record_id")
    })
public class ReconciliationTask {

    public enum Status {
        PENDING,
        SUCCEEDED,
        MANUAL_REVIEW
    }

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "record_id", nullable = false)
    private Long recordId;

    @Enumerated(EnumType.STRING)
    @Column(name = "leg", nullable = false, length = 16)
    private StorageLeg leg;

    @Column(name = "attempts", nullable = false)
    private int attempts;

    @Column(name = "next_attempt_at")
    private LocalDateTime nextAttemptAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private Status status;

    @Column(name = "last_error", length = 1000)
    private String lastError;

    /**
     * 无其他分支保存内容时（如纯向量策略）留存的待写文本，成功后清空
     */
    @Column(name = "pending_content", columnDefinition = "TEXT")
    private String pendingContent;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "resolved_at")
    private LocalDateTime resolvedAt;
}
