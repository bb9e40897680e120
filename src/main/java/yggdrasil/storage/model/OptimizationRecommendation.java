package yggdrasil.storage.model;

import jakarta.persistence.*;
import lombok.Data;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;

/**
 * 存储优化建议
 * 同一 (type, target) 至多一条待处理
 */
@Data
@Entity
@Table(name = "optimization_recommendations",
    indexes = {
        @Index(name = "idx_optimization_rec_target", columnList = "target, status"),
        @Index(name = "idx_optimization_rec_status", columnList = "status")
    })
public class OptimizationRecommendation {

    public enum Type {
        ADD_INDEX,
        MIGRATE_STRATEGY
    }

    public enum Status {
        PENDING,
        APPLIED,
        REJECTED,
        FAILED,
        EXPIRED
    }

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Enumerated(EnumType.STRING)
    @Column(name = "recommendation_type", nullable = false, length = 32)
    private Type type;

    /**
     * 目标资源，如 domain:philosophy 或 record:42
     */
    @Column(name = "target", nullable = false, length = 120)
    private String target;

    @Column(name = "target_domain", length = 50)
    private String targetDomain;

    @Enumerated(EnumType.STRING)
    @Column(name = "target_strategy", length = 32)
    private StorageStrategy targetStrategy;

    @Column(name = "title", nullable = false, length = 255)
    private String title;

    @Column(name = "description", nullable = false, length = 2000)
    private String description;

    @Column(name = "estimated_improvement_percent")
    private double estimatedImprovement;

    @Column(name = "confidence_score")
    private double confidence;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private Status status;

    @Column(name = "status_reason", length = 1000)
    private String statusReason;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "resolved_at")
    private LocalDateTime resolvedAt;

    public boolean isPending() {
        return status == Status.PENDING;
    }
}
