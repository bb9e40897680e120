package yggdrasil.storage.model;

import jakarta.persistence.*;
import lombok.Data;

import java.time.LocalDateTime;

/**
 * 查询性能采样，只追加，仅由保留期清理删除
 */
@Data
@Entity
@Table(name = "query_performance",
    indexes = {
        @Index(name = "idx_query_performance_domain", columnList = "target_domain, executed_at"),
        @Index(name = "idx_query_performance_signature", columnList = "query_signature")
    })
public class PerformanceSample {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "query_signature", nullable = false, length = 64)
    private String querySignature;

    @Enumerated(EnumType.STRING)
    @Column(name = "query_mode", nullable = false, length = 16)
    private QueryMode queryMode;

    @Enumerated(EnumType.STRING)
    @Column(name = "strategy_involved", length = 32)
    private StorageStrategy strategyInvolved;

    @Column(name = "target_domain", length = 50)
    private String targetDomain;

    @Column(name = "latency_ms", nullable = false)
    private double latencyMs;

    @Column(name = "rows_returned")
    private int rowsReturned;

    @Column(name = "partial_result")
    private boolean partial;

    @Column(name = "executed_at", nullable = false)
    private LocalDateTime executedAt;
}
