package yggdrasil.storage.model;

import jakarta.persistence.*;
import lombok.Data;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;

/**
 * 一组暂存向量分块
 * 状态从 STAGING 变为 COMMITTED 的那一次写入即完成标记
 */
@Data
@Entity
@Table(name = "vector_write_batches",
    uniqueConstraints = @UniqueConstraint(name = "uk_vector_batch_generation", columnNames = "generation"),
    indexes = @Index(name = "idx_vector_batch_status", columnList = "status, created_at"))
public class VectorWriteBatch {

    public enum Status {
        STAGING,
        COMMITTED,
        SWEPT
    }

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "generation", nullable = false, length = 64)
    private String generation;

    @Column(name = "record_id", nullable = false)
    private Long recordId;

    @Column(name = "collection_name", nullable = false, length = 100)
    private String collectionName;

    @Column(name = "expected_chunks", nullable = false)
    private int expectedChunks;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private Status status;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "committed_at")
    private LocalDateTime committedAt;

    public boolean isCommitted() {
        return status == Status.COMMITTED;
    }
}
