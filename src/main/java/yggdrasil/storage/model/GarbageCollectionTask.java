package yggdrasil.storage.model;

import jakarta.persistence.*;
import lombok.Data;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;

/**
 * 迁移后被替换的旧位置，宽限期过后回收
 */
@Data
@Entity
@Table(name = "location_gc_tasks",
    indexes = @Index(name = "idx_location_gc_due", columnList = "status, due_at"))
public class GarbageCollectionTask {

    public enum Kind {
        FULL_BLOB,
        VECTOR_GENERATION,
        SPECIALIZED_ROW
    }

    public enum Status {
        PENDING,
        DONE,
        FAILED
    }

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "record_id", nullable = false)
    private Long recordId;

    @Enumerated(EnumType.STRING)
    @Column(name = "kind", nullable = false, length = 32)
    private Kind kind;

    /**
     * blob id、向量 generation 或专用表名
     */
    @Column(name = "reference", nullable = false, length = 120)
    private String reference;

    @Column(name = "due_at", nullable = false)
    private LocalDateTime dueAt;

    @Column(name = "attempts", nullable = false)
    private int attempts;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private Status status;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;
}
