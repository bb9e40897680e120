package yggdrasil.storage.model;

import jakarta.persistence.*;
import lombok.Data;
import org.hibernate.annotations.CreationTimestamp;

import java.time.LocalDateTime;

/**
 * 向量点映射
 * 与完成标记在同一事务写入，按 chunkSequence 排序
 */
@Data
@Entity
@Table(name = "vector_mappings",
    uniqueConstraints = @UniqueConstraint(name = "uk_vector_mapping_point", columnNames = {"collection_name", "point_id"}),
    indexes = {
        @Index(name = "idx_vector_mapping_record", columnList = "record_id"),
        @Index(name = "idx_vector_mapping_generation", columnList = "generation")
    })
public class VectorMapping {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "record_id", nullable = false)
    private Long recordId;

    @Column(name = "collection_name", nullable = false, length = 100)
    private String collectionName;

    @Column(name = "point_id", nullable = false, length = 100)
    private String pointId;

    @Column(name = "generation", nullable = false, length = 64)
    private String generation;

    @Column(name = "vector_dimensions", nullable = false)
    private int vectorDimensions;

    @Column(name = "embedding_model", length = 100)
    private String embeddingModel;

    @Column(name = "chunk_sequence", nullable = false)
    private int chunkSequence;

    @Column(name = "word_count")
    private int wordCount;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;
}
