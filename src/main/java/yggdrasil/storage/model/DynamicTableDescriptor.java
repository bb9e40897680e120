package yggdrasil.storage.model;

import jakarta.persistence.*;
import lombok.Data;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.UpdateTimestamp;
import org.hibernate.type.SqlTypes;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 专用表描述符
 * 声明式生成的表结构与索引定义，独立版本化
 */
@Data
@Entity
@Table(name = "dynamic_tables",
    uniqueConstraints = @UniqueConstraint(name = "uk_dynamic_table_name", columnNames = "table_name"),
    indexes = @Index(name = "idx_dynamic_tables_domain", columnList = "domain, content_type"))
public class DynamicTableDescriptor {

    public enum Status {
        DECLARED,
        APPLIED,
        FAILED
    }

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "table_name", nullable = false, length = 100)
    private String tableName;

    @Column(name = "domain", nullable = false, length = 50)
    private String domain;

    @Column(name = "content_type", nullable = false, length = 50)
    private String contentType;

    @Column(name = "schema_version", nullable = false)
    private int schemaVersion;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "schema_definition")
    private List<String> schemaDefinition;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "indexes_definition")
    private List<String> indexesDefinition;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private Status status;

    @Column(name = "estimated_rows")
    private long estimatedRows;

    @Column(name = "query_count")
    private long queryCount;

    @Column(name = "last_error", length = 1000)
    private String lastError;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    public boolean isApplied() {
        return status == Status.APPLIED;
    }
}
