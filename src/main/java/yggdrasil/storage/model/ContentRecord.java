package yggdrasil.storage.model;

import jakarta.persistence.*;
import lombok.Data;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.UpdateTimestamp;
import org.hibernate.type.SqlTypes;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Map;

/**
 * 内容记录实体
 * 每个来源地址恰好一条，创建一次、多次更新、从不重复
 */
@Data
@Entity
@Table(name = "content_records",
    uniqueConstraints = @UniqueConstraint(name = "uk_content_records_locator", columnNames = "source_locator"),
    indexes = {
        @Index(name = "idx_content_records_domain", columnList = "domain"),
        @Index(name = "idx_content_records_strategy", columnList = "strategy"),
        @Index(name = "idx_content_records_status", columnList = "status"),
        @Index(name = "idx_content_records_created", columnList = "created_at")
    })
public class ContentRecord {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "source_locator", nullable = false, length = 1024)
    private String sourceLocator;

    @Column(name = "title", nullable = false, length = 512)
    private String title;

    @Column(name = "author", length = 255)
    private String author;

    @Column(name = "domain", nullable = false, length = 50)
    private String domain;

    @Column(name = "content_type", nullable = false, length = 50)
    private String contentType;

    @Column(name = "language", length = 10)
    private String language;

    @Column(name = "declared_size", nullable = false)
    private long declaredSize;

    @Column(name = "word_count")
    private Integer wordCount;

    @Column(name = "character_count")
    private Integer characterCount;

    /**
     * 前 1000 字符预览，参与全文排序
     */
    @Column(name = "content_preview", columnDefinition = "TEXT")
    private String contentPreview;

    @Column(name = "semantic_complexity")
    private double semanticComplexity;

    @Column(name = "topic_coherence")
    private double topicCoherence;

    @Column(name = "information_density")
    private double informationDensity;

    @Column(name = "query_potential")
    private double queryPotential;

    @Enumerated(EnumType.STRING)
    @Column(name = "strategy", nullable = false, length = 32)
    private StorageStrategy strategy;

    @Column(name = "policy_version", nullable = false)
    private int policyVersion;

    @Column(name = "confidence_score")
    private double confidenceScore;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private RecordStatus status;

    @Embedded
    private StorageLocation location = new StorageLocation();

    @Column(name = "content_hash", length = 64)
    private String contentHash;

    @Column(name = "manual_review", nullable = false)
    private boolean manualReview;

    // 访问统计（宽松并发更新）
    @Column(name = "query_count", nullable = false)
    private long queryCount;

    @Column(name = "last_queried_at")
    private LocalDateTime lastQueriedAt;

    @Column(name = "access_frequency")
    private double accessFrequency;

    // 重复抓取统计
    @Column(name = "scrape_count", nullable = false)
    private int scrapeCount;

    @Column(name = "last_scraped_at")
    private LocalDateTime lastScrapedAt;

    @Column(name = "last_seen_hash", length = 64)
    private String lastSeenHash;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "metadata")
    private Map<String, Object> metadata;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "tags")
    private List<String> tags;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "keywords")
    private List<String> keywords;

    @Version
    @Column(name = "version")
    private long version;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    /**
     * 所有列为空时 Hibernate 会把嵌入对象加载为 null
     */
    public StorageLocation getLocation() {
        if (location == null) {
            location = new StorageLocation();
        }
        return location;
    }

    public boolean isReady() {
        return status == RecordStatus.READY;
    }

    public boolean isQueryable() {
        return status == RecordStatus.READY
            || status == RecordStatus.DEGRADED
            || status == RecordStatus.MIGRATING;
    }
}
