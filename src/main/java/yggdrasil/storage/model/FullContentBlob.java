package yggdrasil.storage.model;

import jakarta.persistence.*;
import lombok.Data;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 全文内容
 * 以内容哈希去重，同一哈希只保存一份
 */
@Data
@Entity
@Table(name = "full_content_blobs",
    uniqueConstraints = @UniqueConstraint(name = "uk_full_content_hash", columnNames = "content_hash"))
public class FullContentBlob {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "content_hash", nullable = false, length = 64)
    private String contentHash;

    @Column(name = "full_content", nullable = false, columnDefinition = "TEXT")
    private String fullContent;

    /**
     * 书籍等结构化内容的分块
     */
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "chunked_content")
    private List<String> chunkedContent;

    @Column(name = "owner_record_id")
    private Long ownerRecordId;

    /**
     * 最近一次被写入方认领的时间，回收时在宽限期内被认领过的 blob 不删除
     */
    @Column(name = "last_claimed_at")
    private LocalDateTime lastClaimedAt;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;

    public boolean claimedAfter(LocalDateTime cutoff) {
        return lastClaimedAt != null && lastClaimedAt.isAfter(cutoff);
    }

    public boolean matchesHash(String expectedHash) {
        return contentHash != null && contentHash.equals(expectedHash);
    }
}
