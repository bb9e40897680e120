package yggdrasil.storage.model;

import jakarta.persistence.*;
import lombok.Data;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.UpdateTimestamp;
import org.hibernate.type.SqlTypes;

import java.time.LocalDateTime;
import java.util.Map;

/**
 * 分析代理的标注结果
 * 独立于内容记录存放，代理无法触及位置指针
 */
@Data
@Entity
@Table(name = "content_annotations",
    uniqueConstraints = @UniqueConstraint(name = "uk_annotation_agent", columnNames = {"record_id", "agent"}))
public class ContentAnnotation {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "record_id", nullable = false)
    private Long recordId;

    @Column(name = "agent", nullable = false, length = 64)
    private String agent;

    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "payload")
    private Map<String, Object> payload;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private LocalDateTime updatedAt;
}
