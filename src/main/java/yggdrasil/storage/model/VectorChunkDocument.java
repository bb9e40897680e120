package yggdrasil.storage.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 向量库中的分块文档
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class VectorChunkDocument {

    /** 点 ID：generation:序号 */
    @JsonProperty("point_id")
    private String pointId;

    @JsonProperty("content_record_id")
    private Long contentRecordId;

    @JsonProperty("chunk_sequence")
    private Integer chunkSequence;

    @JsonProperty("word_count")
    private Integer wordCount;

    @JsonProperty("domain")
    private String domain;

    @JsonProperty("content_type")
    private String contentType;

    @JsonProperty("generation")
    private String generation;

    /** 记录创建时间（epoch 毫秒），用于时间范围预过滤 */
    @JsonProperty("created_at")
    private Long createdAt;

    @JsonProperty("text")
    private String text;

    @JsonProperty("embedding")
    private float[] embedding;

    public static String pointId(String generation, int sequence) {
        return generation + ":" + sequence;
    }
}
