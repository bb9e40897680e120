package yggdrasil.storage.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import yggdrasil.storage.model.StorageStrategy;

/**
 * 排序后的检索结果
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RankedMatch {

    private Long recordId;

    /** 合并得分 */
    private double score;

    /** 归一化后的全文分 */
    private double textScore;

    /** 归一化后的向量分 */
    private double vectorScore;

    private String title;
    private String domain;
    private String contentType;
    private String sourceLocator;
    private StorageStrategy strategy;
    private String preview;

    public RankedMatch(Long recordId, double score, double textScore, double vectorScore) {
        this.recordId = recordId;
        this.score = score;
        this.textScore = textScore;
        this.vectorScore = vectorScore;
    }
}
