package yggdrasil.storage.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 向量召回的单个分块命中
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class VectorHit {

    private Long recordId;
    private String generation;
    private Integer chunkSequence;
    private double score;
}
