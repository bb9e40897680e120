package yggdrasil.storage.dto;

import lombok.Builder;
import lombok.Value;

import java.util.List;

/**
 * 内容画像
 * 四项分数均在 [0, 1]
 */
@Value
@Builder
public class ContentProfile {

    double semanticComplexity;

    double topicCoherence;

    double informationDensity;

    double queryPotential;

    int wordCount;

    int characterCount;

    List<String> keywords;
}
