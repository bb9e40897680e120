package yggdrasil.storage.dto;

import lombok.Builder;
import lombok.Value;

/**
 * 分类器输入
 */
@Value
@Builder
public class ClassificationInput {

    String text;

    long declaredSize;

    /** 已确定的领域，用于领域先验 */
    String domain;

    String contentType;
}
