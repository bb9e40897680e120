package yggdrasil.storage.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * 摄取请求
 * domain、contentType 为空时由分类器推断；declaredSize 为空时按正文 UTF-8 字节数计算
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class IngestRequest {

    /** 来源地址，作为记录的唯一标识 */
    private String sourceLocator;

    private String title;

    private String author;

    private String domain;

    private String contentType;

    private String language;

    /** 声明大小（字节） */
    private Long declaredSize;

    /** 正文 */
    private String content;

    private Map<String, Object> metadata;

    private List<String> tags;
}
