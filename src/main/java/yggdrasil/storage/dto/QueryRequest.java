package yggdrasil.storage.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;

/**
 * 检索请求
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class QueryRequest {

    private String text;

    private QueryFilter filter;

    /** 语义开关：null 混合检索，true 仅向量，false 仅全文 */
    private Boolean semantic;

    /** 全文权重，为空使用配置值 */
    private Double alpha;

    private Integer limit;

    private Integer offset;

    /** 整体截止时间，为空使用配置值 */
    private Duration deadline;
}
