package yggdrasil.storage.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * 检索过滤条件
 * 同时下推到全文 SQL 和向量预过滤
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class QueryFilter {

    private String domain;
    private String contentType;
    /** 创建时间下界（含） */
    private LocalDateTime createdFrom;
    /** 创建时间上界（不含） */
    private LocalDateTime createdTo;

    public static QueryFilter none() {
        return new QueryFilter();
    }

    public static QueryFilter forDomain(String domain) {
        QueryFilter filter = new QueryFilter();
        filter.setDomain(domain);
        return filter;
    }

    public boolean isEmpty() {
        return isBlank(domain) && isBlank(contentType) && createdFrom == null && createdTo == null;
    }

    private boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
