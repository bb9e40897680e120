package yggdrasil.storage.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import yggdrasil.storage.model.QueryMode;

import java.util.List;

/**
 * 检索响应
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class QueryResponse {

    private List<RankedMatch> results;

    /** 任一子查询超时或失败时为 true */
    private boolean partial;

    private QueryMode mode;

    private long latencyMs;

    /** 未返回结果的子查询，如 text、vector */
    private List<String> failedSides;
}
