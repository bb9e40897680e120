package yggdrasil.storage.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import yggdrasil.storage.model.RecordStatus;

import java.util.List;
import java.util.Map;

/**
 * 存储健康报告
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class HealthReport {

    private Map<RecordStatus, Long> recordsByStatus;
    private long manualReviewRecords;
    private long pendingRepairs;
    private long manualReviewRepairs;
    private long stagedVectorBatches;
    private long pendingRecommendations;
    private List<StrategyOverviewView> strategyOverview;
}
