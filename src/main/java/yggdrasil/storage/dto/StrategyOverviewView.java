package yggdrasil.storage.dto;

import yggdrasil.storage.model.StorageStrategy;

/**
 * 存储策略概览行
 */
public interface StrategyOverviewView {

    StorageStrategy getStrategy();

    String getDomain();

    Long getRecordCount();

    Long getTotalSize();

    Double getAvgConfidence();
}
