package yggdrasil.storage.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import yggdrasil.storage.model.RecordStatus;
import yggdrasil.storage.model.StorageLeg;
import yggdrasil.storage.model.StorageStrategy;

import java.util.Set;

/**
 * 摄取结果
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class IngestResult {

    private Long recordId;

    /** false 表示来源地址已存在，仅合并了抓取统计 */
    private boolean created;

    private StorageStrategy strategy;

    private RecordStatus status;

    private double confidence;

    /** 重试耗尽后仍失败、已转入补写的分支 */
    private Set<StorageLeg> failedLegs;
}
