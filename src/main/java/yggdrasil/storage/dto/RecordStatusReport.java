package yggdrasil.storage.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import yggdrasil.storage.model.RecordStatus;
import yggdrasil.storage.model.StorageLocation;
import yggdrasil.storage.model.StorageStrategy;

import java.util.List;

/**
 * 单条记录的运维视图
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RecordStatusReport {

    private Long recordId;
    private String sourceLocator;
    private StorageStrategy strategy;
    private int policyVersion;
    private double confidence;
    private RecordStatus status;
    private boolean manualReview;
    private StorageLocation location;
    /** 未完成的补写分支及其尝试次数，如 VECTOR x2 */
    private List<String> pendingRepairs;
}
