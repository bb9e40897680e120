package yggdrasil.storage.dto;

import lombok.Value;
import yggdrasil.storage.model.StorageStrategy;

import java.util.List;

/**
 * 放置决策
 */
@Value
public class PlacementDecision {

    StorageStrategy strategy;

    double confidence;

    int policyVersion;

    /** 命中的规则说明 */
    List<String> reasons;
}
