package yggdrasil.storage.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * 内容的存储放置策略
 *
 * <p>storageCost 为相对存储成本，阈值处平局时取成本较低者。</p>
 */
public enum StorageStrategy {

    /** 仅保留元数据与原始来源指针，不复制内容 */
    METADATA_ONLY("metadata_only", 0),

    /** 全文存入关系库 */
    FULL_STORE("full_store", 1),

    /** 分块向量化存入向量库 */
    VECTOR_STORE("vector_store", 2),

    /** 按领域生成的专用表 */
    SPECIALIZED_TABLE("specialized_table", 3),

    /** 全文与向量双写 */
    HYBRID("hybrid", 4);

    private final String value;
    private final int storageCost;

    StorageStrategy(String value, int storageCost) {
        this.value = value;
        this.storageCost = storageCost;
    }

    public String value() {
        return value;
    }

    public int storageCost() {
        return storageCost;
    }

    /**
     * 该策略需要写入的存储分支
     */
    public Set<StorageLeg> requiredLegs() {
        switch (this) {
            case FULL_STORE:
                return EnumSet.of(StorageLeg.FULL);
            case VECTOR_STORE:
                return EnumSet.of(StorageLeg.VECTOR);
            case SPECIALIZED_TABLE:
                return EnumSet.of(StorageLeg.SPECIALIZED);
            case HYBRID:
                return EnumSet.of(StorageLeg.FULL, StorageLeg.VECTOR);
            default:
                return EnumSet.noneOf(StorageLeg.class);
        }
    }

    public static StorageStrategy cheaper(StorageStrategy left, StorageStrategy right) {
        return left.storageCost <= right.storageCost ? left : right;
    }

    public static StorageStrategy fromValue(String value) {
        for (StorageStrategy strategy : values()) {
            if (strategy.value.equalsIgnoreCase(value) || strategy.name().equalsIgnoreCase(value)) {
                return strategy;
            }
        }
        throw new IllegalArgumentException("未知存储策略: " + value);
    }
}
