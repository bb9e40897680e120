package yggdrasil.storage.model;

import jakarta.persistence.Column;
import jakarta.persistence.Embeddable;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * 逻辑记录到物理位置的指针
 *
 * <p>仅由 ConsistencyMapper 更新。metadata_only 记录的位置即来源地址本身。</p>
 */
@Data
@NoArgsConstructor
@Embeddable
public class StorageLocation {

    @Column(name = "full_blob_id")
    private Long fullBlobId;

    @Column(name = "vector_collection", length = 100)
    private String vectorCollection;

    @Column(name = "vector_generation", length = 64)
    private String vectorGeneration;

    @Column(name = "vector_chunk_count")
    private Integer vectorChunkCount;

    @Column(name = "specialized_table", length = 100)
    private String specializedTable;

    public StorageLocation(StorageLocation other) {
        this.fullBlobId = other.fullBlobId;
        this.vectorCollection = other.vectorCollection;
        this.vectorGeneration = other.vectorGeneration;
        this.vectorChunkCount = other.vectorChunkCount;
        this.specializedTable = other.specializedTable;
    }

    public boolean hasLeg(StorageLeg leg) {
        switch (leg) {
            case FULL:
                return fullBlobId != null;
            case VECTOR:
                return vectorGeneration != null;
            case SPECIALIZED:
                return specializedTable != null;
            default:
                return false;
        }
    }

    /**
     * 是否覆盖策略要求的全部分支
     */
    public boolean covers(StorageStrategy strategy) {
        for (StorageLeg leg : strategy.requiredLegs()) {
            if (!hasLeg(leg)) {
                return false;
            }
        }
        return true;
    }

    public boolean isEmpty() {
        return fullBlobId == null && vectorGeneration == null && specializedTable == null;
    }
}
