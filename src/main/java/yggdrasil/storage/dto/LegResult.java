package yggdrasil.storage.dto;

import lombok.Value;
import yggdrasil.storage.model.StorageLeg;

/**
 * 单个存储分支的写入结果
 */
@Value
public class LegResult {

    StorageLeg leg;

    boolean success;

    Long fullBlobId;

    String vectorCollection;

    String vectorGeneration;

    Integer vectorChunkCount;

    String specializedTable;

    String error;

    public static LegResult full(Long blobId) {
        return new LegResult(StorageLeg.FULL, true, blobId, null, null, null, null, null);
    }

    public static LegResult vector(String collection, String generation, int chunkCount) {
        return new LegResult(StorageLeg.VECTOR, true, null, collection, generation, chunkCount, null, null);
    }

    public static LegResult specialized(String tableName) {
        return new LegResult(StorageLeg.SPECIALIZED, true, null, null, null, null, tableName, null);
    }

    public static LegResult failed(StorageLeg leg, String error) {
        return new LegResult(leg, false, null, null, null, null, null, error);
    }
}
