package yggdrasil.storage.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import yggdrasil.storage.model.StorageStrategy;

/**
 * 迁移结果
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class MigrationResult {

    public enum Outcome {
        SWAPPED,
        UNCHANGED,
        FAILED,
        CANCELLED
    }

    private Long recordId;
    private StorageStrategy fromStrategy;
    private StorageStrategy toStrategy;
    private Outcome outcome;
    private String message;

    public boolean isSwapped() {
        return outcome == Outcome.SWAPPED;
    }
}
