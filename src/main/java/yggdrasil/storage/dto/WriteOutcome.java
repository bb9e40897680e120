package yggdrasil.storage.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import yggdrasil.storage.model.StorageLeg;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * 一次多分支写入的汇总结果
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class WriteOutcome {

    private List<LegResult> legs = new ArrayList<>();

    public void add(LegResult result) {
        legs.add(result);
    }

    public List<LegResult> succeeded() {
        List<LegResult> result = new ArrayList<>();
        for (LegResult leg : legs) {
            if (leg.isSuccess()) {
                result.add(leg);
            }
        }
        return result;
    }

    public Set<StorageLeg> failedLegs() {
        Set<StorageLeg> failed = EnumSet.noneOf(StorageLeg.class);
        for (LegResult leg : legs) {
            if (!leg.isSuccess()) {
                failed.add(leg.getLeg());
            }
        }
        return failed;
    }

    /**
     * 指定分支的失败原因，未失败时返回 null
     */
    public String errorFor(StorageLeg leg) {
        for (LegResult result : legs) {
            if (result.getLeg() == leg && !result.isSuccess()) {
                return result.getError();
            }
        }
        return null;
    }

    public boolean allSucceeded() {
        return failedLegs().isEmpty();
    }
}
