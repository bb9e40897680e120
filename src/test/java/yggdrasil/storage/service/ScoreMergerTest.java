package yggdrasil.storage.service;

import org.junit.jupiter.api.Test;
import yggdrasil.storage.dto.RankedMatch;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

public class ScoreMergerTest {

    private final ScoreMerger merger = new ScoreMerger();

    @Test
    public void mergesNormalizedScoresWithAlpha() {
        List<RankedMatch> merged = merger.merge(
            Map.of(1L, 2.0, 3L, 1.6),
            Map.of(2L, 0.9, 3L, 0.95),
            0.5);

        assertThat(merged).extracting(RankedMatch::getRecordId).containsExactly(3L, 1L, 2L);
        assertThat(merged.get(0).getScore()).isCloseTo(0.9, within(1e-9));
        assertThat(merged.get(1).getScore()).isCloseTo(0.5, within(1e-9));
        assertThat(merged.get(2).getTextScore()).isZero();
    }

    @Test
    public void tiesAreOrderedByRecordId() {
        List<RankedMatch> merged = merger.merge(Map.of(9L, 1.0, 4L, 1.0), Map.of(), 1.0);

        assertThat(merged).extracting(RankedMatch::getRecordId).containsExactly(4L, 9L);
    }

    @Test
    public void alphaOneIgnoresVectorSide() {
        List<RankedMatch> merged = merger.merge(Map.of(1L, 0.5), Map.of(2L, 0.99), 1.0);

        assertThat(merged).extracting(RankedMatch::getRecordId).containsExactly(1L, 2L);
        assertThat(merged.get(1).getScore()).isZero();
    }

    @Test
    public void emptyInputsYieldNoMatches() {
        assertThat(merger.merge(Map.of(), Map.of(), 0.5)).isEmpty();
    }
}
