package yggdrasil.storage.service;

import org.junit.jupiter.api.Test;
import yggdrasil.storage.config.StorageProperties;
import yggdrasil.storage.dto.ContentProfile;
import yggdrasil.storage.dto.PlacementDecision;
import yggdrasil.storage.model.StorageStrategy;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

public class PlacementPolicyTest {

    private final StorageProperties properties = new StorageProperties();
    private final PlacementPolicy policy = new PlacementPolicy(properties);

    private static ContentProfile profile(double complexity, double potential) {
        return ContentProfile.builder()
            .semanticComplexity(complexity)
            .topicCoherence(0.5)
            .informationDensity(0.5)
            .queryPotential(potential)
            .wordCount(100)
            .characterCount(600)
            .keywords(List.of())
            .build();
    }

    @Test
    public void smallTechnologyArticleGoesToFullStore() {
        PlacementDecision decision = policy.decide(10 * 1024L, profile(0.4, 0.5), "technology", 1);

        assertThat(decision.getStrategy()).isEqualTo(StorageStrategy.FULL_STORE);
        assertThat(decision.getConfidence()).isBetween(0.7, 0.99);
        assertThat(decision.getPolicyVersion()).isEqualTo(1);
    }

    @Test
    public void largeLiteratureBookGoesToVectorStore() {
        PlacementDecision decision = policy.decide(60L * 1024 * 1024, profile(0.9, 0.9), "literature", 1);

        assertThat(decision.getStrategy()).isEqualTo(StorageStrategy.VECTOR_STORE);
    }

    @Test
    public void richMiddleBandContentIsHybrid() {
        PlacementDecision decision = policy.decide(500_000L, profile(0.9, 0.95), "general", 1);

        assertThat(decision.getStrategy()).isEqualTo(StorageStrategy.HYBRID);
    }

    @Test
    public void highValueDomainAboveMediumIsHybrid() {
        PlacementDecision decision = policy.decide(5_000_000L, profile(0.2, 0.2), "philosophy", 1);

        assertThat(decision.getStrategy()).isEqualTo(StorageStrategy.HYBRID);
    }

    @Test
    public void plainMiddleBandContentKeepsMetadataOnly() {
        PlacementDecision decision = policy.decide(500_000L, profile(0.2, 0.2), "general", 1);

        assertThat(decision.getStrategy()).isEqualTo(StorageStrategy.METADATA_ONLY);
    }

    @Test
    public void exactThresholdPicksCheaperStrategyWithMinimumConfidence() {
        long small = properties.getPlacement().getSizeSmall();

        PlacementDecision decision = policy.decide(small, profile(0.2, 0.2), "general", 1);

        assertThat(decision.getStrategy()).isEqualTo(StorageStrategy.METADATA_ONLY);
        assertThat(decision.getConfidence()).isEqualTo(properties.getPlacement().getMinConfidence());
    }

    @Test
    public void exactLargeThresholdPrefersCheaperOfVectorAndHybrid() {
        long large = properties.getPlacement().getSizeLarge();

        PlacementDecision decision = policy.decide(large, profile(0.9, 0.95), "general", 1);

        assertThat(decision.getStrategy()).isEqualTo(StorageStrategy.VECTOR_STORE);
    }

    @Test
    public void confidenceGrowsWithDistanceFromThreshold() {
        PlacementDecision near = policy.decide(45_000L, profile(0.2, 0.2), "general", 1);
        PlacementDecision far = policy.decide(1_000L, profile(0.2, 0.2), "general", 1);

        assertThat(near.getStrategy()).isEqualTo(StorageStrategy.FULL_STORE);
        assertThat(far.getConfidence()).isGreaterThan(near.getConfidence());
    }

    @Test
    public void domainOverrideWinsOverSizeRules() {
        properties.getPlacement().getDomainOverrides().put("legal", StorageStrategy.SPECIALIZED_TABLE);

        PlacementDecision decision = policy.decide(1_000L, profile(0.2, 0.2), "Legal", 1);

        assertThat(decision.getStrategy()).isEqualTo(StorageStrategy.SPECIALIZED_TABLE);
        assertThat(decision.getConfidence()).isEqualTo(properties.getPlacement().getOverrideConfidence());
    }

    @Test
    public void decisionIsDeterministic() {
        ContentProfile profile = profile(0.75, 0.85);

        PlacementDecision first = policy.decide(300_000L, profile, "science", 1);
        PlacementDecision second = policy.decide(300_000L, profile, "science", 1);

        assertThat(second).isEqualTo(first);
    }
}
