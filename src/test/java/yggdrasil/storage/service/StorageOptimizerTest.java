package yggdrasil.storage.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mockito;
import yggdrasil.storage.config.StorageProperties;
import yggdrasil.storage.dto.DomainLatencyView;
import yggdrasil.storage.model.ContentRecord;
import yggdrasil.storage.model.OptimizationRecommendation;
import yggdrasil.storage.model.RecordStatus;
import yggdrasil.storage.model.StorageStrategy;
import yggdrasil.storage.repository.ContentRecordRepository;

import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class StorageOptimizerTest {

    private PerformanceTracker performanceTracker;
    private RecommendationService recommendationService;
    private ContentRecordRepository recordRepository;
    private StorageProperties properties;
    private StorageOptimizer optimizer;

    @BeforeEach
    public void setUp() {
        performanceTracker = Mockito.mock(PerformanceTracker.class);
        recommendationService = Mockito.mock(RecommendationService.class);
        recordRepository = Mockito.mock(ContentRecordRepository.class);
        properties = new StorageProperties();
        optimizer = new StorageOptimizer(performanceTracker, recommendationService, recordRepository,
            new PlacementPolicy(properties), properties);

        when(performanceTracker.slowDomains(any(LocalDateTime.class))).thenReturn(List.of());
        when(recordRepository.findOversized(any(), anyLong(), any(), any())).thenReturn(List.of());
        when(recordRepository.findByPolicyVersionLessThanAndStatusOrderByIdAsc(anyInt(), any(), any()))
            .thenReturn(List.of());
        when(recommendationService.propose(any(OptimizationRecommendation.class))).thenAnswer(invocation -> {
            OptimizationRecommendation candidate = invocation.getArgument(0);
            candidate.setStatus(OptimizationRecommendation.Status.PENDING);
            return candidate;
        });
    }

    private static DomainLatencyView latency(String domain, double avg, long samples) {
        DomainLatencyView view = Mockito.mock(DomainLatencyView.class);
        when(view.getDomain()).thenReturn(domain);
        when(view.getAvgLatencyMs()).thenReturn(avg);
        when(view.getSampleCount()).thenReturn(samples);
        return view;
    }

    private static ContentRecord record(Long id, StorageStrategy strategy, long size, String domain, int policyVersion) {
        ContentRecord record = new ContentRecord();
        record.setId(id);
        record.setStrategy(strategy);
        record.setDeclaredSize(size);
        record.setDomain(domain);
        record.setPolicyVersion(policyVersion);
        record.setStatus(RecordStatus.READY);
        record.setSemanticComplexity(0.4);
        record.setTopicCoherence(0.5);
        record.setInformationDensity(0.5);
        record.setQueryPotential(0.5);
        record.setWordCount(1000);
        record.setCharacterCount(6000);
        record.setKeywords(List.of());
        return record;
    }

    @Test
    public void slowDomainYieldsIndexRecommendation() {
        DomainLatencyView slow = latency("philosophy", 180.0, 120L);
        when(performanceTracker.slowDomains(any(LocalDateTime.class))).thenReturn(List.of(slow));

        int created = optimizer.analyze();

        assertThat(created).isEqualTo(1);
        ArgumentCaptor<OptimizationRecommendation> captor = ArgumentCaptor.forClass(OptimizationRecommendation.class);
        verify(recommendationService).propose(captor.capture());
        OptimizationRecommendation proposed = captor.getValue();
        assertThat(proposed.getType()).isEqualTo(OptimizationRecommendation.Type.ADD_INDEX);
        assertThat(proposed.getTarget()).isEqualTo("domain:philosophy");
        assertThat(proposed.getTitle()).isEqualTo("Add index for philosophy domain queries");
        assertThat(proposed.getDescription()).contains("180.0ms").contains("120 samples");
        assertThat(proposed.getEstimatedImprovement()).isEqualTo(StorageOptimizer.INDEX_IMPROVEMENT);
        assertThat(proposed.getConfidence()).isEqualTo(StorageOptimizer.INDEX_CONFIDENCE);
        verify(recommendationService).expireStale();
    }

    @Test
    public void oversizedFullStoreRecordYieldsVectorMigration() {
        ContentRecord big = record(42L, StorageStrategy.FULL_STORE, 20_000_000L, "history", 1);
        when(recordRepository.findOversized(eq(StorageStrategy.FULL_STORE), eq(10_000_000L), eq(RecordStatus.READY), any()))
            .thenReturn(List.of(big));

        int created = optimizer.analyze();

        assertThat(created).isEqualTo(1);
        ArgumentCaptor<OptimizationRecommendation> captor = ArgumentCaptor.forClass(OptimizationRecommendation.class);
        verify(recommendationService).propose(captor.capture());
        OptimizationRecommendation proposed = captor.getValue();
        assertThat(proposed.getType()).isEqualTo(OptimizationRecommendation.Type.MIGRATE_STRATEGY);
        assertThat(proposed.getTarget()).isEqualTo("record:42");
        assertThat(proposed.getTargetStrategy()).isEqualTo(StorageStrategy.VECTOR_STORE);
        assertThat(proposed.getConfidence()).isEqualTo(StorageOptimizer.OVERSIZED_CONFIDENCE);
    }

    @Test
    public void alreadyPendingRecommendationIsNotCountedAgain() {
        DomainLatencyView slow = latency("science", 150.0, 60L);
        when(performanceTracker.slowDomains(any(LocalDateTime.class))).thenReturn(List.of(slow));
        OptimizationRecommendation existing = new OptimizationRecommendation();
        existing.setStatus(OptimizationRecommendation.Status.PENDING);
        when(recommendationService.propose(any(OptimizationRecommendation.class))).thenReturn(existing);

        assertThat(optimizer.analyze()).isZero();
    }

    @Test
    public void policyDriftProposesReplacementButSkipsMetadataOnly() {
        properties.getPlacement().setVersion(2);
        ContentRecord drifted = record(7L, StorageStrategy.FULL_STORE, 60_000_000L, "literature", 1);
        ContentRecord metadataOnly = record(8L, StorageStrategy.METADATA_ONLY, 60_000_000L, "literature", 1);
        when(recordRepository.findByPolicyVersionLessThanAndStatusOrderByIdAsc(eq(2), eq(RecordStatus.READY), any()))
            .thenReturn(List.of(drifted, metadataOnly));

        int created = optimizer.analyze();

        assertThat(created).isEqualTo(1);
        ArgumentCaptor<OptimizationRecommendation> captor = ArgumentCaptor.forClass(OptimizationRecommendation.class);
        verify(recommendationService, times(1)).propose(captor.capture());
        OptimizationRecommendation proposed = captor.getValue();
        assertThat(proposed.getTarget()).isEqualTo("record:7");
        assertThat(proposed.getTargetStrategy()).isEqualTo(StorageStrategy.VECTOR_STORE);
        assertThat(proposed.getTitle()).isEqualTo("Re-place record under policy v2");
    }

    @Test
    public void recordAlreadyOnChosenStrategyIsLeftAlone() {
        properties.getPlacement().setVersion(2);
        ContentRecord placed = record(9L, StorageStrategy.VECTOR_STORE, 60_000_000L, "literature", 1);
        when(recordRepository.findByPolicyVersionLessThanAndStatusOrderByIdAsc(eq(2), eq(RecordStatus.READY), any()))
            .thenReturn(List.of(placed));

        assertThat(optimizer.analyze()).isZero();
        verify(recommendationService, never()).propose(any());
    }
}
