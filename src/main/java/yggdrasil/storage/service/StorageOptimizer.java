package yggdrasil.storage.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.PageRequest;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import yggdrasil.storage.config.StorageProperties;
import yggdrasil.storage.dto.ContentProfile;
import yggdrasil.storage.dto.DomainLatencyView;
import yggdrasil.storage.dto.PlacementDecision;
import yggdrasil.storage.model.ContentRecord;
import yggdrasil.storage.model.OptimizationRecommendation;
import yggdrasil.storage.model.RecordStatus;
import yggdrasil.storage.model.StorageStrategy;
import yggdrasil.storage.repository.ContentRecordRepository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * 存储优化分析
 * 根据慢查询、超大全文记录和放置策略漂移生成建议，只写建议不改数据
 */
@Service
public class StorageOptimizer {

    private static final Logger log = LoggerFactory.getLogger(StorageOptimizer.class);

    static final double INDEX_IMPROVEMENT = 25.0;
    static final double INDEX_CONFIDENCE = 0.8;
    static final double OVERSIZED_IMPROVEMENT = 40.0;
    static final double OVERSIZED_CONFIDENCE = 0.9;
    static final double DRIFT_IMPROVEMENT = 15.0;

    private final PerformanceTracker performanceTracker;
    private final RecommendationService recommendationService;
    private final ContentRecordRepository recordRepository;
    private final PlacementPolicy placementPolicy;
    private final StorageProperties.Optimizer settings;

    private final AtomicBoolean running = new AtomicBoolean(false);

    public StorageOptimizer(PerformanceTracker performanceTracker,
                            RecommendationService recommendationService,
                            ContentRecordRepository recordRepository,
                            PlacementPolicy placementPolicy,
                            StorageProperties properties) {
        this.performanceTracker = performanceTracker;
        this.recommendationService = recommendationService;
        this.recordRepository = recordRepository;
        this.placementPolicy = placementPolicy;
        this.settings = properties.getOptimizer();
    }

    /**
     * @return 本轮新增的待处理建议数
     */
    @Scheduled(initialDelayString = "${storage.optimizer.initial-delay-ms:300000}",
        fixedDelayString = "${storage.optimizer.analyze-ms:3600000}")
    public int analyze() {
        if (!running.compareAndSet(false, true)) {
            return 0;
        }
        try {
            LocalDateTime now = LocalDateTime.now();
            int created = proposeIndexes(now) + proposeOversizedMigrations() + proposePolicyDrift();
            recommendationService.expireStale();
            if (created > 0) {
                log.info("存储优化分析完成，新增建议: {}", created);
            }
            return created;
        } finally {
            running.set(false);
        }
    }

    private int proposeIndexes(LocalDateTime now) {
        int created = 0;
        for (DomainLatencyView slow : performanceTracker.slowDomains(now)) {
            OptimizationRecommendation candidate = new OptimizationRecommendation();
            candidate.setType(OptimizationRecommendation.Type.ADD_INDEX);
            candidate.setTarget(RecommendationService.domainTarget(slow.getDomain()));
            candidate.setTargetDomain(slow.getDomain());
            candidate.setTitle("Add index for " + slow.getDomain() + " domain queries");
            candidate.setDescription(String.format(Locale.ROOT,
                "Queries in the %s domain average %.1fms over %d samples",
                slow.getDomain(), slow.getAvgLatencyMs(), slow.getSampleCount()));
            candidate.setEstimatedImprovement(INDEX_IMPROVEMENT);
            candidate.setConfidence(INDEX_CONFIDENCE);
            created += isNew(candidate, recommendationService.propose(candidate));
        }
        return created;
    }

    private int proposeOversizedMigrations() {
        List<ContentRecord> oversized = recordRepository.findOversized(StorageStrategy.FULL_STORE,
            settings.getMigrateSizeThreshold(), RecordStatus.READY, PageRequest.of(0, settings.getScanLimit()));
        int created = 0;
        for (ContentRecord record : oversized) {
            OptimizationRecommendation candidate = migration(record, StorageStrategy.VECTOR_STORE,
                "Migrate large content to vector storage",
                String.format(Locale.ROOT, "Record %d holds %d bytes in full storage",
                    record.getId(), record.getDeclaredSize()),
                OVERSIZED_IMPROVEMENT, OVERSIZED_CONFIDENCE);
            created += isNew(candidate, recommendationService.propose(candidate));
        }
        return created;
    }

    private int proposePolicyDrift() {
        int current = placementPolicy.currentVersion();
        List<ContentRecord> outdated = recordRepository.findByPolicyVersionLessThanAndStatusOrderByIdAsc(current,
            RecordStatus.READY, PageRequest.of(0, settings.getScanLimit()));
        int created = 0;
        for (ContentRecord record : outdated) {
            // 仅元数据的记录没有保留内容，无法迁往需要内容的策略
            if (record.getStrategy() == StorageStrategy.METADATA_ONLY) {
                continue;
            }
            PlacementDecision decision = placementPolicy.decide(record.getDeclaredSize(), profileOf(record),
                record.getDomain(), current);
            if (decision.getStrategy() == record.getStrategy()) {
                continue;
            }
            OptimizationRecommendation candidate = migration(record, decision.getStrategy(),
                "Re-place record under policy v" + current,
                String.format(Locale.ROOT, "Record %d was placed as %s by policy v%d; policy v%d chooses %s",
                    record.getId(), record.getStrategy().value(), record.getPolicyVersion(), current,
                    decision.getStrategy().value()),
                DRIFT_IMPROVEMENT, decision.getConfidence());
            created += isNew(candidate, recommendationService.propose(candidate));
        }
        return created;
    }

    private OptimizationRecommendation migration(ContentRecord record, StorageStrategy target, String title,
                                                 String description, double improvement, double confidence) {
        OptimizationRecommendation candidate = new OptimizationRecommendation();
        candidate.setType(OptimizationRecommendation.Type.MIGRATE_STRATEGY);
        candidate.setTarget(RecommendationService.recordTarget(record.getId()));
        candidate.setTargetDomain(record.getDomain());
        candidate.setTargetStrategy(target);
        candidate.setTitle(title);
        candidate.setDescription(description);
        candidate.setEstimatedImprovement(improvement);
        candidate.setConfidence(confidence);
        return candidate;
    }

    private int isNew(OptimizationRecommendation candidate, OptimizationRecommendation stored) {
        return stored == candidate && stored.isPending() ? 1 : 0;
    }

    static ContentProfile profileOf(ContentRecord record) {
        return ContentProfile.builder()
            .semanticComplexity(record.getSemanticComplexity())
            .topicCoherence(record.getTopicCoherence())
            .informationDensity(record.getInformationDensity())
            .queryPotential(record.getQueryPotential())
            .wordCount(record.getWordCount() == null ? 0 : record.getWordCount())
            .characterCount(record.getCharacterCount() == null ? 0 : record.getCharacterCount())
            .keywords(record.getKeywords())
            .build();
    }
}
