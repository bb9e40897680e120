package yggdrasil.storage.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import yggdrasil.storage.common.convention.errorcode.StorageErrorCode;
import yggdrasil.storage.common.convention.exception.AbstractException;
import yggdrasil.storage.common.convention.exception.ClientException;
import yggdrasil.storage.config.StorageProperties;
import yggdrasil.storage.dto.MigrationHandle;
import yggdrasil.storage.dto.MigrationResult;
import yggdrasil.storage.model.OptimizationRecommendation;
import yggdrasil.storage.model.StorageStrategy;
import yggdrasil.storage.repository.OptimizationRecommendationRepository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletionException;

/**
 * 优化建议
 * 同一目标至多一条待处理建议，冲突的新建议直接以 REJECTED 落库
 */
@Service
public class RecommendationService {

    private static final Logger log = LoggerFactory.getLogger(RecommendationService.class);

    static final String DOMAIN_TARGET_PREFIX = "domain:";
    static final String RECORD_TARGET_PREFIX = "record:";

    private final OptimizationRecommendationRepository recommendationRepository;
    private final MigrationService migrationService;
    private final DynamicTableRegistry tableRegistry;
    private final SpecializedTableSchemaBuilder schemaBuilder;
    private final StorageProperties.Optimizer settings;

    public RecommendationService(OptimizationRecommendationRepository recommendationRepository,
                                 MigrationService migrationService,
                                 DynamicTableRegistry tableRegistry,
                                 SpecializedTableSchemaBuilder schemaBuilder,
                                 StorageProperties properties) {
        this.recommendationRepository = recommendationRepository;
        this.migrationService = migrationService;
        this.tableRegistry = tableRegistry;
        this.schemaBuilder = schemaBuilder;
        this.settings = properties.getOptimizer();
    }

    public static String domainTarget(String domain) {
        return DOMAIN_TARGET_PREFIX + domain;
    }

    public static String recordTarget(Long recordId) {
        return RECORD_TARGET_PREFIX + recordId;
    }

    /**
     * 新增建议
     * 已有相同内容的待处理建议时直接返回它；同一目标已有不同的待处理建议时新建议记为 REJECTED
     */
    public OptimizationRecommendation propose(OptimizationRecommendation candidate) {
        List<OptimizationRecommendation> pending = recommendationRepository
            .findByTargetAndStatus(candidate.getTarget(), OptimizationRecommendation.Status.PENDING);
        for (OptimizationRecommendation existing : pending) {
            if (existing.getType() == candidate.getType()
                && Objects.equals(existing.getTargetStrategy(), candidate.getTargetStrategy())) {
                return existing;
            }
        }
        if (!pending.isEmpty()) {
            OptimizationRecommendation conflicting = pending.get(0);
            candidate.setStatus(OptimizationRecommendation.Status.REJECTED);
            candidate.setStatusReason("conflicts with pending recommendation #" + conflicting.getId());
            candidate.setResolvedAt(LocalDateTime.now());
            log.info("建议与待处理建议 #{} 冲突，已拒绝: {}", conflicting.getId(), candidate.getTitle());
            return recommendationRepository.save(candidate);
        }
        candidate.setStatus(OptimizationRecommendation.Status.PENDING);
        OptimizationRecommendation saved = recommendationRepository.save(candidate);
        log.info("新增优化建议 #{}: {}", saved.getId(), saved.getTitle());
        return saved;
    }

    public List<OptimizationRecommendation> listRecommendations(OptimizationRecommendation.Status status) {
        if (status == null) {
            return recommendationRepository.findAllByOrderByCreatedAtDesc();
        }
        return recommendationRepository.findByStatusOrderByCreatedAtDesc(status);
    }

    /**
     * 执行建议
     * 索引建议走 DDL，策略迁移走后台迁移并等待其结束
     *
     * @throws ClientException 建议不存在或不处于待处理状态
     */
    public OptimizationRecommendation apply(Long recommendationId) {
        OptimizationRecommendation recommendation = recommendationRepository.findById(recommendationId)
            .orElseThrow(() -> new ClientException(StorageErrorCode.RECOMMENDATION_NOT_FOUND));
        if (!recommendation.isPending()) {
            throw new ClientException("建议当前状态为 " + recommendation.getStatus(),
                StorageErrorCode.RECOMMENDATION_NOT_PENDING);
        }
        if (isStale(recommendation, LocalDateTime.now())) {
            resolve(recommendation, OptimizationRecommendation.Status.EXPIRED, "expired without being applied");
            throw new ClientException("建议已过期", StorageErrorCode.RECOMMENDATION_NOT_PENDING);
        }

        if (recommendation.getType() == OptimizationRecommendation.Type.ADD_INDEX) {
            applyIndex(recommendation);
        } else {
            applyMigration(recommendation);
        }
        return recommendation;
    }

    /**
     * 过期超过有效期的待处理建议
     */
    public int expireStale() {
        LocalDateTime now = LocalDateTime.now();
        int expired = recommendationRepository.expirePending(now.minus(settings.getRecommendationTtl()), now,
            OptimizationRecommendation.Status.PENDING, OptimizationRecommendation.Status.EXPIRED);
        if (expired > 0) {
            log.info("已过期优化建议: {}", expired);
        }
        return expired;
    }

    private void applyIndex(OptimizationRecommendation recommendation) {
        try {
            tableRegistry.executeDdl(schemaBuilder.domainIndexDdl(recommendation.getTargetDomain()));
            resolve(recommendation, OptimizationRecommendation.Status.APPLIED, "index created");
        } catch (AbstractException e) {
            log.warn("索引建议 #{} 执行失败: {}", recommendation.getId(), e.getErrorMessage());
            resolve(recommendation, OptimizationRecommendation.Status.FAILED, e.getErrorMessage());
        }
    }

    private void applyMigration(OptimizationRecommendation recommendation) {
        Long recordId = parseRecordId(recommendation.getTarget());
        StorageStrategy target = recommendation.getTargetStrategy();
        if (recordId == null || target == null) {
            resolve(recommendation, OptimizationRecommendation.Status.FAILED, "malformed migration target");
            return;
        }
        // 已有迁移在进行时抛出，建议保持待处理
        MigrationHandle handle = migrationService.submit(recordId, target, recommendation.getConfidence());
        MigrationResult result;
        try {
            result = handle.getResult().join();
        } catch (CompletionException e) {
            resolve(recommendation, OptimizationRecommendation.Status.FAILED, String.valueOf(e.getCause()));
            return;
        }
        switch (result.getOutcome()) {
            case SWAPPED:
                resolve(recommendation, OptimizationRecommendation.Status.APPLIED,
                    "migrated " + result.getFromStrategy() + " -> " + result.getToStrategy());
                break;
            case UNCHANGED:
                resolve(recommendation, OptimizationRecommendation.Status.APPLIED, "record already on " + target.value());
                break;
            default:
                resolve(recommendation, OptimizationRecommendation.Status.FAILED,
                    result.getOutcome() + ": " + result.getMessage());
        }
    }

    private void resolve(OptimizationRecommendation recommendation, OptimizationRecommendation.Status status,
                         String reason) {
        recommendation.setStatus(status);
        recommendation.setStatusReason(reason);
        recommendation.setResolvedAt(LocalDateTime.now());
        recommendationRepository.save(recommendation);
        log.info("优化建议 #{} -> {}: {}", recommendation.getId(), status, reason);
    }

    private boolean isStale(OptimizationRecommendation recommendation, LocalDateTime now) {
        return recommendation.getCreatedAt() != null
            && recommendation.getCreatedAt().isBefore(now.minus(settings.getRecommendationTtl()));
    }

    static Long parseRecordId(String target) {
        if (target == null || !target.startsWith(RECORD_TARGET_PREFIX)) {
            return null;
        }
        try {
            return Long.parseLong(target.substring(RECORD_TARGET_PREFIX.length()));
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
