package yggdrasil.storage.service;

import org.springframework.stereotype.Service;
import yggdrasil.storage.config.StorageProperties;
import yggdrasil.storage.dto.ContentProfile;
import yggdrasil.storage.dto.PlacementDecision;
import yggdrasil.storage.model.StorageStrategy;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * 放置策略
 *
 * <p>显式决策表（按顺序）：</p>
 * <ol>
 *     <li>size &lt; sizeSmall → full_store</li>
 *     <li>size &gt; sizeLarge → vector_store</li>
 *     <li>complexity &gt; 0.7 且 queryPotential &gt; 0.8 → hybrid</li>
 *     <li>领域属于高价值领域且 size &gt; sizeMedium → hybrid</li>
 *     <li>其余 → metadata_only</li>
 * </ol>
 * <p>领域覆盖规则优先于决策表。大小恰好等于阈值时比较两侧结果，取存储成本较低者；
 * 分数阈值为严格大于，等于阈值时自然落到较便宜的一侧。</p>
 *
 * <p>置信度由当前输入到最近一个会改变结果的阈值的归一化距离决定：
 * 大小按对数距离除以 sizeMargin，分数按差值除以 scoreMargin，
 * 距离达到一个边距即视为完全确定，最终截断到 [minConfidence, maxConfidence]。</p>
 */
@Service
public class PlacementPolicy {

    private final StorageProperties.Placement settings;

    public PlacementPolicy(StorageProperties properties) {
        this.settings = properties.getPlacement();
    }

    public int currentVersion() {
        return settings.getVersion();
    }

    /**
     * 计算放置决策，纯函数
     *
     * @param size 声明大小（字节）
     * @param profile 内容画像
     * @param domain 领域
     * @param policyVersion 写入记录的策略版本
     */
    public PlacementDecision decide(long size, ContentProfile profile, String domain, int policyVersion) {
        List<String> reasons = new ArrayList<>();
        String normalizedDomain = domain == null ? "" : domain.toLowerCase(Locale.ROOT);

        StorageStrategy override = findOverride(normalizedDomain);
        if (override != null) {
            reasons.add("领域覆盖规则: " + normalizedDomain + " -> " + override.value());
            return new PlacementDecision(override, clampConfidence(settings.getOverrideConfidence()),
                policyVersion, reasons);
        }

        long small = settings.getSizeSmall();
        long large = settings.getSizeLarge();

        if (size < small) {
            reasons.add("小于 " + small + " 字节，全文存储");
            return decision(StorageStrategy.FULL_STORE, sizeDistance(size, small), policyVersion, reasons);
        }
        if (size > large) {
            reasons.add("大于 " + large + " 字节，向量存储");
            return decision(StorageStrategy.VECTOR_STORE, sizeDistance(size, large), policyVersion, reasons);
        }

        BandOutcome middle = evaluateMiddleBand(size, profile, normalizedDomain);

        if (size == small || size == large) {
            StorageStrategy boundary = size == small ? StorageStrategy.FULL_STORE : StorageStrategy.VECTOR_STORE;
            StorageStrategy chosen = StorageStrategy.cheaper(boundary, middle.strategy);
            reasons.add("恰好位于阈值 " + size + "，在 " + boundary.value() + " 与 "
                + middle.strategy.value() + " 之间取成本较低者");
            return decision(chosen, 0.0, policyVersion, reasons);
        }

        reasons.add(middle.reason);
        double distance = Math.min(middle.distance,
            Math.min(sizeDistance(size, small), sizeDistance(size, large)));
        return decision(middle.strategy, distance, policyVersion, reasons);
    }

    /**
     * 中间区间（sizeSmall, sizeLarge）内的规则 3 到 5
     */
    private BandOutcome evaluateMiddleBand(long size, ContentProfile profile, String domain) {
        double complexityGap = profile.getSemanticComplexity() - settings.getComplexityThreshold();
        double potentialGap = profile.getQueryPotential() - settings.getQueryPotentialThreshold();
        boolean richContent = complexityGap > 0 && potentialGap > 0;
        double richDistance = conjunctionDistance(complexityGap, potentialGap) / settings.getScoreMargin();

        if (richContent) {
            return new BandOutcome(StorageStrategy.HYBRID, richDistance,
                "语义复杂度与检索潜力均高于阈值，混合存储");
        }

        boolean highValue = settings.getHighValueDomains().stream()
            .anyMatch(candidate -> candidate.equalsIgnoreCase(domain));
        double mediumDistance = highValue ? sizeDistance(size, settings.getSizeMedium()) : Double.POSITIVE_INFINITY;

        if (highValue && size > settings.getSizeMedium()) {
            return new BandOutcome(StorageStrategy.HYBRID, Math.min(richDistance, mediumDistance),
                "高价值领域 " + domain + " 且大于 " + settings.getSizeMedium() + " 字节，混合存储");
        }
        return new BandOutcome(StorageStrategy.METADATA_ONLY, Math.min(richDistance, mediumDistance),
            "未命中其他规则，仅保留元数据与来源指针");
    }

    /**
     * 合取条件翻转所需的最小距离：
     * 成立时任一条件翻转即可，取最小余量；不成立时所有失败条件都需翻转，取最大缺口
     */
    private double conjunctionDistance(double firstGap, double secondGap) {
        if (firstGap > 0 && secondGap > 0) {
            return Math.min(firstGap, secondGap);
        }
        double missing = 0.0;
        if (firstGap <= 0) {
            missing = Math.max(missing, -firstGap);
        }
        if (secondGap <= 0) {
            missing = Math.max(missing, -secondGap);
        }
        return missing;
    }

    private double sizeDistance(long size, long threshold) {
        if (size <= 0 || threshold <= 0) {
            return Double.POSITIVE_INFINITY;
        }
        return Math.abs(Math.log((double) size / threshold)) / settings.getSizeMargin();
    }

    private PlacementDecision decision(StorageStrategy strategy, double normalizedDistance,
                                       int policyVersion, List<String> reasons) {
        double confidence = clampConfidence(Math.min(1.0, normalizedDistance));
        return new PlacementDecision(strategy, confidence, policyVersion, reasons);
    }

    private double clampConfidence(double value) {
        return Math.max(settings.getMinConfidence(), Math.min(settings.getMaxConfidence(), value));
    }

    private StorageStrategy findOverride(String domain) {
        Map<String, StorageStrategy> overrides = settings.getDomainOverrides();
        if (overrides == null || overrides.isEmpty() || domain.isEmpty()) {
            return null;
        }
        for (Map.Entry<String, StorageStrategy> entry : overrides.entrySet()) {
            if (entry.getKey().equalsIgnoreCase(domain)) {
                return entry.getValue();
            }
        }
        return null;
    }

    private static final class BandOutcome {
        private final StorageStrategy strategy;
        private final double distance;
        private final String reason;

        private BandOutcome(StorageStrategy strategy, double distance, String reason) {
            this.strategy = strategy;
            this.distance = distance;
            this.reason = reason;
        }
    }
}
