package yggdrasil.storage.service;

import org.apache.commons.codec.digest.DigestUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.scheduling.annotation.Async;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import yggdrasil.storage.config.StorageProperties;
import yggdrasil.storage.dto.DomainLatencyView;
import yggdrasil.storage.dto.QueryFilter;
import yggdrasil.storage.model.PerformanceSample;
import yggdrasil.storage.model.QueryMode;
import yggdrasil.storage.model.StorageStrategy;
import yggdrasil.storage.repository.PerformanceSampleRepository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Locale;

/**
 * 查询性能追踪
 * 每次查询异步追加一条采样，超过保留期的采样定期删除
 */
@Service
public class PerformanceTracker {

    private static final Logger log = LoggerFactory.getLogger(PerformanceTracker.class);

    private final PerformanceSampleRepository sampleRepository;
    private final StorageProperties.Optimizer settings;

    public PerformanceTracker(PerformanceSampleRepository sampleRepository, StorageProperties properties) {
        this.sampleRepository = sampleRepository;
        this.settings = properties.getOptimizer();
    }

    @Async("trackingExecutor")
    public void record(String queryText, QueryFilter filter, QueryMode mode, StorageStrategy strategyInvolved,
                       String targetDomain, double latencyMs, int rowsReturned, boolean partial) {
        PerformanceSample sample = new PerformanceSample();
        sample.setQuerySignature(signature(queryText, filter, mode));
        sample.setQueryMode(mode);
        sample.setStrategyInvolved(strategyInvolved);
        sample.setTargetDomain(targetDomain == null ? null : targetDomain.toLowerCase(Locale.ROOT));
        sample.setLatencyMs(latencyMs);
        sample.setRowsReturned(rowsReturned);
        sample.setPartial(partial);
        sample.setExecutedAt(LocalDateTime.now());
        try {
            sampleRepository.save(sample);
        } catch (DataAccessException e) {
            log.warn("性能采样写入失败: {}", e.getMessage());
        }
    }

    /**
     * 滚动窗口内的慢领域
     */
    public List<DomainLatencyView> slowDomains(LocalDateTime now) {
        return sampleRepository.findSlowDomains(now.minus(settings.getWindow()),
            settings.getMinSamples(), settings.getLatencyThresholdMs());
    }

    @Scheduled(fixedDelayString = "${storage.optimizer.retention-sweep-ms:3600000}")
    public int purgeExpired() {
        int deleted = sampleRepository.deleteOlderThan(LocalDateTime.now().minus(settings.getSampleRetention()));
        if (deleted > 0) {
            log.info("已删除过期性能采样: {}", deleted);
        }
        return deleted;
    }

    /**
     * 查询签名：模式、规范化文本与过滤条件的 SHA-256
     */
    public static String signature(String queryText, QueryFilter filter, QueryMode mode) {
        StringBuilder key = new StringBuilder();
        key.append(mode).append('|');
        key.append(queryText == null ? "" : queryText.trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", " "));
        if (filter != null) {
            key.append('|').append(filter.getDomain())
                .append('|').append(filter.getContentType())
                .append('|').append(filter.getCreatedFrom())
                .append('|').append(filter.getCreatedTo());
        }
        return DigestUtils.sha256Hex(key.toString());
    }
}
