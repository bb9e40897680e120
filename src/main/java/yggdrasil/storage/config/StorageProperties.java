package yggdrasil.storage.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;
import yggdrasil.storage.model.StorageStrategy;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * 存储放置与检索配置
 */
@Component
@ConfigurationProperties(prefix = "storage")
@Data
public class StorageProperties {

    private Placement placement = new Placement();
    private Classifier classifier = new Classifier();
    private Coordinator coordinator = new Coordinator();
    private Reconciliation reconciliation = new Reconciliation();
    private Migration migration = new Migration();
    private Query query = new Query();
    private Optimizer optimizer = new Optimizer();
    private Vector vector = new Vector();

    /**
     * 放置策略决策表
     */
    @Data
    public static class Placement {
        /** 当前策略版本，写入每条记录 */
        private int version = 1;
        private long sizeSmall = 50_000L;
        private long sizeMedium = 1_000_000L;
        private long sizeLarge = 50_000_000L;
        private double complexityThreshold = 0.7;
        private double queryPotentialThreshold = 0.8;
        private List<String> highValueDomains = new ArrayList<>(List.of("science", "philosophy", "literature"));
        /** 领域覆盖规则，优先于决策表 */
        private Map<String, StorageStrategy> domainOverrides = new HashMap<>();
        /** 大小阈值的置信边距（自然对数尺度，ln2 即两倍距离视为完全确定） */
        private double sizeMargin = 0.6931;
        /** 画像分数阈值的置信边距 */
        private double scoreMargin = 0.2;
        private double minConfidence = 0.3;
        private double maxConfidence = 0.99;
        private double overrideConfidence = 0.95;
    }

    @Data
    public static class Classifier {
        private int analysisWindow = 20_000;
        private int coherenceChunkTokens = 50;
        private int keywordCount = 10;
        private int previewLength = 1000;
    }

    @Data
    public static class Coordinator {
        /** 向量分块并行写入的工作线程上限 */
        private int vectorWorkers = 4;
        private int chunkSize = 1000;
        private int maxAttempts = 3;
        private Duration initialBackoff = Duration.ofMillis(200);
        private Duration maxBackoff = Duration.ofSeconds(5);
        /** 无完成标记的暂存分块在此宽限期后清理 */
        private Duration orphanGrace = Duration.ofMinutes(30);
    }

    @Data
    public static class Reconciliation {
        private int maxAttempts = 3;
        private Duration initialBackoff = Duration.ofSeconds(30);
        private Duration maxBackoff = Duration.ofMinutes(30);
        private int batchSize = 50;
    }

    @Data
    public static class Migration {
        private int concurrency = 2;
        /** 两次迁移启动之间的最小间隔 */
        private Duration minInterval = Duration.ofMillis(500);
        /** 旧位置延迟回收的宽限期 */
        private Duration gcGrace = Duration.ofHours(1);
        private int gcMaxAttempts = 5;
    }

    @Data
    public static class Query {
        private double alpha = 0.5;
        private int defaultLimit = 20;
        private int vectorTopK = 50;
        private double minVectorScore = 0.6;
        private Duration subQueryTimeout = Duration.ofSeconds(2);
        private Duration defaultDeadline = Duration.ofSeconds(5);
    }

    @Data
    public static class Optimizer {
        private Duration window = Duration.ofHours(24);
        private double latencyThresholdMs = 100.0;
        private int minSamples = 50;
        private long migrateSizeThreshold = 10_000_000L;
        private Duration recommendationTtl = Duration.ofDays(7);
        private Duration sampleRetention = Duration.ofDays(30);
        private int scanLimit = 200;
    }

    @Data
    public static class Vector {
        private String index = "ygg_content_vectors";
    }
}
