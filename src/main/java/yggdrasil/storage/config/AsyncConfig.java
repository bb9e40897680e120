package yggdrasil.storage.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.concurrent.Executor;

/**
 * 异步任务执行器配置。
 * 向量分块写入、检索子查询、迁移与性能采样各自使用独立线程池，互不阻塞。
 */
@Configuration
@EnableAsync
public class AsyncConfig {

    private final StorageProperties properties;

    public AsyncConfig(StorageProperties properties) {
        this.properties = properties;
    }

    /**
     * 向量分块写入线程池，并行度由 storage.coordinator.vector-workers 限定。
     */
    @Bean(name = "vectorWriteExecutor")
    public Executor vectorWriteExecutor() {
        int workers = Math.max(1, properties.getCoordinator().getVectorWorkers());
        return buildExecutor(workers, workers, 500, "vector-write-");
    }

    /**
     * 混合检索子查询线程池。
     */
    @Bean(name = "queryExecutor")
    public Executor queryExecutor() {
        return buildExecutor(4, 16, 200, "hybrid-query-");
    }

    /**
     * 后台迁移线程池，容量即迁移并发上限。
     */
    @Bean(name = "migrationExecutor")
    public Executor migrationExecutor() {
        int concurrency = Math.max(1, properties.getMigration().getConcurrency());
        return buildExecutor(concurrency, concurrency, 100, "migration-");
    }

    /**
     * 性能采样写入线程池。
     */
    @Bean(name = "trackingExecutor")
    public Executor trackingExecutor() {
        return buildExecutor(1, 2, 1000, "perf-tracking-");
    }

    private ThreadPoolTaskExecutor buildExecutor(int core, int max, int queue, String prefix) {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(core);
        executor.setMaxPoolSize(max);
        executor.setQueueCapacity(queue);
        executor.setThreadNamePrefix(prefix);
        executor.initialize();
        return executor;
    }
}
