package yggdrasil.storage.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import yggdrasil.storage.client.VectorEncodingService;
import yggdrasil.storage.common.convention.errorcode.StorageErrorCode;
import yggdrasil.storage.common.convention.exception.ContentValidationException;
import yggdrasil.storage.common.convention.exception.ServiceException;
import yggdrasil.storage.config.StorageProperties;
import yggdrasil.storage.dto.QueryFilter;
import yggdrasil.storage.dto.QueryRequest;
import yggdrasil.storage.dto.QueryResponse;
import yggdrasil.storage.dto.RankedMatch;
import yggdrasil.storage.dto.VectorHit;
import yggdrasil.storage.model.ContentRecord;
import yggdrasil.storage.model.QueryMode;
import yggdrasil.storage.model.StorageStrategy;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * 混合检索规划
 * 全文与向量两路子查询并发执行、各自限时，任一路失败时返回另一路结果并标记 partial
 */
@Service
public class HybridQueryPlanner {

    private static final Logger log = LoggerFactory.getLogger(HybridQueryPlanner.class);

    static final String TEXT_SIDE = "text";
    static final String VECTOR_SIDE = "vector";

    private static final int MAX_LIMIT = 200;

    private final FullTextSearchService fullTextSearch;
    private final VectorEncodingService encodingService;
    private final VectorStoreGateway vectorStore;
    private final ConsistencyMapper consistencyMapper;
    private final ScoreMerger scoreMerger;
    private final AccessStatsRecorder accessStats;
    private final PerformanceTracker performanceTracker;
    private final Executor queryExecutor;
    private final StorageProperties.Query settings;

    public HybridQueryPlanner(FullTextSearchService fullTextSearch,
                              VectorEncodingService encodingService,
                              VectorStoreGateway vectorStore,
                              ConsistencyMapper consistencyMapper,
                              ScoreMerger scoreMerger,
                              AccessStatsRecorder accessStats,
                              PerformanceTracker performanceTracker,
                              @Qualifier("queryExecutor") Executor queryExecutor,
                              StorageProperties properties) {
        this.fullTextSearch = fullTextSearch;
        this.encodingService = encodingService;
        this.vectorStore = vectorStore;
        this.consistencyMapper = consistencyMapper;
        this.scoreMerger = scoreMerger;
        this.accessStats = accessStats;
        this.performanceTracker = performanceTracker;
        this.queryExecutor = queryExecutor;
        this.settings = properties.getQuery();
    }

    public QueryResponse query(QueryRequest request) {
        if (request == null || request.getText() == null || request.getText().isBlank()) {
            throw new ContentValidationException(StorageErrorCode.QUERY_EMPTY);
        }
        long start = System.nanoTime();
        String text = request.getText().trim();
        QueryFilter filter = request.getFilter() == null ? QueryFilter.none() : request.getFilter();
        QueryMode mode = QueryMode.fromSemanticFlag(request.getSemantic());
        double alpha = resolveAlpha(request.getAlpha(), mode);
        int limit = resolveLimit(request.getLimit());
        int offset = request.getOffset() == null ? 0 : request.getOffset();
        if (offset < 0) {
            throw new ContentValidationException("offset 不能为负数", StorageErrorCode.PARAM_INVALID);
        }
        Duration budget = request.getDeadline() == null ? settings.getDefaultDeadline() : request.getDeadline();
        long deadline = start + budget.toNanos();
        int fetchSize = offset + limit;

        // 每个子查询的超时从各自提交时起算，且不超过整体截止时间
        long subQueryTimeout = settings.getSubQueryTimeout().toNanos();
        CompletableFuture<Map<Long, Double>> textFuture = null;
        CompletableFuture<List<VectorHit>> vectorFuture = null;
        long textDeadline = deadline;
        long vectorDeadline = deadline;
        if (mode.usesText()) {
            int textLimit = Math.max(fetchSize, settings.getVectorTopK());
            textDeadline = Math.min(deadline, System.nanoTime() + subQueryTimeout);
            textFuture = CompletableFuture.supplyAsync(
                () -> fullTextSearch.search(text, filter, textLimit), queryExecutor);
        }
        if (mode.usesVector()) {
            int topK = Math.max(fetchSize, settings.getVectorTopK());
            vectorDeadline = Math.min(deadline, System.nanoTime() + subQueryTimeout);
            vectorFuture = CompletableFuture.supplyAsync(
                () -> vectorStore.knnSearch(encodingService.encodeQuery(text), topK, filter), queryExecutor);
        }

        List<String> failedSides = new ArrayList<>();
        Map<Long, Double> textScores = textFuture == null ? Collections.emptyMap()
            : await(textFuture, TEXT_SIDE, textDeadline, failedSides);
        List<VectorHit> vectorHits = vectorFuture == null ? Collections.emptyList()
            : await(vectorFuture, VECTOR_SIDE, vectorDeadline, failedSides);

        int requestedSides = (textFuture == null ? 0 : 1) + (vectorFuture == null ? 0 : 1);
        if (failedSides.size() == requestedSides) {
            throw new ServiceException("检索失败，全部子查询未返回: " + failedSides, StorageErrorCode.SEARCH_SERVICE_ERROR);
        }
        if (textScores == null) {
            textScores = Collections.emptyMap();
        }
        if (vectorHits == null) {
            vectorHits = Collections.emptyList();
        }

        Set<Long> candidateIds = new HashSet<>(textScores.keySet());
        vectorHits.forEach(hit -> candidateIds.add(hit.getRecordId()));
        Map<Long, ContentRecord> records = consistencyMapper.resolveQueryable(candidateIds).stream()
            .collect(Collectors.toMap(ContentRecord::getId, Function.identity()));

        Map<Long, Double> visibleText = new HashMap<>();
        textScores.forEach((id, score) -> {
            if (records.containsKey(id)) {
                visibleText.put(id, score);
            }
        });
        Map<Long, Double> visibleVector = new HashMap<>();
        for (VectorHit hit : vectorHits) {
            ContentRecord record = records.get(hit.getRecordId());
            if (record == null || hit.getScore() < settings.getMinVectorScore()
                || !consistencyMapper.isCurrentGeneration(record, hit.getGeneration())) {
                continue;
            }
            visibleVector.merge(hit.getRecordId(), hit.getScore(), Math::max);
        }

        List<RankedMatch> merged = scoreMerger.merge(visibleText, visibleVector, alpha);
        List<RankedMatch> page = offset >= merged.size()
            ? new ArrayList<>()
            : new ArrayList<>(merged.subList(offset, Math.min(merged.size(), fetchSize)));
        page.forEach(match -> hydrate(match, records.get(match.getRecordId())));

        long latencyMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
        boolean partial = !failedSides.isEmpty();
        if (!page.isEmpty()) {
            accessStats.recordHits(page.stream().map(RankedMatch::getRecordId).collect(Collectors.toList()));
        }
        track(text, filter, mode, page, latencyMs, partial);
        log.debug("检索完成, 模式: {}, 返回: {}, partial: {}, 耗时: {}ms", mode, page.size(), partial, latencyMs);
        return new QueryResponse(page, partial, mode, latencyMs, failedSides);
    }

    private <T> T await(CompletableFuture<T> future, String side, long sideDeadline, List<String> failedSides) {
        long remaining = Math.max(0L, sideDeadline - System.nanoTime());
        try {
            return future.get(remaining, TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("{} 子查询超时，返回部分结果", side);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() == null ? e : e.getCause();
            log.warn("{} 子查询失败，返回部分结果: {}", side, cause.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            future.cancel(true);
            log.warn("{} 子查询等待被中断", side);
        }
        failedSides.add(side);
        return null;
    }

    private void hydrate(RankedMatch match, ContentRecord record) {
        if (record == null) {
            return;
        }
        match.setTitle(record.getTitle());
        match.setDomain(record.getDomain());
        match.setContentType(record.getContentType());
        match.setSourceLocator(record.getSourceLocator());
        match.setStrategy(record.getStrategy());
        match.setPreview(record.getContentPreview());
    }

    private void track(String text, QueryFilter filter, QueryMode mode, List<RankedMatch> page,
                       long latencyMs, boolean partial) {
        StorageStrategy strategy = page.isEmpty() ? null : page.get(0).getStrategy();
        String domain = filter.getDomain() != null && !filter.getDomain().isBlank()
            ? filter.getDomain()
            : page.isEmpty() ? null : page.get(0).getDomain();
        performanceTracker.record(text, filter, mode, strategy, domain, latencyMs, page.size(), partial);
    }

    private double resolveAlpha(Double requested, QueryMode mode) {
        if (mode == QueryMode.TEXT) {
            return 1.0;
        }
        if (mode == QueryMode.VECTOR) {
            return 0.0;
        }
        double alpha = requested == null ? settings.getAlpha() : requested;
        if (alpha < 0.0 || alpha > 1.0) {
            throw new ContentValidationException("alpha 必须位于 [0, 1]", StorageErrorCode.PARAM_INVALID);
        }
        return alpha;
    }

    private int resolveLimit(Integer requested) {
        if (requested == null) {
            return settings.getDefaultLimit();
        }
        if (requested <= 0) {
            throw new ContentValidationException("limit 必须为正数", StorageErrorCode.PARAM_INVALID);
        }
        return Math.min(requested, MAX_LIMIT);
    }
}
