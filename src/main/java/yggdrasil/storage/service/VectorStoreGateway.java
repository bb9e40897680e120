package yggdrasil.storage.service;

import co.elastic.clients.elasticsearch.ElasticsearchClient;
import co.elastic.clients.elasticsearch._types.ElasticsearchException;
import co.elastic.clients.elasticsearch._types.ErrorCause;
import co.elastic.clients.elasticsearch._types.FieldValue;
import co.elastic.clients.elasticsearch._types.SortOrder;
import co.elastic.clients.elasticsearch._types.query_dsl.Query;
import co.elastic.clients.elasticsearch.core.BulkRequest;
import co.elastic.clients.elasticsearch.core.BulkResponse;
import co.elastic.clients.elasticsearch.core.DeleteByQueryResponse;
import co.elastic.clients.elasticsearch.core.SearchResponse;
import co.elastic.clients.elasticsearch.core.bulk.BulkOperation;
import co.elastic.clients.elasticsearch.core.bulk.BulkResponseItem;
import co.elastic.clients.elasticsearch.core.search.Hit;
import co.elastic.clients.json.JsonData;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import yggdrasil.storage.common.convention.errorcode.StorageErrorCode;
import yggdrasil.storage.common.convention.exception.ServiceException;
import yggdrasil.storage.common.convention.exception.TransientStoreException;
import yggdrasil.storage.config.StorageProperties;
import yggdrasil.storage.dto.QueryFilter;
import yggdrasil.storage.dto.VectorHit;
import yggdrasil.storage.model.VectorChunkDocument;

import java.io.IOException;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * 向量存储网关
 * 所有领域共用一个 Elasticsearch 索引，以 domain 字段区分，检索时预过滤
 */
@Service
public class VectorStoreGateway {

    private static final Logger log = LoggerFactory.getLogger(VectorStoreGateway.class);
    static final int LOAD_PAGE_SIZE = 1000;

    private final ElasticsearchClient searchClient;
    private final String indexName;
    private volatile boolean indexReady;

    public VectorStoreGateway(ElasticsearchClient searchClient, StorageProperties properties) {
        this.searchClient = searchClient;
        this.indexName = properties.getVector().getIndex();
    }

    public String collection() {
        return indexName;
    }

    /**
     * 索引不存在时按向量维度创建
     */
    public void ensureIndex(int dimensions) {
        if (indexReady) {
            return;
        }
        synchronized (this) {
            if (indexReady) {
                return;
            }
            try {
                boolean exists = searchClient.indices().exists(e -> e.index(indexName)).value();
                if (!exists) {
                    searchClient.indices().create(c -> c
                        .index(indexName)
                        .mappings(m -> m
                            .properties("point_id", p -> p.keyword(k -> k))
                            .properties("content_record_id", p -> p.long_(l -> l))
                            .properties("chunk_sequence", p -> p.integer(i -> i))
                            .properties("word_count", p -> p.integer(i -> i))
                            .properties("domain", p -> p.keyword(k -> k))
                            .properties("content_type", p -> p.keyword(k -> k))
                            .properties("generation", p -> p.keyword(k -> k))
                            .properties("created_at", p -> p.date(d -> d.format("epoch_millis")))
                            .properties("text", p -> p.text(t -> t))
                            .properties("embedding", p -> p.denseVector(d -> d
                                .dims(dimensions)
                                .index(true)
                                .similarity("cosine")))
                        )
                    );
                    log.info("已创建向量索引 {}，维度: {}", indexName, dimensions);
                }
                indexReady = true;
            } catch (IOException e) {
                throw new TransientStoreException("向量索引初始化失败: " + e.getMessage(), e,
                    StorageErrorCode.ELASTICSEARCH_ERROR);
            } catch (ElasticsearchException e) {
                if (e.getMessage() != null && e.getMessage().contains("resource_already_exists_exception")) {
                    indexReady = true;
                    return;
                }
                throw translate("向量索引初始化失败", e);
            }
        }
    }

    /**
     * 批量写入一组分块，按点 ID 覆盖，重复写入幂等
     * 任一分块被拒绝即整体失败，由调用方按批次重试
     */
    public void indexChunks(List<VectorChunkDocument> documents) {
        if (documents.isEmpty()) {
            return;
        }
        List<BulkOperation> operations = documents.stream()
            .map(this::createIndexOperation)
            .collect(Collectors.toList());
        BulkResponse bulkResponse;
        try {
            bulkResponse = searchClient.bulk(BulkRequest.of(builder -> builder.operations(operations)));
        } catch (IOException e) {
            throw new TransientStoreException("向量分块批量写入失败", e, StorageErrorCode.ELASTICSEARCH_ERROR);
        } catch (ElasticsearchException e) {
            throw translate("向量分块批量写入失败", e);
        }
        if (bulkResponse.errors()) {
            handleBulkErrors(bulkResponse);
        }
    }

    private BulkOperation createIndexOperation(VectorChunkDocument document) {
        return BulkOperation.of(op -> op.index(idx -> idx
            .index(indexName)
            .id(document.getPointId())
            .document(document)
        ));
    }

    private void handleBulkErrors(BulkResponse response) {
        int failed = 0;
        boolean retryable = true;
        String firstReason = null;
        for (BulkResponseItem item : response.items()) {
            ErrorCause error = item.error();
            if (error == null) {
                continue;
            }
            failed++;
            if (item.status() != 429 && item.status() < 500) {
                retryable = false;
            }
            if (firstReason == null) {
                firstReason = item.id() + ": " + error.reason();
            }
            log.error("向量分块写入失败, 点ID: {}, 状态: {}, 原因: {}", item.id(), item.status(), error.reason());
        }
        String message = "部分向量分块写入失败, 失败数: " + failed + ", 首个错误: " + firstReason;
        if (retryable) {
            throw new TransientStoreException(message, StorageErrorCode.ELASTICSEARCH_ERROR);
        }
        throw new ServiceException(message, StorageErrorCode.ELASTICSEARCH_ERROR);
    }

    /**
     * 刷新索引，使已确认的分块对计数与检索可见
     */
    public void refresh() {
        try {
            searchClient.indices().refresh(r -> r.index(indexName));
        } catch (IOException e) {
            throw new TransientStoreException("向量索引刷新失败", e, StorageErrorCode.ELASTICSEARCH_ERROR);
        } catch (ElasticsearchException e) {
            throw translate("向量索引刷新失败", e);
        }
    }

    public long countGeneration(String generation) {
        try {
            return searchClient.count(c -> c
                .index(indexName)
                .query(q -> q.term(t -> t.field("generation").value(generation)))
            ).count();
        } catch (IOException e) {
            throw new TransientStoreException("向量分块计数失败", e, StorageErrorCode.ELASTICSEARCH_ERROR);
        } catch (ElasticsearchException e) {
            if (isIndexMissing(e)) {
                return 0L;
            }
            throw translate("向量分块计数失败", e);
        }
    }

    /**
     * 按序号读取一个 generation 的全部分块（不含向量）
     * 以 chunk_sequence 做 search_after 分页，分块数不受单次查询窗口限制
     */
    public List<VectorChunkDocument> loadGeneration(String generation) {
        List<VectorChunkDocument> chunks = new ArrayList<>();
        Integer lastSequence = null;
        try {
            while (true) {
                Integer after = lastSequence;
                SearchResponse<VectorChunkDocument> response = searchClient.search(s -> {
                    s.index(indexName)
                        .query(q -> q.term(t -> t.field("generation").value(generation)))
                        .sort(so -> so.field(f -> f.field("chunk_sequence").order(SortOrder.Asc)))
                        .source(src -> src.filter(f -> f.excludes("embedding")))
                        .size(LOAD_PAGE_SIZE);
                    if (after != null) {
                        s.searchAfter(FieldValue.of(after.longValue()));
                    }
                    return s;
                }, VectorChunkDocument.class);

                List<Hit<VectorChunkDocument>> hits = response.hits().hits();
                for (Hit<VectorChunkDocument> hit : hits) {
                    if (hit.source() != null) {
                        chunks.add(hit.source());
                    }
                }
                if (hits.size() < LOAD_PAGE_SIZE) {
                    return chunks;
                }
                VectorChunkDocument last = hits.get(hits.size() - 1).source();
                if (last == null || last.getChunkSequence() == null) {
                    throw new ServiceException("向量分块缺少序号, generation: " + generation,
                        StorageErrorCode.CONSISTENCY_VIOLATION);
                }
                lastSequence = last.getChunkSequence();
            }
        } catch (IOException e) {
            throw new TransientStoreException("读取向量分块失败", e, StorageErrorCode.ELASTICSEARCH_ERROR);
        } catch (ElasticsearchException e) {
            if (isIndexMissing(e)) {
                return Collections.emptyList();
            }
            throw translate("读取向量分块失败", e);
        }
    }

    /**
     * kNN 检索，过滤条件作为预过滤下推
     */
    public List<VectorHit> knnSearch(List<Float> queryVector, int topK, QueryFilter filter) {
        List<Query> filters = buildFilters(filter);
        int candidates = Math.max(topK * 4, 100);
        try {
            SearchResponse<VectorChunkDocument> response = searchClient.search(s -> {
                s.index(indexName);
                s.knn(knn -> {
                    knn.field("embedding")
                        .queryVector(queryVector)
                        .k(topK)
                        .numCandidates(candidates);
                    if (!filters.isEmpty()) {
                        knn.filter(filters);
                    }
                    return knn;
                });
                s.source(src -> src.filter(f -> f.excludes("embedding", "text")));
                s.size(topK);
                return s;
            }, VectorChunkDocument.class);

            List<VectorHit> hits = new ArrayList<>();
            response.hits().hits().forEach(hit -> {
                VectorChunkDocument source = hit.source();
                if (source == null || source.getContentRecordId() == null) {
                    return;
                }
                hits.add(new VectorHit(source.getContentRecordId(), source.getGeneration(),
                    source.getChunkSequence(), hit.score() == null ? 0.0 : hit.score()));
            });
            return hits;
        } catch (IOException e) {
            throw new TransientStoreException("向量检索失败", e, StorageErrorCode.ELASTICSEARCH_ERROR);
        } catch (ElasticsearchException e) {
            if (isIndexMissing(e)) {
                log.warn("索引 {} 不存在，向量检索返回空结果", indexName);
                return Collections.emptyList();
            }
            throw translate("向量检索失败", e);
        }
    }

    /**
     * 删除一个 generation 的全部分块
     */
    public long deleteGeneration(String generation) {
        try {
            DeleteByQueryResponse response = searchClient.deleteByQuery(d -> d
                .index(indexName)
                .query(q -> q.term(t -> t.field("generation").value(generation)))
                .refresh(true));
            long deleted = response.deleted() == null ? 0L : response.deleted();
            log.info("已删除向量分块, generation: {}, 删除数: {}", generation, deleted);
            return deleted;
        } catch (IOException e) {
            throw new TransientStoreException("删除向量分块失败", e, StorageErrorCode.ELASTICSEARCH_ERROR);
        } catch (ElasticsearchException e) {
            if (isIndexMissing(e)) {
                return 0L;
            }
            throw translate("删除向量分块失败", e);
        }
    }

    private List<Query> buildFilters(QueryFilter filter) {
        List<Query> filters = new ArrayList<>();
        if (filter == null) {
            return filters;
        }
        if (filter.getDomain() != null && !filter.getDomain().isBlank()) {
            String domain = filter.getDomain().toLowerCase(Locale.ROOT);
            filters.add(Query.of(q -> q.term(t -> t.field("domain").value(domain))));
        }
        if (filter.getContentType() != null && !filter.getContentType().isBlank()) {
            String contentType = filter.getContentType();
            filters.add(Query.of(q -> q.term(t -> t.field("content_type").value(contentType))));
        }
        if (filter.getCreatedFrom() != null || filter.getCreatedTo() != null) {
            Long from = toEpochMillis(filter.getCreatedFrom());
            Long to = toEpochMillis(filter.getCreatedTo());
            filters.add(Query.of(q -> q.range(r -> {
                r.field("created_at");
                if (from != null) {
                    r.gte(JsonData.of(from));
                }
                if (to != null) {
                    r.lt(JsonData.of(to));
                }
                return r;
            })));
        }
        return filters;
    }

    public static Long toEpochMillis(LocalDateTime time) {
        if (time == null) {
            return null;
        }
        return time.atZone(ZoneId.systemDefault()).toInstant().toEpochMilli();
    }

    private RuntimeException translate(String message, ElasticsearchException e) {
        int status = e.status();
        if (status == 429 || status >= 500) {
            return new TransientStoreException(message + ": " + e.getMessage(), e, StorageErrorCode.ELASTICSEARCH_ERROR);
        }
        return new ServiceException(message + ": " + e.getMessage(), e, StorageErrorCode.ELASTICSEARCH_ERROR);
    }

    private boolean isIndexMissing(Throwable error) {
        if (error == null) {
            return false;
        }
        String message = error.getMessage();
        if (message != null) {
            String lowered = message.toLowerCase(Locale.ROOT);
            if (lowered.contains("index_not_found_exception") || lowered.contains("index_not_found")) {
                return true;
            }
        }
        return isIndexMissing(error.getCause());
    }
}
