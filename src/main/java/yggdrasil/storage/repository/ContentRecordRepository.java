package yggdrasil.storage.repository;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;
import yggdrasil.storage.dto.StatusCountView;
import yggdrasil.storage.dto.StrategyOverviewView;
import yggdrasil.storage.dto.TextRankView;
import yggdrasil.storage.model.ContentRecord;
import yggdrasil.storage.model.RecordStatus;
import yggdrasil.storage.model.StorageStrategy;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * 内容记录数据访问接口
 */
@Repository
public interface ContentRecordRepository extends JpaRepository<ContentRecord, Long> {

    Optional<ContentRecord> findBySourceLocator(String sourceLocator);

    List<ContentRecord> findByIdIn(Collection<Long> ids);

    /**
     * 重复抓取：只合并统计，不改内容与指针
     */
    @Transactional
    @Modifying
    @Query("update ContentRecord r set r.scrapeCount = r.scrapeCount + 1, r.lastScrapedAt = :scrapedAt, "
        + "r.lastSeenHash = :contentHash where r.id = :id")
    int mergeRescrape(@Param("id") Long id,
                      @Param("scrapedAt") LocalDateTime scrapedAt,
                      @Param("contentHash") String contentHash);

    /**
     * 访问计数宽松累加，不参与乐观锁版本
     */
    @Transactional
    @Modifying
    @Query("update ContentRecord r set r.queryCount = r.queryCount + :hits, r.lastQueriedAt = :queriedAt, "
        + "r.accessFrequency = r.accessFrequency * :decay + :hits where r.id = :id")
    int addAccessHits(@Param("id") Long id,
                      @Param("hits") long hits,
                      @Param("decay") double decay,
                      @Param("queriedAt") LocalDateTime queriedAt);

    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("update ContentRecord r set r.status = :target where r.id = :id and r.status = :expected")
    int transitionStatus(@Param("id") Long id,
                         @Param("expected") RecordStatus expected,
                         @Param("target") RecordStatus target);

    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("update ContentRecord r set r.manualReview = true where r.id = :id")
    int flagManualReview(@Param("id") Long id);

    /**
     * 原子切换位置指针
     * 版本不匹配时返回 0，原指针保持不变
     */
    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("update ContentRecord r set "
        + "r.location.fullBlobId = :fullBlobId, "
        + "r.location.vectorCollection = :vectorCollection, "
        + "r.location.vectorGeneration = :vectorGeneration, "
        + "r.location.vectorChunkCount = :vectorChunkCount, "
        + "r.location.specializedTable = :specializedTable, "
        + "r.contentHash = :contentHash, "
        + "r.strategy = :strategy, r.policyVersion = :policyVersion, r.confidenceScore = :confidence, "
        + "r.status = :status, r.version = r.version + 1 "
        + "where r.id = :id and r.version = :version")
    int swapLocation(@Param("id") Long id,
                     @Param("version") long version,
                     @Param("fullBlobId") Long fullBlobId,
                     @Param("vectorCollection") String vectorCollection,
                     @Param("vectorGeneration") String vectorGeneration,
                     @Param("vectorChunkCount") Integer vectorChunkCount,
                     @Param("specializedTable") String specializedTable,
                     @Param("contentHash") String contentHash,
                     @Param("strategy") StorageStrategy strategy,
                     @Param("policyVersion") int policyVersion,
                     @Param("confidence") double confidence,
                     @Param("status") RecordStatus status);

    @Query("select case when count(r) > 0 then true else false end from ContentRecord r "
        + "where r.location.fullBlobId = :blobId")
    boolean isBlobReferenced(@Param("blobId") Long blobId);

    @Query("select case when count(r) > 0 then true else false end from ContentRecord r "
        + "where r.location.vectorGeneration = :generation")
    boolean isGenerationReferenced(@Param("generation") String generation);

    @Query("select r from ContentRecord r where r.strategy = :strategy and r.declaredSize > :size "
        + "and r.status = :status order by r.declaredSize desc")
    List<ContentRecord> findOversized(@Param("strategy") StorageStrategy strategy,
                                      @Param("size") long size,
                                      @Param("status") RecordStatus status,
                                      Pageable pageable);

    List<ContentRecord> findByPolicyVersionLessThanAndStatusOrderByIdAsc(int policyVersion,
                                                                       RecordStatus status,
                                                                       Pageable pageable);

    List<ContentRecord> findByStatusOrderByIdAsc(RecordStatus status, Pageable pageable);

    @Query("select r.status as status, count(r) as total from ContentRecord r group by r.status")
    List<StatusCountView> countGroupedByStatus();

    long countByManualReviewTrue();

    /**
     * 全文排序：标题与预览、完整正文两路 ts_rank，同一记录取最大值
     * 过滤条件直接下推到 SQL，未就绪记录不参与
     */
    @Query(value = "SELECT ranked.id AS id, MAX(ranked.text_rank) AS rank FROM ("
        + " SELECT r.id AS id, CAST(ts_rank(to_tsvector('english', COALESCE(r.title, '') || ' ' || COALESCE(r.content_preview, '')),"
        + "   plainto_tsquery('english', :query)) AS DOUBLE PRECISION) AS text_rank"
        + " FROM content_records r"
        + " WHERE r.status IN ('READY', 'DEGRADED', 'MIGRATING')"
        + "   AND to_tsvector('english', COALESCE(r.title, '') || ' ' || COALESCE(r.content_preview, '')) @@ plainto_tsquery('english', :query)"
        + "   AND (CAST(:domain AS VARCHAR) IS NULL OR r.domain = CAST(:domain AS VARCHAR))"
        + "   AND (CAST(:contentType AS VARCHAR) IS NULL OR r.content_type = CAST(:contentType AS VARCHAR))"
        + "   AND (CAST(:createdFrom AS TIMESTAMP) IS NULL OR r.created_at >= CAST(:createdFrom AS TIMESTAMP))"
        + "   AND (CAST(:createdTo AS TIMESTAMP) IS NULL OR r.created_at < CAST(:createdTo AS TIMESTAMP))"
        + " UNION ALL"
        + " SELECT r.id AS id, CAST(ts_rank(to_tsvector('english', b.full_content),"
        + "   plainto_tsquery('english', :query)) AS DOUBLE PRECISION) AS text_rank"
        + " FROM content_records r JOIN full_content_blobs b ON b.id = r.full_blob_id"
        + " WHERE r.status IN ('READY', 'DEGRADED', 'MIGRATING')"
        + "   AND to_tsvector('english', b.full_content) @@ plainto_tsquery('english', :query)"
        + "   AND (CAST(:domain AS VARCHAR) IS NULL OR r.domain = CAST(:domain AS VARCHAR))"
        + "   AND (CAST(:contentType AS VARCHAR) IS NULL OR r.content_type = CAST(:contentType AS VARCHAR))"
        + "   AND (CAST(:createdFrom AS TIMESTAMP) IS NULL OR r.created_at >= CAST(:createdFrom AS TIMESTAMP))"
        + "   AND (CAST(:createdTo AS TIMESTAMP) IS NULL OR r.created_at < CAST(:createdTo AS TIMESTAMP))"
        + ") ranked GROUP BY ranked.id ORDER BY rank DESC, id ASC LIMIT :limit",
        nativeQuery = true)
    List<TextRankView> rankFullText(@Param("query") String query,
                                    @Param("domain") String domain,
                                    @Param("contentType") String contentType,
                                    @Param("createdFrom") LocalDateTime createdFrom,
                                    @Param("createdTo") LocalDateTime createdTo,
                                    @Param("limit") int limit);

    /**
     * 存储策略概览：按策略与领域统计
     */
    @Query("select r.strategy as strategy, r.domain as domain, count(r) as recordCount, "
        + "sum(r.declaredSize) as totalSize, avg(r.confidenceScore) as avgConfidence "
        + "from ContentRecord r group by r.strategy, r.domain order by r.strategy, r.domain")
    List<StrategyOverviewView> strategyOverview();
}
