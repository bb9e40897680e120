package yggdrasil.storage.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;
import yggdrasil.storage.model.OptimizationRecommendation;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * 优化建议数据访问接口
 */
@Repository
public interface OptimizationRecommendationRepository extends JpaRepository<OptimizationRecommendation, Long> {

    Optional<OptimizationRecommendation> findFirstByTypeAndTargetAndStatus(OptimizationRecommendation.Type type,
                                                                         String target,
                                                                         OptimizationRecommendation.Status status);

    List<OptimizationRecommendation> findByTargetAndStatus(String target, OptimizationRecommendation.Status status);

    List<OptimizationRecommendation> findByStatusOrderByCreatedAtDesc(OptimizationRecommendation.Status status);

    List<OptimizationRecommendation> findAllByOrderByCreatedAtDesc();

    long countByStatus(OptimizationRecommendation.Status status);

    /**
     * 过期超过有效期仍未处理的建议
     */
    @Transactional
    @Modifying
    @Query("update OptimizationRecommendation r set r.status = :expired, r.resolvedAt = :now, "
        + "r.statusReason = 'expired without being applied' "
        + "where r.status = :pending and r.createdAt < :cutoff")
    int expirePending(@Param("cutoff") LocalDateTime cutoff,
                      @Param("now") LocalDateTime now,
                      @Param("pending") OptimizationRecommendation.Status pending,
                      @Param("expired") OptimizationRecommendation.Status expired);
}
