package yggdrasil.storage.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;
import yggdrasil.storage.dto.DomainLatencyView;
import yggdrasil.storage.model.PerformanceSample;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 查询性能采样数据访问接口
 */
@Repository
public interface PerformanceSampleRepository extends JpaRepository<PerformanceSample, Long> {

    /**
     * 滚动窗口内平均延迟超过阈值且样本充足的领域
     */
    @Query("select p.targetDomain as domain, avg(p.latencyMs) as avgLatencyMs, count(p) as sampleCount "
        + "from PerformanceSample p "
        + "where p.executedAt >= :since and p.targetDomain is not null "
        + "group by p.targetDomain "
        + "having count(p) >= :minSamples and avg(p.latencyMs) > :thresholdMs "
        + "order by p.targetDomain")
    List<DomainLatencyView> findSlowDomains(@Param("since") LocalDateTime since,
                                            @Param("minSamples") long minSamples,
                                            @Param("thresholdMs") double thresholdMs);

    @Transactional
    @Modifying
    @Query("delete from PerformanceSample p where p.executedAt < :cutoff")
    int deleteOlderThan(@Param("cutoff") LocalDateTime cutoff);
}
