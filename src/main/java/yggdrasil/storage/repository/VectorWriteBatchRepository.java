package yggdrasil.storage.repository;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import yggdrasil.storage.model.VectorWriteBatch;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * 向量暂存批次数据访问接口
 */
@Repository
public interface VectorWriteBatchRepository extends JpaRepository<VectorWriteBatch, Long> {

    Optional<VectorWriteBatch> findByGeneration(String generation);

    /**
     * 查询超过宽限期仍未提交的暂存批次
     */
    List<VectorWriteBatch> findByStatusAndCreatedAtBeforeOrderByCreatedAtAsc(VectorWriteBatch.Status status,
                                                                            LocalDateTime createdBefore,
                                                                            Pageable pageable);

    long countByStatus(VectorWriteBatch.Status status);
}
