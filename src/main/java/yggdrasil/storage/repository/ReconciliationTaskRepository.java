package yggdrasil.storage.repository;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import yggdrasil.storage.model.ReconciliationTask;
import yggdrasil.storage.model.StorageLeg;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * 补写任务数据访问接口
 */
@Repository
public interface ReconciliationTaskRepository extends JpaRepository<ReconciliationTask, Long> {

    List<ReconciliationTask> findByStatusAndNextAttemptAtLessThanEqualOrderByNextAttemptAtAsc(
        ReconciliationTask.Status status, LocalDateTime dueBefore, Pageable pageable);

    Optional<ReconciliationTask> findFirstByRecordIdAndLegAndStatus(Long recordId,
                                                                  StorageLeg leg,
                                                                  ReconciliationTask.Status status);

    List<ReconciliationTask> findByRecordIdOrderByIdAsc(Long recordId);

    long countByStatus(ReconciliationTask.Status status);
}
