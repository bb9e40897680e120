package yggdrasil.storage.repository;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import yggdrasil.storage.model.GarbageCollectionTask;

import java.time.LocalDateTime;
import java.util.List;

/**
 * 旧位置回收任务数据访问接口
 */
@Repository
public interface GarbageCollectionTaskRepository extends JpaRepository<GarbageCollectionTask, Long> {

    List<GarbageCollectionTask> findByStatusAndDueAtLessThanEqualOrderByDueAtAsc(GarbageCollectionTask.Status status,
                                                                              LocalDateTime dueBefore,
                                                                              Pageable pageable);
}
