package yggdrasil.storage.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import yggdrasil.storage.model.ContentAnnotation;

import java.util.List;
import java.util.Optional;

/**
 * 内容标注数据访问接口
 */
@Repository
public interface ContentAnnotationRepository extends JpaRepository<ContentAnnotation, Long> {

    Optional<ContentAnnotation> findByRecordIdAndAgent(Long recordId, String agent);

    List<ContentAnnotation> findByRecordIdOrderByAgentAsc(Long recordId);
}
