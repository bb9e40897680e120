package yggdrasil.storage.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;
import yggdrasil.storage.model.VectorMapping;

import java.util.List;

/**
 * 向量映射数据访问接口
 */
@Repository
public interface VectorMappingRepository extends JpaRepository<VectorMapping, Long> {

    List<VectorMapping> findByGenerationOrderByChunkSequenceAsc(String generation);

    long countByGeneration(String generation);

    @Transactional
    @Modifying
    @Query("delete from VectorMapping m where m.generation = :generation")
    int deleteByGeneration(@Param("generation") String generation);
}
