package yggdrasil.storage.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;
import yggdrasil.storage.model.DynamicTableDescriptor;

import java.util.Optional;

/**
 * 专用表描述符数据访问接口
 */
@Repository
public interface DynamicTableDescriptorRepository extends JpaRepository<DynamicTableDescriptor, Long> {

    Optional<DynamicTableDescriptor> findByTableName(String tableName);

    @Transactional
    @Modifying
    @Query("update DynamicTableDescriptor d set d.estimatedRows = d.estimatedRows + :delta where d.tableName = :tableName")
    int adjustEstimatedRows(@Param("tableName") String tableName, @Param("delta") long delta);
}
