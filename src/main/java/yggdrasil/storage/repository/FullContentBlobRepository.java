package yggdrasil.storage.repository;

import jakarta.persistence.LockModeType;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;
import yggdrasil.storage.model.FullContentBlob;

import java.time.LocalDateTime;
import java.util.Optional;

/**
 * 全文内容数据访问接口
 */
@Repository
public interface FullContentBlobRepository extends JpaRepository<FullContentBlob, Long> {

    Optional<FullContentBlob> findByContentHash(String contentHash);

    /**
     * 认领已有 blob，与回收时的行锁互斥
     *
     * @return 更新行数，0 表示该哈希尚无 blob
     */
    @Transactional
    @Modifying(clearAutomatically = true)
    @Query("update FullContentBlob b set b.lastClaimedAt = :claimedAt where b.contentHash = :contentHash")
    int claimByContentHash(@Param("contentHash") String contentHash,
                           @Param("claimedAt") LocalDateTime claimedAt);

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select b from FullContentBlob b where b.id = :id")
    Optional<FullContentBlob> lockById(@Param("id") Long id);
}
