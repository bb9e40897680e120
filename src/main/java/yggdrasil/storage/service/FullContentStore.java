package yggdrasil.storage.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.NonTransientDataAccessException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import yggdrasil.storage.common.convention.errorcode.StorageErrorCode;
import yggdrasil.storage.common.convention.exception.ServiceException;
import yggdrasil.storage.common.convention.exception.TransientStoreException;
import yggdrasil.storage.model.FullContentBlob;
import yggdrasil.storage.repository.FullContentBlobRepository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * 全文存储
 * 以内容哈希为幂等键：重复写入同一内容返回已有 blob
 */
@Service
public class FullContentStore {

    private static final Logger log = LoggerFactory.getLogger(FullContentStore.class);

    private final FullContentBlobRepository blobRepository;

    public FullContentStore(FullContentBlobRepository blobRepository) {
        this.blobRepository = blobRepository;
    }

    /**
     * 幂等写入全文
     *
     * @return blob id
     * @throws TransientStoreException 数据库暂时不可用
     */
    public Long writeIdempotent(String contentHash, String fullContent, List<String> chunks, Long ownerRecordId) {
        try {
            Optional<Long> claimed = claimExisting(contentHash);
            if (claimed.isPresent()) {
                log.debug("全文已存在，复用 blob: {}", claimed.get());
                return claimed.get();
            }

            FullContentBlob blob = new FullContentBlob();
            blob.setContentHash(contentHash);
            blob.setFullContent(fullContent);
            blob.setChunkedContent(chunks);
            blob.setOwnerRecordId(ownerRecordId);
            blob.setLastClaimedAt(LocalDateTime.now());
            try {
                Long blobId = blobRepository.saveAndFlush(blob).getId();
                log.info("全文写入完成，blob: {}, 字符数: {}", blobId, fullContent.length());
                return blobId;
            } catch (DataIntegrityViolationException e) {
                // 并发写入同一哈希，以先提交者为准
                return claimExisting(contentHash)
                    .orElseThrow(() -> new ServiceException("全文哈希冲突后未找到已有记录", e,
                        StorageErrorCode.STORAGE_WRITE_FAILED));
            }
        } catch (TransientDataAccessException | RecoverableDataAccessException e) {
            throw new TransientStoreException("全文写入失败: " + e.getMessage(), e, StorageErrorCode.DATABASE_ERROR);
        } catch (NonTransientDataAccessException e) {
            throw new ServiceException("全文写入失败: " + e.getMessage(), e, StorageErrorCode.STORAGE_WRITE_FAILED);
        }
    }

    /**
     * 先刷新认领时间再读取；回收方持有行锁时这里会等待，随后认领不到即视为不存在
     */
    private Optional<Long> claimExisting(String contentHash) {
        if (blobRepository.claimByContentHash(contentHash, LocalDateTime.now()) == 0) {
            return Optional.empty();
        }
        return blobRepository.findByContentHash(contentHash).map(FullContentBlob::getId);
    }

    public Optional<FullContentBlob> find(Long blobId) {
        if (blobId == null) {
            return Optional.empty();
        }
        return blobRepository.findById(blobId);
    }

    /**
     * 回读校验：blob 存在且哈希一致
     */
    public boolean isReadable(Long blobId, String expectedHash) {
        return find(blobId)
            .map(blob -> expectedHash == null || blob.matchesHash(expectedHash))
            .orElse(false);
    }

    /**
     * 在行锁内回收 blob：claimedBefore 之后被认领过的保留
     *
     * @return true 表示已删除或本就不存在，false 表示近期被认领而保留
     */
    @Transactional
    public boolean deleteIfUnclaimed(Long blobId, LocalDateTime claimedBefore) {
        Optional<FullContentBlob> locked = blobRepository.lockById(blobId);
        if (locked.isEmpty()) {
            return true;
        }
        if (locked.get().claimedAfter(claimedBefore)) {
            log.debug("blob {} 在 {} 之后被认领，暂不回收", blobId, claimedBefore);
            return false;
        }
        blobRepository.delete(locked.get());
        log.info("已回收全文 blob: {}", blobId);
        return true;
    }
}
