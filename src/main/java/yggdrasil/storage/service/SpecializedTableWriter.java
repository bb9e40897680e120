package yggdrasil.storage.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import yggdrasil.storage.common.convention.errorcode.StorageErrorCode;
import yggdrasil.storage.common.convention.exception.ServiceException;
import yggdrasil.storage.common.convention.exception.TransientStoreException;
import yggdrasil.storage.model.ContentRecord;
import yggdrasil.storage.model.DynamicTableDescriptor;

import java.util.List;
import java.util.Optional;

/**
 * 专用表写入
 * 表名只来自 SpecializedTableSchemaBuilder 的规范化结果，可以安全拼入 SQL
 */
@Service
public class SpecializedTableWriter {

    private static final Logger log = LoggerFactory.getLogger(SpecializedTableWriter.class);

    private final DynamicTableRegistry registry;
    private final JdbcTemplate jdbcTemplate;

    public SpecializedTableWriter(DynamicTableRegistry registry, JdbcTemplate jdbcTemplate) {
        this.registry = registry;
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * 写入一行，按 record_id 幂等
     *
     * @return 表名
     */
    public String write(ContentRecord record, String content, String contentHash) {
        DynamicTableDescriptor descriptor = registry.ensureTable(record.getDomain(), record.getContentType());
        String table = descriptor.getTableName();
        String keywords = record.getKeywords() == null ? null : String.join(",", record.getKeywords());
        try {
            int updated = jdbcTemplate.update(
                "UPDATE " + table + " SET content_hash = ?, title = ?, content = ?, keywords = ? WHERE record_id = ?",
                contentHash, record.getTitle(), content, keywords, record.getId());
            if (updated == 0) {
                jdbcTemplate.update(
                    "INSERT INTO " + table + " (record_id, content_hash, title, content, keywords) VALUES (?, ?, ?, ?, ?)",
                    record.getId(), contentHash, record.getTitle(), content, keywords);
                registry.adjustRows(table, 1);
            }
            log.info("专用表写入完成, 表: {}, 记录: {}", table, record.getId());
            return table;
        } catch (TransientDataAccessException | RecoverableDataAccessException e) {
            throw new TransientStoreException("专用表写入失败: " + table, e, StorageErrorCode.DATABASE_ERROR);
        } catch (DataAccessException e) {
            throw new ServiceException("专用表写入失败: " + table, e, StorageErrorCode.STORAGE_WRITE_FAILED);
        }
    }

    /**
     * 回读校验：行存在且哈希一致
     */
    public boolean isReadable(String table, Long recordId, String expectedHash) {
        List<String> hashes = jdbcTemplate.queryForList(
            "SELECT content_hash FROM " + table + " WHERE record_id = ?", String.class, recordId);
        if (hashes.isEmpty()) {
            return false;
        }
        return expectedHash == null || expectedHash.equals(hashes.get(0));
    }

    public Optional<String> readContent(String table, Long recordId) {
        List<String> rows = jdbcTemplate.queryForList(
            "SELECT content FROM " + table + " WHERE record_id = ?", String.class, recordId);
        return rows.isEmpty() ? Optional.empty() : Optional.ofNullable(rows.get(0));
    }

    public void delete(String table, Long recordId) {
        int deleted = jdbcTemplate.update("DELETE FROM " + table + " WHERE record_id = ?", recordId);
        if (deleted > 0) {
            registry.adjustRows(table, -deleted);
        }
        log.info("已回收专用表行, 表: {}, 记录: {}", table, recordId);
    }
}
