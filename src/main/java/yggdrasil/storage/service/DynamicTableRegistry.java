package yggdrasil.storage.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Service;
import yggdrasil.storage.common.convention.errorcode.StorageErrorCode;
import yggdrasil.storage.common.convention.exception.ServiceException;
import yggdrasil.storage.common.convention.exception.TransientStoreException;
import yggdrasil.storage.model.DynamicTableDescriptor;
import yggdrasil.storage.repository.DynamicTableDescriptorRepository;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * 专用表注册表
 * 描述符先落库为 DECLARED，DDL 执行成功后置为 APPLIED；失败置为 FAILED，下次写入时重新应用
 */
@Service
public class DynamicTableRegistry {

    private static final Logger log = LoggerFactory.getLogger(DynamicTableRegistry.class);

    private final DynamicTableDescriptorRepository descriptorRepository;
    private final SpecializedTableSchemaBuilder schemaBuilder;
    private final JdbcTemplate jdbcTemplate;

    public DynamicTableRegistry(DynamicTableDescriptorRepository descriptorRepository,
                                SpecializedTableSchemaBuilder schemaBuilder,
                                JdbcTemplate jdbcTemplate) {
        this.descriptorRepository = descriptorRepository;
        this.schemaBuilder = schemaBuilder;
        this.jdbcTemplate = jdbcTemplate;
    }

    /**
     * 确保领域与内容类型对应的专用表已建好
     *
     * @return 已应用的描述符
     */
    public DynamicTableDescriptor ensureTable(String domain, String contentType) {
        DynamicTableDescriptor declared = schemaBuilder.build(domain, contentType);
        DynamicTableDescriptor descriptor = descriptorRepository.findByTableName(declared.getTableName())
            .orElseGet(() -> declare(declared));
        if (descriptor.isApplied()) {
            return descriptor;
        }
        return apply(descriptor);
    }

    public Optional<DynamicTableDescriptor> find(String tableName) {
        return descriptorRepository.findByTableName(tableName);
    }

    public void adjustRows(String tableName, long delta) {
        descriptorRepository.adjustEstimatedRows(tableName, delta);
    }

    /**
     * 执行一条独立的 DDL（如优化建议中的索引）
     */
    public void executeDdl(String ddl) {
        try {
            jdbcTemplate.execute(ddl);
            log.info("DDL 执行完成: {}", ddl);
        } catch (TransientDataAccessException | RecoverableDataAccessException e) {
            throw new TransientStoreException("DDL 执行失败: " + e.getMessage(), e, StorageErrorCode.DATABASE_ERROR);
        } catch (DataAccessException e) {
            throw new ServiceException("DDL 执行失败: " + e.getMessage(), e, StorageErrorCode.DATABASE_ERROR);
        }
    }

    private DynamicTableDescriptor declare(DynamicTableDescriptor descriptor) {
        try {
            return descriptorRepository.saveAndFlush(descriptor);
        } catch (DataIntegrityViolationException e) {
            // 并发声明同一张表
            return descriptorRepository.findByTableName(descriptor.getTableName()).orElseThrow(() -> e);
        }
    }

    private DynamicTableDescriptor apply(DynamicTableDescriptor descriptor) {
        List<String> statements = new ArrayList<>();
        if (descriptor.getSchemaDefinition() != null) {
            statements.addAll(descriptor.getSchemaDefinition());
        }
        if (descriptor.getIndexesDefinition() != null) {
            statements.addAll(descriptor.getIndexesDefinition());
        }
        try {
            for (String statement : statements) {
                jdbcTemplate.execute(statement);
            }
        } catch (DataAccessException e) {
            descriptor.setStatus(DynamicTableDescriptor.Status.FAILED);
            descriptor.setLastError(abbreviate(e.getMessage()));
            descriptorRepository.save(descriptor);
            log.error("专用表 {} 结构应用失败", descriptor.getTableName(), e);
            if (e instanceof TransientDataAccessException || e instanceof RecoverableDataAccessException) {
                throw new TransientStoreException("专用表结构应用失败: " + descriptor.getTableName(), e,
                    StorageErrorCode.DATABASE_ERROR);
            }
            throw new ServiceException("专用表结构应用失败: " + descriptor.getTableName(), e,
                StorageErrorCode.STORAGE_WRITE_FAILED);
        }
        descriptor.setStatus(DynamicTableDescriptor.Status.APPLIED);
        descriptor.setLastError(null);
        DynamicTableDescriptor applied = descriptorRepository.save(descriptor);
        log.info("专用表结构已应用: {} (v{})", applied.getTableName(), applied.getSchemaVersion());
        return applied;
    }

    private String abbreviate(String message) {
        if (message == null) {
            return null;
        }
        return message.length() <= 1000 ? message : message.substring(0, 1000);
    }
}
