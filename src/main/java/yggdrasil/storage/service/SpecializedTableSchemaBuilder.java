package yggdrasil.storage.service;

import org.springframework.stereotype.Component;
import yggdrasil.storage.model.DynamicTableDescriptor;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * 专用表结构生成器
 * 只产出声明式描述符（建表与索引 DDL），执行交给 DynamicTableRegistry
 */
@Component
public class SpecializedTableSchemaBuilder {

    /** 表结构版本，结构变化时递增，新版本对应新表名 */
    public static final int SCHEMA_VERSION = 1;

    private static final int MAX_IDENTIFIER_LENGTH = 63;

    public DynamicTableDescriptor build(String domain, String contentType) {
        String normalizedDomain = sanitize(domain, "general");
        String normalizedType = sanitize(contentType, "document");
        String tableName = truncate("spec_" + normalizedDomain + "_" + normalizedType + "_v" + SCHEMA_VERSION);

        List<String> schema = new ArrayList<>();
        schema.add("CREATE TABLE IF NOT EXISTS " + tableName + " ("
            + "record_id BIGINT PRIMARY KEY, "
            + "content_hash VARCHAR(64) NOT NULL, "
            + "title VARCHAR(512), "
            + "content TEXT NOT NULL, "
            + "keywords TEXT, "
            + "created_at TIMESTAMP DEFAULT CURRENT_TIMESTAMP)");

        List<String> indexes = new ArrayList<>();
        indexes.add("CREATE INDEX IF NOT EXISTS " + truncate("idx_" + tableName + "_hash")
            + " ON " + tableName + " (content_hash)");
        indexes.add("CREATE INDEX IF NOT EXISTS " + truncate("idx_" + tableName + "_fts")
            + " ON " + tableName + " USING GIN (to_tsvector('english', content))");

        DynamicTableDescriptor descriptor = new DynamicTableDescriptor();
        descriptor.setTableName(tableName);
        descriptor.setDomain(normalizedDomain);
        descriptor.setContentType(normalizedType);
        descriptor.setSchemaVersion(SCHEMA_VERSION);
        descriptor.setSchemaDefinition(schema);
        descriptor.setIndexesDefinition(indexes);
        descriptor.setStatus(DynamicTableDescriptor.Status.DECLARED);
        return descriptor;
    }

    /**
     * 领域查询慢时建议添加的部分索引
     */
    public String domainIndexDdl(String domain) {
        String normalizedDomain = sanitize(domain, "general");
        return "CREATE INDEX IF NOT EXISTS " + truncate("idx_content_records_" + normalizedDomain + "_created")
            + " ON content_records (created_at, id) WHERE domain = '" + normalizedDomain + "'";
    }

    /**
     * 标识符只保留小写字母、数字和下划线
     */
    static String sanitize(String value, String fallback) {
        if (value == null || value.isBlank()) {
            return fallback;
        }
        String cleaned = value.toLowerCase(Locale.ROOT).replaceAll("[^a-z0-9_]+", "_").replaceAll("^_+|_+$", "");
        return cleaned.isEmpty() ? fallback : cleaned;
    }

    private static String truncate(String identifier) {
        return identifier.length() <= MAX_IDENTIFIER_LENGTH ? identifier : identifier.substring(0, MAX_IDENTIFIER_LENGTH);
    }
}
