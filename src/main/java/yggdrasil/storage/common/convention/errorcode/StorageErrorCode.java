package yggdrasil.storage.common.convention.errorcode;

/**
 * 存储引擎错误码枚举
 *
 * 错误码规范：
 * - A0xxx: 调用方错误（参数校验、状态冲突等）
 * - B0xxx: 服务端错误（一致性、迁移、数据库等）
 * - C0xxx: 外部依赖错误（Elasticsearch、向量化 API）
 */
public enum StorageErrorCode implements IErrorCode {

    CLIENT_ERROR("A0001", "客户端请求错误"),

    SERVICE_ERROR("B0001", "服务端执行错误"),

    // ==================== 摄取校验 (A01xx) ====================
    PARAM_INVALID("A0102", "参数格式错误"),

    SOURCE_LOCATOR_EMPTY("A0103", "来源地址不能为空"),

    CONTENT_EMPTY("A0104", "内容不能为空"),

    DECLARED_SIZE_INVALID("A0105", "声明大小不能为负数"),

    QUERY_EMPTY("A0106", "查询文本不能为空"),

    // ==================== 记录与推荐 (A04xx) ====================
    RECORD_NOT_FOUND("A0401", "内容记录不存在"),

    RECOMMENDATION_NOT_FOUND("A0402", "优化建议不存在"),

    RECOMMENDATION_NOT_PENDING("A0403", "优化建议已处理"),

    MIGRATION_IN_PROGRESS("A0404", "该记录已有迁移在进行"),

    // ==================== 服务端错误 (B0xxx) ====================
    SEARCH_SERVICE_ERROR("B0102", "检索服务异常"),

    STORAGE_WRITE_FAILED("B0105", "存储写入失败"),

    DATABASE_ERROR("B0106", "数据库操作异常"),

    CONSISTENCY_VIOLATION("B0201", "一致性校验失败"),

    MIGRATION_FAILED("B0202", "迁移失败"),

    // ==================== 外部依赖错误 (C0xxx) ====================
    ELASTICSEARCH_ERROR("C0101", "Elasticsearch服务异常"),

    EMBEDDING_API_ERROR("C0104", "向量化API异常");

    private final String code;
    private final String message;

    StorageErrorCode(String code, String message) {
        this.code = code;
        this.message = message;
    }

    @Override
    public String code() {
        return this.code;
    }

    @Override
    public String message() {
        return this.message;
    }
}
