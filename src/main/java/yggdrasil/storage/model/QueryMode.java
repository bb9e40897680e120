package yggdrasil.storage.model;

/**
 * 检索执行计划
 */
public enum QueryMode {

    TEXT(true, false),
    VECTOR(false, true),
    HYBRID(true, true);

    private final boolean usesText;
    private final boolean usesVector;

    QueryMode(boolean usesText, boolean usesVector) {
        this.usesText = usesText;
        this.usesVector = usesVector;
    }

    public boolean usesText() {
        return usesText;
    }

    public boolean usesVector() {
        return usesVector;
    }

    /**
     * 语义开关：未指定走混合，true 仅向量，false 仅全文
     */
    public static QueryMode fromSemanticFlag(Boolean semantic) {
        if (semantic == null) {
            return HYBRID;
        }
        return semantic ? VECTOR : TEXT;
    }
}
