package domain.model;

/**
 * Per-statement context used for warning attribution: file + namespace + sqlId.
 */
public final class FormatContext {

    public static final FormatContext EMPTY = new FormatContext("", "", "");

    private final String file;
    private final String namespace;
    private final String sqlId;

    public FormatContext(String file, String namespace, String sqlId) {
        this.file = safe(file);
        this.namespace = safe(namespace);
        this.sqlId = safe(sqlId);
    }

    private static String safe(String s) {
        return s == null ? "" : s;
    }

    public FormatContext withNamespace(String ns) {
        return new FormatContext(file, ns, sqlId);
    }

    public FormatContext withSqlId(String id) {
        return new FormatContext(file, namespace, id);
    }

    public String getFile() {
        return file;
    }

    public String getNamespace() {
        return namespace;
    }

    public String getSqlId() {
        return sqlId;
    }
}
