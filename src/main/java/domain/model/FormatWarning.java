package domain.model;

/**
 * A single warning emitted while formatting a mapper file.
 *
 * <p>Warnings are not fatal. The affected statement keeps its original text and the
 * warning tells the operator which one to review.</p>
 */
public final class FormatWarning {

    private final WarningCode code;
    private final String file;
    private final String namespace;
    private final String sqlId;
    private final String message;
    private final String detail;

    public FormatWarning(
            WarningCode code,
            String file,
            String namespace,
            String sqlId,
            String message,
            String detail
    ) {
        this.code = code == null ? WarningCode.TRANSFORM_ERROR : code;
        this.file = nullToEmpty(file);
        this.namespace = nullToEmpty(namespace);
        this.sqlId = nullToEmpty(sqlId);
        this.message = nullToEmpty(message);
        this.detail = nullToEmpty(detail);
    }

    public static FormatWarning of(WarningCode code, FormatContext ctx, String message, String detail) {
        FormatContext c = ctx == null ? FormatContext.EMPTY : ctx;
        return new FormatWarning(code, c.getFile(), c.getNamespace(), c.getSqlId(), message, detail);
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }

    public WarningCode getCode() {
        return code;
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

    public String getMessage() {
        return message;
    }

    public String getDetail() {
        return detail;
    }
}
