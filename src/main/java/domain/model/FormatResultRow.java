package domain.model;

/**
 * A single statement (or file) outcome row for reporting.
 */
public final class FormatResultRow {

    /**
     * e.g. FORMATTED / UNCHANGED / SKIPPED / FALLBACK / REVERTED / NOT_MAPPER / ERROR
     */
    private final String status;
    private final String file;
    private final String namespace;
    private final String sqlId;

    /**
     * select / insert / update / delete, empty for file level rows
     */
    private final String statementType;
    private final String message;

    /**
     * 옵션성 상세 정보 (예외 메시지, 파싱 실패 위치 등)
     */
    private final String detail;

    public FormatResultRow(
            String status,
            String file,
            String namespace,
            String sqlId,
            String statementType,
            String message,
            String detail
    ) {
        this.status = nullToEmpty(status);
        this.file = nullToEmpty(file);
        this.namespace = nullToEmpty(namespace);
        this.sqlId = nullToEmpty(sqlId);
        this.statementType = nullToEmpty(statementType);
        this.message = nullToEmpty(message);
        this.detail = nullToEmpty(detail);
    }

    private static String nullToEmpty(String s) {
        return s == null ? "" : s;
    }

    public String getStatus() {
        return status;
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

    public String getStatementType() {
        return statementType;
    }

    public String getMessage() {
        return message;
    }

    public String getDetail() {
        return detail;
    }
}
