package domain.mapper;

/**
 * Outcome of one statement inside a mapper document.
 */
public final class StatementFormatResult {

    public enum Status {
        /** body replaced with formatted text */
        FORMATTED,
        /** formatted text equals the original body */
        UNCHANGED,
        /** blank body or a single CDATA section */
        SKIPPED,
        /** body could not be parsed; original kept */
        FALLBACK,
        /** formatted text failed the dynamic tag check; original kept */
        REVERTED
    }

    private final MapperStatement statement;
    private final Status status;
    private final String message;

    public StatementFormatResult(MapperStatement statement, Status status, String message) {
        this.statement = statement;
        this.status = status;
        this.message = message == null ? "" : message;
    }

    public MapperStatement getStatement() {
        return statement;
    }

    public Status getStatus() {
        return status;
    }

    public String getMessage() {
        return message;
    }
}
