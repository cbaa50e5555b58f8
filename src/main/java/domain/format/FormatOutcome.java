package domain.format;

/**
 * Result of {@link MybatisSqlFormatter#tryFormat(String, FormatterOptions)}.
 */
public final class FormatOutcome {

    public enum Status {
        /** parsed and rendered */
        FORMATTED,
        /** empty / whitespace-only input, returned unchanged */
        SKIPPED_BLANK,
        /** internal failure, original input returned unchanged */
        FALLBACK
    }

    private final String text;
    private final Status status;
    private final RuntimeException failure;

    private FormatOutcome(String text, Status status, RuntimeException failure) {
        this.text = text;
        this.status = status;
        this.failure = failure;
    }

    static FormatOutcome formatted(String text) {
        return new FormatOutcome(text, Status.FORMATTED, null);
    }

    static FormatOutcome skipped(String input) {
        return new FormatOutcome(input, Status.SKIPPED_BLANK, null);
    }

    static FormatOutcome fallback(String input, RuntimeException failure) {
        return new FormatOutcome(input, Status.FALLBACK, failure);
    }

    public String getText() {
        return text;
    }

    public Status getStatus() {
        return status;
    }

    /** null unless {@link Status#FALLBACK}. */
    public RuntimeException getFailure() {
        return failure;
    }

    public boolean isFallback() {
        return status == Status.FALLBACK;
    }
}
