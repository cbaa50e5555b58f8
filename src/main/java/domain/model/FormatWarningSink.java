package domain.model;

/**
 * Sink for format warnings.
 *
 * <p>Decouples the mapper formatter from the CLI and the report writers.</p>
 */
public interface FormatWarningSink {

    static FormatWarningSink none() {
        return NullFormatWarningSink.INSTANCE;
    }

    void warn(FormatWarning warning);
}
