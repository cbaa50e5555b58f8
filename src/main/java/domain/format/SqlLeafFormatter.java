package domain.format;

/**
 * Pure-SQL pretty printer called once per SQL text leaf.
 *
 * <p>Input is already trimmed and never blank. Implementations may throw any
 * RuntimeException; the caller degrades that single leaf to its original text.</p>
 */
@FunctionalInterface
public interface SqlLeafFormatter {

    String format(String sql, ResolvedFormatOptions options);
}
