package domain.format;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * MyBatis SQL 본문 포매터 (entry point).
 *
 * <p>parse ({@link MybatisSqlParser}) -> render ({@link MybatisCstPrinter}) -> cleanup.
 * Dynamic tags, attributes and {@code #{}}/{@code ${}} placeholders are reproduced verbatim; only
 * whitespace and keyword case around them change.</p>
 *
 * <p>{@link #format} never throws. On any internal failure it returns the input unchanged
 * (logged at WARN). Use {@link #tryFormat} when the caller needs to know that happened.</p>
 *
 * <p>Stateless apart from the leaf formatter; safe to share across threads if the leaf formatter is.</p>
 */
public final class MybatisSqlFormatter {

    private static final Logger log = LoggerFactory.getLogger(MybatisSqlFormatter.class);

    private final SqlLeafFormatter leafFormatter;

    public MybatisSqlFormatter() {
        this(new BuiltinSqlLeafFormatter());
    }

    public MybatisSqlFormatter(SqlLeafFormatter leafFormatter) {
        if (leafFormatter == null) throw new IllegalArgumentException("leafFormatter is null");
        this.leafFormatter = leafFormatter;
    }

    public String format(String input) {
        return format(input, null);
    }

    public String format(String input, FormatterOptions overrides) {
        return tryFormat(input, overrides).getText();
    }

    public FormatOutcome tryFormat(String input, FormatterOptions overrides) {
        if (input == null || input.trim().isEmpty()) {
            return FormatOutcome.skipped(input == null ? "" : input);
        }

        try {
            ResolvedFormatOptions options = resolveOptions(overrides);
            RootNode root = MybatisSqlParser.parse(input);
            String rendered = new MybatisCstPrinter(leafFormatter, options).render(root);
            return FormatOutcome.formatted(cleanup(rendered));
        } catch (RuntimeException e) {
            log.warn("MyBatis SQL format failed, original text kept: {}", e.getMessage());
            log.debug("format failure detail", e);
            return FormatOutcome.fallback(input, e);
        }
    }

    public static ResolvedFormatOptions resolveOptions(FormatterOptions overrides) {
        return ResolvedFormatOptions.resolve(overrides);
    }

    public static SqlDialect detectDialect(String sql) {
        return SqlDialectDetector.detect(sql);
    }

    /**
     * Parsed tree outline, or {@code "Error: <message>"} when the input does not parse.
     */
    public static String debugPrintCst(String input) {
        try {
            return CstDebugPrinter.print(MybatisSqlParser.parse(input));
        } catch (CstParseException e) {
            return "Error: " + e.getMessage();
        }
    }

    /** trim, strip trailing blanks per line, collapse 2+ blank lines into one. */
    static String cleanup(String rendered) {
        String[] lines = rendered.split("\n", -1);
        StringBuilder sb = new StringBuilder(rendered.length());
        for (int i = 0; i < lines.length; i++) {
            if (i > 0) sb.append('\n');
            sb.append(rtrim(lines[i]));
        }
        return sb.toString()
                .replaceAll("\n{3,}", "\n\n")
                .trim();
    }

    private static String rtrim(String s) {
        int end = s.length();
        while (end > 0 && Character.isWhitespace(s.charAt(end - 1))) end--;
        return s.substring(0, end);
    }
}
