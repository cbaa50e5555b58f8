package domain.format;

/**
 * Fully resolved formatting options (defaults merged with overrides). Never contains nulls.
 */
public final class ResolvedFormatOptions {

    public static final SqlDialect DEFAULT_DIALECT = SqlDialect.MYSQL;
    public static final KeywordCase DEFAULT_KEYWORD_CASE = KeywordCase.UPPER;
    public static final int DEFAULT_TAB_WIDTH = 4;
    public static final IndentStyle DEFAULT_INDENT_STYLE = IndentStyle.STANDARD;
    public static final boolean DEFAULT_DENSE_OPERATORS = false;

    private static final ResolvedFormatOptions DEFAULTS = new ResolvedFormatOptions(
            DEFAULT_DIALECT, DEFAULT_KEYWORD_CASE, DEFAULT_TAB_WIDTH, DEFAULT_INDENT_STYLE, DEFAULT_DENSE_OPERATORS);

    private final SqlDialect dialect;
    private final KeywordCase keywordCase;
    private final int tabWidth;
    private final IndentStyle indentStyle;
    private final boolean denseOperators;

    private ResolvedFormatOptions(SqlDialect dialect,
                                  KeywordCase keywordCase,
                                  int tabWidth,
                                  IndentStyle indentStyle,
                                  boolean denseOperators) {
        this.dialect = dialect;
        this.keywordCase = keywordCase;
        this.tabWidth = tabWidth;
        this.indentStyle = indentStyle;
        this.denseOperators = denseOperators;
    }

    public static ResolvedFormatOptions defaults() {
        return DEFAULTS;
    }

    /**
     * defaults ← overrides. Absent (null) fields keep the default; tabWidth &lt;= 0 counts as absent.
     */
    public static ResolvedFormatOptions resolve(FormatterOptions overrides) {
        if (overrides == null) return DEFAULTS;

        Integer tw = overrides.getTabWidth();
        return new ResolvedFormatOptions(
                overrides.getDialect() != null ? overrides.getDialect() : DEFAULT_DIALECT,
                overrides.getKeywordCase() != null ? overrides.getKeywordCase() : DEFAULT_KEYWORD_CASE,
                (tw != null && tw > 0) ? tw : DEFAULT_TAB_WIDTH,
                overrides.getIndentStyle() != null ? overrides.getIndentStyle() : DEFAULT_INDENT_STYLE,
                overrides.getDenseOperators() != null ? overrides.getDenseOperators() : DEFAULT_DENSE_OPERATORS
        );
    }

    public SqlDialect getDialect() {
        return dialect;
    }

    public KeywordCase getKeywordCase() {
        return keywordCase;
    }

    public int getTabWidth() {
        return tabWidth;
    }

    public IndentStyle getIndentStyle() {
        return indentStyle;
    }

    public boolean isDenseOperators() {
        return denseOperators;
    }

    /** tabWidth spaces repeated depth times. */
    public String indent(int depth) {
        if (depth <= 0) return "";
        return " ".repeat(tabWidth * depth);
    }

    @Override
    public String toString() {
        return "dialect=" + dialect.getTag()
                + ", keywordCase=" + keywordCase.getTag()
                + ", tabWidth=" + tabWidth
                + ", indentStyle=" + indentStyle.getTag()
                + ", denseOperators=" + denseOperators;
    }
}
