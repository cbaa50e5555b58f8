package domain.format;

/**
 * Caller overrides for {@link MybatisSqlFormatter}.
 *
 * <p>Every field is optional: {@code null} means "use the default". A non-positive
 * {@code tabWidth} is treated the same as {@code null}.</p>
 */
public final class FormatterOptions {

    private static final FormatterOptions NONE = builder().build();

    private final SqlDialect dialect;
    private final KeywordCase keywordCase;
    private final Integer tabWidth;
    private final IndentStyle indentStyle;
    private final Boolean denseOperators;

    private FormatterOptions(Builder b) {
        this.dialect = b.dialect;
        this.keywordCase = b.keywordCase;
        this.tabWidth = b.tabWidth;
        this.indentStyle = b.indentStyle;
        this.denseOperators = b.denseOperators;
    }

    /** No overrides at all. */
    public static FormatterOptions none() {
        return NONE;
    }

    public static Builder builder() {
        return new Builder();
    }

    public SqlDialect getDialect() {
        return dialect;
    }

    public KeywordCase getKeywordCase() {
        return keywordCase;
    }

    public Integer getTabWidth() {
        return tabWidth;
    }

    public IndentStyle getIndentStyle() {
        return indentStyle;
    }

    public Boolean getDenseOperators() {
        return denseOperators;
    }

    /** Copy with only the dialect replaced. */
    public FormatterOptions withDialect(SqlDialect d) {
        return builder()
                .dialect(d)
                .keywordCase(keywordCase)
                .tabWidth(tabWidth)
                .indentStyle(indentStyle)
                .denseOperators(denseOperators)
                .build();
    }

    public static final class Builder {
        private SqlDialect dialect;
        private KeywordCase keywordCase;
        private Integer tabWidth;
        private IndentStyle indentStyle;
        private Boolean denseOperators;

        private Builder() {
        }

        public Builder dialect(SqlDialect dialect) {
            this.dialect = dialect;
            return this;
        }

        public Builder keywordCase(KeywordCase keywordCase) {
            this.keywordCase = keywordCase;
            return this;
        }

        public Builder tabWidth(Integer tabWidth) {
            this.tabWidth = tabWidth;
            return this;
        }

        public Builder indentStyle(IndentStyle indentStyle) {
            this.indentStyle = indentStyle;
            return this;
        }

        public Builder denseOperators(Boolean denseOperators) {
            this.denseOperators = denseOperators;
            return this;
        }

        public FormatterOptions build() {
            return new FormatterOptions(this);
        }
    }
}
