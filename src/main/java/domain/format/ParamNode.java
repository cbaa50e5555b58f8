package domain.format;

/**
 * MyBatis parameter placeholder: {@code #{expr}} or {@code ${expr}}.
 *
 * <p>The expression is opaque. It is printed back exactly as captured.</p>
 */
public final class ParamNode implements CstNode {

    private final ParamDelimiter delimiter;
    private final String expression;
    private final int start;
    private final int end;

    public ParamNode(ParamDelimiter delimiter, String expression, int start, int end) {
        if (delimiter == null) throw new IllegalArgumentException("delimiter is null");
        this.delimiter = delimiter;
        this.expression = expression == null ? "" : expression;
        this.start = start;
        this.end = end;
    }

    public ParamDelimiter getDelimiter() {
        return delimiter;
    }

    public String getExpression() {
        return expression;
    }

    /** {@code #{expr}} / {@code ${expr}} */
    public String toSource() {
        return delimiter.getSigil() + "{" + expression + "}";
    }

    @Override
    public int getStart() {
        return start;
    }

    @Override
    public int getEnd() {
        return end;
    }
}
