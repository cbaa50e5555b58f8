package domain.format;

/** Literal SQL text between structural boundaries. Never empty; not trimmed. */
public final class SqlTextNode implements CstNode {

    private final String content;
    private final int start;
    private final int end;

    public SqlTextNode(String content, int start, int end) {
        if (content == null || content.isEmpty()) {
            throw new IllegalArgumentException("sql text node must not be empty");
        }
        this.content = content;
        this.start = start;
        this.end = end;
    }

    public String getContent() {
        return content;
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
