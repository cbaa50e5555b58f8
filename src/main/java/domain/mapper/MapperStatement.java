package domain.mapper;

/**
 * One {@code <select|insert|update|delete>} element located in a mapper document.
 *
 * <p>Offsets are character positions in the document: {@code contentStart}/{@code contentEnd}
 * delimit the inner text between the opening and the closing tag.</p>
 */
public final class MapperStatement {

    private final String statementType;
    private final String id;
    private final int tagStart;
    private final int contentStart;
    private final int contentEnd;
    private final String baseIndent;
    private final String content;

    public MapperStatement(String statementType,
                           String id,
                           int tagStart,
                           int contentStart,
                           int contentEnd,
                           String baseIndent,
                           String content) {
        this.statementType = statementType == null ? "" : statementType;
        this.id = id == null ? "" : id;
        this.tagStart = tagStart;
        this.contentStart = contentStart;
        this.contentEnd = contentEnd;
        this.baseIndent = baseIndent == null ? "" : baseIndent;
        this.content = content == null ? "" : content;
    }

    /** lower-case tag name: select / insert / update / delete */
    public String getStatementType() {
        return statementType;
    }

    /** {@code id} attribute, empty if absent */
    public String getId() {
        return id;
    }

    public int getTagStart() {
        return tagStart;
    }

    public int getContentStart() {
        return contentStart;
    }

    public int getContentEnd() {
        return contentEnd;
    }

    /** leading whitespace of the line holding the opening tag */
    public String getBaseIndent() {
        return baseIndent;
    }

    public String getContent() {
        return content;
    }
}
