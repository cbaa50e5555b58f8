package domain.mapper;

import java.util.List;

/**
 * Outcome of {@link MapperDocumentFormatter#format}.
 */
public final class MapperFormatResult {

    private final String text;
    private final boolean mapper;
    private final String namespace;
    private final List<StatementFormatResult> statements;
    private final boolean changed;

    public MapperFormatResult(String text,
                              boolean mapper,
                              String namespace,
                              List<StatementFormatResult> statements,
                              boolean changed) {
        this.text = text;
        this.mapper = mapper;
        this.namespace = namespace == null ? "" : namespace;
        this.statements = statements == null ? List.of() : List.copyOf(statements);
        this.changed = changed;
    }

    static MapperFormatResult notMapper(String document) {
        return new MapperFormatResult(document, false, "", List.of(), false);
    }

    /** whole document after splicing (identical to the input when nothing changed) */
    public String getText() {
        return text;
    }

    /** false if the document has no {@code <mapper namespace=...>} */
    public boolean isMapper() {
        return mapper;
    }

    public String getNamespace() {
        return namespace;
    }

    public List<StatementFormatResult> getStatements() {
        return statements;
    }

    public boolean isChanged() {
        return changed;
    }

    public long count(StatementFormatResult.Status status) {
        return statements.stream().filter(s -> s.getStatus() == status).count();
    }
}
