package domain.format;

import java.util.List;

/** Document root. One per {@link MybatisSqlParser#parse(String)} call. */
public final class RootNode implements CstNode {

    private final List<CstNode> children;
    private final int start;
    private final int end;

    public RootNode(List<CstNode> children, int start, int end) {
        this.children = children == null ? List.of() : List.copyOf(children);
        this.start = start;
        this.end = end;
    }

    public List<CstNode> getChildren() {
        return children;
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
