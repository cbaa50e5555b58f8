package domain.format;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A recognized MyBatis dynamic tag ({@code <if>}, {@code <foreach>}, {@code <include/>} ...).
 *
 * <p>Attributes keep source order (LinkedHashMap). Values are raw, i.e. not unescaped.
 * A self-closing tag never has children.</p>
 */
public final class TagNode implements CstNode {

    private final String tagName;
    private final Map<String, String> attributes;
    private final boolean selfClosing;
    private final List<CstNode> children;
    private final int start;
    private final int end;

    public TagNode(String tagName,
                   Map<String, String> attributes,
                   boolean selfClosing,
                   List<CstNode> children,
                   int start,
                   int end) {
        if (tagName == null || tagName.isEmpty()) {
            throw new IllegalArgumentException("tagName is empty");
        }
        if (selfClosing && children != null && !children.isEmpty()) {
            throw new IllegalArgumentException("self-closing tag cannot have children: <" + tagName + "/>");
        }
        this.tagName = tagName;
        this.attributes = attributes == null
                ? Collections.emptyMap()
                : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
        this.selfClosing = selfClosing;
        this.children = (children == null || selfClosing) ? List.of() : List.copyOf(children);
        this.start = start;
        this.end = end;
    }

    public String getTagName() {
        return tagName;
    }

    public Map<String, String> getAttributes() {
        return attributes;
    }

    public boolean isSelfClosing() {
        return selfClosing;
    }

    public List<CstNode> getChildren() {
        return children;
    }

    /** true if any direct child is itself a tag. */
    public boolean hasNestedTags() {
        for (CstNode child : children) {
            if (child instanceof TagNode) return true;
        }
        return false;
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
