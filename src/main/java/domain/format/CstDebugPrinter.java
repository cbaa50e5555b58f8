package domain.format;

import java.util.Map;

/**
 * CST 구조를 사람이 읽을 수 있는 outline 으로 출력 (diagnostics only).
 *
 * <pre>
 * Root
 *   SQL: "SELECT * FROM t WHERE 1=1"
 *   Tag: &lt;if&gt; (selfClosing: false)
 *     Attributes: [test="n != null"]
 *     Param: #{n}
 * </pre>
 */
public final class CstDebugPrinter {

    static final int SQL_PREVIEW_LIMIT = 50;

    private CstDebugPrinter() {
    }

    public static String print(CstNode node) {
        StringBuilder sb = new StringBuilder();
        print(node, 0, sb);
        return sb.toString();
    }

    private static void print(CstNode node, int depth, StringBuilder sb) {
        String indent = "  ".repeat(depth);

        if (node instanceof RootNode) {
            line(sb, indent, "Root");
            for (CstNode child : ((RootNode) node).getChildren()) {
                print(child, depth + 1, sb);
            }
        } else if (node instanceof TagNode) {
            TagNode tag = (TagNode) node;
            line(sb, indent, "Tag: <" + tag.getTagName() + "> (selfClosing: " + tag.isSelfClosing() + ")");
            if (!tag.getAttributes().isEmpty()) {
                line(sb, indent + "  ", "Attributes: " + attributes(tag.getAttributes()));
            }
            for (CstNode child : tag.getChildren()) {
                print(child, depth + 1, sb);
            }
        } else if (node instanceof SqlTextNode) {
            String text = ((SqlTextNode) node).getContent().trim();
            if (text.length() > SQL_PREVIEW_LIMIT) {
                text = text.substring(0, SQL_PREVIEW_LIMIT) + "...";
            }
            line(sb, indent, "SQL: \"" + text.replace("\n", "\\n") + "\"");
        } else if (node instanceof ParamNode) {
            line(sb, indent, "Param: " + ((ParamNode) node).toSource());
        }
    }

    private static String attributes(Map<String, String> attrs) {
        StringBuilder sb = new StringBuilder("[");
        boolean first = true;
        for (Map.Entry<String, String> e : attrs.entrySet()) {
            if (!first) sb.append(", ");
            sb.append(e.getKey()).append("=\"").append(e.getValue()).append('"');
            first = false;
        }
        return sb.append(']').toString();
    }

    private static void line(StringBuilder sb, String indent, String text) {
        if (sb.length() > 0) sb.append('\n');
        sb.append(indent).append(text);
    }
}
