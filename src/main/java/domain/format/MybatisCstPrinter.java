package domain.format;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * CST -> formatted text.
 *
 * <p>Layout rules</p>
 * <ul>
 *   <li>Root: children concatenated at depth 0.</li>
 *   <li>Self-closing tag: {@code \n<indent><name attrs/>}.</li>
 *   <li>Tag with nested tags: opening line, children at depth+1, closing line.</li>
 *   <li>Tag with only text/params: the formatted children, trimmed, as one line at depth+1 when shorter
 *       than {@value #SHORT_CONTENT_LIMIT} chars, otherwise the children at depth+1 as rendered.</li>
 *   <li>Attribute values are double-quoted, or single-quoted when the value contains {@code "}.</li>
 *   <li>SQL run (adjacent text/param siblings): delegated to {@link SqlLeafFormatter}, every output line
 *       prefixed with the depth indent.</li>
 * </ul>
 *
 * <p>Parameters are handed to the leaf formatter as opaque word tokens and put back afterwards,
 * so {@code #{...}} / {@code ${...}} content is never touched. If the leaf formatter throws, or loses
 * or duplicates a token, that run keeps its original text (per-run degrade).</p>
 */
final class MybatisCstPrinter {

    private static final Logger log = LoggerFactory.getLogger(MybatisCstPrinter.class);

    static final int SHORT_CONTENT_LIMIT = 80;

    /** param stand-in: __MBP{n}__ (a plain identifier for any SQL tokenizer) */
    private static final String TOKEN_PREFIX = "__MBP";
    private static final String TOKEN_SUFFIX = "__";

    private final SqlLeafFormatter leafFormatter;
    private final ResolvedFormatOptions options;

    MybatisCstPrinter(SqlLeafFormatter leafFormatter, ResolvedFormatOptions options) {
        this.leafFormatter = leafFormatter;
        this.options = options;
    }

    String render(RootNode root) {
        StringBuilder out = new StringBuilder();
        renderChildren(root.getChildren(), 0, out);
        return out.toString();
    }

    private void renderChildren(List<CstNode> children, int depth, StringBuilder out) {
        List<CstNode> run = new ArrayList<>();
        for (CstNode child : children) {
            if (child instanceof TagNode) {
                flushRun(run, depth, out);
                renderTag((TagNode) child, depth, out);
            } else if (child instanceof SqlTextNode || child instanceof ParamNode) {
                run.add(child);
            } else {
                // RootNode never appears as a child
                throw new IllegalStateException("Unexpected node: " + child.getClass().getSimpleName());
            }
        }
        flushRun(run, depth, out);
    }

    private void renderTag(TagNode tag, int depth, StringBuilder out) {
        String indent = options.indent(depth);
        String open = "<" + tag.getTagName() + renderAttributes(tag.getAttributes());

        if (tag.isSelfClosing()) {
            out.append('\n').append(indent).append(open).append("/>");
            return;
        }

        String close = "</" + tag.getTagName() + ">";
        out.append('\n').append(indent).append(open).append('>');

        StringBuilder body = new StringBuilder();
        renderChildren(tag.getChildren(), depth + 1, body);

        if (!tag.hasNestedTags()) {
            // short body: the formatted text, trimmed, at depth+1
            String content = body.toString().trim();
            if (content.length() < SHORT_CONTENT_LIMIT) {
                if (!content.isEmpty()) out.append('\n').append(options.indent(depth + 1)).append(content);
                out.append('\n').append(indent).append(close);
                return;
            }
        }

        out.append(body);
        out.append('\n').append(indent).append(close);
    }

    private static String renderAttributes(Map<String, String> attributes) {
        if (attributes.isEmpty()) return "";
        StringBuilder sb = new StringBuilder();
        for (Map.Entry<String, String> e : attributes.entrySet()) {
            String value = e.getValue();
            // a value holding '"' came from a single-quoted attribute
            char quote = value.indexOf('"') >= 0 ? '\'' : '"';
            sb.append(' ').append(e.getKey()).append('=').append(quote).append(value).append(quote);
        }
        return sb.toString();
    }

    /** Adjacent text/param siblings are formatted as one SQL fragment. */
    private void flushRun(List<CstNode> run, int depth, StringBuilder out) {
        if (run.isEmpty()) return;
        List<CstNode> nodes = new ArrayList<>(run);
        run.clear();

        String original = sourceOf(nodes).trim();
        if (original.isEmpty()) return;

        String formatted = formatRun(nodes, original);
        String indent = options.indent(depth);
        for (String line : formatted.split("\n", -1)) {
            out.append('\n').append(indent).append(line);
        }
    }

    private String formatRun(List<CstNode> nodes, String original) {
        if (original.toUpperCase(Locale.ROOT).contains(TOKEN_PREFIX)) {
            log.debug("SQL run already contains {}, kept as is", TOKEN_PREFIX);
            return original;
        }

        List<ParamNode> params = new ArrayList<>();
        StringBuilder masked = new StringBuilder();
        for (CstNode n : nodes) {
            if (n instanceof SqlTextNode) {
                masked.append(((SqlTextNode) n).getContent());
            } else {
                masked.append(token(params.size()));
                params.add((ParamNode) n);
            }
        }

        String sql = masked.toString().trim();
        try {
            String result = leafFormatter.format(sql, options);
            if (result == null) {
                throw new IllegalStateException("leaf formatter returned null");
            }
            return unmask(stripBlankEdges(result), params);
        } catch (RuntimeException e) {
            log.debug("SQL leaf kept unformatted: {}", e.getMessage());
            return original;
        }
    }

    private static String unmask(String formatted, List<ParamNode> params) {
        String s = formatted;
        for (int i = params.size() - 1; i >= 0; i--) {
            String token = token(i);
            int at = indexOfIgnoreCase(s, token, 0);
            if (at < 0 || indexOfIgnoreCase(s, token, at + token.length()) >= 0) {
                throw new IllegalStateException("parameter placeholder lost: " + params.get(i).toSource());
            }
            s = s.substring(0, at) + params.get(i).toSource() + s.substring(at + token.length());
        }
        return s;
    }

    /** drops blank leading lines and trailing whitespace; keeps the first line's indentation */
    private static String stripBlankEdges(String s) {
        String t = s.stripTrailing();
        int lineStart = 0;
        for (int i = 0; i < t.length(); i++) {
            char c = t.charAt(i);
            if (c == '\n') {
                lineStart = i + 1;
            } else if (!Character.isWhitespace(c)) {
                break;
            }
        }
        return t.substring(lineStart);
    }

    private static int indexOfIgnoreCase(String s, String token, int from) {
        for (int i = from; i + token.length() <= s.length(); i++) {
            if (s.regionMatches(true, i, token, 0, token.length())) return i;
        }
        return -1;
    }

    private static String token(int index) {
        return TOKEN_PREFIX + index + TOKEN_SUFFIX;
    }

    /** text content + param source, in order. */
    private static String sourceOf(List<CstNode> nodes) {
        StringBuilder sb = new StringBuilder();
        for (CstNode n : nodes) {
            if (n instanceof SqlTextNode) {
                sb.append(((SqlTextNode) n).getContent());
            } else if (n instanceof ParamNode) {
                sb.append(((ParamNode) n).toSource());
            } else if (n instanceof TagNode) {
                // not reached: callers only pass leaf runs
                throw new IllegalStateException("tag inside leaf run");
            }
        }
        return sb.toString();
    }
}
