package domain.format;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Recursive-descent parser: MyBatis statement body -> {@link RootNode}.
 *
 * <p>Single forward cursor. Only {@link DynamicTags} become {@link TagNode}s; every other
 * {@code <...>} shape (opening or closing, e.g. {@code <selectKey>}) stays inside {@link SqlTextNode}
 * content. The only fatal condition is structural (mismatched / missing / stray closing dynamic tag),
 * reported as {@link CstParseException}.</p>
 *
 * <p>Each {@link #parse(String)} call uses a fresh cursor, so the class is safe to share.</p>
 */
public final class MybatisSqlParser {

    private final String input;
    private final int length;
    private int pos;

    private MybatisSqlParser(String input) {
        this.input = input == null ? "" : input;
        this.length = this.input.length();
        this.pos = 0;
    }

    public static RootNode parse(String input) {
        MybatisSqlParser p = new MybatisSqlParser(input);
        List<CstNode> children = p.parseNodes(true);
        return new RootNode(children, 0, p.length);
    }

    private List<CstNode> parseNodes(boolean root) {
        List<CstNode> nodes = new ArrayList<>();

        while (pos < length) {
            char c = input.charAt(pos);

            if (isClosingTagAt(pos)) {
                if (root) {
                    int at = pos;
                    pos += 2;
                    throw new CstParseException("Unexpected closing tag </" + readName() + ">", at);
                }
                break; // caller consumes the closing tag
            }

            if (c == '<' && isTagStartAt(pos)) {
                TagNode tag = parseTag();
                if (tag != null) {
                    nodes.add(tag);
                    continue;
                }
                nodes.add(parseText(true));
                continue;
            }

            if (ParamDelimiter.isSigil(c) && peek(1) == '{') {
                ParamNode param = parseParam();
                if (param != null) {
                    nodes.add(param);
                    continue;
                }
                nodes.add(parseText(true));
                continue;
            }

            SqlTextNode text = parseText(false);
            if (text != null) nodes.add(text);
        }

        return nodes;
    }

    /**
     * {@code <name attr="v" ...>children</name>} or {@code <name .../>}.
     *
     * @return null if this is not a well-formed opening tag (caller falls back to text)
     */
    private TagNode parseTag() {
        final int start = pos;
        pos++; // '<'

        String tagName = readName();
        if (!DynamicTags.isDynamicTag(tagName)) {
            pos = start;
            return null;
        }

        Map<String, String> attributes = parseAttributes();
        skipWhitespace();

        if (peek(0) == '/' && peek(1) == '>') {
            pos += 2;
            return new TagNode(tagName, attributes, true, List.of(), start, pos);
        }

        if (peek(0) != '>') {
            pos = start;
            return null;
        }
        pos++; // '>'

        List<CstNode> children = parseNodes(false);

        if (!isClosingTagAt(pos)) {
            throw new CstParseException("Unclosed tag <" + tagName + ">", start);
        }
        int closeAt = pos;
        pos += 2;
        skipWhitespace();
        String closingName = readName();
        if (!closingName.equalsIgnoreCase(tagName)) {
            throw new CstParseException(
                    "Mismatched closing tag: expected </" + tagName + ">, got </" + closingName + ">", closeAt);
        }
        skipWhitespace();
        if (peek(0) == '>') pos++;

        return new TagNode(tagName, attributes, false, children, start, pos);
    }

    /** name="value" / name='value' pairs, in source order. Stops at '>' or '/'. */
    private Map<String, String> parseAttributes() {
        Map<String, String> attributes = new LinkedHashMap<>();

        while (pos < length) {
            skipWhitespace();

            char c = peek(0);
            if (c == '>' || c == '/') break;

            String name = readName();
            if (name.isEmpty()) break;

            skipWhitespace();
            if (peek(0) != '=') break;
            pos++;
            skipWhitespace();

            char quote = peek(0);
            if (quote != '"' && quote != '\'') break;
            pos++;

            int valueStart = pos;
            while (pos < length && input.charAt(pos) != quote) pos++;
            String value = input.substring(valueStart, pos);
            if (peek(0) == quote) pos++;

            attributes.put(name, value);
        }

        return attributes;
    }

    /**
     * {@code #{...}} / {@code ${...}} with brace-depth balancing.
     *
     * @return null if the braces never close (the sigil is then plain text)
     */
    private ParamNode parseParam() {
        final int start = pos;
        int close = paramCloseIndex(start);
        if (close < 0) return null;

        ParamDelimiter delimiter = ParamDelimiter.fromSigil(input.charAt(start));
        String expression = input.substring(start + 2, close);
        pos = close + 1;
        return new ParamNode(delimiter, expression, start, pos);
    }

    /**
     * Plain text up to the next structural boundary.
     *
     * @param consumeFirst consume the current char unconditionally (used after a failed
     *                     tag/param attempt so the cursor always advances)
     */
    private SqlTextNode parseText(boolean consumeFirst) {
        final int start = pos;
        if (consumeFirst && pos < length) pos++;

        while (pos < length) {
            if (isBoundaryAt(pos)) break;
            pos++;
        }

        if (pos == start) return null;
        return new SqlTextNode(input.substring(start, pos), start, pos);
    }

    private boolean isBoundaryAt(int i) {
        char c = input.charAt(i);
        if (c == '<') {
            return isClosingTagAt(i) || isTagStartAt(i);
        }
        if (ParamDelimiter.isSigil(c) && charAt(i + 1) == '{') {
            return paramCloseIndex(i) >= 0;
        }
        return false;
    }

    /** '<' immediately followed by a recognized dynamic tag name. */
    private boolean isTagStartAt(int i) {
        if (charAt(i) != '<') return false;
        int p = i + 1;
        int nameStart = p;
        while (p < length && isNameChar(input.charAt(p))) p++;
        if (p == nameStart || !Character.isLetter(input.charAt(nameStart))) return false;
        return DynamicTags.isDynamicTag(input.substring(nameStart, p));
    }

    /** '&lt;/' followed by a recognized dynamic tag name; other closing tags are plain text. */
    private boolean isClosingTagAt(int i) {
        if (charAt(i) != '<' || charAt(i + 1) != '/') return false;
        int p = i + 2;
        while (p < length && Character.isWhitespace(input.charAt(p))) p++;
        int nameStart = p;
        while (p < length && isNameChar(input.charAt(p))) p++;
        return p > nameStart && DynamicTags.isDynamicTag(input.substring(nameStart, p));
    }

    /** Index of the '}' closing the placeholder opened at {@code sigilAt}, or -1. */
    private int paramCloseIndex(int sigilAt) {
        int depth = 1;
        int p = sigilAt + 2;
        while (p < length) {
            char c = input.charAt(p);
            if (c == '{') {
                depth++;
            } else if (c == '}') {
                depth--;
                if (depth == 0) return p;
            }
            p++;
        }
        return -1;
    }

    private String readName() {
        skipWhitespace();
        int start = pos;
        while (pos < length && isNameChar(input.charAt(pos))) pos++;
        return input.substring(start, pos);
    }

    private static boolean isNameChar(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || (c >= '0' && c <= '9') || c == '_' || c == '-';
    }

    private void skipWhitespace() {
        while (pos < length && Character.isWhitespace(input.charAt(pos))) pos++;
    }

    private char peek(int offset) {
        return charAt(pos + offset);
    }

    private char charAt(int i) {
        return (i >= 0 && i < length) ? input.charAt(i) : '\0';
    }
}
