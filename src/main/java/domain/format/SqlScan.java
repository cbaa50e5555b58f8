package domain.format;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Forward cursor over raw SQL text for {@link BuiltinSqlLeafFormatter}.
 *
 * <p>Every {@code readXxx} returns the consumed source slice untouched, so strings, comments and
 * CDATA sections can be re-emitted verbatim.</p>
 */
final class SqlScan {

    /** {@code <name a="v" ...>}, {@code </name>}, {@code <name/>} with quoted attribute values only */
    private static final Pattern XML_ELEMENT = Pattern.compile(
            "</?[A-Za-z][\\w:.-]*(?:\\s+[\\w:.-]+\\s*=\\s*(?:\"[^\"]*\"|'[^']*'))*\\s*/?>"
    );

    final String s;
    int pos = 0;

    SqlScan(String s) {
        this.s = (s == null) ? "" : s;
    }

    static boolean isWordChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_' || c == '$' || c == '@';
    }

    boolean hasNext() {
        return pos < s.length();
    }

    char peek() {
        return peekAt(0);
    }

    char peekAt(int offset) {
        int i = pos + offset;
        return (i >= 0 && i < s.length()) ? s.charAt(i) : '\0';
    }

    boolean startsWith(String prefix) {
        return s.startsWith(prefix, pos);
    }

    String readWord() {
        int start = pos;
        while (pos < s.length() && isWordChar(s.charAt(pos))) pos++;
        return s.substring(start, pos);
    }

    String readSpaces() {
        int start = pos;
        while (pos < s.length() && Character.isWhitespace(s.charAt(pos))) pos++;
        return s.substring(start, pos);
    }

    boolean peekIsLineComment() {
        return startsWith("--");
    }

    /** MySQL style {@code # comment}. */
    boolean peekIsHashComment() {
        return peek() == '#' && peekAt(1) != '{';
    }

    /** up to, not including, the line break */
    String readLineComment() {
        int start = pos;
        while (pos < s.length() && s.charAt(pos) != '\n') pos++;
        return s.substring(start, pos);
    }

    boolean peekIsBlockComment() {
        return startsWith("/*");
    }

    String readBlockComment() {
        return readUntil(2, "*/");
    }

    boolean peekIsXmlComment() {
        return startsWith("<!--");
    }

    String readXmlComment() {
        return readUntil(4, "-->");
    }

    boolean peekIsCdata() {
        return startsWith(CdataUtil.OPEN);
    }

    String readCdata() {
        return readUntil(CdataUtil.OPEN.length(), CdataUtil.CLOSE);
    }

    /**
     * Quoted literal or identifier. A doubled closing quote is an escaped quote.
     *
     * @param backslashEscapes MySQL style {@code \'} inside the literal
     */
    String readQuoted(char close, boolean backslashEscapes) {
        int start = pos;
        pos++; // opening quote
        while (pos < s.length()) {
            char c = s.charAt(pos++);
            if (backslashEscapes && c == '\\' && pos < s.length()) {
                pos++;
                continue;
            }
            if (c == close) {
                if (pos < s.length() && s.charAt(pos) == close) {
                    pos++;
                    continue;
                }
                break;
            }
        }
        return s.substring(start, pos);
    }

    boolean peekIsMyBatisParam() {
        char c = peek();
        return (c == '#' || c == '$') && peekAt(1) == '{';
    }

    /** {@code #{...}} with nested braces; unterminated runs to the end. */
    String readMyBatisParam() {
        int start = pos;
        pos += 2;
        int depth = 1;
        while (pos < s.length() && depth > 0) {
            char c = s.charAt(pos++);
            if (c == '{') depth++;
            else if (c == '}') depth--;
        }
        return s.substring(start, pos);
    }

    /**
     * Markup left in SQL text ({@code <selectKey ...>}, {@code </selectKey>}). Strict shape so that
     * comparisons such as {@code a<b AND c>d} are not taken for a tag.
     */
    boolean peekIsXmlElement() {
        if (peek() != '<') return false;
        Matcher m = XML_ELEMENT.matcher(s).region(pos, s.length());
        return m.lookingAt();
    }

    String readXmlElement() {
        Matcher m = XML_ELEMENT.matcher(s).region(pos, s.length());
        if (!m.lookingAt()) return "";
        pos = m.end();
        return m.group();
    }

    /** {@code &lt;}, {@code &gt;}, {@code &amp;}, {@code &#60;} ... */
    boolean peekIsEntity() {
        if (peek() != '&') return false;
        int p = pos + 1;
        int limit = Math.min(s.length(), pos + 10);
        while (p < limit) {
            char c = s.charAt(p);
            if (c == ';') return p > pos + 1;
            if (!Character.isLetterOrDigit(c) && c != '#') return false;
            p++;
        }
        return false;
    }

    String readEntity() {
        int start = pos;
        pos = s.indexOf(';', pos) + 1;
        return s.substring(start, pos);
    }

    private String readUntil(int openLength, String terminator) {
        int start = pos;
        int end = s.indexOf(terminator, pos + openLength);
        if (end < 0) {
            pos = s.length();
        } else {
            pos = end + terminator.length();
        }
        return s.substring(start, pos);
    }
}
