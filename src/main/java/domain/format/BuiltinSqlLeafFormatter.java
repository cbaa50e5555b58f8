package domain.format;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.Deque;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Token based SQL pretty printer (default {@link SqlLeafFormatter}).
 *
 * <p>No SQL grammar: the text is split into tokens ({@link SqlScan}) and re-emitted with
 * clause-oriented line breaks. Output depends only on the token sequence, so re-formatting
 * formatted output gives the same text.</p>
 *
 * <ul>
 *   <li>Clause keywords (SELECT, FROM, WHERE, GROUP BY, ...) start a line at the block column.</li>
 *   <li>Top-level commas break after, AND/OR break before (not the AND of BETWEEN, not inside CASE).</li>
 *   <li>{@code (SELECT ...)} / {@code (WITH ...)} open an indented block; other parentheses stay inline.</li>
 *   <li>Strings, quoted identifiers, comments, CDATA sections, XML entities and non-dynamic XML elements
 *       ({@code <selectKey>}) are copied verbatim.</li>
 * </ul>
 */
public final class BuiltinSqlLeafFormatter implements SqlLeafFormatter {

    static final int TABULAR_WIDTH = 10;

    private static final Set<String> KEYWORDS = Set.of(
            "SELECT", "FROM", "WHERE", "AND", "OR", "NOT", "IN", "IS", "NULL", "LIKE", "BETWEEN", "EXISTS",
            "AS", "ON", "JOIN", "INNER", "LEFT", "RIGHT", "FULL", "OUTER", "CROSS", "NATURAL",
            "GROUP", "BY", "ORDER", "HAVING", "LIMIT", "OFFSET", "UNION", "ALL", "INTERSECT", "EXCEPT",
            "DISTINCT", "INSERT", "INTO", "VALUES", "UPDATE", "SET", "DELETE", "RETURNING", "WITH",
            "CASE", "WHEN", "THEN", "ELSE", "END", "ASC", "DESC", "TRUE", "FALSE", "USING", "ANY", "SOME",
            "ESCAPE", "INTERVAL", "MERGE", "MATCHED", "PRIOR", "OVER", "PARTITION"
    );

    /** keywords that end an operand (so a following '-' or '*' is binary) */
    private static final Set<String> VALUE_KEYWORDS = Set.of("NULL", "TRUE", "FALSE", "END");

    /** keywords always separated from a following '(' */
    private static final Set<String> SPACED_BEFORE_PAREN = Set.of(
            "IN", "EXISTS", "AS", "AND", "OR", "NOT", "ON", "FROM", "JOIN", "WHERE", "SELECT", "USING",
            "ALL", "ANY", "SOME", "THEN", "ELSE", "WHEN", "OVER"
    );

    private static final List<String[]> CLAUSES = phrases(
            "ON DUPLICATE KEY UPDATE", "SELECT DISTINCT", "INSERT INTO", "REPLACE INTO", "DELETE FROM",
            "MERGE INTO", "GROUP BY", "ORDER BY", "START WITH", "CONNECT BY", "FOR UPDATE",
            "SELECT", "FROM", "WHERE", "HAVING", "LIMIT", "OFFSET", "VALUES", "UPDATE", "SET", "DELETE",
            "RETURNING", "WITH"
    );

    private static final List<String[]> JOINS = phrases(
            "LEFT OUTER JOIN", "RIGHT OUTER JOIN", "FULL OUTER JOIN", "NATURAL JOIN", "LEFT JOIN", "RIGHT JOIN",
            "FULL JOIN", "INNER JOIN", "CROSS JOIN", "CROSS APPLY", "OUTER APPLY", "STRAIGHT_JOIN", "JOIN"
    );

    private static final List<String[]> SET_OPERATIONS = phrases(
            "UNION ALL", "UNION", "INTERSECT", "EXCEPT", "MINUS"
    );

    /** multi-char operators, longest first */
    private static final String[] OPERATORS = {
            "->>", "<=>", "::", "<=", ">=", "<>", "!=", "==", "||", "&&", ":=", "->"
    };

    @Override
    public String format(String sql, ResolvedFormatOptions options) {
        if (sql == null) return "";
        String s = sql.replace("\r\n", "\n").replace('\r', '\n').trim();
        if (s.isEmpty()) return "";

        // CDATA 내부만 포맷하고 래퍼는 유지
        if (CdataUtil.isWholeCdata(s)) {
            return CdataUtil.wrap(format(CdataUtil.innerOf(s), options));
        }

        List<Token> tokens = tokenize(s, options.getDialect());
        return new Layout(tokens, options).run();
    }

    // ------------------------------------------------------------------ tokens

    enum Kind {
        WORD, QUOTED, XML_ELEMENT, LINE_COMMENT, BLOCK_COMMENT, OPEN, CLOSE, COMMA, SEMICOLON, DOT, OPERATOR
    }

    static final class Token {
        final Kind kind;
        final String text;
        final boolean spaceBefore;

        Token(Kind kind, String text, boolean spaceBefore) {
            this.kind = kind;
            this.text = text;
            this.spaceBefore = spaceBefore;
        }

        String upper() {
            return text.toUpperCase(Locale.ROOT);
        }
    }

    static List<Token> tokenize(String sql, SqlDialect dialect) {
        boolean mysql = dialect == SqlDialect.MYSQL || dialect == SqlDialect.MARIADB;
        SqlScan st = new SqlScan(sql);
        List<Token> out = new ArrayList<>();
        boolean space = false;

        while (st.hasNext()) {
            char c = st.peek();
            if (Character.isWhitespace(c)) {
                st.readSpaces();
                space = true;
                continue;
            }

            Kind kind;
            String text;
            if (st.peekIsLineComment() || (mysql && st.peekIsHashComment())) {
                kind = Kind.LINE_COMMENT;
                text = st.readLineComment();
            } else if (st.peekIsBlockComment()) {
                kind = Kind.BLOCK_COMMENT;
                text = st.readBlockComment();
            } else if (st.peekIsXmlComment()) {
                kind = Kind.BLOCK_COMMENT;
                text = st.readXmlComment();
            } else if (st.peekIsCdata()) {
                kind = Kind.QUOTED;
                text = st.readCdata();
            } else if (st.peekIsXmlElement()) {
                kind = Kind.XML_ELEMENT;
                text = st.readXmlElement();
            } else if (st.peekIsMyBatisParam()) {
                kind = Kind.QUOTED;
                text = st.readMyBatisParam();
            } else if (c == '\'' || c == '"') {
                kind = Kind.QUOTED;
                text = st.readQuoted(c, mysql);
            } else if (c == '`') {
                kind = Kind.QUOTED;
                text = st.readQuoted('`', false);
            } else if (c == '[' && dialect == SqlDialect.TSQL) {
                kind = Kind.QUOTED;
                text = st.readQuoted(']', false);
            } else if (SqlScan.isWordChar(c)) {
                kind = Kind.WORD;
                text = st.readWord();
            } else if (c == '(' || c == ')' || c == ',' || c == ';' || c == '.') {
                kind = c == '(' ? Kind.OPEN
                        : c == ')' ? Kind.CLOSE
                        : c == ',' ? Kind.COMMA
                        : c == ';' ? Kind.SEMICOLON
                        : Kind.DOT;
                text = String.valueOf(c);
                st.pos++;
            } else if (st.peekIsEntity()) {
                kind = Kind.OPERATOR;
                text = readEntityOperator(st);
            } else {
                kind = Kind.OPERATOR;
                text = readOperator(st);
            }

            out.add(new Token(kind, text, space));
            space = false;
        }
        return out;
    }

    /** {@code &lt;}, {@code &lt;=}, {@code &lt;&gt;}, {@code &gt;=} as one operator */
    private static String readEntityOperator(SqlScan st) {
        String e = st.readEntity();
        if (e.equals("&lt;") || e.equals("&gt;")) {
            if (st.peek() == '=') {
                st.pos++;
                return e + "=";
            }
            if (e.equals("&lt;") && st.startsWith("&gt;")) {
                return e + st.readEntity();
            }
        }
        return e;
    }

    private static String readOperator(SqlScan st) {
        for (String op : OPERATORS) {
            if (st.startsWith(op)) {
                st.pos += op.length();
                return op;
            }
        }
        return String.valueOf(st.s.charAt(st.pos++));
    }

    private static List<String[]> phrases(String... phrases) {
        List<String[]> list = new ArrayList<>();
        for (String p : phrases) list.add(p.split(" "));
        list.sort(Comparator.comparingInt((String[] a) -> a.length).reversed());
        return List.copyOf(list);
    }

    // ------------------------------------------------------------------ layout

    private static final class Scope {
        final int base;
        final boolean subquery;
        final int closeIndent;
        boolean clauseSeen;
        int inlineDepth;
        int caseDepth;

        Scope(int base, boolean subquery, int closeIndent) {
            this.base = base;
            this.subquery = subquery;
            this.closeIndent = closeIndent;
        }
    }

    private static final class Layout {
        private final List<Token> tokens;
        private final ResolvedFormatOptions options;
        private final int tab;
        private final boolean tabular;
        private final StringBuilder out = new StringBuilder();
        private final Deque<Scope> scopes = new ArrayDeque<>();

        private int pendingBreak = -1;
        private boolean pendingBlank;
        private boolean noSpaceNext;
        private boolean lineStart = true;
        private boolean betweenPending;

        // previous emitted token
        private Kind prevKind;
        private boolean prevValue;
        private boolean prevKeyword;
        private String prevUpper = "";
        private boolean prevUnary;
        private boolean prevBinary;
        private boolean prevTight;

        Layout(List<Token> tokens, ResolvedFormatOptions options) {
            this.tokens = tokens;
            this.options = options;
            this.tab = options.getTabWidth();
            this.tabular = options.getIndentStyle().isTabular();
            this.scopes.push(new Scope(0, false, 0));
        }

        String run() {
            for (int i = 0; i < tokens.size(); i++) {
                Token t = tokens.get(i);
                switch (t.kind) {
                    case WORD -> i += word(i) - 1;
                    case QUOTED -> {
                        emit(t.text, needSpace(t));
                        after(t.kind, true, false, "");
                    }
                    case XML_ELEMENT -> {
                        // <selectKey ...> / </selectKey>: own line at the block column
                        Scope sc = scopes.peek();
                        pendingBreak = sc.base;
                        emit(t.text, false);
                        pendingBreak = sc.base;
                        after(t.kind, false, false, "");
                    }
                    case LINE_COMMENT -> {
                        emit(t.text, true);
                        Scope sc = scopes.peek();
                        pendingBreak = continuationCol(sc);
                        prevKind = t.kind;
                    }
                    case BLOCK_COMMENT -> {
                        emit(t.text, true);
                        prevKind = t.kind;
                        prevUnary = false;
                        prevBinary = false;
                        prevTight = false;
                    }
                    case OPEN -> open(i);
                    case CLOSE -> close(t);
                    case COMMA -> comma(i);
                    case SEMICOLON -> semicolon();
                    case DOT -> {
                        emit(".", needSpace(t));
                        after(t.kind, false, false, "");
                    }
                    case OPERATOR -> operator(t);
                }
            }
            return finish();
        }

        /** @return number of tokens consumed */
        private int word(int i) {
            Token t = tokens.get(i);
            Scope sc = scopes.peek();

            if (!dotAdjacent(i)) {
                // a clause never follows a binary operator: "a = VALUES(a)"
                if (sc.inlineDepth == 0 && !prevBinary) {
                    int n = matchPhrase(CLAUSES, i);
                    if (n > 0) {
                        clause(phraseText(i, n));
                        return n;
                    }
                    n = matchPhrase(SET_OPERATIONS, i);
                    if (n > 0) {
                        pendingBreak = sc.base;
                        emit(phraseText(i, n), false);
                        pendingBreak = sc.base;
                        sc.clauseSeen = false;
                        afterKeyword(tokens.get(i + n - 1).upper());
                        return n;
                    }
                    n = matchPhrase(JOINS, i);
                    if (n > 0) {
                        lineKeyword(phraseText(i, n), sc);
                        return n;
                    }
                }

                String upper = t.upper();
                if (KEYWORDS.contains(upper)) {
                    String cased = options.getKeywordCase().apply(t.text);
                    if (upper.equals("AND") && betweenPending) {
                        betweenPending = false;
                        emit(cased, needSpace(t));
                    } else if ((upper.equals("AND") || upper.equals("OR"))
                            && sc.inlineDepth == 0 && sc.caseDepth == 0) {
                        lineKeyword(cased, sc);
                        return 1;
                    } else {
                        if (upper.equals("CASE")) sc.caseDepth++;
                        if (upper.equals("END") && sc.caseDepth > 0) sc.caseDepth--;
                        if (upper.equals("BETWEEN")) betweenPending = true;
                        emit(cased, needSpace(t));
                    }
                    afterKeyword(upper);
                    return 1;
                }
            }

            emit(t.text, needSpace(t));
            after(Kind.WORD, true, false, t.upper());
            return 1;
        }

        private void clause(String phrase) {
            Scope sc = scopes.peek();
            betweenPending = false;
            pendingBreak = sc.base;
            if (tabular) {
                emit(pad(phrase), false);
                noSpaceNext = true;
            } else {
                emit(phrase, false);
                pendingBreak = sc.base + tab;
            }
            sc.clauseSeen = true;
            afterKeyword(phrase.toUpperCase(Locale.ROOT));
        }

        /** AND / OR / JOIN: own line at the content column (tabular: padded at the block column). */
        private void lineKeyword(String text, Scope sc) {
            if (tabular) {
                pendingBreak = sc.base;
                emit(pad(text), false);
                noSpaceNext = true;
            } else {
                pendingBreak = continuationCol(sc);
                emit(text, false);
            }
            afterKeyword(text.toUpperCase(Locale.ROOT));
        }

        private void open(int i) {
            Token t = tokens.get(i);
            Scope sc = scopes.peek();
            emit("(", needSpace(t));
            after(Kind.OPEN, false, false, "");

            if (startsSubquery(i)) {
                int anchor = currentLineIndent();
                if (sc.clauseSeen && anchor < contentCol(sc)) anchor = contentCol(sc);
                Scope inner = new Scope(anchor + tab, true, anchor);
                scopes.push(inner);
                pendingBreak = inner.base;
            } else {
                sc.inlineDepth++;
            }
        }

        private void close(Token t) {
            Scope sc = scopes.peek();
            if (sc.inlineDepth > 0) {
                sc.inlineDepth--;
                emit(")", false);
            } else if (sc.subquery) {
                scopes.pop();
                pendingBreak = sc.closeIndent;
                emit(")", false);
            } else {
                emit(")", false);
            }
            after(t.kind, true, false, "");
        }

        private void comma(int i) {
            Scope sc = scopes.peek();
            emit(",", false);
            after(Kind.COMMA, false, false, "");
            if (i > 0 && sc.inlineDepth == 0 && sc.caseDepth == 0) {
                pendingBreak = continuationCol(sc);
            }
        }

        private void semicolon() {
            emit(";", false);
            after(Kind.SEMICOLON, false, false, "");
            scopes.clear();
            scopes.push(new Scope(0, false, 0));
            betweenPending = false;
            pendingBreak = 0;
            pendingBlank = true;
        }

        private void operator(Token t) {
            String op = t.text;
            boolean dense = options.isDenseOperators();

            if (op.equals("[")) {
                emit(op, false);
                after(Kind.OPERATOR, false, false, op);
                prevTight = true;
                return;
            }
            if (op.equals("]")) {
                emit(op, false);
                after(Kind.OPERATOR, true, false, op);
                return;
            }
            if (op.equals("::")) {
                emit(op, false);
                after(Kind.OPERATOR, false, false, op);
                prevTight = true;
                return;
            }
            if (op.equals("?") || (op.equals("*") && !prevValue)) {
                // placeholder / wildcard: an operand
                emit(op, needSpace(t));
                after(Kind.OPERATOR, true, false, op);
                return;
            }
            if (!prevValue && (op.equals("-") || op.equals("+") || op.equals("~") || op.equals("!") || op.equals(":"))) {
                emit(op, needSpace(t));
                after(Kind.OPERATOR, false, false, op);
                prevUnary = true;
                return;
            }

            emit(op, !dense && !prevTight && !prevUnary && prevKind != Kind.OPEN);
            after(Kind.OPERATOR, false, true, op);
        }

        private boolean needSpace(Token t) {
            if (prevKind == null) return false;
            switch (t.kind) {
                case COMMA:
                case SEMICOLON:
                case CLOSE:
                    return false;
                case DOT:
                    return !(prevKind == Kind.WORD || prevKind == Kind.QUOTED || prevKind == Kind.CLOSE)
                            && prevKind != Kind.OPEN && !prevUnary && !prevTight;
                default:
                    break;
            }
            if (prevKind == Kind.DOT || prevKind == Kind.OPEN || prevUnary || prevTight) return false;
            if (prevBinary && options.isDenseOperators()) return false;
            // N'..', E'..', _utf8'..'
            if (t.kind == Kind.QUOTED && prevKind == Kind.WORD && !prevKeyword && !t.spaceBefore) return false;
            if (t.kind == Kind.OPEN) {
                if (prevKind == Kind.WORD) {
                    return prevKeyword && (t.spaceBefore || SPACED_BEFORE_PAREN.contains(prevUpper));
                }
                return prevKind != Kind.QUOTED && prevKind != Kind.CLOSE
                        && !(prevKind == Kind.OPERATOR && prevValue);
            }
            return true;
        }

        private void emit(String text, boolean space) {
            if (pendingBreak >= 0) {
                breakLine(pendingBreak);
            } else if (space && !noSpaceNext && !lineStart) {
                out.append(' ');
            }
            noSpaceNext = false;
            out.append(text);
            lineStart = false;
        }

        private void breakLine(int col) {
            if (!lineStart) {
                rtrimLine();
                out.append('\n');
                if (pendingBlank) out.append('\n');
            } else {
                // blank current line: only reset its indentation
                int n = out.length();
                while (n > 0 && out.charAt(n - 1) == ' ') n--;
                out.setLength(n);
            }
            out.append(" ".repeat(Math.max(0, col)));
            pendingBlank = false;
            pendingBreak = -1;
            noSpaceNext = false;
            lineStart = true;
        }

        private void after(Kind kind, boolean value, boolean binary, String upper) {
            prevKind = kind;
            prevValue = value;
            prevBinary = binary;
            prevUnary = false;
            prevTight = false;
            prevKeyword = false;
            prevUpper = upper;
        }

        private void afterKeyword(String upper) {
            after(Kind.WORD, VALUE_KEYWORDS.contains(upper), false, upper);
            prevKeyword = true;
        }

        private int contentCol(Scope sc) {
            return sc.base + (tabular ? TABULAR_WIDTH : tab);
        }

        private int continuationCol(Scope sc) {
            return sc.clauseSeen ? contentCol(sc) : sc.base;
        }

        private int currentLineIndent() {
            int lineStartAt = out.lastIndexOf("\n") + 1;
            int p = lineStartAt;
            while (p < out.length() && out.charAt(p) == ' ') p++;
            return p - lineStartAt;
        }

        private String pad(String keyword) {
            if (options.getIndentStyle() == IndentStyle.TABULAR_RIGHT) {
                int width = TABULAR_WIDTH - 1;
                if (keyword.length() >= width) return keyword + " ";
                return " ".repeat(width - keyword.length()) + keyword + " ";
            }
            if (keyword.length() >= TABULAR_WIDTH) return keyword + " ";
            return keyword + " ".repeat(TABULAR_WIDTH - keyword.length());
        }

        private boolean dotAdjacent(int i) {
            return (i > 0 && tokens.get(i - 1).kind == Kind.DOT)
                    || (i + 1 < tokens.size() && tokens.get(i + 1).kind == Kind.DOT);
        }

        private int matchPhrase(List<String[]> phrases, int i) {
            for (String[] p : phrases) {
                if (i + p.length > tokens.size()) continue;
                boolean ok = true;
                for (int k = 0; k < p.length && ok; k++) {
                    Token t = tokens.get(i + k);
                    ok = t.kind == Kind.WORD && t.upper().equals(p[k]);
                }
                if (ok && (i + p.length >= tokens.size() || tokens.get(i + p.length).kind != Kind.DOT)) {
                    return p.length;
                }
            }
            return 0;
        }

        private String phraseText(int i, int n) {
            StringBuilder sb = new StringBuilder();
            for (int k = 0; k < n; k++) {
                if (k > 0) sb.append(' ');
                sb.append(options.getKeywordCase().apply(tokens.get(i + k).text));
            }
            return sb.toString();
        }

        private boolean startsSubquery(int openAt) {
            for (int k = openAt + 1; k < tokens.size(); k++) {
                Token t = tokens.get(k);
                if (t.kind == Kind.LINE_COMMENT || t.kind == Kind.BLOCK_COMMENT) continue;
                if (t.kind != Kind.WORD) return false;
                String u = t.upper();
                return u.equals("SELECT") || u.equals("WITH");
            }
            return false;
        }

        private void rtrimLine() {
            int n = out.length();
            while (n > 0 && (out.charAt(n - 1) == ' ' || out.charAt(n - 1) == '\t')) n--;
            out.setLength(n);
        }

        private String finish() {
            String[] lines = out.toString().split("\n", -1);
            StringBuilder sb = new StringBuilder(out.length());
            for (int i = 0; i < lines.length; i++) {
                if (i > 0) sb.append('\n');
                String line = lines[i];
                int end = line.length();
                while (end > 0 && Character.isWhitespace(line.charAt(end - 1))) end--;
                sb.append(line, 0, end);
            }
            // leading blank lines only: the first line may carry right-aligned padding
            int from = 0;
            while (from < sb.length() && sb.charAt(from) == '\n') from++;
            return sb.substring(from).stripTrailing();
        }
    }
}
