package domain.mapper;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Mapper XML 문서에서 statement 경계를 찾는다 (regex, no DOM).
 *
 * <p>A DOM round trip would re-serialize the whole document; here only the statement bodies are
 * replaced and every other byte stays as written.</p>
 */
public final class MapperStatementLocator {

    private static final Pattern MAPPER = Pattern.compile(
            "<mapper\\s+namespace\\s*=\\s*[\"']([^\"']+)[\"']",
            Pattern.CASE_INSENSITIVE
    );

    // opening tag must carry at least one attribute; '>' inside quoted values is allowed;
    // a self-closing <select .../> never matches
    private static final Pattern STATEMENT = Pattern.compile(
            "<(select|insert|update|delete)(\\s(?:\"[^\"]*\"|'[^']*'|[^'\">])*)(?<!/)>([\\s\\S]*?)</\\1\\s*>",
            Pattern.CASE_INSENSITIVE
    );

    private static final Pattern ID_ATTR = Pattern.compile(
            "\\bid\\s*=\\s*(?:\"([^\"]*)\"|'([^']*)')"
    );

    private MapperStatementLocator() {
    }

    public static boolean isMapper(String document) {
        return document != null && MAPPER.matcher(document).find();
    }

    /** namespace attribute of the mapper root, or empty */
    public static String namespaceOf(String document) {
        if (document == null) return "";
        Matcher m = MAPPER.matcher(document);
        return m.find() ? m.group(1) : "";
    }

    /**
     * Statements in document order.
     */
    public static List<MapperStatement> locate(String document) {
        List<MapperStatement> out = new ArrayList<>();
        if (document == null || document.isEmpty()) return out;

        Matcher m = STATEMENT.matcher(document);
        while (m.find()) {
            String attrs = m.group(2);
            out.add(new MapperStatement(
                    m.group(1).toLowerCase(Locale.ROOT),
                    idOf(attrs),
                    m.start(),
                    m.start(3),
                    m.end(3),
                    baseIndentAt(document, m.start()),
                    m.group(3)
            ));
        }
        return out;
    }

    private static String idOf(String attrs) {
        Matcher m = ID_ATTR.matcher(attrs);
        if (!m.find()) return "";
        return m.group(1) != null ? m.group(1) : m.group(2);
    }

    static String baseIndentAt(String document, int tagStart) {
        int lineStart = document.lastIndexOf('\n', tagStart - 1) + 1;
        int p = lineStart;
        while (p < tagStart && (document.charAt(p) == ' ' || document.charAt(p) == '\t')) p++;
        return document.substring(lineStart, p);
    }
}
