package domain.format;

import java.util.List;
import java.util.Locale;

/**
 * SQL 텍스트에서 방언을 추정한다 (heuristic fingerprints).
 *
 * <p>Rules are evaluated in declaration order and the first hit wins, because one statement
 * may carry fingerprints of several dialects (e.g. {@code LIMIT} together with {@code ::}).</p>
 */
public final class SqlDialectDetector {

    private static final List<Rule> RULES = List.of(
            new Rule(SqlDialect.MYSQL, "LIMIT", "IFNULL", "CONCAT", "`"),
            new Rule(SqlDialect.POSTGRESQL, "RETURNING", "::", "ARRAY"),
            new Rule(SqlDialect.PLSQL, "ROWNUM", "CONNECT BY", "NVL"),
            new Rule(SqlDialect.TSQL, "TOP", "@@", "IDENTITY")
    );

    public static final SqlDialect FALLBACK = SqlDialect.MYSQL;

    private SqlDialectDetector() {
    }

    public static SqlDialect detect(String sql) {
        if (sql == null || sql.isEmpty()) return FALLBACK;
        String upper = sql.toUpperCase(Locale.ROOT);
        for (Rule r : RULES) {
            if (r.matches(upper)) return r.dialect;
        }
        return FALLBACK;
    }

    private static final class Rule {
        private final SqlDialect dialect;
        private final String[] markers;

        Rule(SqlDialect dialect, String... markers) {
            this.dialect = dialect;
            this.markers = markers;
        }

        boolean matches(String upper) {
            for (String m : markers) {
                if (upper.contains(m)) return true;
            }
            return false;
        }
    }
}
