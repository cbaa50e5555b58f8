package domain.format;

import java.util.Locale;

/**
 * SQL dialect tag handed to the leaf formatter.
 */
public enum SqlDialect {

    /** Generic ANSI-ish SQL. */
    SQL("sql"),
    MYSQL("mysql"),
    MARIADB("mariadb"),
    POSTGRESQL("postgresql"),
    /** Oracle PL/SQL. */
    PLSQL("plsql"),
    /** SQL Server T-SQL. */
    TSQL("tsql");

    private final String tag;

    SqlDialect(String tag) {
        this.tag = tag;
    }

    public String getTag() {
        return tag;
    }

    /**
     * @throws IllegalArgumentException unknown tag
     */
    public static SqlDialect fromTag(String tag) {
        if (tag == null) throw new IllegalArgumentException("dialect is null");
        String t = tag.trim().toLowerCase(Locale.ROOT);
        for (SqlDialect d : values()) {
            if (d.tag.equals(t)) return d;
        }
        // 흔한 별칭
        switch (t) {
            case "oracle":
                return PLSQL;
            case "sqlserver":
            case "mssql":
                return TSQL;
            case "postgres":
            case "pg":
                return POSTGRESQL;
            default:
                throw new IllegalArgumentException("Unknown dialect: " + tag);
        }
    }
}
