package domain.format;

import com.alibaba.druid.DbType;
import com.alibaba.druid.sql.SQLUtils;

/**
 * {@link SqlLeafFormatter} backed by Alibaba Druid {@code SQLUtils.format}.
 *
 * <p>Druid parses the fragment with the dialect's own grammar, so only complete statements
 * are reformatted; Druid hands back an unparseable fragment unchanged. Druid indents with tabs,
 * which are replaced by {@code tabWidth} spaces. Druid has no "preserve" keyword case;
 * {@link KeywordCase#PRESERVE} formats as upper case.</p>
 */
public final class DruidSqlLeafFormatter implements SqlLeafFormatter {

    @Override
    public String format(String sql, ResolvedFormatOptions options) {
        boolean upperCase = options.getKeywordCase() != KeywordCase.LOWER;
        String formatted = SQLUtils.format(sql, toDbType(options.getDialect()),
                new SQLUtils.FormatOption(upperCase, true));
        if (formatted == null) {
            throw new IllegalStateException("Druid returned null");
        }
        return formatted
                .replace("\r\n", "\n")
                .replace("\t", " ".repeat(options.getTabWidth()))
                .trim();
    }

    static DbType toDbType(SqlDialect dialect) {
        return switch (dialect) {
            case MYSQL -> DbType.mysql;
            case MARIADB -> DbType.mariadb;
            case POSTGRESQL -> DbType.postgresql;
            case PLSQL -> DbType.oracle;
            case TSQL -> DbType.sqlserver;
            case SQL -> DbType.other;
        };
    }
}
