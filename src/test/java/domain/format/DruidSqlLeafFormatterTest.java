package domain.format;

import com.alibaba.druid.DbType;
import org.junit.jupiter.api.Test;

import java.util.Locale;

import static org.junit.jupiter.api.Assertions.*;

class DruidSqlLeafFormatterTest {

    @Test
    void format_reformatsCompleteStatement() {
        String out = new DruidSqlLeafFormatter().format("select a, b from t where c = 1", ResolvedFormatOptions.defaults());

        assertTrue(out.startsWith("SELECT"), out);
        assertTrue(out.contains("FROM t"), out);
        assertTrue(out.contains("WHERE c = 1"), out);
        assertFalse(out.contains("\t"), out);
    }

    @Test
    void format_throughCore_keepsPlaceholdersAndTags() {
        MybatisSqlFormatter formatter = new MybatisSqlFormatter(new DruidSqlLeafFormatter());
        String out = formatter.format("select a from t where b = #{b} <if test=\"c != null\">and c = #{c}</if>");

        assertTrue(out.contains("#{b}"), out);
        assertTrue(out.contains("<if test=\"c != null\">"), out);
        assertTrue(out.toLowerCase(Locale.ROOT).contains("and c = #{c}"), out);
        assertTrue(out.contains("</if>"), out);
    }

    @Test
    void toDbType_mapsEveryDialect() {
        assertEquals(DbType.mysql, DruidSqlLeafFormatter.toDbType(SqlDialect.MYSQL));
        assertEquals(DbType.oracle, DruidSqlLeafFormatter.toDbType(SqlDialect.PLSQL));
        assertEquals(DbType.sqlserver, DruidSqlLeafFormatter.toDbType(SqlDialect.TSQL));
        assertEquals(DbType.postgresql, DruidSqlLeafFormatter.toDbType(SqlDialect.POSTGRESQL));
        for (SqlDialect d : SqlDialect.values()) {
            assertNotNull(DruidSqlLeafFormatter.toDbType(d));
        }
    }
}
