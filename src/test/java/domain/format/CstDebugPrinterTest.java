package domain.format;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class CstDebugPrinterTest {

    @Test
    void print_outlinesTree() {
        String out = MybatisSqlFormatter.debugPrintCst("SELECT * FROM t WHERE 1=1 <if test=\"n != null\">AND n=#{n}</if>");

        assertEquals("""
                Root
                  SQL: "SELECT * FROM t WHERE 1=1"
                  Tag: <if> (selfClosing: false)
                    Attributes: [test="n != null"]
                    SQL: "AND n="
                    Param: #{n}""", out);
    }

    @Test
    void print_truncatesLongSqlAndEscapesNewlines() {
        String sql = "a\n" + "b".repeat(60);
        String out = CstDebugPrinter.print(MybatisSqlParser.parse(sql));

        String expected = "Root\n  SQL: \"a\\n" + "b".repeat(48) + "...\"";
        assertEquals(expected, out);
    }
}
