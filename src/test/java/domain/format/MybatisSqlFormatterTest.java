package domain.format;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Locale;

import static org.junit.jupiter.api.Assertions.*;

class MybatisSqlFormatterTest {

    private final MybatisSqlFormatter formatter = new MybatisSqlFormatter();

    @Test
    void format_singleIf() {
        String out = formatter.format("SELECT * FROM t WHERE 1=1 <if test=\"n != null\">AND n=#{n}</if>");

        assertEquals("""
                SELECT
                    *
                FROM
                    t
                WHERE
                    1 = 1
                <if test="n != null">
                    AND n = #{n}
                </if>""", out);
    }

    @Test
    void format_shortTagBody_goesThroughLeafFormatter() {
        String in = "SELECT a FROM t <where><if test=\"x\">and   name = #{n}</if></where>";

        assertEquals("""
                SELECT
                    a
                FROM
                    t
                <where>
                    <if test="x">
                        AND name = #{n}
                    </if>
                </where>""", formatter.format(in));

        FormatterOptions lower = FormatterOptions.builder().keywordCase(KeywordCase.LOWER).build();
        String out = formatter.format("SELECT a FROM t <where><if test=\"x\">AND   NAME = #{n}</if></where>", lower);
        assertTrue(out.contains("\n        and NAME = #{n}\n"), out);
        assertTrue(out.startsWith("select\n"), out);
    }

    @Test
    void format_singleQuotedAttributeWithDoubleQuotes_staysWellFormed() {
        String in = "SELECT * FROM t WHERE 1=1 <if test='type == \"A\"'>AND k = 1</if>";

        String out = formatter.format(in);

        assertTrue(out.contains("\n<if test='type == \"A\"'>\n"), out);
        assertFalse(out.contains("\"A\"\""), out);
        assertEquals(out, formatter.format(out));
    }

    @Test
    void format_whereWithNestedForeach() {
        String in = """
                select id, name from users
                <where>
                  <if test="name != null">AND name LIKE CONCAT('%', #{name}, '%')</if>
                  <if test="ids != null">AND id IN <foreach collection="ids" item="id" open="(" separator="," close=")">#{id}</foreach></if>
                </where>
                order by id
                """;

        assertEquals("""
                SELECT
                    id,
                    name
                FROM
                    users
                <where>
                    <if test="name != null">
                        AND name LIKE CONCAT('%', #{name}, '%')
                    </if>
                    <if test="ids != null">
                        AND id IN
                        <foreach collection="ids" item="id" open="(" separator="," close=")">
                            #{id}
                        </foreach>
                    </if>
                </where>
                ORDER BY
                    id""", formatter.format(in));
    }

    @Test
    void format_longTagContent_isFormattedAtDepthPlusOne() {
        String in = "<where>a.column_one = #{one} AND a.column_two = #{two} "
                + "AND a.column_three = #{three} AND a.column_four = #{four}</where>";

        assertEquals("""
                <where>
                    a.column_one = #{one}
                    AND a.column_two = #{two}
                    AND a.column_three = #{three}
                    AND a.column_four = #{four}
                </where>""", formatter.format(in));
    }

    @Test
    void format_isIdempotent() {
        List<String> inputs = List.of(
                "SELECT * FROM t WHERE 1=1 <if test=\"n != null\">AND n=#{n}</if>",
                "select a, b from t t1 left join u on u.id = t1.id where t1.x in (select x from v) order by a desc",
                "UPDATE t <set><if test=\"a != null\">a = #{a},</if><if test=\"b != null\">b = #{b}</if></set> WHERE id = #{id}",
                "INSERT INTO t (a, b) VALUES <foreach collection=\"list\" item=\"it\" separator=\",\">(#{it.a}, #{it.b})</foreach>"
        );
        for (String in : inputs) {
            String once = formatter.format(in);
            assertEquals(once, formatter.format(once), "not idempotent for: " + in);
        }
    }

    @Test
    void format_fourLevelNesting_keepsEveryTagOnce() {
        String in = "SELECT * FROM t <where><choose><when test=\"a != null\">"
                + "<trim prefix=\"(\" suffix=\")\" prefixOverrides=\"AND\"><if test=\"b != null\">AND b = #{b}</if></trim>"
                + "</when><otherwise>1=1</otherwise></choose></where>";

        String out = formatter.format(in);

        for (String tag : List.of("where", "choose", "when", "trim", "if", "otherwise")) {
            assertEquals(1, count(out, "<" + tag + ">") + count(out, "<" + tag + " "), "open " + tag + " in:\n" + out);
            assertEquals(1, count(out, "</" + tag + ">"), "close " + tag + " in:\n" + out);
        }
        assertTrue(out.contains("<trim prefix=\"(\" suffix=\")\" prefixOverrides=\"AND\">"));
        assertTrue(out.contains("\n                    AND b = #{b}\n"), out);
    }

    @Test
    void format_dottedParam_isVerbatim() {
        String out = formatter.format("select * from u where code = #{user.info.code}");
        assertTrue(out.contains("code = #{user.info.code}"), out);
    }

    @Test
    void format_paramWithOptions_isVerbatim() {
        String out = formatter.format("select * from u where d = #{d,jdbcType=TIMESTAMP} and o = ${order}");
        assertTrue(out.contains("#{d,jdbcType=TIMESTAMP}"), out);
        assertTrue(out.contains("${order}"), out);
    }

    @Test
    void format_selfClosingInclude_isVerbatim() {
        String out = formatter.format("SELECT <include refid=\"Base\"/> FROM t");
        assertTrue(out.contains("\n<include refid=\"Base\"/>\n"), out);
    }

    @Test
    void format_emptyAndBlankInput_returnedUnchanged() {
        assertEquals("", formatter.format(""));
        assertEquals("   \n\t  ", formatter.format("   \n\t  "));
        assertTrue(formatter.format("   \n\t  ").trim().isEmpty());
        assertEquals(FormatOutcome.Status.SKIPPED_BLANK, formatter.tryFormat(" ", null).getStatus());
    }

    @Test
    void format_mismatchedTag_returnsOriginal() {
        String in = "<if test=\"a\">select 1</foreach>";

        assertEquals(in, formatter.format(in));

        FormatOutcome outcome = formatter.tryFormat(in, null);
        assertTrue(outcome.isFallback());
        assertInstanceOf(CstParseException.class, outcome.getFailure());
    }

    @Test
    void format_lowerKeywordCase() {
        FormatterOptions options = FormatterOptions.builder().keywordCase(KeywordCase.LOWER).build();
        assertEquals("select\n    Name\nfrom\n    Users", formatter.format("SELECT Name FROM Users", options));
    }

    @Test
    void format_tabWidth_drivesTagAndSqlIndent() {
        FormatterOptions options = FormatterOptions.builder().tabWidth(2).build();

        assertEquals("SELECT\n  a\nFROM\n  t", formatter.format("select a from t", options));
        assertEquals("""
                <where>
                  <if test="x">
                    a = 1
                  </if>
                </where>""", formatter.format("<where><if test=\"x\">a = 1</if></where>", options));
    }

    @Test
    void format_denseOperators() {
        FormatterOptions options = FormatterOptions.builder().denseOperators(true).build();
        String out = formatter.format("SELECT a FROM t WHERE a = 1", options);
        assertTrue(out.contains("a=1"), out);
    }

    @Test
    void format_leafFailure_degradesOnlyThatRun() {
        SqlLeafFormatter leaf = (sql, options) -> {
            if (sql.contains("boom")) throw new IllegalStateException("boom");
            return sql.toUpperCase(Locale.ROOT);
        };
        MybatisSqlFormatter f = new MybatisSqlFormatter(leaf);

        FormatOutcome outcome = f.tryFormat("select boom\n<if test=\"x\">AND b = 1</if>\nselect ok", null);

        assertEquals(FormatOutcome.Status.FORMATTED, outcome.getStatus());
        assertEquals("select boom\n<if test=\"x\">\n    AND B = 1\n</if>\nSELECT OK", outcome.getText());
    }

    @Test
    void format_leafLosingPlaceholder_keepsRunOriginal() {
        MybatisSqlFormatter f = new MybatisSqlFormatter((sql, options) -> "x");
        assertEquals("a = #{p}", f.format("a = #{p}"));
    }

    @Test
    void debugPrintCst_reportsParseError() {
        assertEquals("Error: Mismatched closing tag: expected </if>, got </foreach>",
                MybatisSqlFormatter.debugPrintCst("<if test=\"a\">x</foreach>"));
    }

    @Test
    void cleanup_collapsesBlankLinesAndTrailingSpaces() {
        assertEquals("a\n\nb", MybatisSqlFormatter.cleanup("\n  a  \n\n\n\nb \n"));
    }

    private static int count(String s, String needle) {
        int n = 0;
        int at = s.indexOf(needle);
        while (at >= 0) {
            n++;
            at = s.indexOf(needle, at + needle.length());
        }
        return n;
    }
}
