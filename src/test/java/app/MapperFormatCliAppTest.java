package app;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class MapperFormatCliAppTest {

    @TempDir
    Path tempDir;

    private static final String USER_MAPPER = """
            <mapper namespace="com.example.UserMapper">
                <select id="findUser" resultType="User">select id from users where id = #{id}</select>
                <select id="broken">select 1 <if test="a">and a = 1</foreach></select>
            </mapper>
            """;

    @Test
    void run_formatsTreeIntoOutDir_andWritesCsvReport() throws Exception {
        Path in = tempDir.resolve("mappers");
        Files.createDirectories(in.resolve("user"));
        Files.writeString(in.resolve("user/UserMapper.xml"), USER_MAPPER);
        Files.writeString(in.resolve("beans.xml"), "<beans/>");
        Path out = tempDir.resolve("formatted");
        Path result = tempDir.resolve("report/result.csv");

        MapperFormatCliApp.Summary s = MapperFormatCliApp.run(new String[]{
                "--in=" + in, "--out=" + out, "--result=" + result, "--dialect=mysql", "--keywordCase=lower"
        });

        assertEquals(2, s.getFiles());
        assertEquals(1, s.getNotMapper());
        assertEquals(1, s.getChangedFiles());
        assertEquals(1, s.getFormatted());
        assertEquals(1, s.getFallback());
        assertEquals(0, s.getFailedFiles());

        String formatted = Files.readString(out.resolve("user/UserMapper.xml"), StandardCharsets.UTF_8);
        assertTrue(formatted.contains("    <select id=\"findUser\" resultType=\"User\">\n"
                + "        select\n"
                + "            id\n"
                + "        from\n"
                + "            users\n"
                + "        where\n"
                + "            id = #{id}\n"
                + "    </select>"), formatted);
        assertTrue(formatted.contains("<select id=\"broken\">select 1 <if test=\"a\">and a = 1</foreach></select>"));
        assertFalse(Files.exists(out.resolve("beans.xml")));
        assertEquals(USER_MAPPER, Files.readString(in.resolve("user/UserMapper.xml")));

        CSVFormat read = CSVFormat.DEFAULT.builder().setHeader().setSkipHeaderRecord(true).build();
        try (CSVParser p = CSVParser.parse(result, StandardCharsets.UTF_8, read)) {
            List<CSVRecord> rows = p.getRecords();
            assertEquals(3, rows.size());
            assertTrue(rows.stream().anyMatch(r -> r.get("status").equals("NOT_MAPPER") && r.get("file").equals("beans.xml")));
            assertTrue(rows.stream().anyMatch(r -> r.get("status").equals("FALLBACK") && r.get("sqlId").equals("broken")));
        }
        assertTrue(Files.exists(tempDir.resolve("report/result-warnings.csv")));
    }

    @Test
    void run_inPlace_rewritesOnlyChangedFiles() throws Exception {
        Path file = tempDir.resolve("UserMapper.xml");
        Files.writeString(file, "<mapper namespace=\"m\">\n<select id=\"a\">select a from t</select>\n</mapper>");

        MapperFormatCliApp.Summary s = MapperFormatCliApp.run(new String[]{
                "--in=" + file, "--inPlace", "--noResult", "--tabWidth=2"
        });

        assertEquals(1, s.getChangedFiles());
        assertEquals("<mapper namespace=\"m\">\n<select id=\"a\">\n  SELECT\n    a\n  FROM\n    t\n</select>\n</mapper>",
                Files.readString(file));

        MapperFormatCliApp.Summary again = MapperFormatCliApp.run(new String[]{
                "--in=" + file, "--inPlace", "--noResult", "--tabWidth=2"
        });
        assertEquals(0, again.getChangedFiles());
        assertEquals(1, again.getUnchanged());
    }

    @Test
    void run_missingInput_isRejected() {
        assertThrows(IllegalArgumentException.class, () -> MapperFormatCliApp.run(new String[]{
                "--in=" + tempDir.resolve("nope"), "--noResult"
        }));
    }

    @Test
    void run_unknownEngine_isRejected() throws Exception {
        Path file = tempDir.resolve("M.xml");
        Files.writeString(file, "<mapper namespace=\"m\"/>");

        assertThrows(IllegalArgumentException.class, () -> MapperFormatCliApp.run(new String[]{
                "--in=" + file, "--noResult", "--engine=jsqlparser"
        }));
    }
}
