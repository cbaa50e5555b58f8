package infra.output;

import domain.model.FormatContext;
import domain.model.FormatResultRow;
import domain.model.FormatWarning;
import domain.model.WarningCode;
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

class CsvResultWriterTest {

    @TempDir
    Path tempDir;

    private static final CSVFormat READ = CSVFormat.DEFAULT.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .build();

    @Test
    void write_resultAndWarningsFiles() throws Exception {
        Path result = tempDir.resolve("report/format-result.csv");
        List<FormatResultRow> rows = List.of(
                new FormatResultRow("FORMATTED", "a/UserMapper.xml", "com.example.UserMapper", "findUser", "select", "", ""),
                new FormatResultRow("FALLBACK", "a/UserMapper.xml", "com.example.UserMapper", "bad", "select",
                        "Mismatched closing tag: expected </if>, got </foreach>", "")
        );
        List<FormatWarning> warnings = List.of(FormatWarning.of(WarningCode.FORMAT_FALLBACK,
                new FormatContext("a/UserMapper.xml", "com.example.UserMapper", "bad"), "original kept", "line1\nline2"));

        new CsvResultWriter().write(result, rows, warnings);

        try (CSVParser p = CSVParser.parse(result, StandardCharsets.UTF_8, READ)) {
            assertEquals(List.of("status", "file", "namespace", "sqlId", "statementType", "message", "detail"), p.getHeaderNames());
            List<CSVRecord> records = p.getRecords();
            assertEquals(2, records.size());
            assertEquals("findUser", records.get(0).get("sqlId"));
            assertEquals("Mismatched closing tag: expected </if>, got </foreach>", records.get(1).get("message"));
        }

        Path warningsFile = tempDir.resolve("report/format-result-warnings.csv");
        assertTrue(Files.exists(warningsFile));
        try (CSVParser p = CSVParser.parse(warningsFile, StandardCharsets.UTF_8, READ)) {
            List<CSVRecord> records = p.getRecords();
            assertEquals(1, records.size());
            assertEquals("FORMAT_FALLBACK", records.get(0).get("code"));
            assertEquals("line1\nline2", records.get(0).get("detail"));
        }
    }

    @Test
    void warningsFileOf_replacesExtension() {
        assertEquals(Path.of("out", "r-warnings.csv"), CsvResultWriter.warningsFileOf(Path.of("out", "r.csv")));
        assertEquals(Path.of("r-warnings.csv"), CsvResultWriter.warningsFileOf(Path.of("r")));
    }
}
