package infra.output;

import domain.model.FormatResultRow;
import domain.model.FormatWarning;
import domain.output.ResultWriter;
import org.apache.poi.ss.usermodel.Row;
import org.apache.poi.ss.usermodel.Sheet;
import org.apache.poi.ss.usermodel.Workbook;
import org.apache.poi.xssf.usermodel.XSSFWorkbook;

import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * XLSX report writer.
 *
 * <p>Sheets:
 * <ul>
 *   <li>result: one row per statement (or per skipped / failed file)</li>
 *   <li>warnings: non-fatal warnings (standard codes)</li>
 * </ul>
 */
public final class XlsxResultWriter implements ResultWriter {

    static final String[] RESULT_HEADER = {
            "status", "file", "namespace", "sqlId", "statementType", "message", "detail"
    };
    static final String[] WARNING_HEADER = {
            "code", "file", "namespace", "sqlId", "message", "detail"
    };

    private static void writeResultSheet(Workbook wb, List<FormatResultRow> results) {
        Sheet sh = wb.createSheet("result");
        int r = 0;
        header(sh.createRow(r++), RESULT_HEADER);

        for (FormatResultRow it : results) {
            Row row = sh.createRow(r++);
            row.createCell(0)
                    .setCellValue(it.getStatus());
            row.createCell(1)
                    .setCellValue(it.getFile());
            row.createCell(2)
                    .setCellValue(it.getNamespace());
            row.createCell(3)
                    .setCellValue(it.getSqlId());
            row.createCell(4)
                    .setCellValue(it.getStatementType());
            row.createCell(5)
                    .setCellValue(it.getMessage());
            row.createCell(6)
                    .setCellValue(it.getDetail());
        }
    }

    private static void writeWarningsSheet(Workbook wb, List<FormatWarning> warnings) {
        Sheet sh = wb.createSheet("warnings");
        int r = 0;
        header(sh.createRow(r++), WARNING_HEADER);

        for (FormatWarning w : warnings) {
            Row row = sh.createRow(r++);
            row.createCell(0)
                    .setCellValue(w.getCode().name());
            row.createCell(1)
                    .setCellValue(w.getFile());
            row.createCell(2)
                    .setCellValue(w.getNamespace());
            row.createCell(3)
                    .setCellValue(w.getSqlId());
            row.createCell(4)
                    .setCellValue(w.getMessage());
            row.createCell(5)
                    .setCellValue(w.getDetail());
        }
    }

    private static void header(Row row, String[] names) {
        for (int i = 0; i < names.length; i++) {
            row.createCell(i)
                    .setCellValue(names[i]);
        }
    }

    @Override
    public void write(Path resultFile, List<FormatResultRow> results, List<FormatWarning> warnings) {
        if (resultFile == null) throw new IllegalArgumentException("resultFile is null");
        if (results == null) throw new IllegalArgumentException("results is null");
        if (warnings == null) throw new IllegalArgumentException("warnings is null");

        ReportFiles.createParentDirectories(resultFile);

        try (Workbook wb = new XSSFWorkbook()) {
            writeResultSheet(wb, results);
            writeWarningsSheet(wb, warnings);

            try (OutputStream os = Files.newOutputStream(resultFile)) {
                wb.write(os);
            }
        } catch (Exception e) {
            throw new IllegalStateException("Failed to write xlsx: " + resultFile, e);
        }
    }
}
