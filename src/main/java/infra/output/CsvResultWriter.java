package infra.output;

import domain.model.FormatResultRow;
import domain.model.FormatWarning;
import domain.output.ResultWriter;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;

import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * CSV report writer (Commons CSV).
 *
 * <p>Two files: {@code <name>.csv} for the result rows and {@code <name>-warnings.csv} next to it.</p>
 */
public final class CsvResultWriter implements ResultWriter {

    private static final CSVFormat RESULT_FORMAT = CSVFormat.DEFAULT.builder()
            .setHeader(XlsxResultWriter.RESULT_HEADER)
            .build();

    private static final CSVFormat WARNING_FORMAT = CSVFormat.DEFAULT.builder()
            .setHeader(XlsxResultWriter.WARNING_HEADER)
            .build();

    /** {@code report.csv} -> {@code report-warnings.csv} */
    public static Path warningsFileOf(Path resultFile) {
        String name = resultFile.getFileName().toString();
        int dot = name.lastIndexOf('.');
        String stem = dot > 0 ? name.substring(0, dot) : name;
        return resultFile.resolveSibling(stem + "-warnings.csv");
    }

    @Override
    public void write(Path resultFile, List<FormatResultRow> results, List<FormatWarning> warnings) {
        if (resultFile == null) throw new IllegalArgumentException("resultFile is null");
        if (results == null) throw new IllegalArgumentException("results is null");
        if (warnings == null) throw new IllegalArgumentException("warnings is null");

        ReportFiles.createParentDirectories(resultFile);

        try (Writer w = Files.newBufferedWriter(resultFile, StandardCharsets.UTF_8);
             CSVPrinter printer = new CSVPrinter(w, RESULT_FORMAT)) {
            for (FormatResultRow it : results) {
                printer.printRecord(
                        it.getStatus(),
                        it.getFile(),
                        it.getNamespace(),
                        it.getSqlId(),
                        it.getStatementType(),
                        it.getMessage(),
                        it.getDetail()
                );
            }
        } catch (Exception e) {
            throw new IllegalStateException("Failed to write csv: " + resultFile, e);
        }

        Path warningsFile = warningsFileOf(resultFile);
        try (Writer w = Files.newBufferedWriter(warningsFile, StandardCharsets.UTF_8);
             CSVPrinter printer = new CSVPrinter(w, WARNING_FORMAT)) {
            for (FormatWarning it : warnings) {
                printer.printRecord(
                        it.getCode().name(),
                        it.getFile(),
                        it.getNamespace(),
                        it.getSqlId(),
                        it.getMessage(),
                        it.getDetail()
                );
            }
        } catch (Exception e) {
            throw new IllegalStateException("Failed to write csv: " + warningsFile, e);
        }
    }
}
