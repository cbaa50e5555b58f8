package app;

import cli.CliArgParser;
import cli.CliPathResolver;
import cli.CliProgressMonitor;
import cli.MapperFormatCli;
import domain.format.FormatterOptions;
import domain.format.IndentStyle;
import domain.format.KeywordCase;
import domain.format.MybatisSqlFormatter;
import domain.format.SqlDialect;
import domain.format.SqlLeafFormatter;
import domain.mapper.MapperDocumentFormatter;
import domain.mapper.MapperFormatResult;
import domain.mapper.StatementFormatResult;
import domain.model.FormatContext;
import domain.model.FormatResultRow;
import domain.model.FormatWarning;
import domain.model.FormatWarningSink;
import domain.model.ListFormatWarningSink;
import domain.model.WarningCode;
import domain.output.FormattedXmlWriter;
import domain.output.ResultWriter;
import mybatis.MapperXmlScanner;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/** CLI entry (invoked by {@link MapperFormatCli}). */
public final class MapperFormatCliApp {

    private MapperFormatCliApp() {}

    public static void main(String[] args) {
        run(args);
    }

    /**
     * Runs one batch and returns its counters.
     *
     * @throws IllegalStateException with {@code --failFast}, on the first file that cannot be processed
     */
    public static Summary run(String[] args) {

        long t0 = System.nanoTime();
        Map<String, String> argv = CliArgParser.parseArgs(args);

        // ------------------------------------------------------------
        // baseDir / in / out / result
        // ------------------------------------------------------------
        CliPathResolver paths = CliPathResolver.fromArgs(argv);
        Path baseDir = paths.getBaseDir();

        Path in = paths.resolve(CliArgParser.option(argv, "in"), CliPathResolver.DEFAULT_IN);
        Path out = paths.resolve(CliArgParser.option(argv, "out"), CliPathResolver.DEFAULT_OUT);
        Path result = paths.resolve(CliArgParser.option(argv, "result"), CliPathResolver.DEFAULT_RESULT);

        boolean inPlace = CliArgParser.optionFlag(argv, "inPlace");
        boolean noResult = CliArgParser.optionFlag(argv, "noResult");
        boolean failFast = CliArgParser.optionFlag(argv, "failFast");
        boolean useTabs = CliArgParser.optionFlag(argv, "useTabs");
        int logEvery = Math.max(1, CliArgParser.parseInt(CliArgParser.option(argv, "logEvery"), 100));
        String engine = CliArgParser.option(argv, "engine");

        // ------------------------------------------------------------
        // formatting options
        // ------------------------------------------------------------
        String dialectRaw = CliArgParser.option(argv, "dialect");
        boolean autoDialect = CliArgParser.isAutoDialect(dialectRaw);
        SqlDialect dialect = CliArgParser.parseDialect(dialectRaw);
        KeywordCase keywordCase = CliArgParser.parseKeywordCase(CliArgParser.option(argv, "keywordCase"));
        IndentStyle indentStyle = CliArgParser.parseIndentStyle(CliArgParser.option(argv, "indentStyle"));
        Integer tabWidth = CliArgParser.parseTabWidth(CliArgParser.option(argv, "tabWidth"));
        Boolean denseOperators = CliArgParser.hasOption(argv, "denseOperators")
                ? CliArgParser.optionFlag(argv, "denseOperators")
                : null;

        FormatterOptions options = FormatterOptions.builder()
                .dialect(dialect)
                .keywordCase(keywordCase)
                .tabWidth(tabWidth)
                .indentStyle(indentStyle)
                .denseOperators(denseOperators)
                .build();

        System.out.println("==================================================");
        System.out.println("[START] MyBatis mapper formatting");
        System.out.println("[CONF] baseDir        = " + baseDir);
        System.out.println("[CONF] in             = " + in);
        System.out.println("[CONF] out            = " + (inPlace ? "(in place)" : out.toString()));
        System.out.println("[CONF] result         = " + (noResult ? "(disabled)" : result.toString()));
        System.out.println("[CONF] engine         = " + (engine == null ? MapperFormatComponentsFactory.ENGINE_BUILTIN : engine));
        System.out.println("[CONF] dialect        = " + (autoDialect ? "auto" : dialect.getTag()));
        System.out.println("[CONF] options        = " + MybatisSqlFormatter.resolveOptions(options));
        System.out.println("[CONF] useTabs        = " + useTabs);
        System.out.println("[CONF] failFast       = " + failFast);
        System.out.println("[CONF] logEvery       = " + logEvery);
        System.out.println("==================================================");

        CliPathResolver.requireExists(in, "mapper input (--in)");

        // ------------------------------------------------------------
        // assemble runtime components
        // ------------------------------------------------------------
        MapperFormatComponentsFactory factory = new MapperFormatComponentsFactory();
        SqlLeafFormatter leaf = factory.createLeafFormatter(engine);
        MapperDocumentFormatter documentFormatter = factory.createDocumentFormatter(leaf, options, autoDialect, useTabs);
        FormattedXmlWriter xmlWriter = factory.createXmlWriter(inPlace, out);
        ResultWriter resultWriter = factory.createResultWriter(!noResult, result);

        long tScan0 = System.nanoTime();
        List<Path> files = MapperXmlScanner.scan(in);
        System.out.println("[STEP1] scan done. xmlFiles=" + files.size() + ", elapsed=" + ms(tScan0) + "ms");

        List<FormatResultRow> rows = new ArrayList<>(Math.max(16, files.size() * 8));
        List<FormatWarning> warnings = new ArrayList<>(64);
        FormatWarningSink warningSink = new ListFormatWarningSink(warnings);
        Summary summary = new Summary();

        long tLoop0 = System.nanoTime();
        int total = files.size();
        System.out.println("[STEP2] formatting start. total=" + total);

        try (CliProgressMonitor progress = new CliProgressMonitor(total, logEvery)) {
            for (int i = 0; i < total; i++) {
                Path file = files.get(i);
                Path relative = MapperXmlScanner.relativize(in, file);
                String key = relative.toString();
                FormatContext ctx = new FormatContext(key, "", "");
                progress.begin(key);

                try {
                    String document = Files.readString(file, StandardCharsets.UTF_8);
                    MapperFormatResult r = documentFormatter.format(document, ctx, warningSink);

                    if (!r.isMapper()) {
                        summary.notMapper++;
                        rows.add(new FormatResultRow("NOT_MAPPER", key, "", "", "", "not a MyBatis mapper", ""));
                        warningSink.warn(FormatWarning.of(WarningCode.NOT_MAPPER_XML, ctx, "not a MyBatis mapper; skipped", ""));
                    } else {
                        for (StatementFormatResult st : r.getStatements()) {
                            rows.add(new FormatResultRow(
                                    st.getStatus().name(), key, r.getNamespace(),
                                    st.getStatement().getId(), st.getStatement().getStatementType(),
                                    st.getMessage(), ""));
                            summary.count(st.getStatus());
                        }
                        if (!inPlace || r.isChanged()) {
                            xmlWriter.write(file, relative, r.getText());
                        }
                        if (r.isChanged()) summary.changedFiles++;
                    }
                } catch (IOException e) {
                    summary.failedFiles++;
                    rows.add(new FormatResultRow("ERROR", key, "", "", "", e.getClass().getSimpleName(), safe(e.getMessage())));
                    warningSink.warn(FormatWarning.of(WarningCode.IO_ERROR, ctx, "cannot read/write file", safe(e.getMessage())));
                    System.out.println("[ERROR] io failed: " + key + " ex=" + e.getClass().getName() + ": " + safe(e.getMessage()));
                    if (failFast) {
                        System.out.println("[FAILFAST] stop on first error.");
                        writeReport(resultWriter, noResult, result, rows, warnings);
                        throw new IllegalStateException("Failed to format mapper: " + file, e);
                    }
                } catch (RuntimeException e) {
                    summary.failedFiles++;
                    rows.add(new FormatResultRow("ERROR", key, "", "", "", e.getClass().getSimpleName(), safe(e.getMessage())));
                    WarningCode code = (e.getCause() instanceof IOException) ? WarningCode.IO_ERROR : WarningCode.TRANSFORM_ERROR;
                    warningSink.warn(FormatWarning.of(code, ctx, e.getClass().getSimpleName(), safe(e.getMessage())));
                    System.out.println("[ERROR] format/write failed: " + key + " ex=" + e.getClass().getName() + ": " + safe(e.getMessage()));
                    if (failFast) {
                        System.out.println("[FAILFAST] stop on first error.");
                        writeReport(resultWriter, noResult, result, rows, warnings);
                        throw new IllegalStateException("Failed to format mapper: " + file, e);
                    }
                }

                summary.files++;
                progress.finished(summary.changedFiles, summary.failedFiles);
            }
        }

        System.out.println("[STEP2] formatting done. elapsed=" + ms(tLoop0) + "ms");
        System.out.println("[STAT] " + summary);
        System.out.println("[STAT] warnings=" + warnings.size());
        for (FormatWarning w : warnings) {
            if (w.getCode() == WarningCode.NOT_MAPPER_XML) continue;
            System.out.println("[WARN] " + w.getCode() + " " + w.getFile() + " " + w.getSqlId() + " : " + w.getMessage());
        }

        writeReport(resultWriter, noResult, result, rows, warnings);

        System.out.println("==================================================");
        System.out.println("[DONE] totalElapsed=" + ms(t0) + "ms");
        System.out.println("==================================================");
        return summary;
    }

    private static void writeReport(ResultWriter writer, boolean noResult, Path result,
                                    List<FormatResultRow> rows, List<FormatWarning> warnings) {
        if (noResult) {
            System.out.println("[STEP3] result report skipped (--noResult). rows=" + rows.size());
            return;
        }
        long t = System.nanoTime();
        System.out.println("[STEP3] writing result report... rows=" + rows.size());
        writer.write(result, rows, warnings);
        System.out.println("[STEP3] result report written: " + result + " elapsed=" + ms(t) + "ms");
    }

    private static long ms(long nanoStart) {
        return (System.nanoTime() - nanoStart) / 1_000_000L;
    }

    private static String safe(String s) {
        return (s == null) ? "" : s;
    }

    /** Batch counters. */
    public static final class Summary {
        private int files;
        private int notMapper;
        private int changedFiles;
        private int failedFiles;
        private int formatted;
        private int unchanged;
        private int skipped;
        private int fallback;
        private int reverted;

        private void count(StatementFormatResult.Status status) {
            switch (status) {
                case FORMATTED -> formatted++;
                case UNCHANGED -> unchanged++;
                case SKIPPED -> skipped++;
                case FALLBACK -> fallback++;
                case REVERTED -> reverted++;
            }
        }

        public int getFiles() {
            return files;
        }

        public int getNotMapper() {
            return notMapper;
        }

        public int getChangedFiles() {
            return changedFiles;
        }

        public int getFailedFiles() {
            return failedFiles;
        }

        public int getFormatted() {
            return formatted;
        }

        public int getUnchanged() {
            return unchanged;
        }

        public int getSkipped() {
            return skipped;
        }

        public int getFallback() {
            return fallback;
        }

        public int getReverted() {
            return reverted;
        }

        @Override
        public String toString() {
            return "files=" + files
                    + ", notMapper=" + notMapper
                    + ", changedFiles=" + changedFiles
                    + ", failedFiles=" + failedFiles
                    + ", formatted=" + formatted
                    + ", unchanged=" + unchanged
                    + ", skipped=" + skipped
                    + ", fallback=" + fallback
                    + ", reverted=" + reverted;
        }
    }
}
