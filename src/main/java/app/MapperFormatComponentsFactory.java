package app;

import domain.format.BuiltinSqlLeafFormatter;
import domain.format.DruidSqlLeafFormatter;
import domain.format.FormatterOptions;
import domain.format.MybatisSqlFormatter;
import domain.format.SqlLeafFormatter;
import domain.mapper.MapperDocumentFormatter;
import domain.output.FormattedXmlWriter;
import domain.output.ResultWriter;
import infra.output.CsvResultWriter;
import infra.output.FileFormattedXmlWriter;
import infra.output.NullResultWriter;
import infra.output.XlsxResultWriter;

import java.nio.file.Path;
import java.util.Locale;

/**
 * Object-assembly factory for {@link MapperFormatCliApp}.
 * <p>
 * The CLI app stays on orchestration/logging; object creation lives here.
 */
final class MapperFormatComponentsFactory {

    static final String ENGINE_BUILTIN = "builtin";
    static final String ENGINE_DRUID = "druid";

    SqlLeafFormatter createLeafFormatter(String engine) {
        String e = (engine == null || engine.isBlank()) ? ENGINE_BUILTIN : engine.trim().toLowerCase(Locale.ROOT);
        return switch (e) {
            case ENGINE_BUILTIN -> new BuiltinSqlLeafFormatter();
            case ENGINE_DRUID -> new DruidSqlLeafFormatter();
            default -> throw new IllegalArgumentException("Unknown engine: " + engine + " (builtin|druid)");
        };
    }

    MapperDocumentFormatter createDocumentFormatter(SqlLeafFormatter leaf,
                                                    FormatterOptions options,
                                                    boolean autoDialect,
                                                    boolean useTabs) {
        return new MapperDocumentFormatter(new MybatisSqlFormatter(leaf), options, autoDialect, useTabs);
    }

    FormattedXmlWriter createXmlWriter(boolean inPlace, Path outDir) {
        if (inPlace) return FileFormattedXmlWriter.inPlace();
        return new FileFormattedXmlWriter(outDir);
    }

    ResultWriter createResultWriter(boolean enable, Path resultFile) {
        if (!enable) return new NullResultWriter();
        String name = resultFile.getFileName().toString().toLowerCase(Locale.ROOT);
        if (name.endsWith(".csv")) return new CsvResultWriter();
        return new XlsxResultWriter();
    }
}
