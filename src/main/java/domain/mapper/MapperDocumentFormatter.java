package domain.mapper;

import domain.format.CdataUtil;
import domain.format.FormatOutcome;
import domain.format.FormatterOptions;
import domain.format.MybatisSqlFormatter;
import domain.format.SqlDialect;
import domain.model.FormatContext;
import domain.model.FormatWarning;
import domain.model.FormatWarningSink;
import domain.model.WarningCode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Mapper XML 문서 전체를 포맷한다: statement body 만 교체하고 나머지 바이트는 그대로 둔다.
 *
 * <p>Each body is formatted by {@link MybatisSqlFormatter} and re-indented under its opening tag:
 * every non-blank line gets {@code baseIndent + indentUnit} in front of its own relative
 * indentation, and the closing tag goes back to {@code baseIndent}.</p>
 */
public final class MapperDocumentFormatter {

    private static final Logger log = LoggerFactory.getLogger(MapperDocumentFormatter.class);

    private final MybatisSqlFormatter formatter;
    private final FormatterOptions options;
    private final boolean autoDialect;
    private final boolean useTabs;
    private final DynamicTagBalanceChecker checker = new DynamicTagBalanceChecker();

    /**
     * @param options     core options; the dialect is ignored when {@code autoDialect}
     * @param autoDialect detect the dialect from the whole document
     * @param useTabs     indent unit is a tab instead of {@code tabWidth} spaces
     */
    public MapperDocumentFormatter(MybatisSqlFormatter formatter,
                                   FormatterOptions options,
                                   boolean autoDialect,
                                   boolean useTabs) {
        if (formatter == null) throw new IllegalArgumentException("formatter is null");
        this.formatter = formatter;
        this.options = options == null ? FormatterOptions.none() : options;
        this.autoDialect = autoDialect;
        this.useTabs = useTabs;
    }

    public MapperFormatResult format(String document, FormatContext ctx, FormatWarningSink warningSink) {
        FormatContext base = ctx == null ? FormatContext.EMPTY : ctx;
        FormatWarningSink sink = warningSink == null ? FormatWarningSink.none() : warningSink;

        if (document == null || !MapperStatementLocator.isMapper(document)) {
            return MapperFormatResult.notMapper(document);
        }

        String namespace = MapperStatementLocator.namespaceOf(document);
        base = base.withNamespace(namespace);

        FormatterOptions effective = options;
        if (autoDialect) {
            SqlDialect detected = MybatisSqlFormatter.detectDialect(document);
            effective = options.withDialect(detected);
            log.debug("{}: dialect detected as {}", base.getFile(), detected.getTag());
        }
        int tabWidth = MybatisSqlFormatter.resolveOptions(effective).getTabWidth();
        String indentUnit = useTabs ? "\t" : " ".repeat(tabWidth);

        List<StatementFormatResult> results = new ArrayList<>();
        StringBuilder out = new StringBuilder(document.length() + 256);
        int cursor = 0;
        boolean changed = false;

        for (MapperStatement st : MapperStatementLocator.locate(document)) {
            FormatContext sctx = base.withSqlId(st.getId());
            String original = st.getContent();
            String trimmed = original.trim();

            out.append(document, cursor, st.getContentStart());
            cursor = st.getContentEnd();

            if (trimmed.isEmpty() || CdataUtil.isWholeCdata(trimmed)) {
                out.append(original);
                results.add(new StatementFormatResult(st, StatementFormatResult.Status.SKIPPED,
                        trimmed.isEmpty() ? "blank body" : "CDATA body"));
                continue;
            }

            FormatOutcome outcome = formatter.tryFormat(trimmed, effective);
            if (outcome.isFallback()) {
                out.append(original);
                String reason = outcome.getFailure() == null ? "" : outcome.getFailure().getMessage();
                sink.warn(FormatWarning.of(WarningCode.FORMAT_FALLBACK, sctx,
                        "statement body could not be parsed; original kept", reason));
                results.add(new StatementFormatResult(st, StatementFormatResult.Status.FALLBACK, reason));
                continue;
            }

            if (!checker.verify(trimmed, outcome.getText(), sctx, sink)) {
                out.append(original);
                results.add(new StatementFormatResult(st, StatementFormatResult.Status.REVERTED,
                        "dynamic tag check failed"));
                continue;
            }

            String replacement = reindent(outcome.getText(), st.getBaseIndent(), indentUnit, tabWidth);
            out.append(replacement);
            if (replacement.equals(original)) {
                results.add(new StatementFormatResult(st, StatementFormatResult.Status.UNCHANGED, ""));
            } else {
                changed = true;
                results.add(new StatementFormatResult(st, StatementFormatResult.Status.FORMATTED, ""));
            }
        }
        out.append(document, cursor, document.length());

        return new MapperFormatResult(out.toString(), true, namespace, results, changed);
    }

    /**
     * {@code "\n" + lines + "\n" + baseIndent}; blank lines stay empty. With tabs, leading runs of
     * {@code tabWidth} spaces become tabs.
     */
    static String reindent(String formatted, String baseIndent, String indentUnit, int tabWidth) {
        String prefix = baseIndent + indentUnit;
        StringBuilder sb = new StringBuilder(formatted.length() + 64);
        sb.append('\n');
        String[] lines = formatted.split("\n", -1);
        for (int i = 0; i < lines.length; i++) {
            if (i > 0) sb.append('\n');
            String line = lines[i];
            if (line.trim().isEmpty()) continue;
            sb.append(prefix);
            sb.append("\t".equals(indentUnit) ? spacesToTabs(line, tabWidth) : line);
        }
        sb.append('\n').append(baseIndent);
        return sb.toString();
    }

    private static String spacesToTabs(String line, int tabWidth) {
        int n = 0;
        while (n < line.length() && line.charAt(n) == ' ') n++;
        return "\t".repeat(n / tabWidth) + " ".repeat(n % tabWidth) + line.substring(n);
    }
}
