package infra.output;

import domain.model.FormatResultRow;
import domain.model.FormatWarning;
import domain.output.ResultWriter;

import java.nio.file.Path;
import java.util.List;

/**
 * No-op implementation ({@code --noResult}).
 */
public final class NullResultWriter implements ResultWriter {
    @Override
    public void write(Path resultFile, List<FormatResultRow> results, List<FormatWarning> warnings) {
        // intentionally no-op
    }
}
