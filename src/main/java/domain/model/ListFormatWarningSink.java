package domain.model;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * List-backed sink with de-duplication by (code|file|namespace|sqlId|message|detail).
 */
public final class ListFormatWarningSink implements FormatWarningSink {

    private final List<FormatWarning> target;
    private final Set<String> seen = new HashSet<>(256);

    public ListFormatWarningSink(List<FormatWarning> target) {
        this.target = target;
    }

    private static String key(FormatWarning w) {
        return w.getCode().name() + "|"
                + w.getFile() + "|"
                + w.getNamespace() + "|"
                + w.getSqlId() + "|"
                + w.getMessage() + "|"
                + w.getDetail();
    }

    @Override
    public void warn(FormatWarning warning) {
        if (warning == null || target == null) return;
        if (seen.add(key(warning))) {
            target.add(warning);
        }
    }
}
