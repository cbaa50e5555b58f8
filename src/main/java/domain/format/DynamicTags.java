package domain.format;

import java.util.Locale;
import java.util.Set;

/**
 * Closed set of MyBatis dynamic SQL tags that become {@link TagNode}s.
 *
 * <p>Anything else shaped like {@code <...>} (CDATA, XML comments, {@code <>} operator,
 * unknown elements) stays plain SQL text.</p>
 */
public final class DynamicTags {

    public static final Set<String> NAMES = Set.of(
            "if", "choose", "when", "otherwise", "foreach",
            "where", "set", "trim", "bind", "include", "property"
    );

    private DynamicTags() {
    }

    public static boolean isDynamicTag(String name) {
        if (name == null || name.isEmpty()) return false;
        return NAMES.contains(name.toLowerCase(Locale.ROOT));
    }
}
