package domain.format;

import java.util.Locale;

/**
 * Clause layout of the leaf formatter.
 *
 * <ul>
 *   <li>{@link #STANDARD}: clause keyword on its own line, content indented below it</li>
 *   <li>{@link #TABULAR_LEFT}: keyword left-aligned in a fixed-width column, content on the same line</li>
 *   <li>{@link #TABULAR_RIGHT}: same, keyword right-aligned</li>
 * </ul>
 */
public enum IndentStyle {
    STANDARD("standard"),
    TABULAR_LEFT("tabularLeft"),
    TABULAR_RIGHT("tabularRight");

    private final String tag;

    IndentStyle(String tag) {
        this.tag = tag;
    }

    public String getTag() {
        return tag;
    }

    public boolean isTabular() {
        return this != STANDARD;
    }

    public static IndentStyle fromTag(String tag) {
        if (tag == null) throw new IllegalArgumentException("indentStyle is null");
        String t = tag.trim().toLowerCase(Locale.ROOT);
        for (IndentStyle s : values()) {
            if (s.tag.toLowerCase(Locale.ROOT).equals(t)) return s;
        }
        throw new IllegalArgumentException("Unknown indentStyle: " + tag);
    }
}
