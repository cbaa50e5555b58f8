package domain.format;

import java.util.Locale;

public enum KeywordCase {
    UPPER("upper"),
    LOWER("lower"),
    /** keep the spelling found in source */
    PRESERVE("preserve");

    private final String tag;

    KeywordCase(String tag) {
        this.tag = tag;
    }

    public String getTag() {
        return tag;
    }

    public String apply(String word) {
        return switch (this) {
            case UPPER -> word.toUpperCase(Locale.ROOT);
            case LOWER -> word.toLowerCase(Locale.ROOT);
            case PRESERVE -> word;
        };
    }

    public static KeywordCase fromTag(String tag) {
        if (tag == null) throw new IllegalArgumentException("keywordCase is null");
        String t = tag.trim().toLowerCase(Locale.ROOT);
        for (KeywordCase k : values()) {
            if (k.tag.equals(t)) return k;
        }
        throw new IllegalArgumentException("Unknown keywordCase: " + tag);
    }
}
