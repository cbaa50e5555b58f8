package cli;

import domain.format.IndentStyle;
import domain.format.KeywordCase;
import domain.format.SqlDialect;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * {@code --key=value} / {@code --key value} / {@code --flag} parsing.
 *
 * <p>Every option falls back to the JVM system property of the same name
 * ({@code -DkeywordCase=lower}); the command line wins.</p>
 */
public final class CliArgParser {

    private static final Set<String> TRUE_WORDS = Set.of("true", "1", "y", "yes", "on");

    private CliArgParser() {
    }

    public static Map<String, String> parseArgs(String[] args) {
        Map<String, String> m = new LinkedHashMap<>();
        if (args == null) return m;

        int i = 0;
        while (i < args.length) {
            String a = args[i] == null ? "" : args[i].trim();
            i++;
            if (!a.startsWith("--") || a.length() == 2) continue;

            String body = a.substring(2);
            int eq = body.indexOf('=');
            if (eq > 0) {
                m.put(body.substring(0, eq).trim(), body.substring(eq + 1).trim());
            } else if (i < args.length && args[i] != null && !args[i].startsWith("--")) {
                m.put(body.trim(), args[i].trim());
                i++;
            } else {
                m.put(body.trim(), "");
            }
        }
        return m;
    }

    /** command line value, else system property, else null (blank counts as absent) */
    public static String option(Map<String, String> argv, String key) {
        String v = argv == null ? null : argv.get(key);
        if (v == null || v.isBlank()) v = System.getProperty(key);
        return (v == null || v.isBlank()) ? null : v.trim();
    }

    /** presence-style: {@code --inPlace} and {@code --inPlace=true} are on, {@code --inPlace=false} is off */
    public static boolean flag(Map<String, String> argv, String key) {
        if (argv == null || !argv.containsKey(key)) return false;
        return isTrue(argv.get(key), true);
    }

    /** {@link #flag} with system-property fallback */
    public static boolean optionFlag(Map<String, String> argv, String key) {
        if (argv != null && argv.containsKey(key)) return flag(argv, key);
        String prop = System.getProperty(key);
        return prop != null && isTrue(prop, true);
    }

    public static boolean hasOption(Map<String, String> argv, String key) {
        return (argv != null && argv.containsKey(key)) || System.getProperty(key) != null;
    }

    public static int parseInt(String s, int def) {
        if (s == null) return def;
        try {
            return Integer.parseInt(s.trim());
        } catch (NumberFormatException e) {
            return def;
        }
    }

    /** "auto" (or absent) means: detect per document */
    public static boolean isAutoDialect(String raw) {
        return raw == null || raw.isBlank() || raw.trim().equalsIgnoreCase("auto");
    }

    /**
     * @return null for auto
     * @throws IllegalArgumentException unknown dialect
     */
    public static SqlDialect parseDialect(String raw) {
        return isAutoDialect(raw) ? null : SqlDialect.fromTag(raw);
    }

    public static KeywordCase parseKeywordCase(String raw) {
        return raw == null ? null : KeywordCase.fromTag(raw);
    }

    public static IndentStyle parseIndentStyle(String raw) {
        return raw == null ? null : IndentStyle.fromTag(raw);
    }

    /** null unless a positive number */
    public static Integer parseTabWidth(String raw) {
        int v = parseInt(raw, 0);
        return v > 0 ? v : null;
    }

    private static boolean isTrue(String raw, boolean blankMeans) {
        if (raw == null || raw.isBlank()) return blankMeans;
        return TRUE_WORDS.contains(raw.trim().toLowerCase(Locale.ROOT));
    }
}
