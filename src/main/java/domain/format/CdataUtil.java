package domain.format;

/**
 * {@code <![CDATA[ ... ]]>} 유틸.
 *
 * <p>A statement body wrapped in one CDATA section keeps its wrapper; only the inner SQL is
 * formatted.</p>
 */
public final class CdataUtil {

    public static final String OPEN = "<![CDATA[";
    public static final String CLOSE = "]]>";

    private CdataUtil() {
    }

    /** trimmed text is exactly one CDATA section. */
    public static boolean isWholeCdata(String raw) {
        if (raw == null) return false;
        String t = raw.trim();
        if (!t.startsWith(OPEN) || !t.endsWith(CLOSE)) return false;
        return t.indexOf(CLOSE, OPEN.length()) == t.length() - CLOSE.length();
    }

    public static String innerOf(String raw) {
        if (raw == null) return "";
        String t = raw.trim();
        if (!isWholeCdata(t)) return raw;
        return t.substring(OPEN.length(), t.length() - CLOSE.length());
    }

    public static String wrap(String inner) {
        String body = inner == null ? "" : inner.trim();
        if (body.isEmpty()) return OPEN + CLOSE;
        return OPEN + "\n" + body + "\n" + CLOSE;
    }
}
