package domain.format;

/** The two MyBatis placeholder forms. */
public enum ParamDelimiter {

    /** {@code #{...}}: bound as a PreparedStatement parameter. */
    SAFE('#'),

    /** {@code ${...}}: substituted into the SQL text as-is. */
    RAW('$');

    private final char sigil;

    ParamDelimiter(char sigil) {
        this.sigil = sigil;
    }

    public char getSigil() {
        return sigil;
    }

    public static ParamDelimiter fromSigil(char c) {
        if (c == '#') return SAFE;
        if (c == '$') return RAW;
        throw new IllegalArgumentException("not a parameter sigil: " + c);
    }

    static boolean isSigil(char c) {
        return c == '#' || c == '$';
    }
}
