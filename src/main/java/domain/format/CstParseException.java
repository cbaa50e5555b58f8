package domain.format;

/**
 * Structural failure while building the CST: a closing tag that does not match its opening tag,
 * a dynamic tag left unclosed at end of input, or a stray dynamic closing tag at root level.
 *
 * <p>Thrown out of {@link MybatisSqlParser#parse(String)}; {@link MybatisSqlFormatter}
 * turns it into a whole-input fallback.</p>
 */
public class CstParseException extends RuntimeException {

    private final int position;

    public CstParseException(String message, int position) {
        super(message + " (at " + position + ")");
        this.position = position;
    }

    public int getPosition() {
        return position;
    }
}
