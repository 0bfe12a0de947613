package natvis.engine;

/**
 * A size expression that must produce an unsigned integer didn't.
 */
public class SizeParseException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    public SizeParseException(String text) {
        super("couldn't parse '" + text + "' as an unsigned integer");
    }
}
