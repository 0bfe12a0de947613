package natvis.rules;

/**
 * The document as a whole is not a usable rule document (not well formed, wrong root element, ...).
 */
public class NatvisDocumentException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    public NatvisDocumentException(String message) {
        super(message);
    }

    public NatvisDocumentException(String message, Throwable cause) {
        super(message, cause);
    }
}
