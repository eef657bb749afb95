package io.surfworks.tensorforge.einstr;

/**
 * Base class for every failure raised by the subscript engine.
 *
 * <p>All failures are deterministic user-input errors: the same subscripts and
 * ranks always produce the same exception. The offending subscript text is kept
 * so callers can report it without re-threading the input.
 */
public class EinstrException extends RuntimeException {

    /**
     * Category of an engine failure.
     */
    public enum Kind {
        /** Malformed subscript text */
        SYNTAX,
        /** Operand count or rank does not fit the subscripts */
        ARITY,
        /** Operation-family structural rule violated */
        VALIDATION,
        /** Physical shape does not fit an output term */
        SHAPE
    }

    private final Kind kind;
    private final String subscripts;

    protected EinstrException(Kind kind, String message, String subscripts) {
        super(String.format("%s: \"%s\"", message, subscripts));
        this.kind = kind;
        this.subscripts = subscripts;
    }

    public Kind kind() {
        return kind;
    }

    /**
     * The subscript text (or term text) the failure refers to.
     */
    public String subscripts() {
        return subscripts;
    }
}
