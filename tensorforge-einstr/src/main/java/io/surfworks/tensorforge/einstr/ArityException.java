package io.surfworks.tensorforge.einstr;

/**
 * Thrown when operand count or operand ranks cannot be bound to the subscripts.
 */
public class ArityException extends EinstrException {

    public ArityException(String message, String subscripts) {
        super(Kind.ARITY, message, subscripts);
    }
}
