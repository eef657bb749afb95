package io.surfworks.tensorforge.einstr;

/**
 * Thrown when a physical shape does not line up with an output term.
 */
public class ShapeException extends EinstrException {

    public ShapeException(String message, String term) {
        super(Kind.SHAPE, message, term);
    }
}
