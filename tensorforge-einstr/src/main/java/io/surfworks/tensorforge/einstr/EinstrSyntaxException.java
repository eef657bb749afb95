package io.surfworks.tensorforge.einstr;

/**
 * Thrown when subscript text does not follow the grammar.
 */
public class EinstrSyntaxException extends EinstrException {

    private final int column;

    public EinstrSyntaxException(String message, String subscripts) {
        super(Kind.SYNTAX, message, subscripts);
        this.column = -1;
    }

    public EinstrSyntaxException(String message, String subscripts, int column) {
        super(Kind.SYNTAX, String.format("%s at column %d", message, column), subscripts);
        this.column = column;
    }

    /**
     * 1-based column of the offending character, or -1 when the failure is not tied to one.
     */
    public int getColumn() {
        return column;
    }
}
