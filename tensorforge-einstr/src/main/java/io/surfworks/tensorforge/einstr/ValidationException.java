package io.surfworks.tensorforge.einstr;

/**
 * Thrown when a matched expression breaks a structural rule of its operation family.
 *
 * <p>The {@link Rule} identifies the violated rule so callers and tests can react
 * to it without parsing the message.
 */
public class ValidationException extends EinstrException {

    /**
     * Structural rules checked by the family validators.
     */
    public enum Rule {
        /** Wrong number of output terms */
        OUTPUT_COUNT,
        /** Wrong number of input terms */
        INPUT_COUNT,
        /** Output index that no input binds */
        UNBOUND_OUTPUT_INDEX,
        /** Index repeated inside a decomposition input */
        REPEATED_INPUT_INDEX,
        /** Decomposition input index missing from every output */
        INPUT_INDEX_DROPPED,
        /** Outputs do not introduce exactly one new index */
        NEW_INDEX_COUNT,
        /** New index missing from one of the factors */
        NEW_INDEX_NOT_SHARED,
        /** Factor with fewer than two indices */
        RANK_ONE_FACTOR,
        /** Index other than the new one repeated across the factors */
        ILLEGAL_OUTPUT_REPEAT
    }

    private final Rule rule;
    private final OperationFamily family;

    public ValidationException(OperationFamily family, Rule rule, String message, String subscripts) {
        super(Kind.VALIDATION, String.format("%s for %s", message, family.label()), subscripts);
        this.rule = rule;
        this.family = family;
    }

    public Rule rule() {
        return rule;
    }

    public OperationFamily family() {
        return family;
    }
}
