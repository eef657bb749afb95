package io.surfworks.tensorforge.einstr;

/**
 * The three operation families whose subscripts the engine understands.
 */
public enum OperationFamily {
    /** Contraction: any number of inputs, one output */
    EINSUM("einsum"),
    /** Decomposition: one input split into two factors sharing a new rank index */
    EINSVD("einsvd"),
    /** Contraction followed by decomposition of its result */
    EINSUMSVD("einsumsvd");

    private final String label;

    OperationFamily(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * The rule set for this family.
     */
    public ExpressionValidator validator() {
        return switch (this) {
            case EINSUM -> EinsumValidator.INSTANCE;
            case EINSVD -> EinsvdValidator.INSTANCE;
            case EINSUMSVD -> EinsumsvdValidator.INSTANCE;
        };
    }

    /**
     * Looks a family up by its label, ignoring case.
     *
     * @throws IllegalArgumentException for an unknown label
     */
    public static OperationFamily fromLabel(String label) {
        for (OperationFamily family : values()) {
            if (family.label.equalsIgnoreCase(label)) {
                return family;
            }
        }
        throw new IllegalArgumentException("Unknown operation family: " + label);
    }
}
