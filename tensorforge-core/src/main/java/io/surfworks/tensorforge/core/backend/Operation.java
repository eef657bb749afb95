package io.surfworks.tensorforge.core.backend;

import java.util.Locale;

/**
 * Numeric operations a backend may implement.
 */
public enum Operation {
    EINSUM,
    EINSVD,
    EINSVD_RAND,
    EINSUMSVD,
    EINSUMSVD_RAND,
    SVD,
    INV,
    ISCLOSE,
    ALLCLOSE,
    COPY;

    /**
     * Lowercase name as used in diagnostics and on the command line.
     */
    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * True for operations that take a subscripts string.
     */
    public boolean takesSubscripts() {
        return switch (this) {
            case EINSUM, EINSVD, EINSVD_RAND, EINSUMSVD, EINSUMSVD_RAND -> true;
            default -> false;
        };
    }

    /**
     * True for the randomized decomposition variants.
     */
    public boolean isRandomized() {
        return this == EINSVD_RAND || this == EINSUMSVD_RAND;
    }
}
