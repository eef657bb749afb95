package io.surfworks.tensorforge.einstr;

import io.surfworks.tensorforge.einstr.ValidationException.Rule;

import java.util.Set;

/**
 * Contraction rules: exactly one output, and no output index that no input binds.
 * Repeated input indices are allowed (diagonals, traces).
 */
public final class EinsumValidator implements ExpressionValidator {

    static final EinsumValidator INSTANCE = new EinsumValidator();

    private EinsumValidator() {}

    @Override
    public OperationFamily family() {
        return OperationFamily.EINSUM;
    }

    @Override
    public void validate(Expression expr) {
        ExpressionValidator.requireMatched(expr);
        if (expr.outputs().size() != 1) {
            throw violation(Rule.OUTPUT_COUNT,
                "expect exactly one output, got " + expr.outputs().size(), expr);
        }
        Set<Integer> inputIndices = expr.inputIndices();
        for (int index : expr.outputIndices()) {
            if (!inputIndices.contains(index)) {
                throw violation(Rule.UNBOUND_OUTPUT_INDEX,
                    "free index '" + IndexSymbols.letter(index) + "' not bound by any input", expr);
            }
        }
    }
}
