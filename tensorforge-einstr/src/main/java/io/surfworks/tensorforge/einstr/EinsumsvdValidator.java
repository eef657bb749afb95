package io.surfworks.tensorforge.einstr;

import io.surfworks.tensorforge.einstr.ValidationException.Rule;

/**
 * Fused contraction and decomposition rules: one or more inputs, two factors sharing
 * exactly one new index, which is the only index allowed to repeat in the outputs.
 * Indices repeated across inputs are contracted by the contraction half of the split,
 * so an expression accepted here splits into halves the other two families accept.
 */
public final class EinsumsvdValidator implements ExpressionValidator {

    static final EinsumsvdValidator INSTANCE = new EinsumsvdValidator();

    private EinsumsvdValidator() {}

    @Override
    public OperationFamily family() {
        return OperationFamily.EINSUMSVD;
    }

    @Override
    public void validate(Expression expr) {
        ExpressionValidator.requireMatched(expr);
        if (expr.inputs().isEmpty()) {
            throw violation(Rule.INPUT_COUNT, "expect at least one input", expr);
        }
        if (expr.outputs().size() != 2) {
            throw violation(Rule.OUTPUT_COUNT, "expect two outputs, got " + expr.outputs().size(), expr);
        }
        FactorRules.checkFactors(this, expr);
    }
}
