package io.surfworks.tensorforge.einstr;

import io.surfworks.tensorforge.einstr.ValidationException.Rule;

import java.util.HashSet;
import java.util.Set;

/**
 * Decomposition rules: one input with distinct indices, two factors that keep every
 * input index and share exactly one new index, which is the only index allowed to repeat.
 */
public final class EinsvdValidator implements ExpressionValidator {

    static final EinsvdValidator INSTANCE = new EinsvdValidator();

    private EinsvdValidator() {}

    @Override
    public OperationFamily family() {
        return OperationFamily.EINSVD;
    }

    @Override
    public void validate(Expression expr) {
        ExpressionValidator.requireMatched(expr);
        if (expr.inputs().size() != 1) {
            throw violation(Rule.INPUT_COUNT, "expect one input, got " + expr.inputs().size(), expr);
        }
        if (expr.outputs().size() != 2) {
            throw violation(Rule.OUTPUT_COUNT, "expect two outputs, got " + expr.outputs().size(), expr);
        }
        InputTerm input = expr.inputs().get(0);
        if (new HashSet<>(input.indices()).size() != input.size()) {
            throw violation(Rule.REPEATED_INPUT_INDEX, "repeated input index", expr);
        }
        Set<Integer> outputIndices = expr.outputIndices();
        if (!outputIndices.containsAll(expr.inputIndices())) {
            throw violation(Rule.INPUT_INDEX_DROPPED, "not all input indices preserved in outputs", expr);
        }
        FactorRules.checkFactors(this, expr);
    }
}
