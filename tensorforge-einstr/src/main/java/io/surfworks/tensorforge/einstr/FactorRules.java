package io.surfworks.tensorforge.einstr;

import io.surfworks.tensorforge.einstr.ValidationException.Rule;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Rules shared by the two families that produce a pair of factors.
 */
final class FactorRules {

    private FactorRules() {}

    /**
     * Output ids that no input uses.
     */
    static Set<Integer> newIndices(Expression expr) {
        Set<Integer> result = new LinkedHashSet<>(expr.outputIndices());
        result.removeAll(expr.inputIndices());
        return result;
    }

    /**
     * Checks the two-factor shape of the outputs and returns the new rank index.
     * The new index is the only one allowed to appear twice across both factors.
     */
    static int checkFactors(ExpressionValidator validator, Expression expr) {
        Set<Integer> newIndices = newIndices(expr);
        if (newIndices.size() != 1) {
            throw validator.violation(Rule.NEW_INDEX_COUNT,
                "expect exactly one new index in outputs, got " + newIndices.size(), expr);
        }
        int newIndex = newIndices.iterator().next();
        OutputTerm first = expr.outputs().get(0);
        OutputTerm second = expr.outputs().get(1);
        if (!first.contains(newIndex) || !second.contains(newIndex)) {
            throw validator.violation(Rule.NEW_INDEX_NOT_SHARED,
                "expect new index '" + IndexSymbols.letter(newIndex) + "' in both outputs", expr);
        }
        if (first.size() < 2 || second.size() < 2) {
            throw validator.violation(Rule.RANK_ONE_FACTOR,
                "expect outputs to be at least two dimensional", expr);
        }
        if (expr.outputIndices().size() != first.size() + second.size() - 1) {
            throw validator.violation(Rule.ILLEGAL_OUTPUT_REPEAT, "only the new index may repeat in the outputs", expr);
        }
        return newIndex;
    }
}
