package io.surfworks.tensorforge.einstr;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Rewrites a fused contraction and decomposition into two primitive expressions.
 *
 * <p>The intermediate term lists every output index except the new one, in order of
 * first appearance scanning the first output and then the second. The contraction
 * half produces it without fusing; the decomposition half consumes it and keeps the
 * original outputs with their fusing groups.
 */
public final class EinsumsvdSplitter {

    private static final Logger LOG = Logger.getLogger(EinsumsvdSplitter.class.getName());

    private EinsumsvdSplitter() {}

    /**
     * Splits a validated einsumsvd expression. The argument is left untouched.
     *
     * @throws IllegalArgumentException if the expression is unmatched or has no single new index
     */
    public static SplitExpression split(Expression expr) {
        ExpressionValidator.requireMatched(expr);
        Set<Integer> newIndices = FactorRules.newIndices(expr);
        if (newIndices.size() != 1 || expr.outputs().size() != 2) {
            throw new IllegalArgumentException("Not a validated einsumsvd expression: " + expr);
        }
        int newIndex = newIndices.iterator().next();

        Set<Integer> intermediate = new LinkedHashSet<>();
        for (OutputTerm output : expr.outputs()) {
            for (int index : output.indices()) {
                if (index != newIndex) {
                    intermediate.add(index);
                }
            }
        }
        List<Integer> indices = new ArrayList<>(intermediate);

        Expression contraction = new Expression(expr.inputs(), List.of(OutputTerm.of(indices)), expr.source());
        Expression decomposition = new Expression(List.of(InputTerm.of(indices)), expr.outputs(), expr.source());
        LOG.fine(() -> "Split \"" + expr.source() + "\" into " + contraction + " then " + decomposition);
        return new SplitExpression(contraction, decomposition, newIndex);
    }
}
