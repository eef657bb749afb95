package io.surfworks.tensorforge.einstr;

import io.surfworks.tensorforge.einstr.EinstrOptions.BroadcastPolicy;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.logging.Logger;

/**
 * Binds a parsed expression to the ranks of its operands.
 *
 * <p>Each input ellipsis is replaced by fresh ids sized to fill the operand's rank.
 * Fresh ids are allocated contiguously above the highest symbol id, input term by
 * input term, so runs of different operands never alias. The longest run (first
 * one on ties) becomes the expansion of every output ellipsis.
 */
public final class ExpressionMatcher {

    private static final Logger LOG = Logger.getLogger(ExpressionMatcher.class.getName());

    private final EinstrOptions options;

    public ExpressionMatcher(EinstrOptions options) {
        this.options = options;
    }

    /**
     * Expands every ellipsis of {@code expr} against the given ranks.
     *
     * @param expr  a parsed expression
     * @param ranks one rank per input term, in order
     * @return a new, fully expanded expression
     * @throws ArityException if the ranks cannot be bound to the input terms
     */
    public Expression match(Expression expr, int... ranks) {
        if (ranks.length != expr.inputs().size()) {
            throw new ArityException(String.format(
                "number of operands does not match subscripts: expected %d, got %d",
                expr.inputs().size(), ranks.length), expr.source());
        }

        int next = expr.nindices();
        List<InputTerm> inputs = new ArrayList<>();
        List<Integer> ellipsis = List.of();
        Set<Integer> runLengths = new LinkedHashSet<>();

        for (int i = 0; i < ranks.length; i++) {
            InputTerm term = expr.inputs().get(i);
            int rank = ranks[i];
            if (rank < 0) {
                throw new ArityException("negative rank " + rank + " for operand " + i, expr.source());
            }
            if (!term.hasEllipsis()) {
                if (term.size() != rank) {
                    throw mismatch(term, rank, expr);
                }
                inputs.add(term);
                continue;
            }

            int count = rank - term.literalCount();
            if (count < 0) {
                throw mismatch(term, rank, expr);
            }
            List<Integer> run = new ArrayList<>(count);
            for (int k = 0; k < count; k++) {
                run.add(next++);
            }
            if (runLengths.isEmpty() || count > ellipsis.size()) {
                ellipsis = run;
            }
            runLengths.add(count);
            inputs.add(new InputTerm(splice(term.indices(), run), term.source()));
        }

        if (options.broadcastPolicy() == BroadcastPolicy.EQUAL_RUNS && runLengths.size() > 1) {
            throw new ArityException("ellipsis run lengths differ across operands: " + runLengths, expr.source());
        }
        if (runLengths.size() > 1) {
            LOG.fine(() -> "Ellipsis runs of different lengths " + runLengths + " in \"" + expr.source() + "\"");
        }
        if (next > options.maxIndices()) {
            throw new ArityException(String.format(
                "too many indices after ellipsis expansion: %d (maximum %d)", next, options.maxIndices()),
                expr.source());
        }

        List<OutputTerm> outputs = new ArrayList<>();
        for (OutputTerm term : expr.outputs()) {
            outputs.add(expand(term, ellipsis));
        }

        Expression matched = new Expression(inputs, outputs, expr.source());
        LOG.fine(() -> "Matched \"" + expr.source() + "\" against ranks " + Arrays.toString(ranks)
            + " as " + matched);
        return matched;
    }

    private static OutputTerm expand(OutputTerm term, List<Integer> ellipsis) {
        int position = term.find(Expression.ELLIPSIS);
        if (position < 0) {
            return term;
        }
        List<FusingGroup> fusing = new ArrayList<>();
        for (FusingGroup group : term.fusing()) {
            fusing.add(group.expand(position, ellipsis.size()));
        }
        return new OutputTerm(splice(term.indices(), ellipsis), fusing, term.source());
    }

    private static List<Integer> splice(List<Integer> indices, List<Integer> run) {
        List<Integer> result = new ArrayList<>(indices.size() + run.size());
        for (int index : indices) {
            if (index == Expression.ELLIPSIS) {
                result.addAll(run);
            } else {
                result.add(index);
            }
        }
        return result;
    }

    private static ArityException mismatch(InputTerm term, int rank, Expression expr) {
        return new ArityException(
            String.format("indices \"%s\" do not match ndim %d", term.source(), rank), expr.source());
    }
}
