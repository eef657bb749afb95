package io.surfworks.tensorforge.einstr;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * A parsed subscript expression: input terms, output terms and the source text.
 *
 * <p>Instances are immutable. {@link #match(int...)} and the splitter produce new
 * expressions instead of changing this one.
 *
 * @param inputs  one term per operand, in operand order
 * @param outputs one term per result
 * @param source  the subscripts this expression came from, kept for diagnostics
 */
public record Expression(List<InputTerm> inputs, List<OutputTerm> outputs, String source) {

    /** Placeholder id for an unexpanded ellipsis. */
    public static final int ELLIPSIS = -1;

    public Expression {
        inputs = List.copyOf(inputs);
        outputs = List.copyOf(outputs);
        source = source == null ? "" : source;
    }

    /**
     * Ids used by any input term, in first-appearance order.
     */
    public Set<Integer> inputIndices() {
        return collect(inputs);
    }

    /**
     * Ids used by any output term, in first-appearance order.
     */
    public Set<Integer> outputIndices() {
        return collect(outputs);
    }

    /**
     * One more than the largest id in use, 0 when no term has an id.
     */
    public int nindices() {
        int max = -1;
        for (Term term : allTerms()) {
            for (int index : term.indices()) {
                max = Math.max(max, index);
            }
        }
        return max + 1;
    }

    /**
     * Whether every ellipsis has been expanded against operand ranks.
     */
    public boolean isMatched() {
        return allTerms().stream().noneMatch(Term::hasEllipsis);
    }

    /**
     * Binds this expression to operand ranks with the default options.
     */
    public Expression match(int... ranks) {
        return new ExpressionMatcher(EinstrOptions.defaults()).match(this, ranks);
    }

    /**
     * Canonical form without fusing parentheses, as consumed by a numeric routine.
     */
    public String indicesString() {
        return join(inputs.stream().map(Term::indicesString).collect(Collectors.toList()),
            outputs.stream().map(Term::indicesString).collect(Collectors.toList()));
    }

    /**
     * Canonical form including fusing parentheses.
     */
    @Override
    public String toString() {
        return join(inputs.stream().map(InputTerm::toString).collect(Collectors.toList()),
            outputs.stream().map(OutputTerm::toString).collect(Collectors.toList()));
    }

    private List<Term> allTerms() {
        List<Term> terms = new ArrayList<>(inputs);
        terms.addAll(outputs);
        return terms;
    }

    private static Set<Integer> collect(List<? extends Term> terms) {
        Set<Integer> result = new LinkedHashSet<>();
        for (Term term : terms) {
            for (int index : term.indices()) {
                if (index != ELLIPSIS) {
                    result.add(index);
                }
            }
        }
        return result;
    }

    private static String join(List<String> inputs, List<String> outputs) {
        return String.join(",", inputs) + "->" + String.join(",", outputs);
    }
}
