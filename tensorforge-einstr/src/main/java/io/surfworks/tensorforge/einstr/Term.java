package io.surfworks.tensorforge.einstr;

import java.util.List;

/**
 * An ordered sequence of index ids naming the axes of one operand or result.
 *
 * <p>The id {@link Expression#ELLIPSIS} stands for an unexpanded broadcast run.
 */
public interface Term {

    List<Integer> indices();

    /**
     * The text this term was parsed from, or its canonical form for derived terms.
     */
    String source();

    default int size() {
        return indices().size();
    }

    default boolean contains(int index) {
        return indices().contains(index);
    }

    /**
     * Position of the first occurrence of an index, or -1.
     */
    default int find(int index) {
        return indices().indexOf(index);
    }

    default boolean hasEllipsis() {
        return indices().contains(Expression.ELLIPSIS);
    }

    /**
     * Number of entries that are not the broadcast placeholder.
     */
    default int literalCount() {
        return hasEllipsis() ? size() - 1 : size();
    }

    /**
     * Canonical letters for this term's indices, without any grouping.
     */
    default String indicesString() {
        StringBuilder sb = new StringBuilder();
        for (int index : indices()) {
            appendIndex(sb, index);
        }
        return sb.toString();
    }

    static void appendIndex(StringBuilder sb, int index) {
        if (index == Expression.ELLIPSIS) {
            sb.append("...");
        } else {
            sb.append(IndexSymbols.letter(index));
        }
    }

    static List<Integer> checkIndices(List<Integer> indices) {
        List<Integer> copy = List.copyOf(indices);
        int ellipses = 0;
        for (int index : copy) {
            if (index == Expression.ELLIPSIS) {
                ellipses++;
            } else if (index < 0) {
                throw new IllegalArgumentException("Negative index id: " + index);
            }
        }
        if (ellipses > 1) {
            throw new IllegalArgumentException("A term can hold at most one ellipsis, got " + ellipses);
        }
        return copy;
    }
}
