package io.surfworks.tensorforge.einstr;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Subscripts of one result, with the fusing groups that reshape it.
 *
 * <p>Group boundaries are positions in {@link #indices()}. While the term still holds
 * the ellipsis placeholder the placeholder occupies a single position; matching
 * re-maps the boundaries onto the expanded sequence.
 *
 * <p>Groups are ordered and never overlap. Parsed terms start each group at a distinct
 * position; after an ellipsis expands to an empty run an empty group may share its
 * start with the next group.
 */
public record OutputTerm(List<Integer> indices, List<FusingGroup> fusing, String source) implements Term {

    public OutputTerm {
        indices = Term.checkIndices(indices);
        fusing = List.copyOf(fusing);
        source = source == null ? "" : source;
        int previousEnd = 0;
        for (FusingGroup group : fusing) {
            if (group.start() < previousEnd) {
                throw new IllegalArgumentException("Fusing groups overlap or are out of order: " + fusing);
            }
            if (group.end() > indices.size()) {
                throw new IllegalArgumentException(
                    "Fusing group " + group + " exceeds term length " + indices.size());
            }
            previousEnd = group.end();
        }
    }

    public static OutputTerm of(List<Integer> indices) {
        return of(indices, List.of());
    }

    public static OutputTerm of(List<Integer> indices, List<FusingGroup> fusing) {
        OutputTerm term = new OutputTerm(indices, fusing, "");
        return new OutputTerm(indices, fusing, term.toString());
    }

    public boolean isFused() {
        return !fusing.isEmpty();
    }

    /**
     * Collapses each fusing group of a physical shape into the product of its extents.
     *
     * <p>Axes outside every group pass through unchanged; with no groups the result
     * equals the input.
     *
     * @param shape per-axis extents for this term's expanded indices
     * @return the reshaped extents
     * @throws ShapeException if the term is unexpanded, the lengths differ or a fused extent overflows
     */
    public int[] newShape(int... shape) {
        if (hasEllipsis()) {
            throw new ShapeException("ellipsis not expanded", toString());
        }
        if (shape.length != size()) {
            throw new ShapeException(
                "shape/indices length mismatch: shape " + Arrays.toString(shape) + " has " + shape.length
                    + " axes, term has " + size(), toString());
        }
        List<Integer> result = new ArrayList<>();
        int i = 0;
        for (FusingGroup group : fusing) {
            for (; i < group.start(); i++) {
                result.add(shape[i]);
            }
            int product = 1;
            for (; i < group.end(); i++) {
                try {
                    product = Math.multiplyExact(product, shape[i]);
                } catch (ArithmeticException e) {
                    throw new ShapeException("fused extent of group " + group + " of shape "
                        + Arrays.toString(shape) + " overflows int", toString());
                }
            }
            result.add(product);
        }
        for (; i < shape.length; i++) {
            result.add(shape[i]);
        }
        return result.stream().mapToInt(Integer::intValue).toArray();
    }

    /**
     * Canonical text including parentheses around fused runs.
     */
    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        int i = 0;
        for (FusingGroup group : fusing) {
            for (; i < group.start(); i++) {
                Term.appendIndex(sb, indices.get(i));
            }
            sb.append('(');
            for (; i < group.end(); i++) {
                Term.appendIndex(sb, indices.get(i));
            }
            sb.append(')');
        }
        for (; i < indices.size(); i++) {
            Term.appendIndex(sb, indices.get(i));
        }
        return sb.toString();
    }
}
