package io.surfworks.tensorforge.backend.cpu.ops;

import io.surfworks.tensorforge.core.tensor.Tensor;
import io.surfworks.tensorforge.einstr.IndexSymbols;
import io.surfworks.tensorforge.einstr.Term;

import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Extents of index ids bound by operand shapes.
 */
final class IndexSpace {

    private final Map<Integer, Integer> extents = new LinkedHashMap<>();

    /**
     * Binds each index of a term to the matching axis of an operand.
     *
     * @throws IllegalArgumentException if an index is already bound to a different extent
     */
    void bind(Term term, Tensor operand) {
        List<Integer> indices = term.indices();
        if (indices.size() != operand.rank()) {
            throw new IllegalArgumentException("Term " + term.indicesString() + " has " + indices.size()
                + " indices but operand has shape " + Arrays.toString(operand.shape()));
        }
        for (int axis = 0; axis < indices.size(); axis++) {
            bind(indices.get(axis), operand.dim(axis));
        }
    }

    void bind(int id, int extent) {
        Integer previous = extents.putIfAbsent(id, extent);
        if (previous != null && previous != extent) {
            throw new IllegalArgumentException(String.format(
                "Extent mismatch for index '%c': %d vs %d", IndexSymbols.letter(id), previous, extent));
        }
    }

    boolean isBound(int id) {
        return extents.containsKey(id);
    }

    int extent(int id) {
        Integer extent = extents.get(id);
        if (extent == null) {
            throw new IllegalArgumentException("Index '" + IndexSymbols.letter(id) + "' is not bound by any operand");
        }
        return extent;
    }

    /**
     * Extents of the given ids, in order.
     */
    int[] shapeOf(List<Integer> ids) {
        int[] shape = new int[ids.size()];
        for (int i = 0; i < shape.length; i++) {
            shape[i] = extent(ids.get(i));
        }
        return shape;
    }

    /**
     * Product of the extents of the given ids.
     */
    int volume(List<Integer> ids) {
        long volume = 1;
        for (int id : ids) {
            volume *= extent(id);
        }
        if (volume > Integer.MAX_VALUE) {
            throw new IllegalArgumentException("Index space too large: " + volume + " elements");
        }
        return (int) volume;
    }
}
