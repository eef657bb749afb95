package io.surfworks.tensorforge.backend.cpu.ops;

import io.surfworks.tensorforge.core.backend.Factorization;
import io.surfworks.tensorforge.core.backend.OpRequest;
import io.surfworks.tensorforge.core.tensor.Tensor;
import io.surfworks.tensorforge.einstr.Expression;
import io.surfworks.tensorforge.einstr.InputTerm;
import io.surfworks.tensorforge.einstr.OutputTerm;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * SVD of one tensor viewed as a matrix.
 *
 * <p>Rows are the indices of the first output term and columns the indices of the second,
 * each without the new index. The factors come back laid out in their output terms' index
 * order, the new index taking extent {@code k}: {@code u} holds the left singular vectors
 * and {@code v} the rows of {@code Vt}.
 */
public final class DecompositionKernel {

    private static final Logger LOG = Logger.getLogger(DecompositionKernel.class.getName());

    public Factorization decompose(Expression expr, Tensor a, int rank) {
        if (expr.inputs().size() != 1 || expr.outputs().size() != 2) {
            throw new IllegalArgumentException("Decomposition requires one input and two outputs: " + expr);
        }
        InputTerm input = expr.inputs().get(0);
        OutputTerm first = expr.outputs().get(0);
        OutputTerm second = expr.outputs().get(1);

        IndexSpace space = new IndexSpace();
        space.bind(input, a);
        int newIndex = newIndex(first, space);

        List<Integer> rowIds = without(first.indices(), newIndex);
        List<Integer> colIds = without(second.indices(), newIndex);
        int m = space.volume(rowIds);
        int n = space.volume(colIds);
        if ((long) m * n != a.elementCount()) {
            throw new IllegalArgumentException("Outputs of " + expr + " do not cover every input element");
        }

        double[][] matrix = matricize(a, input.indices(), rowIds, colIds, space, m, n);
        JacobiSvd.Result svd = JacobiSvd.decompose(matrix, m, n);

        int k = svd.k();
        if (rank != OpRequest.FULL_RANK && rank < k) {
            k = rank;
        }
        int kept = k;
        LOG.fine(() -> "Decomposed " + m + "x" + n + " matrix, keeping " + kept + " of " + svd.k() + " singular values");

        space.bind(newIndex, k);
        double[] s = new double[k];
        System.arraycopy(svd.s(), 0, s, 0, k);

        Tensor u = Tensor.zeros(space.shapeOf(first.indices()));
        fill(u, first.indices(), rowIds, newIndex, space, (outer, factor) -> svd.u()[outer][factor]);
        Tensor v = Tensor.zeros(space.shapeOf(second.indices()));
        fill(v, second.indices(), colIds, newIndex, space, (outer, factor) -> svd.vt()[factor][outer]);
        return new Factorization(u, Tensor.fromArray(s, k), v);
    }

    /**
     * The one index of the first output term not bound by the input.
     */
    private static int newIndex(OutputTerm first, IndexSpace space) {
        for (int id : first.indices()) {
            if (!space.isBound(id)) {
                return id;
            }
        }
        throw new IllegalArgumentException("No new index in " + first.indicesString());
    }

    private static List<Integer> without(List<Integer> ids, int id) {
        List<Integer> result = new ArrayList<>(ids);
        result.remove(Integer.valueOf(id));
        return result;
    }

    private static double[][] matricize(Tensor a, List<Integer> inputIds, List<Integer> rowIds, List<Integer> colIds,
                                        IndexSpace space, int m, int n) {
        double[][] matrix = new double[m][n];
        int[] shape = a.shape();
        int[] position = new int[shape.length];
        for (int flat = 0; flat < a.elementCount(); flat++) {
            int row = linear(position, inputIds, rowIds, space);
            int col = linear(position, inputIds, colIds, space);
            matrix[row][col] = a.getFlat(flat);
            increment(position, shape);
        }
        return matrix;
    }

    @FunctionalInterface
    private interface FactorSource {
        double get(int outer, int factor);
    }

    /**
     * Writes a factor tensor: {@code outer} is the mixed-radix position over {@code outerIds},
     * {@code factor} is the position along the new index.
     */
    private static void fill(Tensor target, List<Integer> ids, List<Integer> outerIds, int newIndex,
                             IndexSpace space, FactorSource source) {
        int[] shape = target.shape();
        int[] position = new int[shape.length];
        int newAxis = ids.indexOf(newIndex);
        for (int flat = 0; flat < target.elementCount(); flat++) {
            int outer = linear(position, ids, outerIds, space);
            target.setFlat(flat, source.get(outer, position[newAxis]));
            increment(position, shape);
        }
    }

    /**
     * Row-major linear index over {@code selected}, reading each id's coordinate from its
     * axis in {@code ids}.
     */
    private static int linear(int[] position, List<Integer> ids, List<Integer> selected, IndexSpace space) {
        int index = 0;
        for (int id : selected) {
            index = index * space.extent(id) + position[ids.indexOf(id)];
        }
        return index;
    }

    private static void increment(int[] position, int[] shape) {
        for (int axis = shape.length - 1; axis >= 0; axis--) {
            if (++position[axis] < shape[axis]) {
                return;
            }
            position[axis] = 0;
        }
    }
}
