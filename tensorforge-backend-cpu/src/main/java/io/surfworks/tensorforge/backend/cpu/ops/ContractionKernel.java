package io.surfworks.tensorforge.backend.cpu.ops;

import io.surfworks.tensorforge.core.tensor.Tensor;
import io.surfworks.tensorforge.core.tensor.TensorSpec;
import io.surfworks.tensorforge.einstr.Expression;
import io.surfworks.tensorforge.einstr.InputTerm;
import io.surfworks.tensorforge.einstr.OutputTerm;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Sum of products over a matched single-output expression.
 *
 * <p>Walks every assignment of the expression's index ids, multiplies the addressed operand
 * elements and accumulates into the addressed output element. An id repeated within an input
 * term reads that operand's diagonal; an id repeated within the output term writes the
 * output's diagonal and leaves the other elements zero.
 */
public final class ContractionKernel {

    public Tensor contract(Expression expr, List<Tensor> operands) {
        if (expr.outputs().size() != 1) {
            throw new IllegalArgumentException("Contraction requires exactly one output, got " + expr.outputs().size());
        }
        if (operands.size() != expr.inputs().size()) {
            throw new IllegalArgumentException(
                "Contraction expects " + expr.inputs().size() + " operands, got " + operands.size());
        }

        IndexSpace space = new IndexSpace();
        for (int t = 0; t < operands.size(); t++) {
            space.bind(expr.inputs().get(t), operands.get(t));
        }
        OutputTerm output = expr.outputs().get(0);
        Tensor result = Tensor.zeros(space.shapeOf(output.indices()));

        // Loop order: output ids first, then the summed ones
        Set<Integer> ordered = new LinkedHashSet<>(output.indices());
        for (InputTerm term : expr.inputs()) {
            ordered.addAll(term.indices());
        }
        List<Integer> ids = new ArrayList<>(ordered);
        int[] extents = space.shapeOf(ids);
        for (int extent : extents) {
            if (extent == 0) {
                return result;
            }
        }

        int[][] operandStrides = new int[operands.size()][];
        for (int t = 0; t < operands.size(); t++) {
            operandStrides[t] = strideByPosition(expr.inputs().get(t).indices(), ids, operands.get(t).spec());
        }
        int[] outputStrides = strideByPosition(output.indices(), ids, result.spec());

        int[] position = new int[ids.size()];
        int[] offsets = new int[operands.size()];
        int outputOffset = 0;
        do {
            double product = 1.0;
            for (int t = 0; t < operands.size(); t++) {
                product *= operands.get(t).getFlat(offsets[t]);
            }
            result.setFlat(outputOffset, result.getFlat(outputOffset) + product);

            // Advance the odometer, keeping every offset in step
            int axis = ids.size() - 1;
            for (; axis >= 0; axis--) {
                position[axis]++;
                for (int t = 0; t < offsets.length; t++) {
                    offsets[t] += operandStrides[t][axis];
                }
                outputOffset += outputStrides[axis];
                if (position[axis] < extents[axis]) {
                    break;
                }
                for (int t = 0; t < offsets.length; t++) {
                    offsets[t] -= operandStrides[t][axis] * extents[axis];
                }
                outputOffset -= outputStrides[axis] * extents[axis];
                position[axis] = 0;
            }
            if (axis < 0) {
                break;
            }
        } while (true);

        return result;
    }

    /**
     * Per loop position, the flat-offset step of one tensor. A repeated id adds the strides of
     * all the axes it labels.
     */
    private static int[] strideByPosition(List<Integer> termIds, List<Integer> loopIds, TensorSpec spec) {
        long[] strides = spec.strides();
        int[] result = new int[loopIds.size()];
        for (int axis = 0; axis < termIds.size(); axis++) {
            result[loopIds.indexOf(termIds.get(axis))] += (int) strides[axis];
        }
        return result;
    }
}
