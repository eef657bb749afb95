package io.surfworks.tensorforge.core.backend;

import io.surfworks.tensorforge.core.tensor.Tensor;
import io.surfworks.tensorforge.core.testing.ToleranceConfig;

import java.util.List;
import java.util.Objects;

/**
 * One operation call in data form, for {@link Backend#execute(OpRequest)}.
 *
 * @param operation  the operation to run
 * @param subscripts index notation, or {@code null} for operations that take none
 * @param operands   input tensors in call order
 * @param rank       number of singular values to keep, {@link #FULL_RANK} for all
 * @param randomized randomized SVD parameters, only read by the {@code _RAND} variants
 * @param tolerance  comparison tolerance, only read by {@code ISCLOSE} and {@code ALLCLOSE}
 */
public record OpRequest(
    Operation operation,
    String subscripts,
    List<Tensor> operands,
    int rank,
    RandomizedSvdOptions randomized,
    ToleranceConfig tolerance
) {
    public static final int FULL_RANK = 0;

    public OpRequest {
        Objects.requireNonNull(operation, "operation cannot be null");
        operands = List.copyOf(operands);
        if (operation.takesSubscripts() && subscripts == null) {
            throw new IllegalArgumentException(operation.label() + " requires subscripts");
        }
        if (rank < 0) {
            throw new IllegalArgumentException("rank must be non-negative, got " + rank);
        }
        if (operation.isRandomized() && rank == FULL_RANK) {
            throw new IllegalArgumentException(operation.label() + " requires an explicit rank");
        }
        if (randomized == null) {
            randomized = RandomizedSvdOptions.defaults();
        }
        if (tolerance == null) {
            tolerance = ToleranceConfig.DEFAULT;
        }
    }

    public static OpRequest einsum(String subscripts, Tensor... operands) {
        return new OpRequest(Operation.EINSUM, subscripts, List.of(operands), FULL_RANK, null, null);
    }

    public static OpRequest einsvd(String subscripts, Tensor a) {
        return einsvd(subscripts, a, FULL_RANK);
    }

    public static OpRequest einsvd(String subscripts, Tensor a, int rank) {
        return new OpRequest(Operation.EINSVD, subscripts, List.of(a), rank, null, null);
    }

    public static OpRequest einsvdRand(String subscripts, Tensor a, int rank, RandomizedSvdOptions options) {
        return new OpRequest(Operation.EINSVD_RAND, subscripts, List.of(a), rank, options, null);
    }

    public static OpRequest einsumsvd(String subscripts, int rank, Tensor... operands) {
        return new OpRequest(Operation.EINSUMSVD, subscripts, List.of(operands), rank, null, null);
    }

    public static OpRequest einsumsvdRand(String subscripts, int rank, RandomizedSvdOptions options,
                                         Tensor... operands) {
        return new OpRequest(Operation.EINSUMSVD_RAND, subscripts, List.of(operands), rank, options, null);
    }

    public static OpRequest svd(Tensor a) {
        return new OpRequest(Operation.SVD, null, List.of(a), FULL_RANK, null, null);
    }

    public static OpRequest inv(Tensor a) {
        return new OpRequest(Operation.INV, null, List.of(a), FULL_RANK, null, null);
    }

    public static OpRequest isClose(Tensor a, Tensor b, ToleranceConfig tolerance) {
        return new OpRequest(Operation.ISCLOSE, null, List.of(a, b), FULL_RANK, null, tolerance);
    }

    public static OpRequest allClose(Tensor a, Tensor b, ToleranceConfig tolerance) {
        return new OpRequest(Operation.ALLCLOSE, null, List.of(a, b), FULL_RANK, null, tolerance);
    }

    public static OpRequest copy(Tensor... operands) {
        return new OpRequest(Operation.COPY, null, List.of(operands), FULL_RANK, null, null);
    }

    public Tensor operand(int i) {
        return operands.get(i);
    }

    public Tensor[] operandArray() {
        return operands.toArray(new Tensor[0]);
    }
}
