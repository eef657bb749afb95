package io.surfworks.tensorforge.core.backend;

import io.surfworks.tensorforge.core.tensor.Tensor;
import io.surfworks.tensorforge.core.testing.ToleranceConfig;

import java.util.List;

/**
 * Backend interface for executing index-notation operations.
 * Implementations provide execution on different targets (dense CPU, distributed, etc.).
 *
 * <p>Typed methods throw {@link UnsupportedOperationException} for operations the backend
 * does not advertise in {@link #capabilities()}; {@link #execute(OpRequest)} reports them
 * as {@link OpResult.Unsupported} instead.
 */
public interface Backend extends AutoCloseable {

    /**
     * Returns the name of this backend (e.g., "cpu").
     */
    String name();

    /**
     * Returns the capabilities of this backend.
     */
    BackendCapabilities capabilities();

    /**
     * Check if this backend supports a specific operation.
     */
    default boolean supports(Operation op) {
        return capabilities().supports(op);
    }

    /**
     * Execute an operation given in data form.
     */
    OpResult execute(OpRequest request);

    /**
     * Sum of products over the indices the output drops.
     *
     * @param subscripts index notation such as {@code "ij,jk->ik"}
     * @param operands   one tensor per input term
     * @return the result, reshaped through the output's fusing groups
     */
    Tensor einsum(String subscripts, Tensor... operands);

    /**
     * Decompose one tensor into two factors sharing a new index, keeping all singular values.
     */
    default Factorization einsvd(String subscripts, Tensor a) {
        return einsvd(subscripts, a, OpRequest.FULL_RANK);
    }

    /**
     * Decompose one tensor into two factors sharing a new index.
     *
     * @param rank number of singular values to keep, {@link OpRequest#FULL_RANK} for all
     */
    Factorization einsvd(String subscripts, Tensor a, int rank);

    /**
     * Randomized variant of {@link #einsvd(String, Tensor, int)}.
     */
    Factorization einsvdRand(String subscripts, Tensor a, int rank, RandomizedSvdOptions options);

    /**
     * Contraction followed by decomposition, keeping all singular values.
     */
    default Factorization einsumsvd(String subscripts, Tensor... operands) {
        return einsumsvd(subscripts, OpRequest.FULL_RANK, operands);
    }

    /**
     * Contraction followed by decomposition.
     */
    Factorization einsumsvd(String subscripts, int rank, Tensor... operands);

    /**
     * Randomized variant of {@link #einsumsvd(String, int, Tensor...)}.
     */
    Factorization einsumsvdRand(String subscripts, int rank, RandomizedSvdOptions options, Tensor... operands);

    /**
     * Matrix SVD: {@code u (m x k)}, {@code s (k)}, {@code vh (k x n)}.
     */
    Factorization svd(Tensor a);

    /**
     * Inverse of a square non-singular matrix.
     */
    Tensor inv(Tensor a);

    /**
     * Elementwise closeness with the default tolerance; 1.0 where close, 0.0 elsewhere.
     */
    default Tensor isClose(Tensor a, Tensor b) {
        return isClose(a, b, ToleranceConfig.DEFAULT);
    }

    /**
     * Elementwise {@code |a - b| <= atol + rtol * |b|}; 1.0 where close, 0.0 elsewhere.
     */
    Tensor isClose(Tensor a, Tensor b, ToleranceConfig tolerance);

    default boolean allClose(Tensor a, Tensor b) {
        return allClose(a, b, ToleranceConfig.DEFAULT);
    }

    boolean allClose(Tensor a, Tensor b, ToleranceConfig tolerance);

    /**
     * Deep copy of each operand.
     */
    List<Tensor> copy(Tensor... operands);

    /**
     * Number of processes sharing this backend.
     */
    default int nproc() {
        return 1;
    }

    /**
     * Index of this process among {@link #nproc()}.
     */
    default int rank() {
        return 0;
    }

    /**
     * Close this backend and release any resources.
     */
    @Override
    void close();
}
