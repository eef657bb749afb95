package io.surfworks.tensorforge.core.backend;

import io.surfworks.tensorforge.core.tensor.Tensor;

import java.util.List;
import java.util.Objects;

/**
 * The {@code u, s, v} triple of a decomposition.
 *
 * <p>{@code u} and {@code v} carry the new index with extent {@code k}; {@code s} is the
 * rank-1 tensor of the {@code k} singular values in descending order.
 */
public record Factorization(Tensor u, Tensor s, Tensor v) {

    public Factorization {
        Objects.requireNonNull(u, "u cannot be null");
        Objects.requireNonNull(s, "s cannot be null");
        Objects.requireNonNull(v, "v cannot be null");
        if (s.rank() != 1) {
            throw new IllegalArgumentException("singular values must be a vector, got rank " + s.rank());
        }
    }

    /**
     * Number of singular values kept.
     */
    public int k() {
        return s.dim(0);
    }

    public List<Tensor> toList() {
        return List.of(u, s, v);
    }
}
