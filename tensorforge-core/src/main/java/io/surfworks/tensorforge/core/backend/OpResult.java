package io.surfworks.tensorforge.core.backend;

import io.surfworks.tensorforge.core.tensor.Tensor;

import java.util.List;
import java.util.Objects;

/**
 * Result of {@link Backend#execute(OpRequest)}: one tensor, a fixed-arity tuple,
 * one tensor per operand, a boolean, or a marker for an operation the backend lacks.
 */
public sealed interface OpResult
    permits OpResult.Single, OpResult.Tuple, OpResult.Sequence, OpResult.Flag, OpResult.Unsupported {

    /**
     * A single tensor, e.g. from {@code einsum} or {@code inv}.
     */
    record Single(Tensor tensor) implements OpResult {
        public Single {
            Objects.requireNonNull(tensor, "tensor cannot be null");
        }
    }

    /**
     * A fixed-arity group, e.g. the {@code u, s, v} triple of a decomposition.
     */
    record Tuple(List<Tensor> tensors) implements OpResult {
        public Tuple {
            tensors = List.copyOf(tensors);
        }
    }

    /**
     * One result per operand, e.g. from {@code copy}.
     */
    record Sequence(List<Tensor> tensors) implements OpResult {
        public Sequence {
            tensors = List.copyOf(tensors);
        }
    }

    /**
     * A boolean answer, e.g. from {@code allclose}.
     */
    record Flag(boolean value) implements OpResult {}

    /**
     * The backend does not implement the requested operation.
     */
    record Unsupported(Operation operation, String backend) implements OpResult {
        public Unsupported {
            Objects.requireNonNull(operation, "operation cannot be null");
            Objects.requireNonNull(backend, "backend cannot be null");
        }

        public String message() {
            return "Backend '" + backend + "' does not support " + operation.label();
        }
    }

    /**
     * Tensor of a {@link Single} result.
     *
     * @throws IllegalStateException for any other variant
     */
    default Tensor single() {
        if (this instanceof Single s) {
            return s.tensor();
        }
        throw new IllegalStateException("Expected a single tensor, got " + this);
    }

    /**
     * Tensors of a {@link Tuple} or {@link Sequence} result, or the one tensor of a {@link Single}.
     *
     * @throws IllegalStateException for {@link Flag} and {@link Unsupported}
     */
    default List<Tensor> tensors() {
        if (this instanceof Single s) {
            return List.of(s.tensor());
        }
        if (this instanceof Tuple t) {
            return t.tensors();
        }
        if (this instanceof Sequence s) {
            return s.tensors();
        }
        throw new IllegalStateException("Result carries no tensors: " + this);
    }

    default boolean isSupported() {
        return !(this instanceof Unsupported);
    }
}
