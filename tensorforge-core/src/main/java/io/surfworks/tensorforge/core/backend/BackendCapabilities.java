package io.surfworks.tensorforge.core.backend;

import java.util.EnumSet;
import java.util.Set;

/**
 * Describes the capabilities of a backend.
 */
public record BackendCapabilities(
    Set<Operation> supportedOperations,
    int maxTensorRank,
    long maxElementCount
) {
    public BackendCapabilities {
        supportedOperations = supportedOperations.isEmpty()
            ? Set.of()
            : Set.copyOf(EnumSet.copyOf(supportedOperations));
        if (maxTensorRank < 0) {
            throw new IllegalArgumentException("maxTensorRank must be non-negative, got " + maxTensorRank);
        }
    }

    /**
     * Capabilities of the dense CPU reference backend: everything but randomized SVD.
     */
    public static BackendCapabilities cpu() {
        Set<Operation> ops = EnumSet.allOf(Operation.class);
        ops.remove(Operation.EINSVD_RAND);
        ops.remove(Operation.EINSUMSVD_RAND);
        return new BackendCapabilities(ops, 52, Integer.MAX_VALUE);
    }

    public boolean supports(Operation op) {
        return supportedOperations.contains(op);
    }

    /**
     * Builder for custom capabilities.
     */
    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private final Set<Operation> operations = EnumSet.noneOf(Operation.class);
        private int maxRank = 52;
        private long maxElements = Integer.MAX_VALUE;

        public Builder supports(Operation... ops) {
            for (Operation op : ops) {
                operations.add(op);
            }
            return this;
        }

        public Builder supportsAll() {
            operations.addAll(EnumSet.allOf(Operation.class));
            return this;
        }

        public Builder maxTensorRank(int maxRank) {
            this.maxRank = maxRank;
            return this;
        }

        public Builder maxElementCount(long maxElements) {
            this.maxElements = maxElements;
            return this;
        }

        public BackendCapabilities build() {
            return new BackendCapabilities(operations, maxRank, maxElements);
        }
    }
}
