package io.surfworks.tensorforge.core.tensor;

import java.util.Arrays;

/**
 * Tensor specification: shape and computed row-major strides.
 * Immutable metadata describing tensor layout.
 */
public record TensorSpec(int[] shape, long[] strides) {

    public TensorSpec {
        shape = shape.clone();
        strides = strides.clone();
        if (shape.length != strides.length) {
            throw new IllegalArgumentException("Shape and strides must have same length");
        }
        for (int dim : shape) {
            if (dim < 0) {
                throw new IllegalArgumentException("Negative extent in shape " + Arrays.toString(shape));
            }
        }
    }

    /**
     * Create a TensorSpec with row-major (C-contiguous) strides.
     */
    public static TensorSpec of(int... shape) {
        return new TensorSpec(shape, computeRowMajorStrides(shape));
    }

    @Override
    public int[] shape() {
        return shape.clone();
    }

    @Override
    public long[] strides() {
        return strides.clone();
    }

    /**
     * Number of dimensions.
     */
    public int rank() {
        return shape.length;
    }

    /**
     * Extent of one axis.
     */
    public int dim(int axis) {
        return shape[axis];
    }

    /**
     * Total number of elements; a rank-0 tensor holds one.
     */
    public long elementCount() {
        long count = 1;
        for (int dim : shape) {
            count *= dim;
        }
        return count;
    }

    /**
     * Compute flat index from multi-dimensional indices.
     */
    public int flatIndex(int... indices) {
        if (indices.length != shape.length) {
            throw new IllegalArgumentException(
                "Expected " + shape.length + " indices, got " + indices.length);
        }
        long idx = 0;
        for (int i = 0; i < indices.length; i++) {
            if (indices[i] < 0 || indices[i] >= shape[i]) {
                throw new IndexOutOfBoundsException(
                    "Index " + indices[i] + " out of bounds for dimension " + i + " with size " + shape[i]);
            }
            idx += indices[i] * strides[i];
        }
        return (int) idx;
    }

    /**
     * Check if shapes are equal.
     */
    public boolean shapeEquals(TensorSpec other) {
        return Arrays.equals(this.shape, other.shape);
    }

    /**
     * Compute row-major (C-contiguous) strides for a shape.
     */
    public static long[] computeRowMajorStrides(int[] shape) {
        long[] strides = new long[shape.length];
        long stride = 1;
        for (int i = shape.length - 1; i >= 0; i--) {
            strides[i] = stride;
            stride *= shape[i];
        }
        return strides;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TensorSpec that)) return false;
        return Arrays.equals(shape, that.shape) && Arrays.equals(strides, that.strides);
    }

    @Override
    public int hashCode() {
        return 31 * Arrays.hashCode(shape) + Arrays.hashCode(strides);
    }

    @Override
    public String toString() {
        return "TensorSpec[shape=" + Arrays.toString(shape) + ", strides=" + Arrays.toString(strides) + "]";
    }
}
