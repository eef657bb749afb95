package io.surfworks.tensorforge.core.tensor;

import java.util.Arrays;
import java.util.Random;

/**
 * Dense row-major tensor of {@code double} elements.
 *
 * <p>Tensors are mutable through {@link #set} and {@link #setFlat}. {@link #reshape}
 * returns a view over the same storage; {@link #copy} detaches.
 */
public final class Tensor {

    private final TensorSpec spec;
    private final double[] data;

    private Tensor(TensorSpec spec, double[] data) {
        this.spec = spec;
        this.data = data;
    }

    // ==================== Factory Methods ====================

    /**
     * Create a zero-filled tensor.
     */
    public static Tensor zeros(int... shape) {
        TensorSpec spec = TensorSpec.of(shape);
        return new Tensor(spec, new double[checkedSize(spec)]);
    }

    /**
     * Create a tensor filled with a constant.
     */
    public static Tensor full(double value, int... shape) {
        Tensor t = zeros(shape);
        Arrays.fill(t.data, value);
        return t;
    }

    /**
     * Create a rank-0 tensor holding one value.
     */
    public static Tensor scalar(double value) {
        return new Tensor(TensorSpec.of(), new double[]{value});
    }

    /**
     * Create a tensor from row-major data. The array is copied.
     */
    public static Tensor fromArray(double[] data, int... shape) {
        TensorSpec spec = TensorSpec.of(shape);
        if (data.length != spec.elementCount()) {
            throw new IllegalArgumentException(
                "Data length " + data.length + " does not match shape " + Arrays.toString(shape));
        }
        return new Tensor(spec, data.clone());
    }

    /**
     * Create an {@code n x n} identity matrix.
     */
    public static Tensor identity(int n) {
        Tensor t = zeros(n, n);
        for (int i = 0; i < n; i++) {
            t.data[i * n + i] = 1.0;
        }
        return t;
    }

    /**
     * Create a tensor of uniform values in {@code [-1, 1)} from a fixed seed.
     */
    public static Tensor random(long seed, int... shape) {
        Tensor t = zeros(shape);
        Random random = new Random(seed);
        for (int i = 0; i < t.data.length; i++) {
            t.data[i] = 2.0 * random.nextDouble() - 1.0;
        }
        return t;
    }

    // ==================== Accessors ====================

    public TensorSpec spec() {
        return spec;
    }

    public int[] shape() {
        return spec.shape();
    }

    public int dim(int axis) {
        return spec.dim(axis);
    }

    public int rank() {
        return spec.rank();
    }

    public int elementCount() {
        return data.length;
    }

    /**
     * Get element at multi-dimensional index.
     */
    public double get(int... indices) {
        return data[spec.flatIndex(indices)];
    }

    /**
     * Set element at multi-dimensional index.
     */
    public void set(double value, int... indices) {
        data[spec.flatIndex(indices)] = value;
    }

    public double getFlat(int index) {
        return data[index];
    }

    public void setFlat(int index, double value) {
        data[index] = value;
    }

    /**
     * Value of a rank-0 or single-element tensor.
     */
    public double item() {
        if (data.length != 1) {
            throw new IllegalStateException("item() requires a single element, tensor has " + data.length);
        }
        return data[0];
    }

    /**
     * Copy elements to a new array in row-major order.
     */
    public double[] toArray() {
        return data.clone();
    }

    // ==================== Operations ====================

    /**
     * Create a deep copy of this tensor.
     */
    public Tensor copy() {
        return new Tensor(spec, data.clone());
    }

    /**
     * Reshape to new dimensions (must have same element count). Shares storage.
     */
    public Tensor reshape(int... newShape) {
        TensorSpec newSpec = TensorSpec.of(newShape);
        if (newSpec.elementCount() != data.length) {
            throw new IllegalArgumentException(
                "Cannot reshape " + Arrays.toString(spec.shape()) + " to " + Arrays.toString(newShape));
        }
        if (newSpec.shapeEquals(spec)) {
            return this;
        }
        return new Tensor(newSpec, data);
    }

    private static int checkedSize(TensorSpec spec) {
        long count = spec.elementCount();
        if (count > Integer.MAX_VALUE - 8) {
            throw new IllegalArgumentException("Tensor too large: " + Arrays.toString(spec.shape()));
        }
        return (int) count;
    }

    @Override
    public String toString() {
        return "Tensor[shape=" + Arrays.toString(spec.shape()) + "]";
    }
}
