package io.surfworks.tensorforge.backend.cpu;

import io.surfworks.tensorforge.core.backend.BackendRegistry;
import io.surfworks.tensorforge.core.backend.Factorization;
import io.surfworks.tensorforge.core.backend.OpRequest;
import io.surfworks.tensorforge.core.backend.OpResult;
import io.surfworks.tensorforge.core.backend.Operation;
import io.surfworks.tensorforge.core.backend.RandomizedSvdOptions;
import io.surfworks.tensorforge.core.tensor.Tensor;
import io.surfworks.tensorforge.core.testing.TensorAssert;
import io.surfworks.tensorforge.core.testing.ToleranceConfig;
import io.surfworks.tensorforge.einstr.ArityException;
import io.surfworks.tensorforge.einstr.EinstrOptions;
import io.surfworks.tensorforge.einstr.EinstrOptions.BroadcastPolicy;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class CpuBackendTest {

    private static final ToleranceConfig EXACT = ToleranceConfig.forOp(Operation.EINSUM);
    private static final ToleranceConfig SVD_TOL = ToleranceConfig.forOp(Operation.EINSVD);

    private CpuBackend backend;

    @BeforeEach
    void setUp() {
        backend = new CpuBackend();
    }

    @Test
    void backendProperties() {
        assertEquals("cpu", backend.name());
        assertTrue(backend.supports(Operation.EINSUMSVD));
        assertFalse(backend.supports(Operation.EINSVD_RAND));
        assertEquals(1, backend.nproc());
        assertEquals(0, backend.rank());
    }

    @Nested
    @DisplayName("einsum")
    class Contraction {

        private final Tensor a = Tensor.fromArray(new double[]{1, 2, 3, 4}, 2, 2);
        private final Tensor b = Tensor.fromArray(new double[]{5, 6, 7, 8}, 2, 2);

        @Test
        void matmul() {
            Tensor c = backend.einsum("ij,jk->ik", a, b);
            TensorAssert.assertEquals(Tensor.fromArray(new double[]{19, 22, 43, 50}, 2, 2), c, EXACT);
        }

        @Test
        void traceIsRankZero() {
            Tensor t = backend.einsum("ii->", a);
            assertEquals(0, t.rank());
            assertEquals(5.0, t.item());
        }

        @Test
        void diagonalRead() {
            assertArrayEquals(new double[]{1, 4}, backend.einsum("ii->i", a).toArray());
        }

        @Test
        void diagonalWrite() {
            Tensor d = backend.einsum("i->ii", Tensor.fromArray(new double[]{1, 2}, 2));
            assertArrayEquals(new double[]{1, 0, 0, 2}, d.toArray());
        }

        @Test
        void transpose() {
            Tensor t = backend.einsum("ij->ji", Tensor.fromArray(new double[]{1, 2, 3, 4, 5, 6}, 2, 3));
            assertArrayEquals(new int[]{3, 2}, t.shape());
            assertArrayEquals(new double[]{1, 4, 2, 5, 3, 6}, t.toArray());
        }

        @Test
        void outerProduct() {
            Tensor o = backend.einsum("i,j->ij",
                Tensor.fromArray(new double[]{1, 2}, 2), Tensor.fromArray(new double[]{3, 4, 5}, 3));
            assertArrayEquals(new double[]{3, 4, 5, 6, 8, 10}, o.toArray());
        }

        @Test
        void fullSum() {
            assertEquals(10.0, backend.einsum("ij->", a).item());
        }

        @Test
        void scalarOperand() {
            Tensor scaled = backend.einsum("i,->i", Tensor.fromArray(new double[]{1, 2}, 2), Tensor.scalar(3));
            assertArrayEquals(new double[]{3, 6}, scaled.toArray());
        }

        @Test
        void batchedThroughEllipsis() {
            Tensor batch = Tensor.fromArray(new double[]{1, 2, 3, 4, 5, 6, 7, 8}, 2, 2, 2);
            Tensor scale = Tensor.fromArray(new double[]{1, 0, 0, 2}, 2, 2);

            Tensor c = backend.einsum("...ij,jk->...ik", batch, scale);
            assertArrayEquals(new int[]{2, 2, 2}, c.shape());
            assertArrayEquals(new double[]{1, 4, 3, 8, 5, 12, 7, 16}, c.toArray());
        }

        @Test
        void fusedOutputIsReshaped() {
            Tensor c = backend.einsum("ij,jk->(ik)", a, b);
            assertArrayEquals(new int[]{4}, c.shape());
            assertArrayEquals(new double[]{19, 22, 43, 50}, c.toArray());
        }

        @Test
        void fusedEllipsisKeepsElementOrder() {
            Tensor x = Tensor.random(3, 2, 3, 4);
            Tensor fused = backend.einsum("...k->(...)k", x);
            assertArrayEquals(new int[]{6, 4}, fused.shape());
            assertArrayEquals(x.toArray(), fused.toArray());
        }

        @Test
        void extentMismatchIsRejected() {
            assertThrows(IllegalArgumentException.class,
                () -> backend.einsum("ij,jk->ik", Tensor.zeros(2, 3), Tensor.zeros(4, 2)));
        }

        @Test
        void emptyContractionYieldsZeros() {
            Tensor empty = backend.einsum("ij,jk->ik", Tensor.zeros(2, 0), Tensor.zeros(0, 3));
            assertArrayEquals(new double[6], empty.toArray());
        }
    }

    @Nested
    @DisplayName("einsvd")
    class Decomposition {

        @ParameterizedTest(name = "{0}x{1}")
        @CsvSource({"4, 3", "3, 5", "1, 1", "6, 6"})
        void reconstructsTheMatrix(int m, int n) {
            Tensor x = Tensor.random(m * 31L + n, m, n);
            Factorization f = backend.einsvd("ij->ia,ja", x);

            assertEquals(Math.min(m, n), f.k());
            assertArrayEquals(new int[]{m, f.k()}, f.u().shape());
            assertArrayEquals(new int[]{n, f.k()}, f.v().shape());
            TensorAssert.assertEquals(x, backend.einsum("ia,a,ja->ij", f.u(), f.s(), f.v()), SVD_TOL);
            assertDescending(f.s());
        }

        @Test
        void leftFactorHasOrthonormalColumns() {
            Factorization f = backend.einsvd("ij->ia,ja", Tensor.random(11, 5, 3));
            Tensor gram = backend.einsum("ia,ib->ab", f.u(), f.u());
            TensorAssert.assertEquals(Tensor.identity(3), gram, SVD_TOL);
        }

        @Test
        void higherOrderTensorSplitsAlongOutputTerms() {
            Tensor x = Tensor.random(5, 2, 3, 4);
            Factorization f = backend.einsvd("ijk->ia,ajk", x);

            assertArrayEquals(new int[]{2, 2}, f.u().shape());
            assertArrayEquals(new int[]{2, 3, 4}, f.v().shape());
            TensorAssert.assertEquals(x, backend.einsum("ia,a,ajk->ijk", f.u(), f.s(), f.v()), SVD_TOL);
        }

        @Test
        void rowsFollowTheFirstOutputTerm() {
            Tensor x = Tensor.random(9, 2, 3, 4);
            Factorization f = backend.einsvd("ijk->kia,aj", x);

            assertArrayEquals(new int[]{4, 2, 3}, f.u().shape());
            assertArrayEquals(new int[]{3, 3}, f.v().shape());
            TensorAssert.assertEquals(x, backend.einsum("kia,a,aj->ijk", f.u(), f.s(), f.v()), SVD_TOL);
        }

        @Test
        void fusedFactorsAreReshaped() {
            Factorization f = backend.einsvd("ijk->(ij)a,ak", Tensor.random(2, 2, 3, 4));
            assertArrayEquals(new int[]{6, 4}, f.u().shape());
            assertArrayEquals(new int[]{4, 4}, f.v().shape());
        }

        @Test
        void truncationKeepsLargestSingularValues() {
            Tensor x = Tensor.random(17, 5, 4);
            Factorization full = backend.einsvd("ij->ia,ja", x);
            Factorization truncated = backend.einsvd("ij->ia,ja", x, 2);

            assertEquals(2, truncated.k());
            assertArrayEquals(new int[]{5, 2}, truncated.u().shape());
            assertEquals(full.s().getFlat(0), truncated.s().getFlat(0), 1e-12);
            assertEquals(full.s().getFlat(1), truncated.s().getFlat(1), 1e-12);
        }

        @Test
        void rankOneMatrixIsExactAfterTruncation() {
            Tensor x = backend.einsum("i,j->ij",
                Tensor.fromArray(new double[]{1, 2, 3}, 3), Tensor.fromArray(new double[]{4, 5}, 2));
            Factorization f = backend.einsvd("ij->ia,ja", x, 1);

            assertEquals(Math.sqrt(14) * Math.sqrt(41), f.s().item(), 1e-10);
            TensorAssert.assertEquals(x, backend.einsum("ia,a,ja->ij", f.u(), f.s(), f.v()), SVD_TOL);
        }

        @Test
        void rankAboveMinimumKeepsAll() {
            assertEquals(3, backend.einsvd("ij->ia,ja", Tensor.random(4, 4, 3), 10).k());
        }
    }

    @Nested
    @DisplayName("einsumsvd")
    class Fused {

        @Test
        void matchesContractionThenDecomposition() {
            Tensor a = Tensor.random(21, 3, 4);
            Tensor b = Tensor.random(22, 4, 5);

            Factorization fused = backend.einsumsvd("ij,jk->ia,ka", a, b);
            Factorization stepwise = backend.einsvd("ik->ia,ka", backend.einsum("ij,jk->ik", a, b));

            TensorAssert.assertEquals(stepwise.s(), fused.s(), SVD_TOL);
            TensorAssert.assertEquals(
                backend.einsum("ia,a,ka->ik", stepwise.u(), stepwise.s(), stepwise.v()),
                backend.einsum("ia,a,ka->ik", fused.u(), fused.s(), fused.v()),
                SVD_TOL);
        }

        @Test
        void rankIsApplied() {
            Factorization f = backend.einsumsvd("ij,jk->ia,ka", 1, Tensor.random(1, 3, 3), Tensor.random(2, 3, 3));
            assertEquals(1, f.k());
            assertArrayEquals(new int[]{3, 1}, f.v().shape());
        }

        @Test
        void fusingIsDeferredToTheFactors() {
            Factorization f = backend.einsumsvd("ijk,kl->(ij)a,al", Tensor.random(3, 2, 3, 4), Tensor.random(4, 4, 5));
            assertArrayEquals(new int[]{6, 5}, f.u().shape());
            assertArrayEquals(new int[]{5, 5}, f.v().shape());
        }
    }

    @Nested
    @DisplayName("Matrix operations")
    class MatrixOperations {

        @Test
        void svdReturnsRightSingularVectorsAsRows() {
            Tensor x = Tensor.random(31, 3, 2);
            Factorization f = backend.svd(x);

            assertArrayEquals(new int[]{3, 2}, f.u().shape());
            assertArrayEquals(new int[]{2, 2}, f.v().shape());
            TensorAssert.assertEquals(x, backend.einsum("ia,a,aj->ij", f.u(), f.s(), f.v()), SVD_TOL);
        }

        @Test
        void invOfKnownMatrix() {
            Tensor x = Tensor.fromArray(new double[]{4, 7, 2, 6}, 2, 2);
            TensorAssert.assertEquals(Tensor.fromArray(new double[]{0.6, -0.7, -0.2, 0.4}, 2, 2),
                backend.inv(x), ToleranceConfig.forOp(Operation.INV));
        }

        @Test
        void invTimesMatrixIsIdentity() {
            Tensor x = Tensor.random(41, 4, 4);
            Tensor product = backend.einsum("ij,jk->ik", backend.inv(x), x);
            assertTrue(backend.allClose(product, Tensor.identity(4), new ToleranceConfig(1e-9, 1e-9)));
        }

        @Test
        void invOfZeroMatrixIsRejected() {
            assertThrows(IllegalArgumentException.class, () -> backend.inv(Tensor.zeros(2, 2)));
        }
    }

    @Nested
    @DisplayName("execute")
    class Execute {

        @Test
        void randomizedSvdIsUnsupported() {
            OpResult result = backend.execute(
                OpRequest.einsvdRand("ij->ia,ja", Tensor.random(1, 4, 4), 2, RandomizedSvdOptions.defaults()));
            assertInstanceOf(OpResult.Unsupported.class, result);
            assertThrows(UnsupportedOperationException.class,
                () -> backend.einsvdRand("ij->ia,ja", Tensor.random(1, 4, 4), 2, RandomizedSvdOptions.defaults()));
        }

        @Test
        void einsvdYieldsTriple() {
            OpResult result = backend.execute(OpRequest.einsvd("ij->ia,ja", Tensor.random(1, 3, 3)));
            assertEquals(3, assertInstanceOf(OpResult.Tuple.class, result).tensors().size());
        }

        @Test
        void copyYieldsSequence() {
            OpResult result = backend.execute(OpRequest.copy(Tensor.zeros(2), Tensor.zeros(3), Tensor.zeros(4)));
            assertEquals(3, assertInstanceOf(OpResult.Sequence.class, result).tensors().size());
        }

        @Test
        void isCloseYieldsSingleMask() {
            Tensor a = Tensor.fromArray(new double[]{1, 2}, 2);
            Tensor b = Tensor.fromArray(new double[]{1, 5}, 2);
            OpResult result = backend.execute(OpRequest.isClose(a, b, null));
            assertArrayEquals(new double[]{1, 0}, result.single().toArray());
        }
    }

    @Nested
    @DisplayName("Lifecycle and configuration")
    class Lifecycle {

        @AfterEach
        void tearDown() {
            BackendRegistry.clear();
        }

        @Test
        void registerMakesTheBackendDiscoverable() {
            CpuBackend.register();
            assertInstanceOf(CpuBackend.class, BackendRegistry.get("CPU"));
            assertEquals(List.of("cpu"), BackendRegistry.available());
        }

        @Test
        void closedBackendRejectsCalls() {
            backend.close();
            assertThrows(IllegalStateException.class, () -> backend.einsum("i->i", Tensor.zeros(1)));
        }

        @Test
        void broadcastPolicyComesFromOptions() {
            CpuBackend strict = new CpuBackend(
                EinstrOptions.builder().broadcastPolicy(BroadcastPolicy.EQUAL_RUNS).build());
            Tensor x = Tensor.zeros(2, 3);
            Tensor y = Tensor.zeros(4, 2, 3);

            assertThrows(ArityException.class, () -> strict.einsum("...i,...i->...i", x, y));
            assertArrayEquals(new int[]{4, 2, 3}, backend.einsum("...i,...i->...i", x, y).shape());
        }
    }

    private static void assertDescending(Tensor s) {
        for (int i = 1; i < s.elementCount(); i++) {
            assertTrue(s.getFlat(i - 1) >= s.getFlat(i), "singular values must be descending");
        }
    }
}
