package io.surfworks.tensorforge.core.testing;

import io.surfworks.tensorforge.core.backend.Operation;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ToleranceConfigTest {

    @Nested
    @DisplayName("isClose")
    class IsCloseTests {

        @Test
        void exactMatch() {
            ToleranceConfig tol = ToleranceConfig.STRICT;
            assertTrue(tol.isClose(1.0, 1.0));
            assertTrue(tol.isClose(-5.5, -5.5));
            assertFalse(tol.isClose(1.0, Math.nextUp(1.0)));
        }

        @Test
        void withinAbsoluteTolerance() {
            ToleranceConfig tol = new ToleranceConfig(1e-5, 0);
            assertTrue(tol.isClose(1.0, 1.000005));
            assertTrue(tol.isClose(1.0, 0.999995));
            assertFalse(tol.isClose(1.0, 1.00002));
        }

        @Test
        void relativeTermScalesWithReference() {
            ToleranceConfig tol = new ToleranceConfig(0, 1e-3);
            assertTrue(tol.isClose(1000.0, 1000.5));
            // 1e-3 * 1.0 is too small for a difference of 0.5
            assertFalse(tol.isClose(1.0, 1.5));
            assertTrue(tol.isClose(1000.0, 999.5));
        }

        @Test
        void defaultIsRelativeOneBillionth() {
            ToleranceConfig tol = ToleranceConfig.DEFAULT;
            assertEquals(0.0, tol.atol());
            assertEquals(1e-9, tol.rtol());
            assertTrue(tol.isClose(1.0, 1.0 + 1e-10));
            assertFalse(tol.isClose(1.0, 1.0 + 1e-8));
            assertFalse(tol.isClose(0.0, 1e-300));
        }

        @Test
        void nanValues() {
            ToleranceConfig tol = new ToleranceConfig(1e-5, 1e-5);
            assertTrue(tol.isClose(Double.NaN, Double.NaN));
            assertFalse(tol.isClose(Double.NaN, 1.0));
            assertFalse(tol.isClose(1.0, Double.NaN));
        }

        @Test
        void infinityValues() {
            ToleranceConfig tol = new ToleranceConfig(1e-5, 1e-5);
            assertTrue(tol.isClose(Double.POSITIVE_INFINITY, Double.POSITIVE_INFINITY));
            assertFalse(tol.isClose(Double.POSITIVE_INFINITY, Double.NEGATIVE_INFINITY));
            assertFalse(tol.isClose(Double.POSITIVE_INFINITY, 1e308));
        }
    }

    @Nested
    @DisplayName("Defaults and combinators")
    class Defaults {

        @Test
        void forOpUsesOperationTable() {
            assertEquals(new ToleranceConfig(1e-12, 1e-10), ToleranceConfig.forOp(Operation.EINSUM));
            assertEquals(ToleranceConfig.STRICT, ToleranceConfig.forOp(Operation.COPY));
            assertEquals(ToleranceConfig.DEFAULT, ToleranceConfig.forOp(Operation.ALLCLOSE));
        }

        @Test
        void scaledAndOr() {
            ToleranceConfig tol = new ToleranceConfig(1e-6, 1e-4).scaled(10);
            assertEquals(1e-5, tol.atol(), 1e-18);
            assertEquals(1e-3, tol.rtol(), 1e-15);

            ToleranceConfig combined = new ToleranceConfig(1e-3, 0).or(new ToleranceConfig(0, 1e-2));
            assertEquals(1e-3, combined.atol());
            assertEquals(1e-2, combined.rtol());
        }

        @Test
        void negativeToleranceIsRejected() {
            assertThrows(IllegalArgumentException.class, () -> new ToleranceConfig(-1, 0));
        }
    }
}
