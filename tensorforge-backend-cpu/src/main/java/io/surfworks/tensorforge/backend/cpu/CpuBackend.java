package io.surfworks.tensorforge.backend.cpu;

import io.surfworks.tensorforge.backend.cpu.ops.ContractionKernel;
import io.surfworks.tensorforge.backend.cpu.ops.DecompositionKernel;
import io.surfworks.tensorforge.core.backend.BackendCapabilities;
import io.surfworks.tensorforge.core.backend.BackendRegistry;
import io.surfworks.tensorforge.core.backend.EinsteinBackend;
import io.surfworks.tensorforge.core.backend.Factorization;
import io.surfworks.tensorforge.core.tensor.Tensor;
import io.surfworks.tensorforge.einstr.EinstrOptions;
import io.surfworks.tensorforge.einstr.Expression;

import java.util.List;

/**
 * In-process backend over dense row-major tensors.
 * Uses scalar loop kernels; randomized SVD is not available.
 */
public class CpuBackend extends EinsteinBackend {

    public static final String NAME = "cpu";

    private final ContractionKernel contraction = new ContractionKernel();
    private final DecompositionKernel decomposition = new DecompositionKernel();
    private final BackendCapabilities capabilities = BackendCapabilities.cpu();

    public CpuBackend() {
        super();
    }

    public CpuBackend(EinstrOptions options) {
        super(options);
    }

    /**
     * Registers this backend under {@value #NAME}.
     */
    public static void register() {
        BackendRegistry.register(NAME, CpuBackend::new);
    }

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public BackendCapabilities capabilities() {
        return capabilities;
    }

    @Override
    protected Tensor contract(Expression expr, List<Tensor> operands) {
        return contraction.contract(expr, operands);
    }

    @Override
    protected Factorization decompose(Expression expr, Tensor a, int rank) {
        return decomposition.decompose(expr, a, rank);
    }
}
