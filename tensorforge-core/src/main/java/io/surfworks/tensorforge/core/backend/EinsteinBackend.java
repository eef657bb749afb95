package io.surfworks.tensorforge.core.backend;

import io.surfworks.tensorforge.core.tensor.Tensor;
import io.surfworks.tensorforge.core.testing.ToleranceConfig;
import io.surfworks.tensorforge.einstr.Einstr;
import io.surfworks.tensorforge.einstr.EinstrOptions;
import io.surfworks.tensorforge.einstr.Expression;
import io.surfworks.tensorforge.einstr.ExpressionMatcher;
import io.surfworks.tensorforge.einstr.OperationFamily;
import io.surfworks.tensorforge.einstr.OutputTerm;
import io.surfworks.tensorforge.einstr.SplitExpression;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * Base class for backends that evaluate subscripts with a contraction kernel and a
 * decomposition kernel.
 *
 * <p>This class owns the parse, match and validate flow, the reshape through fusing groups,
 * the split of fused operations, and the operations built from the two kernels
 * ({@code svd}, {@code inv}). Subclasses only see matched, validated expressions whose
 * terms carry no ellipsis.
 */
public abstract class EinsteinBackend implements Backend {

    private static final Logger LOG = Logger.getLogger(EinsteinBackend.class.getName());

    private static final String MATRIX_SVD = "ij->ia,aj";
    private static final String INV_DECOMPOSE = "ij->ia,ja";
    private static final String INV_RECOMPOSE = "ia,a,ja->ji";

    private final EinstrOptions options;
    private volatile boolean closed = false;

    protected EinsteinBackend() {
        this(EinstrOptions.defaults());
    }

    protected EinsteinBackend(EinstrOptions options) {
        this.options = Objects.requireNonNull(options, "options cannot be null");
    }

    public EinstrOptions options() {
        return options;
    }

    // ==================== Kernels ====================

    /**
     * Evaluate a matched contraction.
     *
     * @param expr     one output term, no ellipsis
     * @param operands one tensor per input term, ranks equal to the term sizes
     * @return tensor whose axes follow the output term's indices
     */
    protected abstract Tensor contract(Expression expr, List<Tensor> operands);

    /**
     * Evaluate a matched decomposition of one tensor.
     *
     * @param rank singular values to keep, {@link OpRequest#FULL_RANK} for all
     * @return factors whose axes follow the output terms' indices
     */
    protected abstract Factorization decompose(Expression expr, Tensor a, int rank);

    /**
     * Randomized decomposition. Backends that advertise the {@code _RAND} operations override this.
     */
    protected Factorization decomposeRandomized(Expression expr, Tensor a, int rank,
                                                RandomizedSvdOptions randomized) {
        throw unsupported(Operation.EINSVD_RAND);
    }

    // ==================== Dispatch ====================

    @Override
    public OpResult execute(OpRequest request) {
        checkNotClosed();
        Operation op = request.operation();
        if (!supports(op)) {
            LOG.fine(() -> name() + " does not support " + op.label());
            return new OpResult.Unsupported(op, name());
        }
        return switch (op) {
            case EINSUM -> new OpResult.Single(einsum(request.subscripts(), request.operandArray()));
            case EINSVD -> tuple(einsvd(request.subscripts(), single(request), request.rank()));
            case EINSVD_RAND -> tuple(einsvdRand(request.subscripts(), single(request),
                request.rank(), request.randomized()));
            case EINSUMSVD -> tuple(einsumsvd(request.subscripts(), request.rank(), request.operandArray()));
            case EINSUMSVD_RAND -> tuple(einsumsvdRand(request.subscripts(), request.rank(),
                request.randomized(), request.operandArray()));
            case SVD -> tuple(svd(single(request)));
            case INV -> new OpResult.Single(inv(single(request)));
            case ISCLOSE -> new OpResult.Single(isClose(pairFirst(request), request.operand(1), request.tolerance()));
            case ALLCLOSE -> new OpResult.Flag(allClose(pairFirst(request), request.operand(1), request.tolerance()));
            case COPY -> new OpResult.Sequence(copy(request.operandArray()));
        };
    }

    // ==================== Typed Operations ====================

    @Override
    public Tensor einsum(String subscripts, Tensor... operands) {
        require(Operation.EINSUM);
        Expression expr = prepare(OperationFamily.EINSUM, subscripts, operands);
        return contractAndReshape(expr, List.of(operands));
    }

    @Override
    public Factorization einsvd(String subscripts, Tensor a, int rank) {
        require(Operation.EINSVD);
        checkRank(rank);
        Expression expr = prepare(OperationFamily.EINSVD, subscripts, a);
        return decomposeAndReshape(expr, a, rank);
    }

    @Override
    public Factorization einsvdRand(String subscripts, Tensor a, int rank, RandomizedSvdOptions randomized) {
        require(Operation.EINSVD_RAND);
        checkExplicitRank(rank);
        Expression expr = prepare(OperationFamily.EINSVD, subscripts, a);
        return reshapeFactors(expr, decomposeRandomized(expr, a, rank, randomized));
    }

    @Override
    public Factorization einsumsvd(String subscripts, int rank, Tensor... operands) {
        require(Operation.EINSUMSVD);
        checkRank(rank);
        SplitExpression split = prepareSplit(subscripts, operands);
        Tensor intermediate = contractAndReshape(split.contraction(), List.of(operands));
        return decomposeAndReshape(split.decomposition(), intermediate, rank);
    }

    @Override
    public Factorization einsumsvdRand(String subscripts, int rank, RandomizedSvdOptions randomized,
                                       Tensor... operands) {
        require(Operation.EINSUMSVD_RAND);
        checkExplicitRank(rank);
        SplitExpression split = prepareSplit(subscripts, operands);
        Tensor intermediate = contractAndReshape(split.contraction(), List.of(operands));
        Expression decomposition = split.decomposition();
        return reshapeFactors(decomposition, decomposeRandomized(decomposition, intermediate, rank, randomized));
    }

    @Override
    public Factorization svd(Tensor a) {
        require(Operation.SVD);
        requireMatrix("svd", a);
        Expression expr = prepare(OperationFamily.EINSVD, MATRIX_SVD, a);
        return decompose(expr, a, OpRequest.FULL_RANK);
    }

    @Override
    public Tensor inv(Tensor a) {
        require(Operation.INV);
        requireMatrix("inv", a);
        if (a.dim(0) != a.dim(1)) {
            throw new IllegalArgumentException("inv requires a square matrix, got " + Arrays.toString(a.shape()));
        }
        Factorization f = decomposeAndReshape(prepare(OperationFamily.EINSVD, INV_DECOMPOSE, a), a, OpRequest.FULL_RANK);
        Tensor reciprocal = Tensor.zeros(f.k());
        for (int i = 0; i < f.k(); i++) {
            double s = f.s().getFlat(i);
            if (s == 0.0) {
                throw new IllegalArgumentException("inv requires a non-singular matrix");
            }
            reciprocal.setFlat(i, 1.0 / s);
        }
        Tensor[] operands = {f.u(), reciprocal, f.v()};
        return contractAndReshape(prepare(OperationFamily.EINSUM, INV_RECOMPOSE, operands), List.of(operands));
    }

    @Override
    public Tensor isClose(Tensor a, Tensor b, ToleranceConfig tolerance) {
        require(Operation.ISCLOSE);
        return compare(a, b, tolerance);
    }

    @Override
    public boolean allClose(Tensor a, Tensor b, ToleranceConfig tolerance) {
        require(Operation.ALLCLOSE);
        Tensor close = compare(a, b, tolerance);
        for (int i = 0; i < close.elementCount(); i++) {
            if (close.getFlat(i) == 0.0) {
                return false;
            }
        }
        return true;
    }

    @Override
    public List<Tensor> copy(Tensor... operands) {
        require(Operation.COPY);
        checkNotNull(operands);
        List<Tensor> copies = new ArrayList<>(operands.length);
        for (Tensor t : operands) {
            copies.add(t.copy());
        }
        return copies;
    }

    @Override
    public void close() {
        closed = true;
    }

    protected void checkNotClosed() {
        if (closed) {
            throw new IllegalStateException("Backend has been closed");
        }
    }

    // ==================== Internal Helpers ====================

    private Expression prepare(OperationFamily family, String subscripts, Tensor... operands) {
        checkNotNull(operands);
        Expression parsed = Einstr.parse(subscripts, options);
        if (parsed.inputs().size() != operands.length) {
            throw new IllegalArgumentException(String.format(
                "%s \"%s\" expects %d operand(s), got %d",
                family.label(), subscripts, parsed.inputs().size(), operands.length));
        }
        int[] ranks = new int[operands.length];
        for (int i = 0; i < operands.length; i++) {
            ranks[i] = operands[i].rank();
            checkLimits(operands[i]);
        }
        Expression expr = new ExpressionMatcher(options).match(parsed, ranks);
        family.validator().validate(expr);
        return expr;
    }

    private SplitExpression prepareSplit(String subscripts, Tensor... operands) {
        Expression expr = prepare(OperationFamily.EINSUMSVD, subscripts, operands);
        return Einstr.splitEinsumsvd(expr);
    }

    private Tensor contractAndReshape(Expression expr, List<Tensor> operands) {
        LOG.fine(() -> name() + " contract " + expr.indicesString());
        Tensor result = contract(expr, operands);
        return result.reshape(expr.outputs().get(0).newShape(result.shape()));
    }

    private Factorization decomposeAndReshape(Expression expr, Tensor a, int rank) {
        LOG.fine(() -> name() + " decompose " + expr.indicesString() + " rank " + rank);
        return reshapeFactors(expr, decompose(expr, a, rank));
    }

    private static Factorization reshapeFactors(Expression expr, Factorization f) {
        OutputTerm first = expr.outputs().get(0);
        OutputTerm second = expr.outputs().get(1);
        return new Factorization(
            f.u().reshape(first.newShape(f.u().shape())),
            f.s(),
            f.v().reshape(second.newShape(f.v().shape())));
    }

    /**
     * Elementwise closeness; {@code b} may be a rank-0 tensor broadcast against {@code a}.
     */
    private static Tensor compare(Tensor a, Tensor b, ToleranceConfig tolerance) {
        Objects.requireNonNull(a, "a cannot be null");
        Objects.requireNonNull(b, "b cannot be null");
        Objects.requireNonNull(tolerance, "tolerance cannot be null");
        boolean broadcast = b.rank() == 0;
        if (!broadcast && !a.spec().shapeEquals(b.spec())) {
            throw new IllegalArgumentException("Cannot compare shapes " + Arrays.toString(a.shape())
                + " and " + Arrays.toString(b.shape()));
        }
        Tensor result = Tensor.zeros(a.shape());
        for (int i = 0; i < a.elementCount(); i++) {
            double reference = broadcast ? b.item() : b.getFlat(i);
            result.setFlat(i, tolerance.isClose(reference, a.getFlat(i)) ? 1.0 : 0.0);
        }
        return result;
    }

    private void checkLimits(Tensor t) {
        BackendCapabilities caps = capabilities();
        if (t.rank() > caps.maxTensorRank()) {
            throw new IllegalArgumentException(
                name() + " supports tensors up to rank " + caps.maxTensorRank() + ", got " + t.rank());
        }
        if (t.elementCount() > caps.maxElementCount()) {
            throw new IllegalArgumentException(
                name() + " supports up to " + caps.maxElementCount() + " elements, got " + t.elementCount());
        }
    }

    private void require(Operation op) {
        checkNotClosed();
        if (!supports(op)) {
            throw unsupported(op);
        }
    }

    private UnsupportedOperationException unsupported(Operation op) {
        return new UnsupportedOperationException("Backend '" + name() + "' does not support " + op.label());
    }

    private static void requireMatrix(String what, Tensor a) {
        Objects.requireNonNull(a, "operand cannot be null");
        if (a.rank() != 2) {
            throw new IllegalArgumentException(what + " requires a matrix, got rank " + a.rank());
        }
    }

    private static void checkRank(int rank) {
        if (rank < 0) {
            throw new IllegalArgumentException("rank must be non-negative, got " + rank);
        }
    }

    private static void checkExplicitRank(int rank) {
        if (rank <= 0) {
            throw new IllegalArgumentException("randomized decomposition requires a positive rank, got " + rank);
        }
    }

    private static void checkNotNull(Tensor[] operands) {
        Objects.requireNonNull(operands, "operands cannot be null");
        for (int i = 0; i < operands.length; i++) {
            Objects.requireNonNull(operands[i], "operand " + i + " cannot be null");
        }
    }

    private static Tensor single(OpRequest request) {
        if (request.operands().size() != 1) {
            throw new IllegalArgumentException(request.operation().label() + " takes one operand, got "
                + request.operands().size());
        }
        return request.operand(0);
    }

    private static Tensor pairFirst(OpRequest request) {
        if (request.operands().size() != 2) {
            throw new IllegalArgumentException(request.operation().label() + " takes two operands, got "
                + request.operands().size());
        }
        return request.operand(0);
    }

    private static OpResult tuple(Factorization f) {
        return new OpResult.Tuple(f.toList());
    }
}
