package io.surfworks.tensorforge.einstr;

/**
 * Entry points for parsing, matching and validating subscripts of each operation family.
 *
 * <p>Every call builds its own symbol table and terms, so the methods are safe to call
 * from any number of threads.
 *
 * <p>Example:
 * <pre>{@code
 * Expression expr = Einstr.parseEinsumsvd("ij,jk->ia,ka", 2, 2);
 * SplitExpression split = Einstr.splitEinsumsvd(expr);
 * backend.contract(split.contraction(), operands);
 * }</pre>
 */
public final class Einstr {

    private Einstr() {} // Utility class

    public static Expression parse(String subscripts) {
        return EinstrParser.parse(subscripts);
    }

    public static Expression parse(String subscripts, EinstrOptions options) {
        return EinstrParser.parse(subscripts, options);
    }

    /**
     * Parses, matches and validates subscripts for the given family.
     */
    public static Expression parse(OperationFamily family, String subscripts, EinstrOptions options, int... ranks) {
        Expression expr = new ExpressionMatcher(options).match(EinstrParser.parse(subscripts, options), ranks);
        family.validator().validate(expr);
        return expr;
    }

    public static Expression parseEinsum(String subscripts, int... ranks) {
        return parse(OperationFamily.EINSUM, subscripts, EinstrOptions.defaults(), ranks);
    }

    public static Expression parseEinsum(String subscripts, EinstrOptions options, int... ranks) {
        return parse(OperationFamily.EINSUM, subscripts, options, ranks);
    }

    public static Expression parseEinsvd(String subscripts, int rank) {
        return parse(OperationFamily.EINSVD, subscripts, EinstrOptions.defaults(), rank);
    }

    public static Expression parseEinsvd(String subscripts, EinstrOptions options, int rank) {
        return parse(OperationFamily.EINSVD, subscripts, options, rank);
    }

    public static Expression parseEinsumsvd(String subscripts, int... ranks) {
        return parse(OperationFamily.EINSUMSVD, subscripts, EinstrOptions.defaults(), ranks);
    }

    public static Expression parseEinsumsvd(String subscripts, EinstrOptions options, int... ranks) {
        return parse(OperationFamily.EINSUMSVD, subscripts, options, ranks);
    }

    public static SplitExpression splitEinsumsvd(Expression expr) {
        return EinsumsvdSplitter.split(expr);
    }
}
