package io.surfworks.tensorforge.einstr;

/**
 * Structural rule set of one operation family, applied to a matched expression.
 */
public interface ExpressionValidator {

    OperationFamily family();

    /**
     * Checks the family's rules.
     *
     * @param expr a matched expression
     * @throws ValidationException on the first violated rule
     * @throws IllegalArgumentException if {@code expr} still contains an ellipsis
     */
    void validate(Expression expr);

    default ValidationException violation(ValidationException.Rule rule, String message, Expression expr) {
        return new ValidationException(family(), rule, message, expr.source());
    }

    static void requireMatched(Expression expr) {
        if (!expr.isMatched()) {
            throw new IllegalArgumentException("Expression must be matched before validation: " + expr);
        }
    }
}
