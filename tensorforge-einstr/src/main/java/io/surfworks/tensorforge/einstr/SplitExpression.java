package io.surfworks.tensorforge.einstr;

/**
 * The two primitive halves of a fused expression.
 *
 * <p>{@code contraction} must run first; its single result is the operand of
 * {@code decomposition}.
 *
 * @param contraction   original inputs, one output: the intermediate term
 * @param decomposition the intermediate term as sole input, the original two outputs
 * @param newIndex      id of the rank index shared by the two factors
 */
public record SplitExpression(Expression contraction, Expression decomposition, int newIndex) {
}
