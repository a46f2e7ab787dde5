package org.javai.symbolic.expr;

/**
 * Bitwise complement, {@code ~child}.
 */
@ExpressionKind("bitwise_not")
public final class BitwiseNot extends UnaryExpression {

	public BitwiseNot(Object child) {
		super(child);
	}
}
