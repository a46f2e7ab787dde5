package org.javai.symbolic.expr;

import java.util.List;

/**
 * Bitwise or, {@code a | b | ...}.
 */
@ExpressionKind("bitwise_or")
public final class BitwiseOr extends MultiChildExpression {

	public BitwiseOr(List<?> children) {
		super(children);
	}
}
