package org.javai.symbolic.expr;

import java.util.List;

/**
 * Bitwise and, {@code a & b & ...}.
 */
@ExpressionKind("bitwise_and")
public final class BitwiseAnd extends MultiChildExpression {

	public BitwiseAnd(List<?> children) {
		super(children);
	}
}
