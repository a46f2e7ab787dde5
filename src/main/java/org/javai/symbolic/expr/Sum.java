package org.javai.symbolic.expr;

import java.util.List;

/**
 * A sum of its children, {@code a + b + ...}.
 */
@ExpressionKind("sum")
public final class Sum extends MultiChildExpression {

	public Sum(List<?> children) {
		super(children);
	}
}
