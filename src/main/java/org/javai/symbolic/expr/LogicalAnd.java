package org.javai.symbolic.expr;

import java.util.List;

/**
 * Logical conjunction, {@code a and b and ...}.
 */
@ExpressionKind("logical_and")
public final class LogicalAnd extends MultiChildExpression {

	public LogicalAnd(List<?> children) {
		super(children);
	}
}
