package org.javai.symbolic.expr;

import java.util.List;

/**
 * Logical disjunction, {@code a or b or ...}.
 */
@ExpressionKind("logical_or")
public final class LogicalOr extends MultiChildExpression {

	public LogicalOr(List<?> children) {
		super(children);
	}
}
