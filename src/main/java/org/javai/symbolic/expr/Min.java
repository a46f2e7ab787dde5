package org.javai.symbolic.expr;

import java.util.List;

/**
 * The smallest of its children.
 */
@ExpressionKind("min")
public final class Min extends MultiChildExpression {

	public Min(List<?> children) {
		super(children);
	}
}
