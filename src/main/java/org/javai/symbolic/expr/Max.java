package org.javai.symbolic.expr;

import java.util.List;

/**
 * The largest of its children.
 */
@ExpressionKind("max")
public final class Max extends MultiChildExpression {

	public Max(List<?> children) {
		super(children);
	}
}
