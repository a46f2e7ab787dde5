package org.javai.symbolic.expr;

/**
 * Logical negation, {@code not child}.
 */
@ExpressionKind("logical_not")
public final class LogicalNot extends UnaryExpression {

	public LogicalNot(Object child) {
		super(child);
	}
}
