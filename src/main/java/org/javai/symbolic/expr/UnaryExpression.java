package org.javai.symbolic.expr;

import java.util.List;

/**
 * Base for operators with a single operand.
 */
public abstract class UnaryExpression extends Expression {

	private final Object child;

	protected UnaryExpression(Object child) {
		this.child = requireOperand(child, getClass().getSimpleName(), "child");
	}

	public Object child() {
		return child;
	}

	@Override
	public List<Object> children() {
		return childList(child);
	}
}
