package org.javai.symbolic.expr;

import java.util.List;

/**
 * Base for n-ary operators whose operands form one ordered list.
 */
public abstract class MultiChildExpression extends Expression {

	private final List<Object> children;

	protected MultiChildExpression(List<?> children) {
		this.children = requireOperands(children, getClass().getSimpleName(), "children", 1);
	}

	@Override
	public List<Object> children() {
		return children;
	}
}
