package org.javai.symbolic.expr;

import java.util.List;

/**
 * An unevaluated derivative of {@code child} with respect to {@code variables}, in order.
 */
@ExpressionKind("derivative")
public final class Derivative extends Expression {

	private final Object child;
	private final List<String> variables;

	public Derivative(Object child, List<String> variables) {
		this.child = requireOperand(child, "Derivative", "child");
		if (variables == null || variables.isEmpty()) {
			throw new MalformedExpressionException("Derivative requires at least one variable");
		}
		for (String name : variables) {
			requireName(name, "Derivative", "variable name");
		}
		this.variables = List.copyOf(variables);
	}

	public Object child() {
		return child;
	}

	public List<String> variables() {
		return variables;
	}

	@Override
	public List<Object> children() {
		return childList(child, variables);
	}
}
